package com.devexperts.dxlab.eqcheck.semantics;

/*
 * #%L
 * core
 * %%
 * Copyright (C) 2015 - 2018 Devexperts, LLC
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 * 
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * #L%
 */

import com.devexperts.dxlab.eqcheck.Transition;
import com.devexperts.dxlab.eqcheck.term.Choice;
import com.devexperts.dxlab.eqcheck.term.Parallel;
import com.devexperts.dxlab.eqcheck.term.Prefix;
import com.devexperts.dxlab.eqcheck.term.Recursive;
import com.devexperts.dxlab.eqcheck.term.Stop;
import com.devexperts.dxlab.eqcheck.term.TermKind;
import com.devexperts.dxlab.eqcheck.term.Var;

import java.util.Set;

/**
 * {@code P --a--> P'} implies {@code P + Q --a--> P'} for a visible {@code a}
 * and {@code P + Q --tau--> P' + Q} for the silent one (see {@link Choice#combine}), symmetrically for {@code Q}.
 */
public class ChoiceRule extends AbstractSosRule {
    public ChoiceRule() {
        super(TermKind.CHOICE);
    }

    @Override
    public Set<Transition> visitStop(Stop stop, SosEngine engine) {
        return NONE;
    }

    @Override
    public Set<Transition> visitVar(Var var, SosEngine engine) {
        return NONE;
    }

    @Override
    public Set<Transition> visitPrefix(Prefix prefix, SosEngine engine) {
        return NONE;
    }

    @Override
    public Set<Transition> visitChoice(Choice choice, SosEngine engine) {
        return choice.combine(engine.transitions(choice.getLeft()), engine.transitions(choice.getRight()));
    }

    @Override
    public Set<Transition> visitParallel(Parallel parallel, SosEngine engine) {
        return NONE;
    }

    @Override
    public Set<Transition> visitRecursive(Recursive recursive, SosEngine engine) {
        return NONE;
    }
}
