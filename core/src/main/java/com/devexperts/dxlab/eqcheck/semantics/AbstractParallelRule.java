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

import com.devexperts.dxlab.eqcheck.Action;
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
 * Base class for the model-specific rules of parallel composition.
 */
public abstract class AbstractParallelRule extends AbstractSosRule {
    protected AbstractParallelRule() {
        super(TermKind.PARALLEL);
    }

    /**
     * {@code P --a--> P'} implies {@code P | Q --a--> P' | Q}.
     */
    protected static void addLeftSteps(Parallel p, Set<Transition> leftSteps, Set<Transition> result) {
        for (Transition t : leftSteps)
            result.add(new Transition(p, t.getAction(), new Parallel(t.getTarget(), p.getRight())));
    }

    /**
     * {@code Q --a--> Q'} implies {@code P | Q --a--> P | Q'}.
     */
    protected static void addRightSteps(Parallel p, Set<Transition> rightSteps, Set<Transition> result) {
        for (Transition t : rightSteps)
            result.add(new Transition(p, t.getAction(), new Parallel(p.getLeft(), t.getTarget())));
    }

    /**
     * Returns the step on which both operands advance together.
     */
    protected static Transition synchronize(Parallel p, Transition left, Transition right, Action action) {
        return new Transition(p, action, new Parallel(left.getTarget(), right.getTarget()));
    }

    @Override
    public final Set<Transition> visitStop(Stop stop, SosEngine engine) {
        return NONE;
    }

    @Override
    public final Set<Transition> visitVar(Var var, SosEngine engine) {
        return NONE;
    }

    @Override
    public final Set<Transition> visitPrefix(Prefix prefix, SosEngine engine) {
        return NONE;
    }

    @Override
    public final Set<Transition> visitChoice(Choice choice, SosEngine engine) {
        return NONE;
    }

    @Override
    public final Set<Transition> visitRecursive(Recursive recursive, SosEngine engine) {
        return NONE;
    }
}
