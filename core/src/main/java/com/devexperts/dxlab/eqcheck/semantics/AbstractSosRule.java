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
import com.devexperts.dxlab.eqcheck.term.Term;
import com.devexperts.dxlab.eqcheck.term.TermKind;
import com.devexperts.dxlab.eqcheck.term.TermVisitor;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Base class for rules which are written as {@link TermVisitor visitors}: every rule states
 * what it derives for each term variant, and the ones it does not apply to derive {@link #NONE}.
 */
public abstract class AbstractSosRule implements SosRule, TermVisitor<Set<Transition>, SosEngine> {
    protected static final Set<Transition> NONE = Collections.emptySet();

    private final Set<TermKind> kinds;

    protected AbstractSosRule(TermKind kind, TermKind... otherKinds) {
        this.kinds = EnumSet.of(kind, otherKinds);
    }

    @Override
    public boolean appliesTo(Term term) {
        return kinds.contains(term.getKind());
    }

    @Override
    public Set<Transition> derive(Term term, SosEngine engine) {
        return term.accept(this, engine);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + kinds;
    }
}
