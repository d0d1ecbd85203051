package com.devexperts.dxlab.eqcheck.term;

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

import java.util.Collections;
import java.util.Set;

/**
 * The deadlocked process, it cannot perform any action.
 */
public final class Stop extends Term {
    public static final Stop INSTANCE = new Stop();

    static final String CANONICAL_FORM = "STOP";

    private Stop() {}

    @Override
    public TermKind getKind() {
        return TermKind.STOP;
    }

    @Override
    public <R, P> R accept(TermVisitor<R, P> visitor, P p) {
        return visitor.visitStop(this, p);
    }

    @Override
    public Term substitute(String variable, Term replacement) {
        return this;
    }

    @Override
    public Set<Transition> derive() {
        return Collections.emptySet();
    }

    @Override
    public Set<String> freeVariables() {
        return Collections.emptySet();
    }

    @Override
    boolean occursUnguarded(String variable) {
        return false;
    }

    @Override
    void appendCanonicalForm(StringBuilder sb) {
        sb.append(CANONICAL_FORM);
    }

    @Override
    boolean equalsSameKind(Term other) {
        return true;
    }

    @Override
    int computeHashCode() {
        return CANONICAL_FORM.hashCode();
    }
}
