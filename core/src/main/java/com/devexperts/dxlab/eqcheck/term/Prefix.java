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

import com.devexperts.dxlab.eqcheck.Action;
import com.devexperts.dxlab.eqcheck.Transition;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;

/**
 * Performs {@link #getAction() the action} and then behaves as {@link #getContinuation() the continuation}.
 */
public final class Prefix extends Term {
    private final Action action;
    private final Term continuation;

    public Prefix(Action action, Term continuation) {
        this.action = Objects.requireNonNull(action, "action");
        this.continuation = Objects.requireNonNull(continuation, "continuation");
    }

    public Action getAction() {
        return action;
    }

    public Term getContinuation() {
        return continuation;
    }

    /**
     * Returns the only transition of this term.
     */
    public Transition step() {
        return new Transition(this, action, continuation);
    }

    @Override
    public TermKind getKind() {
        return TermKind.PREFIX;
    }

    @Override
    public <R, P> R accept(TermVisitor<R, P> visitor, P p) {
        return visitor.visitPrefix(this, p);
    }

    @Override
    public Term substitute(String variable, Term replacement) {
        Term newContinuation = continuation.substitute(variable, replacement);
        return newContinuation == continuation ? this : new Prefix(action, newContinuation);
    }

    @Override
    public Set<Transition> derive() {
        return Collections.singleton(step());
    }

    @Override
    public Set<String> freeVariables() {
        return continuation.freeVariables();
    }

    @Override
    boolean occursUnguarded(String variable) {
        return false;
    }

    @Override
    void appendCanonicalForm(StringBuilder sb) {
        sb.append(action).append('.').append(continuation);
    }

    @Override
    boolean equalsSameKind(Term other) {
        Prefix that = (Prefix) other;
        return action.equals(that.action) && continuation.equals(that.continuation);
    }

    @Override
    int computeHashCode() {
        return Objects.hash(TermKind.PREFIX.ordinal(), action, continuation);
    }
}
