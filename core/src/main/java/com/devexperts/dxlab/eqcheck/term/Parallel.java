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
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Concurrent execution of {@link #getLeft() left} and {@link #getRight() right} operands.
 * How the operands interleave and synchronize is defined by the semantic model,
 * see {@link com.devexperts.dxlab.eqcheck.semantics.SemanticModel}.
 */
public final class Parallel extends Term {
    private final Term left;
    private final Term right;

    public Parallel(Term left, Term right) {
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public Term getLeft() {
        return left;
    }

    public Term getRight() {
        return right;
    }

    @Override
    public TermKind getKind() {
        return TermKind.PARALLEL;
    }

    @Override
    public <R, P> R accept(TermVisitor<R, P> visitor, P p) {
        return visitor.visitParallel(this, p);
    }

    @Override
    public Term substitute(String variable, Term replacement) {
        Term newLeft = left.substitute(variable, replacement);
        Term newRight = right.substitute(variable, replacement);
        if (newLeft == left && newRight == right)
            return this;
        return new Parallel(newLeft, newRight);
    }

    /**
     * Always returns an empty set, the parallel composition has no model-independent semantics.
     */
    @Override
    public Set<Transition> derive() {
        return Collections.emptySet();
    }

    @Override
    public Set<String> freeVariables() {
        Set<String> vars = new HashSet<>(left.freeVariables());
        vars.addAll(right.freeVariables());
        return vars;
    }

    @Override
    boolean occursUnguarded(String variable) {
        return left.occursUnguarded(variable) || right.occursUnguarded(variable);
    }

    @Override
    void appendCanonicalForm(StringBuilder sb) {
        sb.append('(').append(left).append(" | ").append(right).append(')');
    }

    @Override
    boolean equalsSameKind(Term other) {
        Parallel that = (Parallel) other;
        return left.equals(that.left) && right.equals(that.right);
    }

    @Override
    int computeHashCode() {
        return Objects.hash(TermKind.PARALLEL.ordinal(), left, right);
    }
}
