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

import java.util.Set;

/**
 * An immutable process term.
 * <p>
 * The set of variants is closed: {@link Stop}, {@link Var}, {@link Prefix}, {@link Choice},
 * {@link Parallel} and {@link Recursive}. Use {@link #accept(TermVisitor, Object)} to process
 * terms variant-by-variant.
 * <p>
 * Terms are compared structurally. The {@link #toString() canonical form} is deterministic and
 * unique for every term, so it is used as a key for state identity (see {@link TermTable}).
 */
public abstract class Term {
    // Both are computed lazily, racy initialization is fine since terms are immutable
    private String canonicalForm;
    private int hash;

    Term() {}

    public abstract TermKind getKind();

    public abstract <R, P> R accept(TermVisitor<R, P> visitor, P p);

    /**
     * Returns a term with every free occurrence of the specified variable replaced
     * by {@code replacement}. This term is not changed.
     */
    public abstract Term substitute(String variable, Term replacement);

    /**
     * Derives the one-step transitions of this term without any semantic model.
     * <p>
     * NOTE: {@link Parallel} has no transitions here since the semantics of parallel composition
     * depends on the model, use {@link com.devexperts.dxlab.eqcheck.semantics.SosEngine} instead.
     */
    public abstract Set<Transition> derive();

    /**
     * Returns the variables which occur in this term but are not bound by an enclosing {@link Recursive}.
     */
    public abstract Set<String> freeVariables();

    /**
     * Returns {@code true} if the specified variable occurs free in this term and
     * is not preceded by a prefix action.
     */
    abstract boolean occursUnguarded(String variable);

    abstract void appendCanonicalForm(StringBuilder sb);

    abstract boolean equalsSameKind(Term other);

    abstract int computeHashCode();

    public boolean isStop() {
        return getKind() == TermKind.STOP;
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Term))
            return false;
        Term other = (Term) o;
        return getKind() == other.getKind() && hashCode() == other.hashCode() && equalsSameKind(other);
    }

    @Override
    public final int hashCode() {
        int h = hash;
        if (h == 0) {
            h = computeHashCode();
            if (h == 0)
                h = 1;
            hash = h;
        }
        return h;
    }

    /**
     * Returns the canonical form of this term:
     * {@code STOP}, {@code X}, {@code a.P}, {@code (P + Q)}, {@code (P | Q)} and {@code rec X.P}.
     */
    @Override
    public final String toString() {
        String s = canonicalForm;
        if (s == null) {
            StringBuilder sb = new StringBuilder();
            appendCanonicalForm(sb);
            s = sb.toString();
            canonicalForm = s;
        }
        return s;
    }
}
