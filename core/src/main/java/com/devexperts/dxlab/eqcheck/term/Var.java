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
import java.util.regex.Pattern;

/**
 * An occurrence of a process variable, bound by an enclosing {@link Recursive} term.
 * A free variable has no transitions.
 */
public final class Var extends Term {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String name;

    public Var(String name) {
        this.name = checkName(name);
    }

    /**
     * Checks that the specified string can be used as a process variable name.
     *
     * @throws IllegalArgumentException if it cannot.
     */
    static String checkName(String name) {
        if (name == null)
            throw new IllegalArgumentException("Variable name is null");
        if (!IDENTIFIER.matcher(name).matches())
            throw new IllegalArgumentException("Invalid variable name \"" + name + "\"");
        if (name.equals(Stop.CANONICAL_FORM) || name.equals(Recursive.KEYWORD))
            throw new IllegalArgumentException("\"" + name + "\" is reserved and cannot be used as a variable name");
        return name;
    }

    public String getName() {
        return name;
    }

    @Override
    public TermKind getKind() {
        return TermKind.VAR;
    }

    @Override
    public <R, P> R accept(TermVisitor<R, P> visitor, P p) {
        return visitor.visitVar(this, p);
    }

    @Override
    public Term substitute(String variable, Term replacement) {
        return name.equals(variable) ? replacement : this;
    }

    @Override
    public Set<Transition> derive() {
        return Collections.emptySet();
    }

    @Override
    public Set<String> freeVariables() {
        return Collections.singleton(name);
    }

    @Override
    boolean occursUnguarded(String variable) {
        return name.equals(variable);
    }

    @Override
    void appendCanonicalForm(StringBuilder sb) {
        sb.append(name);
    }

    @Override
    boolean equalsSameKind(Term other) {
        return name.equals(((Var) other).name);
    }

    @Override
    int computeHashCode() {
        return 31 * TermKind.VAR.ordinal() + name.hashCode();
    }
}
