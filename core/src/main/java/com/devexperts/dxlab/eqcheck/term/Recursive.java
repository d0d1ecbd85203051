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
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * The recursive process {@code rec X.P}: behaves as {@code P} where every free occurrence
 * of {@code X} stands for the whole term. The definition is kept unexpanded and
 * is {@link #unfold() unfolded} one level on demand.
 */
public final class Recursive extends Term {
    static final String KEYWORD = "rec";

    private final String variable;
    private final Term definition;

    public Recursive(String variable, Term definition) {
        this.variable = Var.checkName(variable);
        this.definition = Objects.requireNonNull(definition, "definition");
    }

    public String getVariable() {
        return variable;
    }

    public Term getDefinition() {
        return definition;
    }

    /**
     * Returns {@code true} if every free occurrence of the bound variable in the definition
     * is preceded by a prefix action, so that unfolding always makes progress.
     */
    public boolean isGuarded() {
        return !definition.occursUnguarded(variable);
    }

    /**
     * Returns the definition with the bound variable replaced by this term.
     *
     * @throws IllegalArgumentException if this recursion is not {@link #isGuarded() guarded}.
     */
    public Term unfold() {
        requireGuarded();
        return definition.substitute(variable, this);
    }

    /**
     * Turns the steps of the unfolded term into the steps of this term.
     */
    public Set<Transition> resource(Set<Transition> unfoldedSteps) {
        Set<Transition> result = new LinkedHashSet<>();
        for (Transition t : unfoldedSteps)
            result.add(t.withSource(this));
        return Collections.unmodifiableSet(result);
    }

    private void requireGuarded() {
        if (!isGuarded())
            throw new IllegalArgumentException("Unguarded recursion: " + variable + " occurs unguarded in " + this);
    }

    @Override
    public TermKind getKind() {
        return TermKind.RECURSIVE;
    }

    @Override
    public <R, P> R accept(TermVisitor<R, P> visitor, P p) {
        return visitor.visitRecursive(this, p);
    }

    /**
     * Substitution on the bound variable replaces the whole term,
     * otherwise it goes into the definition.
     */
    @Override
    public Term substitute(String variable, Term replacement) {
        if (this.variable.equals(variable))
            return replacement;
        Term newDefinition = definition.substitute(variable, replacement);
        return newDefinition == definition ? this : new Recursive(this.variable, newDefinition);
    }

    @Override
    public Set<Transition> derive() {
        return resource(unfold().derive());
    }

    @Override
    public Set<String> freeVariables() {
        Set<String> vars = new HashSet<>(definition.freeVariables());
        vars.remove(variable);
        return vars;
    }

    @Override
    boolean occursUnguarded(String variable) {
        return !this.variable.equals(variable) && definition.occursUnguarded(variable);
    }

    @Override
    void appendCanonicalForm(StringBuilder sb) {
        sb.append(KEYWORD).append(' ').append(variable).append('.').append(definition);
    }

    @Override
    boolean equalsSameKind(Term other) {
        Recursive that = (Recursive) other;
        return variable.equals(that.variable) && definition.equals(that.definition);
    }

    @Override
    int computeHashCode() {
        return Objects.hash(TermKind.RECURSIVE.ordinal(), variable, definition);
    }
}
