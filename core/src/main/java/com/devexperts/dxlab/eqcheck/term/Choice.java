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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Behaves as either {@link #getLeft() left} or {@link #getRight() right} branch.
 * <p>
 * A visible step of a branch resolves the choice, its target is the continuation of that branch.
 * A silent step does not resolve it: {@code (P + Q) --tau--> (P' + Q)}, where the summands
 * of {@code Q} which are already summands of {@code P'} are dropped.
 */
public final class Choice extends Term {
    private final Term left;
    private final Term right;

    public Choice(Term left, Term right) {
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
    }

    public Term getLeft() {
        return left;
    }

    public Term getRight() {
        return right;
    }

    /**
     * Combines the steps of both branches into the steps of this choice.
     *
     * @param leftSteps steps of the left branch.
     * @param rightSteps steps of the right branch.
     */
    public Set<Transition> combine(Set<Transition> leftSteps, Set<Transition> rightSteps) {
        Set<Transition> result = new LinkedHashSet<>();
        for (Transition t : leftSteps) {
            Term target = t.getAction().isSilent() ? join(t.getTarget(), right, true) : t.getTarget();
            result.add(new Transition(this, t.getAction(), target));
        }
        for (Transition t : rightSteps) {
            Term target = t.getAction().isSilent() ? join(t.getTarget(), left, false) : t.getTarget();
            result.add(new Transition(this, t.getAction(), target));
        }
        return Collections.unmodifiableSet(result);
    }

    /**
     * Returns the summands of the term in the left to right order,
     * nested choices are flattened and a term which is not a choice is its own single summand.
     */
    public static List<Term> summands(Term term) {
        List<Term> result = new ArrayList<>();
        addSummands(term, result);
        return result;
    }

    private static void addSummands(Term term, List<Term> result) {
        if (term instanceof Choice) {
            Choice c = (Choice) term;
            addSummands(c.left, result);
            addSummands(c.right, result);
        } else {
            result.add(term);
        }
    }

    /**
     * Puts the target of a silent step next to the untouched branch,
     * keeping only the summands of that branch which the target does not have yet.
     */
    private static Term join(Term stepped, Term untouched, boolean steppedOnLeft) {
        Set<Term> present = new HashSet<>(summands(stepped));
        List<Term> untouchedSummands = summands(untouched);
        Set<Term> kept = new LinkedHashSet<>();
        for (Term s : untouchedSummands) {
            if (!present.contains(s))
                kept.add(s);
        }
        if (kept.isEmpty())
            return stepped;
        Term other = kept.size() == untouchedSummands.size() ? untouched : rightNested(new ArrayList<>(kept));
        return steppedOnLeft ? new Choice(stepped, other) : new Choice(other, stepped);
    }

    private static Term rightNested(List<Term> summands) {
        Term result = summands.get(summands.size() - 1);
        for (int i = summands.size() - 2; i >= 0; i--)
            result = new Choice(summands.get(i), result);
        return result;
    }

    @Override
    public TermKind getKind() {
        return TermKind.CHOICE;
    }

    @Override
    public <R, P> R accept(TermVisitor<R, P> visitor, P p) {
        return visitor.visitChoice(this, p);
    }

    @Override
    public Term substitute(String variable, Term replacement) {
        Term newLeft = left.substitute(variable, replacement);
        Term newRight = right.substitute(variable, replacement);
        if (newLeft == left && newRight == right)
            return this;
        return new Choice(newLeft, newRight);
    }

    @Override
    public Set<Transition> derive() {
        return combine(left.derive(), right.derive());
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
        sb.append('(').append(left).append(" + ").append(right).append(')');
    }

    @Override
    boolean equalsSameKind(Term other) {
        Choice that = (Choice) other;
        return left.equals(that.left) && right.equals(that.right);
    }

    @Override
    int computeHashCode() {
        return Objects.hash(TermKind.CHOICE.ordinal(), left, right);
    }
}
