package com.devexperts.dxlab.eqcheck.lts;

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
import com.devexperts.dxlab.eqcheck.term.Term;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Weak (silent-step insensitive) view of a single {@link Lts}.
 * Closures and divergence are computed on demand and cached, so an instance
 * should be owned by one verification task.
 */
public class TauClosure {
    private final Lts lts;
    private final Map<Term, Set<Term>> closures = new HashMap<>();
    private final Map<Term, Boolean> divergence = new HashMap<>();

    public TauClosure(Lts lts) {
        this.lts = lts;
    }

    public Lts getLts() {
        return lts;
    }

    /**
     * Returns the states reachable from the specified one by zero or more {@link Action#TAU tau} steps.
     */
    public Set<Term> closure(Term state) {
        Set<Term> closure = closures.get(state);
        if (closure != null)
            return closure;
        closure = new LinkedHashSet<>();
        Deque<Term> stack = new ArrayDeque<>();
        closure.add(state);
        stack.push(state);
        while (!stack.isEmpty()) {
            for (Term next : lts.targetsOf(stack.pop(), Action.TAU)) {
                if (closure.add(next))
                    stack.push(next);
            }
        }
        closure = Collections.unmodifiableSet(closure);
        closures.put(state, closure);
        return closure;
    }

    public Set<Term> closure(Collection<Term> states) {
        Set<Term> result = new LinkedHashSet<>();
        for (Term s : states)
            result.addAll(closure(s));
        return result;
    }

    /**
     * Returns the states reachable from the specified ones by {@code tau* action tau*}
     * for a visible action, or by {@code tau*} for the silent one.
     */
    public Set<Term> weakAfter(Collection<Term> states, Action action) {
        Set<Term> before = closure(states);
        if (action.isSilent())
            return before;
        Set<Term> after = new LinkedHashSet<>();
        for (Term s : before)
            after.addAll(lts.targetsOf(s, action));
        return closure(after);
    }

    /**
     * Returns the visible actions of the outgoing transitions of the specified state.
     */
    public Set<Action> initials(Term state) {
        Set<Action> initials = new TreeSet<>(lts.actionsFrom(state));
        initials.remove(Action.TAU);
        return initials;
    }

    /**
     * Returns {@code true} if the specified state cannot perform a silent step.
     */
    public boolean isStable(Term state) {
        return lts.targetsOf(state, Action.TAU).isEmpty();
    }

    /**
     * Returns {@code true} if an infinite sequence of silent steps starts in the specified state.
     */
    public boolean isDivergent(Term state) {
        Boolean cached = divergence.get(state);
        if (cached != null)
            return cached;
        boolean divergent = false;
        // A tau cycle is reachable iff some state of the closure is tau-reachable from its own tau-successor
        for (Term s : closure(state)) {
            for (Term next : lts.targetsOf(s, Action.TAU)) {
                if (closure(next).contains(s)) {
                    divergent = true;
                    break;
                }
            }
            if (divergent)
                break;
        }
        divergence.put(state, divergent);
        return divergent;
    }

    public boolean isDivergent(Collection<Term> states) {
        for (Term s : states) {
            if (isDivergent(s))
                return true;
        }
        return false;
    }
}
