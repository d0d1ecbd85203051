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
import com.devexperts.dxlab.eqcheck.Transition;
import com.devexperts.dxlab.eqcheck.term.Term;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Set of transitions indexed by source state and by (source, action) pair,
 * so that both {@link #transitionsFrom(Term)} and {@link #targetsOf(Term, Action)}
 * do not scan the whole relation.
 */
public class TransitionRelation {
    private final Map<Term, Set<Transition>> outgoing = new LinkedHashMap<>();
    private final Map<Term, Map<Action, Set<Term>>> targets = new LinkedHashMap<>();
    private int size;

    /**
     * Adds the specified transition, re-adding an existing one has no effect.
     *
     * @return {@code true} if the relation did not contain the transition.
     */
    public boolean add(Term source, Action action, Term target) {
        return add(new Transition(source, action, target));
    }

    public boolean add(Transition transition) {
        Term source = transition.getSource();
        if (!outgoing.computeIfAbsent(source, s -> new LinkedHashSet<>()).add(transition))
            return false;
        targets.computeIfAbsent(source, s -> new LinkedHashMap<>())
            .computeIfAbsent(transition.getAction(), a -> new LinkedHashSet<>())
            .add(transition.getTarget());
        size++;
        return true;
    }

    /**
     * Returns all outgoing transitions of the specified state, empty set for an unknown state.
     */
    public Set<Transition> transitionsFrom(Term state) {
        Set<Transition> ts = outgoing.get(state);
        return ts == null ? Collections.emptySet() : Collections.unmodifiableSet(ts);
    }

    /**
     * Returns all states reachable from the specified one in one {@code action} step.
     */
    public Set<Term> targetsOf(Term state, Action action) {
        Map<Action, Set<Term>> byAction = targets.get(state);
        if (byAction == null)
            return Collections.emptySet();
        Set<Term> ts = byAction.get(action);
        return ts == null ? Collections.emptySet() : Collections.unmodifiableSet(ts);
    }

    /**
     * Returns the actions of the outgoing transitions of the specified state.
     */
    public Set<Action> actionsFrom(Term state) {
        Map<Action, Set<Term>> byAction = targets.get(state);
        return byAction == null ? Collections.emptySet() : Collections.unmodifiableSet(byAction.keySet());
    }

    /**
     * Returns the states which have at least one outgoing transition.
     */
    public Set<Term> sources() {
        return Collections.unmodifiableSet(outgoing.keySet());
    }

    /**
     * Returns the number of distinct transitions.
     */
    public int size() {
        return size;
    }
}
