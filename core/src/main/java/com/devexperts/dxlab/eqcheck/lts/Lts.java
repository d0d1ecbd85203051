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
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Labelled transition system of a term: its reachable states, the actions which occur
 * on transitions, the transition relation and the initial state.
 * <p>
 * Instances are created by {@link LtsBuilder} and are read-only.
 */
public class Lts {
    private final Term initial;
    private final Set<Term> states;
    private final Set<Action> actions;
    private final TransitionRelation relation;

    Lts(Term initial, Set<Term> states, Set<Action> actions, TransitionRelation relation) {
        this.initial = initial;
        this.states = Collections.unmodifiableSet(states);
        this.actions = Collections.unmodifiableSet(actions);
        this.relation = relation;
    }

    public Term getInitial() {
        return initial;
    }

    public Set<Term> getStates() {
        return states;
    }

    public Set<Action> getActions() {
        return actions;
    }

    /**
     * Returns the actions except {@link Action#TAU} in their natural order.
     */
    public Set<Action> getVisibleActions() {
        Set<Action> visible = new TreeSet<>(actions);
        visible.remove(Action.TAU);
        return visible;
    }

    public boolean hasSilentTransitions() {
        return actions.contains(Action.TAU);
    }

    public Set<Transition> transitionsFrom(Term state) {
        return relation.transitionsFrom(state);
    }

    public Set<Term> targetsOf(Term state, Action action) {
        return relation.targetsOf(state, action);
    }

    public Set<Action> actionsFrom(Term state) {
        return relation.actionsFrom(state);
    }

    /**
     * Returns the reachable states without outgoing transitions.
     */
    public Set<Term> deadlockStates() {
        Set<Term> deadlocks = new LinkedHashSet<>();
        for (Term s : states) {
            if (relation.transitionsFrom(s).isEmpty())
                deadlocks.add(s);
        }
        return deadlocks;
    }

    public int getTransitionCount() {
        return relation.size();
    }

    @Override
    public String toString() {
        return "LTS of " + initial + " (" + states.size() + " states, " + relation.size() + " transitions)";
    }
}
