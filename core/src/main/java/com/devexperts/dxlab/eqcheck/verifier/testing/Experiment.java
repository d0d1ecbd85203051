package com.devexperts.dxlab.eqcheck.verifier.testing;

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
import com.devexperts.dxlab.eqcheck.lts.TauClosure;
import com.devexperts.dxlab.eqcheck.term.Term;
import com.devexperts.dxlab.eqcheck.verifier.Witness;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * The test "after the trace, offer the actions": a process passes it if, having performed
 * the trace, it performs one of the offered actions.
 */
public final class Experiment {
    private final List<Action> trace;
    private final Set<Action> offers;

    public Experiment(List<Action> trace, Set<Action> offers) {
        this.trace = Collections.unmodifiableList(new ArrayList<>(trace));
        this.offers = Collections.unmodifiableSet(new TreeSet<>(offers));
    }

    public List<Action> getTrace() {
        return trace;
    }

    public Set<Action> getOffers() {
        return offers;
    }

    /**
     * Returns {@code true} if some run of the initial state of the transition system
     * performs the trace and then an offered action.
     */
    public boolean mayPass(TauClosure closure) {
        Set<Term> states = after(closure, closure.getLts().getInitial(), trace.size());
        for (Action a : offers) {
            if (!closure.weakAfter(states, a).isEmpty())
                return true;
        }
        return false;
    }

    /**
     * Returns {@code true} if every run of the initial state of the transition system which performs
     * the trace does not diverge on the way and ends in stable states offering at least one of the actions.
     * It holds trivially if the trace cannot be performed.
     */
    public boolean mustPass(TauClosure closure) {
        Term initial = closure.getLts().getInitial();
        for (int i = 0; i <= trace.size(); i++) {
            if (closure.isDivergent(after(closure, initial, i)))
                return false;
        }
        for (Term s : after(closure, initial, trace.size())) {
            if (closure.isStable(s) && Collections.disjoint(closure.initials(s), offers))
                return false;
        }
        return true;
    }

    private Set<Term> after(TauClosure closure, Term initial, int length) {
        Set<Term> states = closure.closure(initial);
        for (int i = 0; i < length; i++)
            states = closure.weakAfter(states, trace.get(i));
        return states;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Experiment that = (Experiment) o;
        return trace.equals(that.trace) && offers.equals(that.offers);
    }

    @Override
    public int hashCode() {
        return 31 * trace.hashCode() + offers.hashCode();
    }

    @Override
    public String toString() {
        return "after " + Witness.traceToString(trace) + " offer " + Witness.actionsToString(offers);
    }
}
