package com.devexperts.dxlab.eqcheck.verifier.trace;

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
import com.devexperts.dxlab.eqcheck.CheckConfiguration;
import com.devexperts.dxlab.eqcheck.CheckOptions;
import com.devexperts.dxlab.eqcheck.lts.Lts;
import com.devexperts.dxlab.eqcheck.lts.TauClosure;
import com.devexperts.dxlab.eqcheck.term.Term;
import com.devexperts.dxlab.eqcheck.verifier.AbstractBoundedChecker;
import com.devexperts.dxlab.eqcheck.verifier.EquivalenceKind;
import com.devexperts.dxlab.eqcheck.verifier.Verdict;
import com.devexperts.dxlab.eqcheck.verifier.Witness;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;

/**
 * Two terms are trace equivalent iff they can perform the same sequences of visible actions.
 * Traces are compared up to the configured depth, the witness is a shortest trace
 * which only one of the terms can perform.
 */
public class TraceEquivalenceChecker extends AbstractBoundedChecker {
    public TraceEquivalenceChecker(CheckConfiguration configuration) {
        super(EquivalenceKind.TRACE, configuration);
    }

    @Override
    public Verdict check(Lts left, Lts right) {
        return explore(new TauClosure(left), new TauClosure(right), TraceEquivalenceChecker::compareTraces);
    }

    /**
     * Returns the witness if exactly one of the state sets reached after the trace is empty.
     */
    @Nullable
    public static Witness compareTraces(List<Action> trace, Set<Term> left, Set<Term> right) {
        if (left.isEmpty() == right.isEmpty())
            return null;
        String side = left.isEmpty() ? "right" : "left";
        return new Witness(trace, anyState(left), anyState(right), null,
            "trace " + Witness.traceToString(trace) + " is possible only for the " + side + " term");
    }

    /**
     * Returns the non-empty traces of visible actions of the transition system which are not longer than
     * {@code depth}, in the order of their length.
     */
    public static Set<List<Action>> traces(Lts lts, int depth) {
        TauClosure closure = new TauClosure(lts);
        Set<Action> alphabet = lts.getVisibleActions();
        Set<List<Action>> traces = new LinkedHashSet<>();
        Queue<List<Action>> traceQueue = new ArrayDeque<>();
        Queue<Set<Term>> stateQueue = new ArrayDeque<>();
        traceQueue.add(Collections.emptyList());
        stateQueue.add(closure.closure(lts.getInitial()));
        while (!traceQueue.isEmpty()) {
            List<Action> trace = traceQueue.poll();
            Set<Term> states = stateQueue.poll();
            if (trace.size() == depth)
                continue;
            for (Action a : alphabet) {
                Set<Term> after = closure.weakAfter(states, a);
                if (after.isEmpty())
                    continue;
                List<Action> next = new ArrayList<>(trace);
                next.add(a);
                traces.add(Collections.unmodifiableList(next));
                traceQueue.add(next);
                stateQueue.add(after);
            }
        }
        return traces;
    }

    /**
     * Returns the bounded traces of the term under the default configuration.
     *
     * @see #traces(Lts, int)
     */
    public static Set<List<Action>> traces(Term term, int depth) {
        return traces(term, depth, new CheckOptions());
    }

    /**
     * Returns the bounded traces of the term in the semantic model of the specified options.
     *
     * @see #traces(Lts, int)
     */
    public static Set<List<Action>> traces(Term term, int depth, CheckOptions options) {
        return traces(options.createConfiguration().createBuilder().build(term), depth);
    }
}
