package com.devexperts.dxlab.eqcheck.verifier.failures;

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
import com.devexperts.dxlab.eqcheck.lts.Lts;
import com.devexperts.dxlab.eqcheck.lts.TauClosure;
import com.devexperts.dxlab.eqcheck.term.Term;
import com.devexperts.dxlab.eqcheck.verifier.AbstractBoundedChecker;
import com.devexperts.dxlab.eqcheck.verifier.EquivalenceKind;
import com.devexperts.dxlab.eqcheck.verifier.Verdict;
import com.devexperts.dxlab.eqcheck.verifier.Witness;
import com.devexperts.dxlab.eqcheck.verifier.trace.TraceEquivalenceChecker;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.TreeSet;

/**
 * Failures equivalence and refinement in the stable failures model.
 * <p>
 * The refusals of a stable state are the actions of the joint alphabet it cannot perform.
 * Two terms are failures equivalent iff they have the same traces and after every trace each
 * refusal of one term is contained in a refusal of the other one. The specification is refined
 * by the implementation iff every trace of the implementation is a trace of the specification
 * and every refusal of the implementation is contained in a refusal of the specification after that trace.
 */
public class FailuresEquivalenceChecker extends AbstractBoundedChecker {
    public FailuresEquivalenceChecker(CheckConfiguration configuration) {
        super(EquivalenceKind.FAILURES, configuration);
    }

    @Override
    public Verdict check(Lts left, Lts right) {
        TauClosure lc = new TauClosure(left);
        TauClosure rc = new TauClosure(right);
        Set<Action> alphabet = jointAlphabet(left, right);
        return explore(lc, rc, (trace, l, r) -> {
            Witness w = TraceEquivalenceChecker.compareTraces(trace, l, r);
            if (w != null)
                return w;
            w = compareRefusals(trace, l, lc, r, rc, alphabet, true);
            return w != null ? w : compareRefusals(trace, r, rc, l, lc, alphabet, false);
        });
    }

    /**
     * Checks that {@code implementation} refines {@code specification}.
     */
    public Verdict refines(Term specification, Term implementation) {
        return checkTerms(specification, implementation, true, this::refines);
    }

    public Verdict refines(Lts specification, Lts implementation) {
        TauClosure sc = new TauClosure(specification);
        TauClosure ic = new TauClosure(implementation);
        Set<Action> alphabet = jointAlphabet(specification, implementation);
        return explore(sc, ic, new Comparison() {
            @Override
            public Witness compare(List<Action> trace, Set<Term> spec, Set<Term> impl) {
                if (impl.isEmpty())
                    return null;
                if (spec.isEmpty()) {
                    return new Witness(trace, null, anyState(impl), null, "trace " + Witness.traceToString(trace)
                        + " of the implementation is not allowed by the specification");
                }
                return compareRefusals(trace, impl, ic, spec, sc, alphabet, false);
            }

            @Override
            public boolean continues(Set<Term> spec, Set<Term> impl) {
                return !impl.isEmpty();
            }
        });
    }

    /**
     * Looks for a refusal of a state of {@code first} which is not contained in any refusal of {@code second}.
     */
    @Nullable
    private static Witness compareRefusals(List<Action> trace, Set<Term> first, TauClosure firstClosure,
        Set<Term> second, TauClosure secondClosure, Set<Action> alphabet, boolean firstIsLeft)
    {
        List<Set<Action>> secondRefusals = maximalRefusals(second, secondClosure, alphabet);
        for (Term s : first) {
            if (!firstClosure.isStable(s))
                continue;
            Set<Action> refusal = refusal(s, firstClosure, alphabet);
            boolean matched = false;
            for (Set<Action> other : secondRefusals) {
                if (other.containsAll(refusal)) {
                    matched = true;
                    break;
                }
            }
            if (matched)
                continue;
            Failure failure = new Failure(trace, refusal);
            return new Witness(trace, firstIsLeft ? s : anyState(second), firstIsLeft ? anyState(second) : s,
                refusal, "failure " + failure + " of the " + (firstIsLeft ? "left" : "right")
                    + " term is not a failure of the " + (firstIsLeft ? "right" : "left") + " one");
        }
        return null;
    }

    private static Set<Action> refusal(Term state, TauClosure closure, Set<Action> alphabet) {
        Set<Action> refusal = new TreeSet<>(alphabet);
        refusal.removeAll(closure.initials(state));
        return refusal;
    }

    /**
     * Returns the refusals of the stable states among the specified ones
     * which are not contained in other ones.
     */
    static List<Set<Action>> maximalRefusals(Set<Term> states, TauClosure closure, Set<Action> alphabet) {
        List<Set<Action>> refusals = new ArrayList<>();
        for (Term s : states) {
            if (closure.isStable(s)) {
                Set<Action> r = refusal(s, closure, alphabet);
                if (!refusals.contains(r))
                    refusals.add(r);
            }
        }
        List<Set<Action>> maximal = new ArrayList<>();
        for (Set<Action> r : refusals) {
            boolean dominated = false;
            for (Set<Action> other : refusals) {
                if (other != r && other.size() > r.size() && other.containsAll(r)) {
                    dominated = true;
                    break;
                }
            }
            if (!dominated)
                maximal.add(r);
        }
        return maximal;
    }

    /**
     * Returns the failures of the transition system with maximal refusals (over its own visible actions)
     * for the traces which are not longer than {@code depth}, the empty trace included.
     */
    public static List<Failure> failures(Lts lts, int depth) {
        TauClosure closure = new TauClosure(lts);
        Set<Action> alphabet = lts.getVisibleActions();
        List<Failure> failures = new ArrayList<>();
        Queue<List<Action>> traceQueue = new ArrayDeque<>();
        Queue<Set<Term>> stateQueue = new ArrayDeque<>();
        traceQueue.add(Collections.emptyList());
        stateQueue.add(closure.closure(lts.getInitial()));
        while (!traceQueue.isEmpty()) {
            List<Action> trace = traceQueue.poll();
            Set<Term> states = stateQueue.poll();
            for (Set<Action> refusal : maximalRefusals(states, closure, alphabet))
                failures.add(new Failure(trace, refusal));
            if (trace.size() == depth)
                continue;
            for (Action a : alphabet) {
                Set<Term> after = closure.weakAfter(states, a);
                if (after.isEmpty())
                    continue;
                List<Action> next = new ArrayList<>(trace);
                next.add(a);
                traceQueue.add(next);
                stateQueue.add(after);
            }
        }
        return failures;
    }
}
