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

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Testing equivalence over {@link Experiment experiments}.
 * <ul>
 *     <li>May-equivalence: both terms may pass the same experiments, which holds iff they are trace equivalent.</li>
 *     <li>Must-equivalence: both terms must pass the same experiments. After every explored trace both terms
 *     either diverge or converge, and in the latter case every acceptance set (the visible actions of a
 *     reachable stable state) of one term contains an acceptance set of the other.</li>
 * </ul>
 * {@link EquivalenceKind#TESTING} requires both.
 */
public class TestingEquivalenceChecker extends AbstractBoundedChecker {
    public TestingEquivalenceChecker(EquivalenceKind kind, CheckConfiguration configuration) {
        super(kind, configuration);
        if (kind != EquivalenceKind.TESTING && kind != EquivalenceKind.MAY_TESTING && kind != EquivalenceKind.MUST_TESTING)
            throw new IllegalArgumentException(kind + " is not a testing equivalence");
    }

    public TestingEquivalenceChecker(CheckConfiguration configuration) {
        this(EquivalenceKind.TESTING, configuration);
    }

    @Override
    public Verdict check(Lts left, Lts right) {
        switch (kind) {
        case MAY_TESTING:
            return checkMay(left, right);
        case MUST_TESTING:
            return checkMust(left, right);
        default:
            Verdict may = checkMay(left, right);
            if (may.isNotEquivalent())
                return may;
            Verdict must = checkMust(left, right);
            return must.isNotEquivalent() || may.isEquivalent() ? must : may;
        }
    }

    public Verdict checkMay(Lts left, Lts right) {
        return explore(new TauClosure(left), new TauClosure(right), (trace, l, r) -> {
            Witness w = TraceEquivalenceChecker.compareTraces(trace, l, r);
            if (w == null)
                return null;
            // Offering the next action after the trace without it distinguishes the terms
            List<Action> prefix = trace.subList(0, trace.size() - 1);
            Experiment e = new Experiment(prefix, Collections.singleton(trace.get(trace.size() - 1)));
            return new Witness(prefix, w.getLeftState(), w.getRightState(), e.getOffers(),
                "only the " + (l.isEmpty() ? "right" : "left") + " term may pass \"" + e + "\"");
        });
    }

    public Verdict checkMust(Lts left, Lts right) {
        TauClosure lc = new TauClosure(left);
        TauClosure rc = new TauClosure(right);
        Set<Action> alphabet = jointAlphabet(left, right);
        return explore(lc, rc, new Comparison() {
            @Override
            public Witness compare(List<Action> trace, Set<Term> l, Set<Term> r) {
                boolean leftDiverges = lc.isDivergent(l);
                boolean rightDiverges = rc.isDivergent(r);
                if (leftDiverges != rightDiverges) {
                    Experiment e = new Experiment(trace, alphabet);
                    return new Witness(trace, anyState(l), anyState(r), e.getOffers(),
                        "only the " + (leftDiverges ? "left" : "right") + " term may diverge after "
                            + Witness.traceToString(trace) + ", so it fails \"" + e + "\"");
                }
                if (leftDiverges)
                    return null;
                Witness w = compareAcceptances(trace, l, lc, r, rc, alphabet, "left", "right");
                return w != null ? w : compareAcceptances(trace, r, rc, l, lc, alphabet, "right", "left");
            }

            @Override
            public boolean continues(Set<Term> l, Set<Term> r) {
                return !lc.isDivergent(l);
            }
        });
    }

    /**
     * Looks for an acceptance set of {@code first} which contains no acceptance set of {@code second}.
     * The experiment offering the actions outside of it is then passed by {@code second} only.
     */
    @Nullable
    private static Witness compareAcceptances(List<Action> trace, Set<Term> first, TauClosure firstClosure,
        Set<Term> second, TauClosure secondClosure, Set<Action> alphabet, String firstName, String secondName)
    {
        Set<Set<Action>> secondAcceptances = acceptances(second, secondClosure);
        for (Term s : first) {
            if (!firstClosure.isStable(s))
                continue;
            Set<Action> acceptance = firstClosure.initials(s);
            boolean matched = false;
            for (Set<Action> other : secondAcceptances) {
                if (acceptance.containsAll(other)) {
                    matched = true;
                    break;
                }
            }
            if (matched)
                continue;
            Set<Action> offers = new TreeSet<>(alphabet);
            offers.removeAll(acceptance);
            Experiment e = new Experiment(trace, offers);
            boolean firstIsLeft = firstName.equals("left");
            return new Witness(trace, firstIsLeft ? s : anyState(second), firstIsLeft ? anyState(second) : s, offers,
                "only the " + secondName + " term must pass \"" + e + "\", the " + firstName
                    + " term may reach " + s + " accepting " + Witness.actionsToString(acceptance));
        }
        return null;
    }

    static Set<Set<Action>> acceptances(Set<Term> states, TauClosure closure) {
        Set<Set<Action>> result = new LinkedHashSet<>();
        for (Term s : states) {
            if (closure.isStable(s))
                result.add(closure.initials(s));
        }
        return result;
    }
}
