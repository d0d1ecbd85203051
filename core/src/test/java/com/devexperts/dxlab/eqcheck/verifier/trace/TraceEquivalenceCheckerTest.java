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
import com.devexperts.dxlab.eqcheck.CheckOptions;
import com.devexperts.dxlab.eqcheck.EqChecker;
import com.devexperts.dxlab.eqcheck.semantics.SemanticModel;
import com.devexperts.dxlab.eqcheck.term.Term;
import com.devexperts.dxlab.eqcheck.verifier.EquivalenceKind;
import com.devexperts.dxlab.eqcheck.verifier.Verdict;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static com.devexperts.dxlab.eqcheck.term.Terms.*;
import static org.junit.Assert.*;

public class TraceEquivalenceCheckerTest {
    private final Action a = Action.of("a");
    private final Action b = Action.of("b");

    private static Verdict check(Term left, Term right) {
        return EqChecker.checkEquivalence(left, right, EquivalenceKind.TRACE);
    }

    @Test
    public void testSameTerms() {
        assertTrue(check(prefix("a", stop()), prefix("a", stop())).isEquivalent());
    }

    @Test
    public void testMissingTrace() {
        Verdict verdict = check(choice(prefix("a", stop()), prefix("b", stop())), prefix("a", stop()));
        assertTrue(verdict.isNotEquivalent());
        assertEquals(Collections.singletonList(b), verdict.getWitness().getTrace());
        assertEquals(stop(), verdict.getWitness().getLeftState());
        assertNull(verdict.getWitness().getRightState());
    }

    @Test
    public void testShortestWitness() {
        Verdict verdict = check(sequence("a", "b", "c"), sequence("a", "b", "d"));
        assertEquals(Arrays.asList(a, b, Action.of("c")), verdict.getWitness().getTrace());
    }

    @Test
    public void testSilentStepsAreInvisible() {
        assertTrue(check(prefix("tau", prefix("a", stop())), prefix("a", stop())).isEquivalent());
        assertTrue(check(prefix("a", prefix("tau", prefix("b", stop()))), sequence("a", "b")).isEquivalent());
    }

    @Test
    public void testChoiceIdempotence() {
        Term p = rec("X", choice(prefix("a", var("X")), prefix("b", stop())));
        assertTrue(check(choice(p, p), p).isEquivalent());
        assertEquals(TraceEquivalenceChecker.traces(choice(p, p), 5), TraceEquivalenceChecker.traces(p, 5));
    }

    @Test
    public void testStopAbsorption() {
        Term p = prefix("a", choice(prefix("b", stop()), prefix("c", stop())));
        assertTrue(check(choice(p, stop()), p).isEquivalent());
    }

    @Test
    public void testVendingMachines() {
        Term choiceAfterCoin = prefix("coin", choice(prefix("coffee", stop()), prefix("tea", stop())));
        Term choiceOnCoin = choice(prefix("coin", prefix("tau", prefix("coffee", stop()))),
            prefix("coin", prefix("tau", prefix("tea", stop()))));
        assertTrue(check(choiceAfterCoin, choiceOnCoin).isEquivalent());
    }

    @Test
    public void testRecursiveTraces() {
        Term clock = rec("X", prefix("a", var("X")));
        Set<List<Action>> expected = new LinkedHashSet<>();
        expected.add(Arrays.asList(a));
        expected.add(Arrays.asList(a, a));
        expected.add(Arrays.asList(a, a, a));
        expected.add(Arrays.asList(a, a, a, a));
        assertEquals(expected, TraceEquivalenceChecker.traces(clock, 4));
        assertEquals(10, TraceEquivalenceChecker.traces(clock, 10).size());
    }

    @Test
    public void testTracesInSemanticModel() {
        Term twice = par(prefix("a", stop()), prefix("a", stop()));
        assertEquals(2, TraceEquivalenceChecker.traces(twice, 3).size());
        assertEquals(Collections.singleton(Arrays.asList(a)), TraceEquivalenceChecker.traces(twice, 3,
            new CheckOptions().semanticModel(SemanticModel.CSP).synchronizeOn("a")));
    }

    @Test
    public void testCyclicStateSpacesAreDecided() {
        Term clock = rec("X", prefix("a", var("X")));
        Term doubleClock = rec("Y", prefix("a", prefix("a", var("Y"))));
        Verdict verdict = EqChecker.checkEquivalence(clock, doubleClock, EquivalenceKind.TRACE, new CheckOptions().depth(1));
        assertTrue(verdict.toString(), verdict.isEquivalent());
    }

    @Test
    public void testDepthBound() {
        Term six = sequence("a", "a", "a", "a", "a", "a");
        Term seven = sequence("a", "a", "a", "a", "a", "a", "a");
        Verdict bounded = EqChecker.checkEquivalence(six, seven, EquivalenceKind.TRACE, new CheckOptions().depth(3));
        assertTrue(bounded.isInconclusive());
        assertNotNull(bounded.getReason());
        assertNull(bounded.getWitness());
        Verdict full = check(six, seven);
        assertTrue(full.isNotEquivalent());
        assertEquals(7, full.getWitness().getTrace().size());
    }
}
