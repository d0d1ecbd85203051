package com.devexperts.dxlab.eqcheck.tests;

/*
 * #%L
 * libtest
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

import com.devexperts.dxlab.eqcheck.EqChecker;
import com.devexperts.dxlab.eqcheck.term.Term;
import com.devexperts.dxlab.eqcheck.verifier.EquivalenceKind;
import com.devexperts.dxlab.eqcheck.verifier.Verdict;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

import java.util.Arrays;
import java.util.List;

import static com.devexperts.dxlab.eqcheck.term.Terms.*;
import static org.junit.Assert.*;

/**
 * A machine offering the choice of a drink after the payment against a machine
 * choosing the drink internally on the payment.
 */
@RunWith(Parameterized.class)
public class VendingMachineTest {
    private static final Term CHOICE_AFTER_COIN = prefix("coin", choice(prefix("coffee", stop()), prefix("tea", stop())));
    private static final Term CHOICE_ON_COIN = choice(
        prefix("coin", prefix("tau", prefix("coffee", stop()))),
        prefix("coin", prefix("tau", prefix("tea", stop()))));

    private final EquivalenceKind kind;
    private final Verdict.Outcome expected;

    @Parameterized.Parameters(name = "{0}")
    public static List<Object[]> params() {
        return Arrays.<Object[]>asList(
            new Object[] {EquivalenceKind.TRACE, Verdict.Outcome.EQUIVALENT},
            new Object[] {EquivalenceKind.STRONG_BISIMULATION, Verdict.Outcome.NOT_EQUIVALENT},
            new Object[] {EquivalenceKind.WEAK_BISIMULATION, Verdict.Outcome.NOT_EQUIVALENT},
            new Object[] {EquivalenceKind.TESTING, Verdict.Outcome.NOT_EQUIVALENT},
            new Object[] {EquivalenceKind.MAY_TESTING, Verdict.Outcome.EQUIVALENT},
            new Object[] {EquivalenceKind.MUST_TESTING, Verdict.Outcome.NOT_EQUIVALENT},
            new Object[] {EquivalenceKind.FAILURES, Verdict.Outcome.NOT_EQUIVALENT}
        );
    }

    public VendingMachineTest(EquivalenceKind kind, Verdict.Outcome expected) {
        this.kind = kind;
        this.expected = expected;
    }

    @Test
    public void test() {
        Verdict verdict = EqChecker.checkEquivalence(CHOICE_AFTER_COIN, CHOICE_ON_COIN, kind);
        assertEquals(verdict.toString(), expected, verdict.getOutcome());
        if (verdict.isNotEquivalent())
            assertNotNull(verdict.getWitness());
    }

    @Test
    public void testSameMachine() {
        assertTrue(EqChecker.checkEquivalence(CHOICE_ON_COIN, CHOICE_ON_COIN, kind).isEquivalent());
    }
}
