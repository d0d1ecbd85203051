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

import com.devexperts.dxlab.eqcheck.CheckOptions;
import com.devexperts.dxlab.eqcheck.EqChecker;
import com.devexperts.dxlab.eqcheck.lts.Lts;
import com.devexperts.dxlab.eqcheck.semantics.SemanticModel;
import com.devexperts.dxlab.eqcheck.term.Term;
import com.devexperts.dxlab.eqcheck.verifier.EquivalenceKind;
import org.junit.Test;

import static com.devexperts.dxlab.eqcheck.term.Terms.*;
import static org.junit.Assert.*;

/**
 * Two processes acquiring a pair of locks.
 */
public class DeadlockTest {
    private static CheckOptions options() {
        return new CheckOptions().semanticModel(SemanticModel.CSP).synchronizeOn("a", "b");
    }

    @Test
    public void testOppositeOrder() {
        Term system = par(sequence("a", "b"), sequence("b", "a"));
        Lts lts = EqChecker.buildLts(system, options());
        assertEquals(1, lts.getStates().size());
        assertTrue(lts.deadlockStates().contains(lts.getInitial()));
        for (EquivalenceKind kind : EquivalenceKind.values())
            assertTrue(kind.toString(), EqChecker.checkEquivalence(system, stop(), kind, options()).isEquivalent());
    }

    @Test
    public void testSameOrder() {
        Term system = par(sequence("a", "b"), sequence("a", "b"));
        Lts lts = EqChecker.buildLts(system, options());
        assertEquals(1, lts.deadlockStates().size());
        assertTrue(EqChecker.checkEquivalence(system, sequence("a", "b"), EquivalenceKind.STRONG_BISIMULATION,
            options()).isEquivalent());
        assertTrue(EqChecker.checkEquivalence(system, stop(), EquivalenceKind.TRACE, options()).isNotEquivalent());
    }

    @Test
    public void testInterleavingDoesNotDeadlock() {
        Term system = par(sequence("a", "b"), sequence("b", "a"));
        Lts lts = EqChecker.buildLts(system, new CheckOptions().semanticModel(SemanticModel.CSP));
        assertEquals(9, lts.getStates().size());
        assertEquals(1, lts.deadlockStates().size());
        assertEquals(par(stop(), stop()), lts.deadlockStates().iterator().next());
    }
}
