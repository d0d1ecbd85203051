package com.devexperts.dxlab.eqcheck;

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

import com.devexperts.dxlab.eqcheck.lts.Lts;
import com.devexperts.dxlab.eqcheck.semantics.CommunicationFunction;
import com.devexperts.dxlab.eqcheck.semantics.SemanticModel;
import com.devexperts.dxlab.eqcheck.term.Term;
import com.devexperts.dxlab.eqcheck.verifier.EquivalenceKind;
import com.devexperts.dxlab.eqcheck.verifier.Verdict;
import com.devexperts.dxlab.eqcheck.verifier.bisimulation.WeakBisimulationChecker;
import com.devexperts.dxlab.eqcheck.verifier.testing.TestingEquivalenceChecker;
import org.junit.Test;

import static com.devexperts.dxlab.eqcheck.term.Terms.*;
import static org.junit.Assert.*;

public class EqCheckerTest {
    @Test
    public void testBuildLts() {
        Lts lts = EqChecker.buildLts(par(prefix("a", stop()), prefix("'a", stop())), SemanticModel.CCS);
        assertEquals(4, lts.getStates().size());
        assertTrue(lts.hasSilentTransitions());
        Lts csp = EqChecker.buildLts(par(prefix("a", stop()), prefix("'a", stop())), SemanticModel.CSP);
        assertFalse(csp.hasSilentTransitions());
    }

    @Test
    public void testDefaultOptions() {
        CheckConfiguration configuration = new CheckOptions().createConfiguration();
        assertEquals(CheckConfiguration.DEFAULT_DEPTH, configuration.depth);
        assertEquals(CheckConfiguration.DEFAULT_MAX_STATES, configuration.maxStates);
        assertEquals(SemanticModel.CCS, configuration.semanticModel);
        assertEquals(LoggingLevel.WARN, configuration.reporter.getLogLevel());
        assertTrue(configuration.synchronizationAlphabet.isEmpty());
        assertNotSame(configuration.termTable, new CheckOptions().createConfiguration().termTable);
    }

    @Test
    public void testCreateChecker() {
        CheckConfiguration configuration = new CheckOptions().createConfiguration();
        assertTrue(EqChecker.createChecker(EquivalenceKind.WEAK_BISIMULATION, configuration) instanceof WeakBisimulationChecker);
        assertTrue(EqChecker.createChecker(EquivalenceKind.MUST_TESTING, configuration) instanceof TestingEquivalenceChecker);
        for (EquivalenceKind kind : EquivalenceKind.values())
            assertEquals(kind, EqChecker.createChecker(kind, configuration).getKind());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoKind() {
        EqChecker.checkEquivalence(stop(), stop(), null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveDepth() {
        EqChecker.checkEquivalence(stop(), stop(), EquivalenceKind.TRACE, new CheckOptions().depth(0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveMaxStates() {
        new CheckOptions().maxStates(-1).createConfiguration();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoSemanticModel() {
        new CheckOptions().semanticModel((SemanticModel) null).createConfiguration();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownSemanticModel() {
        new CheckOptions().semanticModel("pi");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSilentSynchronization() {
        new CheckOptions().semanticModel(SemanticModel.CSP).synchronizeOn("tau").createConfiguration();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSilentSynchronizationOutsideCsp() {
        new CheckOptions().semanticModel(SemanticModel.CCS).synchronizeOn("tau").createConfiguration();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonCommutativeCommunicationOutsideAcp() {
        new CheckOptions().semanticModel(SemanticModel.CSP)
            .communicationFunction(CommunicationFunction.EMPTY.define("send", "receive", "comm"))
            .createConfiguration();
    }

    @Test
    public void testStateLimitGivesInconclusiveVerdict() {
        Term counter = rec("X", prefix("a", par(var("X"), prefix("b", stop()))));
        Verdict verdict = EqChecker.checkEquivalence(counter, counter, EquivalenceKind.STRONG_BISIMULATION,
            new CheckOptions().maxStates(20).logLevel(LoggingLevel.OFF));
        assertTrue(verdict.isInconclusive());
        assertTrue(verdict.getReason(), verdict.getReason().contains("20"));
    }

    @Test
    public void testCheckOnTransitionSystems() {
        CheckConfiguration configuration = new CheckOptions().createConfiguration();
        Lts left = configuration.createBuilder().build(prefix("tau", prefix("a", stop())));
        Lts right = configuration.createBuilder().build(prefix("a", stop()));
        assertTrue(EqChecker.createChecker(EquivalenceKind.WEAK_BISIMULATION, configuration).check(left, right).isEquivalent());
        assertTrue(EqChecker.createChecker(EquivalenceKind.STRONG_BISIMULATION, configuration).check(left, right).isNotEquivalent());
    }
}
