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
import com.devexperts.dxlab.eqcheck.EqChecker;
import com.devexperts.dxlab.eqcheck.semantics.SemanticModel;
import com.devexperts.dxlab.eqcheck.term.Term;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;

import static com.devexperts.dxlab.eqcheck.term.Terms.*;
import static org.junit.Assert.*;

public class TauClosureTest {
    private final Action a = Action.of("a");
    private final Action b = Action.of("b");

    @Test
    public void testClosure() {
        Term t = prefix("tau", prefix("tau", prefix("a", stop())));
        TauClosure closure = new TauClosure(EqChecker.buildLts(t, SemanticModel.CCS));
        assertEquals(new HashSet<>(Arrays.asList(t, prefix("tau", prefix("a", stop())), prefix("a", stop()))),
            closure.closure(t));
        assertEquals(Collections.singleton(stop()), closure.weakAfter(Collections.singleton(t), a));
        assertEquals(closure.closure(t), closure.weakAfter(Collections.singleton(t), Action.TAU));
        assertTrue(closure.weakAfter(Collections.singleton(t), b).isEmpty());
        assertFalse(closure.isStable(t));
        assertTrue(closure.isStable(prefix("a", stop())));
        assertEquals(Collections.singleton(a), closure.initials(prefix("a", stop())));
        assertTrue(closure.initials(t).isEmpty());
    }

    @Test
    public void testWeakStepEndsWithSilentSteps() {
        Term t = prefix("a", prefix("tau", prefix("b", stop())));
        TauClosure closure = new TauClosure(EqChecker.buildLts(t, SemanticModel.CCS));
        assertEquals(new HashSet<>(Arrays.asList(prefix("tau", prefix("b", stop())), prefix("b", stop()))),
            closure.weakAfter(Collections.singleton(t), a));
    }

    @Test
    public void testDivergence() {
        Term loop = rec("X", prefix("tau", var("X")));
        Term t = prefix("a", loop);
        TauClosure closure = new TauClosure(EqChecker.buildLts(choice(t, prefix("tau", loop)), SemanticModel.CCS));
        assertTrue(closure.isDivergent(loop));
        assertFalse(closure.isDivergent(t));
        assertTrue(closure.isDivergent(choice(t, prefix("tau", loop))));
        assertTrue(closure.isDivergent(Arrays.asList(t, loop)));
    }

    @Test
    public void testNoDivergenceWithoutCycle() {
        Term t = prefix("tau", prefix("tau", stop()));
        TauClosure closure = new TauClosure(EqChecker.buildLts(t, SemanticModel.CCS));
        assertFalse(closure.isDivergent(t));
    }
}
