package com.devexperts.dxlab.eqcheck.semantics.ccs;

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
import com.devexperts.dxlab.eqcheck.semantics.AbstractParallelRule;
import com.devexperts.dxlab.eqcheck.semantics.SosEngine;
import com.devexperts.dxlab.eqcheck.term.Parallel;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * CCS parallel composition: both operands step independently, and complementary
 * actions {@code a} and {@code 'a} of the operands synchronize into {@code tau}.
 * When both the interleaved steps and the synchronization are possible, all of them are kept.
 */
public class CcsParallelRule extends AbstractParallelRule {
    @Override
    public Set<Transition> visitParallel(Parallel p, SosEngine engine) {
        Set<Transition> leftSteps = engine.transitions(p.getLeft());
        Set<Transition> rightSteps = engine.transitions(p.getRight());
        Set<Transition> result = new LinkedHashSet<>();
        addLeftSteps(p, leftSteps, result);
        addRightSteps(p, rightSteps, result);
        for (Transition l : leftSteps) {
            for (Transition r : rightSteps) {
                if (l.getAction().isComplementOf(r.getAction()))
                    result.add(synchronize(p, l, r, Action.TAU));
            }
        }
        return Collections.unmodifiableSet(result);
    }
}
