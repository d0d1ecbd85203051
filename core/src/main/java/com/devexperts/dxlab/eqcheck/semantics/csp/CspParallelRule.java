package com.devexperts.dxlab.eqcheck.semantics.csp;

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
import java.util.TreeSet;

/**
 * CSP alphabetized parallel composition. An action of the synchronization alphabet
 * fires only when both operands perform it, and the composition performs the same
 * visible action. Other actions, {@code tau} included, interleave.
 * Nested compositions synchronize all their participants this way.
 */
public class CspParallelRule extends AbstractParallelRule {
    private final Set<Action> alphabet;

    /**
     * @throws IllegalArgumentException if the alphabet contains {@link Action#TAU}.
     */
    public CspParallelRule(Set<Action> alphabet) {
        if (alphabet.contains(Action.TAU))
            throw new IllegalArgumentException("Synchronization alphabet cannot contain the silent action");
        this.alphabet = Collections.unmodifiableSet(new TreeSet<>(alphabet));
    }

    public Set<Action> getAlphabet() {
        return alphabet;
    }

    @Override
    public Set<Transition> visitParallel(Parallel p, SosEngine engine) {
        Set<Transition> leftSteps = engine.transitions(p.getLeft());
        Set<Transition> rightSteps = engine.transitions(p.getRight());
        Set<Transition> leftFree = new LinkedHashSet<>();
        Set<Transition> rightFree = new LinkedHashSet<>();
        Set<Transition> result = new LinkedHashSet<>();
        for (Transition l : leftSteps) {
            if (!alphabet.contains(l.getAction()))
                leftFree.add(l);
        }
        for (Transition r : rightSteps) {
            if (!alphabet.contains(r.getAction()))
                rightFree.add(r);
        }
        addLeftSteps(p, leftFree, result);
        addRightSteps(p, rightFree, result);
        for (Transition l : leftSteps) {
            if (!alphabet.contains(l.getAction()))
                continue;
            for (Transition r : rightSteps) {
                if (l.getAction().equals(r.getAction()))
                    result.add(synchronize(p, l, r, l.getAction()));
            }
        }
        return Collections.unmodifiableSet(result);
    }

    @Override
    public String toString() {
        return "CspParallelRule" + alphabet;
    }
}
