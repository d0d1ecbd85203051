package com.devexperts.dxlab.eqcheck.semantics.acp;

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
import com.devexperts.dxlab.eqcheck.semantics.CommunicationFunction;
import com.devexperts.dxlab.eqcheck.semantics.SosEngine;
import com.devexperts.dxlab.eqcheck.term.Parallel;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * ACP merge {@code x || y = x |_ y + y |_ x + x | y}, where {@code x |_ y} is the left merge
 * (the left operand moves first) and {@code x | y} is the communication merge: if {@code x --a--> x'},
 * {@code y --b--> y'} and {@code gamma(a, b) = c} is defined then {@code x | y --c--> x' || y'}.
 */
public class AcpMergeRule extends AbstractParallelRule {
    private final CommunicationFunction gamma;

    public AcpMergeRule(CommunicationFunction gamma) {
        this.gamma = Objects.requireNonNull(gamma, "gamma");
    }

    public CommunicationFunction getCommunicationFunction() {
        return gamma;
    }

    @Override
    public Set<Transition> visitParallel(Parallel p, SosEngine engine) {
        Set<Transition> leftSteps = engine.transitions(p.getLeft());
        Set<Transition> rightSteps = engine.transitions(p.getRight());
        Set<Transition> result = new LinkedHashSet<>(leftMerge(p, leftSteps));
        result.addAll(rightMerge(p, rightSteps));
        result.addAll(communicationMerge(p, leftSteps, rightSteps));
        return Collections.unmodifiableSet(result);
    }

    /**
     * Returns the steps of {@code x |_ y}, where the left operand performs the first action.
     *
     * @param leftSteps one-step transitions of the left operand.
     */
    public Set<Transition> leftMerge(Parallel p, Set<Transition> leftSteps) {
        Set<Transition> result = new LinkedHashSet<>();
        addLeftSteps(p, leftSteps, result);
        return result;
    }

    /**
     * Returns the steps of {@code y |_ x}.
     *
     * @param rightSteps one-step transitions of the right operand.
     */
    public Set<Transition> rightMerge(Parallel p, Set<Transition> rightSteps) {
        Set<Transition> result = new LinkedHashSet<>();
        addRightSteps(p, rightSteps, result);
        return result;
    }

    /**
     * Returns the steps of {@code x | y}.
     */
    public Set<Transition> communicationMerge(Parallel p, Set<Transition> leftSteps, Set<Transition> rightSteps) {
        Set<Transition> result = new LinkedHashSet<>();
        if (gamma.isEmpty())
            return result;
        for (Transition l : leftSteps) {
            for (Transition r : rightSteps) {
                Action c = gamma.apply(l.getAction(), r.getAction());
                if (c != null)
                    result.add(synchronize(p, l, r, c));
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "AcpMergeRule" + gamma;
    }
}
