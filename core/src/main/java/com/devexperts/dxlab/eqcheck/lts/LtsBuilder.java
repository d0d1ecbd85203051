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
import com.devexperts.dxlab.eqcheck.Reporter;
import com.devexperts.dxlab.eqcheck.Transition;
import com.devexperts.dxlab.eqcheck.semantics.SosEngine;
import com.devexperts.dxlab.eqcheck.term.Term;
import com.devexperts.dxlab.eqcheck.term.TermTable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Explores the reachable configurations of a term breadth-first and collects them into an {@link Lts}.
 * States are interned by their canonical form and every state is expanded once,
 * so the exploration terminates on finite-state terms.
 */
public class LtsBuilder {
    private final SosEngine engine;
    private final TermTable termTable;
    private final int maxStates;
    private final Reporter reporter;

    public LtsBuilder(SosEngine engine, TermTable termTable, int maxStates, Reporter reporter) {
        if (maxStates <= 0)
            throw new IllegalArgumentException("State count ceiling should be positive, " + maxStates + " is specified");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.termTable = Objects.requireNonNull(termTable, "termTable");
        this.maxStates = maxStates;
        this.reporter = Objects.requireNonNull(reporter, "reporter");
    }

    public SosEngine getEngine() {
        return engine;
    }

    /**
     * @throws StateSpaceLimitExceededException if the term has more reachable states than the ceiling.
     * @throws IllegalArgumentException if a reachable term contains an unguarded recursion.
     */
    public Lts build(Term term) {
        Term initial = termTable.intern(Objects.requireNonNull(term, "term"));
        Set<Term> states = new LinkedHashSet<>();
        Set<Action> actions = new LinkedHashSet<>();
        TransitionRelation relation = new TransitionRelation();
        Deque<Term> worklist = new ArrayDeque<>();
        states.add(initial);
        worklist.add(initial);
        while (!worklist.isEmpty()) {
            Term state = worklist.poll();
            for (Transition t : engine.transitions(state)) {
                Term target = termTable.intern(t.getTarget());
                if (states.add(target)) {
                    if (states.size() > maxStates)
                        throw new StateSpaceLimitExceededException(maxStates, states.size());
                    worklist.add(target);
                }
                actions.add(t.getAction());
                relation.add(state, t.getAction(), target);
            }
        }
        Lts lts = new Lts(initial, states, actions, relation);
        reporter.logLtsBuilt(engine.getModel(), lts);
        return lts;
    }
}
