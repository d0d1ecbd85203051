package com.devexperts.dxlab.eqcheck.verifier.bisimulation;

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
import com.devexperts.dxlab.eqcheck.lts.Lts;
import com.devexperts.dxlab.eqcheck.term.Term;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Bisimulation classes of the states of two transition systems, computed by
 * {@link PartitionRefinement} over their disjoint union. A state which belongs
 * to both systems gets a separate number on each side.
 */
public class JointPartition {
    private final Map<Term, Integer> leftIds;
    private final Map<Term, Integer> rightIds;
    private final PartitionRefinement refinement;
    private final int[] blocks;

    /**
     * Returns the successors to be matched of a state.
     */
    public interface Successors {
        Map<Action, Set<Term>> of(Term state);
    }

    public JointPartition(Lts left, Successors leftSuccessors, Lts right, Successors rightSuccessors) {
        leftIds = index(left, 0);
        rightIds = index(right, leftIds.size());
        List<Map<Action, Set<Integer>>> graph = new ArrayList<>();
        addStates(left, leftSuccessors, leftIds, graph);
        addStates(right, rightSuccessors, rightIds, graph);
        refinement = new PartitionRefinement(graph);
        blocks = refinement.refine();
    }

    /**
     * Returns the strong bisimulation classes, every step is matched by a step with the same action.
     */
    public static JointPartition strong(Lts left, Lts right) {
        return new JointPartition(left, strongSuccessors(left), right, strongSuccessors(right));
    }

    static Successors strongSuccessors(Lts lts) {
        return state -> {
            Map<Action, Set<Term>> result = new LinkedHashMap<>();
            for (Action a : lts.actionsFrom(state))
                result.put(a, lts.targetsOf(state, a));
            return result;
        };
    }

    public boolean initialStatesEquivalent(Lts left, Lts right) {
        return leftBlock(left.getInitial()) == rightBlock(right.getInitial());
    }

    public int leftBlock(Term state) {
        return blocks[leftIds.get(state)];
    }

    public int rightBlock(Term state) {
        return blocks[rightIds.get(state)];
    }

    public Set<Integer> leftBlocks(Set<Term> states) {
        Set<Integer> result = new HashSet<>();
        for (Term s : states)
            result.add(leftBlock(s));
        return result;
    }

    public Set<Integer> rightBlocks(Set<Term> states) {
        Set<Integer> result = new HashSet<>();
        for (Term s : states)
            result.add(rightBlock(s));
        return result;
    }

    /**
     * Returns an action whose target blocks differ for the two states, {@code null} if their signatures coincide.
     */
    @Nullable
    public Action distinguishingAction(Term leftState, Term rightState) {
        return refinement.distinguishingAction(leftIds.get(leftState), rightIds.get(rightState));
    }

    private static Map<Term, Integer> index(Lts lts, int offset) {
        Map<Term, Integer> ids = new HashMap<>();
        for (Term s : lts.getStates())
            ids.put(s, offset + ids.size());
        return ids;
    }

    private static void addStates(Lts lts, Successors successors, Map<Term, Integer> ids,
                                  List<Map<Action, Set<Integer>>> graph)
    {
        for (Term s : lts.getStates()) {
            Map<Action, Set<Integer>> edges = new LinkedHashMap<>();
            successors.of(s).forEach((action, targets) -> {
                Set<Integer> targetIds = new LinkedHashSet<>();
                for (Term t : targets)
                    targetIds.add(ids.get(t));
                edges.put(action, targetIds);
            });
            graph.add(edges);
        }
    }
}
