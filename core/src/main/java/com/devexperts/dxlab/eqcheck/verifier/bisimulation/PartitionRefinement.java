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
import org.jetbrains.annotations.Nullable;

import java.util.AbstractMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Computes the coarsest partition of states which is stable with respect to the transitions:
 * two states stay in one block iff for every action they reach the same set of blocks.
 * <p>
 * Starts with a single block and splits blocks by the transition signature of their states,
 * the set of {@code (action, target block)} pairs, until no block splits anymore.
 * In the first round the signature is just the set of outgoing actions.
 */
public class PartitionRefinement {
    private final List<Map<Action, Set<Integer>>> successors;
    private int[] blocks;
    private int blockCount;
    private int rounds;

    /**
     * @param successors for each state, its successors indexed by action.
     */
    public PartitionRefinement(List<Map<Action, Set<Integer>>> successors) {
        this.successors = successors;
    }

    /**
     * Refines the partition up to the fixed point and returns the block of each state.
     */
    public int[] refine() {
        int n = successors.size();
        blocks = new int[n];
        blockCount = n == 0 ? 0 : 1;
        rounds = 0;
        while (true) {
            rounds++;
            Map<Map.Entry<Integer, Map<Action, Set<Integer>>>, Integer> newBlockIds = new HashMap<>();
            int[] newBlocks = new int[n];
            for (int s = 0; s < n; s++) {
                // The current block is a part of the key, so blocks are only split, never merged
                Map.Entry<Integer, Map<Action, Set<Integer>>> key =
                    new AbstractMap.SimpleImmutableEntry<>(blocks[s], signature(s));
                Integer id = newBlockIds.get(key);
                if (id == null) {
                    id = newBlockIds.size();
                    newBlockIds.put(key, id);
                }
                newBlocks[s] = id;
            }
            blocks = newBlocks;
            if (newBlockIds.size() == blockCount)
                return blocks.clone();
            blockCount = newBlockIds.size();
        }
    }

    /**
     * Returns the target blocks of the state per action under the current partition.
     */
    public Map<Action, Set<Integer>> signature(int state) {
        Map<Action, Set<Integer>> signature = new TreeMap<>();
        successors.get(state).forEach((action, targets) -> {
            Set<Integer> targetBlocks = new TreeSet<>();
            for (int t : targets)
                targetBlocks.add(blocks[t]);
            signature.put(action, targetBlocks);
        });
        return signature;
    }

    /**
     * Returns an action whose target blocks differ for the two states in the refined partition,
     * {@code null} if their signatures coincide.
     */
    @Nullable
    public Action distinguishingAction(int x, int y) {
        Map<Action, Set<Integer>> sx = signature(x);
        Map<Action, Set<Integer>> sy = signature(y);
        Set<Action> actions = new TreeSet<>(sx.keySet());
        actions.addAll(sy.keySet());
        for (Action a : actions) {
            if (!sx.getOrDefault(a, new TreeSet<>()).equals(sy.getOrDefault(a, new TreeSet<>())))
                return a;
        }
        return null;
    }

    public int getBlockCount() {
        return blockCount;
    }

    /**
     * Returns the number of rounds the last {@link #refine()} has taken.
     */
    public int getRounds() {
        return rounds;
    }
}
