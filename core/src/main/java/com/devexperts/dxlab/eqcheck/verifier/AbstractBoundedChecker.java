package com.devexperts.dxlab.eqcheck.verifier;

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
import com.devexperts.dxlab.eqcheck.CheckConfiguration;
import com.devexperts.dxlab.eqcheck.lts.Lts;
import com.devexperts.dxlab.eqcheck.lts.TauClosure;
import com.devexperts.dxlab.eqcheck.term.Term;
import com.devexperts.dxlab.eqcheck.verifier.bisimulation.JointPartition;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.TreeSet;

/**
 * Base class for the linear-time checkers. They explore the visible traces of both terms
 * at once, breadth-first, as pairs of tau-closed state sets reached after the same trace,
 * and compare the pairs up to the configured depth.
 * <p>
 * A pair of sets is explored once, the traces continuing it do not depend on how it was reached,
 * so the exploration terminates on cyclic state spaces and is exact when it stops before the depth bound.
 * A pair whose sets cover the same strong bisimulation classes has no difference after any trace
 * and is not continued, and terms with strongly bisimilar initial states are equivalent without exploration.
 * Otherwise, when no difference is found, the verdict is {@link Verdict.Outcome#INCONCLUSIVE inconclusive}.
 */
public abstract class AbstractBoundedChecker extends AbstractEquivalenceChecker {
    protected final int depth;

    protected AbstractBoundedChecker(EquivalenceKind kind, CheckConfiguration configuration) {
        super(kind, configuration);
        this.depth = configuration.depth;
    }

    public int getDepth() {
        return depth;
    }

    /**
     * Compares the state sets of both terms reached after the same trace.
     */
    protected interface Comparison {
        /**
         * Returns the witness of a difference between the state sets, {@code null} if there is none.
         * At least one of the sets is non-empty.
         */
        @Nullable
        Witness compare(List<Action> trace, Set<Term> left, Set<Term> right);

        /**
         * Returns {@code true} if the traces continuing the specified pair should be explored.
         */
        default boolean continues(Set<Term> left, Set<Term> right) {
            return true;
        }
    }

    /**
     * Returns the visible actions of both transition systems.
     */
    protected static Set<Action> jointAlphabet(Lts left, Lts right) {
        Set<Action> alphabet = new TreeSet<>(left.getVisibleActions());
        alphabet.addAll(right.getVisibleActions());
        return alphabet;
    }

    @Nullable
    protected static Term anyState(Set<Term> states) {
        return states.isEmpty() ? null : states.iterator().next();
    }

    protected Verdict explore(TauClosure left, TauClosure right, Comparison comparison) {
        JointPartition partition = JointPartition.strong(left.getLts(), right.getLts());
        if (partition.initialStatesEquivalent(left.getLts(), right.getLts()))
            return Verdict.equivalent(kind);
        Set<Action> alphabet = jointAlphabet(left.getLts(), right.getLts());
        Set<SetPair> visited = new HashSet<>();
        Queue<Node> queue = new ArrayDeque<>();
        SetPair start = new SetPair(left.closure(left.getLts().getInitial()), right.closure(right.getLts().getInitial()));
        visited.add(start);
        queue.add(new Node(Collections.emptyList(), start));
        boolean cutOff = false;
        while (!queue.isEmpty()) {
            Node node = queue.poll();
            Witness witness = comparison.compare(node.trace, node.pair.left, node.pair.right);
            if (witness != null)
                return Verdict.notEquivalent(kind, witness);
            if (!comparison.continues(node.pair.left, node.pair.right))
                continue;
            if (partition.leftBlocks(node.pair.left).equals(partition.rightBlocks(node.pair.right)))
                continue;
            for (Action a : alphabet) {
                Set<Term> leftAfter = left.weakAfter(node.pair.left, a);
                Set<Term> rightAfter = right.weakAfter(node.pair.right, a);
                if (leftAfter.isEmpty() && rightAfter.isEmpty())
                    continue;
                SetPair next = new SetPair(leftAfter, rightAfter);
                if (visited.contains(next))
                    continue;
                if (node.trace.size() >= depth) {
                    cutOff = true;
                    continue;
                }
                visited.add(next);
                List<Action> trace = new ArrayList<>(node.trace);
                trace.add(a);
                queue.add(new Node(trace, next));
            }
        }
        if (cutOff)
            return Verdict.inconclusive(kind, "no difference is found within the depth bound " + depth);
        return Verdict.equivalent(kind);
    }

    private static final class SetPair {
        final Set<Term> left;
        final Set<Term> right;

        SetPair(Set<Term> left, Set<Term> right) {
            this.left = left;
            this.right = right;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof SetPair))
                return false;
            SetPair that = (SetPair) o;
            return left.equals(that.left) && right.equals(that.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(left, right);
        }
    }

    private static final class Node {
        final List<Action> trace;
        final SetPair pair;

        Node(List<Action> trace, SetPair pair) {
            this.trace = trace;
            this.pair = pair;
        }
    }
}
