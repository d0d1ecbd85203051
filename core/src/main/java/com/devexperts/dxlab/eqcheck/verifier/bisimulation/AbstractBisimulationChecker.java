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
import com.devexperts.dxlab.eqcheck.CheckConfiguration;
import com.devexperts.dxlab.eqcheck.lts.Lts;
import com.devexperts.dxlab.eqcheck.verifier.AbstractEquivalenceChecker;
import com.devexperts.dxlab.eqcheck.verifier.EquivalenceKind;
import com.devexperts.dxlab.eqcheck.verifier.Verdict;
import com.devexperts.dxlab.eqcheck.verifier.Witness;

import java.util.Collections;
import java.util.List;

/**
 * Decides bisimilarity by {@link PartitionRefinement partition refinement} over the disjoint union
 * of both transition systems. Subclasses define which transitions are matched.
 */
public abstract class AbstractBisimulationChecker extends AbstractEquivalenceChecker {
    protected AbstractBisimulationChecker(EquivalenceKind kind, CheckConfiguration configuration) {
        super(kind, configuration);
    }

    /**
     * Returns a function which gives the successors to be matched of every state of the transition system.
     */
    protected abstract JointPartition.Successors successors(Lts lts);

    @Override
    public Verdict check(Lts left, Lts right) {
        JointPartition partition = new JointPartition(left, successors(left), right, successors(right));
        if (partition.initialStatesEquivalent(left, right))
            return Verdict.equivalent(kind);
        Action a = partition.distinguishingAction(left.getInitial(), right.getInitial());
        List<Action> trace = a == null || a.isSilent() ? Collections.emptyList() : Collections.singletonList(a);
        String description = "initial states are distinguished by " + kind.getDescription()
            + (a == null ? "" : ", their " + a + " steps cannot be matched");
        return Verdict.notEquivalent(kind,
            new Witness(trace, left.getInitial(), right.getInitial(), null, description));
    }
}
