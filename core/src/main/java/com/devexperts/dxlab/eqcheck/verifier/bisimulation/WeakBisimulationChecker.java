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
import com.devexperts.dxlab.eqcheck.lts.TauClosure;
import com.devexperts.dxlab.eqcheck.term.Term;
import com.devexperts.dxlab.eqcheck.verifier.EquivalenceKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Weak bisimilarity: strong bisimilarity of the saturated transition systems, where a visible
 * {@code a} step is {@code tau* a tau*} and a silent step is {@code tau*}, zero steps included.
 * Silent steps thus never have to be matched one-for-one.
 */
public class WeakBisimulationChecker extends AbstractBisimulationChecker {
    public WeakBisimulationChecker(CheckConfiguration configuration) {
        super(EquivalenceKind.WEAK_BISIMULATION, configuration);
    }

    @Override
    protected JointPartition.Successors successors(Lts lts) {
        TauClosure closure = new TauClosure(lts);
        Set<Action> alphabet = lts.getVisibleActions();
        return state -> {
            Map<Action, Set<Term>> result = new LinkedHashMap<>();
            result.put(Action.TAU, closure.closure(state));
            for (Action a : alphabet) {
                Set<Term> after = closure.weakAfter(Collections.singleton(state), a);
                if (!after.isEmpty())
                    result.put(a, after);
            }
            return result;
        };
    }
}
