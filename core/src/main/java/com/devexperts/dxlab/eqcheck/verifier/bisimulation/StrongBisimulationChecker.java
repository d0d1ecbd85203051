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

import com.devexperts.dxlab.eqcheck.CheckConfiguration;
import com.devexperts.dxlab.eqcheck.lts.Lts;
import com.devexperts.dxlab.eqcheck.verifier.EquivalenceKind;

/**
 * Strong bisimilarity: every step, silent ones included, is matched by a step with the same action
 * leading to bisimilar states.
 */
public class StrongBisimulationChecker extends AbstractBisimulationChecker {
    public StrongBisimulationChecker(CheckConfiguration configuration) {
        super(EquivalenceKind.STRONG_BISIMULATION, configuration);
    }

    @Override
    protected JointPartition.Successors successors(Lts lts) {
        return JointPartition.strongSuccessors(lts);
    }
}
