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

/**
 * Thrown by {@link LtsBuilder} when the number of discovered states exceeds the configured ceiling.
 */
public class StateSpaceLimitExceededException extends RuntimeException {
    private final int maxStates;
    private final int discoveredStates;

    public StateSpaceLimitExceededException(int maxStates, int discoveredStates) {
        super("State space exceeds " + maxStates + " states, " + discoveredStates + " states are discovered");
        this.maxStates = maxStates;
        this.discoveredStates = discoveredStates;
    }

    public int getMaxStates() {
        return maxStates;
    }

    public int getDiscoveredStates() {
        return discoveredStates;
    }
}
