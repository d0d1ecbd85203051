package com.devexperts.dxlab.eqcheck.semantics;

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

import java.util.Arrays;
import java.util.Locale;

/**
 * Process algebra whose rules define the transitions of parallel composition.
 * Prefix, choice and recursion have the same rules in all of them.
 */
public enum SemanticModel {
    /**
     * Interleaving plus synchronization of complementary actions into {@code tau}.
     */
    CCS,
    /**
     * Rendezvous on a synchronization alphabet, the synchronized action stays visible.
     */
    CSP,
    /**
     * Merge of left merges and the communication merge driven by a communication function.
     */
    ACP;

    /**
     * Returns the model with the specified name ignoring the case.
     *
     * @throws IllegalArgumentException if there is no such model.
     */
    public static SemanticModel forName(String name) {
        if (name != null) {
            String upperCase = name.trim().toUpperCase(Locale.ROOT);
            for (SemanticModel model : values()) {
                if (model.name().equals(upperCase))
                    return model;
            }
        }
        throw new IllegalArgumentException("Unknown semantic model \"" + name + "\", expected one of "
            + Arrays.toString(values()));
    }
}
