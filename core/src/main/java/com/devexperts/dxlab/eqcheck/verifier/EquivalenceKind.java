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

import java.util.Arrays;
import java.util.Locale;

/**
 * Behavioural equivalence which two terms are checked against.
 */
public enum EquivalenceKind {
    TRACE("trace equivalence"),
    STRONG_BISIMULATION("strong bisimilarity"),
    WEAK_BISIMULATION("weak bisimilarity"),
    /**
     * Both {@link #MAY_TESTING may} and {@link #MUST_TESTING must} testing equivalence.
     */
    TESTING("testing equivalence"),
    MAY_TESTING("may-testing equivalence"),
    MUST_TESTING("must-testing equivalence"),
    FAILURES("failures equivalence");

    private final String description;

    EquivalenceKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Returns the kind with the specified name ignoring the case, {@code '-'} may be used instead of {@code '_'}.
     *
     * @throws IllegalArgumentException if there is no such kind.
     */
    public static EquivalenceKind forName(String name) {
        if (name != null) {
            String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
            for (EquivalenceKind kind : values()) {
                if (kind.name().equals(normalized))
                    return kind;
            }
        }
        throw new IllegalArgumentException("Unsupported equivalence kind \"" + name + "\", expected one of "
            + Arrays.toString(values()));
    }
}
