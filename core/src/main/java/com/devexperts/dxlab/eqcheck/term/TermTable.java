package com.devexperts.dxlab.eqcheck.term;

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

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Interning table for terms keyed by their canonical form.
 * <p>
 * Structurally equal terms are mapped to a single instance, so that states of transition systems
 * are shared and their canonical forms are computed only once. The table is safe for concurrent use
 * and an interned term is never replaced, so one table may be shared by independent verification tasks.
 */
public class TermTable {
    private final ConcurrentMap<String, Term> terms = new ConcurrentHashMap<>();

    /**
     * Returns the interned instance equal to the specified term,
     * the term itself becomes the interned one if there is no such instance yet.
     */
    public Term intern(Term term) {
        Objects.requireNonNull(term, "term");
        Term existing = terms.putIfAbsent(term.toString(), term);
        return existing == null ? term : existing;
    }

    public boolean contains(Term term) {
        return terms.containsKey(term.toString());
    }

    public int size() {
        return terms.size();
    }
}
