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

import com.devexperts.dxlab.eqcheck.Transition;
import com.devexperts.dxlab.eqcheck.term.Term;

import java.util.Set;

/**
 * Structural operational semantics rule. Rules derive the one-step transitions of a term
 * and may ask the engine for the transitions of its subterms.
 */
public interface SosRule {
    /**
     * Returns {@code true} if this rule can derive transitions of the specified term.
     */
    boolean appliesTo(Term term);

    /**
     * Derives the transitions of the specified term, which this rule {@link #appliesTo(Term) applies to}.
     *
     * @param engine engine to derive the transitions of subterms with.
     */
    Set<Transition> derive(Term term, SosEngine engine);
}
