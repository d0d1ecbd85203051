package com.devexperts.dxlab.eqcheck.verifier.failures;

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
import com.devexperts.dxlab.eqcheck.verifier.Witness;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A pair {@code (trace, refusal)}: after the trace the process may reach a stable state
 * which cannot perform any of the refused actions.
 */
public final class Failure {
    private final List<Action> trace;
    private final Set<Action> refusal;

    public Failure(List<Action> trace, Set<Action> refusal) {
        this.trace = Collections.unmodifiableList(new ArrayList<>(trace));
        this.refusal = Collections.unmodifiableSet(new TreeSet<>(refusal));
    }

    public List<Action> getTrace() {
        return trace;
    }

    public Set<Action> getRefusal() {
        return refusal;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Failure failure = (Failure) o;
        return trace.equals(failure.trace) && refusal.equals(failure.refusal);
    }

    @Override
    public int hashCode() {
        return 31 * trace.hashCode() + refusal.hashCode();
    }

    @Override
    public String toString() {
        return "(" + Witness.traceToString(trace) + ", " + Witness.actionsToString(refusal) + ")";
    }
}
