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
import com.devexperts.dxlab.eqcheck.term.Term;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Evidence that two terms are not equivalent: the trace after which the difference shows up,
 * the pair of states exposing it and, for testing and failures, the set of actions of the
 * distinguishing test or refusal.
 */
public final class Witness {
    private final List<Action> trace;
    private final Term leftState;
    private final Term rightState;
    private final Set<Action> actions;
    private final String description;

    public Witness(List<Action> trace, @Nullable Term leftState, @Nullable Term rightState,
                   @Nullable Set<Action> actions, String description)
    {
        this.trace = Collections.unmodifiableList(new ArrayList<>(trace));
        this.leftState = leftState;
        this.rightState = rightState;
        this.actions = actions == null ? null : Collections.unmodifiableSet(new TreeSet<>(actions));
        this.description = description;
    }

    @NotNull
    public List<Action> getTrace() {
        return trace;
    }

    /**
     * Returns the state of the left term the difference is exposed in,
     * {@code null} if the left term cannot perform the {@link #getTrace() trace}.
     */
    @Nullable
    public Term getLeftState() {
        return leftState;
    }

    @Nullable
    public Term getRightState() {
        return rightState;
    }

    @Nullable
    public Set<Action> getActions() {
        return actions;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Returns the trace as {@code a.b.c}, the empty trace is {@code <empty>}.
     */
    public static String traceToString(List<Action> trace) {
        if (trace.isEmpty())
            return "<empty>";
        return trace.stream().map(Action::toString).collect(Collectors.joining("."));
    }

    public static String actionsToString(Set<Action> actions) {
        return actions.stream().sorted().map(Action::toString).collect(Collectors.joining(", ", "{", "}"));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(description);
        sb.append(" [trace: ").append(traceToString(trace));
        if (leftState != null || rightState != null)
            sb.append(", states: ").append(leftState).append(" / ").append(rightState);
        return sb.append(']').toString();
    }
}
