package com.devexperts.dxlab.eqcheck;

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

import org.jetbrains.annotations.NotNull;

import java.util.regex.Pattern;

/**
 * An action label of a transition.
 * <p>
 * There is one distinguished {@link #TAU silent action}, which represents an internal step
 * that cannot be observed. Every other action is either a name {@code a} or a co-name {@code 'a};
 * a name and its co-name are {@link #complement() complementary} and synchronize in CCS.
 */
public final class Action implements Comparable<Action> {
    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_]+");
    private static final String TAU_NAME = "tau";
    private static final char CO_NAME_MARK = '\'';

    /**
     * The silent action.
     */
    public static final Action TAU = new Action(TAU_NAME, false);

    private final String name;
    private final boolean coName;

    private Action(String name, boolean coName) {
        this.name = name;
        this.coName = coName;
    }

    /**
     * Returns the action with the specified label.
     * A leading {@code '} denotes a co-name, {@code "tau"} denotes the silent action.
     *
     * @throws IllegalArgumentException if the label is not a valid action label.
     */
    @NotNull
    public static Action of(String label) {
        if (label == null)
            throw new IllegalArgumentException("Action label is null");
        if (TAU_NAME.equals(label))
            return TAU;
        boolean coName = !label.isEmpty() && label.charAt(0) == CO_NAME_MARK;
        String name = coName ? label.substring(1) : label;
        if (!NAME.matcher(name).matches() || TAU_NAME.equals(name)) {
            throw new IllegalArgumentException("Invalid action label \"" + label
                + "\": letters, digits and '_' are expected, optionally prefixed with '");
        }
        return new Action(name, coName);
    }

    public boolean isSilent() {
        return this == TAU;
    }

    public boolean isCoName() {
        return coName;
    }

    /**
     * Returns the name without the co-name mark.
     */
    public String getName() {
        return name;
    }

    /**
     * Returns {@code 'a} for {@code a} and {@code a} for {@code 'a}.
     *
     * @throws IllegalStateException for the silent action.
     */
    @NotNull
    public Action complement() {
        if (isSilent())
            throw new IllegalStateException("The silent action has no complement");
        return new Action(name, !coName);
    }

    public boolean isComplementOf(Action other) {
        return !isSilent() && !other.isSilent() && name.equals(other.name) && coName != other.coName;
    }

    @Override
    public int compareTo(Action other) {
        return toString().compareTo(other.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Action action = (Action) o;
        return coName == action.coName && name.equals(action.name);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + (coName ? 1 : 0);
    }

    @Override
    public String toString() {
        return coName ? CO_NAME_MARK + name : name;
    }
}
