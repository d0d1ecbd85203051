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

import com.devexperts.dxlab.eqcheck.Action;

/**
 * Static factory methods for concise term construction, e.g.
 * {@code rec("X", prefix("coin", choice(prefix("coffee", var("X")), prefix("tea", var("X")))))}.
 */
public class Terms {
    private Terms() {}

    public static Stop stop() {
        return Stop.INSTANCE;
    }

    public static Var var(String name) {
        return new Var(name);
    }

    public static Prefix prefix(Action action, Term continuation) {
        return new Prefix(action, continuation);
    }

    /**
     * @param action action label, see {@link Action#of(String)}.
     */
    public static Prefix prefix(String action, Term continuation) {
        return new Prefix(Action.of(action), continuation);
    }

    /**
     * Returns the sequence of prefixes ending with {@link Stop}.
     */
    public static Term sequence(String... actions) {
        Term result = Stop.INSTANCE;
        for (int i = actions.length - 1; i >= 0; i--)
            result = prefix(actions[i], result);
        return result;
    }

    public static Choice choice(Term left, Term right) {
        return new Choice(left, right);
    }

    /**
     * Returns right-nested binary choices over the specified alternatives.
     *
     * @throws IllegalArgumentException if less than two alternatives are specified.
     */
    public static Choice choice(Term first, Term second, Term... others) {
        if (others.length == 0)
            return new Choice(first, second);
        Term tail = others[others.length - 1];
        for (int i = others.length - 2; i >= 0; i--)
            tail = new Choice(others[i], tail);
        return new Choice(first, new Choice(second, tail));
    }

    public static Parallel par(Term left, Term right) {
        return new Parallel(left, right);
    }

    public static Recursive rec(String variable, Term definition) {
        return new Recursive(variable, definition);
    }
}
