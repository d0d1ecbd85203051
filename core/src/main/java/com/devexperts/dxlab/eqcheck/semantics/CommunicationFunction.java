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

import com.devexperts.dxlab.eqcheck.Action;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Partial ACP communication function {@code gamma: Action x Action -> Action}, defined by a table.
 * Instances are immutable, {@link #define(Action, Action, Action)} returns an extended function.
 * The function must be commutative and associative, see {@link #validate()}.
 */
public class CommunicationFunction {
    /**
     * The function which is defined nowhere, so that ACP merge is pure interleaving.
     */
    public static final CommunicationFunction EMPTY = new CommunicationFunction(Collections.emptyMap());

    private final Map<Action, Map<Action, Action>> table;

    private CommunicationFunction(Map<Action, Map<Action, Action>> table) {
        this.table = table;
    }

    /**
     * Returns the function with {@code gamma(a, b) = result}.
     * Only this ordered pair is defined, use {@link #defineSymmetric(Action, Action, Action)}
     * to define {@code gamma(b, a)} as well.
     *
     * @throws IllegalArgumentException if an argument is silent or the pair is already mapped to another action.
     */
    public CommunicationFunction define(Action a, Action b, Action result) {
        if (a.isSilent() || b.isSilent())
            throw new IllegalArgumentException("Communication of the silent action cannot be defined");
        Action existing = apply(a, b);
        if (existing != null && !existing.equals(result))
            throw new IllegalArgumentException("gamma(" + a + ", " + b + ") is already defined as " + existing);
        Map<Action, Map<Action, Action>> newTable = new LinkedHashMap<>();
        table.forEach((x, row) -> newTable.put(x, new LinkedHashMap<>(row)));
        newTable.computeIfAbsent(a, x -> new LinkedHashMap<>()).put(b, result);
        return new CommunicationFunction(newTable);
    }

    public CommunicationFunction define(String a, String b, String result) {
        return define(Action.of(a), Action.of(b), Action.of(result));
    }

    public CommunicationFunction defineSymmetric(Action a, Action b, Action result) {
        return define(a, b, result).define(b, a, result);
    }

    public CommunicationFunction defineSymmetric(String a, String b, String result) {
        return defineSymmetric(Action.of(a), Action.of(b), Action.of(result));
    }

    /**
     * Returns {@code gamma(a, b)}, or {@code null} if it is undefined.
     * It is never defined on the silent action.
     */
    @Nullable
    public Action apply(Action a, Action b) {
        if (a.isSilent() || b.isSilent())
            return null;
        Map<Action, Action> row = table.get(a);
        return row == null ? null : row.get(b);
    }

    public boolean isEmpty() {
        return table.isEmpty();
    }

    /**
     * Returns the actions the table mentions, as arguments or as results.
     */
    public Set<Action> getDomain() {
        Set<Action> domain = new TreeSet<>();
        table.forEach((a, row) -> {
            domain.add(a);
            row.forEach((b, c) -> {
                domain.add(b);
                domain.add(c);
            });
        });
        return domain;
    }

    /**
     * Checks that the function is commutative and associative over its {@link #getDomain() domain},
     * where an undefined result only equals an undefined one.
     *
     * @throws IllegalArgumentException naming the offending actions if it is not.
     */
    public void validate() {
        Set<Action> domain = getDomain();
        for (Action a : domain) {
            for (Action b : domain) {
                Action ab = apply(a, b);
                Action ba = apply(b, a);
                if (!same(ab, ba)) {
                    throw new IllegalArgumentException("Communication function is not commutative: gamma("
                        + a + ", " + b + ") = " + ab + ", but gamma(" + b + ", " + a + ") = " + ba);
                }
                for (Action c : domain) {
                    Action left = ab == null ? null : apply(ab, c);
                    Action bc = apply(b, c);
                    Action right = bc == null ? null : apply(a, bc);
                    if (!same(left, right)) {
                        throw new IllegalArgumentException("Communication function is not associative: gamma(gamma("
                            + a + ", " + b + "), " + c + ") = " + left + ", but gamma(" + a + ", gamma(" + b + ", "
                            + c + ")) = " + right);
                    }
                }
            }
        }
    }

    private static boolean same(@Nullable Action x, @Nullable Action y) {
        return x == null ? y == null : x.equals(y);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("gamma{");
        String sep = "";
        for (Map.Entry<Action, Map<Action, Action>> row : table.entrySet()) {
            for (Map.Entry<Action, Action> e : row.getValue().entrySet()) {
                sb.append(sep).append('(').append(row.getKey()).append(", ").append(e.getKey()).append(") -> ")
                    .append(e.getValue());
                sep = ", ";
            }
        }
        return sb.append('}').toString();
    }
}
