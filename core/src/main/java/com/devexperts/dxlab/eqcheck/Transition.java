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

import com.devexperts.dxlab.eqcheck.term.Term;

import java.util.Objects;

/**
 * A {@code source --action--> target} step between two process terms.
 * Transitions are compared structurally by all three components.
 */
public final class Transition {
    private final Term source;
    private final Action action;
    private final Term target;

    public Transition(Term source, Action action, Term target) {
        this.source = Objects.requireNonNull(source, "source");
        this.action = Objects.requireNonNull(action, "action");
        this.target = Objects.requireNonNull(target, "target");
    }

    public Term getSource() {
        return source;
    }

    public Action getAction() {
        return action;
    }

    public Term getTarget() {
        return target;
    }

    /**
     * Returns the same step performed from the specified source,
     * used when a composite term inherits the steps of its operand.
     */
    public Transition withSource(Term newSource) {
        return newSource.equals(source) ? this : new Transition(newSource, action, target);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        Transition that = (Transition) o;
        return action.equals(that.action) && source.equals(that.source) && target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, action, target);
    }

    @Override
    public String toString() {
        return source + " --" + action + "--> " + target;
    }
}
