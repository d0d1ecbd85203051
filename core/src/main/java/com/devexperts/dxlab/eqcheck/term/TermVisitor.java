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

/**
 * A visitor over process terms with an additional parameter of type {@code P}.
 * Every term variant has its own method, so an implementation handles all of them
 * or does not compile.
 *
 * @param <R> the result type.
 * @param <P> the parameter type, use {@link Void} if not needed.
 */
public interface TermVisitor<R, P> {
    R visitStop(Stop stop, P p);

    R visitVar(Var var, P p);

    R visitPrefix(Prefix prefix, P p);

    R visitChoice(Choice choice, P p);

    R visitParallel(Parallel parallel, P p);

    R visitRecursive(Recursive recursive, P p);
}
