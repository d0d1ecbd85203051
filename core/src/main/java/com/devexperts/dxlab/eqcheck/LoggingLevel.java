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

/**
 * Threshold of the messages {@link Reporter} prints.
 */
public enum LoggingLevel {
    /**
     * Transition system sizes, started checks and their verdicts.
     */
    INFO,
    /**
     * Inconclusive verdicts only.
     */
    WARN,
    OFF
}
