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

import com.devexperts.dxlab.eqcheck.lts.LtsBuilder;
import com.devexperts.dxlab.eqcheck.semantics.CommunicationFunction;
import com.devexperts.dxlab.eqcheck.semantics.SemanticModel;
import com.devexperts.dxlab.eqcheck.semantics.SosEngine;
import com.devexperts.dxlab.eqcheck.term.TermTable;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Validated configuration of verification tasks, see {@link CheckOptions} for the meaning of the parameters.
 * The SOS engine is created and checked when the configuration is created, before any exploration starts.
 * The synchronization alphabet and the communication function are validated whatever the semantic model is.
 */
public class CheckConfiguration {
    public static final int DEFAULT_DEPTH = 10;
    public static final int DEFAULT_MAX_STATES = 100_000;
    public static final SemanticModel DEFAULT_SEMANTIC_MODEL = SemanticModel.CCS;

    public final SemanticModel semanticModel;
    public final int depth;
    public final int maxStates;
    public final Set<Action> synchronizationAlphabet;
    public final CommunicationFunction communicationFunction;
    public final TermTable termTable;
    public final Reporter reporter;
    private final SosEngine engine;

    CheckConfiguration(SemanticModel semanticModel, int depth, int maxStates, Set<Action> synchronizationAlphabet,
        CommunicationFunction communicationFunction, TermTable termTable, LoggingLevel logLevel)
    {
        if (depth <= 0)
            throw new IllegalArgumentException("Exploration depth should be positive, " + depth + " is specified");
        if (maxStates <= 0)
            throw new IllegalArgumentException("State count ceiling should be positive, " + maxStates + " is specified");
        if (synchronizationAlphabet.contains(Action.TAU))
            throw new IllegalArgumentException("Synchronization alphabet cannot contain the silent action");
        communicationFunction.validate();
        this.semanticModel = semanticModel;
        this.depth = depth;
        this.maxStates = maxStates;
        this.synchronizationAlphabet = Collections.unmodifiableSet(new TreeSet<>(synchronizationAlphabet));
        this.communicationFunction = communicationFunction;
        this.termTable = termTable;
        this.reporter = new Reporter(logLevel);
        this.engine = SosEngine.forModel(semanticModel, this.synchronizationAlphabet, communicationFunction);
    }

    public SosEngine getEngine() {
        return engine;
    }

    /**
     * Returns a new builder, builders are cheap and are not shared between verification tasks.
     */
    public LtsBuilder createBuilder() {
        return new LtsBuilder(engine, termTable, maxStates, reporter);
    }
}
