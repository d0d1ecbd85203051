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

import com.devexperts.dxlab.eqcheck.semantics.CommunicationFunction;
import com.devexperts.dxlab.eqcheck.semantics.SemanticModel;
import com.devexperts.dxlab.eqcheck.term.TermTable;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Fluent options of verification tasks, {@link #createConfiguration()} validates them.
 */
public class CheckOptions {
    protected SemanticModel semanticModel = CheckConfiguration.DEFAULT_SEMANTIC_MODEL;
    protected int depth = CheckConfiguration.DEFAULT_DEPTH;
    protected int maxStates = CheckConfiguration.DEFAULT_MAX_STATES;
    protected Set<Action> synchronizationAlphabet = new LinkedHashSet<>();
    protected CommunicationFunction communicationFunction = CommunicationFunction.EMPTY;
    protected TermTable termTable;
    protected LoggingLevel logLevel = Reporter.DEFAULT_LOG_LEVEL;

    /**
     * Semantic model which defines the transitions of parallel composition
     */
    public CheckOptions semanticModel(SemanticModel semanticModel) {
        this.semanticModel = semanticModel;
        return this;
    }

    /**
     * Semantic model by its name, see {@link SemanticModel#forName(String)}
     */
    public CheckOptions semanticModel(String semanticModel) {
        return semanticModel(SemanticModel.forName(semanticModel));
    }

    /**
     * Maximal length of the traces explored by trace, testing and failures checks
     */
    public CheckOptions depth(int depth) {
        this.depth = depth;
        return this;
    }

    /**
     * Maximal number of states of a transition system
     */
    public CheckOptions maxStates(int maxStates) {
        this.maxStates = maxStates;
        return this;
    }

    /**
     * Add actions to the CSP synchronization alphabet
     */
    public CheckOptions synchronizeOn(String... actions) {
        for (String a : actions)
            synchronizationAlphabet.add(Action.of(a));
        return this;
    }

    public CheckOptions synchronizationAlphabet(Set<Action> alphabet) {
        this.synchronizationAlphabet = new LinkedHashSet<>(alphabet);
        return this;
    }

    /**
     * ACP communication function
     */
    public CheckOptions communicationFunction(CommunicationFunction communicationFunction) {
        this.communicationFunction = communicationFunction;
        return this;
    }

    /**
     * Interning table for states, a new one is used by every configuration if it is not specified
     */
    public CheckOptions termTable(TermTable termTable) {
        this.termTable = termTable;
        return this;
    }

    public CheckOptions logLevel(LoggingLevel logLevel) {
        this.logLevel = logLevel;
        return this;
    }

    /**
     * @throws IllegalArgumentException if an option is missing or invalid, the synchronization alphabet
     *                                  contains {@code tau}, or the communication function is not
     *                                  commutative and associative.
     */
    public CheckConfiguration createConfiguration() {
        if (semanticModel == null)
            throw new IllegalArgumentException("Semantic model is not specified");
        if (communicationFunction == null)
            throw new IllegalArgumentException("Communication function is not specified");
        if (logLevel == null)
            throw new IllegalArgumentException("Logging level is not specified");
        return new CheckConfiguration(semanticModel, depth, maxStates, synchronizationAlphabet, communicationFunction,
            termTable != null ? termTable : new TermTable(), logLevel);
    }
}
