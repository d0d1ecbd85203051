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
import com.devexperts.dxlab.eqcheck.Transition;
import com.devexperts.dxlab.eqcheck.semantics.acp.AcpMergeRule;
import com.devexperts.dxlab.eqcheck.semantics.ccs.CcsParallelRule;
import com.devexperts.dxlab.eqcheck.semantics.csp.CspParallelRule;
import com.devexperts.dxlab.eqcheck.term.Term;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Derives the one-step transitions of terms with the rules of one semantic model.
 * The result is the union of the transitions derived by all the rules which apply to the term,
 * it does not depend on the order of rules. A term no rule applies to has no transitions.
 * <p>
 * Engines are immutable and can be shared between threads.
 */
public class SosEngine {
    private final SemanticModel model;
    private final List<SosRule> rules;

    private SosEngine(SemanticModel model, List<SosRule> rules) {
        this.model = model;
        this.rules = Collections.unmodifiableList(rules);
    }

    /**
     * Returns the engine for the model with the empty CSP synchronization alphabet
     * and the empty ACP communication function.
     */
    public static SosEngine forModel(SemanticModel model) {
        return forModel(model, Collections.emptySet(), CommunicationFunction.EMPTY);
    }

    /**
     * @param alphabet synchronization alphabet, used by {@link SemanticModel#CSP}.
     * @param gamma communication function, used by {@link SemanticModel#ACP}.
     * @throws IllegalArgumentException if the alphabet contains {@code tau}
     *                                  or the communication function is not commutative and associative.
     */
    public static SosEngine forModel(SemanticModel model, Set<Action> alphabet, CommunicationFunction gamma) {
        Objects.requireNonNull(model, "model");
        List<SosRule> rules = new ArrayList<>();
        rules.add(new PrefixRule());
        rules.add(new ChoiceRule());
        rules.add(new RecursionRule());
        switch (model) {
        case CCS:
            rules.add(new CcsParallelRule());
            break;
        case CSP:
            rules.add(new CspParallelRule(alphabet));
            break;
        case ACP:
            gamma.validate();
            rules.add(new AcpMergeRule(gamma));
            break;
        default:
            throw new IllegalArgumentException("Unsupported semantic model " + model);
        }
        return new SosEngine(model, rules);
    }

    /**
     * Returns the engine with the additional rule.
     */
    public SosEngine withRule(SosRule rule) {
        List<SosRule> newRules = new ArrayList<>(rules);
        newRules.add(Objects.requireNonNull(rule, "rule"));
        return new SosEngine(model, newRules);
    }

    public SemanticModel getModel() {
        return model;
    }

    public List<SosRule> getRules() {
        return rules;
    }

    /**
     * Derives the one-step transitions of the specified term.
     *
     * @throws IllegalArgumentException if the term contains an unguarded recursion on its derivation path.
     */
    public Set<Transition> transitions(Term term) {
        Set<Transition> result = new LinkedHashSet<>();
        for (SosRule rule : rules) {
            if (rule.appliesTo(term))
                result.addAll(rule.derive(term, this));
        }
        return Collections.unmodifiableSet(result);
    }

    @Override
    public String toString() {
        return model + " " + rules;
    }
}
