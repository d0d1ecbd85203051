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

import com.devexperts.dxlab.eqcheck.CheckConfiguration;
import com.devexperts.dxlab.eqcheck.Reporter;
import com.devexperts.dxlab.eqcheck.lts.Lts;
import com.devexperts.dxlab.eqcheck.lts.LtsBuilder;
import com.devexperts.dxlab.eqcheck.lts.StateSpaceLimitExceededException;
import com.devexperts.dxlab.eqcheck.term.Term;

import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Base class for checkers, builds the transition systems with the configured builder
 * and reports the outcome.
 */
public abstract class AbstractEquivalenceChecker implements EquivalenceChecker {
    protected final EquivalenceKind kind;
    protected final CheckConfiguration configuration;
    protected final LtsBuilder builder;
    protected final Reporter reporter;

    protected AbstractEquivalenceChecker(EquivalenceKind kind, CheckConfiguration configuration) {
        this.kind = kind;
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.builder = configuration.createBuilder();
        this.reporter = configuration.reporter;
    }

    @Override
    public EquivalenceKind getKind() {
        return kind;
    }

    @Override
    public Verdict check(Term left, Term right) {
        return checkTerms(left, right, false, this::check);
    }

    /**
     * Builds the transition systems of both terms and applies the specified check to them.
     * An exceeded state-count ceiling is converted to an inconclusive verdict.
     */
    protected Verdict checkTerms(Term left, Term right, boolean refinement, BiFunction<Lts, Lts, Verdict> check) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        reporter.logCheckStarted(kind, refinement, left, right);
        Verdict verdict;
        try {
            Lts leftLts = builder.build(left);
            Lts rightLts = builder.build(right);
            verdict = check.apply(leftLts, rightLts);
        } catch (StateSpaceLimitExceededException e) {
            verdict = Verdict.inconclusive(kind, e.getMessage());
        }
        if (refinement)
            verdict = verdict.asRefinement();
        reporter.logVerdict(verdict);
        return verdict;
    }
}
