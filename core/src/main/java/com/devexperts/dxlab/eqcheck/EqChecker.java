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

import com.devexperts.dxlab.eqcheck.lts.Lts;
import com.devexperts.dxlab.eqcheck.lts.StateSpaceLimitExceededException;
import com.devexperts.dxlab.eqcheck.semantics.SemanticModel;
import com.devexperts.dxlab.eqcheck.term.Term;
import com.devexperts.dxlab.eqcheck.verifier.EquivalenceChecker;
import com.devexperts.dxlab.eqcheck.verifier.EquivalenceKind;
import com.devexperts.dxlab.eqcheck.verifier.Verdict;
import com.devexperts.dxlab.eqcheck.verifier.bisimulation.StrongBisimulationChecker;
import com.devexperts.dxlab.eqcheck.verifier.bisimulation.WeakBisimulationChecker;
import com.devexperts.dxlab.eqcheck.verifier.failures.FailuresEquivalenceChecker;
import com.devexperts.dxlab.eqcheck.verifier.testing.TestingEquivalenceChecker;
import com.devexperts.dxlab.eqcheck.verifier.trace.TraceEquivalenceChecker;
import org.jetbrains.annotations.Nullable;

/**
 * Entry point of the library: builds transition systems of terms and checks terms for equivalence.
 * See {@link #checkEquivalence(Term, Term, EquivalenceKind, CheckOptions)} for details.
 */
public class EqChecker {
    private EqChecker() {}

    /**
     * Builds the transition system of the term under the specified model with the default options.
     *
     * @throws StateSpaceLimitExceededException if the term has too many reachable states.
     */
    public static Lts buildLts(Term term, SemanticModel model) {
        return buildLts(term, new CheckOptions().semanticModel(model));
    }

    /**
     * @throws StateSpaceLimitExceededException if the term has too many reachable states.
     * @throws IllegalArgumentException if the options are invalid.
     */
    public static Lts buildLts(Term term, CheckOptions options) {
        return options.createConfiguration().createBuilder().build(term);
    }

    /**
     * Checks the terms with the default options.
     */
    public static Verdict checkEquivalence(Term left, Term right, EquivalenceKind kind) {
        return checkEquivalence(left, right, kind, null);
    }

    /**
     * Checks whether the terms are equivalent.
     * <p>
     * The verdict is {@link Verdict.Outcome#INCONCLUSIVE inconclusive} if an exploration limit
     * is reached before a difference is found.
     *
     * @param options options of the check, the default ones if {@code null}.
     * @throws IllegalArgumentException if the kind is not supported or the options are invalid.
     */
    public static Verdict checkEquivalence(Term left, Term right, EquivalenceKind kind, @Nullable CheckOptions options) {
        return createChecker(kind, configuration(options)).check(left, right);
    }

    /**
     * Checks whether {@code implementation} refines {@code specification} in the failures model.
     */
    public static Verdict checkRefinement(Term specification, Term implementation, @Nullable CheckOptions options) {
        return new FailuresEquivalenceChecker(configuration(options)).refines(specification, implementation);
    }

    /**
     * Returns the checker of the specified kind.
     *
     * @throws IllegalArgumentException if the kind is not supported.
     */
    public static EquivalenceChecker createChecker(EquivalenceKind kind, CheckConfiguration configuration) {
        if (kind == null)
            throw new IllegalArgumentException("Equivalence kind is not specified");
        switch (kind) {
        case TRACE:
            return new TraceEquivalenceChecker(configuration);
        case STRONG_BISIMULATION:
            return new StrongBisimulationChecker(configuration);
        case WEAK_BISIMULATION:
            return new WeakBisimulationChecker(configuration);
        case TESTING:
        case MAY_TESTING:
        case MUST_TESTING:
            return new TestingEquivalenceChecker(kind, configuration);
        case FAILURES:
            return new FailuresEquivalenceChecker(configuration);
        default:
            throw new IllegalArgumentException("Unsupported equivalence kind " + kind);
        }
    }

    private static CheckConfiguration configuration(@Nullable CheckOptions options) {
        return (options != null ? options : new CheckOptions()).createConfiguration();
    }
}
