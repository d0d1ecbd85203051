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

import org.jetbrains.annotations.Nullable;

import java.util.Locale;
import java.util.Objects;

/**
 * Result of an equivalence (or refinement) check.
 * A check which gave up on an exploration limit is {@link Outcome#INCONCLUSIVE},
 * which is never the same as {@link Outcome#NOT_EQUIVALENT}.
 */
public final class Verdict {
    public enum Outcome {
        EQUIVALENT, NOT_EQUIVALENT, INCONCLUSIVE
    }

    private final EquivalenceKind kind;
    private final boolean refinement;
    private final Outcome outcome;
    private final Witness witness;
    private final String reason;

    private Verdict(EquivalenceKind kind, boolean refinement, Outcome outcome,
                    @Nullable Witness witness, @Nullable String reason)
    {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.refinement = refinement;
        this.outcome = outcome;
        this.witness = witness;
        this.reason = reason;
    }

    public static Verdict equivalent(EquivalenceKind kind) {
        return new Verdict(kind, false, Outcome.EQUIVALENT, null, null);
    }

    public static Verdict notEquivalent(EquivalenceKind kind, Witness witness) {
        return new Verdict(kind, false, Outcome.NOT_EQUIVALENT, Objects.requireNonNull(witness, "witness"), null);
    }

    public static Verdict inconclusive(EquivalenceKind kind, String reason) {
        return new Verdict(kind, false, Outcome.INCONCLUSIVE, null, reason);
    }

    /**
     * Returns the same verdict stating a refinement rather than an equivalence.
     */
    public Verdict asRefinement() {
        return new Verdict(kind, true, outcome, witness, reason);
    }

    public EquivalenceKind getKind() {
        return kind;
    }

    public boolean isRefinement() {
        return refinement;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isEquivalent() {
        return outcome == Outcome.EQUIVALENT;
    }

    public boolean isNotEquivalent() {
        return outcome == Outcome.NOT_EQUIVALENT;
    }

    public boolean isInconclusive() {
        return outcome == Outcome.INCONCLUSIVE;
    }

    /**
     * Returns the witness of a {@link Outcome#NOT_EQUIVALENT} verdict, {@code null} otherwise.
     */
    @Nullable
    public Witness getWitness() {
        return witness;
    }

    /**
     * Returns why the check is {@link Outcome#INCONCLUSIVE}, {@code null} otherwise.
     */
    @Nullable
    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        String relation = refinement ? kind.name().toLowerCase(Locale.ROOT) + " refinement" : kind.getDescription();
        switch (outcome) {
        case EQUIVALENT:
            return relation + ": holds";
        case NOT_EQUIVALENT:
            return relation + ": does not hold, " + witness;
        default:
            return relation + ": inconclusive, " + reason;
        }
    }
}
