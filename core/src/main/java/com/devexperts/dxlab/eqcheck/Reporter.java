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
import com.devexperts.dxlab.eqcheck.semantics.SemanticModel;
import com.devexperts.dxlab.eqcheck.term.Term;
import com.devexperts.dxlab.eqcheck.verifier.EquivalenceKind;
import com.devexperts.dxlab.eqcheck.verifier.Verdict;

import java.io.PrintStream;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Prints progress of verification tasks. {@link LoggingLevel#INFO} messages go to the standard output,
 * {@link LoggingLevel#WARN} ones to the standard error stream. Every message is printed at once,
 * so messages of concurrent tasks are not interleaved.
 */
public class Reporter {
    public static final LoggingLevel DEFAULT_LOG_LEVEL = LoggingLevel.WARN;

    private final LoggingLevel logLevel;
    private final PrintStream out;
    private final PrintStream err;

    public Reporter(LoggingLevel logLevel) {
        this(logLevel, System.out, System.err);
    }

    public Reporter(LoggingLevel logLevel, PrintStream out, PrintStream err) {
        this.logLevel = Objects.requireNonNull(logLevel, "logLevel");
        this.out = out;
        this.err = err;
    }

    public LoggingLevel getLogLevel() {
        return logLevel;
    }

    public void logLtsBuilt(SemanticModel model, Lts lts) {
        log(LoggingLevel.INFO, sb -> sb.append("Built ").append(model).append(' ').append(lts));
    }

    public void logCheckStarted(EquivalenceKind kind, boolean refinement, Term left, Term right) {
        log(LoggingLevel.INFO, sb -> {
            sb.append("Checking ").append(refinement ? kind.name() + " refinement" : kind.getDescription()).append('\n');
            sb.append("  left:  ").append(left).append('\n');
            sb.append("  right: ").append(right);
        });
    }

    public void logVerdict(Verdict verdict) {
        LoggingLevel level = verdict.isInconclusive() ? LoggingLevel.WARN : LoggingLevel.INFO;
        log(level, sb -> sb.append(verdict));
    }

    private void log(LoggingLevel logLevel, Consumer<StringBuilder> msg) {
        if (this.logLevel.compareTo(logLevel) > 0)
            return;
        StringBuilder sb = new StringBuilder();
        msg.accept(sb);
        PrintStream stream = logLevel == LoggingLevel.WARN ? err : out;
        synchronized (this) {
            stream.println(sb);
        }
    }
}
