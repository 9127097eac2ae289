/*
 * This file is part of JFOG.
 * Copyright (c) 2026 The JFOG contributors.
 *
 * JFOG is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JFOG is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JFOG. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jfog;

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class FormulaConfiguration {
    public static final int DEFAULT_INITIAL_SIZE = 1024;
    public static final double DEFAULT_TERM_TABLE_GROWTH_FACTOR = 1.5d;
    public static final long DEFAULT_UNFOLDING_WARNING_THRESHOLD = 10_000_000L;

    /**
     * If set, chains of {@code &} and {@code |} are grouped by recursive bisection when parsed or
     * when quantifiers are unfolded, instead of being folded to the left.
     */
    @Value.Default
    public boolean balancedAssociation() {
        return false;
    }

    @Value.Default
    public int initialSize() {
        return DEFAULT_INITIAL_SIZE;
    }

    @Value.Default
    public double growthFactor() {
        return DEFAULT_TERM_TABLE_GROWTH_FACTOR;
    }

    /** Estimated number of nodes created by quantifier elimination above which a warning is logged. */
    @Value.Default
    public long unfoldingWarningThreshold() {
        return DEFAULT_UNFOLDING_WARNING_THRESHOLD;
    }

    @Value.Default
    public boolean logStatisticsOnClear() {
        return false;
    }
}
