/*
 * This file is part of JRPN (https://github.com/incaseoftrouble/jrpn).
 * Copyright (c) 2023 Tobias Meggendorfer.
 *
 * JRPN is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JRPN is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JRPN. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jrpn;

import org.immutables.value.Value;

@SuppressWarnings("MethodReturnAlwaysConstant")
@Value.Immutable
public class EngineConfiguration {
    public static final int DEFAULT_TABLE_QUEUE_DEPTH = 64;
    public static final int DEFAULT_RANDOM_MAX_DEPTH = 3;
    public static final int DEFAULT_RANDOM_MAX_VARIABLES = 5;
    public static final int DEFAULT_RANDOM_SET_SIZE = 10;

    /**
     * Number of threads formatting truth table rows. With a single worker, rows are formatted on
     * the calling thread.
     */
    @Value.Default
    public int tableWorkers() {
        return Math.max(1, Math.min(4, Runtime.getRuntime().availableProcessors()));
    }

    /**
     * Capacity of the row queue of each table worker.
     */
    @Value.Default
    public int tableQueueDepth() {
        return DEFAULT_TABLE_QUEUE_DEPTH;
    }

    @Value.Default
    public int randomMaxDepth() {
        return DEFAULT_RANDOM_MAX_DEPTH;
    }

    @Value.Default
    public int randomMaxVariables() {
        return DEFAULT_RANDOM_MAX_VARIABLES;
    }

    /**
     * Exclusive upper bound on the number of elements of randomly generated sets.
     */
    @Value.Default
    public int randomSetSize() {
        return DEFAULT_RANDOM_SET_SIZE;
    }

    @Value.Check
    protected void check() {
        if (tableWorkers() < 1 || tableQueueDepth() < 1) {
            throw new IllegalStateException("Table workers and queue depth must be positive");
        }
        if (randomMaxDepth() < 0 || randomMaxVariables() < 1
            || randomMaxVariables() > VariableTable.SIZE || randomSetSize() < 1) {
            throw new IllegalStateException("Invalid random generator bounds");
        }
    }
}
