package me.golemcore.nexus.domain.budget;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Thrown when the configured context window leaves too little input capacity
 * for any turn to run. Fatal at process level.
 */
public class InsufficientContextException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final int capacityCeiling;
    private final int minimumViableCapacity;

    public InsufficientContextException(int capacityCeiling, int minimumViableCapacity) {
        super("Context window too small for reasonable operation: capacity ceiling " + capacityCeiling
                + " < " + minimumViableCapacity);
        this.capacityCeiling = capacityCeiling;
        this.minimumViableCapacity = minimumViableCapacity;
    }

    public int getCapacityCeiling() {
        return capacityCeiling;
    }

    public int getMinimumViableCapacity() {
        return minimumViableCapacity;
    }
}
