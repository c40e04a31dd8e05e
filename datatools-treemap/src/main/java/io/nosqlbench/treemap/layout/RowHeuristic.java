/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.treemap.layout;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/// The row heuristics available to [TreemapLayout], selectable by name.
///
/// The no-arg [TreemapLayout] constructor reads the system property
/// [#HEURISTIC_PROPERTY] (`nb.treemap.heuristic`) to pick one; it defaults to [#GREEDY].
public enum RowHeuristic {

    /// Forward greedy scan on the normalized aspect metric, see [GreedyRowStrategy]
    GREEDY(new GreedyRowStrategy()),
    /// Trial layouts compared by their worst item aspect ratio, see [TrialRowStrategy]
    TRIAL(new TrialRowStrategy()),
    /// Output-compatible with the first releases, see [LegacyGreedyRowStrategy]
    LEGACY(new LegacyGreedyRowStrategy());

    /// System property naming the default heuristic
    public static final String HEURISTIC_PROPERTY = "nb.treemap.heuristic";

    private final RowStrategy strategy;

    RowHeuristic(RowStrategy strategy) {
        this.strategy = strategy;
    }

    /// @return the shared, stateless strategy for this heuristic
    public RowStrategy strategy() {
        return strategy;
    }

    /// Looks up a heuristic by name, ignoring case and surrounding whitespace.
    ///
    /// @param name the heuristic name, e.g. `greedy`
    /// @return the matching heuristic
    /// @throws IllegalArgumentException if no heuristic has that name
    public static RowHeuristic fromName(String name) {
        Objects.requireNonNull(name, "heuristic name cannot be null");
        String wanted = name.trim();
        for (RowHeuristic heuristic : values()) {
            if (heuristic.name().equalsIgnoreCase(wanted)) {
                return heuristic;
            }
        }
        throw new IllegalArgumentException(String.format(
            "Unknown row heuristic '%s', expected one of %s",
            name, Arrays.toString(values()).toLowerCase(Locale.ROOT)));
    }

    /// @return the heuristic named by [#HEURISTIC_PROPERTY], or [#GREEDY] when it is unset
    public static RowHeuristic fromSystemProperties() {
        String configured = System.getProperty(HEURISTIC_PROPERTY);
        if (configured == null || configured.isBlank()) {
            return GREEDY;
        }
        return fromName(configured);
    }
}
