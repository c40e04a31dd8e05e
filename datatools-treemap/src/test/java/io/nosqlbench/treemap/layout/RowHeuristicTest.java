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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class RowHeuristicTest {

    @AfterEach
    public void clearProperty() {
        System.clearProperty(RowHeuristic.HEURISTIC_PROPERTY);
    }

    @ParameterizedTest
    @ValueSource(strings = {"trial", "TRIAL", " Trial "})
    public void testFromNameIgnoresCase(String name) {
        assertThat(RowHeuristic.fromName(name)).isEqualTo(RowHeuristic.TRIAL);
    }

    @Test
    public void testUnknownName() {
        assertThatThrownBy(() -> RowHeuristic.fromName("slice-and-dice"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("slice-and-dice")
            .hasMessageContaining("greedy");
    }

    @Test
    public void testDefaultIsGreedy() {
        assertThat(RowHeuristic.fromSystemProperties()).isEqualTo(RowHeuristic.GREEDY);
        assertThat(new TreemapLayout().getRowStrategy()).isInstanceOf(GreedyRowStrategy.class);
    }

    @Test
    public void testSystemPropertySelectsHeuristic() {
        System.setProperty(RowHeuristic.HEURISTIC_PROPERTY, "legacy");
        assertThat(new TreemapLayout().getRowStrategy()).isInstanceOf(LegacyGreedyRowStrategy.class);

        System.setProperty(RowHeuristic.HEURISTIC_PROPERTY, "  ");
        assertThat(RowHeuristic.fromSystemProperties()).isEqualTo(RowHeuristic.GREEDY);

        System.setProperty(RowHeuristic.HEURISTIC_PROPERTY, "bogus");
        assertThatThrownBy(TreemapLayout::new).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testStrategyNames() {
        for (RowHeuristic heuristic : RowHeuristic.values()) {
            assertThat(RowHeuristic.fromName(heuristic.strategy().getName())).isEqualTo(heuristic);
        }
    }
}
