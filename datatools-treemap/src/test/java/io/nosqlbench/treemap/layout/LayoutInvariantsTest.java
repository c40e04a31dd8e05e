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

import io.nosqlbench.treemap.MapItem;
import io.nosqlbench.treemap.geometry.Rect;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.stream.Stream;

import static io.nosqlbench.treemap.layout.TreemapFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

/// Randomized checks of the layout invariants: sorting, tiling and proportional areas.
@Tag("unit")
public class LayoutInvariantsTest {

    private static final int CASES_PER_HEURISTIC = 60;

    static Stream<Arguments> randomCases() {
        Random random = new Random(20240917L);
        List<Arguments> cases = new ArrayList<>();
        for (RowHeuristic heuristic : RowHeuristic.values()) {
            for (int i = 0; i < CASES_PER_HEURISTIC; i++) {
                double[] sizes = randomSizes(random, 1 + random.nextInt(40));
                if (Arrays.stream(sizes).sum() == 0.0) {
                    sizes[0] = 1.0;
                }
                cases.add(Arguments.of(heuristic, sizes, randomBounds(random)));
            }
        }
        return cases.stream();
    }

    @ParameterizedTest
    @MethodSource("randomCases")
    public void testSortedPermutation(RowHeuristic heuristic, double[] sizes, Rect bounds) {
        List<MapItem> items = items(sizes);
        List<MapItem> original = new ArrayList<>(items);
        new TreemapLayout(heuristic).layoutItems(items, bounds);

        assertThat(items).hasSize(sizes.length).containsExactlyInAnyOrderElementsOf(original);
        for (int i = 1; i < items.size(); i++) {
            assertThat(items.get(i).getSize()).isLessThanOrEqualTo(items.get(i - 1).getSize());
        }
    }

    @ParameterizedTest
    @MethodSource("randomCases")
    public void testTiling(RowHeuristic heuristic, double[] sizes, Rect bounds) {
        List<MapItem> items = items(sizes);
        new TreemapLayout(heuristic).layoutItems(items, bounds);
        assertTiles(items, bounds);
    }

    @ParameterizedTest
    @MethodSource("randomCases")
    public void testProportionalAreas(RowHeuristic heuristic, double[] sizes, Rect bounds) {
        if (heuristic == RowHeuristic.LEGACY) {
            return;
        }
        List<MapItem> items = items(sizes);
        new TreemapLayout(heuristic).layoutItems(items, bounds);
        assertProportional(items, bounds);
    }
}
