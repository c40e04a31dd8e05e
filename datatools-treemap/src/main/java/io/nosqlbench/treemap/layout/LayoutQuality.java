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

import io.nosqlbench.treemap.Mappable;
import io.nosqlbench.treemap.geometry.Rect;
import io.nosqlbench.treemap.utils.SHARED;

import java.util.List;
import java.util.Objects;

/**
 * Shape statistics of a finished layout.
 *
 * <p>The aspect ratio figures cover only items with a non-degenerate rectangle; zero-size
 * items are counted in {@link #degenerateCount} instead. When no item has a usable
 * rectangle the aspect ratio figures are all 0.0.</p>
 *
 * <pre>{@code
 * layout.layoutItems(items, bounds);
 * LayoutQuality quality = LayoutQuality.of(items);
 * logger.info("worst aspect ratio {}", quality.maxAspectRatio);
 * }</pre>
 */
public class LayoutQuality {

    /** Number of items measured */
    public final int itemCount;
    /** Items whose rectangle has no area */
    public final int degenerateCount;
    /** Mean aspect ratio of the non-degenerate items */
    public final double meanAspectRatio;
    /** Best (lowest) aspect ratio of the non-degenerate items */
    public final double minAspectRatio;
    /** Worst (highest) aspect ratio of the non-degenerate items */
    public final double maxAspectRatio;
    /** Sum of the item areas */
    public final double coveredArea;

    public LayoutQuality(int itemCount, int degenerateCount, double meanAspectRatio,
                         double minAspectRatio, double maxAspectRatio, double coveredArea) {
        this.itemCount = itemCount;
        this.degenerateCount = degenerateCount;
        this.meanAspectRatio = meanAspectRatio;
        this.minAspectRatio = minAspectRatio;
        this.maxAspectRatio = maxAspectRatio;
        this.coveredArea = coveredArea;
    }

    /**
     * Measures the bounds currently assigned to the given items.
     *
     * @param items laid out items
     * @return the statistics
     */
    public static LayoutQuality of(List<? extends Mappable> items) {
        Objects.requireNonNull(items, "items cannot be null");
        int degenerate = 0;
        double sum = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = 0.0;
        double area = 0.0;
        for (Mappable item : items) {
            Rect r = item.getBounds();
            area += r.area();
            if (r.isDegenerate()) {
                degenerate++;
                continue;
            }
            double ratio = r.aspectRatio();
            sum += ratio;
            min = Math.min(min, ratio);
            max = Math.max(max, ratio);
        }
        int measured = items.size() - degenerate;
        if (measured == 0) {
            return new LayoutQuality(items.size(), degenerate, 0.0, 0.0, 0.0, area);
        }
        return new LayoutQuality(items.size(), degenerate, sum / measured, min, max, area);
    }

    public String toJson() {
        return SHARED.gson.toJson(this);
    }

    @Override
    public String toString() {
        return String.format("LayoutQuality{items=%d, degenerate=%d, meanAspect=%.4f, minAspect=%.4f, maxAspect=%.4f, area=%.4f}",
            itemCount, degenerateCount, meanAspectRatio, minAspectRatio, maxAspectRatio, coveredArea);
    }
}
