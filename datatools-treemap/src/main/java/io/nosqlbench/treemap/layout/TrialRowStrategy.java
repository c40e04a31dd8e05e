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

import java.util.List;

/// Trial-based row selection.
///
/// For each candidate row boundary the row is laid out on paper, and the worst aspect
/// ratio among its items is measured. The boundary advances only while that worst ratio
/// strictly improves. This compares real item shapes instead of the first-item estimate
/// used by [GreedyRowStrategy], at the cost of a pass over the row for every candidate.
public class TrialRowStrategy implements RowStrategy {

    @Override
    public RowSelection selectRow(List<? extends Mappable> items, int start, int end, Rect bounds) {
        double total = TreemapLayout.totalSize(items, start, end + 1);
        int last = start;
        double b = items.get(start).getSize() / total;
        double worst = worstAspect(items, start, last, b, bounds);

        while (last < end) {
            double q = items.get(last + 1).getSize() / total;
            double trial = worstAspect(items, start, last + 1, b + q, bounds);
            if (trial >= worst) {
                break;
            }
            last++;
            b += q;
            worst = trial;
        }
        return new RowSelection(last, b);
    }

    /// Measures the most elongated item of a trial row without touching the items.
    /// Degenerate item rectangles are ignored.
    static double worstAspect(List<? extends Mappable> items, int start, int last, double fraction, Rect bounds) {
        double rowW = bounds.w() < bounds.h() ? bounds.w() : bounds.w() * fraction;
        double rowH = bounds.w() < bounds.h() ? bounds.h() * fraction : bounds.h();
        boolean horizontal = rowW > rowH;
        double rowTotal = TreemapLayout.totalSize(items, start, last + 1);
        if (!(rowTotal > 0.0)) {
            return 0.0;
        }

        double worst = 0.0;
        for (int i = start; i <= last; i++) {
            double share = items.get(i).getSize() / rowTotal;
            Rect r = horizontal ? new Rect(0.0, 0.0, rowW * share, rowH) : new Rect(0.0, 0.0, rowW, rowH * share);
            worst = Math.max(worst, r.aspectRatio());
        }
        return worst;
    }

    @Override
    public String getName() {
        return "trial";
    }
}
