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

/// Greedy row selection with the arithmetic of the first treemap releases, kept so that
/// layouts recorded with those releases can be reproduced exactly.
///
/// Two details differ from [GreedyRowStrategy]:
/// - the range total leaves out the last item of the range
/// - the first candidate considered is the first item itself, so its share is counted
///   twice in the row share `b`
///
/// The resulting rows still tile the bounds, but item areas are only roughly
/// proportional to their sizes. Use [GreedyRowStrategy] for new layouts.
public class LegacyGreedyRowStrategy implements RowStrategy {

    @Override
    public RowSelection selectRow(List<? extends Mappable> items, int start, int end, Rect bounds) {
        double total = TreemapLayout.totalSize(items, start, end);
        boolean tall = bounds.w() < bounds.h();
        double big = tall ? bounds.h() : bounds.w();
        double small = tall ? bounds.w() : bounds.h();

        double a = items.get(start).getSize() / total;
        double b = a;
        int mid = start;
        while (mid <= end) {
            double aspect = TreemapLayout.normAspect(big, small, a, b);
            double q = items.get(mid).getSize() / total;
            if (TreemapLayout.normAspect(big, small, a, b + q) > aspect) {
                break;
            }
            mid++;
            b += q;
        }
        // the scan can run one past the range when every candidate improves the row
        return new RowSelection(Math.min(mid, end), b);
    }

    @Override
    public String getName() {
        return "legacy";
    }
}
