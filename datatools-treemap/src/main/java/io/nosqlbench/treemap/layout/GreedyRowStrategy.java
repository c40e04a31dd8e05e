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

/// Forward greedy row selection.
///
/// The row starts with the largest remaining item and takes on the following items one at
/// a time. Before each addition the normalized aspect metric of the row is compared with
/// the metric the row would have with the candidate included; the row is closed as soon
/// as the candidate would make it worse.
///
/// `a` is the share of the first item, `b` the share of the whole row, both relative to
/// the total size of the remaining range. The row occupies exactly `b` of the split side,
/// so every item ends with an area proportional to its size.
public class GreedyRowStrategy implements RowStrategy {

    @Override
    public RowSelection selectRow(List<? extends Mappable> items, int start, int end, Rect bounds) {
        double total = TreemapLayout.totalSize(items, start, end + 1);
        boolean tall = bounds.w() < bounds.h();
        double big = tall ? bounds.h() : bounds.w();
        double small = tall ? bounds.w() : bounds.h();

        double a = items.get(start).getSize() / total;
        double b = a;
        int last = start;
        while (last < end) {
            double q = items.get(last + 1).getSize() / total;
            if (TreemapLayout.normAspect(big, small, a, b + q) > TreemapLayout.normAspect(big, small, a, b)) {
                break;
            }
            last++;
            b += q;
        }
        return new RowSelection(last, b);
    }

    @Override
    public String getName() {
        return "greedy";
    }
}
