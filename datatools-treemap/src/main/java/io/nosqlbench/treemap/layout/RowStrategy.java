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

/// Decides how many of the remaining items go into the next row of a squarified layout.
///
/// Implementations are called by [TreemapLayout] with items already sorted by descending
/// size, a range of at least three items with a positive total size, and non-degenerate
/// bounds. They must not modify the items.
public interface RowStrategy {

    /// Chooses the next row.
    ///
    /// @param items the items, sorted by descending size
    /// @param start index of the first item in the remaining range
    /// @param end index of the last item in the remaining range (inclusive)
    /// @param bounds the rectangle left for the remaining range
    /// @return the last index of the row and its share of the split side
    RowSelection selectRow(List<? extends Mappable> items, int start, int end, Rect bounds);

    /// @return a short name used in log messages
    String getName();
}
