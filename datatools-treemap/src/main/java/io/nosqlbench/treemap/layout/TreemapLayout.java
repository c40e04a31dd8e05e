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

import io.nosqlbench.treemap.MapModel;
import io.nosqlbench.treemap.Mappable;
import io.nosqlbench.treemap.geometry.Rect;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/// # TreemapLayout
///
/// Squarified treemap layout after Bruls, Huizing and van Wijk.
///
/// ## Algorithm
/// 1. **Sort**: items are sorted by descending size, in place. The sort is stable, so
///    items of equal size keep the order the caller gave them.
/// 2. **Partition**: the longer side of the current rectangle is split. A [RowStrategy]
///    picks a prefix of the remaining items to form a row along the shorter side; the row
///    takes its share of the split side and the rest of the items continue in what is left.
///    A range of one or two items is always laid out as a single row.
/// 3. **Row layout**: a row is distributed along its own longer side, each item taking a
///    slice proportional to its size.
///
/// ## Degenerate input
/// - an empty list is a no-op
/// - a zero total size or zero-area bounds yield zero-area rectangles, never NaN
/// - negative or non-finite sizes and bounds are rejected with [IllegalArgumentException]
/// - sizes whose sum overflows to infinity are rejected the same way
///
/// ## Usage
/// ```java
/// List<MapItem> items = new ArrayList<>(List.of(new MapItem(2), new MapItem(6)));
/// new TreemapLayout().layoutItems(items, new Rect(0, 0, 6, 4));
/// // items is now [6, 2], with bounds (0,0,4.5,4) and (4.5,0,1.5,4)
/// ```
///
/// The default greedy heuristic keeps every area proportional to its size; layouts recorded
/// with the first releases are reproduced by [RowHeuristic#LEGACY].
///
/// Instances hold no per-call state and can be shared between threads, as long as each
/// call works on its own list of items.
public class TreemapLayout implements MapLayout {

    private static final Logger logger = LogManager.getLogger(TreemapLayout.class);

    private static final Comparator<Mappable> BY_SIZE_DESCENDING =
        Comparator.comparingDouble(Mappable::getSize).reversed();

    private final RowStrategy rowStrategy;

    /// Creates a layout using the heuristic named by the `nb.treemap.heuristic` system
    /// property, or the greedy heuristic if it is not set.
    public TreemapLayout() {
        this(RowHeuristic.fromSystemProperties());
    }

    /// @param heuristic the row heuristic to use
    public TreemapLayout(RowHeuristic heuristic) {
        this(Objects.requireNonNull(heuristic, "heuristic cannot be null").strategy());
    }

    /// @param rowStrategy the row strategy to use
    public TreemapLayout(RowStrategy rowStrategy) {
        this.rowStrategy = Objects.requireNonNull(rowStrategy, "rowStrategy cannot be null");
    }

    /// @return the row strategy of this layout
    public RowStrategy getRowStrategy() {
        return rowStrategy;
    }

    @Override
    public void layout(MapModel<?> model, Rect bounds) {
        Objects.requireNonNull(model, "model cannot be null");
        List<? extends Mappable> items = model.getItems();
        Objects.requireNonNull(items, "model returned null items");
        layoutItems(items, bounds);
    }

    /// Sorts the items by descending size and assigns bounds to every one of them.
    ///
    /// @param items the items to lay out, reordered in place
    /// @param bounds the rectangle to fill
    /// @throws IllegalArgumentException if a size or the bounds are negative or not finite
    public void layoutItems(List<? extends Mappable> items, Rect bounds) {
        Objects.requireNonNull(items, "items cannot be null");
        Objects.requireNonNull(bounds, "bounds cannot be null");
        validateBounds(bounds);
        validateItems(items);
        if (items.isEmpty()) {
            return;
        }

        sortDescending(items);
        double total = totalSize(items);
        logger.debug("laying out {} items of total size {} into {} with {} rows",
            items.size(), total, bounds, rowStrategy.getName());
        if (!(total > 0.0) || bounds.isDegenerate()) {
            logger.warn("degenerate layout: total size {} into {}, all {} items get zero area",
                total, bounds, items.size());
        }
        layoutItems(items, 0, items.size() - 1, bounds);
        if (logger.isDebugEnabled()) {
            logger.debug("layout complete: {}", LayoutQuality.of(items));
        }
    }

    /// Lays out an already sorted range of items.
    ///
    /// Each pass commits one row and continues with the residual rectangle, so the depth
    /// of the partition does not grow the stack.
    ///
    /// @param items the items, sorted by descending size
    /// @param start first index of the range
    /// @param end last index of the range (inclusive)
    /// @param bounds the rectangle to fill
    public void layoutItems(List<? extends Mappable> items, int start, int end, Rect bounds) {
        Rect remaining = bounds;
        int first = start;
        while (first <= end) {
            if (end - first < 2 || remaining.isDegenerate() || !(totalSize(items, first, end + 1) > 0.0)) {
                layoutRow(items, first, end, remaining);
                return;
            }

            RowSelection row = rowStrategy.selectRow(items, first, end, remaining);
            int last = Math.max(first, Math.min(end, row.last()));
            double b = last == end ? 1.0 : Math.max(0.0, Math.min(1.0, row.fraction()));
            logger.trace("row [{}..{}] takes {} of {}", first, last, b, remaining);

            double x = remaining.x();
            double y = remaining.y();
            double w = remaining.w();
            double h = remaining.h();
            if (w < h) {
                layoutRow(items, first, last, new Rect(x, y, w, h * b));
                remaining = new Rect(x, y + h * b, w, h * (1.0 - b));
            } else {
                layoutRow(items, first, last, new Rect(x, y, w * b, h));
                remaining = new Rect(x + w * b, y, w * (1.0 - b), h);
            }
            first = last + 1;
        }
    }

    /// Distributes a row of items along the longer side of its rectangle. Each item spans
    /// the full shorter side and a slice of the longer side proportional to its size.
    /// If the row has no size at all, every item gets a zero-area rectangle at the origin
    /// of `bounds`.
    ///
    /// @param items the items
    /// @param start first index of the row
    /// @param end last index of the row (inclusive)
    /// @param bounds the rectangle of the row
    public void layoutRow(List<? extends Mappable> items, int start, int end, Rect bounds) {
        boolean horizontal = bounds.w() > bounds.h();
        double total = totalSize(items, start, end + 1);
        if (!(total > 0.0)) {
            for (int i = start; i <= end; i++) {
                items.get(i).setBounds(new Rect(bounds.x(), bounds.y(), 0.0, 0.0));
            }
            return;
        }

        double a = 0.0;
        for (int i = start; i <= end; i++) {
            double b = items.get(i).getSize() / total;
            if (horizontal) {
                items.get(i).setBounds(new Rect(bounds.x() + bounds.w() * a, bounds.y(), bounds.w() * b, bounds.h()));
            } else {
                items.get(i).setBounds(new Rect(bounds.x(), bounds.y() + bounds.h() * a, bounds.w(), bounds.h() * b));
            }
            a += b;
        }
    }

    /// Sorts items by descending size. Equal sizes keep their relative order.
    /// @param items the items to sort in place
    public static void sortDescending(List<? extends Mappable> items) {
        items.sort(BY_SIZE_DESCENDING);
    }

    /// @param items the items
    /// @return the sum of all sizes
    public static double totalSize(List<? extends Mappable> items) {
        return totalSize(items, 0, items.size());
    }

    /// @param items the items
    /// @param start first index
    /// @param endExclusive one past the last index
    /// @return the sum of the sizes in the range
    public static double totalSize(List<? extends Mappable> items, int start, int endExclusive) {
        double sum = 0.0;
        for (int i = start; i < endExclusive; i++) {
            sum += items.get(i).getSize();
        }
        return sum;
    }

    /// Normalized aspect metric of a prospective row: [#aspect], folded so it is never
    /// below 1.0. Larger is worse.
    ///
    /// @param big the side being split
    /// @param small the other side
    /// @param a share of the first item of the row
    /// @param b share of the whole row
    /// @return the metric, at least 1.0
    public static double normAspect(double big, double small, double a, double b) {
        double x = aspect(big, small, a, b);
        if (x < 1.0) {
            return 1.0 / x;
        }
        return x;
    }

    /// Ratio of the row depth `big * b` to the extent of its first item `small * a / b`.
    ///
    /// @param big the side being split
    /// @param small the other side
    /// @param a share of the first item of the row
    /// @param b share of the whole row
    /// @return the raw ratio
    public static double aspect(double big, double small, double a, double b) {
        return (big * b) / (small * a / b);
    }

    private static void validateBounds(Rect bounds) {
        if (!Double.isFinite(bounds.x()) || !Double.isFinite(bounds.y())
            || !Double.isFinite(bounds.w()) || !Double.isFinite(bounds.h())) {
            throw new IllegalArgumentException("bounds must be finite: " + bounds);
        }
        if (bounds.w() < 0.0 || bounds.h() < 0.0) {
            throw new IllegalArgumentException("bounds must have non-negative width and height: " + bounds);
        }
    }

    private static void validateItems(List<? extends Mappable> items) {
        double sum = 0.0;
        for (int i = 0; i < items.size(); i++) {
            Mappable item = items.get(i);
            if (item == null) {
                throw new IllegalArgumentException(String.format("item %d is null", i));
            }
            double size = item.getSize();
            if (!Double.isFinite(size) || size < 0.0) {
                throw new IllegalArgumentException(String.format(
                    "item %d has size %s, sizes must be finite and non-negative", i, size));
            }
            sum += size;
        }
        if (!Double.isFinite(sum)) {
            throw new IllegalArgumentException(String.format(
                "total size of %d items overflows to %s, sizes must have a finite sum", items.size(), sum));
        }
    }
}
