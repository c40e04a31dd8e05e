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

package io.nosqlbench.treemap.geometry;

/// # Rect
///
/// An immutable axis-aligned rectangle with its origin at (`x`, `y`) and extent
/// (`w`, `h`). Layouts never change a rectangle; they assign a new one.
///
/// A rectangle with a zero (or negative) width or height is *degenerate*. It has no
/// aspect ratio and is never a candidate for further subdivision.
///
/// @param x left edge
/// @param y top edge
/// @param w width
/// @param h height
public record Rect(double x, double y, double w, double h) {

    /// The unit square at the origin
    public static final Rect UNIT = new Rect(0.0, 0.0, 1.0, 1.0);

    /// Creates the unit square `(0, 0, 1, 1)`.
    public Rect() {
        this(0.0, 0.0, 1.0, 1.0);
    }

    /// Computes `max(w/h, h/w)`. A value of 1.0 is a perfect square.
    ///
    /// @return the aspect ratio, or 0.0 when this rectangle is degenerate
    public double aspectRatio() {
        if (isDegenerate()) {
            return 0.0;
        }
        return Math.max(w / h, h / w);
    }

    /// @return true if either dimension is not positive
    public boolean isDegenerate() {
        return !(w > 0.0) || !(h > 0.0);
    }

    /// @return `w * h`
    public double area() {
        return w * h;
    }

    /// @return the right edge
    public double maxX() {
        return x + w;
    }

    /// @return the bottom edge
    public double maxY() {
        return y + h;
    }

    /// Computes the area shared by the interiors of this rectangle and another.
    ///
    /// @param other the rectangle to intersect with
    /// @return the overlapping area, 0.0 if the rectangles only touch or are disjoint
    public double intersectionArea(Rect other) {
        double iw = Math.min(maxX(), other.maxX()) - Math.max(x, other.x);
        double ih = Math.min(maxY(), other.maxY()) - Math.max(y, other.y);
        if (iw <= 0.0 || ih <= 0.0) {
            return 0.0;
        }
        return iw * ih;
    }

    /// Checks whether another rectangle lies inside this one, allowing each edge to
    /// stray by up to `epsilon` to absorb rounding.
    ///
    /// @param other the candidate inner rectangle
    /// @param epsilon tolerance per edge
    /// @return true if `other` is contained
    public boolean contains(Rect other, double epsilon) {
        return other.x >= x - epsilon
            && other.y >= y - epsilon
            && other.maxX() <= maxX() + epsilon
            && other.maxY() <= maxY() + epsilon;
    }

    @Override
    public String toString() {
        return "Rect{x=" + x + ", y=" + y + ", w=" + w + ", h=" + h + "}";
    }
}
