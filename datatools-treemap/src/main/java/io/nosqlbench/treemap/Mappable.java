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

package io.nosqlbench.treemap;

import io.nosqlbench.treemap.geometry.Rect;

/// Interface representing an object that can be placed in a treemap layout.
///
/// - **size**: the weight of the item; its area in the map is proportional to it
/// - **bounds**: the rectangle the item occupies, written by the layout
///
/// Sizes must be finite and non-negative. A zero size is legal and yields a
/// zero-area rectangle.
public interface Mappable {

    /// @return the weight of this item
    double getSize();

    /// @param size the new weight of this item
    void setSize(double size);

    /// @return the rectangle assigned by the most recent layout
    Rect getBounds();

    /// @param bounds the rectangle this item occupies
    void setBounds(Rect bounds);

    /// Sets the bounds from explicit coordinates.
    ///
    /// @param x left edge
    /// @param y top edge
    /// @param w width
    /// @param h height
    default void setBounds(double x, double y, double w, double h) {
        setBounds(new Rect(x, y, w, h));
    }
}
