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

import java.util.Objects;

/// The stock [Mappable]: a size and the bounds a layout gave it.
public class MapItem implements Mappable {

    private double size;
    private Rect bounds;

    /// Creates an item of size 1.0 occupying the unit square.
    public MapItem() {
        this(1.0);
    }

    /// Creates an item of the given size occupying the unit square until laid out.
    /// @param size the weight of this item
    public MapItem(double size) {
        this.size = size;
        this.bounds = Rect.UNIT;
    }

    @Override
    public double getSize() {
        return size;
    }

    @Override
    public void setSize(double size) {
        this.size = size;
    }

    @Override
    public Rect getBounds() {
        return bounds;
    }

    @Override
    public void setBounds(Rect bounds) {
        this.bounds = Objects.requireNonNull(bounds, "bounds cannot be null");
    }

    @Override
    public String toString() {
        return "MapItem{size=" + size + ", bounds=" + bounds + "}";
    }
}
