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
import io.nosqlbench.treemap.geometry.Rect;

/// The interface for a treemap layout algorithm.
public interface MapLayout {

    /// Arrange the items in the given model to fill the given rectangle.
    ///
    /// @param model the model supplying the items
    /// @param bounds the bounding rectangle for the layout
    void layout(MapModel<?> model, Rect bounds);
}
