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

import java.util.List;

/// Supplies the items of a treemap to a layout.
///
/// The returned list is laid out in place: the layout reorders it by descending size
/// and writes the bounds of every item. Implementations decide where the items come from.
///
/// @param <T> the item type
@FunctionalInterface
public interface MapModel<T extends Mappable> {

    /// @return the mutable list of items in this model
    List<T> getItems();
}
