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

/// # Synopsis
/// Squarified treemap layout: a set of weighted items is fitted into a bounding rectangle
/// so that each item gets a sub-rectangle with an area proportional to its weight, while
/// keeping those sub-rectangles as close to square as the greedy row heuristic allows.
///
/// ## Parts
/// 1. [io.nosqlbench.treemap.geometry.Rect]: the rectangle value type
/// 2. [io.nosqlbench.treemap.Mappable] and [io.nosqlbench.treemap.MapItem]: what gets laid out
/// 3. [io.nosqlbench.treemap.MapModel]: where the items come from
/// 4. [io.nosqlbench.treemap.layout.TreemapLayout]: the layout engine, with pluggable
///    [io.nosqlbench.treemap.layout.RowStrategy] row heuristics
///
/// Nothing here draws; a layout only writes bounds.
package io.nosqlbench.treemap;
