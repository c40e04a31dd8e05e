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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class MapItemTest {

    @Test
    public void testDefaults() {
        MapItem item = new MapItem();
        assertThat(item.getSize()).isEqualTo(1.0);
        assertThat(item.getBounds()).isEqualTo(new Rect());
    }

    @Test
    public void testSizeAndBounds() {
        MapItem item = new MapItem(3.5);
        item.setSize(7.0);
        item.setBounds(1.0, 2.0, 3.0, 4.0);
        assertThat(item.getSize()).isEqualTo(7.0);
        assertThat(item.getBounds()).isEqualTo(new Rect(1.0, 2.0, 3.0, 4.0));

        item.setBounds(new Rect(0.0, 0.0, 2.0, 2.0));
        assertThat(item.getBounds().area()).isEqualTo(4.0);
        assertThat(item.toString()).contains("size=7.0");
    }

    @Test
    public void testNullBoundsRejected() {
        MapItem item = new MapItem();
        assertThatThrownBy(() -> item.setBounds(null)).isInstanceOf(NullPointerException.class);
    }
}
