/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Arbor.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.arbor.grove;

import com.hellblazer.arbor.grove.Primitive.Kind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for BranchConfiguration.
 *
 * @author hal.hildebrand
 */
public class BranchConfigurationTest {

    @Test
    public void testDefaults() {
        var config = BranchConfiguration.defaultConfig();
        assertEquals(Kind.CYLINDER, config.trunkKind());
        assertEquals(0.1, config.trunkRadiusRatio());
        assertEquals(Kind.SPHERE, config.leafKind());
        assertEquals(0.2, config.leafSizeRatio());
    }

    @Test
    public void testSolids() {
        var config = BranchConfiguration.defaultConfig();
        assertEquals(Primitive.cylinder(20, 2), config.trunk(20));
        assertEquals(Primitive.sphere(4), config.leaf(20));
        assertEquals(Primitive.sphere(5), config.withTrunkKind(Kind.SPHERE).trunk(10));
        assertEquals(Primitive.cube(2), config.withLeafKind(Kind.CUBE).leaf(10));
    }

    @Test
    public void testWithers() {
        var config = BranchConfiguration.defaultConfig();
        var changed = config.withTrunkRadiusRatio(0.25).withLeafSizeRatio(0.5);
        assertEquals(0.25, changed.trunkRadiusRatio());
        assertEquals(0.5, changed.leafSizeRatio());
        // Original unchanged
        assertEquals(BranchConfiguration.defaultConfig(), config);
        assertNotEquals(config, changed);
    }

    @Test
    public void testEqualsAndHashCode() {
        var a = new BranchConfiguration(Kind.CUBE, 0.3, Kind.SPHERE, 0.4);
        var b = new BranchConfiguration(Kind.CUBE, 0.3, Kind.SPHERE, 0.4);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertTrue(a.toString().contains("trunkKind=CUBE"));
    }

    @Test
    public void testInvalid() {
        var config = BranchConfiguration.defaultConfig();
        assertThrows(IllegalArgumentException.class, () -> config.withTrunkRadiusRatio(0));
        assertThrows(IllegalArgumentException.class, () -> config.withLeafSizeRatio(-1));
        assertThrows(IllegalArgumentException.class, () -> config.withLeafSizeRatio(Double.NaN));
        assertThrows(NullPointerException.class, () -> config.withTrunkKind(null));
    }
}
