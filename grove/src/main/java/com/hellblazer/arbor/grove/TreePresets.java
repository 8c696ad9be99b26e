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

import java.util.List;

import static com.hellblazer.arbor.geometry.Transforms.rotateX;
import static com.hellblazer.arbor.geometry.Transforms.rotateZ;
import static com.hellblazer.arbor.geometry.Transforms.translate;

/**
 * Stock tables and DNA for {@link BranchGenerator}.
 *
 * @author hal.hildebrand
 */
public final class TreePresets {

    public static final String LEAF_LABEL   = "green";
    public static final String BRANCH_LABEL = "saddlebrown";

    private TreePresets() {
        // Prevent instantiation
    }

    /**
     * Leans a branch {@code inclination} degrees about X, turns it {@code zRotation} degrees about Z, then moves it to
     * the tip of a trunk of length {@code size} along Z.
     *
     * @return {@code (size, inclination, zRotation) -> translate(0, 0, size) * rotateZ(zRotation) * rotateX(inclination)}
     */
    public static TransformFunction tipTransform() {
        return params -> {
            if (params.length < 3) {
                throw new IllegalArgumentException("Expected (size, inclination, zRotation): " + params.length);
            }
            return translate(0, 0, params[0]).multiply(rotateZ(params[2])).multiply(rotateX(params[1]));
        };
    }

    /**
     * Two entries: leaf at depth 0, branch for every depth above.
     */
    public static DepthTransformTable standardTable() {
        return DepthTransformTable.builder()
                                  .add(tipTransform(), LEAF_LABEL)
                                  .add(tipTransform(), BRANCH_LABEL)
                                  .build();
    }

    /**
     * A single steep branch per node, turning 80 degrees each level.
     */
    public static List<BranchDescriptor> fern() {
        return List.of(new BranchDescriptor(12, 80, 0.85));
    }

    /**
     * Three spreading branches per node.
     */
    public static List<BranchDescriptor> oak() {
        return List.of(new BranchDescriptor(35, 0, 0.7), new BranchDescriptor(35, 120, 0.68),
                       new BranchDescriptor(35, 240, 0.72));
    }
}
