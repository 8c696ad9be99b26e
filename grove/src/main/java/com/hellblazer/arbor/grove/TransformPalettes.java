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

import java.util.ArrayList;
import java.util.List;

import static com.hellblazer.arbor.geometry.Transforms.rotateZ;
import static com.hellblazer.arbor.geometry.Transforms.translate;

/**
 * Ready made transform arrays for {@link CyclicTransformMapper}.
 *
 * @author hal.hildebrand
 */
public final class TransformPalettes {

    private TransformPalettes() {
        // Prevent instantiation
    }

    /**
     * Six axis aligned translations, in the order +X, -X, +Y, -Y, +Z, -Z. Cycling through them grows a 3D cross.
     */
    public static List<TransformFunction> axisCross() {
        return List.of(TransformFunction.scalar(d -> translate(d, 0, 0)),
                       TransformFunction.scalar(d -> translate(-d, 0, 0)),
                       TransformFunction.scalar(d -> translate(0, d, 0)),
                       TransformFunction.scalar(d -> translate(0, -d, 0)),
                       TransformFunction.scalar(d -> translate(0, 0, d)),
                       TransformFunction.scalar(d -> translate(0, 0, -d)));
    }

    /**
     * Four translations in the XY plane, in the order +X, +Y, -X, -Y.
     */
    public static List<TransformFunction> planarCross() {
        return List.of(TransformFunction.scalar(d -> translate(d, 0, 0)),
                       TransformFunction.scalar(d -> translate(0, d, 0)),
                       TransformFunction.scalar(d -> translate(-d, 0, 0)),
                       TransformFunction.scalar(d -> translate(0, -d, 0)));
    }

    /**
     * A spiral staircase: function {@code k} places at radius {@code d}, turned {@code 360 / steps * k} degrees about
     * Z and lifted {@code pitch * k / steps}. Each full pass repeats the same turn and rise one {@code dist} further
     * out.
     *
     * @param steps functions per turn
     * @param pitch rise per full turn
     * @return the palette
     * @throws IllegalArgumentException if steps &lt; 1
     */
    public static List<TransformFunction> spiral(int steps, double pitch) {
        if (steps < 1) {
            throw new IllegalArgumentException("steps must be positive: " + steps);
        }
        var palette = new ArrayList<TransformFunction>(steps);
        for (int k = 0; k < steps; k++) {
            var angle = 360.0 / steps * k;
            var lift = pitch * k / steps;
            palette.add(TransformFunction.scalar(d -> rotateZ(angle).multiply(translate(d, 0, lift))));
        }
        return List.copyOf(palette);
    }
}
