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

import com.hellblazer.arbor.geometry.AffineMatrix;

/**
 * The rendering collaborator. It owns the children of the current scope and physically applies matrices to them; the
 * applicators only decide which matrix goes with which child.
 *
 * @author hal.hildebrand
 */
public interface RenderContext {

    /**
     * @return the number of children in the current scope
     */
    int childCount();

    /**
     * Apply the matrix to the subtree of child {@code index} and emit it. May be invoked any number of times for the
     * same index.
     *
     * @param index  the child, 0 .. childCount() - 1
     * @param matrix the final transform for this instance
     */
    void renderChildAt(int index, AffineMatrix matrix);

    /**
     * Emit a primitive that is not one of the scope's children.
     *
     * @param primitive the solid
     * @param matrix    the final transform
     * @param label     display label, such as a color name
     */
    void renderPrimitive(Primitive primitive, AffineMatrix matrix, String label);
}
