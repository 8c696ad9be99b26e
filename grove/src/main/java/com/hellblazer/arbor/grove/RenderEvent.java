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
 * Immutable record of one call into a {@link RenderContext}, as captured by {@link SceneRecorder}.
 *
 * @author hal.hildebrand
 */
public sealed interface RenderEvent permits RenderEvent.ChildRendered, RenderEvent.PrimitiveRendered {

    /**
     * Position of the event in emission order, starting at 0.
     * @return the sequence number
     */
    int sequence();

    /**
     * The final transform handed to the collaborator.
     * @return the matrix
     */
    AffineMatrix matrix();

    /**
     * Child {@code index} of the scope was rendered with {@code matrix}.
     *
     * @param sequence emission order
     * @param index    child index
     * @param matrix   final transform
     */
    record ChildRendered(int sequence, int index, AffineMatrix matrix) implements RenderEvent {}

    /**
     * A primitive was rendered with {@code matrix} and {@code label}.
     *
     * @param sequence  emission order
     * @param primitive the solid
     * @param matrix    final transform
     * @param label     display label
     */
    record PrimitiveRendered(int sequence, Primitive primitive, AffineMatrix matrix, String label)
    implements RenderEvent {}
}
