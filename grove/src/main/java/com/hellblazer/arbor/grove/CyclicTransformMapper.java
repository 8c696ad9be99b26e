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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Renders a single template child {@code numChildren} times, cycling through a palette of transform functions. Each
 * completed pass through the palette pushes the next pass {@code dist} further out.
 *
 * <p>For instance {@code i}, with palette length {@code L}:
 * <pre>
 *   cycle     = floor(i / L)
 *   funcIndex = i mod L
 *   matrix    = transforms[funcIndex](cycle * dist)
 * </pre>
 * The first {@code L} instances therefore use a multiplier of 0. The template is always child 0 of the context; it is
 * re-rendered once per instance, so the rendered count is decoupled from the number of children supplied.
 *
 * @author hal.hildebrand
 */
public class CyclicTransformMapper {

    /** The child re-rendered for every instance */
    public static final int TEMPLATE_INDEX = 0;

    private static final Logger log = LoggerFactory.getLogger(CyclicTransformMapper.class);

    /**
     * Distance multiplier for an instance
     *
     * @param index         the instance
     * @param paletteLength number of transform functions
     * @return completed passes through the palette before this instance
     * @throws IllegalArgumentException if paletteLength is not positive
     */
    public static int cycle(int index, int paletteLength) {
        if (paletteLength <= 0) {
            throw new IllegalArgumentException("Palette length must be positive: " + paletteLength);
        }
        return Math.floorDiv(index, paletteLength);
    }

    /**
     * Render the template child {@code numChildren} times.
     *
     * @param context     supplies the template child and renders
     * @param numChildren instances to render
     * @param transforms  the palette, used cyclically
     * @param dist        distance added per completed pass
     * @return the number of instances rendered
     * @throws IllegalArgumentException if the palette is empty, numChildren is negative, or instances are requested
     *                                  from a scope with no template child
     */
    public int apply(RenderContext context, int numChildren, List<? extends TransformFunction> transforms,
                     double dist) {
        Objects.requireNonNull(context, "context cannot be null");
        Objects.requireNonNull(transforms, "transforms cannot be null");
        if (transforms.isEmpty()) {
            throw new IllegalArgumentException("Transform array must not be empty");
        }
        if (numChildren < 0) {
            throw new IllegalArgumentException("numChildren must be non-negative: " + numChildren);
        }
        var palette = List.copyOf(transforms);
        var length = palette.size();
        if (numChildren > 0 && context.childCount() <= TEMPLATE_INDEX) {
            throw new IllegalArgumentException("No template child in scope for " + numChildren + " instances");
        }
        log.debug("Mapping {} instances over {} transforms, dist: {}", numChildren, length, dist);
        for (int i = 0; i < numChildren; i++) {
            var cycle = cycle(i, length);
            var funcIndex = i % length;
            var matrix = palette.get(funcIndex).evaluate(cycle * dist);
            log.trace("instance: {} function: {} cycle: {}", i, funcIndex, cycle);
            context.renderChildAt(TEMPLATE_INDEX, matrix);
        }
        return numChildren;
    }
}
