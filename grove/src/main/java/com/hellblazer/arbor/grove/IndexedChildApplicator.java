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
import com.hellblazer.arbor.geometry.Transforms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Applies one matrix per child of a {@link RenderContext}, by position.
 *
 * <p>Both modes read the child count once, then visit children 0 .. N - 1 exactly once in ascending order, handing
 * each a single final matrix.
 *
 * <ul>
 * <li><b>Function mode</b>: child {@code i} receives {@code f((i + 1) * dist)}</li>
 * <li><b>Fixed-transform mode</b>: child {@code i} receives {@code extra * baseStep((i + 1) * dist)}, so the extra
 * transform is applied after the per-index step</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public class IndexedChildApplicator {

    /** Per-index step used when none is supplied: march along X */
    public static final TransformFunction DEFAULT_BASE_STEP = TransformFunction.scalar(
    d -> Transforms.translate(d, 0, 0));

    private static final Logger log = LoggerFactory.getLogger(IndexedChildApplicator.class);

    private final TransformFunction baseStep;

    public IndexedChildApplicator() {
        this(DEFAULT_BASE_STEP);
    }

    /**
     * @param baseStep the per-index step used by fixed-transform mode
     */
    public IndexedChildApplicator(TransformFunction baseStep) {
        this.baseStep = Objects.requireNonNull(baseStep, "baseStep cannot be null");
    }

    /**
     * Function mode: render child {@code i} with {@code f((i + 1) * dist)}.
     *
     * @param context the children and renderer
     * @param f       the transform function
     * @param dist    spacing between consecutive children
     * @return the number of children rendered
     */
    public int applyFunction(RenderContext context, TransformFunction f, double dist) {
        Objects.requireNonNull(context, "context cannot be null");
        Objects.requireNonNull(f, "f cannot be null");
        final var n = context.childCount();
        log.debug("Applying transform function to {} children, dist: {}", n, dist);
        for (int i = 0; i < n; i++) {
            var matrix = f.evaluate((i + 1) * dist);
            log.trace("child: {} matrix: {}", i, matrix);
            context.renderChildAt(i, matrix);
        }
        return n;
    }

    /**
     * Fixed-transform mode using this applicator's base step.
     *
     * @param context the children and renderer
     * @param extra   transform applied after the per-index step
     * @param dist    spacing between consecutive children
     * @return the number of children rendered
     */
    public int applyFixed(RenderContext context, AffineMatrix extra, double dist) {
        return applyFixed(context, baseStep, extra, dist);
    }

    /**
     * Fixed-transform mode: render child {@code i} with {@code extra * baseStep((i + 1) * dist)}.
     *
     * @param context  the children and renderer
     * @param baseStep the per-index step
     * @param extra    transform applied after the per-index step
     * @param dist     spacing between consecutive children
     * @return the number of children rendered
     */
    public int applyFixed(RenderContext context, TransformFunction baseStep, AffineMatrix extra, double dist) {
        Objects.requireNonNull(baseStep, "baseStep cannot be null");
        Objects.requireNonNull(extra, "extra cannot be null");
        return applyFunction(context, baseStep.andThen(extra), dist);
    }

    /**
     * @return the per-index step used by fixed-transform mode
     */
    public TransformFunction baseStep() {
        return baseStep;
    }
}
