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
import com.hellblazer.arbor.grove.RenderEvent.ChildRendered;
import com.hellblazer.arbor.grove.RenderEvent.PrimitiveRendered;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A {@link RenderContext} over a fixed number of children that records every call in emission order. Hosts use it to
 * capture a scene and replay it into their own engine.
 *
 * <p>Not thread-safe; the applicators are single threaded.
 *
 * @author hal.hildebrand
 */
public class SceneRecorder implements RenderContext {

    private final int               childCount;
    private final List<RenderEvent> events = new ArrayList<>();
    private int                     childCountReads;

    /**
     * @param childCount the number of children in scope
     * @throws IllegalArgumentException if childCount is negative
     */
    public SceneRecorder(int childCount) {
        if (childCount < 0) {
            throw new IllegalArgumentException("childCount must be non-negative: " + childCount);
        }
        this.childCount = childCount;
    }

    @Override
    public int childCount() {
        childCountReads++;
        return childCount;
    }

    /**
     * @return how many times {@link #childCount()} has been read
     */
    public int childCountReads() {
        return childCountReads;
    }

    /**
     * @return the child events, in emission order
     */
    public List<ChildRendered> children() {
        return events.stream()
                     .filter(ChildRendered.class::isInstance)
                     .map(ChildRendered.class::cast)
                     .collect(Collectors.toList());
    }

    /**
     * Discard recorded events
     */
    public void clear() {
        events.clear();
    }

    /**
     * @return all events, in emission order
     */
    public List<RenderEvent> events() {
        return Collections.unmodifiableList(events);
    }

    /**
     * @return the primitive events, in emission order
     */
    public List<PrimitiveRendered> primitives() {
        return events.stream()
                     .filter(PrimitiveRendered.class::isInstance)
                     .map(PrimitiveRendered.class::cast)
                     .collect(Collectors.toList());
    }

    @Override
    public void renderChildAt(int index, AffineMatrix matrix) {
        Objects.requireNonNull(matrix, "matrix cannot be null");
        if (index < 0 || index >= childCount) {
            throw new IndexOutOfBoundsException("No child " + index + " in scope of " + childCount);
        }
        events.add(new ChildRendered(events.size(), index, matrix));
    }

    @Override
    public void renderPrimitive(Primitive primitive, AffineMatrix matrix, String label) {
        Objects.requireNonNull(primitive, "primitive cannot be null");
        Objects.requireNonNull(matrix, "matrix cannot be null");
        events.add(new PrimitiveRendered(events.size(), primitive, matrix, label));
    }
}
