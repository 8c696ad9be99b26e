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
import java.util.Objects;

/**
 * Transforms and labels indexed by recursion depth. Lookups clamp the depth into the table, so the last entry serves
 * every depth beyond the end of the table and an entry added at index {@code k} also governs all deeper levels.
 *
 * <p>Immutable and thread-safe.
 *
 * @author hal.hildebrand
 */
public final class DepthTransformTable {

    /**
     * @param transform evaluated with {@code (size, inclination, zRotation)}
     * @param label     display label, such as a color
     */
    public record Entry(TransformFunction transform, String label) {
        public Entry {
            Objects.requireNonNull(transform, "transform cannot be null");
            Objects.requireNonNull(label, "label cannot be null");
        }
    }

    public static class Builder {
        private final List<Entry> entries = new ArrayList<>();

        public Builder add(TransformFunction transform, String label) {
            entries.add(new Entry(transform, label));
            return this;
        }

        public DepthTransformTable build() {
            return new DepthTransformTable(entries);
        }
    }

    private final List<Entry> entries;

    /**
     * @param entries the entries, index 0 first
     * @throws IllegalArgumentException if there are no entries
     */
    public DepthTransformTable(List<Entry> entries) {
        Objects.requireNonNull(entries, "entries cannot be null");
        if (entries.isEmpty()) {
            throw new IllegalArgumentException("Depth transform table must not be empty");
        }
        this.entries = List.copyOf(entries);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static DepthTransformTable of(Entry... entries) {
        return new DepthTransformTable(List.of(entries));
    }

    /**
     * @param depth any depth
     * @return {@code clamp(depth, 0, size - 1)}
     */
    public int clamp(int depth) {
        return Math.max(0, Math.min(depth, entries.size() - 1));
    }

    /**
     * @param depth any depth
     * @return the entry at the clamped depth
     */
    public Entry at(int depth) {
        return entries.get(clamp(depth));
    }

    public List<Entry> entries() {
        return entries;
    }

    public String labelAt(int depth) {
        return at(depth).label();
    }

    public int size() {
        return entries.size();
    }

    public TransformFunction transformAt(int depth) {
        return at(depth).transform();
    }

    @Override
    public String toString() {
        return "DepthTransformTable" + entries.stream().map(Entry::label).toList();
    }
}
