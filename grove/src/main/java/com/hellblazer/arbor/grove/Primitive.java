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

import java.util.Arrays;
import java.util.Objects;

/**
 * A non-child solid handed to the {@link RenderContext}, described by its kind and dimensions.
 *
 * @param kind       the solid
 * @param dimensions kind specific dimensions: {@code (size)} for a cube, {@code (radius)} for a sphere,
 *                   {@code (height, radius)} for a cylinder
 * @author hal.hildebrand
 */
public record Primitive(Kind kind, double... dimensions) {

    public enum Kind {
        CUBE, SPHERE, CYLINDER
    }

    public Primitive {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(dimensions, "dimensions cannot be null");
        dimensions = dimensions.clone();
    }

    public static Primitive cube(double size) {
        return new Primitive(Kind.CUBE, size);
    }

    public static Primitive cylinder(double height, double radius) {
        return new Primitive(Kind.CYLINDER, height, radius);
    }

    public static Primitive sphere(double radius) {
        return new Primitive(Kind.SPHERE, radius);
    }

    @Override
    public double[] dimensions() {
        return dimensions.clone();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Primitive other && kind == other.kind && Arrays.equals(dimensions, other.dimensions);
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + Arrays.hashCode(dimensions);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + Arrays.toString(dimensions);
    }
}
