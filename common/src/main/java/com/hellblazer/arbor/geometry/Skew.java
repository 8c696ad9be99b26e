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
package com.hellblazer.arbor.geometry;

/**
 * Fluent skew angles. Every angle not set stays 0, so {@code Skew.builder().build()} is the identity.
 *
 * @author hal.hildebrand
 */
public final class Skew {

    private double xy, xz, yx, yz, zx, zy;

    private Skew() {
    }

    public static Skew builder() {
        return new Skew();
    }

    /**
     * @return the skew matrix
     * @throws IllegalArgumentException if any angle is congruent to 90 degrees modulo 180
     */
    public AffineMatrix build() {
        return Transforms.skew(xy, xz, yx, yz, zx, zy);
    }

    public Skew xy(double angle) {
        xy = angle;
        return this;
    }

    public Skew xz(double angle) {
        xz = angle;
        return this;
    }

    public Skew yx(double angle) {
        yx = angle;
        return this;
    }

    public Skew yz(double angle) {
        yz = angle;
        return this;
    }

    public Skew zx(double angle) {
        zx = angle;
        return this;
    }

    public Skew zy(double angle) {
        zy = angle;
        return this;
    }
}
