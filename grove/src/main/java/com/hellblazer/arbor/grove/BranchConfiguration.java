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

import com.hellblazer.arbor.grove.Primitive.Kind;

import java.util.Objects;

/**
 * Configuration of the solids emitted by {@link BranchGenerator}.
 *
 * <p>Trunks are emitted with dimensions {@code (size, size * trunkRadiusRatio)} and leaves with
 * {@code (size * leafSizeRatio)}, where {@code size} is the node's current trunk length.
 *
 * <p>Thread-safe and immutable after construction.
 *
 * @author hal.hildebrand
 */
public final class BranchConfiguration {

    /** Default trunk solid */
    public static final Kind DEFAULT_TRUNK_KIND = Kind.CYLINDER;

    /** Default trunk radius as a fraction of its length */
    public static final double DEFAULT_TRUNK_RADIUS_RATIO = 0.1;

    /** Default leaf solid */
    public static final Kind DEFAULT_LEAF_KIND = Kind.SPHERE;

    /** Default leaf size as a fraction of the last trunk length */
    public static final double DEFAULT_LEAF_SIZE_RATIO = 0.2;

    private final Kind   trunkKind;
    private final double trunkRadiusRatio;
    private final Kind   leafKind;
    private final double leafSizeRatio;

    /**
     * @throws IllegalArgumentException if a ratio is not positive
     */
    public BranchConfiguration(Kind trunkKind, double trunkRadiusRatio, Kind leafKind, double leafSizeRatio) {
        Objects.requireNonNull(trunkKind, "trunkKind cannot be null");
        Objects.requireNonNull(leafKind, "leafKind cannot be null");
        if (!(trunkRadiusRatio > 0)) {
            throw new IllegalArgumentException("trunkRadiusRatio must be positive: " + trunkRadiusRatio);
        }
        if (!(leafSizeRatio > 0)) {
            throw new IllegalArgumentException("leafSizeRatio must be positive: " + leafSizeRatio);
        }
        this.trunkKind = trunkKind;
        this.trunkRadiusRatio = trunkRadiusRatio;
        this.leafKind = leafKind;
        this.leafSizeRatio = leafSizeRatio;
    }

    public static BranchConfiguration defaultConfig() {
        return new BranchConfiguration(DEFAULT_TRUNK_KIND, DEFAULT_TRUNK_RADIUS_RATIO, DEFAULT_LEAF_KIND,
                                       DEFAULT_LEAF_SIZE_RATIO);
    }

    /**
     * @param size the leaf's parent trunk length
     * @return the leaf solid
     */
    public Primitive leaf(double size) {
        return switch (leafKind) {
            case CYLINDER -> Primitive.cylinder(size * leafSizeRatio, size * leafSizeRatio / 2);
            case CUBE -> Primitive.cube(size * leafSizeRatio);
            case SPHERE -> Primitive.sphere(size * leafSizeRatio);
        };
    }

    public Kind leafKind() {
        return leafKind;
    }

    public double leafSizeRatio() {
        return leafSizeRatio;
    }

    /**
     * @param size the trunk length
     * @return the trunk solid
     */
    public Primitive trunk(double size) {
        return switch (trunkKind) {
            case CYLINDER -> Primitive.cylinder(size, size * trunkRadiusRatio);
            case CUBE -> Primitive.cube(size);
            case SPHERE -> Primitive.sphere(size / 2);
        };
    }

    public Kind trunkKind() {
        return trunkKind;
    }

    public double trunkRadiusRatio() {
        return trunkRadiusRatio;
    }

    public BranchConfiguration withLeafKind(Kind newLeafKind) {
        return new BranchConfiguration(trunkKind, trunkRadiusRatio, newLeafKind, leafSizeRatio);
    }

    public BranchConfiguration withLeafSizeRatio(double newLeafSizeRatio) {
        return new BranchConfiguration(trunkKind, trunkRadiusRatio, leafKind, newLeafSizeRatio);
    }

    public BranchConfiguration withTrunkKind(Kind newTrunkKind) {
        return new BranchConfiguration(newTrunkKind, trunkRadiusRatio, leafKind, leafSizeRatio);
    }

    public BranchConfiguration withTrunkRadiusRatio(double newTrunkRadiusRatio) {
        return new BranchConfiguration(trunkKind, newTrunkRadiusRatio, leafKind, leafSizeRatio);
    }

    @Override
    public String toString() {
        return String.format("BranchConfiguration[trunkKind=%s, trunkRadiusRatio=%.3f, leafKind=%s, leafSizeRatio=%.3f]",
                             trunkKind, trunkRadiusRatio, leafKind, leafSizeRatio);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        var other = (BranchConfiguration) obj;
        return trunkKind == other.trunkKind &&
               leafKind == other.leafKind &&
               Double.compare(trunkRadiusRatio, other.trunkRadiusRatio) == 0 &&
               Double.compare(leafSizeRatio, other.leafSizeRatio) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(trunkKind, trunkRadiusRatio, leafKind, leafSizeRatio);
    }
}
