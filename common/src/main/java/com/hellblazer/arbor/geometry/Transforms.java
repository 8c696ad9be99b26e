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

import javax.vecmath.Matrix4d;
import javax.vecmath.Tuple3d;
import javax.vecmath.Vector3d;
import java.util.Objects;

/**
 * Canonical affine matrix builders.
 *
 * <p>All angles are in degrees. Rotations are right handed. Every builder answers a matrix whose last row is
 * {@code [0, 0, 0, 1]}.
 *
 * <p><b>Thread Safety:</b> All methods are stateless and thread-safe.
 *
 * @author hal.hildebrand
 * @see Polygons
 * @see Skew
 */
public final class Transforms {

    /** Tangent of a skew angle is undefined within this many degrees of 90 (mod 180) */
    static final double SKEW_POLE_TOLERANCE = 1e-9;

    private Transforms() {
        // Prevent instantiation
    }

    /**
     * The neutral element of composition.
     *
     * @return the identity matrix
     */
    public static AffineMatrix identity() {
        return AffineMatrix.identity();
    }

    /**
     * Identity scale, the result of omitting every factor.
     *
     * @return the identity matrix
     */
    public static AffineMatrix scale() {
        return identity();
    }

    /**
     * Scale along X only; the omitted factors are 1.
     *
     * @param sx x factor
     * @return the scale matrix
     */
    public static AffineMatrix scale(double sx) {
        return scale(sx, 1, 1);
    }

    /**
     * Scale along X and Y; the omitted Z factor is 1.
     *
     * @param sx x factor
     * @param sy y factor
     * @return the scale matrix
     */
    public static AffineMatrix scale(double sx, double sy) {
        return scale(sx, sy, 1);
    }

    /**
     * Uniform scale.
     *
     * @param s the factor applied on all three axes
     * @return the scale matrix
     */
    public static AffineMatrix uniformScale(double s) {
        return scale(s, s, s);
    }

    /**
     * Diagonal scale matrix.
     *
     * @param sx x factor
     * @param sy y factor
     * @param sz z factor
     * @return the scale matrix
     */
    public static AffineMatrix scale(double sx, double sy, double sz) {
        var matrix = new Matrix4d();
        matrix.m00 = sx;
        matrix.m11 = sy;
        matrix.m22 = sz;
        matrix.m33 = 1;
        return AffineMatrix.of(matrix);
    }

    /**
     * Rotation about the X axis, from Y towards Z.
     *
     * @param angle degrees
     * @return the rotation matrix
     */
    public static AffineMatrix rotateX(double angle) {
        var matrix = new Matrix4d();
        matrix.rotX(Math.toRadians(angle));
        return AffineMatrix.of(matrix);
    }

    /**
     * Rotation about the Y axis, from Z towards X.
     *
     * @param angle degrees
     * @return the rotation matrix
     */
    public static AffineMatrix rotateY(double angle) {
        var matrix = new Matrix4d();
        matrix.rotY(Math.toRadians(angle));
        return AffineMatrix.of(matrix);
    }

    /**
     * Rotation about the Z axis, from X towards Y.
     *
     * @param angle degrees
     * @return the rotation matrix
     */
    public static AffineMatrix rotateZ(double angle) {
        var matrix = new Matrix4d();
        matrix.rotZ(Math.toRadians(angle));
        return AffineMatrix.of(matrix);
    }

    /**
     * Combined rotation: about X first, then Y, then Z. The result is exactly
     * {@code rotateZ(angleZ) * rotateY(angleY) * rotateX(angleX)}, which matches a host primitive's
     * {@code rotate([x, y, z])}.
     *
     * @param angleX degrees about X
     * @param angleY degrees about Y
     * @param angleZ degrees about Z
     * @return the rotation matrix
     */
    public static AffineMatrix rotate(double angleX, double angleY, double angleZ) {
        return rotateZ(angleZ).multiply(rotateY(angleY)).multiply(rotateX(angleX));
    }

    /**
     * Identity with the translation column set to (dx, dy, dz, 1).
     *
     * @param dx x offset
     * @param dy y offset
     * @param dz z offset
     * @return the translation matrix
     */
    public static AffineMatrix translate(double dx, double dy, double dz) {
        var matrix = new Matrix4d();
        matrix.setIdentity();
        matrix.setTranslation(new Vector3d(dx, dy, dz));
        return AffineMatrix.of(matrix);
    }

    /**
     * @param offset the translation
     * @return the translation matrix
     */
    public static AffineMatrix translate(Tuple3d offset) {
        Objects.requireNonNull(offset, "offset cannot be null");
        return translate(offset.x, offset.y, offset.z);
    }

    /**
     * Shear matrix. Each named angle sets one off diagonal element to its tangent: {@code xy} is the x displacement
     * per unit of y, {@code xz} the x displacement per unit of z, and so on. Use {@link Skew} to supply only some of
     * the angles.
     *
     * @return the skew matrix
     * @throws IllegalArgumentException if any angle is congruent to 90 degrees modulo 180
     */
    public static AffineMatrix skew(double xy, double xz, double yx, double yz, double zx, double zy) {
        var matrix = new Matrix4d();
        matrix.setIdentity();
        matrix.m01 = tangent("xy", xy);
        matrix.m02 = tangent("xz", xz);
        matrix.m10 = tangent("yx", yx);
        matrix.m12 = tangent("yz", yz);
        matrix.m20 = tangent("zx", zx);
        matrix.m21 = tangent("zy", zy);
        return AffineMatrix.of(matrix);
    }

    /**
     * Reflection across the plane through the origin with the given normal.
     *
     * @return the mirror matrix
     * @throws IllegalArgumentException if the normal is the zero vector
     */
    public static AffineMatrix mirror(double nx, double ny, double nz) {
        var lengthSquared = nx * nx + ny * ny + nz * nz;
        if (lengthSquared == 0) {
            throw new IllegalArgumentException("Mirror normal must be non-zero");
        }
        var n = new double[] { nx, ny, nz };
        var matrix = new Matrix4d();
        matrix.setIdentity();
        for (int row = 0; row < 3; row++) {
            for (int col = 0; col < 3; col++) {
                var identity = row == col ? 1.0 : 0.0;
                matrix.setElement(row, col, identity - 2 * n[row] * n[col] / lengthSquared);
            }
        }
        return AffineMatrix.of(matrix);
    }

    /**
     * Left to right product of the chain: {@code compose(a, b, c) == a * b * c}. Applying the result applies
     * {@code c} first and {@code a} last.
     *
     * @param chain the matrices to multiply
     * @return the product, identity for an empty chain
     */
    public static AffineMatrix compose(AffineMatrix... chain) {
        Objects.requireNonNull(chain, "chain cannot be null");
        if (chain.length == 0) {
            return identity();
        }
        var result = Objects.requireNonNull(chain[0], "chain element cannot be null");
        for (int i = 1; i < chain.length; i++) {
            result = result.multiply(chain[i]);
        }
        return result;
    }

    private static double tangent(String name, double angle) {
        var offPole = Math.abs(Math.abs(Math.IEEEremainder(angle, 180)) - 90);
        if (offPole <= SKEW_POLE_TOLERANCE) {
            throw new IllegalArgumentException("Skew angle " + name + " has undefined tangent: " + angle);
        }
        return Math.tan(Math.toRadians(angle));
    }
}
