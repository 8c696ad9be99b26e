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

import javax.vecmath.Matrix3d;
import javax.vecmath.Matrix4d;
import javax.vecmath.Point3d;
import javax.vecmath.Vector3d;
import java.util.Objects;

/**
 * Immutable 4x4 homogeneous matrix, stored row major.
 *
 * <p>The arithmetic is delegated to {@link Matrix4d}; every operation works on a private copy so instances are never
 * mutated once constructed. Matrices produced by {@link Transforms} and {@link Polygons} satisfy the affine invariant
 * (last row is exactly {@code [0, 0, 0, 1]}), and the product of two affine matrices is affine as well.
 *
 * <p>Composition convention: to apply {@code A} and then {@code B}, use {@code B.multiply(A)}, or equivalently
 * {@code A.then(B)}.
 *
 * <p><b>Thread Safety:</b> Instances are immutable and thread-safe.
 *
 * @author hal.hildebrand
 */
public final class AffineMatrix {

    private static final AffineMatrix IDENTITY = new AffineMatrix(
    new double[] { 1, 0, 0, 0, 0, 1, 0, 0, 0, 0, 1, 0, 0, 0, 0, 1 });

    private final double[] m;

    private AffineMatrix(double[] m) {
        this.m = m;
    }

    /**
     * Copy the supplied vecmath matrix.
     *
     * @param matrix the source matrix
     * @return an immutable matrix with the same elements
     */
    public static AffineMatrix of(Matrix4d matrix) {
        Objects.requireNonNull(matrix, "matrix cannot be null");
        var elements = new double[16];
        for (int row = 0; row < 4; row++) {
            for (int col = 0; col < 4; col++) {
                elements[row * 4 + col] = matrix.getElement(row, col);
            }
        }
        return new AffineMatrix(elements);
    }

    /**
     * Create a matrix from 16 row major elements.
     *
     * @param elements row major elements, copied
     * @return the matrix
     * @throws IllegalArgumentException if there are not exactly 16 elements
     */
    public static AffineMatrix ofRowMajor(double... elements) {
        Objects.requireNonNull(elements, "elements cannot be null");
        if (elements.length != 16) {
            throw new IllegalArgumentException("A 4x4 matrix requires 16 elements: " + elements.length);
        }
        return new AffineMatrix(elements.clone());
    }

    /**
     * Create a matrix from rows.
     *
     * @param rows four rows of four elements each, copied
     * @return the matrix
     * @throws IllegalArgumentException if the shape is not 4x4
     */
    public static AffineMatrix ofRows(double[][] rows) {
        Objects.requireNonNull(rows, "rows cannot be null");
        if (rows.length != 4) {
            throw new IllegalArgumentException("A 4x4 matrix requires 4 rows: " + rows.length);
        }
        var elements = new double[16];
        for (int row = 0; row < 4; row++) {
            if (rows[row] == null || rows[row].length != 4) {
                throw new IllegalArgumentException("Row " + row + " must have 4 columns");
            }
            System.arraycopy(rows[row], 0, elements, row * 4, 4);
        }
        return new AffineMatrix(elements);
    }

    /**
     * @return the shared identity matrix
     */
    static AffineMatrix identity() {
        return IDENTITY;
    }

    private static boolean same(double a, double b) {
        return a == b || (Double.isNaN(a) && Double.isNaN(b));
    }

    /**
     * Element accessor.
     *
     * @param row the row, 0..3
     * @param col the column, 0..3
     * @return the element at the row and column
     */
    public double get(int row, int col) {
        if (row < 0 || row > 3 || col < 0 || col > 3) {
            throw new IndexOutOfBoundsException("Invalid element: [" + row + ", " + col + "]");
        }
        return m[row * 4 + col];
    }

    /**
     * Answer {@code this * other}. Applying the result is equivalent to applying {@code other} first and then the
     * receiver.
     *
     * @param other the right hand operand
     * @return the product
     */
    public AffineMatrix multiply(AffineMatrix other) {
        Objects.requireNonNull(other, "other cannot be null");
        var result = new Matrix4d();
        result.mul(toMatrix4d(), other.toMatrix4d());
        return of(result);
    }

    /**
     * Answer the transform that applies the receiver first and then {@code next}, i.e. {@code next * this}.
     *
     * @param next the transform applied after the receiver
     * @return the composed transform
     */
    public AffineMatrix then(AffineMatrix next) {
        Objects.requireNonNull(next, "next cannot be null");
        return next.multiply(this);
    }

    /**
     * Transform a point, including the translation component.
     *
     * @param point the point, unchanged
     * @return a new transformed point
     */
    public Point3d transform(Point3d point) {
        Objects.requireNonNull(point, "point cannot be null");
        var result = new Point3d();
        toMatrix4d().transform(point, result);
        return result;
    }

    /**
     * Transform a direction. Translation does not apply to vectors.
     *
     * @param vector the vector, unchanged
     * @return a new transformed vector
     */
    public Vector3d transform(Vector3d vector) {
        Objects.requireNonNull(vector, "vector cannot be null");
        var result = new Vector3d();
        toMatrix4d().transform(vector, result);
        return result;
    }

    /**
     * @return true if the last row is exactly [0, 0, 0, 1]
     */
    public boolean isAffine() {
        return m[12] == 0 && m[13] == 0 && m[14] == 0 && m[15] == 1;
    }

    /**
     * @return the translation column as a vector
     */
    public Vector3d translation() {
        return new Vector3d(m[3], m[7], m[11]);
    }

    /**
     * @return a copy of the upper left 3x3 block
     */
    public Matrix3d rotationBlock() {
        var block = new Matrix3d();
        toMatrix4d().getRotationScale(block);
        return block;
    }

    /**
     * @return a mutable vecmath copy of this matrix
     */
    public Matrix4d toMatrix4d() {
        return new Matrix4d(m);
    }

    /**
     * @return a copy of the elements as four rows
     */
    public double[][] toRows() {
        var rows = new double[4][4];
        for (int row = 0; row < 4; row++) {
            System.arraycopy(m, row * 4, rows[row], 0, 4);
        }
        return rows;
    }

    /**
     * Element-wise comparison within a tolerance.
     *
     * @param other   the matrix to compare
     * @param epsilon the largest permitted absolute difference per element
     * @return true if every element is within epsilon
     */
    public boolean epsilonEquals(AffineMatrix other, double epsilon) {
        Objects.requireNonNull(other, "other cannot be null");
        for (int i = 0; i < 16; i++) {
            if (!(Math.abs(m[i] - other.m[i]) <= epsilon)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AffineMatrix other)) return false;
        for (int i = 0; i < 16; i++) {
            if (!same(m[i], other.m[i])) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int result = 1;
        for (double v : m) {
            // -0.0 and 0.0 compare equal, so they must hash alike
            long bits = Double.doubleToLongBits(v + 0.0);
            result = 31 * result + (int) (bits ^ (bits >>> 32));
        }
        return result;
    }

    /**
     * Nested row notation, e.g. {@code [[1.0,0.0,0.0,5.0],[0.0,1.0,0.0,0.0],...]}, as accepted by OpenSCAD's
     * {@code multmatrix}.
     */
    @Override
    public String toString() {
        var builder = new StringBuilder("[");
        for (int row = 0; row < 4; row++) {
            builder.append(row == 0 ? "[" : ",[");
            for (int col = 0; col < 4; col++) {
                if (col > 0) {
                    builder.append(',');
                }
                builder.append(m[row * 4 + col]);
            }
            builder.append(']');
        }
        return builder.append(']').toString();
    }
}
