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

import static com.hellblazer.arbor.geometry.Transforms.rotateZ;
import static com.hellblazer.arbor.geometry.Transforms.translate;
import static java.lang.Math.cos;
import static java.lang.Math.sin;
import static java.lang.Math.toRadians;

/**
 * Regular polygon measures and placement of objects on the sides of a regular n-gon prism.
 *
 * <p>Polygons are centered on the origin in the XY plane with vertex 0 on the positive X axis. Side {@code s} runs from
 * vertex {@code s} to vertex {@code s + 1}, counter clockwise.
 *
 * @author hal.hildebrand
 */
public final class Polygons {

    private Polygons() {
        // Prevent instantiation
    }

    /**
     * Length of one side of a regular polygon.
     *
     * @param height the circumradius
     * @param sides  number of sides
     * @return {@code 2 * height * sin(180 / sides)}
     */
    public static double sideLength(double height, int sides) {
        validateSides(sides);
        return 2 * height * sin(toRadians(180.0 / sides));
    }

    /**
     * @param sides number of sides
     * @return the sum of the interior angles, in degrees
     */
    public static double totalInteriorDegrees(int sides) {
        validateSides(sides);
        return (sides - 2) * 180.0;
    }

    /**
     * @param sides number of sides
     * @return a single interior angle, in degrees
     */
    public static double interiorAngle(int sides) {
        return totalInteriorDegrees(sides) / sides;
    }

    /**
     * Distance from the center to the midpoint of a side.
     *
     * @param radius the circumradius
     * @param sides  number of sides
     * @return the apothem
     */
    public static double apothem(double radius, int sides) {
        validateSides(sides);
        return radius * cos(toRadians(180.0 / sides));
    }

    /**
     * Position an object centered on a side of a regular prism. The object's local X axis runs along the side.
     *
     * <p>Periodic in {@code sideNumber}: side {@code s} and side {@code s + sides} answer the identical matrix.
     *
     * @param sideNumber the side, any integer
     * @param sides      number of sides
     * @param radius     the circumradius
     * @return {@code translate(x, y, 0) * rotateZ(theta) * translate(sideLength / 2, 0, 0)}
     * @throws IllegalArgumentException if sides &lt; 1
     */
    public static AffineMatrix placeOnPolygonSide(int sideNumber, int sides, double radius) {
        validateSides(sides);
        var side = Math.floorMod(sideNumber, sides);
        var vertexAngle = toRadians(360.0 / sides * side);
        var theta = 360.0 * (0.25 + (side + 0.5) / sides);
        var vertex = translate(radius * cos(vertexAngle), radius * sin(vertexAngle), 0);
        var halfSide = translate(sideLength(radius, sides) / 2, 0, 0);
        return vertex.multiply(rotateZ(theta)).multiply(halfSide);
    }

    /**
     * Position an object at a vertex of a regular prism, lifted by {@code zOffset} and turned to face the vertex
     * direction. Unlike {@link #placeOnPolygonSide(int, int, double)} there is no re-centering on the side.
     *
     * @param sideNumber the side, any integer
     * @param sides      number of sides
     * @param radius     the circumradius
     * @param zOffset    the lift along Z
     * @return {@code translate(x, y, zOffset) * rotateZ(sideNumber * 360 / sides)}
     * @throws IllegalArgumentException if sides &lt; 1
     */
    public static AffineMatrix placeOnPolygonSideWithZOffset(int sideNumber, int sides, double radius,
                                                             double zOffset) {
        validateSides(sides);
        var side = Math.floorMod(sideNumber, sides);
        var angle = 360.0 / sides * side;
        var radians = toRadians(angle);
        return translate(radius * cos(radians), radius * sin(radians), zOffset).multiply(rotateZ(angle));
    }

    private static void validateSides(int sides) {
        if (sides < 1) {
            throw new IllegalArgumentException("A polygon must have at least one side: " + sides);
        }
    }
}
