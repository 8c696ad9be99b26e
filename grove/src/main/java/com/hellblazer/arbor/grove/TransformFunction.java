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

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.DoubleFunction;

/**
 * A pure function from numeric parameters to an affine matrix. Applicators call it with a single distance, the branch
 * generator with {@code (size, inclination, zRotation)}.
 *
 * <p>Implementations must be referentially transparent: the same parameters always answer an equal matrix.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface TransformFunction {

    /**
     * Function that ignores its parameters
     */
    static TransformFunction constant(AffineMatrix matrix) {
        Objects.requireNonNull(matrix, "matrix cannot be null");
        return params -> matrix;
    }

    /**
     * Adapt a function of the first parameter
     */
    static TransformFunction scalar(DoubleFunction<AffineMatrix> function) {
        Objects.requireNonNull(function, "function cannot be null");
        return params -> {
            if (params.length == 0) {
                throw new IllegalArgumentException("Scalar transform requires a parameter");
            }
            return function.apply(params[0]);
        };
    }

    /**
     * Compute the matrix for the parameters
     *
     * @param params the parameters, commonly a single index or distance
     * @return the matrix
     */
    AffineMatrix evaluate(double... params);

    /**
     * Apply {@code extra} after the receiver's transform: answers {@code params -> extra * evaluate(params)}
     */
    default TransformFunction andThen(AffineMatrix extra) {
        Objects.requireNonNull(extra, "extra cannot be null");
        return params -> extra.multiply(evaluate(params));
    }

    /**
     * Apply the receiver's transform after {@code first}: answers {@code params -> evaluate(params) * first}
     */
    default TransformFunction compose(AffineMatrix first) {
        Objects.requireNonNull(first, "first cannot be null");
        return params -> evaluate(params).multiply(first);
    }

    /**
     * Cache results by parameter values. The cache is unbounded and lives as long as the returned function: every
     * distinct parameter list keeps its matrix, so memoize functions evaluated over a small, recurring parameter set
     * rather than per child distances.
     */
    default TransformFunction memoized() {
        Map<ParameterKey, AffineMatrix> cache = new ConcurrentHashMap<>();
        return params -> cache.computeIfAbsent(new ParameterKey(params), key -> evaluate(key.values()));
    }
}
