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

/**
 * Value semantics for a parameter array, used as a memoization key
 *
 * @author hal.hildebrand
 */
final class ParameterKey {
    private final double[] values;

    ParameterKey(double... values) {
        this.values = values.clone();
    }

    double[] values() {
        return values.clone();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof ParameterKey other && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "ParameterKey" + Arrays.toString(values);
    }
}
