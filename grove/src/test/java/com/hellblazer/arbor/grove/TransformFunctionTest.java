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

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static com.hellblazer.arbor.geometry.Transforms.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TransformFunction factories and combinators.
 *
 * @author hal.hildebrand
 */
public class TransformFunctionTest {

    @Test
    public void testConstant() {
        var f = TransformFunction.constant(rotateX(30));
        assertEquals(rotateX(30), f.evaluate());
        assertEquals(rotateX(30), f.evaluate(1, 2, 3));
    }

    @Test
    public void testScalarUsesFirstParameter() {
        var f = TransformFunction.scalar(d -> translate(d, 0, 0));
        assertEquals(translate(7, 0, 0), f.evaluate(7));
        assertEquals(translate(7, 0, 0), f.evaluate(7, 99));
        assertThrows(IllegalArgumentException.class, f::evaluate);
    }

    @Test
    public void testReferentialTransparency() {
        var f = TransformFunction.scalar(d -> rotate(d, 2 * d, 3 * d).multiply(translate(d, d, d)));
        assertEquals(f.evaluate(12.5), f.evaluate(12.5));
    }

    @Test
    public void testAndThenAppliesExtraAfter() {
        var f = TransformFunction.scalar(d -> translate(d, 0, 0));
        var extra = rotateZ(90);
        assertEquals(extra.multiply(translate(4, 0, 0)), f.andThen(extra).evaluate(4));
    }

    @Test
    public void testComposeAppliesFirstBefore() {
        var f = TransformFunction.scalar(d -> translate(d, 0, 0));
        var first = uniformScale(2);
        assertEquals(translate(4, 0, 0).multiply(first), f.compose(first).evaluate(4));
    }

    @Test
    public void testMemoized() {
        var calls = new AtomicInteger();
        TransformFunction f = params -> {
            calls.incrementAndGet();
            return translate(params[0], params[1], 0);
        };
        var memo = f.memoized();
        var first = memo.evaluate(1, 2);
        var second = memo.evaluate(1, 2);
        assertSame(first, second);
        assertEquals(1, calls.get());

        assertEquals(translate(2, 1, 0), memo.evaluate(2, 1));
        assertEquals(2, calls.get());
    }

    @Test
    public void testNullArguments() {
        assertThrows(NullPointerException.class, () -> TransformFunction.constant(null));
        assertThrows(NullPointerException.class, () -> TransformFunction.scalar(null));
        assertThrows(NullPointerException.class, () -> TransformFunction.constant(identity()).andThen(null));
    }
}
