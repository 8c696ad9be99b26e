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
import com.hellblazer.arbor.geometry.Transforms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Grows a branching structure from a compact DNA and a {@link DepthTransformTable}.
 *
 * <p>At a node of remaining depth {@code n} and trunk length {@code size}:
 * <ol>
 * <li>the trunk is emitted in the node's frame, labelled {@code table[clamp(n + 1)]}</li>
 * <li>for each descriptor {@code (inclination, zRotation, scale)}, in DNA order, the child frame is the node frame
 * times {@code table[clamp(n)].transform(size, inclination, zRotation)}. While {@code n > 0} a child node of size
 * {@code scale * size} and depth {@code n - 1} grows there; at {@code n == 0} a leaf labelled {@code table[clamp(n)]}
 * is emitted instead</li>
 * </ol>
 * Traversal is pre-order: each sibling is fully grown before the next begins. Because lookups clamp, the deepest
 * table entry governs every level beyond the table's end.
 *
 * @author hal.hildebrand
 */
public class BranchGenerator {

    private static final Logger log = LoggerFactory.getLogger(BranchGenerator.class);

    private final BranchConfiguration config;

    public BranchGenerator() {
        this(BranchConfiguration.defaultConfig());
    }

    public BranchGenerator(BranchConfiguration config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    public BranchConfiguration config() {
        return config;
    }

    /**
     * Grow from the identity frame.
     *
     * @param context receives the trunk and leaf primitives
     * @param size    trunk length of the root
     * @param dna     branch descriptors applied at every node
     * @param n       recursion depth, 0 grows a single trunk with leaves
     * @param table   transforms and labels by depth
     * @return the number of primitives emitted
     * @throws IllegalArgumentException if n is negative
     */
    public int grow(RenderContext context, double size, List<BranchDescriptor> dna, int n,
                    DepthTransformTable table) {
        return grow(context, Transforms.identity(), size, dna, n, table);
    }

    /**
     * Grow from the supplied root frame.
     *
     * @param context receives the trunk and leaf primitives
     * @param root    frame of the root trunk
     * @param size    trunk length of the root
     * @param dna     branch descriptors applied at every node
     * @param n       recursion depth, 0 grows a single trunk with leaves
     * @param table   transforms and labels by depth
     * @return the number of primitives emitted
     * @throws IllegalArgumentException if n is negative
     */
    public int grow(RenderContext context, AffineMatrix root, double size, List<BranchDescriptor> dna, int n,
                    DepthTransformTable table) {
        Objects.requireNonNull(context, "context cannot be null");
        Objects.requireNonNull(root, "root cannot be null");
        Objects.requireNonNull(dna, "dna cannot be null");
        Objects.requireNonNull(table, "table cannot be null");
        if (n < 0) {
            throw new IllegalArgumentException("Recursion depth must be non-negative: " + n);
        }
        var genome = List.copyOf(dna);
        log.debug("Growing depth: {} size: {} branches per node: {} table: {}", n, size, genome.size(), table);
        var emitted = node(context, root, size, genome, n, table);
        log.debug("Grew {} primitives", emitted);
        return emitted;
    }

    private int node(RenderContext context, AffineMatrix frame, double size, List<BranchDescriptor> dna, int n,
                     DepthTransformTable table) {
        context.renderPrimitive(config.trunk(size), frame, table.labelAt(n == Integer.MAX_VALUE ? n : n + 1));
        var emitted = 1;
        var entry = table.at(n);
        for (var branch : dna) {
            var placement = entry.transform().evaluate(size, branch.inclination(), branch.zRotation());
            var childFrame = frame.multiply(placement);
            if (n > 0) {
                emitted += node(context, childFrame, branch.scaleFactor() * size, dna, n - 1, table);
            } else {
                log.trace("leaf: {} at: {}", entry.label(), childFrame);
                context.renderPrimitive(config.leaf(size), childFrame, entry.label());
                emitted++;
            }
        }
        return emitted;
    }
}
