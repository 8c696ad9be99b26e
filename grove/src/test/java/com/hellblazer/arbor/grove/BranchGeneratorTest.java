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
import com.hellblazer.arbor.grove.Primitive.Kind;
import com.hellblazer.arbor.grove.RenderEvent.PrimitiveRendered;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;
import java.util.ArrayList;
import java.util.List;

import static com.hellblazer.arbor.geometry.Transforms.identity;
import static com.hellblazer.arbor.geometry.Transforms.translate;
import static com.hellblazer.arbor.grove.TreePresets.BRANCH_LABEL;
import static com.hellblazer.arbor.grove.TreePresets.LEAF_LABEL;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for recursive, depth indexed branch generation.
 *
 * @author hal.hildebrand
 */
public class BranchGeneratorTest {

    private static final double EPSILON = 1e-9;

    private static void assertMatrix(AffineMatrix expected, AffineMatrix actual) {
        assertTrue(expected.epsilonEquals(actual, EPSILON), () -> "expected " + expected + " but was " + actual);
    }

    /**
     * Tip transform that records the size it was evaluated with
     */
    private static TransformFunction recording(List<Double> sizes) {
        var tip = TreePresets.tipTransform();
        return params -> {
            sizes.add(params[0]);
            return tip.evaluate(params);
        };
    }

    @Test
    public void testSingleBranchScenario() {
        var scene = new SceneRecorder(0);
        var tip = TreePresets.tipTransform();

        var emitted = new BranchGenerator().grow(scene, 30, List.of(new BranchDescriptor(12, 80, 0.85)), 1,
                                                 TreePresets.standardTable());

        var primitives = scene.primitives();
        assertEquals(3, emitted);
        assertEquals(3, primitives.size());

        // Root trunk at depth 1
        var root = primitives.get(0);
        assertEquals(Kind.CYLINDER, root.primitive().kind());
        assertEquals(30, root.primitive().dimensions()[0], EPSILON);
        assertEquals(3, root.primitive().dimensions()[1], EPSILON);
        assertEquals(BRANCH_LABEL, root.label());
        assertEquals(identity(), root.matrix());

        // The single recursive call at depth 0, positioned at the root's tip
        var child = primitives.get(1);
        assertEquals(Kind.CYLINDER, child.primitive().kind());
        assertEquals(25.5, child.primitive().dimensions()[0], EPSILON);
        // Trunk label is table[clamp(n + 1)], so the depth 0 trunk is still a branch; the leaf label goes on the leaf
        assertEquals(BRANCH_LABEL, child.label());
        assertMatrix(tip.evaluate(30, 12, 80), child.matrix());
        var base = child.matrix().transform(new Point3d(0, 0, 0));
        assertTrue(new Point3d(0, 0, 30).epsilonEquals(base, EPSILON));

        // Depth 0 terminates with a leaf instead of recursing
        var leaf = primitives.get(2);
        assertEquals(Kind.SPHERE, leaf.primitive().kind());
        assertEquals(25.5 * 0.2, leaf.primitive().dimensions()[0], EPSILON);
        assertEquals(LEAF_LABEL, leaf.label());
        assertMatrix(tip.evaluate(30, 12, 80).multiply(tip.evaluate(25.5, 12, 80)), leaf.matrix());
    }

    @Test
    public void testDepthZero() {
        var scene = new SceneRecorder(0);

        var emitted = new BranchGenerator().grow(scene, 10, TreePresets.oak(), 0, TreePresets.standardTable());

        assertEquals(4, emitted);
        var labels = scene.primitives().stream().map(PrimitiveRendered::label).toList();
        assertEquals(List.of(BRANCH_LABEL, LEAF_LABEL, LEAF_LABEL, LEAF_LABEL), labels);
    }

    @Test
    public void testBleedDown() {
        var leafSizes = new ArrayList<Double>();
        var branchSizes = new ArrayList<Double>();
        var table = DepthTransformTable.builder()
                                       .add(recording(leafSizes), "leaf")
                                       .add(recording(branchSizes), "branch")
                                       .build();

        new BranchGenerator().grow(new SceneRecorder(0), 64, List.of(new BranchDescriptor(10, 0, 0.5)), 5, table);

        // Node sizes by depth: n=5:64, 4:32, 3:16, 2:8, 1:4, 0:2
        assertEquals(List.of(64.0, 32.0, 16.0, 8.0, 4.0), branchSizes);
        assertEquals(List.of(2.0), leafSizes);
        assertSame(table.at(3), table.at(2));
        assertNotSame(table.at(2), table.at(0));
    }

    @Test
    public void testAddedEntryGovernsDeeperLevels() {
        var leafSizes = new ArrayList<Double>();
        var twigSizes = new ArrayList<Double>();
        var branchSizes = new ArrayList<Double>();
        var table = DepthTransformTable.builder()
                                       .add(recording(leafSizes), "leaf")
                                       .add(recording(twigSizes), "twig")
                                       .add(recording(branchSizes), "branch")
                                       .build();
        var scene = new SceneRecorder(0);

        new BranchGenerator().grow(scene, 16, List.of(new BranchDescriptor(10, 0, 0.5)), 4, table);

        assertEquals(List.of(16.0, 8.0, 4.0), branchSizes);
        assertEquals(List.of(2.0), twigSizes);
        assertEquals(List.of(1.0), leafSizes);

        var labels = scene.primitives().stream().map(PrimitiveRendered::label).toList();
        assertEquals(List.of("branch", "branch", "branch", "branch", "twig", "leaf"), labels);
    }

    @Test
    public void testPreOrderSiblingsInDnaOrder() {
        var scene = new SceneRecorder(0);
        var tip = TreePresets.tipTransform();
        var dna = List.of(new BranchDescriptor(10, 0, 0.5), new BranchDescriptor(20, 0, 0.5));

        var emitted = new BranchGenerator().grow(scene, 8, dna, 1, TreePresets.standardTable());

        assertEquals(7, emitted);
        var primitives = scene.primitives();
        var kinds = primitives.stream().map(p -> p.primitive().kind()).toList();
        assertEquals(List.of(Kind.CYLINDER, Kind.CYLINDER, Kind.SPHERE, Kind.SPHERE, Kind.CYLINDER, Kind.SPHERE,
                             Kind.SPHERE), kinds);

        assertMatrix(tip.evaluate(8, 10, 0), primitives.get(1).matrix());
        assertMatrix(tip.evaluate(8, 10, 0).multiply(tip.evaluate(4, 10, 0)), primitives.get(2).matrix());
        assertMatrix(tip.evaluate(8, 10, 0).multiply(tip.evaluate(4, 20, 0)), primitives.get(3).matrix());
        assertMatrix(tip.evaluate(8, 20, 0), primitives.get(4).matrix());
        assertMatrix(tip.evaluate(8, 20, 0).multiply(tip.evaluate(4, 10, 0)), primitives.get(5).matrix());

        for (int i = 0; i < primitives.size(); i++) {
            assertEquals(i, primitives.get(i).sequence());
        }
    }

    @Test
    public void testPrimitiveCountForBranchingDna() {
        // Nodes: 1 + 3 + 9, leaves: 27
        var scene = new SceneRecorder(0);
        var emitted = new BranchGenerator().grow(scene, 20, TreePresets.oak(), 2, TreePresets.standardTable());
        assertEquals(13 + 27, emitted);
        assertEquals(emitted, scene.primitives().size());
    }

    @Test
    public void testRootFrame() {
        var scene = new SceneRecorder(0);
        var root = translate(100, 0, 0);

        new BranchGenerator().grow(scene, root, 10, TreePresets.fern(), 0, TreePresets.standardTable());

        assertEquals(root, scene.primitives().get(0).matrix());
        assertMatrix(root.multiply(TreePresets.tipTransform().evaluate(10, 12, 80)),
                     scene.primitives().get(1).matrix());
    }

    @Test
    public void testConfiguredSolids() {
        var scene = new SceneRecorder(0);
        var config = BranchConfiguration.defaultConfig().withTrunkKind(Kind.CUBE).withLeafKind(Kind.CYLINDER);

        new BranchGenerator(config).grow(scene, 10, TreePresets.fern(), 0, TreePresets.standardTable());

        assertEquals(Primitive.cube(10), scene.primitives().get(0).primitive());
        assertEquals(Kind.CYLINDER, scene.primitives().get(1).primitive().kind());
    }

    @Test
    public void testSingleEntryTable() {
        var scene = new SceneRecorder(0);
        var table = DepthTransformTable.builder().add(TreePresets.tipTransform(), "only").build();

        new BranchGenerator().grow(scene, 10, TreePresets.fern(), 3, table);

        assertTrue(scene.primitives().stream().allMatch(p -> p.label().equals("only")));
    }

    @Test
    public void testEmptyDnaGrowsTrunkOnly() {
        var scene = new SceneRecorder(0);
        assertEquals(1, new BranchGenerator().grow(scene, 10, List.of(), 4, TreePresets.standardTable()));
    }

    @Test
    public void testMaximumDepthTrunkUsesLastEntry() {
        var scene = new SceneRecorder(0);
        assertEquals(1, new BranchGenerator().grow(scene, 10, List.of(), Integer.MAX_VALUE,
                                                   TreePresets.standardTable()));
        assertEquals(BRANCH_LABEL, scene.primitives().get(0).label());
    }

    @Test
    public void testNegativeDepthFailsFast() {
        var scene = new SceneRecorder(0);
        assertThrows(IllegalArgumentException.class,
                     () -> new BranchGenerator().grow(scene, 10, TreePresets.fern(), -1, TreePresets.standardTable()));
        assertTrue(scene.events().isEmpty());
    }

    @Test
    public void testNullArguments() {
        var generator = new BranchGenerator();
        var scene = new SceneRecorder(0);
        assertThrows(NullPointerException.class, () -> generator.grow(scene, 1, null, 1, TreePresets.standardTable()));
        assertThrows(NullPointerException.class, () -> generator.grow(scene, 1, TreePresets.fern(), 1, null));
        assertThrows(NullPointerException.class, () -> new BranchGenerator(null));
    }
}
