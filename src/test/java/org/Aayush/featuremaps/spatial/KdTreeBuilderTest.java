package org.Aayush.featuremaps.spatial;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.Arrays;
import java.util.Random;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KD Tree Builder Tests")
class KdTreeBuilderTest {

    // =====================================================================
    // CORRECTNESS TESTS
    // =====================================================================

    @Test
    @DisplayName("Correctness: empty input yields empty tree")
    void testEmptyBuild() {
        KdTree2D tree = KdTreeBuilder.sequential().build(new double[0], new double[0], 0);

        assertTrue(tree.isEmpty());
        assertEquals(0, tree.size());
        assertEquals(0, tree.depth());

        IntArrayList hits = new IntArrayList();
        tree.rangeSearch(-1.0, 1.0, -1.0, 1.0, hits::add);
        assertTrue(hits.isEmpty());
    }

    @Test
    @DisplayName("Correctness: single point is found by a window on it")
    void testSinglePoint() {
        KdTree2D tree = KdTreeBuilder.sequential().build(new double[]{3.0}, new double[]{4.0}, 1);

        assertEquals(1, tree.size());
        assertEquals(1, tree.depth());
        assertEquals(0, tree.pointIdAt(0));

        IntArrayList hits = new IntArrayList();
        tree.rangeSearch(3.0, 3.0, 4.0, 4.0, hits::add);
        assertEquals(IntArrayList.of(0), hits);
    }

    @Test
    @DisplayName("Correctness: count smaller than arrays indexes only the prefix")
    void testPrefixCount() {
        double[] xs = {0.0, 1.0, 2.0, 3.0};
        double[] ys = {0.0, 1.0, 2.0, 3.0};
        KdTree2D tree = KdTreeBuilder.sequential().build(xs, ys, 2);

        assertEquals(2, tree.size());
        assertEquals(IntArrayList.of(0, 1), collectSorted(tree, -10, 10, -10, 10));
    }

    @Test
    @DisplayName("Correctness: root splits on x, its children on y")
    void testAlternatingAxes() {
        double[] xs = {5.0, 1.0, 9.0, 2.0, 8.0, 3.0, 7.0};
        double[] ys = {1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0};
        KdTree2D tree = KdTreeBuilder.sequential().build(xs, ys, xs.length);

        // Median of xs {1,2,3,5,7,8,9} is 5.0 -> point 0.
        assertEquals(0, tree.pointIdAt(0));
        assertEquals(0, tree.splitAxisAt(0));
        assertEquals(1, tree.splitAxisAt(1));
        // Right subtree starts after the three left slots.
        assertEquals(1, tree.splitAxisAt(4));
    }

    @Test
    @DisplayName("Correctness: identical coordinates resolve by point id")
    void testTieBreakById() {
        double[] xs = {1.0, 1.0, 1.0, 1.0, 1.0};
        double[] ys = {2.0, 2.0, 2.0, 2.0, 2.0};
        KdTree2D tree = KdTreeBuilder.sequential().build(xs, ys, xs.length);

        int[] preorder = new int[tree.size()];
        for (int i = 0; i < preorder.length; i++) {
            preorder[i] = tree.pointIdAt(i);
        }
        assertArrayEquals(new int[]{2, 1, 0, 4, 3}, preorder);
        assertEquals(IntArrayList.of(0, 1, 2, 3, 4), collectSorted(tree, 1.0, 1.0, 2.0, 2.0));
    }

    @Test
    @DisplayName("Correctness: window boundaries are inclusive")
    void testInclusiveBounds() {
        double[] xs = {0.0, 1.0, 2.0};
        double[] ys = {0.0, 1.0, 2.0};
        KdTree2D tree = KdTreeBuilder.sequential().build(xs, ys, xs.length);

        assertEquals(IntArrayList.of(1, 2), collectSorted(tree, 1.0, 2.0, 1.0, 2.0));
        assertEquals(IntArrayList.of(), collectSorted(tree, 1.5, 1.9, 0.0, 3.0));
    }

    @Test
    @DisplayName("Correctness: inverted window reports nothing")
    void testInvertedWindow() {
        KdTree2D tree = KdTreeBuilder.sequential().build(new double[]{1.0}, new double[]{1.0}, 1);
        assertTrue(collectSorted(tree, 2.0, 0.0, 0.0, 2.0).isEmpty());
    }

    @Test
    @DisplayName("Correctness: range search matches brute force on random data with duplicates")
    void testRangeSearchMatchesBruteForce() {
        Random random = new Random(42L);
        int n = 3_000;
        double[] xs = new double[n];
        double[] ys = new double[n];
        for (int i = 0; i < n; i++) {
            // Coarse rounding forces many equal coordinates on both axes.
            xs[i] = Math.floor(random.nextDouble(0.0, 100.0));
            ys[i] = Math.round(random.nextDouble(200.0, 1_200.0) * 2.0) / 2.0;
        }
        KdTree2D tree = KdTreeBuilder.sequential().build(xs, ys, n);

        for (int q = 0; q < 300; q++) {
            double x0 = random.nextDouble(-5.0, 105.0);
            double x1 = x0 + random.nextDouble(0.0, 20.0);
            double y0 = random.nextDouble(150.0, 1_250.0);
            double y1 = y0 + random.nextDouble(0.0, 150.0);

            assertEquals(bruteForce(xs, ys, n, x0, x1, y0, y1), collectSorted(tree, x0, x1, y0, y1),
                    "window " + q);
        }
    }

    @Test
    @DisplayName("Correctness: every point reported exactly once by an unbounded window")
    void testCompleteness() {
        Random random = new Random(7L);
        int n = 1_234;
        double[] xs = random.doubles(n, 0.0, 50.0).toArray();
        double[] ys = random.doubles(n, 0.0, 50.0).toArray();
        KdTree2D tree = KdTreeBuilder.sequential().build(xs, ys, n);

        IntArrayList all = collectSorted(tree,
                Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY,
                Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY);
        assertEquals(n, all.size());
        for (int i = 0; i < n; i++) {
            assertEquals(i, all.getInt(i));
        }
    }

    @Test
    @DisplayName("Correctness: height stays at floor(log2(n)) + 1")
    void testBalancedDepth() {
        Random random = new Random(99L);
        int n = 1_000;
        double[] xs = random.doubles(n).toArray();
        double[] ys = random.doubles(n).toArray();

        KdTree2D tree = KdTreeBuilder.sequential().build(xs, ys, n);
        assertEquals(10, tree.depth());
    }

    @Test
    @DisplayName("Correctness: sorted input still builds a balanced tree")
    void testSortedInputDepth() {
        int n = 4_096;
        double[] xs = new double[n];
        double[] ys = new double[n];
        for (int i = 0; i < n; i++) {
            xs[i] = i;
            ys[i] = n - i;
        }
        KdTree2D tree = KdTreeBuilder.sequential().build(xs, ys, n);
        assertEquals(13, tree.depth());
    }

    @Test
    @DisplayName("Correctness: repeated builds produce the same arena")
    void testDeterministicBuild() {
        Random random = new Random(3L);
        int n = 2_000;
        double[] xs = new double[n];
        double[] ys = new double[n];
        for (int i = 0; i < n; i++) {
            xs[i] = random.nextInt(40);
            ys[i] = random.nextInt(40);
        }

        assertArenaEquals(
                KdTreeBuilder.sequential().build(xs, ys, n),
                KdTreeBuilder.sequential().build(xs, ys, n));
    }

    @Test
    @DisplayName("Correctness: parallel build equals sequential build")
    void testParallelMatchesSequential() {
        Random random = new Random(11L);
        int n = 20_000;
        double[] xs = new double[n];
        double[] ys = new double[n];
        for (int i = 0; i < n; i++) {
            xs[i] = Math.floor(random.nextDouble(0.0, 500.0));
            ys[i] = random.nextDouble(100.0, 2_000.0);
        }

        assertArenaEquals(
                KdTreeBuilder.sequential().build(xs, ys, n),
                new KdTreeBuilder(true, 64).build(xs, ys, n));
    }

    @Test
    @DisplayName("Correctness: build does not modify input arrays")
    void testInputUntouched() {
        double[] xs = {3.0, 1.0, 2.0};
        double[] ys = {9.0, 8.0, 7.0};
        KdTreeBuilder.sequential().build(xs, ys, 3);

        assertArrayEquals(new double[]{3.0, 1.0, 2.0}, xs);
        assertArrayEquals(new double[]{9.0, 8.0, 7.0}, ys);
    }

    @Test
    @DisplayName("Validation: bad arguments are rejected")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new KdTreeBuilder(true, 1));
        assertThrows(IllegalArgumentException.class,
                () -> KdTreeBuilder.sequential().build(new double[2], new double[1], 2));
        assertThrows(IllegalArgumentException.class,
                () -> KdTreeBuilder.sequential().build(new double[2], new double[2], -1));
        assertThrows(NullPointerException.class,
                () -> KdTreeBuilder.sequential().build(null, new double[0], 0));
        KdTree2D tree = KdTreeBuilder.sequential().build(new double[]{1.0}, new double[]{1.0}, 1);
        assertThrows(IndexOutOfBoundsException.class, () -> tree.pointIdAt(1));
    }

    // =====================================================================
    // PERFORMANCE TEST (SMOKE GUARDRAIL)
    // =====================================================================

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    @DisplayName("Performance: 200k point build and 10k windows complete quickly")
    void testBuildAndQuerySmoke() {
        Random random = new Random(2024L);
        int n = 200_000;
        double[] xs = random.doubles(n, 0.0, 5_000.0).toArray();
        double[] ys = random.doubles(n, 100.0, 2_000.0).toArray();

        KdTree2D tree = new KdTreeBuilder(true, 4_096).build(xs, ys, n);
        assertEquals(n, tree.size());

        long[] total = {0L};
        for (int q = 0; q < 10_000; q++) {
            double x = random.nextDouble(0.0, 5_000.0);
            double y = random.nextDouble(100.0, 2_000.0);
            tree.rangeSearch(x - 5.0, x + 5.0, y - 0.5, y + 0.5, id -> total[0]++);
        }
        assertTrue(total[0] >= 0L);
    }

    // =====================================================================
    // HELPERS
    // =====================================================================

    private static IntArrayList collectSorted(KdTree2D tree, double x0, double x1, double y0, double y1) {
        IntArrayList hits = new IntArrayList();
        tree.rangeSearch(x0, x1, y0, y1, hits::add);
        int[] sorted = hits.toIntArray();
        Arrays.sort(sorted);
        return IntArrayList.wrap(sorted);
    }

    private static IntArrayList bruteForce(double[] xs, double[] ys, int n, double x0, double x1, double y0, double y1) {
        IntArrayList expected = new IntArrayList();
        for (int i = 0; i < n; i++) {
            if (xs[i] >= x0 && xs[i] <= x1 && ys[i] >= y0 && ys[i] <= y1) {
                expected.add(i);
            }
        }
        return expected;
    }

    private static void assertArenaEquals(KdTree2D expected, KdTree2D actual) {
        assertEquals(expected.size(), actual.size());
        for (int node = 0; node < expected.size(); node++) {
            assertEquals(expected.pointIdAt(node), actual.pointIdAt(node), "point at slot " + node);
            assertEquals(expected.splitAxisAt(node), actual.splitAxisAt(node), "axis at slot " + node);
        }
    }
}
