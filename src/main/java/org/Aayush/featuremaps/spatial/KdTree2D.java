package org.Aayush.featuremaps.spatial;

import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Objects;
import java.util.function.IntConsumer;

/**
 * Immutable 2-D tree over (rt, mz) points, stored as a pre-order node arena.
 * <p>
 * Every node carries exactly one point. Node {@code n} splits on axis {@code splitAxes[n]}
 * (0 = x/rt, 1 = y/mz) at its own coordinate: points in the left subtree have a coordinate
 * {@code <=} the split value, points in the right subtree {@code >=}. Child slots are
 * {@code -1} when absent.
 * </p>
 * <p>
 * Coordinates are copied at build time, so a tree answers for the snapshot it was built
 * from. Safe for concurrent readers.
 * </p>
 */
@RequiredArgsConstructor(access = AccessLevel.PACKAGE)
public final class KdTree2D {

    private static final KdTree2D EMPTY = new KdTree2D(
            -1,
            new double[0],
            new double[0],
            new int[0],
            new int[0],
            new int[0],
            new byte[0]
    );

    private final int rootIndex;
    private final double[] nodeX;
    private final double[] nodeY;
    private final int[] pointIds;
    private final int[] leftChildren;
    private final int[] rightChildren;
    private final byte[] splitAxes;

    /**
     * Tree with no nodes.
     */
    public static KdTree2D empty() {
        return EMPTY;
    }

    /**
     * Number of indexed points.
     */
    public int size() {
        return pointIds.length;
    }

    public boolean isEmpty() {
        return pointIds.length == 0;
    }

    /**
     * Reports every point inside the closed window {@code [minX, maxX] x [minY, maxY]}.
     * <p>
     * A subtree is entered only when the window can reach its side of the split plane.
     * Each point is reported at most once; report order follows traversal and carries no
     * meaning.
     * </p>
     *
     * @param sink receives original point ids.
     */
    public void rangeSearch(double minX, double maxX, double minY, double maxY, IntConsumer sink) {
        Objects.requireNonNull(sink, "sink");
        if (rootIndex < 0 || minX > maxX || minY > maxY) {
            return;
        }

        int[] stack = new int[Math.max(4, Math.min(64, pointIds.length))];
        int top = 0;
        stack[top++] = rootIndex;

        while (top > 0) {
            int node = stack[--top];
            double x = nodeX[node];
            double y = nodeY[node];

            if (x >= minX && x <= maxX && y >= minY && y <= maxY) {
                sink.accept(pointIds[node]);
            }

            double split;
            double low;
            double high;
            if (splitAxes[node] == 0) {
                split = x;
                low = minX;
                high = maxX;
            } else {
                split = y;
                low = minY;
                high = maxY;
            }

            int right = rightChildren[node];
            if (right >= 0 && high >= split) {
                if (top == stack.length) {
                    stack = Arrays.copyOf(stack, stack.length << 1);
                }
                stack[top++] = right;
            }

            int left = leftChildren[node];
            if (left >= 0 && low <= split) {
                if (top == stack.length) {
                    stack = Arrays.copyOf(stack, stack.length << 1);
                }
                stack[top++] = left;
            }
        }
    }

    /**
     * Height of the tree (0 when empty, 1 for a single node).
     */
    public int depth() {
        if (rootIndex < 0) {
            return 0;
        }
        int[] nodes = new int[Math.max(4, Math.min(64, pointIds.length))];
        int[] levels = new int[nodes.length];
        int top = 0;
        nodes[top] = rootIndex;
        levels[top++] = 1;
        int max = 0;

        while (top > 0) {
            top--;
            int node = nodes[top];
            int level = levels[top];
            max = Math.max(max, level);

            for (int child : new int[]{leftChildren[node], rightChildren[node]}) {
                if (child < 0) {
                    continue;
                }
                if (top == nodes.length) {
                    nodes = Arrays.copyOf(nodes, nodes.length << 1);
                    levels = Arrays.copyOf(levels, levels.length << 1);
                }
                nodes[top] = child;
                levels[top++] = level + 1;
            }
        }
        return max;
    }

    /**
     * Point id stored at arena slot {@code node}, in pre-order.
     */
    public int pointIdAt(int node) {
        if (node < 0 || node >= pointIds.length) {
            throw new IndexOutOfBoundsException("node out of bounds: " + node + " [0, " + pointIds.length + ")");
        }
        return pointIds[node];
    }

    /**
     * Split axis at arena slot {@code node}.
     */
    public int splitAxisAt(int node) {
        if (node < 0 || node >= splitAxes.length) {
            throw new IndexOutOfBoundsException("node out of bounds: " + node + " [0, " + splitAxes.length + ")");
        }
        return splitAxes[node];
    }

    @Override
    public String toString() {
        return "KdTree2D[nodes=" + pointIds.length + "]";
    }
}
