package org.Aayush.featuremaps.spatial;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveAction;

/**
 * Median-split bulk loader for {@link KdTree2D}.
 * <p>
 * At depth {@code d} the slice is split on axis {@code d % 2}. The node point is the median of
 * the slice under the strict order (coordinate, point id), found by quickselect, so equal
 * coordinates fall left or right by id and two builds over the same input produce the same
 * arena. Left subtree size is {@code count / 2}, which bounds the height by
 * {@code floor(log2(n)) + 1}.
 * </p>
 * <p>
 * With {@code parallel} enabled, subtrees of at least {@code parallelThreshold} points are
 * built as fork/join tasks. Subtrees own disjoint slices of the work array and of the arena,
 * so the result is identical to the sequential build.
 * </p>
 */
@Getter
@Accessors(fluent = true)
public final class KdTreeBuilder {

    public static final int DEFAULT_PARALLEL_THRESHOLD = 8_192;

    private final boolean parallel;
    private final int parallelThreshold;

    /**
     * @param parallel build large subtrees on the common fork/join pool.
     * @param parallelThreshold minimum subtree size forked as its own task ({@code >= 2}).
     */
    public KdTreeBuilder(boolean parallel, int parallelThreshold) {
        if (parallelThreshold < 2) {
            throw new IllegalArgumentException("parallelThreshold must be >= 2, got " + parallelThreshold);
        }
        this.parallel = parallel;
        this.parallelThreshold = parallelThreshold;
    }

    public static KdTreeBuilder sequential() {
        return new KdTreeBuilder(false, DEFAULT_PARALLEL_THRESHOLD);
    }

    /**
     * Builds a tree over points {@code 0..count-1}.
     *
     * @param xs x (rt) coordinates, indexed by point id.
     * @param ys y (mz) coordinates, indexed by point id.
     * @param count number of points to index.
     */
    public KdTree2D build(double[] xs, double[] ys, int count) {
        Objects.requireNonNull(xs, "xs");
        Objects.requireNonNull(ys, "ys");
        if (count < 0 || count > xs.length || count > ys.length) {
            throw new IllegalArgumentException(
                    "count out of bounds: " + count + " (xs=" + xs.length + ", ys=" + ys.length + ")");
        }
        if (count == 0) {
            return KdTree2D.empty();
        }

        Arena arena = new Arena(xs, ys, count);
        if (parallel && count >= parallelThreshold) {
            ForkJoinPool.commonPool().invoke(new BuildTask(arena, 0, count, 0, 0, parallelThreshold));
        } else {
            arena.fill(0, count, 0, 0);
        }
        return new KdTree2D(0, arena.nodeX, arena.nodeY, arena.pointIds, arena.leftChildren, arena.rightChildren, arena.splitAxes);
    }

    /**
     * Work state shared by all subtree builds of one tree.
     */
    private static final class Arena {
        private final double[] xs;
        private final double[] ys;
        private final int[] order;

        private final double[] nodeX;
        private final double[] nodeY;
        private final int[] pointIds;
        private final int[] leftChildren;
        private final int[] rightChildren;
        private final byte[] splitAxes;

        private Arena(double[] xs, double[] ys, int count) {
            this.xs = xs;
            this.ys = ys;
            this.order = new int[count];
            for (int i = 0; i < count; i++) {
                order[i] = i;
            }
            this.nodeX = new double[count];
            this.nodeY = new double[count];
            this.pointIds = new int[count];
            this.leftChildren = new int[count];
            this.rightChildren = new int[count];
            this.splitAxes = new byte[count];
        }

        /**
         * Recursively fills the arena for {@code order[start, end)} rooted at slot {@code slot}.
         */
        private void fill(int start, int end, int slot, int depth) {
            while (start < end) {
                int mid = placeNode(start, end, slot, depth);
                int leftSize = mid - start;
                fill(start, mid, slot + 1, depth + 1);
                // Right subtree iteratively.
                start = mid + 1;
                slot = slot + 1 + leftSize;
                depth++;
            }
        }

        /**
         * Selects the median of the slice, writes node {@code slot} and its child links.
         *
         * @return position of the median inside {@code order}.
         */
        private int placeNode(int start, int end, int slot, int depth) {
            int count = end - start;
            int axis = depth & 1;
            int mid = start + count / 2;
            select(start, end, mid, axis);

            int pointId = order[mid];
            int leftSize = mid - start;
            int rightSize = end - mid - 1;

            nodeX[slot] = xs[pointId];
            nodeY[slot] = ys[pointId];
            pointIds[slot] = pointId;
            splitAxes[slot] = (byte) axis;
            leftChildren[slot] = leftSize > 0 ? slot + 1 : -1;
            rightChildren[slot] = rightSize > 0 ? slot + 1 + leftSize : -1;
            return mid;
        }

        /**
         * Quickselect on {@code order[start, end)} so that position {@code k} holds the k-th
         * smallest point and everything before it is smaller.
         */
        private void select(int start, int end, int k, int axis) {
            while (end - start > 1) {
                int pivotIndex = start + (end - start) / 2;
                int pivot = order[pivotIndex];
                swap(pivotIndex, end - 1);

                int store = start;
                for (int i = start; i < end - 1; i++) {
                    if (compare(order[i], pivot, axis) < 0) {
                        swap(store, i);
                        store++;
                    }
                }
                swap(store, end - 1);

                if (store == k) {
                    return;
                } else if (store < k) {
                    start = store + 1;
                } else {
                    end = store;
                }
            }
        }

        private int compare(int a, int b, int axis) {
            double[] coordinates = axis == 0 ? xs : ys;
            int c = Double.compare(coordinates[a], coordinates[b]);
            return c != 0 ? c : Integer.compare(a, b);
        }

        private void swap(int i, int j) {
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
    }

    /**
     * Fork/join subtree build. Falls back to {@link Arena#fill} below the threshold.
     */
    private static final class BuildTask extends RecursiveAction {
        private final Arena arena;
        private final int start;
        private final int end;
        private final int slot;
        private final int depth;
        private final int threshold;

        private BuildTask(Arena arena, int start, int end, int slot, int depth, int threshold) {
            this.arena = arena;
            this.start = start;
            this.end = end;
            this.slot = slot;
            this.depth = depth;
            this.threshold = threshold;
        }

        @Override
        protected void compute() {
            if (end - start < threshold) {
                arena.fill(start, end, slot, depth);
                return;
            }
            int mid = arena.placeNode(start, end, slot, depth);
            int leftSize = mid - start;
            invokeAll(
                    new BuildTask(arena, start, mid, slot + 1, depth + 1, threshold),
                    new BuildTask(arena, mid + 1, end, slot + 1 + leftSize, depth + 1, threshold)
            );
        }
    }
}
