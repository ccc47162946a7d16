// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.xcover;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Spliterator;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Algorithm X in the form of Algorithm D of 7.2.2.1, driven by an explicit
 * stack rather than recursion. Level l of the stack holds the column chosen at
 * that depth and the row node currently being tried in it. Each call to
 * {@link #tryAdvance} resumes the search where the previous solution left it.
 * <p>
 * A driver has exclusive use of its mesh from construction until it finishes,
 * which happens when the search is exhausted, when it is cancelled, or when
 * {@link #close} unwinds it early. Finishing always leaves the mesh exactly as
 * it was found.
 */
final class SearchDriver implements Spliterator<List<Integer>>, AutoCloseable {
    private static final Logger log = LogManager.getFormatterLogger(SearchDriver.class);
    private static final long logCheckSteps = 1000;

    private final Mesh mesh;
    private final CoverEngine engine;
    private final ColumnSelector selector;
    private final Duration logInterval;
    private final BooleanSupplier cancelled;
    private final Runnable onFinish;
    private final int[] olen;  // column sizes before the search began

    private final int[] column;  // column chosen at each level
    private final int[] x;  // row node being tried at each level
    private int step = 2;
    private int l = 0;
    private boolean finished = false;

    private long nodeCount = 0;
    private long solCount = 0;
    private final Stopwatch stopwatch = Stopwatch.createUnstarted();
    private Instant lastLogTime = Instant.now();

    SearchDriver(Mesh mesh, Duration logInterval, BooleanSupplier cancelled, Runnable onFinish) {
        this.mesh = mesh;
        this.engine = new CoverEngine(mesh);
        this.selector = new ColumnSelector(mesh);
        this.logInterval = logInterval;
        this.cancelled = cancelled;
        this.onFinish = onFinish;
        this.column = new int[mesh.primaryItems()];
        this.x = new int[mesh.primaryItems()];
        this.olen = new int[mesh.items() + 1];
        for (int h = 1; h < olen.length; ++h) olen[h] = mesh.size(h);
        log.debug("search begins: %d items, %d options, %d nodes", mesh.items(), mesh.rows(), mesh.nodes());
    }

    /**
     * Advances to the next exact cover and hands it to {@code action} as the
     * row ids chosen at each level, outermost first.
     * @return true if a solution was delivered, false once the search is exhausted
     * @throws SearchCancelledException if the cancellation check fired; the mesh
     * has been restored before this is thrown
     */
    @Override
    public boolean tryAdvance(Consumer<? super List<Integer>> action) {
        if (finished) return false;
        stopwatch.start();
        while (true) {
            switch (step) {
                // The cases are numbered after the steps of Algorithm D; falling
                // through and continuing the loop stand in for its go-tos.
                case 2: {  // Enter level l.
                    ++nodeCount;
                    if (nodeCount % logCheckSteps == 0) {
                        maybeReportProgress();
                    }
                    // case 3:  // Choose i.
                    final int i = selector.choose();
                    if (i == ColumnSelector.NONE) {
                        ImmutableList.Builder<Integer> solution = ImmutableList.builderWithExpectedSize(l);
                        for (int k = 0; k < l; ++k) {
                            solution.add(mesh.rowOf(x[k]));
                        }
                        step = 8;
                        ++solCount;
                        stopwatch.stop();
                        action.accept(solution.build());
                        return true;
                    }
                    if (mesh.size(i) == 0) {
                        // Nothing can cover i. Level l has covered nothing, so leave it directly.
                        step = 8;
                        continue;
                    }
                    // case 4:  // Cover i.
                    engine.cover(i);
                    column[l] = i;
                    x[l] = mesh.down(i);
                    step = 5;
                }
                case 5:  // Try x[l].
                    if (x[l] == column[l]) {
                        step = 7;
                        continue;
                    }
                    if (cancelled.getAsBoolean()) {
                        unwind();
                        throw new SearchCancelledException(nodeCount, solCount);
                    }
                    engine.commit(x[l]);
                    ++l;
                    step = 2;
                    continue;
                case 6:  // Try again.
                    engine.uncommit(x[l]);
                    x[l] = mesh.down(x[l]);
                    step = 5;
                    continue;
                case 7:  // Backtrack.
                    engine.uncover(column[l]);
                case 8:  // Leave level l.
                    if (l == 0) {
                        finish();
                        return false;
                    }
                    --l;
                    step = 6;
                    continue;
                default:
                    throw new IllegalStateException("unknown step " + step);
            }
        }
    }

    /**
     * Restores the mesh if the search stopped short of exhaustion. Safe to call
     * at any point between solutions, and more than once.
     */
    @Override
    public void close() {
        unwind();
    }

    /**
     * Undoes every open level in the reverse of the order it was entered. Only
     * steps 2, 5 and 8 are observable from outside the loop; at 5 the current
     * column is covered but its row has not been committed.
     */
    private void unwind() {
        if (finished) return;
        if (step == 5) engine.uncover(column[l]);
        while (l > 0) {
            --l;
            engine.uncommit(x[l]);
            engine.uncover(column[l]);
        }
        finish();
    }

    private void finish() {
        finished = true;
        if (stopwatch.isRunning()) stopwatch.stop();
        log.debug("search ends: %d nodes %d solutions %s", nodeCount, solCount, stopwatch);
        onFinish.run();
    }

    long solutionCount() {
        return solCount;
    }

    long nodeCount() {
        return nodeCount;
    }

    private void maybeReportProgress() {
        Instant now = Instant.now();
        if (Duration.between(lastLogTime, now).compareTo(logInterval) < 0) return;
        log.info(() -> {
            StringBuilder sb = new StringBuilder();
            double tProduct = 1.0;
            double completeRatio = 0.0;  // Use 7.2.2.1 (27) to estimate progress.
            for (int i = 0; i < l; ++i) {
                final int xi = x[i];
                final int c = column[i];
                tProduct *= olen[c];
                completeRatio += (mesh.position(xi) - 1) / tProduct;
                sb.append(Mesh.item(c)).append(':').append(mesh.position(xi)).append('/').append(olen[c]).append(' ');
            }
            completeRatio += 1.0 / (2.0 * tProduct);  // Final term in equation (27)
            final long millis = Math.max(1, stopwatch.elapsed().toMillis());
            return new FormattedMessage("%.4f %d nodes %s %.0f/sec %d solutions %s",
                    completeRatio, nodeCount, stopwatch, 1000. * nodeCount / millis, solCount, sb.toString());
        });
        lastLogTime = now;
    }

    @Override
    public Spliterator<List<Integer>> trySplit() {
        return null;
    }

    @Override
    public long estimateSize() {
        return Long.MAX_VALUE;
    }

    @Override
    public int characteristics() {
        return ORDERED | NONNULL;
    }
}
