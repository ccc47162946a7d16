// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.xcover;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;
import gnu.trove.set.hash.TIntHashSet;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * An exact cover problem over items numbered from zero, solved with Knuth's
 * Dancing Links (7.2.2.1 of TAOCP volume 4). Options are added first; the
 * first search seals the matrix, after which it can be searched any number of
 * times, one search at a time.
 * <p>
 * Items below {@link #numPrimaryItems()} are primary and must be covered exactly
 * once. Any items above them are secondary and may be covered at most once.
 * Solutions are lists of the row ids returned by {@link #addOption}.
 * <p>
 * Instances are not thread safe.
 */
public class ExactCoverMatrix {
    private final Mesh mesh;
    private Duration logInterval = Duration.ofMillis(5000);
    private boolean verifyIntegrity = ExactCoverMatrix.class.desiredAssertionStatus();
    private BooleanSupplier cancellation = () -> false;
    private boolean sealed = false;
    private SearchDriver active = null;

    private ExactCoverMatrix(Mesh mesh) {
        this.mesh = mesh;
    }

    /**
     * @param numItems number of items, all primary
     * @throws InvalidInputException if {@code numItems} is not positive
     */
    public static ExactCoverMatrix build(int numItems) {
        return build(numItems, 0);
    }

    /**
     * @param numPrimaryItems number of items to be covered exactly once, numbered from 0
     * @param numSecondaryItems number of items to be covered at most once, numbered after the primary ones
     * @throws InvalidInputException unless there is at least one primary item and no negative count
     */
    public static ExactCoverMatrix build(int numPrimaryItems, int numSecondaryItems) {
        if (numPrimaryItems <= 0) {
            throw new InvalidInputException("there must be at least one primary item, not " + numPrimaryItems);
        }
        if (numSecondaryItems < 0) {
            throw new InvalidInputException("negative number of secondary items: " + numSecondaryItems);
        }
        return new ExactCoverMatrix(new Mesh(numPrimaryItems, numSecondaryItems));
    }

    /**
     * Add an option: a nonempty set of distinct items, in the order the row
     * should be linked.
     * @param items item indices in [0, numItems())
     * @return the row id of the new option; ids are sequential from 0
     * @throws InvalidInputException if the option is empty, repeats an item, or
     * names an item out of range. The matrix is unchanged in that case.
     * @throws IllegalStateException if a search has already begun
     */
    public int addOption(int... items) {
        if (sealed) throw new IllegalStateException("options cannot be added once a search has begun");
        if (items.length == 0) throw new InvalidInputException("an option must contain at least one item");
        TIntHashSet itemsSeen = new TIntHashSet(items.length);
        for (int item : items) {
            if (item < 0 || item >= mesh.items()) {
                throw new InvalidInputException("item " + item + " is outside [0, " + mesh.items() + ")");
            }
            if (!itemsSeen.add(item)) throw new InvalidInputException("item repeated in option: " + item);
        }
        final int rowId = mesh.rows();
        int first = -1;
        for (int item : items) {
            int h = Mesh.header(item);
            int n = mesh.newNode(h, rowId);
            mesh.insertAbove(h, n);
            if (first < 0) first = n;
            else mesh.insertLeft(first, n);
        }
        return mesh.addRow(first, items.length);
    }

    /**
     * @see #addOption(int...)
     * @throws InvalidInputException also if {@code items} contains null
     */
    public int addOption(Collection<Integer> items) {
        for (Integer item : items) {
            if (item == null) throw new InvalidInputException("null item in option");
        }
        return addOption(Ints.toArray(items));
    }

    public int numItems() {
        return mesh.items();
    }

    public int numPrimaryItems() {
        return mesh.primaryItems();
    }

    public int numOptions() {
        return mesh.rows();
    }

    /** @return the items of option {@code rowId}, in the order they were given */
    public List<Integer> option(int rowId) {
        if (rowId < 0 || rowId >= mesh.rows()) throw new IndexOutOfBoundsException("no option " + rowId);
        List<Integer> items = new ArrayList<>(mesh.rowLength(rowId));
        final int first = mesh.rowStart(rowId);
        int p = first;
        do {
            items.add(Mesh.item(mesh.column(p)));
            p = mesh.right(p);
        } while (p != first);
        return ImmutableList.copyOf(items);
    }

    public ExactCoverMatrix setLogInterval(Duration logInterval) {
        this.logInterval = logInterval;
        return this;
    }

    /**
     * Whether to check the structure of the mesh each time a search finishes.
     * Defaults to on when assertions are enabled for this package.
     */
    public ExactCoverMatrix setVerifyIntegrity(boolean verifyIntegrity) {
        this.verifyIntegrity = verifyIntegrity;
        return this;
    }

    /**
     * Installs a check polled before each row is tried. Once it returns true the
     * running search restores the matrix and throws {@link SearchCancelledException}.
     */
    public ExactCoverMatrix setCancellation(BooleanSupplier cancellation) {
        this.cancellation = cancellation;
        return this;
    }

    /**
     * @return the first exact cover in search order, or empty if there is none
     */
    public Optional<List<Integer>> solve() {
        List<List<Integer>> found = new ArrayList<>(1);
        try (SearchDriver d = start()) {
            d.tryAdvance(found::add);
        }
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    /**
     * Enumerates every exact cover, handing each to {@code onSolution} as soon as
     * it is found.
     * @return the number of exact covers
     */
    public long solveAll(Consumer<? super List<Integer>> onSolution) {
        try (SearchDriver d = start()) {
            while (d.tryAdvance(onSolution)) {
                // each solution has already been delivered
            }
            return d.solutionCount();
        }
    }

    /**
     * A lazy stream of all exact covers. The effort for any solution is expended
     * only when it is demanded. No other search may start on this matrix until
     * the stream is exhausted or closed; close it when abandoning it early.
     */
    public Stream<List<Integer>> solutions() {
        SearchDriver d = start();
        return StreamSupport.stream(d, false).onClose(d::close);
    }

    /**
     * Checks the structural invariants of the mesh.
     * @throws MeshIntegrityException if they do not hold
     * @throws IllegalStateException if a search is in progress
     */
    public void verifyIntegrity() {
        if (active != null) throw new IllegalStateException("cannot verify the matrix during a search");
        mesh.verifyIntegrity();
    }

    Mesh mesh() {
        return mesh;
    }

    private SearchDriver start() {
        if (active != null) {
            throw new IllegalStateException("a search is already in progress on this matrix");
        }
        sealed = true;
        active = new SearchDriver(mesh, logInterval, cancellation, this::searchFinished);
        return active;
    }

    private void searchFinished() {
        active = null;
        if (verifyIntegrity) mesh.verifyIntegrity();
    }
}
