// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.xcover;

import gnu.trove.list.array.TIntArrayList;

/**
 * The node arena of a dancing-links matrix. Every node (the root, the column
 * headers and the nodes of each option) is an index into a set of parallel
 * int lists; links are indices into the same lists. Node 0 is the root, and
 * headers for items 0..n-1 live at indices 1..n.
 * <p>
 * The splice primitives only keep the four link fields mutually consistent;
 * they know nothing of exact cover. Nothing is ever removed from the arena.
 */
final class Mesh {
    static final int ROOT = 0;
    private static final int NO_ROW = -1;

    private final TIntArrayList llink = new TIntArrayList();
    private final TIntArrayList rlink = new TIntArrayList();
    private final TIntArrayList ulink = new TIntArrayList();
    private final TIntArrayList dlink = new TIntArrayList();
    private final TIntArrayList top = new TIntArrayList();    // owning header
    private final TIntArrayList row = new TIntArrayList();    // row id, or NO_ROW for root and headers
    private final TIntArrayList vindex = new TIntArrayList(); // 1-based position in column at insertion
    private final TIntArrayList len = new TIntArrayList();    // indexed by header; len[ROOT] unused
    private final TIntArrayList rowStart = new TIntArrayList();
    private final TIntArrayList rowLength = new TIntArrayList();

    private final int primaryItems;
    private final int items;

    /**
     * Creates the root and one header per item. Primary headers are linked into
     * the root's ring in item order; secondary headers are left as horizontal
     * self-loops, so they can be covered but are never chosen.
     */
    Mesh(int primaryItems, int secondaryItems) {
        this.primaryItems = primaryItems;
        this.items = primaryItems + secondaryItems;
        newNode(ROOT, NO_ROW);
        len.add(0);
        for (int i = 0; i < items; ++i) {
            int h = newNode(llink.size(), NO_ROW);
            len.add(0);
            if (i < primaryItems) insertLeft(ROOT, h);
        }
    }

    /** Appends a node whose four links point at itself. */
    int newNode(int column, int rowId) {
        int n = llink.size();
        llink.add(n);
        rlink.add(n);
        ulink.add(n);
        dlink.add(n);
        top.add(column);
        row.add(rowId);
        vindex.add(0);
        return n;
    }

    /** Splices {@code n} into the horizontal ring of {@code anchor}, just to its left. */
    void insertLeft(int anchor, int n) {
        int l = llink.get(anchor);
        llink.set(n, l);
        rlink.set(n, anchor);
        rlink.set(l, n);
        llink.set(anchor, n);
    }

    /** Appends {@code n} to the bottom of the column headed by {@code header}, counting it in the size. */
    void insertAbove(int header, int n) {
        int u = ulink.get(header);
        ulink.set(n, u);
        dlink.set(n, header);
        dlink.set(u, n);
        ulink.set(header, n);
        incrementSize(header);
        vindex.set(n, len.get(header));
    }

    /** Records that {@code first} is the leftmost node of a newly added row of {@code length} nodes. */
    int addRow(int first, int length) {
        rowStart.add(first);
        rowLength.add(length);
        return rowStart.size() - 1;
    }

    void unlinkHorizontal(int n) {
        int l = llink.get(n);
        int r = rlink.get(n);
        rlink.set(l, r);
        llink.set(r, l);
    }

    void relinkHorizontal(int n) {
        rlink.set(llink.get(n), n);
        llink.set(rlink.get(n), n);
    }

    void unlinkVertical(int n) {
        int u = ulink.get(n);
        int d = dlink.get(n);
        dlink.set(u, d);
        ulink.set(d, u);
    }

    void relinkVertical(int n) {
        dlink.set(ulink.get(n), n);
        ulink.set(dlink.get(n), n);
    }

    void incrementSize(int header) {
        len.set(header, len.get(header) + 1);
    }

    void decrementSize(int header) {
        len.set(header, len.get(header) - 1);
    }

    int left(int n) { return llink.get(n); }
    int right(int n) { return rlink.get(n); }
    int up(int n) { return ulink.get(n); }
    int down(int n) { return dlink.get(n); }
    int column(int n) { return top.get(n); }
    int rowOf(int n) { return row.get(n); }
    int size(int header) { return len.get(header); }
    int position(int n) { return vindex.get(n); }
    int rowStart(int r) { return rowStart.get(r); }
    int rowLength(int r) { return rowLength.get(r); }

    static int header(int item) { return item + 1; }
    static int item(int header) { return header - 1; }

    int primaryItems() { return primaryItems; }
    int items() { return items; }
    int rows() { return rowStart.size(); }
    int nodes() { return llink.size(); }

    boolean isPrimary(int header) {
        return header > ROOT && header <= primaryItems;
    }

    /**
     * Copies every link field and every column size. Two snapshots taken of the
     * same mesh are equal exactly when its structure is field-for-field identical.
     */
    int[] snapshot() {
        final int n = nodes();
        int[] s = new int[4 * n + len.size()];
        llink.toArray(s, 0, 0, n);
        rlink.toArray(s, 0, n, n);
        ulink.toArray(s, 0, 2 * n, n);
        dlink.toArray(s, 0, 3 * n, n);
        len.toArray(s, 0, 4 * n, len.size());
        return s;
    }

    /**
     * Checks the structural invariants of a mesh with nothing covered: link
     * symmetry, row rings, column sizes, and a root ring holding exactly the
     * primary headers in item order.
     * @throws MeshIntegrityException describing the first violation found
     */
    void verifyIntegrity() {
        for (int n = 0; n < nodes(); ++n) {
            if (rlink.get(llink.get(n)) != n || llink.get(rlink.get(n)) != n) {
                throw new MeshIntegrityException("horizontal links of node " + n + " are asymmetric");
            }
            if (dlink.get(ulink.get(n)) != n || ulink.get(dlink.get(n)) != n) {
                throw new MeshIntegrityException("vertical links of node " + n + " are asymmetric");
            }
        }
        int expected = ROOT;
        for (int h = rlink.get(ROOT); h != ROOT; h = rlink.get(h)) {
            if (h != ++expected) {
                throw new MeshIntegrityException("root ring holds header " + h + " where " + expected + " belongs");
            }
        }
        if (expected != primaryItems) {
            throw new MeshIntegrityException("root ring holds " + expected + " of " + primaryItems + " primary headers");
        }
        for (int h = header(0); h <= items; ++h) {
            int count = 0;
            for (int p = dlink.get(h); p != h; p = dlink.get(p)) {
                if (top.get(p) != h) {
                    throw new MeshIntegrityException("node " + p + " in column " + h + " belongs to column " + top.get(p));
                }
                if (++count > nodes()) throw new MeshIntegrityException("column " + h + " does not close");
            }
            if (count != len.get(h)) {
                throw new MeshIntegrityException("column " + h + " has size " + len.get(h) + " but holds " + count + " nodes");
            }
        }
        for (int r = 0; r < rows(); ++r) {
            final int first = rowStart.get(r);
            int count = 1;
            for (int p = rlink.get(first); p != first; p = rlink.get(p)) {
                if (row.get(p) != r) {
                    throw new MeshIntegrityException("node " + p + " in row " + r + " belongs to row " + row.get(p));
                }
                if (++count > rowLength.get(r)) break;
            }
            if (count != rowLength.get(r)) {
                throw new MeshIntegrityException("row " + r + " ring does not hold its " + rowLength.get(r) + " nodes");
            }
        }
    }
}
