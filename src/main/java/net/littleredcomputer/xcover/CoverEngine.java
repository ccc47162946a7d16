// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.xcover;

/**
 * Cover and uncover from 7.2.2.1 (12)-(15). Calls must nest like parentheses:
 * each uncover undoes the most recent cover still outstanding, or the mesh is
 * silently corrupted.
 */
final class CoverEngine {
    private final Mesh mesh;

    CoverEngine(Mesh mesh) {
        this.mesh = mesh;
    }

    /** Removes column {@code c} from the header ring and every row meeting it from the other columns. */
    void cover(int c) {
        mesh.unlinkHorizontal(c);
        for (int p = mesh.down(c); p != c; p = mesh.down(p)) {
            hide(p);
        }
    }

    /** Exact inverse of {@link #cover}. */
    void uncover(int c) {
        for (int p = mesh.up(c); p != c; p = mesh.up(p)) {
            unhide(p);
        }
        mesh.relinkHorizontal(c);
    }

    private void hide(int p) {
        for (int q = mesh.right(p); q != p; q = mesh.right(q)) {
            mesh.unlinkVertical(q);
            mesh.decrementSize(mesh.column(q));
        }
    }

    private void unhide(int p) {
        for (int q = mesh.left(p); q != p; q = mesh.left(q)) {
            mesh.incrementSize(mesh.column(q));
            mesh.relinkVertical(q);
        }
    }

    /** Covers every other column of the row containing {@code p}, left to right. */
    void commit(int p) {
        for (int q = mesh.right(p); q != p; q = mesh.right(q)) {
            cover(mesh.column(q));
        }
    }

    /** Undoes {@link #commit} of the same node, right to left. */
    void uncommit(int p) {
        for (int q = mesh.left(p); q != p; q = mesh.left(q)) {
            uncover(mesh.column(q));
        }
    }
}
