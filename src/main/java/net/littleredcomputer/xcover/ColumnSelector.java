// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.xcover;

/**
 * Chooses the item to branch on with the minimum remaining values heuristic.
 * Holds no state of its own between calls.
 */
final class ColumnSelector {
    static final int NONE = Mesh.ROOT;

    private final Mesh mesh;

    ColumnSelector(Mesh mesh) {
        this.mesh = mesh;
    }

    /**
     * @return the header of the active column with the fewest rows, the leftmost
     * one on ties, or {@link #NONE} if every primary item is already covered
     */
    int choose() {
        int minLen = Integer.MAX_VALUE;
        int chosen = NONE;
        for (int c = mesh.right(Mesh.ROOT); c != Mesh.ROOT; c = mesh.right(c)) {
            int l = mesh.size(c);
            if (l < minLen) {
                minLen = l;
                chosen = c;
                if (l == 0) break;
            }
        }
        return chosen;
    }
}
