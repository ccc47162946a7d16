// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.xcover;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertThat;

public class CoverEngineTest {

    /** The problem of 7.2.2.1 (5), with items a..g numbered 0..6. */
    static ExactCoverMatrix knuthExample5() {
        ExactCoverMatrix m = ExactCoverMatrix.build(7);
        m.addOption(2, 4);
        m.addOption(0, 3, 6);
        m.addOption(1, 2, 5);
        m.addOption(0, 3, 5);
        m.addOption(1, 6);
        m.addOption(3, 4, 6);
        return m;
    }

    private static List<Integer> rowsIn(Mesh m, int header) {
        List<Integer> rows = new ArrayList<>();
        for (int p = m.down(header); p != header; p = m.down(p)) rows.add(m.rowOf(p));
        return rows;
    }

    @Test
    public void coverThenUncoverRestoresEveryField() {
        Mesh mesh = knuthExample5().mesh();
        CoverEngine e = new CoverEngine(mesh);
        for (int c = 1; c <= mesh.items(); ++c) {
            int[] before = mesh.snapshot();
            e.cover(c);
            e.uncover(c);
            assertArrayEquals("column " + c, before, mesh.snapshot());
        }
        mesh.verifyIntegrity();
    }

    @Test
    public void coverRemovesTheColumnAndEveryRowThatMeetsIt() {
        Mesh mesh = knuthExample5().mesh();
        CoverEngine e = new CoverEngine(mesh);
        final int a = Mesh.header(0);
        final int d = Mesh.header(3);
        final int f = Mesh.header(5);
        final int g = Mesh.header(6);
        assertThat(rowsIn(mesh, d), contains(1, 3, 5));
        e.cover(a);
        assertThat(mesh.right(Mesh.ROOT), is(Mesh.header(1)));
        // Options 1 and 3 contain a, so they vanish from d, f and g.
        assertThat(rowsIn(mesh, d), contains(5));
        assertThat(mesh.size(d), is(1));
        assertThat(rowsIn(mesh, f), contains(2));
        assertThat(rowsIn(mesh, g), contains(4, 5));
        // ...but a itself still lists them, so uncover can find them again.
        assertThat(rowsIn(mesh, a), contains(1, 3));
    }

    @Test
    public void nestedCoversUnwindInReverseOrder() {
        Mesh mesh = knuthExample5().mesh();
        CoverEngine e = new CoverEngine(mesh);
        int[] before = mesh.snapshot();
        // Choose option 1 (a d g) the way the search would.
        final int a = Mesh.header(0);
        e.cover(a);
        int p = mesh.down(a);
        assertThat(mesh.rowOf(p), is(1));
        e.commit(p);
        assertThat(mesh.size(Mesh.header(1)), is(1));
        assertThat(mesh.size(Mesh.header(4)), is(1));
        e.uncommit(p);
        e.uncover(a);
        assertArrayEquals(before, mesh.snapshot());
    }
}
