// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.xcover;

import com.google.common.base.Joiner;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class MainTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(bytes, true);

    private String problemFile(String... lines) throws Exception {
        File f = folder.newFile("problem.txt");
        Files.write(f.toPath(), Joiner.on('\n').join(lines).getBytes(StandardCharsets.UTF_8));
        return f.getPath();
    }

    private String output() {
        return new String(bytes.toByteArray(), StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
    }

    @Test
    public void printsTheFirstSolution() throws Exception {
        String p = problemFile("a b c", "a b", "c", "a", "b c");
        assertThat(Main.run(new String[]{"-problem", p}, out), is(1L));
        assertThat(output(), is("a b\nc\n\n"));
    }

    @Test
    public void printsEverySolution() throws Exception {
        String p = problemFile("a b c", "a b", "c", "a", "b c");
        assertThat(Main.run(new String[]{"-problem", p, "-all", "-loginterval", "PT1S"}, out), is(2L));
        assertThat(output(), is("a b\nc\n\na\nb c\n\n"));
    }

    @Test
    public void printsNothingWithoutASolution() throws Exception {
        String p = problemFile("a b", "a");
        assertThat(Main.run(new String[]{"-problem", p, "-all"}, out), is(0L));
        assertThat(output(), is(""));
    }

    @Test
    public void givesUpAtTheTimeout() throws Exception {
        String p = problemFile("a b", "a", "b");
        assertThat(Main.run(new String[]{"-problem", p, "-timeout", "PT0S"}, out), is(0L));
        assertThat(output(), is(""));
    }

    @Test(expected = IllegalArgumentException.class)
    public void requiresAProblem() throws Exception {
        Main.run(new String[]{"-all"}, out);
    }
}
