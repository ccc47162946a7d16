// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.xcover;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

/**
 * Sudoku as exact cover, 7.2.2.1 (30): items are the cells p, the digits of
 * each row r, of each column c and of each box b. Givens contribute a single
 * option; empty cells one option per digit.
 */
public class SudokuTest {
    private final List<int[]> moves = new ArrayList<>();  // row id -> {row, column, digit}
    private final int[][] board = new int[9][9];

    private ExactCoverMatrix encode(String boardString) {
        int p = 0;
        for (int j = 0; j < boardString.length(); ++j) {
            char ch = boardString.charAt(j);
            if (ch > '0' && ch <= '9') {
                board[p / 9][p % 9] = ch - '0';
                ++p;
            } else if (ch == '.') {
                ++p;
            }
        }
        ExactCoverMatrix m = ExactCoverMatrix.build(4 * 81);
        for (int i = 0; i < 9; ++i) {
            for (int j = 0; j < 9; ++j) {
                for (int k = 1; k <= 9; ++k) {
                    if (board[i][j] != 0 && board[i][j] != k) continue;
                    int b = 3 * (i / 3) + j / 3;
                    m.addOption(9 * i + j, 81 + 9 * i + k - 1, 162 + 9 * j + k - 1, 243 + 9 * b + k - 1);
                    moves.add(new int[]{i, j, k});
                }
            }
        }
        return m;
    }

    private String render(List<Integer> solution) {
        for (int o : solution) {
            int[] move = moves.get(o);
            board[move[0]][move[1]] = move[2];
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 9; ++i) {
            for (int j = 0; j < 9; j += 3) {
                sb.append(board[i][j]).append(board[i][j+1]).append(board[i][j+2]).append(' ');
            }
        }
        return sb.toString();
    }

    private List<String> solutions(String problem) {
        ExactCoverMatrix m = encode(problem);
        List<String> result = new ArrayList<>();
        m.solveAll(s -> {
            TestProblems.assertExactCover(m, s);
            result.add(render(s));
        });
        return result;
    }

    @Test
    public void ex28aSolution() {
        String ex28a = "..3 .1. ... " +
                "415 ... .9. " +
                "2.6 5.. 3.. " +
                "5.. .8. ..9 " +
                ".7. 9.. .32 " +
                ".38 ..4 .6. " +
                "... 26. 4.3 " +
                "... 3.. ..8 " +
                "32. ..7 95. ";
        assertThat(solutions(ex28a), is(Collections.singletonList(
                "793 412 685 415 638 297 286 579 314 562 183 749 174 956 832 938 724 561 859 261 473 647 395 128 321 847 956 ")));
    }

    @Test
    public void worldsHardest() {
        // http://www.telegraph.co.uk/news/science/science-news/9359579/Worlds-hardest-sudoku-can-you-crack-it.html
        String t = "8.. ... ... ..3 6.. ... .7. .9. 2.. .5. ..7 ... ... .45 7.. ... 1.. .3. ..1 ... .68 ..8 5.. .1. .9. ... 4..";
        assertThat(solutions(t), is(Collections.singletonList(
                "812 753 649 943 682 175 675 491 283 154 237 896 369 845 721 287 169 534 521 974 368 438 526 917 796 318 452 ")));
    }

    @Test
    public void conflictingGivensHaveNoSolution() {
        assertThat(encode("11").solve().isPresent(), is(false));
    }
}
