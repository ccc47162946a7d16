// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.xcover;

/** The search was stopped by its cancellation check. The matrix has been restored. */
public class SearchCancelledException extends RuntimeException {
    private final long solutions;

    SearchCancelledException(long steps, long solutions) {
        super("search cancelled after " + steps + " steps and " + solutions + " solutions");
        this.solutions = solutions;
    }

    /** @return the number of solutions delivered before cancellation */
    public long getSolutions() {
        return solutions;
    }
}
