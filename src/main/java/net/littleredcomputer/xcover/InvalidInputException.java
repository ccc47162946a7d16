// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.xcover;

/**
 * A malformed matrix or option: a non-positive item count, or an option that is
 * empty, repeats an item, or names an item that does not exist.
 */
public class InvalidInputException extends IllegalArgumentException {
    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
