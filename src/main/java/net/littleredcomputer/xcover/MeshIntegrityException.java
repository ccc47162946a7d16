// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.xcover;

/**
 * Thrown when the links of a matrix no longer describe a consistent mesh. This
 * is always a bug (typically a cover and uncover that did not nest), never an
 * outcome of the search.
 */
public class MeshIntegrityException extends IllegalStateException {
    public MeshIntegrityException(String message) {
        super(message);
    }
}
