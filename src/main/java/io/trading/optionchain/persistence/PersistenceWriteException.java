package io.trading.optionchain.persistence;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writing buffered rows to disk failed. The rows of that flush are lost.
 */
public class PersistenceWriteException extends RuntimeException {

    private final Path file;
    private final int rows;

    public PersistenceWriteException(Path file, int rows, IOException cause) {
        super("Failed to write " + rows + " rows to " + file + ": " + cause.getMessage(), cause);
        this.file = file;
        this.rows = rows;
    }

    public Path getFile() {
        return file;
    }

    public int getRows() {
        return rows;
    }
}
