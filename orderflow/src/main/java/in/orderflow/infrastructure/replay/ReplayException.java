package in.orderflow.infrastructure.replay;

import java.nio.file.Path;

/**
 * Thrown when a recorded feed cannot be read or a line cannot be parsed.
 */
public class ReplayException extends RuntimeException {

    private final Path source;
    private final long lineNumber;

    public ReplayException(Path source, long lineNumber, String message, Throwable cause) {
        super(String.format("[%s:%d] %s", source, lineNumber, message), cause);
        this.source = source;
        this.lineNumber = lineNumber;
    }

    public Path getSource() {
        return source;
    }

    /**
     * 1-based line of the offending record, 0 when the file itself failed.
     */
    public long getLineNumber() {
        return lineNumber;
    }
}
