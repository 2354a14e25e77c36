package in.orderflow.config;

import java.nio.file.Path;

/**
 * Thrown when a settings source exists but cannot be read or parsed.
 */
public class EngineConfigurationException extends RuntimeException {

    private final Path source;

    public EngineConfigurationException(Path source, String message, Throwable cause) {
        super(String.format("[%s] Settings could not be loaded: %s", source, message), cause);
        this.source = source;
    }

    public Path getSource() {
        return source;
    }
}
