package in.orderflow.infrastructure.replay;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a newline-delimited JSON feed of {@link ReplayEvent}s.
 *
 * Blank lines and lines starting with {@code #} are ignored. Any other line
 * that does not parse fails the whole read, since replaying a feed with holes
 * would not be comparable across presets.
 */
public final class ReplayEventReader {
    private static final Logger log = LoggerFactory.getLogger(ReplayEventReader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static List<ReplayEvent> readAll(Path file) {
        try (BufferedReader reader = Files.newBufferedReader(file)) {
            List<ReplayEvent> events = read(file, reader);
            log.info("Loaded {} replay events from {}", events.size(), file);
            return events;
        } catch (IOException e) {
            throw new ReplayException(file, 0, "Feed could not be read: " + e.getMessage(), e);
        }
    }

    /**
     * @param source name used in error messages
     */
    public static List<ReplayEvent> read(Path source, Reader input) throws IOException {
        BufferedReader reader = input instanceof BufferedReader ? (BufferedReader) input : new BufferedReader(input);
        List<ReplayEvent> events = new ArrayList<>();
        long lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            events.add(parse(source, lineNumber, trimmed));
        }
        return events;
    }

    static ReplayEvent parse(Path source, long lineNumber, String line) {
        ReplayEvent event;
        try {
            event = MAPPER.readValue(line, ReplayEvent.class);
        } catch (JsonProcessingException e) {
            throw new ReplayException(source, lineNumber, "Malformed event: " + e.getOriginalMessage(), e);
        }
        if (event.type() == null) {
            throw new ReplayException(source, lineNumber, "Event has no type", null);
        }
        if (event.type() == ReplayEvent.Type.CLOCK_OFFSET && event.offsetMs() == null) {
            throw new ReplayException(source, lineNumber, "clock-offset event without offsetMs", null);
        }
        return event;
    }

    private ReplayEventReader() {}
}
