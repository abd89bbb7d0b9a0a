package testblocks.engine;

import testblocks.logging.TestLogger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * In-memory {@link TestLogger} for assertions on emitted lifecycle events.
 * Each event is recorded as {@code "LEVEL|block|message"}.
 */
public class RecordingTestLogger implements TestLogger {

    private final List<String> events = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void info(String runName, String blockName, String message) {
        events.add("INFO|" + blockName + "|" + message);
    }

    @Override
    public void debug(String runName, String blockName, String message) {
        events.add("DEBUG|" + blockName + "|" + message);
    }

    @Override
    public void error(String runName, String blockName, String message) {
        events.add("ERROR|" + blockName + "|" + message);
    }

    @Override
    public void testBlockInput(String runName, String blockName, String serializedArgs) {
        events.add("INPUT|" + blockName + "|" + serializedArgs);
    }

    @Override
    public void testBlockOutput(String runName, String blockName, String serializedResult) {
        events.add("OUTPUT|" + blockName + "|" + serializedResult);
    }

    public List<String> events() {
        return events;
    }

    public List<String> eventsFor(String level) {
        synchronized (events) {
            return events.stream()
                    .filter(e -> e.startsWith(level + "|"))
                    .collect(Collectors.toList());
        }
    }
}
