package dev.stepflow.runner;

import dev.stepflow.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every event to the log. Failures are logged at WARN, everything else at INFO.
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void push(Event event) {
        switch (event.kind()) {
            case RUN_ERROR, RUN_FAIL, RUN_WAIT_ERROR, RUN_TIMEOUT -> log.warn("{}", event);
            default -> log.info("{}", event);
        }
    }
}
