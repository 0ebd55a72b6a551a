package dev.stepflow.runner;

import dev.stepflow.model.Event;

/**
 * Receives step lifecycle events, e.g. to forward them to a UI or a log.
 * A failed push is reported by the caller but never fails the step.
 */
public interface Notifier {

    /** Called once before the first step of a run is dispatched. */
    default void start() throws NotificationException {}

    void push(Event event) throws NotificationException;

    /** Called once after every dispatched step has finished. */
    default void stop() {}
}
