package dev.stepflow.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;

/**
 * Copies one process stream into a sink stream on a daemon thread.
 */
final class OutputPump implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(OutputPump.class);

    private final InputStream source;
    private final OutputStream target;
    private final Thread thread;
    private volatile IOException failure;

    private OutputPump(String step, String channel, InputStream source, OutputStream target) {
        this.source = source;
        this.target = target;
        this.thread = new Thread(this, "stepflow-" + step + "-" + channel);
        this.thread.setDaemon(true);
    }

    static OutputPump start(String step, String channel, InputStream source, OutputStream target) {
        OutputPump pump = new OutputPump(step, channel, source, target);
        pump.thread.start();
        return pump;
    }

    @Override
    public void run() {
        try (InputStream in = source) {
            in.transferTo(target);
            target.flush();
        } catch (IOException e) {
            failure = e;
        }
    }

    /**
     * Wait for the copy to finish. A pump still blocked after the grace period
     * (a detached child holding the pipe open) is abandoned.
     */
    void await(Duration grace) throws IOException, InterruptedException {
        thread.join(grace.toMillis());
        if (thread.isAlive()) {
            log.warn("Output of {} still open after {}, no longer waiting", thread.getName(), grace);
            return;
        }
        if (failure != null) {
            throw failure;
        }
    }
}
