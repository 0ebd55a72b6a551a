package dev.stepflow.runner;

import java.io.OutputStream;

/**
 * Destination for a step process's standard output and error.
 * The sink owns both streams; the runner writes and flushes but never closes them.
 */
public interface Sink {

    OutputStream stdout();

    OutputStream stderr();

    static Sink of(OutputStream stdout, OutputStream stderr) {
        return new Sink() {
            @Override public OutputStream stdout() { return stdout; }
            @Override public OutputStream stderr() { return stderr; }
        };
    }

    static Sink console() {
        return of(System.out, System.err);
    }

    static Sink discard() {
        return of(OutputStream.nullOutputStream(), OutputStream.nullOutputStream());
    }
}
