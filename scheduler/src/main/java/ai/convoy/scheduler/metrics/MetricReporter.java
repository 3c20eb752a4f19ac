package ai.convoy.scheduler.metrics;

import java.io.Closeable;

public interface MetricReporter extends Closeable {
    void start();

    void stop();

    default void close() {
        stop();
    }

    static MetricReporter disabled() {
        return new MetricReporter() {
            @Override
            public void start() {
            }

            @Override
            public void stop() {
            }
        };
    }
}
