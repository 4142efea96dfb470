package com.rex.gate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retry binding a listening port with a linear backoff,
 * a restarted container may still hold the port for a few seconds.
 */
public final class BindRetry {

    private static final Logger sLogger = LoggerFactory.getLogger(BindRetry.class);

    public interface Binder<T> {
        T bind() throws Exception;
    }

    private BindRetry() {
    }

    public static <T> T bind(String name, int attempts, long delayMillis, Binder<T> binder) {
        Exception last = null;
        for (int attempt = 1; attempt <= Math.max(1, attempts); attempt++) {
            try {
                return binder.bind();
            } catch (Exception ex) {
                last = ex;
                sLogger.warn("{} bind attempt {}/{} failed - {}", name, attempt, attempts, ex.toString());
            }
            if (attempt < attempts) {
                try {
                    Thread.sleep(delayMillis * attempt);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    throw new GateStartException(name + " bind interrupted", ex);
                }
            }
        }
        throw new GateStartException("Failed to bind " + name, last);
    }
}
