package com.ocilogs.query;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-request state: the id used to correlate log lines and the cancellation signal, either an
 * explicit {@link #cancel()} or the interruption of the worker thread.
 */
public final class QueryContext {

    private final String requestId;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public QueryContext(String requestId) {
        this.requestId = requestId;
    }

    public static QueryContext create() {
        return new QueryContext(UUID.randomUUID().toString());
    }

    public String requestId() {
        return requestId;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get() || Thread.currentThread().isInterrupted();
    }

    public void checkCancelled(String operation) {
        if (isCancelled()) {
            throw new RequestCancelledException("request " + requestId + " cancelled before " + operation);
        }
    }
}
