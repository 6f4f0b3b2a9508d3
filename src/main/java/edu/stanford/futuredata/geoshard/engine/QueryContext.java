package edu.stanford.futuredata.geoshard.engine;

import edu.stanford.futuredata.geoshard.errors.QueryCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation scope of one routing query.  Backend calls register a hook to abort themselves; cancelling the
 * context runs every hook and fails later calls of the same query without touching other queries.
 */
public class QueryContext {
    private static final Logger logger = LoggerFactory.getLogger(QueryContext.class);

    private final String requestID;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> cancelHooks = new CopyOnWriteArrayList<>();

    public QueryContext(String requestID) {
        this.requestID = requestID;
    }

    public String getRequestID() {
        return requestID;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void checkCancelled() {
        if (cancelled.get()) {
            throw new QueryCancelledException(requestID);
        }
    }

    /** Register a hook run on cancellation, or run it now if the query is already cancelled. */
    public void onCancel(Runnable hook) {
        cancelHooks.add(hook);
        if (cancelled.get()) {
            hook.run();
        }
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            logger.info("Cancelling query {} ({} outstanding calls)", requestID, cancelHooks.size());
            cancelHooks.forEach(Runnable::run);
        }
    }
}
