package edu.stanford.futuredata.geoshard.router;

import edu.stanford.futuredata.geoshard.engine.EngineClient;
import edu.stanford.futuredata.geoshard.engine.QueryContext;
import edu.stanford.futuredata.geoshard.engine.RouteRequest;
import edu.stanford.futuredata.geoshard.engine.RouteResponse;
import edu.stanford.futuredata.geoshard.errors.BackendUnavailableException;
import edu.stanford.futuredata.geoshard.registry.Shard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Sends one request to one shard's engine.  A call that cannot reach the engine is retried once; an error the
 * engine reports is never retried.
 */
class BackendProxy {
    private static final Logger logger = LoggerFactory.getLogger(BackendProxy.class);

    static final int MAX_ATTEMPTS = 2;

    private final EngineClient engine;
    final Collection<Long> remoteExecutionTimes = new ConcurrentLinkedQueue<>();

    BackendProxy(EngineClient engine) {
        this.engine = engine;
    }

    RouteResponse query(Shard shard, RouteRequest request, QueryContext context) {
        for (int attempt = 1; ; attempt++) {
            context.checkCancelled();
            long start = System.nanoTime();
            try {
                RouteResponse r = engine.route(shard.endpoint, request, context);
                remoteExecutionTimes.add((System.nanoTime() - start) / 1000L);
                return r;
            } catch (BackendUnavailableException e) {
                if (attempt >= MAX_ATTEMPTS || context.isCancelled()) {
                    throw e;
                }
                logger.warn("Shard {} call failed for {}, retrying: {}", shard.id, request.getRequestID(), e.getMessage());
            }
        }
    }

    void shutdown() {
        engine.shutdown();
    }
}
