package edu.stanford.futuredata.geoshard.router;

import edu.stanford.futuredata.geoshard.engine.QueryContext;
import edu.stanford.futuredata.geoshard.engine.RouteLeg;
import edu.stanford.futuredata.geoshard.engine.RouteRequest;
import edu.stanford.futuredata.geoshard.engine.RouteResponse;
import edu.stanford.futuredata.geoshard.errors.BackendTimeoutException;
import edu.stanford.futuredata.geoshard.errors.GeoShardException;
import edu.stanford.futuredata.geoshard.errors.QueryCancelledException;
import edu.stanford.futuredata.geoshard.errors.StitchInconsistencyException;
import edu.stanford.futuredata.geoshard.registry.Shard;
import edu.stanford.futuredata.geoshard.utilities.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Answers a query whose waypoints span several shards by routing each shard's run of waypoints separately and
 * stitching the pieces together at gateway coordinates.
 */
public class CrossShardResolver {
    private static final Logger logger = LoggerFactory.getLogger(CrossShardResolver.class);

    private final BackendProxy proxy;
    private final GatewaySelector gatewaySelector;
    private final ExecutorService queryThreadPool;
    private final RouterConfig config;

    CrossShardResolver(BackendProxy proxy, ExecutorService queryThreadPool, RouterConfig config) {
        this.proxy = proxy;
        this.queryThreadPool = queryThreadPool;
        this.config = config;
        this.gatewaySelector = new GatewaySelector(proxy, queryThreadPool, config);
    }

    /**
     * @param shards one shard per run of consecutive waypoints, in waypoint order; each run is the longest
     *               prefix of the remaining waypoints that the shard contains
     */
    public RouteResponse resolve(RouteRequest request, List<Shard> shards, QueryContext context) {
        List<List<Coordinate>> runs = splitRuns(request, shards);
        if (shards.size() == 1) {
            return proxy.query(shards.get(0), request, context);
        }
        logger.info("Query {} spans shards {}", request.getRequestID(),
                shards.stream().map(s -> s.id).collect(Collectors.toList()));

        // Gateways at run boundaries are independent of each other.  Pool tasks only call engines; this thread is
        // the only one that waits.
        List<CompletableFuture<Coordinate>> gatewayFutures = new ArrayList<>();
        for (int k = 0; k + 1 < shards.size(); k++) {
            Coordinate p = runs.get(k).get(runs.get(k).size() - 1);
            Coordinate q = runs.get(k + 1).get(0);
            try {
                gatewayFutures.add(gatewaySelector.select(shards.get(k), shards.get(k + 1), p, q, request, context));
            } catch (GeoShardException e) {
                // Stop the candidates already costing for earlier boundaries.
                context.cancel();
                throw e;
            }
        }
        CompletableFuture<RouteResponse> stitched = allOf(gatewayFutures).thenCompose(gateways -> {
            List<CompletableFuture<RouteResponse>> pieceFutures = new ArrayList<>();
            for (int k = 0; k < shards.size(); k++) {
                List<Coordinate> coordinates = new ArrayList<>();
                if (k > 0) {
                    coordinates.add(gateways.get(k - 1));
                }
                coordinates.addAll(runs.get(k));
                if (k < gateways.size()) {
                    coordinates.add(gateways.get(k));
                }
                Shard shard = shards.get(k);
                RouteRequest piece = request.withWaypoints(coordinates);
                pieceFutures.add(CompletableFuture.supplyAsync(() -> proxy.query(shard, piece, context), queryThreadPool));
            }
            return allOf(pieceFutures).thenApply(pieces -> stitch(pieces, gateways, shards));
        });
        return await(stitched, context, config.crossShardTimeoutMillis);
    }

    /** Assign every waypoint to the first shard, from the current one on, that contains it. */
    static List<List<Coordinate>> splitRuns(RouteRequest request, List<Shard> shards) {
        if (shards.isEmpty()) {
            throw new IllegalArgumentException("No shards given for " + request);
        }
        List<List<Coordinate>> runs = new ArrayList<>();
        runs.add(new ArrayList<>());
        int k = 0;
        for (Coordinate wp : request.getWaypoints()) {
            if (!shards.get(k).bbox.contains(wp)) {
                k++;
                if (k >= shards.size() || !shards.get(k).bbox.contains(wp)) {
                    throw new IllegalArgumentException(String.format("Waypoint %s does not follow shard order %s", wp,
                            shards.stream().map(s -> s.id).collect(Collectors.toList())));
                }
                runs.add(new ArrayList<>());
            }
            runs.get(k).add(wp);
        }
        if (runs.size() != shards.size()) {
            throw new IllegalArgumentException(String.format("%d shards given for %d waypoint runs", shards.size(), runs.size()));
        }
        return runs;
    }

    RouteResponse stitch(List<RouteResponse> pieces, List<Coordinate> gateways, List<Shard> shards) {
        for (int k = 0; k < pieces.size(); k++) {
            for (RouteLeg leg : pieces.get(k).legs) {
                if (leg.duration < 0 || leg.distance < 0) {
                    throw new StitchInconsistencyException(String.format("Shard %s returned a leg with negative cost",
                            shards.get(k).id));
                }
            }
            if (k > 0) {
                Coordinate end = pieces.get(k - 1).end();
                Coordinate start = pieces.get(k).start();
                double gap = end.distanceMeters(start);
                if (gap > config.snapToleranceMeters) {
                    throw new StitchInconsistencyException(String.format(
                            "Route on %s ends at %s but route on %s starts at %s (%.1f m apart) near gateway %s",
                            shards.get(k - 1).id, end, shards.get(k).id, start, gap, gateways.get(k - 1)));
                }
            }
        }
        RouteResponse stitched = pieces.get(0);
        for (int k = 1; k < pieces.size(); k++) {
            stitched = stitched.concat(pieces.get(k), gateways.get(k - 1));
        }
        return stitched;
    }

    // Results in submission order, once every future has completed.
    static <T> CompletableFuture<List<T>> allOf(List<CompletableFuture<T>> futures) {
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(v -> futures.stream().map(CompletableFuture::join).collect(Collectors.toList()));
    }

    /**
     * Wait for a query's result.  On failure or timeout the query's outstanding engine calls are cancelled and
     * the first failure is rethrown as is.
     */
    static <T> T await(CompletableFuture<T> future, QueryContext context, long timeoutMillis) {
        try {
            return future.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            context.cancel();
            Throwable cause = e.getCause();
            while (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof GeoShardException) {
                throw (GeoShardException) cause;
            }
            throw new IllegalStateException("Sub-query failed for " + context.getRequestID(), cause);
        } catch (TimeoutException e) {
            context.cancel();
            throw new BackendTimeoutException("cross-shard query " + context.getRequestID(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.cancel();
            throw new QueryCancelledException(context.getRequestID());
        }
    }
}
