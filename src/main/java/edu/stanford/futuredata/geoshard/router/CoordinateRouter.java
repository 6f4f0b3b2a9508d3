package edu.stanford.futuredata.geoshard.router;

import edu.stanford.futuredata.geoshard.engine.EngineClient;
import edu.stanford.futuredata.geoshard.engine.QueryContext;
import edu.stanford.futuredata.geoshard.engine.RouteRequest;
import edu.stanford.futuredata.geoshard.engine.RouteResponse;
import edu.stanford.futuredata.geoshard.errors.NoShardCoverageException;
import edu.stanford.futuredata.geoshard.errors.ShardUnavailableException;
import edu.stanford.futuredata.geoshard.registry.Shard;
import edu.stanford.futuredata.geoshard.registry.ShardRegistry;
import edu.stanford.futuredata.geoshard.utilities.Coordinate;
import edu.stanford.futuredata.geoshard.utilities.Utilities;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * Maps the waypoints of a query to shards.  A query inside one shard is forwarded to that shard's engine
 * unchanged; anything else goes to the {@link CrossShardResolver}.
 */
public class CoordinateRouter {
    private static final Logger logger = LoggerFactory.getLogger(CoordinateRouter.class);

    public static final int QUERY_SUCCESS = 0;
    public static final int QUERY_FAILURE = 1;
    public static final int SERVER_FAILURE = 2;

    // Prefer the shard with the smallest box, then the lowest id.
    static final Comparator<Shard> MOST_SPECIFIC =
            Comparator.<Shard>comparingDouble(s -> s.bbox.area()).thenComparing(s -> s.id);

    private final ShardRegistry registry;
    private final BackendProxy proxy;
    private final CrossShardResolver resolver;
    private final ExecutorService queryThreadPool;

    private final Collection<Long> passThroughTimes = new ConcurrentLinkedQueue<>();
    private final Collection<Long> crossShardTimes = new ConcurrentLinkedQueue<>();

    public CoordinateRouter(ShardRegistry registry, EngineClient engine, RouterConfig config) {
        this.registry = registry;
        this.proxy = new BackendProxy(engine);
        this.queryThreadPool = Executors.newFixedThreadPool(config.queryThreads);
        this.resolver = new CrossShardResolver(proxy, queryThreadPool, config);
    }

    public RouteResponse route(RouteRequest request) {
        return route(request, new QueryContext(request.getRequestID()));
    }

    public RouteResponse route(RouteRequest request, QueryContext context) {
        long start = System.nanoTime();
        List<Set<Shard>> candidates = servingShards(request);
        Set<Shard> common = intersect(candidates, 0, candidates.size());
        if (!common.isEmpty()) {
            Shard shard = mostSpecific(common);
            logger.debug("Query {} passes through to {}", request.getRequestID(), shard.id);
            RouteResponse r = proxy.query(shard, request, context);
            passThroughTimes.add((System.nanoTime() - start) / 1000L);
            return r;
        }
        List<Shard> runs = planRuns(candidates);
        RouteResponse r = resolver.resolve(request, runs, context);
        crossShardTimes.add((System.nanoTime() - start) / 1000L);
        return r;
    }

    public ShardRegistry getRegistry() {
        return registry;
    }

    public void shutdown() {
        if (!passThroughTimes.isEmpty() || !crossShardTimes.isEmpty()) {
            List<Long> remote = new ArrayList<>(proxy.remoteExecutionTimes);
            List<Long> passThrough = new ArrayList<>(passThroughTimes);
            List<Long> crossShard = new ArrayList<>(crossShardTimes);
            logger.info("Queries: {} pass-through, {} cross-shard. p50 Remote: {}μs p99 Remote: {}μs " +
                            "p50 Cross-shard: {}μs p99 Cross-shard: {}μs", passThrough.size(), crossShard.size(),
                    Utilities.percentile(remote, 50), Utilities.percentile(remote, 99),
                    Utilities.percentile(crossShard, 50), Utilities.percentile(crossShard, 99));
        }
        queryThreadPool.shutdown();
        proxy.shutdown();
    }

    // Serving shards covering each waypoint, in catalog order.
    private List<Set<Shard>> servingShards(RouteRequest request) {
        List<Set<Shard>> candidates = new ArrayList<>();
        for (int i = 0; i < request.size(); i++) {
            Coordinate wp = request.getWaypoint(i);
            Set<Shard> covering;
            try {
                covering = registry.lookup(wp);
            } catch (NoShardCoverageException e) {
                throw new NoShardCoverageException(i, wp);
            }
            Set<Shard> serving = covering.stream().filter(Shard::isServing)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            if (serving.isEmpty()) {
                throw new ShardUnavailableException(i, wp,
                        covering.stream().map(s -> s.id).collect(Collectors.toSet()));
            }
            candidates.add(serving);
        }
        return candidates;
    }

    // Shards common to candidates[from, to), by id.
    private static Set<Shard> intersect(List<Set<Shard>> candidates, int from, int to) {
        Map<String, Shard> common = new LinkedHashMap<>();
        candidates.get(from).forEach(s -> common.put(s.id, s));
        for (int i = from + 1; i < to; i++) {
            Set<String> ids = candidates.get(i).stream().map(s -> s.id).collect(Collectors.toSet());
            common.keySet().retainAll(ids);
        }
        return new LinkedHashSet<>(common.values());
    }

    /**
     * Cut the waypoints into maximal runs that share a shard and pick one shard per run.  A run ends at the
     * first waypoint no shard of the run covers, so consecutive runs always use different shards.
     */
    static List<Shard> planRuns(List<Set<Shard>> candidates) {
        List<Shard> runs = new ArrayList<>();
        int runStart = 0;
        for (int i = 1; i <= candidates.size(); i++) {
            if (i == candidates.size() || intersect(candidates, runStart, i + 1).isEmpty()) {
                runs.add(mostSpecific(intersect(candidates, runStart, i)));
                runStart = i;
            }
        }
        return runs;
    }

    static Shard mostSpecific(Set<Shard> shards) {
        return shards.stream().min(MOST_SPECIFIC).orElseThrow();
    }
}
