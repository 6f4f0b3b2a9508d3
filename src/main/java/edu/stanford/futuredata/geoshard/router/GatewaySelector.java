package edu.stanford.futuredata.geoshard.router;

import edu.stanford.futuredata.geoshard.engine.QueryContext;
import edu.stanford.futuredata.geoshard.engine.RouteRequest;
import edu.stanford.futuredata.geoshard.engine.RouteResponse;
import edu.stanford.futuredata.geoshard.errors.BackendErrorException;
import edu.stanford.futuredata.geoshard.errors.UnroutableCrossShardException;
import edu.stanford.futuredata.geoshard.registry.Shard;
import edu.stanford.futuredata.geoshard.utilities.BoundingBox;
import edu.stanford.futuredata.geoshard.utilities.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Picks the point where a route passes from one shard into the next.
 *
 * Candidates lie in the zone where both shards' boxes, grown by a small buffer, overlap: points on the straight
 * line between the enclosing waypoints, the zone's center, and samples along the zone's long axis.  Each
 * candidate costs the duration into it on the first shard plus the duration out of it on the second.  Equal
 * costs go to the candidate nearest the straight line.
 */
class GatewaySelector {
    private static final Logger logger = LoggerFactory.getLogger(GatewaySelector.class);

    private final BackendProxy proxy;
    private final ExecutorService queryThreadPool;
    private final RouterConfig config;

    GatewaySelector(BackendProxy proxy, ExecutorService queryThreadPool, RouterConfig config) {
        this.proxy = proxy;
        this.queryThreadPool = queryThreadPool;
        this.config = config;
    }

    /**
     * Cost every candidate on the query pool.  The returned future completes with the best gateway once all
     * candidates are costed; nothing here waits on the pool.
     */
    CompletableFuture<Coordinate> select(Shard from, Shard to, Coordinate p, Coordinate q, RouteRequest request,
                                         QueryContext context) {
        List<Coordinate> candidates = candidates(from, to, p, q);
        List<CompletableFuture<Optional<Double>>> costs = new ArrayList<>();
        for (Coordinate g : candidates) {
            costs.add(CompletableFuture.supplyAsync(() -> cost(from, to, p, g, q, request, context), queryThreadPool));
        }
        return CompletableFuture.allOf(costs.toArray(new CompletableFuture[0]))
                .thenApply(v -> best(from, to, p, q, candidates,
                        costs.stream().map(CompletableFuture::join).collect(Collectors.toList())));
    }

    Coordinate best(Shard from, Shard to, Coordinate p, Coordinate q, List<Coordinate> candidates,
                    List<Optional<Double>> results) {
        int best = -1;
        double bestCost = Double.MAX_VALUE;
        double bestOffset = Double.MAX_VALUE;
        for (int i = 0; i < candidates.size(); i++) {
            if (results.get(i).isEmpty()) {
                continue;
            }
            double cost = results.get(i).get();
            double offset = candidates.get(i).distanceToSegmentMeters(p, q);
            double epsilon = config.gatewayCostEpsilon * Math.max(1.0, Math.abs(bestCost));
            boolean tie = best >= 0 && Math.abs(cost - bestCost) <= epsilon;
            if (best < 0 || (!tie && cost < bestCost) || (tie && offset < bestOffset)) {
                best = i;
                bestCost = cost;
                bestOffset = offset;
            }
        }
        if (best < 0) {
            throw new UnroutableCrossShardException(from.id, to.id,
                    String.format("none of %d gateway candidates has a route on both sides", candidates.size()));
        }
        logger.debug("Gateway {} -> {} at {} cost {}s", from.id, to.id, candidates.get(best), bestCost);
        return candidates.get(best);
    }

    // Duration p -> g on the first shard plus g -> q on the second, or empty if either engine finds no route.
    private Optional<Double> cost(Shard from, Shard to, Coordinate p, Coordinate g, Coordinate q,
                                  RouteRequest request, QueryContext context) {
        try {
            RouteResponse in = proxy.query(from, request.withWaypoints(List.of(p, g)), context);
            RouteResponse out = proxy.query(to, request.withWaypoints(List.of(g, q)), context);
            return Optional.of(in.duration + out.duration);
        } catch (BackendErrorException e) {
            logger.debug("Gateway candidate {} between {} and {} rejected: {}", g, from.id, to.id, e.getMessage());
            return Optional.empty();
        }
    }

    List<Coordinate> candidates(Shard from, Shard to, Coordinate p, Coordinate q) {
        double buffer = config.gatewayBufferDegrees;
        Optional<BoundingBox> zoneOpt = from.bbox.expand(buffer).intersection(to.bbox.expand(buffer));
        if (zoneOpt.isEmpty()) {
            throw new UnroutableCrossShardException(from.id, to.id,
                    String.format("bounding boxes are more than %s degrees apart", buffer));
        }
        BoundingBox zone = zoneOpt.get();
        int max = config.maxGatewayCandidates;
        Set<Coordinate> candidates = new LinkedHashSet<>();
        // Where the straight line between the waypoints crosses the zone.
        List<Coordinate> onLine = new ArrayList<>();
        int lineSamples = 4 * max;
        for (int i = 1; i <= lineSamples; i++) {
            Coordinate c = p.interpolate(q, (double) i / (lineSamples + 1));
            if (zone.contains(c)) {
                onLine.add(c);
            }
        }
        int lineSlots = (max + 1) / 2;
        if (onLine.size() <= lineSlots) {
            candidates.addAll(onLine);
        } else {
            for (int i = 0; i < lineSlots; i++) {
                candidates.add(onLine.get(i * (onLine.size() - 1) / Math.max(1, lineSlots - 1)));
            }
        }
        candidates.add(zone.center());
        int remaining = max - candidates.size();
        for (int i = 0; i < remaining; i++) {
            double t = (i + 0.5) / remaining;
            Coordinate c = zone.width() >= zone.height()
                    ? new Coordinate(zone.minLon + t * zone.width(), zone.center().lat)
                    : new Coordinate(zone.center().lon, zone.minLat + t * zone.height());
            candidates.add(c);
        }
        List<Coordinate> l = new ArrayList<>(candidates);
        return l.size() > max ? l.subList(0, max) : l;
    }
}
