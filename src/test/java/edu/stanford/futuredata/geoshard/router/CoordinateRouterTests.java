package edu.stanford.futuredata.geoshard.router;

import edu.stanford.futuredata.geoshard.engine.QueryContext;
import edu.stanford.futuredata.geoshard.engine.RouteLeg;
import edu.stanford.futuredata.geoshard.engine.RouteRequest;
import edu.stanford.futuredata.geoshard.engine.RouteResponse;
import edu.stanford.futuredata.geoshard.engine.RouteStep;
import edu.stanford.futuredata.geoshard.errors.BackendErrorException;
import edu.stanford.futuredata.geoshard.errors.BackendTimeoutException;
import edu.stanford.futuredata.geoshard.errors.BackendUnavailableException;
import edu.stanford.futuredata.geoshard.errors.NoShardCoverageException;
import edu.stanford.futuredata.geoshard.errors.QueryCancelledException;
import edu.stanford.futuredata.geoshard.errors.ShardUnavailableException;
import edu.stanford.futuredata.geoshard.errors.StitchInconsistencyException;
import edu.stanford.futuredata.geoshard.errors.UnroutableCrossShardException;
import edu.stanford.futuredata.geoshard.mockinterfaces.FakeEngineClient;
import edu.stanford.futuredata.geoshard.registry.Shard;
import edu.stanford.futuredata.geoshard.registry.ShardCatalog;
import edu.stanford.futuredata.geoshard.registry.ShardRegistry;
import edu.stanford.futuredata.geoshard.utilities.BoundingBox;
import edu.stanford.futuredata.geoshard.utilities.Coordinate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class CoordinateRouterTests {

    private static final Logger logger = LoggerFactory.getLogger(CoordinateRouterTests.class);

    static final String WEST = "http://west:5000";
    static final String EAST = "http://east:5000";
    static final String METRO = "http://metro:5000";

    private FakeEngineClient engine;
    private CoordinateRouter router;

    @BeforeEach
    public void setUp() {
        engine = new FakeEngineClient();
        router = new CoordinateRouter(new ShardRegistry(ShardCatalog.fromResource("/test-catalog.json")), engine,
                new RouterConfig());
    }

    @AfterEach
    public void tearDown() {
        router.shutdown();
    }

    private static RouteRequest request(Coordinate... waypoints) {
        return new RouteRequest(List.of(waypoints));
    }

    @Test
    public void testPassThroughUnchanged() {
        logger.info("testPassThroughUnchanged");
        ShardRegistry registry = new ShardRegistry(ShardCatalog.fromResource(ShardCatalog.DEFAULT_RESOURCE));
        FakeEngineClient planet = new FakeEngineClient();
        CoordinateRouter planetRouter = new CoordinateRouter(registry, planet, new RouterConfig());
        RouteRequest r = request(new Coordinate(-73.989, 40.733), new Coordinate(-73.982, 40.742));
        RouteResponse response = planetRouter.route(r);
        assertEquals(1, planet.calls.size());
        FakeEngineClient.Call call = planet.calls.get(0);
        assertEquals("http://127.0.0.1:5000", call.endpoint);
        // The request is forwarded verbatim and the engine's answer returned as is.
        assertSame(r, call.request);
        assertSame(call.response, response);
        planetRouter.shutdown();
    }

    @Test
    public void testIntercontinentalUnroutable() {
        logger.info("testIntercontinentalUnroutable");
        ShardRegistry registry = new ShardRegistry(ShardCatalog.fromResource(ShardCatalog.DEFAULT_RESOURCE));
        CoordinateRouter planetRouter = new CoordinateRouter(registry, new FakeEngineClient(), new RouterConfig());
        UnroutableCrossShardException e = assertThrows(UnroutableCrossShardException.class, () -> planetRouter.route(
                request(new Coordinate(-73.989, 40.733), new Coordinate(-0.127, 51.507))));
        assertEquals("slice_a_north_america", e.getFromShardID());
        assertEquals("slice_c_europe_africa", e.getToShardID());
        planetRouter.shutdown();
    }

    @Test
    public void testNoShardCoverage() {
        logger.info("testNoShardCoverage");
        NoShardCoverageException e = assertThrows(NoShardCoverageException.class,
                () -> router.route(request(new Coordinate(5, 5), new Coordinate(-100, -80), new Coordinate(6, 6))));
        assertEquals(1, e.getWaypointIndex());
        assertTrue(engine.calls.isEmpty());
    }

    @Test
    public void testShardUnavailable() {
        logger.info("testShardUnavailable");
        ShardUnavailableException e = assertThrows(ShardUnavailableException.class,
                () -> router.route(request(new Coordinate(5, 5), new Coordinate(35, 5))));
        assertEquals(1, e.getWaypointIndex());
        assertEquals(Set.of("frontier"), e.getShardIDs());
        // A stale shard keeps serving.
        router.route(request(new Coordinate(65, 5), new Coordinate(66, 6)));
        assertEquals(1, engine.callsTo("http://stale:5000").size());
    }

    @Test
    public void testMostSpecificShard() {
        logger.info("testMostSpecificShard");
        router.route(request(new Coordinate(3, 3), new Coordinate(3.5, 3.5)));
        assertEquals(1, engine.callsTo(METRO).size());
        router.route(request(new Coordinate(3, 3), new Coordinate(8, 8)));
        assertEquals(1, engine.callsTo(WEST).size());
        // On the shared edge both shards qualify; equal areas fall back to the id.
        router.route(request(new Coordinate(10, 3), new Coordinate(10, 8)));
        assertEquals(1, engine.callsTo(EAST).size());
    }

    @Test
    public void testPlanRuns() {
        logger.info("testPlanRuns");
        ShardRegistry registry = router.getRegistry();
        Shard west = registry.requireShard("west");
        Shard east = registry.requireShard("east");
        Shard metro = registry.requireShard("metro");
        List<Shard> runs = CoordinateRouter.planRuns(List.of(Set.of(west, metro), Set.of(west), Set.of(west, east),
                Set.of(east), Set.of(east, west), Set.of(west)));
        assertEquals(List.of(west, east, west), runs);
        assertEquals(metro, CoordinateRouter.mostSpecific(Set.of(west, metro)));
    }

    @Test
    public void testCrossShardStitching() {
        logger.info("testCrossShardStitching");
        Coordinate p = new Coordinate(5, 5);
        Coordinate q = new Coordinate(15, 5);
        RouteResponse r = router.route(request(p, q));
        assertEquals(1, r.legs.size());
        assertEquals(List.of(p, q), r.waypoints);
        assertEquals(p, r.start());
        assertEquals(q, r.end());
        assertStitched(r, new RouterConfig().snapToleranceMeters);

        RouteStep boundary = boundarySteps(r).get(0);
        assertTrue(boundary.location.lon >= 9.5 && boundary.location.lon <= 10.5, boundary.toString());
        // The pieces that made it up.
        List<FakeEngineClient.Call> west = engine.callsTo(WEST);
        List<FakeEngineClient.Call> east = engine.callsTo(EAST);
        FakeEngineClient.Call westPiece = west.get(west.size() - 1);
        FakeEngineClient.Call eastPiece = east.get(east.size() - 1);
        assertEquals(List.of(p, boundary.location), westPiece.request.getWaypoints());
        assertEquals(List.of(boundary.location, q), eastPiece.request.getWaypoints());
        assertEquals(westPiece.response.duration + eastPiece.response.duration, r.duration, 1e-6);
        assertEquals(westPiece.response.distance + eastPiece.response.distance, r.distance, 1e-6);
    }

    @Test
    public void testCrossShardLegs() {
        logger.info("testCrossShardLegs");
        Coordinate p = new Coordinate(5, 5);
        Coordinate q = new Coordinate(15, 5);
        Coordinate s = new Coordinate(15, 8);
        Coordinate t = new Coordinate(5, 8);
        RouteResponse r = router.route(request(p, q, s, t));
        assertEquals(3, r.legs.size());
        assertEquals(List.of(p, q, s, t), r.waypoints);
        assertEquals(2, boundarySteps(r).size());
        assertStitched(r, new RouterConfig().snapToleranceMeters);
    }

    @Test
    public void testGatewayAvoidsUnroutableArea() {
        logger.info("testGatewayAvoidsUnroutableArea");
        // A lake on the west side of the boundary, across the straight line.
        engine.noRouteWithin(WEST, new BoundingBox(9, 4, 10.6, 6));
        RouteResponse r = router.route(request(new Coordinate(5, 5), new Coordinate(15, 5)));
        Coordinate gateway = boundarySteps(r).get(0).location;
        assertFalse(gateway.lat >= 4 && gateway.lat <= 6 && gateway.lon <= 10.6, gateway.toString());
        assertStitched(r, new RouterConfig().snapToleranceMeters);
    }

    @Test
    public void testGatewayTieBreak() {
        logger.info("testGatewayTieBreak");
        // Every candidate costs the same, so the one nearest the straight line wins.
        engine.fixedLegDuration(WEST, 100).fixedLegDuration(EAST, 100);
        Coordinate p = new Coordinate(5, 2);
        Coordinate q = new Coordinate(15, 8);
        RouteResponse r = router.route(request(p, q));
        Coordinate gateway = boundarySteps(r).get(0).location;
        assertTrue(gateway.distanceToSegmentMeters(p, q) < 1.0, gateway.toString());
        assertEquals(200.0, r.duration, 1e-9);
    }

    @Test
    public void testGatewayCandidates() {
        logger.info("testGatewayCandidates");
        RouterConfig config = new RouterConfig();
        ShardRegistry registry = router.getRegistry();
        GatewaySelector selector = new GatewaySelector(new BackendProxy(engine), null, config);
        List<Coordinate> candidates = selector.candidates(registry.requireShard("west"), registry.requireShard("east"),
                new Coordinate(5, 5), new Coordinate(15, 5));
        assertFalse(candidates.isEmpty());
        assertTrue(candidates.size() <= config.maxGatewayCandidates);
        for (Coordinate c : candidates) {
            assertTrue(c.lon >= 9.5 && c.lon <= 10.5 && c.lat >= -0.5 && c.lat <= 10.5, c.toString());
        }
        assertTrue(candidates.contains(new Coordinate(10, 5)));
        assertThrows(UnroutableCrossShardException.class, () -> selector.candidates(registry.requireShard("west"),
                registry.requireShard("island"), new Coordinate(5, 5), new Coordinate(52, 52)));
    }

    @Test
    public void testDisconnectedShardUnroutable() {
        logger.info("testDisconnectedShardUnroutable");
        UnroutableCrossShardException e = assertThrows(UnroutableCrossShardException.class,
                () -> router.route(request(new Coordinate(5, 5), new Coordinate(52, 52))));
        assertEquals("west", e.getFromShardID());
        assertEquals("island", e.getToShardID());
        // Every candidate rejected by the engine.
        engine.noRouteWithin(EAST, new BoundingBox(9, -1, 11, 11));
        e = assertThrows(UnroutableCrossShardException.class,
                () -> router.route(request(new Coordinate(5, 5), new Coordinate(15, 5))));
        assertEquals("east", e.getToShardID());
    }

    @Test
    public void testStitchInconsistency() {
        logger.info("testStitchInconsistency");
        engine.snapOffset(EAST, 0.01);
        assertThrows(StitchInconsistencyException.class,
                () -> router.route(request(new Coordinate(5, 5), new Coordinate(15, 5))));
    }

    @Test
    public void testRetryOnce() {
        logger.info("testRetryOnce");
        RouteRequest r = request(new Coordinate(5, 5), new Coordinate(8, 8));
        engine.failUnavailable(WEST, 1);
        router.route(r);
        assertEquals(2, engine.callsTo(WEST).size());

        engine.failTimeout(WEST, 1);
        router.route(r);
        assertEquals(4, engine.callsTo(WEST).size());

        engine.failUnavailable(WEST, 2);
        assertThrows(BackendUnavailableException.class, () -> router.route(r));
        assertEquals(6, engine.callsTo(WEST).size());

        engine.failTimeout(WEST, 2);
        assertThrows(BackendTimeoutException.class, () -> router.route(r));
        assertEquals(8, engine.callsTo(WEST).size());
    }

    @Test
    public void testNoRetryOnEngineError() {
        logger.info("testNoRetryOnEngineError");
        engine.noRouteWithin(WEST, new BoundingBox(7, 7, 9, 9));
        BackendErrorException e = assertThrows(BackendErrorException.class,
                () -> router.route(request(new Coordinate(5, 5), new Coordinate(8, 8))));
        assertEquals("NoRoute", e.getEngineCode());
        assertEquals(1, engine.callsTo(WEST).size());
    }

    @Test
    public void testCancellationIsolated() throws Exception {
        logger.info("testCancellationIsolated");
        engine.hang(EAST);
        RouteRequest slow = request(new Coordinate(12, 2), new Coordinate(18, 8));
        QueryContext slowContext = new QueryContext(slow.getRequestID());
        CompletableFuture<RouteResponse> slowQuery = CompletableFuture.supplyAsync(() -> router.route(slow, slowContext));
        assertTrue(engine.hangingCallStarted.await(10, TimeUnit.SECONDS));

        RouteResponse fast = router.route(request(new Coordinate(5, 5), new Coordinate(8, 8)));
        assertNotNull(fast);
        slowContext.cancel();
        ExecutionException e = assertThrows(ExecutionException.class, () -> slowQuery.get(10, TimeUnit.SECONDS));
        assertTrue(e.getCause() instanceof QueryCancelledException, e.getCause().toString());

        // The router still serves other queries.
        assertEquals(2, router.route(request(new Coordinate(5, 5), new Coordinate(8, 8))).waypoints.size());
    }

    @Test
    public void testConcurrentCrossShardQueries() throws Exception {
        logger.info("testConcurrentCrossShardQueries");
        RouterConfig config = new RouterConfig();
        config.queryThreads = 2;
        CoordinateRouter smallPool = new CoordinateRouter(
                new ShardRegistry(ShardCatalog.fromResource("/test-catalog.json")), engine, config);
        int numClients = 16;
        ExecutorService clients = Executors.newFixedThreadPool(numClients);
        CyclicBarrier barrier = new CyclicBarrier(numClients);
        List<Future<RouteResponse>> futures = new ArrayList<>();
        for (int i = 0; i < numClients; i++) {
            futures.add(clients.submit(() -> {
                barrier.await();
                return smallPool.route(request(new Coordinate(5, 5), new Coordinate(15, 5)));
            }));
        }
        for (Future<RouteResponse> f : futures) {
            RouteResponse r = f.get(30, TimeUnit.SECONDS);
            assertEquals(1, boundarySteps(r).size());
        }
        clients.shutdown();
        smallPool.shutdown();

        config.queryThreads = 1;
        CoordinateRouter singleThread = new CoordinateRouter(
                new ShardRegistry(ShardCatalog.fromResource("/test-catalog.json")), engine, config);
        CompletableFuture<RouteResponse> one = CompletableFuture.supplyAsync(
                () -> singleThread.route(request(new Coordinate(5, 5), new Coordinate(15, 5))));
        assertNotNull(one.get(30, TimeUnit.SECONDS));
        singleThread.shutdown();
    }

    @Test
    public void testCrossShardDeadline() {
        logger.info("testCrossShardDeadline");
        RouterConfig config = new RouterConfig();
        config.crossShardTimeoutMillis = 200;
        CoordinateRouter deadlined = new CoordinateRouter(
                new ShardRegistry(ShardCatalog.fromResource("/test-catalog.json")), engine, config);
        engine.hang(EAST);
        RouteRequest r = request(new Coordinate(5, 5), new Coordinate(15, 5));
        QueryContext context = new QueryContext(r.getRequestID());
        assertThrows(BackendTimeoutException.class, () -> deadlined.route(r, context));
        // The hanging engine calls were released.
        assertTrue(context.isCancelled());
        deadlined.shutdown();
    }

    static List<RouteStep> boundarySteps(RouteResponse r) {
        return r.legs.stream().flatMap(l -> l.steps.stream())
                .filter(s -> RouteStep.BOUNDARY_INSTRUCTION.equals(s.instruction))
                .collect(Collectors.toList());
    }

    // Legs meet, none has a negative cost and the totals add up.
    static void assertStitched(RouteResponse r, double toleranceMeters) {
        double duration = 0;
        double distance = 0;
        for (int i = 0; i < r.legs.size(); i++) {
            RouteLeg leg = r.legs.get(i);
            assertTrue(leg.duration >= 0);
            assertTrue(leg.distance >= 0);
            duration += leg.duration;
            distance += leg.distance;
            if (i > 0) {
                assertTrue(r.legs.get(i - 1).end().distanceMeters(leg.start()) <= toleranceMeters);
            }
        }
        assertEquals(r.duration, duration, 1e-6);
        assertEquals(r.distance, distance, 1e-6);
    }
}
