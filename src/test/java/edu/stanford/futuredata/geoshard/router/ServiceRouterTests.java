package edu.stanford.futuredata.geoshard.router;

import edu.stanford.futuredata.geoshard.*;
import edu.stanford.futuredata.geoshard.engine.RouteStep;
import edu.stanford.futuredata.geoshard.errors.ReasonCode;
import edu.stanford.futuredata.geoshard.mockinterfaces.FakeEngineClient;
import edu.stanford.futuredata.geoshard.registry.ShardCatalog;
import edu.stanford.futuredata.geoshard.registry.ShardRegistry;
import edu.stanford.futuredata.geoshard.utilities.BoundingBox;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.Server;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static edu.stanford.futuredata.geoshard.router.CoordinateRouterTests.WEST;
import static org.junit.jupiter.api.Assertions.*;

public class ServiceRouterTests {

    private static final Logger logger = LoggerFactory.getLogger(ServiceRouterTests.class);

    private FakeEngineClient engine;
    private CoordinateRouter router;
    private Server server;
    private ManagedChannel channel;
    private ClientRouterGrpc.ClientRouterBlockingStub stub;

    @BeforeEach
    public void setUp() throws IOException {
        engine = new FakeEngineClient();
        router = new CoordinateRouter(new ShardRegistry(ShardCatalog.fromResource("/test-catalog.json")), engine,
                new RouterConfig());
        String name = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder.forName(name).directExecutor().addService(new ServiceRouter(router)).build().start();
        channel = InProcessChannelBuilder.forName(name).directExecutor().build();
        stub = ClientRouterGrpc.newBlockingStub(channel);
    }

    @AfterEach
    public void tearDown() throws InterruptedException {
        channel.shutdownNow();
        server.shutdownNow();
        server.awaitTermination(5, TimeUnit.SECONDS);
        router.shutdown();
    }

    private static RouteQueryMessage query(double... lonLats) {
        RouteQueryMessage.Builder b = RouteQueryMessage.newBuilder().setRequestID("test-query");
        for (int i = 0; i + 1 < lonLats.length; i += 2) {
            b.addWaypoints(CoordinateMessage.newBuilder().setLon(lonLats[i]).setLat(lonLats[i + 1]));
        }
        return b.build();
    }

    @Test
    public void testRoute() {
        logger.info("testRoute");
        RouteQueryResponse r = stub.route(query(5, 5, 8, 8));
        assertEquals(CoordinateRouter.QUERY_SUCCESS, r.getReturnCode());
        assertEquals(1, r.getLegsCount());
        assertEquals(2, r.getWaypointsCount());
        assertEquals(r.getLegs(0).getDuration(), r.getDuration(), 1e-9);
        assertTrue(r.getDistance() > 0);
        assertEquals("Head out onto Road 0", r.getLegs(0).getSteps(0).getInstruction());
        assertEquals(RouteStep.ARRIVE, r.getLegs(0).getSteps(1).getType());
        assertEquals(5.0, r.getGeometry(0).getLon());
    }

    @Test
    public void testCrossShardRoute() {
        logger.info("testCrossShardRoute");
        RouteQueryResponse r = stub.route(query(5, 5, 15, 5));
        assertEquals(CoordinateRouter.QUERY_SUCCESS, r.getReturnCode());
        assertEquals(1, r.getLegsCount());
        // Same shape as a single-shard answer, with one extra step at the seam.
        List<String> instructions = r.getLegs(0).getStepsList().stream().map(StepMessage::getInstruction)
                .collect(Collectors.toList());
        assertEquals(3, instructions.size());
        assertEquals(RouteStep.BOUNDARY_INSTRUCTION, instructions.get(1));
    }

    @Test
    public void testClientFailures() {
        logger.info("testClientFailures");
        RouteQueryResponse r = stub.route(query(5, 5, -100, -80));
        assertEquals(CoordinateRouter.QUERY_FAILURE, r.getReturnCode());
        assertEquals(ReasonCode.NO_SHARD_COVERAGE.name(), r.getReason());
        assertEquals(1, r.getWaypointIndex());

        r = stub.route(query(35, 5, 5, 5));
        assertEquals(CoordinateRouter.QUERY_FAILURE, r.getReturnCode());
        assertEquals(ReasonCode.SHARD_UNAVAILABLE.name(), r.getReason());
        assertEquals(0, r.getWaypointIndex());
        assertEquals(List.of("frontier"), r.getShardIDsList());

        r = stub.route(query(5, 5, 52, 52));
        assertEquals(CoordinateRouter.QUERY_FAILURE, r.getReturnCode());
        assertEquals(ReasonCode.UNROUTABLE_CROSS_SHARD.name(), r.getReason());
        assertEquals(List.of("west", "island"), r.getShardIDsList());

        engine.noRouteWithin(WEST, new BoundingBox(7, 7, 9, 9));
        r = stub.route(query(5, 5, 8, 8));
        assertEquals(CoordinateRouter.QUERY_FAILURE, r.getReturnCode());
        assertEquals(ReasonCode.BACKEND_ERROR.name(), r.getReason());
        assertTrue(r.getErrorMessage().startsWith("NoRoute"), r.getErrorMessage());
    }

    @Test
    public void testInvalidRequest() {
        logger.info("testInvalidRequest");
        RouteQueryResponse r = stub.route(query(5, 5));
        assertEquals(CoordinateRouter.QUERY_FAILURE, r.getReturnCode());
        assertEquals(ReasonCode.INVALID_REQUEST.name(), r.getReason());
        r = stub.route(query(5, 5, 5, 95));
        assertEquals(ReasonCode.INVALID_REQUEST.name(), r.getReason());
        assertTrue(engine.calls.isEmpty());
    }

    @Test
    public void testServerFailure() {
        logger.info("testServerFailure");
        engine.failUnavailable(WEST, 2);
        RouteQueryResponse r = stub.route(query(5, 5, 8, 8));
        assertEquals(CoordinateRouter.SERVER_FAILURE, r.getReturnCode());
        assertEquals(ReasonCode.BACKEND_UNAVAILABLE.name(), r.getReason());

        engine.snapOffset(CoordinateRouterTests.EAST, 0.01);
        r = stub.route(query(5, 5, 15, 5));
        assertEquals(CoordinateRouter.SERVER_FAILURE, r.getReturnCode());
        assertEquals(ReasonCode.STITCH_INCONSISTENT.name(), r.getReason());
    }

    @Test
    public void testUnexpectedFailure() {
        logger.info("testUnexpectedFailure");
        engine.failMalformed(WEST, 1);
        RouteQueryResponse r = stub.route(query(5, 5, 8, 8));
        assertEquals(CoordinateRouter.SERVER_FAILURE, r.getReturnCode());
        assertEquals(ReasonCode.INTERNAL_ERROR.name(), r.getReason());
        assertTrue(r.getErrorMessage().contains(WEST), r.getErrorMessage());

        engine.failMalformed(CoordinateRouterTests.EAST, 100);
        r = stub.route(query(5, 5, 15, 5));
        assertEquals(CoordinateRouter.SERVER_FAILURE, r.getReturnCode());
        assertEquals(ReasonCode.INTERNAL_ERROR.name(), r.getReason());

        // The service keeps answering.
        assertEquals(CoordinateRouter.QUERY_SUCCESS, stub.route(query(5, 5, 8, 8)).getReturnCode());
    }

    @Test
    public void testShardStatus() {
        logger.info("testShardStatus");
        router.getRegistry().promote("frontier", "/data/frontier/1/frontier.osrm");
        ShardStatusResponse r = stub.shardStatus(ShardStatusMessage.newBuilder().build());
        assertEquals(CoordinateRouter.QUERY_SUCCESS, r.getReturnCode());
        assertEquals(7, r.getCatalogVersion());
        assertEquals(6, r.getShardsCount());
        Map<String, ShardHealthMessage> shards = r.getShardsList().stream()
                .collect(Collectors.toMap(ShardHealthMessage::getShardID, s -> s));
        assertEquals("READY", shards.get("frontier").getReadiness());
        assertEquals("/data/frontier/1/frontier.osrm", shards.get("frontier").getArtifact());
        assertTrue(shards.get("frontier").getServing());
        assertEquals("STALE", shards.get("stale").getReadiness());
        assertEquals("http://west:5000", shards.get("west").getEndpoint());
        assertEquals("West", shards.get("west").getName());
        // Catalog order.
        assertEquals("west", r.getShards(0).getShardID());
    }

    @Test
    public void testRouterServer() throws InterruptedException {
        logger.info("testRouterServer");
        FakeEngineClient serverEngine = new FakeEngineClient();
        ShardRegistry registry = new ShardRegistry(ShardCatalog.fromResource("/test-catalog.json"));
        RouterServer routerServer = new RouterServer(registry, serverEngine, new RouterConfig(), null, 8733);
        assertEquals(0, routerServer.startServing());
        ManagedChannel networkChannel = ManagedChannelBuilder.forAddress("127.0.0.1", 8733).usePlaintext().build();
        ClientRouterGrpc.ClientRouterBlockingStub networkStub = ClientRouterGrpc.newBlockingStub(networkChannel);
        assertEquals(CoordinateRouter.QUERY_SUCCESS, networkStub.route(query(5, 5, 15, 5)).getReturnCode());
        assertEquals(6, networkStub.shardStatus(ShardStatusMessage.newBuilder().build()).getShardsCount());
        networkChannel.shutdownNow();
        networkChannel.awaitTermination(5, TimeUnit.SECONDS);
        routerServer.stopServing();
        routerServer.stopServing();
        assertTrue(serverEngine.shutDown);
    }
}
