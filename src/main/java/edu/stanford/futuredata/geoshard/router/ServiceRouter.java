package edu.stanford.futuredata.geoshard.router;

import edu.stanford.futuredata.geoshard.*;
import edu.stanford.futuredata.geoshard.engine.QueryContext;
import edu.stanford.futuredata.geoshard.engine.RouteLeg;
import edu.stanford.futuredata.geoshard.engine.RouteRequest;
import edu.stanford.futuredata.geoshard.engine.RouteResponse;
import edu.stanford.futuredata.geoshard.engine.RouteStep;
import edu.stanford.futuredata.geoshard.errors.GeoShardException;
import edu.stanford.futuredata.geoshard.errors.NoShardCoverageException;
import edu.stanford.futuredata.geoshard.errors.ReasonCode;
import edu.stanford.futuredata.geoshard.errors.ShardUnavailableException;
import edu.stanford.futuredata.geoshard.errors.UnroutableCrossShardException;
import edu.stanford.futuredata.geoshard.registry.Shard;
import edu.stanford.futuredata.geoshard.utilities.Coordinate;
import io.grpc.Context;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

class ServiceRouter extends ClientRouterGrpc.ClientRouterImplBase {

    private static final Logger logger = LoggerFactory.getLogger(ServiceRouter.class);

    private final CoordinateRouter router;

    ServiceRouter(CoordinateRouter router) {
        this.router = router;
    }

    @Override
    public void route(RouteQueryMessage request, StreamObserver<RouteQueryResponse> responseObserver) {
        responseObserver.onNext(routeHandler(request));
        responseObserver.onCompleted();
    }

    private RouteQueryResponse routeHandler(RouteQueryMessage m) {
        String requestID = m.getRequestID().isEmpty() ? UUID.randomUUID().toString() : m.getRequestID();
        RouteRequest request;
        try {
            List<Coordinate> waypoints = new ArrayList<>();
            for (CoordinateMessage c : m.getWaypointsList()) {
                waypoints.add(new Coordinate(c.getLon(), c.getLat()));
            }
            request = new RouteRequest(requestID, waypoints, m.getProfile());
        } catch (IllegalArgumentException e) {
            return RouteQueryResponse.newBuilder().setReturnCode(CoordinateRouter.QUERY_FAILURE)
                    .setReason(ReasonCode.INVALID_REQUEST.name()).setErrorMessage(e.getMessage()).build();
        }
        // A client disconnect cancels the gRPC context, which aborts this query's outstanding engine calls.
        QueryContext queryContext = new QueryContext(requestID);
        Context grpcContext = Context.current();
        Context.CancellationListener listener = c -> queryContext.cancel();
        grpcContext.addListener(listener, Runnable::run);
        try {
            return toMessage(router.route(request, queryContext));
        } catch (GeoShardException e) {
            if (e.getReason().clientFacing) {
                logger.info("Query {} failed: {}", requestID, e.getMessage());
            } else {
                logger.warn("Query {} failed: {}", requestID, e.getMessage());
            }
            return failureMessage(e);
        } catch (RuntimeException e) {
            logger.error("Query {} failed unexpectedly", requestID, e);
            return RouteQueryResponse.newBuilder().setReturnCode(CoordinateRouter.SERVER_FAILURE)
                    .setReason(ReasonCode.INTERNAL_ERROR.name())
                    .setErrorMessage(String.valueOf(e.getMessage())).build();
        } finally {
            grpcContext.removeListener(listener);
        }
    }

    @Override
    public void shardStatus(ShardStatusMessage request, StreamObserver<ShardStatusResponse> responseObserver) {
        responseObserver.onNext(shardStatusHandler(request));
        responseObserver.onCompleted();
    }

    private ShardStatusResponse shardStatusHandler(ShardStatusMessage m) {
        ShardStatusResponse.Builder b = ShardStatusResponse.newBuilder()
                .setReturnCode(CoordinateRouter.QUERY_SUCCESS)
                .setCatalogVersion(router.getRegistry().catalogVersion);
        for (Shard s : router.getRegistry().getShards()) {
            b.addShards(ShardHealthMessage.newBuilder()
                    .setShardID(s.id)
                    .setName(s.name)
                    .setEndpoint(s.endpoint)
                    .setReadiness(s.readiness.name())
                    .setArtifact(s.artifact == null ? "" : s.artifact)
                    .setServing(s.isServing()));
        }
        return b.build();
    }

    static RouteQueryResponse failureMessage(GeoShardException e) {
        RouteQueryResponse.Builder b = RouteQueryResponse.newBuilder()
                .setReturnCode(e.getReason().clientFacing ? CoordinateRouter.QUERY_FAILURE : CoordinateRouter.SERVER_FAILURE)
                .setReason(e.getReason().name())
                .setErrorMessage(e.getMessage());
        if (e instanceof NoShardCoverageException) {
            b.setWaypointIndex(((NoShardCoverageException) e).getWaypointIndex());
        } else if (e instanceof ShardUnavailableException) {
            ShardUnavailableException u = (ShardUnavailableException) e;
            b.setWaypointIndex(u.getWaypointIndex()).addAllShardIDs(u.getShardIDs());
        } else if (e instanceof UnroutableCrossShardException) {
            UnroutableCrossShardException u = (UnroutableCrossShardException) e;
            b.addShardIDs(u.getFromShardID()).addShardIDs(u.getToShardID());
        }
        return b.build();
    }

    static RouteQueryResponse toMessage(RouteResponse r) {
        RouteQueryResponse.Builder b = RouteQueryResponse.newBuilder()
                .setReturnCode(CoordinateRouter.QUERY_SUCCESS)
                .setDistance(r.distance)
                .setDuration(r.duration);
        r.geometry.forEach(c -> b.addGeometry(toMessage(c)));
        r.waypoints.forEach(c -> b.addWaypoints(toMessage(c)));
        for (RouteLeg leg : r.legs) {
            LegMessage.Builder lb = LegMessage.newBuilder().setDistance(leg.distance).setDuration(leg.duration);
            leg.geometry.forEach(c -> lb.addGeometry(toMessage(c)));
            for (RouteStep step : leg.steps) {
                StepMessage.Builder sb = StepMessage.newBuilder()
                        .setType(step.type)
                        .setModifier(step.modifier)
                        .setName(step.name)
                        .setInstruction(step.instruction)
                        .setDistance(step.distance)
                        .setDuration(step.duration);
                if (step.location != null) {
                    sb.setLocation(toMessage(step.location));
                }
                lb.addSteps(sb);
            }
            b.addLegs(lb);
        }
        return b.build();
    }

    private static CoordinateMessage toMessage(Coordinate c) {
        return CoordinateMessage.newBuilder().setLon(c.lon).setLat(c.lat).build();
    }
}
