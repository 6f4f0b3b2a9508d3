package edu.stanford.futuredata.geoshard.engine;

import edu.stanford.futuredata.geoshard.errors.QueryCancelledException;
import edu.stanford.futuredata.geoshard.utilities.Coordinate;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class RouteResponseTests {

    private static final Logger logger = LoggerFactory.getLogger(RouteResponseTests.class);

    private static RouteResponse straight(Coordinate... points) {
        List<RouteLeg> legs = new ArrayList<>();
        double distance = 0;
        for (int i = 0; i + 1 < points.length; i++) {
            double d = points[i].distanceMeters(points[i + 1]);
            legs.add(new RouteLeg(d, d / 5, List.of(
                    new RouteStep(RouteStep.DEPART, "", "Leg " + i, null, points[i], d, d / 5),
                    new RouteStep(RouteStep.ARRIVE, "", "Leg " + i, null, points[i + 1], 0, 0)),
                    List.of(points[i], points[i + 1])));
            distance += d;
        }
        return new RouteResponse(distance, distance / 5, List.of(points), legs, List.of(points));
    }

    @Test
    public void testRequestValidation() {
        logger.info("testRequestValidation");
        Coordinate a = new Coordinate(1, 1);
        assertThrows(IllegalArgumentException.class, () -> new RouteRequest(List.of(a)));
        RouteRequest r = new RouteRequest("r1", List.of(a, new Coordinate(2, 2)), "");
        assertEquals(RouteRequest.DEFAULT_PROFILE, r.getProfile());
        RouteRequest sub = r.withWaypoints(List.of(new Coordinate(3, 3), a));
        assertEquals("r1", sub.getRequestID());
        assertEquals(new Coordinate(3, 3), sub.getWaypoint(0));
        assertEquals(2, sub.size());
    }

    @Test
    public void testConcatAtGateway() {
        logger.info("testConcatAtGateway");
        Coordinate p = new Coordinate(5, 5);
        Coordinate g = new Coordinate(10, 5);
        Coordinate q = new Coordinate(15, 5);
        Coordinate r = new Coordinate(15, 8);
        RouteResponse first = straight(p, g);
        RouteResponse second = straight(g, q, r);
        RouteResponse joined = first.concat(second, g);

        // The gateway is not a waypoint, so its two legs become one.
        assertEquals(List.of(p, q, r), joined.waypoints);
        assertEquals(2, joined.legs.size());
        assertEquals(first.distance + second.distance, joined.distance, 1e-6);
        assertEquals(first.duration + second.duration, joined.duration, 1e-6);
        assertEquals(joined.duration, joined.legs.stream().mapToDouble(l -> l.duration).sum(), 1e-6);
        assertEquals(p, joined.start());
        assertEquals(r, joined.end());

        List<RouteStep> steps = joined.legs.get(0).steps;
        assertEquals(3, steps.size());
        assertEquals(RouteStep.DEPART, steps.get(0).type);
        assertEquals(RouteStep.BOUNDARY_INSTRUCTION, steps.get(1).instruction);
        assertEquals(g, steps.get(1).location);
        assertEquals(0.0, steps.get(1).duration);
        assertEquals(RouteStep.ARRIVE, steps.get(2).type);
        assertEquals(List.of(p, g, g, q), joined.legs.get(0).geometry);
    }

    @Test
    public void testInstructions() {
        logger.info("testInstructions");
        assertEquals("Head out onto Main Street", RouteStep.describe("depart", "", "Main Street"));
        assertEquals("Turn left onto 3rd Avenue", RouteStep.describe("turn", "left", "3rd Avenue"));
        assertEquals("Arrive at destination", RouteStep.describe("arrive", "", "3rd Avenue"));
        assertEquals("Roundabout", RouteStep.describe("roundabout", "", ""));
        assertEquals("Continue", new RouteStep(null, null, null, null, new Coordinate(0, 0), 0, 0).instruction);
        assertEquals("Keep right", new RouteStep("keep", "right", "", null, null, 0, 0).instruction);
    }

    @Test
    public void testQueryContext() {
        logger.info("testQueryContext");
        QueryContext context = new QueryContext("q1");
        AtomicInteger hooks = new AtomicInteger(0);
        context.onCancel(hooks::incrementAndGet);
        context.checkCancelled();
        context.cancel();
        context.cancel();
        assertEquals(1, hooks.get());
        assertTrue(context.isCancelled());
        assertThrows(QueryCancelledException.class, context::checkCancelled);
        // Registered after cancellation: runs at once.
        context.onCancel(hooks::incrementAndGet);
        assertEquals(2, hooks.get());
        assertFalse(new QueryContext("q2").isCancelled());
    }
}
