package edu.stanford.futuredata.geoshard.engine;

import edu.stanford.futuredata.geoshard.utilities.Coordinate;

import java.util.ArrayList;
import java.util.List;

/**
 * A route as answered by an engine: overall geometry, distance (meters), duration (seconds), snapped waypoints
 * and one leg per consecutive waypoint pair.
 */
public final class RouteResponse {
    public final double distance;
    public final double duration;
    public final List<Coordinate> geometry;
    public final List<RouteLeg> legs;
    public final List<Coordinate> waypoints;

    public RouteResponse(double distance, double duration, List<Coordinate> geometry, List<RouteLeg> legs,
                         List<Coordinate> waypoints) {
        if (legs.isEmpty()) {
            throw new IllegalArgumentException("A route needs at least one leg");
        }
        this.distance = distance;
        this.duration = duration;
        this.geometry = List.copyOf(geometry);
        this.legs = List.copyOf(legs);
        this.waypoints = List.copyOf(waypoints);
    }

    public Coordinate start() {
        return legs.get(0).start();
    }

    public Coordinate end() {
        return legs.get(legs.size() - 1).end();
    }

    /**
     * Join this route, which ends at a gateway, to a route which starts there.  The gateway is not a waypoint
     * of the joined route, so the two legs touching it become one.
     */
    public RouteResponse concat(RouteResponse next, Coordinate gateway) {
        List<RouteLeg> joinedLegs = new ArrayList<>(legs.subList(0, legs.size() - 1));
        joinedLegs.add(legs.get(legs.size() - 1).join(next.legs.get(0), gateway));
        joinedLegs.addAll(next.legs.subList(1, next.legs.size()));
        List<Coordinate> joinedGeometry = new ArrayList<>(geometry);
        joinedGeometry.addAll(next.geometry);
        List<Coordinate> joinedWaypoints = new ArrayList<>(waypoints.subList(0, Math.max(0, waypoints.size() - 1)));
        joinedWaypoints.addAll(next.waypoints.subList(Math.min(1, next.waypoints.size()), next.waypoints.size()));
        return new RouteResponse(distance + next.distance, duration + next.duration, joinedGeometry, joinedLegs,
                joinedWaypoints);
    }
}
