package edu.stanford.futuredata.geoshard.engine;

import edu.stanford.futuredata.geoshard.utilities.Coordinate;

import java.util.List;
import java.util.UUID;

/**
 * An ordered list of at least two waypoints.  Immutable.
 */
public final class RouteRequest {

    public static final String DEFAULT_PROFILE = "cycling";

    private final String requestID;
    private final List<Coordinate> waypoints;
    private final String profile;

    public RouteRequest(List<Coordinate> waypoints) {
        this(UUID.randomUUID().toString(), waypoints, DEFAULT_PROFILE);
    }

    public RouteRequest(String requestID, List<Coordinate> waypoints, String profile) {
        if (waypoints == null || waypoints.size() < 2) {
            throw new IllegalArgumentException("A route needs at least two waypoints");
        }
        this.requestID = requestID;
        this.waypoints = List.copyOf(waypoints);
        this.profile = profile == null || profile.isEmpty() ? DEFAULT_PROFILE : profile;
    }

    /** A sub-request over other waypoints, sharing this request's identity and options. */
    public RouteRequest withWaypoints(List<Coordinate> subWaypoints) {
        return new RouteRequest(requestID, subWaypoints, profile);
    }

    public String getRequestID() {
        return requestID;
    }

    public List<Coordinate> getWaypoints() {
        return waypoints;
    }

    public Coordinate getWaypoint(int i) {
        return waypoints.get(i);
    }

    public int size() {
        return waypoints.size();
    }

    public String getProfile() {
        return profile;
    }

    @Override
    public String toString() {
        return String.format("RouteRequest[%s %s]", requestID, waypoints);
    }
}
