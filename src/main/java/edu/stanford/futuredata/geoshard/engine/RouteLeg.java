package edu.stanford.futuredata.geoshard.engine;

import edu.stanford.futuredata.geoshard.utilities.Coordinate;

import java.util.ArrayList;
import java.util.List;

/**
 * The part of a route between two consecutive waypoints.
 */
public final class RouteLeg {
    public final double distance;
    public final double duration;
    public final List<RouteStep> steps;
    public final List<Coordinate> geometry;

    public RouteLeg(double distance, double duration, List<RouteStep> steps, List<Coordinate> geometry) {
        if (geometry.isEmpty()) {
            throw new IllegalArgumentException("A leg needs geometry");
        }
        this.distance = distance;
        this.duration = duration;
        this.steps = List.copyOf(steps);
        this.geometry = List.copyOf(geometry);
    }

    public Coordinate start() {
        return geometry.get(0);
    }

    public Coordinate end() {
        return geometry.get(geometry.size() - 1);
    }

    /**
     * Join this leg, which ends at a gateway, with a leg that starts at the same gateway on the far side of a
     * shard boundary.  The arrival at the gateway and the departure from it are replaced by a single
     * boundary-crossing step.
     */
    public RouteLeg join(RouteLeg next, Coordinate gateway) {
        List<RouteStep> mergedSteps = new ArrayList<>(steps);
        if (!mergedSteps.isEmpty() && mergedSteps.get(mergedSteps.size() - 1).type.equals(RouteStep.ARRIVE)) {
            mergedSteps.remove(mergedSteps.size() - 1);
        }
        mergedSteps.add(RouteStep.boundaryCrossing(gateway));
        List<RouteStep> nextSteps = next.steps;
        if (!nextSteps.isEmpty() && nextSteps.get(0).type.equals(RouteStep.DEPART)) {
            nextSteps = nextSteps.subList(1, nextSteps.size());
        }
        mergedSteps.addAll(nextSteps);
        List<Coordinate> mergedGeometry = new ArrayList<>(geometry);
        mergedGeometry.addAll(next.geometry);
        return new RouteLeg(distance + next.distance, duration + next.duration, mergedSteps, mergedGeometry);
    }
}
