package edu.stanford.futuredata.geoshard.errors;

import edu.stanford.futuredata.geoshard.utilities.Coordinate;

/** A waypoint lies outside every catalogued shard. */
public class NoShardCoverageException extends GeoShardException {

    private final int waypointIndex;

    public NoShardCoverageException(int waypointIndex, Coordinate waypoint) {
        super(ReasonCode.NO_SHARD_COVERAGE,
                String.format("Waypoint %d %s is not covered by any shard", waypointIndex, waypoint));
        this.waypointIndex = waypointIndex;
    }

    // Used when the offending point is not a request waypoint (catalog coverage checks).
    public NoShardCoverageException(Coordinate point) {
        super(ReasonCode.NO_SHARD_COVERAGE, String.format("Point %s is not covered by any shard", point));
        this.waypointIndex = -1;
    }

    public int getWaypointIndex() {
        return waypointIndex;
    }
}
