package edu.stanford.futuredata.geoshard.errors;

import edu.stanford.futuredata.geoshard.utilities.Coordinate;

import java.util.Set;

/** A waypoint is covered only by shards that have no serving artifact yet. */
public class ShardUnavailableException extends GeoShardException {

    private final int waypointIndex;
    private final Set<String> shardIDs;

    public ShardUnavailableException(int waypointIndex, Coordinate waypoint, Set<String> shardIDs) {
        super(ReasonCode.SHARD_UNAVAILABLE,
                String.format("Waypoint %d %s is covered only by shards not serving: %s", waypointIndex, waypoint, shardIDs));
        this.waypointIndex = waypointIndex;
        this.shardIDs = Set.copyOf(shardIDs);
    }

    public int getWaypointIndex() {
        return waypointIndex;
    }

    public Set<String> getShardIDs() {
        return shardIDs;
    }
}
