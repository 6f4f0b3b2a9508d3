package edu.stanford.futuredata.geoshard.errors;

public class UnroutableCrossShardException extends GeoShardException {

    private final String fromShardID;
    private final String toShardID;

    public UnroutableCrossShardException(String fromShardID, String toShardID, String detail) {
        super(ReasonCode.UNROUTABLE_CROSS_SHARD,
                String.format("No gateway connects shard %s to shard %s: %s", fromShardID, toShardID, detail));
        this.fromShardID = fromShardID;
        this.toShardID = toShardID;
    }

    public String getFromShardID() {
        return fromShardID;
    }

    public String getToShardID() {
        return toShardID;
    }
}
