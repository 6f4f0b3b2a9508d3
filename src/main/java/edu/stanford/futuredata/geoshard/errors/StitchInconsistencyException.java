package edu.stanford.futuredata.geoshard.errors;

/** Partial routes returned by adjacent shards do not meet at their shared gateway. */
public class StitchInconsistencyException extends GeoShardException {

    public StitchInconsistencyException(String message) {
        super(ReasonCode.STITCH_INCONSISTENT, message);
    }
}
