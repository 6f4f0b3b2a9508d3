package edu.stanford.futuredata.geoshard.errors;

public class QueryCancelledException extends GeoShardException {

    public QueryCancelledException(String requestID) {
        super(ReasonCode.CANCELLED, String.format("Query %s cancelled", requestID));
    }
}
