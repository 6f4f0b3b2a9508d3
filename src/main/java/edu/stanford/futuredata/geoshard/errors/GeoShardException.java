package edu.stanford.futuredata.geoshard.errors;

public class GeoShardException extends RuntimeException {

    private final ReasonCode reason;

    public GeoShardException(ReasonCode reason, String message) {
        super(message);
        this.reason = reason;
    }

    public GeoShardException(ReasonCode reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public ReasonCode getReason() {
        return reason;
    }
}
