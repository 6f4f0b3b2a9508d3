package edu.stanford.futuredata.geoshard.errors;

/**
 * The engine answered with a routing-semantic error (no route, malformed input).  Passed through verbatim and
 * never retried.
 */
public class BackendErrorException extends GeoShardException {

    private final String engineCode;
    private final String engineMessage;

    public BackendErrorException(String engineCode, String engineMessage) {
        super(ReasonCode.BACKEND_ERROR, String.format("%s: %s", engineCode, engineMessage));
        this.engineCode = engineCode;
        this.engineMessage = engineMessage;
    }

    public String getEngineCode() {
        return engineCode;
    }

    public String getEngineMessage() {
        return engineMessage;
    }
}
