package edu.stanford.futuredata.geoshard.errors;

/**
 * A network call to an engine or batch backend did not complete.  Transient: the router retries these once.
 */
public class BackendUnavailableException extends GeoShardException {

    private final String backend;

    public BackendUnavailableException(String backend, Throwable cause) {
        this(ReasonCode.BACKEND_UNAVAILABLE, backend, cause);
    }

    protected BackendUnavailableException(ReasonCode reason, String backend, Throwable cause) {
        super(reason, String.format("Backend %s: %s", backend, cause == null ? reason : cause.getMessage()), cause);
        this.backend = backend;
    }

    public String getBackend() {
        return backend;
    }
}
