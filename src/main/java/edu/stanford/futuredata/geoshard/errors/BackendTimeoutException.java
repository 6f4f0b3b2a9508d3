package edu.stanford.futuredata.geoshard.errors;

/** A backend call exceeded its deadline. */
public class BackendTimeoutException extends BackendUnavailableException {

    public BackendTimeoutException(String backend, Throwable cause) {
        super(ReasonCode.BACKEND_TIMEOUT, backend, cause);
    }
}
