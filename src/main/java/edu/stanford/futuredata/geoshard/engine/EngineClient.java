package edu.stanford.futuredata.geoshard.engine;

/**
 * A routing engine reached over the network.  The engine is a black box: it takes ordered coordinates and
 * returns a path or a routing-semantic error.
 *
 * Implementations throw BackendErrorException for engine-reported errors, BackendTimeoutException when the
 * deadline passes, BackendUnavailableException when the engine cannot be reached and QueryCancelledException
 * once the context is cancelled.
 */
public interface EngineClient {

    RouteResponse route(String endpoint, RouteRequest request, QueryContext context);

    default void shutdown() {}
}
