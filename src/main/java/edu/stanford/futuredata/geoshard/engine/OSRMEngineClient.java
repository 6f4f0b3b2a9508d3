package edu.stanford.futuredata.geoshard.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.stanford.futuredata.geoshard.errors.BackendErrorException;
import edu.stanford.futuredata.geoshard.errors.BackendTimeoutException;
import edu.stanford.futuredata.geoshard.errors.BackendUnavailableException;
import edu.stanford.futuredata.geoshard.errors.QueryCancelledException;
import edu.stanford.futuredata.geoshard.utilities.Coordinate;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Client for the OSRM HTTP route service of one shard's osrm-routed instance.
 */
public class OSRMEngineClient implements EngineClient {

    private static final Logger logger = LoggerFactory.getLogger(OSRMEngineClient.class);

    public static final long DEFAULT_TIMEOUT = 5000;

    private final OkHttpClient downloader;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OSRMEngineClient() {
        this(DEFAULT_TIMEOUT);
    }

    public OSRMEngineClient(long timeoutMillis) {
        downloader = new OkHttpClient.Builder().
                connectTimeout(timeoutMillis, TimeUnit.MILLISECONDS).
                readTimeout(timeoutMillis, TimeUnit.MILLISECONDS).
                callTimeout(timeoutMillis, TimeUnit.MILLISECONDS).
                build();
    }

    @Override
    public RouteResponse route(String endpoint, RouteRequest request, QueryContext context) {
        context.checkCancelled();
        HttpUrl url = routeUrl(endpoint, request);
        Call call = downloader.newCall(new Request.Builder().url(url).get().build());
        context.onCancel(call::cancel);
        try (Response response = call.execute()) {
            ResponseBody body = response.body();
            if (body == null) {
                throw new BackendUnavailableException(endpoint, new IOException("Empty response, HTTP " + response.code()));
            }
            JsonNode json;
            try {
                json = objectMapper.readTree(body.byteStream());
            } catch (JsonProcessingException e) {
                if (response.code() >= 500) {
                    throw new BackendUnavailableException(endpoint, e);
                }
                throw new BackendErrorException("InvalidResponse", e.getOriginalMessage());
            }
            return parseRoute(json);
        } catch (InterruptedIOException e) {
            if (context.isCancelled()) {
                throw new QueryCancelledException(request.getRequestID());
            }
            logger.warn("Engine {} timed out for {}", endpoint, request.getRequestID());
            throw new BackendTimeoutException(endpoint, e);
        } catch (IOException e) {
            if (context.isCancelled()) {
                throw new QueryCancelledException(request.getRequestID());
            }
            logger.warn("Engine {} unreachable for {}: {}", endpoint, request.getRequestID(), e.getMessage());
            throw new BackendUnavailableException(endpoint, e);
        }
    }

    @Override
    public void shutdown() {
        downloader.dispatcher().executorService().shutdown();
        downloader.connectionPool().evictAll();
    }

    static HttpUrl routeUrl(String endpoint, RouteRequest request) {
        String base = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        String coordinates = request.getWaypoints().stream()
                .map(c -> c.lon + "," + c.lat)
                .collect(Collectors.joining(";"));
        HttpUrl url = HttpUrl.parse(base + "/route/v1/" + request.getProfile() + "/" + coordinates);
        if (url == null) {
            throw new IllegalArgumentException("Invalid engine endpoint " + endpoint);
        }
        return url.newBuilder()
                .addQueryParameter("steps", "true")
                .addQueryParameter("geometries", "geojson")
                .addQueryParameter("overview", "full")
                .build();
    }

    /** Decode an OSRM route service answer, raising the engine's own error code if it reports one. */
    static RouteResponse parseRoute(JsonNode json) {
        String code = json.path("code").asText("");
        if (!code.equals("Ok")) {
            throw new BackendErrorException(code.isEmpty() ? "InvalidResponse" : code, json.path("message").asText(""));
        }
        JsonNode routes = json.path("routes");
        if (!routes.isArray() || routes.size() == 0) {
            throw new BackendErrorException("NoRoute", "Engine returned no routes");
        }
        JsonNode route = routes.get(0);
        List<RouteLeg> legs = new ArrayList<>();
        for (JsonNode leg : route.path("legs")) {
            List<RouteStep> steps = new ArrayList<>();
            List<Coordinate> legGeometry = new ArrayList<>();
            for (JsonNode step : leg.path("steps")) {
                JsonNode maneuver = step.path("maneuver");
                steps.add(new RouteStep(maneuver.path("type").asText(), maneuver.path("modifier").asText(""),
                        step.path("name").asText(""), null, toCoordinate(maneuver.path("location")),
                        step.path("distance").asDouble(), step.path("duration").asDouble()));
                for (Coordinate c : toCoordinates(step.path("geometry").path("coordinates"))) {
                    if (legGeometry.isEmpty() || !legGeometry.get(legGeometry.size() - 1).equals(c)) {
                        legGeometry.add(c);
                    }
                }
            }
            if (legGeometry.isEmpty() && !steps.isEmpty()) {
                legGeometry.add(steps.get(0).location);
                legGeometry.add(steps.get(steps.size() - 1).location);
            }
            legs.add(new RouteLeg(leg.path("distance").asDouble(), leg.path("duration").asDouble(), steps, legGeometry));
        }
        List<Coordinate> waypoints = new ArrayList<>();
        for (JsonNode waypoint : json.path("waypoints")) {
            waypoints.add(toCoordinate(waypoint.path("location")));
        }
        return new RouteResponse(route.path("distance").asDouble(), route.path("duration").asDouble(),
                toCoordinates(route.path("geometry").path("coordinates")), legs, waypoints);
    }

    private static Coordinate toCoordinate(JsonNode lonLat) {
        return new Coordinate(lonLat.get(0).asDouble(), lonLat.get(1).asDouble());
    }

    private static List<Coordinate> toCoordinates(JsonNode array) {
        List<Coordinate> coordinates = new ArrayList<>();
        for (JsonNode lonLat : array) {
            coordinates.add(toCoordinate(lonLat));
        }
        return coordinates;
    }
}
