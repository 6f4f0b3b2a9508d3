package edu.stanford.futuredata.geoshard.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.stanford.futuredata.geoshard.utilities.BoundingBox;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The declarative, versioned list of shards consumed at startup.
 *
 * <pre>
 * {"version": 3,
 *  "shards": [{"id": "slice_a_north_america", "name": "North America", "bbox": "-170,15,-50,75",
 *              "endpoint": "http://127.0.0.1:5000", "readiness": "READY", "artifact": "s3://...",
 *              "source": "https://download.geofabrik.de/..."}]}
 * </pre>
 */
public class ShardCatalog {
    private static final Logger logger = LoggerFactory.getLogger(ShardCatalog.class);

    public static final String DEFAULT_RESOURCE = "/shard-catalog.json";

    public final long version;
    public final List<Shard> shards;

    public ShardCatalog(long version, List<Shard> shards) {
        Set<String> ids = new HashSet<>();
        for (Shard s : shards) {
            if (!ids.add(s.id)) {
                throw new IllegalArgumentException("Duplicate shard id " + s.id);
            }
        }
        this.version = version;
        this.shards = List.copyOf(shards);
    }

    public static ShardCatalog fromFile(File file) {
        try {
            return parse(FileUtils.readFileToString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read shard catalog " + file, e);
        }
    }

    public static ShardCatalog fromResource(String resource) {
        try (InputStream in = ShardCatalog.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("No shard catalog resource " + resource);
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read shard catalog " + resource, e);
        }
    }

    public static ShardCatalog parse(String json) throws IOException {
        JsonNode root = new ObjectMapper().readTree(json);
        long version = root.path("version").asLong(0);
        List<Shard> shards = new ArrayList<>();
        for (JsonNode node : root.path("shards")) {
            String id = required(node, "id");
            String artifact = optional(node, "artifact");
            ReadinessState readiness = node.has("readiness")
                    ? ReadinessState.valueOf(node.get("readiness").asText().toUpperCase())
                    : artifact == null ? ReadinessState.BUILDING : ReadinessState.READY;
            if (readiness.isServing() && artifact == null) {
                throw new IllegalArgumentException(String.format("Shard %s is %s but names no artifact", id, readiness));
            }
            shards.add(new Shard(id, optional(node, "name"), BoundingBox.parse(required(node, "bbox")),
                    required(node, "endpoint"), readiness, artifact, optional(node, "source"), 0));
        }
        if (shards.isEmpty()) {
            throw new IllegalArgumentException("Shard catalog lists no shards");
        }
        logger.info("Loaded shard catalog version {} with {} shards", version, shards.size());
        return new ShardCatalog(version, shards);
    }

    private static String required(JsonNode node, String field) {
        String value = optional(node, field);
        if (value == null) {
            throw new IllegalArgumentException("Shard catalog entry missing " + field + ": " + node);
        }
        return value;
    }

    private static String optional(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() || value.asText().isEmpty() ? null : value.asText();
    }
}
