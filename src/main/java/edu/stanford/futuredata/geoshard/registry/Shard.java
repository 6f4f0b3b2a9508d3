package edu.stanford.futuredata.geoshard.registry;

import edu.stanford.futuredata.geoshard.utilities.BoundingBox;

import java.util.Objects;

/**
 * One geographic partition and the engine instance serving it.  Immutable; the registry replaces a shard's
 * snapshot when its readiness changes.
 */
public final class Shard {
    public final String id;
    public final String name;
    public final BoundingBox bbox;
    public final String endpoint;
    public final ReadinessState readiness;
    // Location of the routable graph currently served, or null if none.
    public final String artifact;
    // OSM extract the pipeline builds from, or null for the default slice location.
    public final String source;
    // Incremented on every promotion.
    public final long generation;

    public Shard(String id, String name, BoundingBox bbox, String endpoint, ReadinessState readiness,
                 String artifact, String source, long generation) {
        this.id = Objects.requireNonNull(id);
        this.name = name == null ? id : name;
        this.bbox = Objects.requireNonNull(bbox);
        this.endpoint = Objects.requireNonNull(endpoint);
        this.readiness = Objects.requireNonNull(readiness);
        this.artifact = artifact;
        this.source = source;
        this.generation = generation;
    }

    public boolean isServing() {
        return readiness.isServing();
    }

    Shard withReadiness(ReadinessState newReadiness, String newArtifact, long newGeneration) {
        return new Shard(id, name, bbox, endpoint, newReadiness, newArtifact, source, newGeneration);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Shard)) {
            return false;
        }
        Shard s = (Shard) o;
        return id.equals(s.id) && generation == s.generation && readiness == s.readiness;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, generation, readiness);
    }

    @Override
    public String toString() {
        return String.format("Shard[%s %s %s]", id, readiness, bbox);
    }
}
