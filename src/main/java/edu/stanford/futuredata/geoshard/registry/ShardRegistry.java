package edu.stanford.futuredata.geoshard.registry;

import edu.stanford.futuredata.geoshard.errors.NoShardCoverageException;
import edu.stanford.futuredata.geoshard.utilities.Coordinate;
import edu.stanford.futuredata.geoshard.utilities.ZKShardDescription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Catalog of shards, loaded once at startup.  Read-mostly: the only mutation replaces one shard's snapshot
 * when a pipeline for it completes.
 */
public class ShardRegistry {
    private static final Logger logger = LoggerFactory.getLogger(ShardRegistry.class);

    public final long catalogVersion;
    // Catalog order, used to make lookups deterministic.
    private final List<String> shardIDs;
    private final Map<String, Shard> shards = new ConcurrentHashMap<>();

    private volatile RegistryCurator zkCurator = null;
    // Publishes to ZooKeeper in the order changes were made, off the caller's thread.
    private ExecutorService zkPublisher = null;
    private ReadinessUpdateDaemon readinessUpdateDaemon = null;
    public boolean runReadinessUpdateDaemon = true;
    public static int readinessDaemonSleepDurationMillis = 1000;

    public ShardRegistry(ShardCatalog catalog) {
        this.catalogVersion = catalog.version;
        List<String> ids = new ArrayList<>();
        for (Shard s : catalog.shards) {
            shards.put(s.id, s);
            ids.add(s.id);
        }
        this.shardIDs = Collections.unmodifiableList(ids);
    }

    /**
     * Every shard whose bounding box contains the point, in catalog order.
     * @throws NoShardCoverageException if no shard covers the point
     */
    public Set<Shard> lookup(Coordinate c) {
        Set<Shard> found = new LinkedHashSet<>();
        for (String id : shardIDs) {
            Shard s = shards.get(id);
            if (s.bbox.contains(c)) {
                found.add(s);
            }
        }
        if (found.isEmpty()) {
            throw new NoShardCoverageException(c);
        }
        return found;
    }

    public Optional<Shard> getShard(String shardID) {
        return Optional.ofNullable(shards.get(shardID));
    }

    public Shard requireShard(String shardID) {
        Shard s = shards.get(shardID);
        if (s == null) {
            throw new IllegalArgumentException("Unknown shard " + shardID);
        }
        return s;
    }

    public List<Shard> getShards() {
        List<Shard> l = new ArrayList<>();
        for (String id : shardIDs) {
            l.add(shards.get(id));
        }
        return l;
    }

    /** Atomically make the shard READY on a newly built artifact. */
    public Shard promote(String shardID, String artifact) {
        Shard promoted = shards.computeIfPresent(shardID,
                (k, s) -> s.withReadiness(ReadinessState.READY, artifact, s.generation + 1));
        if (promoted == null) {
            throw new IllegalArgumentException("Unknown shard " + shardID);
        }
        logger.info("Shard {} READY on {} (generation {})", shardID, artifact, promoted.generation);
        publish(promoted);
        return promoted;
    }

    /**
     * Record a failed build.  Only a shard with nothing to serve becomes FAILED; a shard with an artifact keeps
     * serving it unchanged.
     */
    public Shard recordBuildFailure(String shardID) {
        Shard updated = shards.computeIfPresent(shardID,
                (k, s) -> s.artifact == null ? s.withReadiness(ReadinessState.FAILED, null, s.generation) : s);
        if (updated == null) {
            throw new IllegalArgumentException("Unknown shard " + shardID);
        }
        if (updated.readiness == ReadinessState.FAILED) {
            logger.warn("Shard {} FAILED before its first build", shardID);
            publish(updated);
        }
        return updated;
    }

    /**
     * Sample the globe on a grid and return points no shard covers.  Used to check the catalog's coverage at
     * startup; land masks are not modeled, so ocean points are reported too.
     */
    public List<Coordinate> uncoveredPoints(double stepDegrees) {
        List<Coordinate> uncovered = new ArrayList<>();
        for (double lat = -90.0; lat <= 90.0; lat += stepDegrees) {
            for (double lon = -180.0; lon <= 180.0; lon += stepDegrees) {
                Coordinate c = new Coordinate(lon, lat);
                if (shards.values().stream().noneMatch(s -> s.bbox.contains(c))) {
                    uncovered.add(c);
                }
            }
        }
        return uncovered;
    }

    /**
     * Mirror readiness changes to ZooKeeper.  Readiness already published there is applied first, so a later
     * promotion starts from the newest generation.  With watch set, ZooKeeper is also polled for changes made
     * elsewhere.
     */
    public synchronized void attachCurator(RegistryCurator zkCurator, boolean watch) {
        this.zkCurator = zkCurator;
        this.zkPublisher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "readiness-publisher");
            t.setDaemon(true);
            return t;
        });
        updateReadiness();
        if (watch) {
            readinessUpdateDaemon = new ReadinessUpdateDaemon();
            readinessUpdateDaemon.start();
        }
    }

    public synchronized void shutdown() {
        runReadinessUpdateDaemon = false;
        if (zkPublisher != null) {
            zkPublisher.shutdown();
            try {
                if (!zkPublisher.awaitTermination(10, TimeUnit.SECONDS)) {
                    logger.warn("Readiness not yet published to ZooKeeper at shutdown");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (readinessUpdateDaemon != null) {
            try {
                readinessUpdateDaemon.interrupt();
                readinessUpdateDaemon.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private synchronized void publish(Shard s) {
        RegistryCurator c = zkCurator;
        if (c == null) {
            return;
        }
        ZKShardDescription d = new ZKShardDescription(s.readiness.name(), s.artifact, s.generation);
        try {
            zkPublisher.execute(() -> c.setShardDescription(s.id, d));
        } catch (RejectedExecutionException e) {
            logger.warn("Registry shut down, shard {} generation {} not published", s.id, s.generation);
        }
    }

    private void updateReadiness() {
        for (String id : shardIDs) {
            zkCurator.getShardDescription(id).ifPresent(d -> applyDescription(id, d));
        }
    }

    // Apply a readiness published by another process if it is newer than ours.  ZooKeeper holds the latest
    // publication, so at an equal generation it wins.
    void applyDescription(String shardID, ZKShardDescription d) {
        ReadinessState readiness = ReadinessState.valueOf(d.readiness);
        String artifact = d.artifact.isEmpty() ? null : d.artifact;
        shards.computeIfPresent(shardID, (k, s) -> {
            boolean changed = readiness != s.readiness || !Objects.equals(artifact, s.artifact);
            if (d.versionNumber > s.generation || (d.versionNumber == s.generation && changed)) {
                logger.info("Shard {} {} -> {} on {} (generation {})", shardID, s.readiness, readiness, artifact,
                        d.versionNumber);
                return s.withReadiness(readiness, artifact, d.versionNumber);
            }
            return s;
        });
    }

    private class ReadinessUpdateDaemon extends Thread {

        ReadinessUpdateDaemon() {
            super("readiness-update-daemon");
            setDaemon(true);
        }

        @Override
        public void run() {
            while (runReadinessUpdateDaemon) {
                updateReadiness();
                try {
                    Thread.sleep(readinessDaemonSleepDurationMillis);
                } catch (InterruptedException e) {
                    break;
                }
            }
        }
    }
}
