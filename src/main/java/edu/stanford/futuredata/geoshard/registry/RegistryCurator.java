package edu.stanford.futuredata.geoshard.registry;

import edu.stanford.futuredata.geoshard.utilities.ZKShardDescription;
import org.apache.curator.RetryPolicy;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.retry.ExponentialBackoffRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Mirrors shard readiness in ZooKeeper so router processes observe promotions made by pipeline processes.
 */
public class RegistryCurator {
    private static final Logger logger = LoggerFactory.getLogger(RegistryCurator.class);

    static final String SHARDS_PATH = "/geoshard/shards";

    private final CuratorFramework cf;

    public RegistryCurator(String zkHost, int zkPort) {
        this(String.format("%s:%d", zkHost, zkPort));
    }

    public RegistryCurator(String connectString) {
        RetryPolicy retryPolicy = new ExponentialBackoffRetry(1000, 3);
        this.cf = CuratorFrameworkFactory.newClient(connectString, retryPolicy);
        cf.start();
    }

    public void close() {
        cf.close();
    }

    boolean setShardDescription(String shardID, ZKShardDescription description) {
        try {
            String path = String.format("%s/%s", SHARDS_PATH, shardID);
            byte[] data = description.stringSummary.getBytes(StandardCharsets.UTF_8);
            if (cf.checkExists().forPath(path) != null) {
                cf.setData().forPath(path, data);
            } else {
                cf.create().creatingParentsIfNeeded().forPath(path, data);
            }
            return true;
        } catch (Exception e) {
            logger.error("ZK Failure publishing shard {}: {}", shardID, e.getMessage());
            return false;
        }
    }

    Optional<ZKShardDescription> getShardDescription(String shardID) {
        try {
            String path = String.format("%s/%s", SHARDS_PATH, shardID);
            if (cf.checkExists().forPath(path) == null) {
                return Optional.empty();
            }
            byte[] b = cf.getData().forPath(path);
            return Optional.of(new ZKShardDescription(new String(b, StandardCharsets.UTF_8)));
        } catch (Exception e) {
            logger.error("ZK Failure reading shard {}: {}", shardID, e.getMessage());
            return Optional.empty();
        }
    }
}
