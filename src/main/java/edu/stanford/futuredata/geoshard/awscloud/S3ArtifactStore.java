package edu.stanford.futuredata.geoshard.awscloud;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.SdkClientException;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.AmazonS3ClientBuilder;
import com.amazonaws.services.s3.model.ListObjectsV2Result;
import edu.stanford.futuredata.geoshard.errors.BackendUnavailableException;
import edu.stanford.futuredata.geoshard.pipeline.ArtifactStore;
import org.javatuples.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks pipeline outputs in S3.  OSRM writes a graph as several files sharing the base name, so an artifact
 * exists if any object starts with its key.
 */
public class S3ArtifactStore implements ArtifactStore {
    private static final Logger logger = LoggerFactory.getLogger(S3ArtifactStore.class);

    private final AmazonS3 s3;

    public S3ArtifactStore(String region) {
        this(AmazonS3ClientBuilder.standard().withRegion(region).build());
    }

    public S3ArtifactStore(AmazonS3 s3) {
        this.s3 = s3;
    }

    @Override
    public boolean exists(String location) {
        Pair<String, String> bucketKey = parseLocation(location);
        try {
            ListObjectsV2Result result = s3.listObjectsV2(bucketKey.getValue0(), bucketKey.getValue1());
            logger.debug("{} objects under {}", result.getKeyCount(), location);
            return result.getKeyCount() > 0;
        } catch (AmazonServiceException e) {
            logger.warn("Listing {} failed: {}", location, e.getMessage());
            return false;
        } catch (SdkClientException e) {
            throw new BackendUnavailableException("s3", e);
        }
    }

    /** Split s3://bucket/key into bucket and key. */
    static Pair<String, String> parseLocation(String location) {
        if (!location.startsWith("s3://")) {
            throw new IllegalArgumentException("Not an S3 location: " + location);
        }
        String path = location.substring("s3://".length());
        int slash = path.indexOf('/');
        if (slash <= 0 || slash == path.length() - 1) {
            throw new IllegalArgumentException("S3 location without bucket or key: " + location);
        }
        return new Pair<>(path.substring(0, slash), path.substring(slash + 1));
    }
}
