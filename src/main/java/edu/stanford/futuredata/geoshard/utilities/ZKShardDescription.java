package edu.stanford.futuredata.geoshard.utilities;

/**
 * Readiness of one shard as mirrored in ZooKeeper.  Serialized as newline-separated fields.
 */
public class ZKShardDescription {
    public final String readiness;
    public final String artifact;
    public final long versionNumber;
    public final String stringSummary;

    public ZKShardDescription(String readiness, String artifact, long versionNumber) {
        this.readiness = readiness;
        this.artifact = artifact == null ? "" : artifact;
        this.versionNumber = versionNumber;
        stringSummary = String.format("%s\n%s\n%d\n", readiness, this.artifact, versionNumber);
    }

    public ZKShardDescription(String stringSummary) {
        this.stringSummary = stringSummary;
        String[] rav = stringSummary.split("\n", -1);
        if (rav.length < 3) {
            throw new IllegalArgumentException("Malformed shard description: " + stringSummary);
        }
        readiness = rav[0];
        artifact = rav[1];
        versionNumber = Long.parseLong(rav[2]);
    }
}
