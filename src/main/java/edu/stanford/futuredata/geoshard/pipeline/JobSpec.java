package edu.stanford.futuredata.geoshard.pipeline;

import edu.stanford.futuredata.geoshard.errors.JobSubmissionException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Everything a job queue needs to run one preprocessing step.  Only {@link Builder#build()} creates these, and it
 * rejects incomplete or malformed specifications before they reach a queue.
 */
public final class JobSpec {
    public static final String OPERATION_VARIABLE = "OSRM_OPERATION";
    public static final String OSM_FILE_VARIABLE = "OSM_FILE";
    public static final String OSRM_FILE_VARIABLE = "OSRM_FILE";
    public static final String OSRM_FILE_BASE_VARIABLE = "OSRM_FILE_BASE";
    public static final String PROFILE_VARIABLE = "PROFILE";
    public static final String OUTPUT_DIR_VARIABLE = "OSRM_OUTPUT_DIR";

    // Batch job names: up to 128 letters, digits, hyphens and underscores.
    static final int MAX_JOB_NAME_LENGTH = 128;
    private static final Pattern NAME_PART = Pattern.compile("[A-Za-z0-9_-]+");

    public final JobKind kind;
    public final String shardID;
    public final String runID;
    public final String jobName;
    // OSM extract read by EXTRACT; null for later steps.
    public final String osmFile;
    // Graph file written by EXTRACT and read by later steps.
    public final String osrmFile;
    public final String profile;
    public final String outputDirectory;

    private JobSpec(Builder b) {
        this.kind = b.kind;
        this.shardID = b.shardID;
        this.runID = b.runID;
        this.jobName = String.format("osrm-%s-%s-%s", b.kind.operation, b.shardID, b.runID);
        this.osmFile = b.kind == JobKind.EXTRACT ? b.osmFile : null;
        this.osrmFile = b.outputDirectory + b.shardID + ".osrm";
        this.profile = b.profile;
        this.outputDirectory = b.outputDirectory;
    }

    /** Container environment the preprocessing image reads its arguments from. */
    public Map<String, String> environment() {
        Map<String, String> env = new LinkedHashMap<>();
        env.put(OPERATION_VARIABLE, kind.operation);
        if (kind == JobKind.EXTRACT) {
            env.put(OSM_FILE_VARIABLE, osmFile);
            env.put(PROFILE_VARIABLE, profile);
        } else {
            env.put(OSRM_FILE_VARIABLE, osrmFile);
            if (kind == JobKind.CUSTOMIZE) {
                env.put(OSRM_FILE_BASE_VARIABLE, outputDirectory + shardID);
            }
        }
        env.put(OUTPUT_DIR_VARIABLE, outputDirectory);
        return Collections.unmodifiableMap(env);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof JobSpec)) {
            return false;
        }
        JobSpec s = (JobSpec) o;
        return jobName.equals(s.jobName) && environment().equals(s.environment());
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobName, environment());
    }

    @Override
    public String toString() {
        return jobName + environment();
    }

    public static final class Builder {
        private JobKind kind;
        private String shardID;
        private String runID;
        private String osmFile;
        private String profile;
        private String outputDirectory;

        private Builder() {}

        public Builder setKind(JobKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder setShardID(String shardID) {
            this.shardID = shardID;
            return this;
        }

        public Builder setRunID(String runID) {
            this.runID = runID;
            return this;
        }

        public Builder setOsmFile(String osmFile) {
            this.osmFile = osmFile;
            return this;
        }

        public Builder setProfile(String profile) {
            this.profile = profile;
            return this;
        }

        /** Directory, local or remote, that the job writes into.  A trailing separator is added if missing. */
        public Builder setOutputDirectory(String outputDirectory) {
            this.outputDirectory = outputDirectory == null || outputDirectory.endsWith("/")
                    ? outputDirectory : outputDirectory + "/";
            return this;
        }

        /**
         * @throws JobSubmissionException if a required field is missing or malformed
         */
        public JobSpec build() {
            if (kind == null) {
                throw new JobSubmissionException("Job kind is required");
            }
            requireName("shard id", shardID);
            requireName("run id", runID);
            if (outputDirectory == null || outputDirectory.isBlank()) {
                throw new JobSubmissionException(String.format("%s job for %s has no output directory", kind, shardID));
            }
            if (kind == JobKind.EXTRACT) {
                if (osmFile == null || osmFile.isBlank()) {
                    throw new JobSubmissionException(String.format("EXTRACT job for %s has no OSM input", shardID));
                }
                if (!osmFile.endsWith(".osm.pbf") && !osmFile.endsWith(".osm")) {
                    throw new JobSubmissionException(String.format("EXTRACT input %s is not an OSM file", osmFile));
                }
                if (profile == null || profile.isBlank()) {
                    throw new JobSubmissionException(String.format("EXTRACT job for %s has no profile", shardID));
                }
            }
            int nameLength = String.format("osrm-%s-%s-%s", kind.operation, shardID, runID).length();
            if (nameLength > MAX_JOB_NAME_LENGTH) {
                throw new JobSubmissionException(String.format("Job name for %s run %s is %d characters long, limit %d",
                        shardID, runID, nameLength, MAX_JOB_NAME_LENGTH));
            }
            return new JobSpec(this);
        }

        private static void requireName(String what, String value) {
            if (value == null || !NAME_PART.matcher(value).matches()) {
                throw new JobSubmissionException(String.format("Invalid %s '%s'", what, value));
            }
        }
    }
}
