package edu.stanford.futuredata.geoshard.localcloud;

import edu.stanford.futuredata.geoshard.errors.JobSubmissionException;
import edu.stanford.futuredata.geoshard.pipeline.JobKind;
import edu.stanford.futuredata.geoshard.pipeline.JobQueueClient;
import edu.stanford.futuredata.geoshard.pipeline.JobSpec;
import edu.stanford.futuredata.geoshard.pipeline.JobState;
import edu.stanford.futuredata.geoshard.pipeline.JobStatus;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs the OSRM tools as local processes instead of batch jobs.  Inputs and outputs must be local paths.
 */
public class LocalJobQueueClient implements JobQueueClient {
    private static final Logger logger = LoggerFactory.getLogger(LocalJobQueueClient.class);

    // Directory holding osrm-extract and friends; empty to use the PATH.
    private final Path binaryDirectory;
    // Directory holding <profile>.lua.
    private final Path profileDirectory;

    private final Map<String, Process> processes = new ConcurrentHashMap<>();

    public LocalJobQueueClient(Path binaryDirectory, Path profileDirectory) {
        this.binaryDirectory = binaryDirectory;
        this.profileDirectory = profileDirectory;
    }

    @Override
    public String submit(JobSpec spec) {
        List<String> command = command(spec);
        File outputDirectory = new File(spec.outputDirectory);
        File log = new File(outputDirectory, spec.jobName + ".log");
        try {
            FileUtils.forceMkdir(outputDirectory);
            if (spec.kind == JobKind.EXTRACT) {
                // osrm-extract names its output after its input.
                FileUtils.copyFile(new File(spec.osmFile), new File(outputDirectory, spec.shardID + ".osm.pbf"));
            }
            Process p = new ProcessBuilder(command)
                    .directory(outputDirectory)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.appendTo(log))
                    .start();
            String jobID = String.format("%s-%d", spec.jobName, p.pid());
            processes.put(jobID, p);
            logger.info("Started {} (log {})", String.join(" ", command), log);
            return jobID;
        } catch (IOException e) {
            throw new JobSubmissionException(String.format("Cannot run %s: %s", spec.jobName, e.getMessage()), e);
        }
    }

    @Override
    public JobStatus poll(String jobID) {
        Process p = processes.get(jobID);
        if (p == null) {
            return JobStatus.failed("Unknown job " + jobID);
        }
        if (p.isAlive()) {
            return JobStatus.of(JobState.RUNNING);
        }
        processes.remove(jobID);
        int exitCode = p.exitValue();
        return exitCode == 0 ? JobStatus.of(JobState.SUCCEEDED) : JobStatus.failed("Exit code " + exitCode);
    }

    @Override
    public boolean cancel(String jobID) {
        Process p = processes.remove(jobID);
        if (p == null) {
            return false;
        }
        p.destroy();
        return true;
    }

    @Override
    public void shutdown() {
        processes.values().forEach(Process::destroy);
        processes.clear();
    }

    List<String> command(JobSpec spec) {
        if (spec.outputDirectory.contains("://") || (spec.osmFile != null && spec.osmFile.contains("://"))) {
            throw new JobSubmissionException(String.format("%s uses a remote location; local jobs need local paths",
                    spec.jobName));
        }
        String binary = binaryDirectory == null ? spec.kind.binary() : binaryDirectory.resolve(spec.kind.binary()).toString();
        List<String> command = new ArrayList<>();
        command.add(binary);
        if (spec.kind == JobKind.EXTRACT) {
            command.add("-p");
            command.add(profileDirectory.resolve(spec.profile + ".lua").toString());
            command.add(spec.outputDirectory + spec.shardID + ".osm.pbf");
        } else {
            command.add(spec.osrmFile);
        }
        return command;
    }
}
