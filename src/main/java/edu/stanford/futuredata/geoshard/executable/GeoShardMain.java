package edu.stanford.futuredata.geoshard.executable;

import edu.stanford.futuredata.geoshard.awscloud.AWSBatchJobQueueClient;
import edu.stanford.futuredata.geoshard.awscloud.S3ArtifactStore;
import edu.stanford.futuredata.geoshard.engine.OSRMEngineClient;
import edu.stanford.futuredata.geoshard.localcloud.LocalArtifactStore;
import edu.stanford.futuredata.geoshard.localcloud.LocalJobQueueClient;
import edu.stanford.futuredata.geoshard.pipeline.AlgorithmMode;
import edu.stanford.futuredata.geoshard.pipeline.ArtifactStore;
import edu.stanford.futuredata.geoshard.pipeline.JobQueueClient;
import edu.stanford.futuredata.geoshard.pipeline.Pipeline;
import edu.stanford.futuredata.geoshard.pipeline.PipelineConfig;
import edu.stanford.futuredata.geoshard.pipeline.PipelineOrchestrator;
import edu.stanford.futuredata.geoshard.pipeline.PipelineState;
import edu.stanford.futuredata.geoshard.registry.RegistryCurator;
import edu.stanford.futuredata.geoshard.registry.ShardCatalog;
import edu.stanford.futuredata.geoshard.registry.ShardRegistry;
import edu.stanford.futuredata.geoshard.router.RouterConfig;
import edu.stanford.futuredata.geoshard.router.RouterServer;
import edu.stanford.futuredata.geoshard.utilities.Coordinate;
import org.apache.commons.cli.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

public class GeoShardMain {

    private static final Logger logger = LoggerFactory.getLogger(GeoShardMain.class);

    public static final int DEFAULT_ROUTER_PORT = 8500;

    public static void main(String[] args) throws Exception {
        Options options = new Options();
        options.addOption("router", false, "Start Router?");
        options.addOption("pipeline", false, "Build shards?");

        options.addOption("catalog", true, "Shard catalog JSON file (default: bundled catalog)");
        options.addOption("zh", true, "ZooKeeper Host Address");
        options.addOption("zp", true, "ZooKeeper Port");
        options.addOption("p", true, "Router Port");
        options.addOption("timeout", true, "Engine timeout in milliseconds");

        options.addOption("bucket", true, "S3 bucket holding slices/ and processed/");
        options.addOption("queue", true, "AWS Batch job queue");
        options.addOption("jobdef", true, "AWS Batch job definition");
        options.addOption("region", true, "AWS region");
        options.addOption("algorithm", true, "ch or mld");
        options.addOption("profile", true, "Routing profile");
        options.addOption("shards", true, "Comma-separated shard ids to build (default: all)");
        options.addOption("local", false, "Run jobs as local processes?");
        options.addOption("slices", true, "Local directory holding <shard>.osm.pbf");
        options.addOption("output", true, "Local output directory");
        options.addOption("bin", true, "Directory holding the OSRM tools");
        options.addOption("profiles", true, "Directory holding <profile>.lua");

        CommandLineParser parser = new DefaultParser();
        CommandLine cmd;
        try {
            cmd = parser.parse(options, args);
        } catch (ParseException e) {
            logger.error("{}", e.getMessage());
            new HelpFormatter().printHelp("geoshard", options);
            System.exit(1);
            return;
        }

        ShardCatalog catalog = cmd.hasOption("catalog")
                ? ShardCatalog.fromFile(new File(cmd.getOptionValue("catalog")))
                : ShardCatalog.fromResource(ShardCatalog.DEFAULT_RESOURCE);
        ShardRegistry registry = new ShardRegistry(catalog);
        List<Coordinate> uncovered = registry.uncoveredPoints(10.0);
        if (!uncovered.isEmpty()) {
            logger.info("{} sample points are outside every shard, e.g. {}", uncovered.size(), uncovered.get(0));
        }
        RegistryCurator zkCurator = null;
        if (cmd.hasOption("zh")) {
            zkCurator = new RegistryCurator(cmd.getOptionValue("zh"), Integer.parseInt(cmd.getOptionValue("zp", "2181")));
        }

        if (cmd.hasOption("pipeline")) {
            logger.info("Starting pipelines!");
            if (zkCurator != null) {
                registry.attachCurator(zkCurator, false);
            }
            int failed = runPipelines(cmd, registry);
            // Flushes readiness still being published.
            registry.shutdown();
            if (zkCurator != null) {
                zkCurator.close();
            }
            System.exit(failed == 0 ? 0 : 1);
        }
        if (cmd.hasOption("router")) {
            logger.info("Starting router!");
            RouterConfig config = new RouterConfig();
            if (cmd.hasOption("timeout")) {
                config.engineTimeoutMillis = Long.parseLong(cmd.getOptionValue("timeout"));
            }
            int port = Integer.parseInt(cmd.getOptionValue("p", Integer.toString(DEFAULT_ROUTER_PORT)));
            RouterServer server = new RouterServer(registry, new OSRMEngineClient(config.engineTimeoutMillis), config,
                    zkCurator, port);
            if (server.startServing() != 0) {
                System.exit(1);
            }
            server.awaitTermination();
        }
    }

    // Build the requested shards and wait for them.  Returns the number of pipelines that did not succeed.
    private static int runPipelines(CommandLine cmd, ShardRegistry registry) {
        PipelineConfig config;
        JobQueueClient jobQueue;
        ArtifactStore artifactStore;
        if (cmd.hasOption("local")) {
            config = new PipelineConfig(cmd.getOptionValue("slices", "data/slices"), cmd.getOptionValue("output", "data/processed"));
            jobQueue = new LocalJobQueueClient(cmd.hasOption("bin") ? Path.of(cmd.getOptionValue("bin")) : null,
                    Path.of(cmd.getOptionValue("profiles", "profiles")));
            artifactStore = new LocalArtifactStore();
        } else {
            if (!cmd.hasOption("bucket")) {
                logger.error("-bucket is required unless -local is given");
                return 1;
            }
            String region = cmd.getOptionValue("region", AWSBatchJobQueueClient.DEFAULT_REGION);
            config = PipelineConfig.forBucket(cmd.getOptionValue("bucket"));
            jobQueue = new AWSBatchJobQueueClient(region,
                    cmd.getOptionValue("queue", AWSBatchJobQueueClient.DEFAULT_JOB_QUEUE),
                    cmd.getOptionValue("jobdef", AWSBatchJobQueueClient.DEFAULT_JOB_DEFINITION));
            artifactStore = new S3ArtifactStore(region);
        }
        if (cmd.hasOption("profile")) {
            config.profile = cmd.getOptionValue("profile");
        }
        if (cmd.hasOption("algorithm")) {
            config.algorithmMode = AlgorithmMode.parse(cmd.getOptionValue("algorithm"));
        }
        PipelineOrchestrator orchestrator = new PipelineOrchestrator(jobQueue, registry, artifactStore, config);
        List<String> shardIDs = cmd.hasOption("shards")
                ? Arrays.stream(cmd.getOptionValue("shards").split(","))
                        .map(String::trim).filter(s -> !s.isEmpty()).collect(Collectors.toList())
                : registry.getShards().stream().map(s -> s.id).collect(Collectors.toList());
        List<Pipeline> pipelines = orchestrator.runPipelines(shardIDs, config.algorithmMode);
        CompletableFuture.allOf(pipelines.stream().map(Pipeline::getCompletion).toArray(CompletableFuture[]::new)).join();
        // Shards whose pipeline could not be created.
        int failed = shardIDs.size() - pipelines.size();
        for (Pipeline p : pipelines) {
            if (p.getState() == PipelineState.SUCCEEDED) {
                logger.info("Shard {}: {}", p.shardID, p.artifact);
            } else {
                failed++;
                logger.error("Shard {}: {} {}", p.shardID, p.getState(),
                        p.getFailure().map(Throwable::getMessage).orElse(""));
            }
        }
        orchestrator.shutdown();
        return failed;
    }
}
