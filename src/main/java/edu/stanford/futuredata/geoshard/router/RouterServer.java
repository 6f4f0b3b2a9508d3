package edu.stanford.futuredata.geoshard.router;

import edu.stanford.futuredata.geoshard.engine.EngineClient;
import edu.stanford.futuredata.geoshard.registry.RegistryCurator;
import edu.stanford.futuredata.geoshard.registry.ShardRegistry;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Serves routing queries and shard readiness over gRPC.
 */
public class RouterServer {
    private static final Logger logger = LoggerFactory.getLogger(RouterServer.class);

    private final int routerPort;
    private final Server server;
    private final CoordinateRouter router;
    private final ShardRegistry registry;
    private final RegistryCurator zkCurator;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    /**
     * @param zkCurator optional; when given, readiness published by pipeline processes is picked up while serving
     */
    public RouterServer(ShardRegistry registry, EngineClient engine, RouterConfig config, RegistryCurator zkCurator,
                        int routerPort) {
        this.routerPort = routerPort;
        this.registry = registry;
        this.zkCurator = zkCurator;
        this.router = new CoordinateRouter(registry, engine, config);
        this.server = ServerBuilder.forPort(routerPort)
                .addService(new ServiceRouter(router))
                .build();
    }

    /** Start serving requests. */
    public int startServing() {
        try {
            server.start();
        } catch (IOException e) {
            logger.warn("Router startup failed: {}", e.getMessage());
            this.stopServing();
            return 1;
        }
        if (zkCurator != null) {
            registry.attachCurator(zkCurator, true);
        }
        logger.info("Router server started, listening on {} ({} shards, catalog version {})", routerPort,
                registry.getShards().size(), registry.catalogVersion);
        Runtime.getRuntime().addShutdownHook(new Thread() {
            @Override
            public void run() {
                RouterServer.this.stopServing();
            }
        });
        return 0;
    }

    /** Stop serving requests and shutdown resources. */
    public void stopServing() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (server != null) {
            server.shutdown();
        }
        registry.shutdown();
        router.shutdown();
        if (zkCurator != null) {
            zkCurator.close();
        }
    }

    public void awaitTermination() throws InterruptedException {
        server.awaitTermination();
    }

    public CoordinateRouter getRouter() {
        return router;
    }
}
