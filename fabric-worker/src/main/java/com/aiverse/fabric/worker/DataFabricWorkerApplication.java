package com.aiverse.fabric.worker;

import com.aiverse.fabric.config.FabricConfig;
import com.aiverse.fabric.worker.bootstrap.BootstrapContext;
import com.aiverse.fabric.worker.bootstrap.FabricBootstrap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Data fabric worker entry point. Configuration comes from {@code FABRIC_*} environment variables.
 * <p>
 * In-process intent executions run on a fixed pool. The main thread is blocked so the JVM stays alive;
 * a shutdown hook or an interrupt cleans up resources and drains the pool.
 * <p>
 * This process exposes no network endpoint. {@link com.aiverse.fabric.worker.api.DataFabricGateway} is a
 * transport-neutral facade; a host that embeds the worker supplies the transport (HTTP, gRPC, a message bus)
 * and calls the gateway obtained from {@link BootstrapContext#getGateway()}.
 */
public final class DataFabricWorkerApplication {

    private static final Logger log = LoggerFactory.getLogger(DataFabricWorkerApplication.class);
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 30;
    private static final int ENGINE_THREADS = 4;

    private DataFabricWorkerApplication() {
    }

    public static void main(String[] args) {
        FabricConfig config = FabricConfig.fromEnvironment();
        ExecutorService engineExecutor = Executors.newFixedThreadPool(ENGINE_THREADS, engineThreads());
        BootstrapContext ctx = FabricBootstrap.initialize(config, List.of(), engineExecutor);

        log.info("Starting data fabric worker | engine: {} | rate limits: {} | ledger: {}",
                config.getIntentEngine(), config.getRateLimitStore(), config.getLedgerStore());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down data fabric worker...");
            stop(ctx, engineExecutor);
        }));

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Interrupted, shutting down data fabric worker...");
            stop(ctx, engineExecutor);
        }
    }

    private static void stop(BootstrapContext ctx, ExecutorService engineExecutor) {
        engineExecutor.shutdown();
        try {
            if (!engineExecutor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Intent executions still running after {}s; forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
                engineExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            engineExecutor.shutdownNow();
        }
        ctx.shutdown();
    }

    private static ThreadFactory engineThreads() {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "fabric-engine-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
