package com.marketpipe.launcher;

import com.marketpipe.core.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs each pipeline role as a child JVM on the launcher's own classpath.
 * - Starts gateway, order manager and order book
 * - Waits for the order book's shared segment before starting the strategy
 * - Stops every child on shutdown, strategy first
 */
public class PipelineLauncher {
    private static final Logger LOG = LoggerFactory.getLogger(PipelineLauncher.class);

    static final long SEGMENT_TIMEOUT_MS = 15_000;
    static final long STOP_TIMEOUT_MS = 5_000;
    private static final String PROPERTY_PREFIX = "marketpipe.";

    private final PipelineConfig config;
    private final String javaExecutable;
    private final String classpath;
    private final Properties systemProperties;
    private final Map<PipelineRole, Process> children = Collections.synchronizedMap(new EnumMap<>(PipelineRole.class));

    public PipelineLauncher(PipelineConfig config) {
        this(config,
            Path.of(System.getProperty("java.home"), "bin", "java").toString(),
            System.getProperty("java.class.path"),
            System.getProperties());
    }

    PipelineLauncher(PipelineConfig config, String javaExecutable, String classpath, Properties systemProperties) {
        this.config = config;
        this.javaExecutable = javaExecutable;
        this.classpath = classpath;
        this.systemProperties = systemProperties;
    }

    /**
     * Command line for one role. {@code marketpipe.*} system properties given to the
     * launcher are passed on so every child sees the same configuration.
     */
    List<String> command(PipelineRole role) {
        List<String> cmd = new ArrayList<>();
        cmd.add(javaExecutable);
        systemProperties.stringPropertyNames().stream()
            .filter(name -> name.startsWith(PROPERTY_PREFIX))
            .sorted()
            .forEach(name -> cmd.add("-D" + name + "=" + systemProperties.getProperty(name)));
        cmd.add("-cp");
        cmd.add(classpath);
        cmd.add(role.getMainClassName());
        return cmd;
    }

    /**
     * Start every role in order.
     *
     * @throws IOException if a child cannot be started or the shared segment never appears
     */
    public void start() throws IOException {
        Path segment = config.getSegmentDir().resolve(config.getSharedMemoryName());

        for (PipelineRole role : PipelineRole.values()) {
            if (role == PipelineRole.STRATEGY) {
                awaitSegment(segment);
            }
            startChild(role);
        }
        LOG.info("Pipeline started ({} processes)", children.size());
    }

    private void startChild(PipelineRole role) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command(role));
        pb.inheritIO();
        Process process = pb.start();
        children.put(role, process);
        LOG.info("Started {} (pid {})", role.getDisplayName(), process.pid());
    }

    private void awaitSegment(Path segment) throws IOException {
        long deadline = System.currentTimeMillis() + SEGMENT_TIMEOUT_MS;
        while (!Files.exists(segment)) {
            Process orderBook = children.get(PipelineRole.ORDER_BOOK);
            if (orderBook != null && !orderBook.isAlive()) {
                throw new IOException("Order book exited with code " + orderBook.exitValue()
                    + " before creating " + segment);
            }
            if (System.currentTimeMillis() > deadline) {
                throw new IOException("Shared segment " + segment + " did not appear within " + SEGMENT_TIMEOUT_MS + "ms");
            }
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while waiting for " + segment);
            }
        }
        LOG.info("Shared segment {} is ready", segment);
    }

    /**
     * Block until the first child exits.
     *
     * @return the role that exited and its exit code
     */
    public Map.Entry<PipelineRole, Integer> awaitFirstExit() throws InterruptedException {
        List<CompletableFuture<Map.Entry<PipelineRole, Integer>>> exits = new ArrayList<>();
        synchronized (children) {
            children.forEach((role, process) ->
                exits.add(process.onExit().thenApply(p -> Map.entry(role, p.exitValue()))));
        }
        try {
            @SuppressWarnings("unchecked")
            Map.Entry<PipelineRole, Integer> first = (Map.Entry<PipelineRole, Integer>)
                CompletableFuture.anyOf(exits.toArray(new CompletableFuture[0])).get();
            return first;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Failed to wait for child processes", e.getCause());
        }
    }

    /**
     * Stop all children, newest first. Children that ignore the request are killed.
     */
    public void stop() {
        List<PipelineRole> roles;
        synchronized (children) {
            roles = new ArrayList<>(children.keySet());
        }
        Collections.reverse(roles);

        for (PipelineRole role : roles) {
            Process process = children.remove(role);
            if (process == null || !process.isAlive()) continue;
            LOG.info("Stopping {}...", role.getDisplayName());
            process.destroy();
            try {
                if (!process.waitFor(STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                    LOG.warn("{} did not stop in {}ms, killing", role.getDisplayName(), STOP_TIMEOUT_MS);
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }

    public int getRunningCount() {
        synchronized (children) {
            return (int) children.values().stream().filter(Process::isAlive).count();
        }
    }
}
