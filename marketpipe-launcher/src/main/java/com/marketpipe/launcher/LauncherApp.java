package com.marketpipe.launcher;

import com.marketpipe.core.config.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Runs the whole pipeline from one command. Stops everything when any process exits.
 */
public class LauncherApp {
    private static final Logger LOG = LoggerFactory.getLogger(LauncherApp.class);

    public static void main(String[] args) {
        LOG.info("Starting marketpipe...");

        PipelineLauncher launcher;
        try {
            launcher = new PipelineLauncher(PipelineConfig.load());
        } catch (Exception e) {
            LOG.error("Failed to load configuration", e);
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Caught shutdown, terminating child processes...");
            launcher.stop();
        }, "launcher-shutdown"));

        int exitCode = 0;
        try {
            launcher.start();
            Map.Entry<PipelineRole, Integer> exited = launcher.awaitFirstExit();
            LOG.warn("{} exited with code {}, stopping pipeline", exited.getKey().getDisplayName(), exited.getValue());
            exitCode = exited.getValue() == 0 ? 0 : 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            LOG.error("Pipeline failed to start", e);
            exitCode = 1;
        }

        launcher.stop();
        System.exit(exitCode);
    }
}
