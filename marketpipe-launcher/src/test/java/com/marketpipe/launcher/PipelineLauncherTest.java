package com.marketpipe.launcher;

import com.marketpipe.core.config.PipelineConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class PipelineLauncherTest {

    private static PipelineLauncher launcher(Properties props) {
        return new PipelineLauncher(new PipelineConfig(), "/opt/jdk/bin/java", "a.jar:b.jar", props);
    }

    @Test
    @DisplayName("Child command runs the role's main class on the launcher classpath")
    void buildsCommandLine() {
        List<String> cmd = launcher(new Properties()).command(PipelineRole.ORDER_BOOK);

        assertEquals(List.of("/opt/jdk/bin/java", "-cp", "a.jar:b.jar", "com.marketpipe.orderbook.OrderBookApp"), cmd);
    }

    @Test
    @DisplayName("Only marketpipe.* properties are forwarded, in name order")
    void forwardsPipelineProperties() {
        Properties props = new Properties();
        props.setProperty("marketpipe.shm.name", "custom_shm");
        props.setProperty("marketpipe.host", "127.0.0.2");
        props.setProperty("user.home", "/home/someone");

        List<String> cmd = launcher(props).command(PipelineRole.STRATEGY);

        assertEquals(List.of(
            "/opt/jdk/bin/java",
            "-Dmarketpipe.host=127.0.0.2",
            "-Dmarketpipe.shm.name=custom_shm",
            "-cp", "a.jar:b.jar",
            "com.marketpipe.strategy.StrategyApp"), cmd);
    }

    @Test
    @DisplayName("Roles start gateway first and strategy last")
    void startOrder() {
        assertArrayEquals(new PipelineRole[]{
            PipelineRole.GATEWAY, PipelineRole.ORDER_MANAGER, PipelineRole.ORDER_BOOK, PipelineRole.STRATEGY
        }, PipelineRole.values());
        assertEquals("com.marketpipe.gateway.GatewayApp", PipelineRole.GATEWAY.getMainClassName());
        assertEquals("com.marketpipe.ordermanager.OrderManagerApp", PipelineRole.ORDER_MANAGER.getMainClassName());
    }

    @Test
    @DisplayName("Stopping with no children is a no-op")
    void stopWithoutChildren() {
        PipelineLauncher launcher = launcher(new Properties());

        launcher.stop();

        assertEquals(0, launcher.getRunningCount());
    }
}
