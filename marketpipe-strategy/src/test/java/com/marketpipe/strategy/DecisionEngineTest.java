package com.marketpipe.strategy;

import com.marketpipe.core.config.PipelineConfig;
import com.marketpipe.core.model.OrderIntent;
import com.marketpipe.core.model.OrderSide;
import com.marketpipe.core.model.Position;
import com.marketpipe.core.shm.SharedPriceTable;
import com.marketpipe.core.wire.FrameReader;
import com.marketpipe.core.wire.OrderIntentCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class DecisionEngineTest {

    private static final Clock FIXED = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_500L), ZoneOffset.UTC);

    @TempDir
    Path segmentDir;

    private PipelineConfig config;
    private SharedPriceTable table;
    private RecordingSender sender;
    private DecisionEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        config = new PipelineConfig();
        config.setShortWindow(2);
        config.setLongWindow(3);
        config.setBullishThreshold(70);
        config.setBearishThreshold(30);
        config.setTradeQuantity(10);
        config.setReconnectDelayMs(100);
        config.setSharedMemoryDir(segmentDir.toString());
        config.setSharedMemoryName("engine_test");

        table = SharedPriceTable.create(segmentDir, "engine_test", config.getSymbols());
        sender = new RecordingSender();
        engine = new DecisionEngine(config, table, sender, new MaNewsStrategy(config), FIXED);
    }

    @AfterEach
    void tearDown() {
        table.unlink();
        table.close();
    }

    private Optional<OrderIntent> tick(double price, String news) throws OrderTransmitException {
        table.update("AAPL", price);
        return engine.onNewsFrame(news.getBytes(StandardCharsets.US_ASCII));
    }

    @Nested
    @DisplayName("Per-tick state machine")
    class StateMachine {

        @Test
        @DisplayName("Rising prices with bullish news buy once and then hold")
        void buysOnceThenHolds() throws Exception {
            // Given two ticks that only fill the history
            assertTrue(tick(10, "80").isEmpty());
            assertTrue(tick(11, "80").isEmpty());

            // When the third tick completes the window
            Optional<OrderIntent> order = tick(12, "80");

            // Then a BUY goes out and the position is LONG
            assertTrue(order.isPresent());
            OrderIntent intent = order.get();
            assertEquals("AAPL", intent.symbol());
            assertEquals(OrderSide.BUY, intent.side());
            assertEquals(10, intent.quantity());
            assertEquals(12.0, intent.price());
            assertEquals(80, intent.sentiment());
            assertEquals(11.5, intent.shortMa(), 1e-12);
            assertEquals(11.0, intent.longMa(), 1e-12);
            assertEquals(Position.FLAT, intent.positionBefore());
            assertEquals(Position.LONG, intent.positionAfter());
            assertEquals(1_700_000_000.5, intent.timestamp(), 1e-6);
            assertEquals(Position.LONG, engine.getPosition());

            // And a repeat of the same conditions sends nothing
            assertTrue(tick(13, "80").isEmpty());
            assertEquals(1, sender.sent.size());
        }

        @Test
        @DisplayName("Long reverses to short on falling prices and bearish news")
        void reversesToShort() throws Exception {
            tick(10, "80");
            tick(11, "80");
            tick(12, "80");

            // short_ma 10.5 drops below long_ma 10.67
            Optional<OrderIntent> order = tick(9, "10");

            assertTrue(order.isPresent());
            assertEquals(OrderSide.SELL, order.get().side());
            assertEquals(Position.LONG, order.get().positionBefore());
            assertEquals(Position.SHORT, engine.getPosition());
            assertTrue(tick(8, "10").isEmpty());
        }

        @Test
        @DisplayName("Malformed sentiment is skipped without touching history")
        void skipsMalformedSentiment() throws Exception {
            tick(10, "80");

            assertTrue(tick(11, "bullish").isEmpty());
            assertTrue(tick(11, "150").isEmpty());

            assertEquals(1, engine.getHistory().size());
            assertEquals(Position.FLAT, engine.getPosition());
        }

        @Test
        @DisplayName("A price that was never written is skipped")
        void skipsMissingPrice() throws Exception {
            assertTrue(engine.onNewsFrame("80".getBytes(StandardCharsets.US_ASCII)).isEmpty());

            assertEquals(0, engine.getHistory().size());
            assertEquals(0, engine.getTicksEvaluated());
        }

        @Test
        @DisplayName("A failed send keeps the position and propagates")
        void transmitFailureKeepsPosition() throws Exception {
            sender.failWith = new OrderTransmitException("broken pipe");
            tick(10, "80");
            tick(11, "80");

            assertThrows(OrderTransmitException.class, () -> tick(12, "80"));
            assertEquals(Position.FLAT, engine.getPosition());
            assertEquals(0, engine.getOrdersSent());
        }
    }

    @Nested
    @DisplayName("Network run")
    class NetworkRun {

        @Test
        @DisplayName("News ticks over TCP produce a framed JSON order at the sink")
        void endToEndOverSockets() throws Exception {
            try (ServerSocket news = new ServerSocket(0); ServerSocket orders = new ServerSocket(0)) {
                config.setNewsPort(news.getLocalPort());
                config.setOrderPort(orders.getLocalPort());

                SocketOrderSender socketSender = new SocketOrderSender("127.0.0.1", orders.getLocalPort());
                socketSender.connect();
                DecisionEngine networked = new DecisionEngine(config, table, socketSender, new MaNewsStrategy(config), FIXED);

                AtomicReference<Throwable> failure = new AtomicReference<>();
                Thread runner = new Thread(() -> {
                    try {
                        networked.run();
                    } catch (Throwable t) {
                        failure.set(t);
                    }
                }, "engine-test");
                runner.setDaemon(true);
                runner.start();

                try (Socket orderConn = orders.accept(); Socket newsConn = news.accept()) {
                    orderConn.setSoTimeout(5_000);
                    OutputStream out = newsConn.getOutputStream();
                    double[] prices = {10, 11, 12};
                    for (int i = 0; i < prices.length; i++) {
                        table.update("AAPL", prices[i]);
                        out.write("80*".getBytes(StandardCharsets.US_ASCII));
                        out.flush();
                        int expected = i + 1;
                        await(() -> networked.getTicksEvaluated() >= expected);
                    }

                    FrameReader reader = new FrameReader(orderConn.getInputStream(), "order-test");
                    assertTrue(reader.hasNext());
                    OrderIntent received = OrderIntentCodec.decode(reader.next());
                    assertEquals(OrderSide.BUY, received.side());
                    assertEquals(Position.LONG, received.positionAfter());
                } finally {
                    networked.stop();
                    runner.join(5_000);
                    socketSender.close();
                }
                assertNull(failure.get());
                assertEquals(Position.LONG, networked.getPosition());
            }
        }

        @Test
        @DisplayName("Stop ends a run that is waiting for the news feed")
        void stopWhileRetrying() throws Exception {
            int port;
            try (ServerSocket free = new ServerSocket(0)) {
                port = free.getLocalPort();
            }
            config.setNewsPort(port);
            config.setReconnectDelayMs(60_000);

            Thread runner = new Thread(() -> {
                try {
                    engine.run();
                } catch (OrderTransmitException e) {
                    fail(e);
                }
            }, "engine-stop-test");
            runner.start();
            Thread.sleep(200);

            engine.stop();
            runner.join(5_000);

            assertFalse(runner.isAlive());
        }
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out");
            }
            Thread.sleep(10);
        }
    }

    private static class RecordingSender implements OrderSender {
        final List<OrderIntent> sent = new ArrayList<>();
        OrderTransmitException failWith;

        @Override
        public void send(OrderIntent intent) throws OrderTransmitException {
            if (failWith != null) throw failWith;
            sent.add(intent);
        }

        @Override
        public void close() {
        }
    }
}
