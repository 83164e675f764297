package dev.bridge.coordinator.transport;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import dev.bridge.transport.Envelope;
import dev.bridge.transport.EnvelopeCodec;
import dev.bridge.transport.LengthPrefixedCodec;
import dev.bridge.transport.MessageTypes;
import dev.bridge.transport.ReplyEnvelope;
import dev.bridge.transport.RequestEnvelope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.Socket;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class ExecutorChannelServerTest {

    private static final int MAX_FRAME = 4096;

    private final EnvelopeCodec codec = new EnvelopeCodec();
    private final RecordingListener listener = new RecordingListener();
    private final List<Socket> sockets = new ArrayList<>();
    private ExecutorChannelServer server;

    private void startServer(Duration heartbeatInterval) throws IOException {
        server = new ExecutorChannelServer("127.0.0.1", 0, MAX_FRAME, heartbeatInterval);
        server.addListener(listener);
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        for (Socket socket : sockets) {
            socket.close();
        }
        if (server != null) {
            server.stop();
        }
    }

    private Socket connect() throws IOException {
        Socket socket = new Socket("127.0.0.1", server.getLocalPort());
        socket.setSoTimeout(5000);
        sockets.add(socket);
        return socket;
    }

    private void write(Socket socket, Envelope envelope) throws IOException {
        LengthPrefixedCodec.writeFrame(socket.getOutputStream(), codec.encode(envelope), MAX_FRAME);
    }

    private Envelope read(Socket socket) throws IOException {
        String frame = LengthPrefixedCodec.readFrame(socket.getInputStream(), MAX_FRAME);
        return frame == null ? null : codec.decode(frame);
    }

    private Socket handshake(String name) throws Exception {
        Socket socket = connect();
        write(socket, Envelope.hello(name, "test"));
        Envelope connected = read(socket);
        assertEquals(MessageTypes.CONNECTED, connected.type());
        assertNotNull(connected.sessionId());
        assertTrue(listener.events.poll(5, TimeUnit.SECONDS).startsWith("connect "));
        return socket;
    }

    @Test
    void socketBecomesCurrentOnlyAfterHello() throws Exception {
        startServer(Duration.ofSeconds(30));
        connect();
        Thread.sleep(100);

        assertFalse(server.isConnected());
        assertThrows(IOException.class, () -> server.send(Envelope.heartbeat()));
    }

    @Test
    void requestsGoOutAndRepliesComeBack() throws Exception {
        startServer(Duration.ofSeconds(30));
        Socket executor = handshake("figma");
        assertTrue(server.isConnected());

        server.send(Envelope.request(new RequestEnvelope("r-1", "ping", Map.of())));
        Envelope request = read(executor);
        assertEquals("r-1", request.request().id());

        write(executor, Envelope.reply(ReplyEnvelope.success("r-1", "pong")));
        Envelope reply = listener.messages.poll(5, TimeUnit.SECONDS);
        assertNotNull(reply);
        assertEquals("pong", reply.reply().result());
    }

    @Test
    void executorHeartbeatIsAcknowledged() throws Exception {
        startServer(Duration.ofSeconds(30));
        Socket executor = handshake("figma");

        write(executor, Envelope.heartbeat());

        assertEquals(MessageTypes.HEARTBEAT_ACK, read(executor).type());
    }

    @Test
    void newerHelloSupersedesTheCurrentConnection() throws Exception {
        startServer(Duration.ofSeconds(30));
        Socket first = handshake("first");
        Socket second = connect();

        write(second, Envelope.hello("second", "test"));
        assertEquals(MessageTypes.CONNECTED, read(second).type());

        String disconnect = listener.events.poll(5, TimeUnit.SECONDS);
        assertNotNull(disconnect);
        assertTrue(disconnect.startsWith("disconnect "), disconnect);
        assertTrue(listener.events.poll(5, TimeUnit.SECONDS).startsWith("connect "));
        assertNull(read(first));

        Thread.sleep(100);
        assertTrue(listener.events.isEmpty(), listener.events::toString);
        assertTrue(server.isConnected());
    }

    @Test
    void repliesFromNonCurrentSocketAreDropped() throws Exception {
        startServer(Duration.ofSeconds(30));
        Socket executor = handshake("figma");
        Socket bystander = connect();

        write(bystander, Envelope.reply(ReplyEnvelope.success("r-1", "stale")));
        assertNull(listener.messages.poll(200, TimeUnit.MILLISECONDS));
        assertTrue(server.isConnected());

        write(executor, Envelope.reply(ReplyEnvelope.success("r-2", "fresh")));
        Envelope reply = listener.messages.poll(5, TimeUnit.SECONDS);
        assertNotNull(reply);
        assertEquals("r-2", reply.reply().id());
        assertNull(listener.events.poll(100, TimeUnit.MILLISECONDS));
    }

    @RepeatedTest(20)
    void racingHellosLeaveExactlyOneCurrentConnection() throws Exception {
        startServer(Duration.ofSeconds(30));
        Socket first = connect();
        Socket second = connect();
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService senders = Executors.newFixedThreadPool(2);
        try {
            List<Future<?>> hellos = new ArrayList<>();
            for (Socket socket : List.of(first, second)) {
                hellos.add(senders.submit(() -> {
                    go.await();
                    write(socket, Envelope.hello("racer", "test"));
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> hello : hellos) {
                hello.get(5, TimeUnit.SECONDS);
            }
        } finally {
            senders.shutdownNow();
        }

        String firstConnect = listener.events.poll(5, TimeUnit.SECONDS);
        String disconnect = listener.events.poll(5, TimeUnit.SECONDS);
        String secondConnect = listener.events.poll(5, TimeUnit.SECONDS);
        assertNotNull(firstConnect);
        assertNotNull(disconnect);
        assertNotNull(secondConnect);
        assertTrue(firstConnect.startsWith("connect "), firstConnect);
        String displaced = firstConnect.substring("connect ".length());
        assertTrue(disconnect.startsWith("disconnect " + displaced + " superseded"), disconnect);
        assertTrue(secondConnect.startsWith("connect "), secondConnect);
        assertNotEquals(firstConnect, secondConnect);

        assertNull(listener.events.poll(200, TimeUnit.MILLISECONDS));
        assertTrue(server.isConnected());
    }

    @Test
    void executorLogLinesAreRelayedWithoutDisconnecting() throws Exception {
        Logger executorLog = (Logger) LoggerFactory.getLogger("EXECUTOR");
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        executorLog.addAppender(appender);
        try {
            startServer(Duration.ofSeconds(30));
            Socket executor = handshake("figma");

            write(executor, Envelope.log("warn", "font missing"));

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (appender.list.isEmpty() && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(1, appender.list.size());
            ILoggingEvent event = appender.list.get(0);
            assertEquals(Level.WARN, event.getLevel());
            assertTrue(event.getFormattedMessage().endsWith("font missing"), event.getFormattedMessage());

            assertNull(listener.events.poll(200, TimeUnit.MILLISECONDS));
            assertTrue(server.isConnected());
        } finally {
            executorLog.detachAppender(appender);
        }
    }

    @Test
    void oversizedFrameClosesTheConnection() throws Exception {
        startServer(Duration.ofSeconds(30));
        Socket executor = handshake("figma");

        executor.getOutputStream().write(ByteBuffer.allocate(4).putInt(MAX_FRAME + 1).array());
        executor.getOutputStream().flush();

        String event = listener.events.poll(5, TimeUnit.SECONDS);
        assertNotNull(event);
        assertTrue(event.startsWith("disconnect "), event);
        assertFalse(server.isConnected());
    }

    @Test
    void silentExecutorIsDroppedAfterTwoIntervals() throws Exception {
        startServer(Duration.ofMillis(100));
        handshake("figma");

        String event = listener.events.poll(5, TimeUnit.SECONDS);
        assertNotNull(event);
        assertTrue(event.contains("heartbeat timeout"), event);
    }

    private static final class RecordingListener implements ChannelListener {

        private final BlockingQueue<String> events = new LinkedBlockingQueue<>();
        private final BlockingQueue<Envelope> messages = new LinkedBlockingQueue<>();

        @Override
        public void onConnect(String connectionId) {
            events.add("connect " + connectionId);
        }

        @Override
        public void onMessage(Envelope envelope) {
            messages.add(envelope);
        }

        @Override
        public void onDisconnect(String connectionId, String reason) {
            events.add("disconnect " + connectionId + " " + reason);
        }
    }
}
