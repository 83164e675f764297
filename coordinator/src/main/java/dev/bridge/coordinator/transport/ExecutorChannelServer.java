package dev.bridge.coordinator.transport;

import dev.bridge.transport.Envelope;
import dev.bridge.transport.EnvelopeCodec;
import dev.bridge.transport.FrameConnection;
import dev.bridge.transport.LengthPrefixedCodec;
import dev.bridge.transport.MessageTypes;
import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TCP listener that executors connect to. A socket becomes the current executor once it sends
 * {@code hello}; a later {@code hello} on another socket supersedes it and the old socket is
 * closed. Only replies from the current connection reach the listeners.
 */
public class ExecutorChannelServer implements TransportChannel, Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorChannelServer.class);
    private static final Logger EXECUTOR_LOG = LoggerFactory.getLogger("EXECUTOR");

    private final String host;
    private final int port;
    private final int maxFrameBytes;
    private final Duration heartbeatInterval;
    private final EnvelopeCodec codec = new EnvelopeCodec();
    private final ExecutorService connectionExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "bridge-connection");
        t.setDaemon(true);
        return t;
    });
    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "bridge-heartbeat");
        t.setDaemon(true);
        return t;
    });
    private final Set<ExecutorConnection> connections = ConcurrentHashMap.newKeySet();
    private final List<ChannelListener> listeners = new CopyOnWriteArrayList<>();
    private final Object currentLock = new Object();
    private final Object promoteLock = new Object();

    private ServerSocket serverSocket;
    private Thread acceptThread;
    private volatile boolean running;
    private volatile ExecutorConnection current;

    public ExecutorChannelServer(String host, int port, int maxFrameBytes, Duration heartbeatInterval) {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.maxFrameBytes = maxFrameBytes > 0 ? maxFrameBytes : LengthPrefixedCodec.DEFAULT_MAX_FRAME_BYTES;
        this.heartbeatInterval = Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
    }

    public synchronized void start() throws IOException {
        if (running) {
            return;
        }
        serverSocket = new ServerSocket();
        serverSocket.setReuseAddress(true);
        serverSocket.bind(new InetSocketAddress(host, port));
        running = true;
        // Not a daemon: the accept thread keeps the coordinator process alive.
        acceptThread = new Thread(this::acceptLoop, "bridge-accept");
        acceptThread.start();
        long intervalMillis = Math.max(1, heartbeatInterval.toMillis());
        heartbeatScheduler.scheduleAtFixedRate(this::heartbeatTick, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        LOGGER.info("Executor listener on {}:{}", host, getLocalPort());
    }

    private void acceptLoop() {
        while (running) {
            try {
                Socket socket = serverSocket.accept();
                ExecutorConnection connection = new ExecutorConnection(socket);
                connections.add(connection);
                connectionExecutor.submit(connection::run);
            } catch (IOException e) {
                if (running) {
                    LOGGER.error("Error accepting connection", e);
                }
            } catch (RejectedExecutionException e) {
                LOGGER.warn("Connection executor rejected connection");
            }
        }
    }

    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return socket == null ? -1 : socket.getLocalPort();
    }

    @Override
    public void send(Envelope envelope) throws IOException {
        ExecutorConnection connection = current;
        if (connection == null) {
            throw new IOException("No executor connected");
        }
        connection.write(envelope);
    }

    @Override
    public boolean isConnected() {
        return current != null;
    }

    @Override
    public void addListener(ChannelListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeListener(ChannelListener listener) {
        listeners.remove(listener);
    }

    /**
     * Makes {@code connection} the current executor. Promotions are serialized so that the
     * displaced connection's disconnect is fired before the new connection's connect, and
     * connect events arrive in the same order as the swaps.
     */
    private void promote(ExecutorConnection connection) {
        synchronized (promoteLock) {
            ExecutorConnection previous;
            synchronized (currentLock) {
                previous = current;
            }
            if (previous == connection) {
                LOGGER.debug("Repeated hello from {}", connection.connectionId());
                return;
            }
            if (previous != null) {
                previous.close("superseded by " + connection.connectionId());
            }
            synchronized (currentLock) {
                if (connection.closed.get()) {
                    return;
                }
                current = connection;
            }
            try {
                connection.write(Envelope.connected(connection.sessionId));
            } catch (IOException e) {
                LOGGER.warn("Unable to acknowledge executor {}", connection.connectionId(), e);
                return;
            }
            LOGGER.info("Executor {} connected (session {})", connection.connectionId(), connection.sessionId);
            for (ChannelListener listener : listeners) {
                listener.onConnect(connection.connectionId());
            }
        }
    }

    private void heartbeatTick() {
        try {
            ExecutorConnection connection = current;
            if (connection == null) {
                return;
            }
            long silentNanos = System.nanoTime() - connection.lastSeenNanos;
            if (silentNanos > heartbeatInterval.multipliedBy(2).toNanos()) {
                LOGGER.warn("Executor {} silent for {} ms", connection.connectionId(),
                    TimeUnit.NANOSECONDS.toMillis(silentNanos));
                connection.close("heartbeat timeout");
                return;
            }
            connection.write(Envelope.heartbeat());
        } catch (IOException e) {
            LOGGER.warn("Heartbeat failed: {}", e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.error("Heartbeat task failed", e);
        }
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (serverSocket != null) {
            try {
                serverSocket.close();
            } catch (IOException e) {
                LOGGER.warn("Error closing server socket", e);
            }
        }
        if (acceptThread != null) {
            try {
                acceptThread.join(Duration.ofSeconds(1).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        for (ExecutorConnection connection : new ArrayList<>(connections)) {
            connection.close("coordinator stopping");
        }
        heartbeatScheduler.shutdownNow();
        connectionExecutor.shutdown();
        try {
            if (!connectionExecutor.awaitTermination(1, TimeUnit.SECONDS)) {
                connectionExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Executor listener stopped");
    }

    @Override
    public void close() {
        stop();
    }

    private final class ExecutorConnection {

        private final FrameConnection frames;
        private final String sessionId;
        private final AtomicBoolean closed = new AtomicBoolean();

        private volatile long lastSeenNanos = System.nanoTime();

        ExecutorConnection(Socket socket) throws IOException {
            this.frames = new FrameConnection(socket, codec, maxFrameBytes);
            this.sessionId = "s-" + UUID.randomUUID().toString().substring(0, 8);
            LOGGER.info("Accepted connection {}", frames.connectionId());
        }

        String connectionId() {
            return frames.connectionId();
        }

        void run() {
            String reason = "stream closed";
            try {
                while (!closed.get()) {
                    Envelope envelope = frames.read();
                    if (envelope == null) {
                        break;
                    }
                    lastSeenNanos = System.nanoTime();
                    handle(envelope);
                }
            } catch (IOException e) {
                if (!closed.get()) {
                    LOGGER.warn("Connection error {}: {}", connectionId(), e.getMessage());
                    reason = "read failed: " + e.getMessage();
                }
            } finally {
                close(reason);
            }
        }

        private void handle(Envelope envelope) throws IOException {
            switch (envelope.type()) {
                case MessageTypes.HELLO -> promote(this);
                case MessageTypes.REPLY -> deliver(envelope);
                case MessageTypes.HEARTBEAT -> write(Envelope.heartbeatAck());
                case MessageTypes.HEARTBEAT_ACK -> {
                    // liveness is tracked for every inbound frame
                }
                case MessageTypes.LOG -> relayLog(envelope.body());
                default -> LOGGER.warn("Unknown message type {} from {}", envelope.type(), connectionId());
            }
        }

        private void deliver(Envelope envelope) {
            if (envelope.reply() == null || envelope.reply().id() == null) {
                LOGGER.warn("Reply without correlation id from {}", connectionId());
                return;
            }
            if (current != this) {
                LOGGER.warn("Discarding reply {} from non-current connection {}", envelope.reply().id(), connectionId());
                return;
            }
            for (ChannelListener listener : listeners) {
                listener.onMessage(envelope);
            }
        }

        private void relayLog(Map<String, Object> body) {
            if (body == null) {
                return;
            }
            String message = String.valueOf(body.get("message"));
            String level = String.valueOf(body.getOrDefault("level", "info"));
            switch (level) {
                case "error" -> EXECUTOR_LOG.error("[{}] {}", connectionId(), message);
                case "warn", "warning" -> EXECUTOR_LOG.warn("[{}] {}", connectionId(), message);
                case "debug" -> EXECUTOR_LOG.debug("[{}] {}", connectionId(), message);
                default -> EXECUTOR_LOG.info("[{}] {}", connectionId(), message);
            }
        }

        void write(Envelope envelope) throws IOException {
            try {
                frames.write(envelope);
            } catch (LengthPrefixedCodec.FrameTooLargeException e) {
                throw e;
            } catch (IOException e) {
                close("write failed: " + e.getMessage());
                throw e;
            }
        }

        void close(String reason) {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            connections.remove(this);
            try {
                frames.close();
            } catch (IOException e) {
                LOGGER.warn("Error closing connection {}", connectionId(), e);
            }
            boolean wasCurrent;
            synchronized (currentLock) {
                wasCurrent = current == this;
                if (wasCurrent) {
                    current = null;
                }
            }
            LOGGER.info("Connection {} closed: {}", connectionId(), reason);
            if (wasCurrent) {
                for (ChannelListener listener : listeners) {
                    listener.onDisconnect(connectionId(), reason);
                }
            }
        }
    }
}
