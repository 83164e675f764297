package dev.bridge.executor;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.bridge.transport.Envelope;
import dev.bridge.transport.EnvelopeCodec;
import dev.bridge.transport.FrameConnection;
import dev.bridge.transport.LengthPrefixedCodec;
import dev.bridge.transport.MessageTypes;
import dev.bridge.transport.ReplyEnvelope;
import dev.bridge.transport.RequestEnvelope;
import java.io.Closeable;
import java.io.IOException;
import java.net.Socket;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executor side of the bridge. Connects to the coordinator, announces itself with {@code hello}
 * and runs incoming requests strictly one at a time on a single worker thread. After an
 * unexpected drop it reconnects with a linearly growing delay.
 */
public class ExecutorClient implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorClient.class);

    public static final String VERSION = "0.1.0";

    private final String host;
    private final int port;
    private final String executorName;
    private final OperationRegistry registry;
    private final int maxFrameBytes;
    private final int maxReconnectAttempts;
    private final Duration reconnectDelay;
    private final EnvelopeCodec codec = new EnvelopeCodec();
    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "executor-worker");
        t.setDaemon(true);
        return t;
    });

    private volatile FrameConnection connection;
    private volatile String sessionId;
    private volatile boolean running;

    public ExecutorClient(String host, int port, String executorName, OperationRegistry registry) {
        this(host, port, executorName, registry, LengthPrefixedCodec.DEFAULT_MAX_FRAME_BYTES, 5, Duration.ofSeconds(1));
    }

    public ExecutorClient(String host, int port, String executorName, OperationRegistry registry, int maxFrameBytes,
                          int maxReconnectAttempts, Duration reconnectDelay) {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.executorName = Objects.requireNonNull(executorName, "executorName");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.maxFrameBytes = maxFrameBytes;
        this.maxReconnectAttempts = maxReconnectAttempts;
        this.reconnectDelay = Objects.requireNonNull(reconnectDelay, "reconnectDelay");
    }

    public void connect() throws IOException {
        running = true;
        openConnection();
    }

    private void openConnection() throws IOException {
        Socket socket = new Socket(host, port);
        FrameConnection frames = new FrameConnection(socket, codec, maxFrameBytes);
        connection = frames;
        Thread readerThread = new Thread(() -> readLoop(frames), "executor-reader");
        readerThread.setDaemon(true);
        readerThread.start();
        frames.write(Envelope.hello(executorName, VERSION));
        LOGGER.info("Connected to {}:{} as {}", host, port, executorName);
    }

    private void readLoop(FrameConnection frames) {
        try {
            while (running) {
                Envelope envelope = frames.read();
                if (envelope == null) {
                    break;
                }
                switch (envelope.type()) {
                    case MessageTypes.CONNECTED -> onSession(envelope.sessionId());
                    case MessageTypes.REQUEST -> submit(frames, envelope.request());
                    case MessageTypes.HEARTBEAT -> frames.write(Envelope.heartbeatAck());
                    case MessageTypes.HEARTBEAT_ACK -> {
                        // nothing to do
                    }
                    default -> LOGGER.warn("Unknown message type {}", envelope.type());
                }
            }
        } catch (IOException e) {
            if (running) {
                LOGGER.warn("Connection error: {}", e.getMessage());
            }
        } finally {
            try {
                frames.close();
            } catch (IOException e) {
                LOGGER.debug("Error closing connection", e);
            }
            if (connection == frames) {
                connection = null;
                onSession(null);
            }
            if (running) {
                reconnect();
            }
        }
    }

    private synchronized void onSession(String sessionId) {
        this.sessionId = sessionId;
        if (sessionId != null) {
            LOGGER.info("Session {} established", sessionId);
        }
        notifyAll();
    }

    private void reconnect() {
        for (int attempt = 1; attempt <= maxReconnectAttempts && running; attempt++) {
            Duration delay = reconnectDelay.multipliedBy(attempt);
            LOGGER.info("Reconnecting in {} ms (attempt {}/{})", delay.toMillis(), attempt, maxReconnectAttempts);
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (!running) {
                return;
            }
            try {
                openConnection();
                return;
            } catch (IOException e) {
                LOGGER.warn("Reconnect attempt {} failed: {}", attempt, e.getMessage());
            }
        }
        if (running) {
            LOGGER.error("Giving up after {} reconnect attempts", maxReconnectAttempts);
            running = false;
        }
    }

    private void submit(FrameConnection frames, RequestEnvelope request) {
        if (request == null || request.id() == null) {
            LOGGER.warn("Request without id ignored");
            return;
        }
        try {
            worker.submit(() -> {
                ReplyEnvelope reply = process(request);
                reply(frames, reply);
                if (!reply.ok()) {
                    forwardLog(frames, "warn", request.kind() + " (" + request.id() + ") failed: " + reply.error());
                }
            });
        } catch (RejectedExecutionException e) {
            LOGGER.warn("Dropping request {}: executor is shutting down", request.id());
        }
    }

    ReplyEnvelope process(RequestEnvelope request) {
        OperationHandler handler = registry.find(request.kind());
        if (handler == null) {
            return ReplyEnvelope.failure(request.id(), "Unknown operation: " + request.kind());
        }
        try {
            return ReplyEnvelope.success(request.id(), handler.handle(request.payload()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ReplyEnvelope.failure(request.id(), "Interrupted while running " + request.kind());
        } catch (Exception e) {
            LOGGER.warn("{} ({}) failed: {}", request.kind(), request.id(), e.toString());
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ReplyEnvelope.failure(request.id(), message);
        }
    }

    private void reply(FrameConnection frames, ReplyEnvelope reply) {
        try {
            try {
                frames.write(Envelope.reply(reply));
            } catch (JsonProcessingException e) {
                frames.write(Envelope.reply(ReplyEnvelope.failure(reply.id(), "Result is not serializable: "
                    + e.getOriginalMessage())));
            }
        } catch (IOException e) {
            LOGGER.warn("Unable to send reply {}: {}", reply.id(), e.getMessage());
        }
    }

    private void forwardLog(FrameConnection frames, String level, String message) {
        try {
            frames.write(Envelope.log(level, message));
        } catch (IOException e) {
            LOGGER.debug("Unable to forward log line: {}", e.getMessage());
        }
    }

    /**
     * Forwards a log line to the coordinator's log.
     */
    public void sendLog(String level, String message) throws IOException {
        FrameConnection frames = connection;
        if (frames == null) {
            throw new IOException("Not connected");
        }
        frames.write(Envelope.log(level, message));
    }

    /**
     * Blocks until the coordinator has acknowledged the {@code hello}.
     *
     * @return whether a session was established within {@code timeout}
     */
    public synchronized boolean awaitSession(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (sessionId == null) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            TimeUnit.NANOSECONDS.timedWait(this, remaining);
        }
        return true;
    }

    public boolean isConnected() {
        return sessionId != null;
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        running = false;
        FrameConnection frames = connection;
        if (frames != null) {
            try {
                frames.close();
            } catch (IOException e) {
                LOGGER.warn("Error closing connection", e);
            }
        }
        worker.shutdownNow();
        LOGGER.info("Executor {} stopped", executorName);
    }
}
