package dev.bridge.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple helper for logging framed traffic in a consistent format so that coordinator and
 * executor logs look identical. Heartbeats are only logged at debug level.
 */
public final class Wire {

    private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");

    private static final int MAX_LOGGED_CHARS = 200;

    private Wire() {
    }

    public static void rx(String connectionId, Envelope envelope, String frame) {
        log("RX", connectionId, envelope, frame);
    }

    public static void tx(String connectionId, Envelope envelope, String frame) {
        log("TX", connectionId, envelope, frame);
    }

    private static void log(String direction, String connectionId, Envelope envelope, String frame) {
        if (MessageTypes.isHeartbeat(envelope.type())) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("{} conn={} type={}", direction, connectionId, envelope.type());
            }
            return;
        }
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("{} conn={} type={} id={} kind={} json={}",
                direction,
                connectionId,
                envelope.type(),
                correlationId(envelope),
                envelope.request() != null ? envelope.request().kind() : null,
                truncate(frame, MAX_LOGGED_CHARS));
        }
    }

    static String correlationId(Envelope envelope) {
        if (envelope.request() != null) {
            return envelope.request().id();
        }
        if (envelope.reply() != null) {
            return envelope.reply().id();
        }
        return null;
    }

    static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
