package dev.bridge.executor;

import java.util.Map;

/**
 * Executes one request kind. The returned value becomes the reply's {@code result}; a thrown
 * exception becomes a failed reply carrying its message.
 */
@FunctionalInterface
public interface OperationHandler {

    Object handle(Map<String, Object> payload) throws Exception;
}
