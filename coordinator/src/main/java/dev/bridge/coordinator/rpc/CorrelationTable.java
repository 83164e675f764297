package dev.bridge.coordinator.rpc;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-flight calls keyed by request id. Insertion order is kept for diagnostics only; lookups are
 * by id. Callers complete the returned calls' futures after the lock is released.
 */
public class CorrelationTable {

    private final Map<String, PendingCall> pending = new LinkedHashMap<>();

    public synchronized void register(PendingCall call) {
        if (pending.putIfAbsent(call.id(), call) != null) {
            throw new IllegalStateException("Duplicate request id " + call.id());
        }
    }

    /**
     * Removes and returns the call for {@code id}, or {@code null} if it was already retired.
     */
    public synchronized PendingCall take(String id) {
        return pending.remove(id);
    }

    /**
     * Removes {@code call} only if it is still the entry registered under its id.
     */
    public synchronized boolean remove(PendingCall call) {
        return pending.remove(call.id(), call);
    }

    public synchronized List<PendingCall> drain() {
        List<PendingCall> drained = new ArrayList<>(pending.values());
        pending.clear();
        return drained;
    }

    public synchronized int size() {
        return pending.size();
    }

    public synchronized List<PendingCall> snapshot() {
        return List.copyOf(pending.values());
    }
}
