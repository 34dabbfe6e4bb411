package uk.ac.ntu.loopserve.server.data;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide key/value state shared by every request.
 * <p>
 * A missing key takes its default on first access and keeps it until an update replaces it.
 * A {@code null} default stores nothing, so the key stays missing.
 * Updates are not serialized: while an update is pending, readers see the old value,
 * and when two updates race on one key the last one to complete wins.
 */
public final class KeyedDataStore {
    private final ConcurrentHashMap<Object, Object> values = new ConcurrentHashMap<>();

    public KeyedDataStore() {}

    public KeyedDataStore(Map<?, ?> initial) {
        initial.forEach((k, v) -> {
            if (k != null && v != null) values.put(k, v);
        });
    }

    /**
     * Current value, or {@code null} when the key is missing.
     */
    @SuppressWarnings("unchecked")
    public <T> T get(Object key) {
        return (T) values.get(Objects.requireNonNull(key, "key"));
    }

    /**
     * Returns the current value, storing {@code def} first if the key is missing.
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrPut(Object key, T def) {
        Objects.requireNonNull(key, "key");
        if (def == null) return (T) values.get(key);
        Object prev = values.putIfAbsent(key, def);
        return prev == null ? def : (T) prev;
    }

    /**
     * Missing key: stores {@code def} and completes with it.
     * Present key: runs {@code update} on the current value, stores the result once it
     * completes and completes with it. A failed update leaves the stored value as it was
     * and fails the returned stage with the same cause.
     */
    @SuppressWarnings("unchecked")
    public <T> CompletableFuture<T> getOrPut(Object key, T def, DataUpdate<T> update) {
        Objects.requireNonNull(key, "key");
        T current = (T) values.get(key);
        if (current == null) {
            return CompletableFuture.completedFuture(getOrPut(key, def));
        }
        if (update == null) return CompletableFuture.completedFuture(current);

        CompletionStage<T> pending;
        try {
            pending = update.apply(current);
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
        if (pending == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("update for key " + key + " returned no stage"));
        }

        return pending.toCompletableFuture().thenApply(next -> {
            if (next == null) values.remove(key);
            else values.put(key, next);
            return next;
        });
    }

    public boolean containsKey(Object key) {
        return values.containsKey(Objects.requireNonNull(key, "key"));
    }

    public int size() {
        return values.size();
    }
}
