package com.browsermux.browser.relay;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiPredicate;

/**
 * Mints ids for a flat, shared id space and remembers what each one stands
 * for until it is taken back.
 *
 * <p>Ids are positive, increase until they wrap at {@link Integer#MAX_VALUE},
 * and are never handed out while a previous use of the same value is still
 * outstanding. {@link #take(int)} returns a payload at most once.
 *
 * @param <T> what each outstanding id maps back to
 */
public class SequenceIdMixer<T> {

    private final AtomicInteger lastId;
    private final ConcurrentMap<Integer, T> outstanding = new ConcurrentHashMap<>();

    public SequenceIdMixer() {
        this(0);
    }

    SequenceIdMixer(int lastId) {
        this.lastId = new AtomicInteger(lastId);
    }

    /**
     * Register a payload under a fresh id.
     */
    public int generate(T payload) {
        Objects.requireNonNull(payload, "payload");
        while (true) {
            int id = advance();
            if (outstanding.putIfAbsent(id, payload) == null) {
                return id;
            }
        }
    }

    /**
     * Mint an id without registering anything. Used for fire-and-forget
     * requests whose responses must match no {@link #take(int)}.
     */
    public int nextSequenceNumber() {
        int id;
        do {
            id = advance();
        } while (outstanding.containsKey(id));
        return id;
    }

    /**
     * Remove and return the payload registered under {@code id}.
     */
    public Optional<T> take(int id) {
        return Optional.ofNullable(outstanding.remove(id));
    }

    /**
     * Drop every outstanding entry the predicate accepts.
     *
     * @return the discarded ids
     */
    public List<Integer> discardIf(BiPredicate<Integer, T> predicate) {
        List<Integer> discarded = new ArrayList<>();
        for (Map.Entry<Integer, T> entry : outstanding.entrySet()) {
            if (predicate.test(entry.getKey(), entry.getValue())
                    && outstanding.remove(entry.getKey(), entry.getValue())) {
                discarded.add(entry.getKey());
            }
        }
        return discarded;
    }

    public int outstanding() {
        return outstanding.size();
    }

    public void clear() {
        outstanding.clear();
    }

    private int advance() {
        return lastId.updateAndGet(x -> x == Integer.MAX_VALUE ? 1 : x + 1);
    }
}
