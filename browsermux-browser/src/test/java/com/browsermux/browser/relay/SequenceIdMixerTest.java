package com.browsermux.browser.relay;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SequenceIdMixerTest {

    @Test
    void generate_returnsIncreasingNonZeroIds() {
        SequenceIdMixer<String> mixer = new SequenceIdMixer<>();

        int first = mixer.generate("a");
        int second = mixer.generate("b");

        assertTrue(first > 0);
        assertTrue(second > first);
        assertEquals(2, mixer.outstanding());
    }

    @Test
    void take_returnsPayloadExactlyOnce() {
        SequenceIdMixer<String> mixer = new SequenceIdMixer<>();
        int id = mixer.generate("payload");

        assertEquals(Optional.of("payload"), mixer.take(id));
        assertEquals(Optional.empty(), mixer.take(id));
        assertEquals(Optional.empty(), mixer.take(id + 1000));
        assertEquals(0, mixer.outstanding());
    }

    @Test
    void generate_wrapsToOneAfterMaxValue() {
        SequenceIdMixer<String> mixer = new SequenceIdMixer<>(Integer.MAX_VALUE - 1);

        assertEquals(Integer.MAX_VALUE, mixer.generate("a"));
        assertEquals(1, mixer.generate("b"));
    }

    @Test
    void nextSequenceNumber_isNotRegistered() {
        SequenceIdMixer<String> mixer = new SequenceIdMixer<>();
        int requestId = mixer.generate("a");

        int internalId = mixer.nextSequenceNumber();

        assertNotEquals(requestId, internalId);
        assertTrue(mixer.take(internalId).isEmpty());
        assertEquals(1, mixer.outstanding());
    }

    @Test
    void discardIf_removesMatchingEntries() {
        SequenceIdMixer<String> mixer = new SequenceIdMixer<>();
        int a1 = mixer.generate("a");
        int b1 = mixer.generate("b");
        int a2 = mixer.generate("a");

        List<Integer> discarded = mixer.discardIf((id, payload) -> payload.equals("a"));

        assertEquals(Set.of(a1, a2), Set.copyOf(discarded));
        assertTrue(mixer.take(a1).isEmpty());
        assertEquals(Optional.of("b"), mixer.take(b1));
    }

    @Test
    void generate_rejectsNullPayload() {
        SequenceIdMixer<String> mixer = new SequenceIdMixer<>();
        assertThrows(NullPointerException.class, () -> mixer.generate(null));
    }

    @Test
    void concurrentGenerate_neverHandsOutTheSameId() throws Exception {
        SequenceIdMixer<Integer> mixer = new SequenceIdMixer<>();
        int threads = 8;
        int perThread = 5_000;
        Set<Integer> seen = ConcurrentHashMap.newKeySet();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int worker = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        assertTrue(seen.add(mixer.generate(worker)), "duplicate id");
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(threads * perThread, seen.size());
        assertEquals(threads * perThread, mixer.outstanding());
        assertFalse(seen.contains(0));
    }
}
