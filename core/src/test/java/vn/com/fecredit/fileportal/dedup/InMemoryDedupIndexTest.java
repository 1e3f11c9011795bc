package vn.com.fecredit.fileportal.dedup;

import org.junit.jupiter.api.Test;
import vn.com.fecredit.fileportal.model.StorageMode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDedupIndexTest {

    private static final String HASH = "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad";

    @Test
    void firstRegistrationWins() {
        InMemoryDedupIndex index = new InMemoryDedupIndex();
        assertEquals(Optional.empty(), index.lookup(HASH, StorageMode.LOCAL));
        assertEquals("a", index.register(HASH, StorageMode.LOCAL, "a"));
        assertEquals("a", index.register(HASH, StorageMode.LOCAL, "b"));
        assertEquals(Optional.of("a"), index.lookup(HASH.toUpperCase(), StorageMode.LOCAL));
    }

    @Test
    void entriesAreScopedPerMode() {
        InMemoryDedupIndex index = new InMemoryDedupIndex();
        index.register(HASH, StorageMode.LOCAL, "local-object");
        assertEquals(Optional.empty(), index.lookup(HASH, StorageMode.REMOTE));
        assertEquals("remote-key", index.register(HASH, StorageMode.REMOTE, "remote-key"));
        assertEquals(2, index.size());
    }

    @Test
    void concurrentRegistrationsAgreeOnOneWinner() throws Exception {
        InMemoryDedupIndex index = new InMemoryDedupIndex();
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<String>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                String location = "object-" + i;
                Callable<String> task = () -> {
                    start.await();
                    return index.register(HASH, StorageMode.LOCAL, location);
                };
                results.add(executor.submit(task));
            }
            start.countDown();
            Set<String> winners = new java.util.HashSet<>();
            for (Future<String> result : results) {
                winners.add(result.get());
            }
            assertEquals(1, winners.size(), "all callers must see the same winner: "
                    + winners.stream().collect(Collectors.joining(",")));
        } finally {
            executor.shutdownNow();
        }
    }
}
