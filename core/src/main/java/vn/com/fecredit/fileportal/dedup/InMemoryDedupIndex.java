package vn.com.fecredit.fileportal.dedup;

import vn.com.fecredit.fileportal.model.StorageMode;

import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryDedupIndex implements DedupIndex {

    private final ConcurrentMap<String, String> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<String> lookup(String contentHash, StorageMode mode) {
        return Optional.ofNullable(entries.get(key(contentHash, mode)));
    }

    @Override
    public String register(String contentHash, StorageMode mode, String location) {
        String previous = entries.putIfAbsent(key(contentHash, mode), location);
        return previous != null ? previous : location;
    }

    public int size() {
        return entries.size();
    }

    private static String key(String contentHash, StorageMode mode) {
        return mode.name() + ':' + contentHash.toLowerCase(Locale.ROOT);
    }
}
