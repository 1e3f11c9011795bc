package vn.com.fecredit.fileportal.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import vn.com.fecredit.fileportal.dedup.DedupIndex;
import vn.com.fecredit.fileportal.model.DedupEntry;
import vn.com.fecredit.fileportal.model.DedupEntryRepository;
import vn.com.fecredit.fileportal.model.StorageMode;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;

/**
 * Database-backed dedup index. The unique constraint on (content_hash, storage_mode) makes
 * registration an atomic insert-if-absent across threads and instances.
 */
@Component
public class JpaDedupIndex implements DedupIndex {

    private static final Logger log = LoggerFactory.getLogger(JpaDedupIndex.class);

    private final DedupEntryRepository repository;
    private final Clock clock;

    public JpaDedupIndex(DedupEntryRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public Optional<String> lookup(String contentHash, StorageMode mode) {
        return repository.findByContentHashAndStorageMode(normalize(contentHash), mode).map(DedupEntry::getLocation);
    }

    @Override
    public String register(String contentHash, StorageMode mode, String location) {
        String hash = normalize(contentHash);
        Optional<DedupEntry> existing = repository.findByContentHashAndStorageMode(hash, mode);
        if (existing.isPresent()) {
            return existing.get().getLocation();
        }
        try {
            repository.saveAndFlush(new DedupEntry(hash, mode, location, clock.instant()));
            log.debug("Registered {} object {} for hash {}", mode, location, hash);
            return location;
        } catch (DataIntegrityViolationException e) {
            // another merge registered the same content first
            log.debug("Lost dedup registration for hash {}: {}", hash, e.getMessage());
            return repository.findByContentHashAndStorageMode(hash, mode)
                    .map(DedupEntry::getLocation)
                    .orElseThrow(() -> e);
        }
    }

    private static String normalize(String contentHash) {
        return contentHash.toLowerCase(Locale.ROOT);
    }
}
