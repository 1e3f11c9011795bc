package vn.com.fecredit.fileportal.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import vn.com.fecredit.fileportal.core.UploadCompletedEvent;
import vn.com.fecredit.fileportal.core.UploadCompletionListener;
import vn.com.fecredit.fileportal.exception.FileAccessDeniedException;
import vn.com.fecredit.fileportal.exception.FileRecordNotFoundException;
import vn.com.fecredit.fileportal.model.FileListResponse;
import vn.com.fecredit.fileportal.model.FileRecord;
import vn.com.fecredit.fileportal.model.FileRecordRepository;
import vn.com.fecredit.fileportal.model.FileRecordView;
import vn.com.fecredit.fileportal.model.FileUpdateRequest;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Permanent file metadata: created from completed uploads, then listed, renamed,
 * soft-deleted and downloaded by the owner.
 */
@Service
public class FileRecordService implements UploadCompletionListener {

    private static final Logger log = LoggerFactory.getLogger(FileRecordService.class);

    static final int MAX_PAGE_SIZE = 100;
    private static final int MAX_FILENAME_LENGTH = 255;

    private final FileRecordRepository fileRecordRepository;
    private final Clock clock;

    public FileRecordService(FileRecordRepository fileRecordRepository, Clock clock) {
        this.fileRecordRepository = fileRecordRepository;
        this.clock = clock;
    }

    /**
     * Creates the record of a completed upload. A session yields at most one record, so a
     * repeated event returns the existing id.
     */
    @Override
    public String onUploadCompleted(UploadCompletedEvent event) {
        FileRecord existing = fileRecordRepository.findBySessionId(event.getSessionId()).orElse(null);
        if (existing != null) {
            log.debug("File record {} already exists for upload {}", existing.getId(), event.getSessionId());
            return String.valueOf(existing.getId());
        }
        Instant now = clock.instant();
        FileRecord record = new FileRecord();
        record.setSessionId(event.getSessionId());
        record.setOwnerId(event.getOwnerId());
        record.setOriginalFilename(truncate(event.getFilename()));
        record.setFilename(sanitizeFilename(event.getFilename(), "upload-" + event.getSessionId()));
        record.setContentType(event.getContentType());
        record.setSize(event.getSize());
        record.setContentHash(event.getContentHash());
        record.setStorageMode(event.getStorageMode());
        record.setFinalLocation(event.getFinalLocation());
        record.setUploadedAt(now);
        record.setUpdatedAt(now);
        record = fileRecordRepository.save(record);
        log.info("Created file record {} for upload {} ({} bytes{})", record.getId(), event.getSessionId(),
                event.getSize(), event.isDeduplicated() ? ", deduplicated" : "");
        return String.valueOf(record.getId());
    }

    public FileListResponse listFiles(String ownerId, int page, int size) {
        if (page < 0) {
            throw new IllegalArgumentException("page must not be negative");
        }
        if (size < 1) {
            throw new IllegalArgumentException("size must be positive");
        }
        int pageSize = Math.min(size, MAX_PAGE_SIZE);
        Page<FileRecord> result = fileRecordRepository.findByOwnerIdAndDeletedFalse(ownerId,
                PageRequest.of(page, pageSize, Sort.by(Sort.Direction.DESC, "uploadedAt").and(Sort.by(Sort.Direction.DESC, "id"))));
        List<FileRecordView> items = result.getContent().stream().map(FileRecordService::toView).collect(Collectors.toList());
        return new FileListResponse(items, page, pageSize, result.getTotalElements(), result.getTotalPages());
    }

    public FileRecordView getFile(String ownerId, Long id) {
        return toView(load(ownerId, id));
    }

    /**
     * Renames a file and/or changes its description.
     */
    @Transactional
    public FileRecordView updateFile(String ownerId, Long id, FileUpdateRequest request) {
        FileRecord record = load(ownerId, id);
        if (request.getFilename() == null && request.getDescription() == null) {
            throw new IllegalArgumentException("Nothing to update");
        }
        if (request.getFilename() != null) {
            String name = sanitizeFilename(request.getFilename(), null);
            if (name == null) {
                throw new IllegalArgumentException("Filename must not be empty");
            }
            record.setFilename(name);
        }
        if (request.getDescription() != null) {
            record.setDescription(request.getDescription().isBlank() ? null : request.getDescription().trim());
        }
        record.setUpdatedAt(clock.instant());
        log.info("Updated file record {} of {}", id, ownerId);
        return toView(fileRecordRepository.save(record));
    }

    /**
     * Hides the file from its owner. The stored object is kept since deduplicated records
     * may share it.
     */
    @Transactional
    public void deleteFile(String ownerId, Long id) {
        FileRecord record = load(ownerId, id);
        Instant now = clock.instant();
        record.setDeleted(true);
        record.setDeletedAt(now);
        record.setUpdatedAt(now);
        fileRecordRepository.save(record);
        log.info("Soft-deleted file record {} of {}", id, ownerId);
    }

    /**
     * Counts a download and returns the record to serve it from.
     */
    @Transactional
    public FileRecord recordDownload(String ownerId, Long id) {
        FileRecord record = load(ownerId, id);
        fileRecordRepository.recordDownload(id, clock.instant());
        return record;
    }

    private FileRecord load(String ownerId, Long id) {
        FileRecord record = fileRecordRepository.findByIdAndDeletedFalse(id)
                .orElseThrow(() -> new FileRecordNotFoundException(String.valueOf(id)));
        if (!record.getOwnerId().equals(ownerId)) {
            throw new FileAccessDeniedException(String.valueOf(id));
        }
        return record;
    }

    /**
     * Keeps the last path segment, drops control characters and trims the result.
     *
     * @return the cleaned name, or {@code fallback} when nothing usable is left
     */
    static String sanitizeFilename(String name, String fallback) {
        if (name == null) {
            return fallback;
        }
        String base = name.replace('\\', '/');
        base = base.substring(base.lastIndexOf('/') + 1);
        StringBuilder cleaned = new StringBuilder(base.length());
        for (int i = 0; i < base.length(); i++) {
            char c = base.charAt(i);
            if (!Character.isISOControl(c)) {
                cleaned.append(c);
            }
        }
        String result = cleaned.toString().trim();
        if (result.isEmpty() || result.equals(".") || result.equals("..")) {
            return fallback;
        }
        return truncate(result);
    }

    private static String truncate(String value) {
        return value.length() <= MAX_FILENAME_LENGTH ? value : value.substring(0, MAX_FILENAME_LENGTH);
    }

    static FileRecordView toView(FileRecord record) {
        FileRecordView view = new FileRecordView();
        view.setId(String.valueOf(record.getId()));
        view.setUploadId(record.getSessionId());
        view.setFilename(record.getFilename());
        view.setOriginalFilename(record.getOriginalFilename());
        view.setContentType(record.getContentType());
        view.setSize(record.getSize());
        view.setContentHash(record.getContentHash());
        view.setStorageMode(record.getStorageMode().name());
        view.setDescription(record.getDescription());
        view.setUploadedAt(record.getUploadedAt());
        view.setUpdatedAt(record.getUpdatedAt());
        view.setLastAccessedAt(record.getLastAccessedAt());
        view.setDownloadCount(record.getDownloadCount());
        return view;
    }
}
