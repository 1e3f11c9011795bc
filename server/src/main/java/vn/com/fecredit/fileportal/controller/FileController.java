package vn.com.fecredit.fileportal.controller;

import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.InputStreamResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;
import vn.com.fecredit.fileportal.model.DownloadLinkResponse;
import vn.com.fecredit.fileportal.model.FileListResponse;
import vn.com.fecredit.fileportal.model.FileRecord;
import vn.com.fecredit.fileportal.model.FileRecordView;
import vn.com.fecredit.fileportal.model.FileUpdateRequest;
import vn.com.fecredit.fileportal.service.ChunkedUploadService;
import vn.com.fecredit.fileportal.service.FileRecordService;
import vn.com.fecredit.fileportal.storage.DownloadReference;

import java.nio.charset.StandardCharsets;
import java.security.Principal;

/**
 * The caller's stored files.
 *
 * <p>
 * Local files are streamed as attachments; files in remote storage are answered with a
 * time-limited direct link.
 */
@RestController
@RequestMapping("/api/files")
public class FileController {
    private static final Logger log = LoggerFactory.getLogger(FileController.class);

    private final FileRecordService fileRecordService;
    private final ChunkedUploadService uploadService;

    public FileController(FileRecordService fileRecordService, ChunkedUploadService uploadService) {
        this.fileRecordService = fileRecordService;
        this.uploadService = uploadService;
    }

    @GetMapping
    public ResponseEntity<FileListResponse> list(@RequestParam(value = "page", defaultValue = "0") int page,
                                                 @RequestParam(value = "size", defaultValue = "20") int size,
                                                 Principal principal) {
        return ResponseEntity.ok(fileRecordService.listFiles(principal.getName(), page, size));
    }

    @GetMapping("/{id}")
    public ResponseEntity<FileRecordView> get(@PathVariable("id") Long id, Principal principal) {
        return ResponseEntity.ok(fileRecordService.getFile(principal.getName(), id));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<FileRecordView> update(@PathVariable("id") Long id, @Valid @RequestBody FileUpdateRequest request,
                                                 Principal principal) {
        return ResponseEntity.ok(fileRecordService.updateFile(principal.getName(), id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") Long id, Principal principal) {
        fileRecordService.deleteFile(principal.getName(), id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/download")
    public ResponseEntity<?> download(@PathVariable("id") Long id, Principal principal) {
        FileRecord record = fileRecordService.recordDownload(principal.getName(), id);
        DownloadReference reference = uploadService.openDownload(record.getStorageMode(), record.getFinalLocation());
        if (reference.isRedirect()) {
            log.debug("Issued download link for file {} valid until {}", id, reference.getExpiresAt());
            return ResponseEntity.ok(new DownloadLinkResponse(reference.getUrl().toString(), reference.getExpiresAt()));
        }
        MediaType mediaType = MediaType.APPLICATION_OCTET_STREAM;
        if (StringUtils.hasText(record.getContentType())) {
            try {
                mediaType = MediaType.parseMediaType(record.getContentType());
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring invalid content type '{}' of file {}", record.getContentType(), id);
            }
        }
        log.debug("Streaming file {} ({} bytes) to {}", id, reference.getSize(), principal.getName());
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                        .filename(record.getFilename(), StandardCharsets.UTF_8)
                        .build()
                        .toString())
                .contentLength(reference.getSize())
                .contentType(mediaType)
                .body(new InputStreamResource(reference.getStream()));
    }
}
