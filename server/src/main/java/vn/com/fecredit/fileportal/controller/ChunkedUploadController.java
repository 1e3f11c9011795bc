package vn.com.fecredit.fileportal.controller;

import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import vn.com.fecredit.fileportal.model.ChunkResponse;
import vn.com.fecredit.fileportal.model.InitRequest;
import vn.com.fecredit.fileportal.model.InitResponse;
import vn.com.fecredit.fileportal.model.UploadSessionView;
import vn.com.fecredit.fileportal.service.ChunkedUploadService;

import java.io.IOException;
import java.security.Principal;

/**
 * REST controller for chunked file uploads.
 *
 * <p>
 * Exposes endpoints for:
 * <ul>
 * <li>Initializing or resuming upload sessions</li>
 * <li>Uploading file chunks</li>
 * <li>Checking upload status</li>
 * <li>Aborting uploads</li>
 * </ul>
 * Errors are rendered by {@link UploadExceptionHandler}.
 */
@RestController
@RequestMapping("/api/upload")
public class ChunkedUploadController {
    private static final Logger log = LoggerFactory.getLogger(ChunkedUploadController.class);

    private final ChunkedUploadService uploadService;

    public ChunkedUploadController(ChunkedUploadService uploadService) {
        this.uploadService = uploadService;
    }

    /**
     * Initializes a new upload session or resumes a broken one.
     *
     * @param req       file details, optionally naming the broken upload to resume
     * @param principal the authenticated user
     * @return session details including the chunks still missing
     */
    @PostMapping("/init")
    public ResponseEntity<InitResponse> initUpload(@Valid @RequestBody InitRequest req, Principal principal) {
        log.debug("Received InitRequest: filename={}, fileSize={}, chunkSize={}", req.getFilename(), req.getFileSize(), req.getChunkSize());
        return ResponseEntity.ok(uploadService.initializeUpload(principal.getName(), req));
    }

    /**
     * Uploads a single chunk for an active upload session. The response to the chunk that
     * completes the file carries the terminal status and the new file id.
     *
     * @param uploadId    upload session ID
     * @param chunkNumber chunk index (0-based)
     * @param file        chunk data
     * @param principal   the authenticated user
     * @throws IOException if the multipart payload cannot be read
     */
    @PostMapping("/chunk")
    public ResponseEntity<ChunkResponse> uploadChunk(
            @RequestParam(value = "uploadId") String uploadId,
            @RequestParam(value = "chunkNumber") int chunkNumber,
            @RequestPart(value = "file") MultipartFile file,
            Principal principal) throws IOException {
        ChunkResponse response = uploadService.acceptChunk(principal.getName(), uploadId, chunkNumber, file.getBytes());
        log.debug("Chunk upload successful for uploadId={}, chunkNumber={}, status={}", uploadId, chunkNumber, response.getStatus());
        return ResponseEntity.ok(response);
    }

    /**
     * Gets the current status of a live or finished upload session.
     */
    @GetMapping("/{uploadId}/status")
    public ResponseEntity<UploadSessionView> getStatus(@PathVariable("uploadId") String uploadId, Principal principal) {
        return ResponseEntity.ok(uploadService.getSessionStatus(principal.getName(), uploadId));
    }

    /**
     * Aborts an upload session and discards its chunks. Repeating the call returns the
     * already-final state.
     */
    @DeleteMapping("/{uploadId}")
    public ResponseEntity<UploadSessionView> abort(@PathVariable("uploadId") String uploadId, Principal principal) {
        return ResponseEntity.ok(uploadService.abortUpload(principal.getName(), uploadId));
    }
}
