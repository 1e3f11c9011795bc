package vn.com.fecredit.fileportal.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import vn.com.fecredit.fileportal.service.ChunkedUploadService;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final ChunkedUploadService uploadService;
    private final Clock clock;

    public HealthController(ChunkedUploadService uploadService, Clock clock) {
        this.uploadService = uploadService;
        this.clock = clock;
    }

    @GetMapping("/api/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("storageMode", uploadService.getDefaultMode().name());
        body.put("time", clock.instant().toString());
        return ResponseEntity.ok(body);
    }
}
