package com.csd.vulnscan.controller;

import com.csd.vulnscan.config.ScannerProperties;
import com.csd.vulnscan.model.LockfileMode;
import com.csd.vulnscan.model.ScanOptions;
import com.csd.vulnscan.model.ScanResult;
import com.csd.vulnscan.service.ScanService;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Slf4j
public class ScanController {

    private final ScanService scanService;
    private final ScannerProperties properties;

    public ScanController(ScanService scanService, ScannerProperties properties) {
        this.scanService = scanService;
        this.properties = properties;
    }

    @PostMapping("/scan")
    public ResponseEntity<ScanResult> scan(@RequestBody ScanRequest request) {
        if (request.getPath() == null || request.getPath().isBlank()) {
            throw new IllegalArgumentException("path is required");
        }
        ScanOptions options = ScanOptions.builder()
                .includeDev(request.isIncludeDev())
                .lockfileMode(request.getLockfileMode())
                .concurrency(request.getConcurrency() != null
                        ? request.getConcurrency()
                        : properties.getScan().getDefaultConcurrency())
                .ignoreFilePath(request.getIgnoreFile() == null ? null : Path.of(request.getIgnoreFile()))
                .checkMaintenance(request.isCheckMaintenance())
                .build();
        log.info("Scan requested for {}", request.getPath());
        return ResponseEntity.ok(scanService.scan(Path.of(request.getPath()), options));
    }

    @GetMapping("/supported-files")
    public Map<String, List<String>> supportedFiles() {
        return Map.of("files", scanService.listSupportedManifestFilenames());
    }

    @Data
    public static class ScanRequest {
        private String path;
        private boolean includeDev;
        private LockfileMode lockfileMode;
        private Integer concurrency;
        private String ignoreFile;
        private boolean checkMaintenance;
    }
}
