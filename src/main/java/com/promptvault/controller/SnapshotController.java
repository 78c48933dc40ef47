package com.promptvault.controller;

import com.promptvault.model.dto.ImportResult;
import com.promptvault.service.SnapshotService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Backup and migration: export the whole library, import a snapshot.
 */
@Slf4j
@RestController
@RequestMapping("/v1/snapshot")
public class SnapshotController {

    private final SnapshotService snapshotService;

    public SnapshotController(SnapshotService snapshotService) {
        this.snapshotService = snapshotService;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> exportSnapshot() {
        log.info("Snapshot export requested");
        return ResponseEntity.ok(snapshotService.exportSnapshot());
    }

    /**
     * Import a snapshot. The body is the raw snapshot text (wrapped object or bare list).
     */
    @PostMapping
    public ResponseEntity<ImportResult> importSnapshot(@RequestBody String snapshot) {
        log.info("Snapshot import requested: {} chars", snapshot.length());
        return ResponseEntity.ok(snapshotService.importSnapshot(snapshot));
    }
}
