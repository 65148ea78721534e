package com.paramvault.api.controller;

import com.paramvault.api.model.dto.PoolStatusResponse;
import com.paramvault.api.service.CredentialPoolManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/internal/pool")
@RequiredArgsConstructor
@Tag(name = "Credential Pool", description = "Internal credential pool inspection and control")
public class PoolController {

    private final CredentialPoolManager credentialPoolManager;

    /**
     * GET /internal/pool
     */
    @GetMapping
    @Operation(summary = "Get credential pool and generator status")
    public ResponseEntity<PoolStatusResponse> getStatus() {
        return ResponseEntity.ok(credentialPoolManager.status());
    }

    /**
     * Starts the generator ahead of demand.
     * POST /internal/pool/prime?warmUp=true
     */
    @PostMapping("/prime")
    @Operation(summary = "Start the credential generator, optionally followed by a warm-up")
    public ResponseEntity<PoolStatusResponse> prime(@RequestParam(defaultValue = "false") boolean warmUp) {
        log.info("Priming credential generator (warmUp={})", warmUp);
        credentialPoolManager.prime(warmUp);
        return ResponseEntity.ok(credentialPoolManager.status());
    }

    /**
     * POST /internal/pool/warmup
     */
    @PostMapping("/warmup")
    @Operation(summary = "Trigger a background pool warm-up")
    public ResponseEntity<Map<String, Object>> warmUp() {
        boolean triggered = credentialPoolManager.triggerWarmUp();
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("triggered", triggered));
    }
}
