package com.paramvault.api.controller;

import com.paramvault.api.generator.CredentialGenerator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@Tag(name = "Health", description = "Liveness check")
public class HealthController {

    private final CredentialGenerator credentialGenerator;

    @GetMapping("/health")
    @Operation(summary = "Service liveness and generator state")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", "paramvault-api");
        body.put("generator", credentialGenerator.state().name());
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(body);
    }
}
