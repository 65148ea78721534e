package com.paramvault.api.service;

import com.paramvault.api.util.SecureRandomUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the dynamic headers every outbound remote API request needs:
 * a pooled credential and a fresh trace identifier.
 */
@Service
@RequiredArgsConstructor
public class RequestHeaderService {

    public static final String CREDENTIAL_HEADER = "specialencodeparam";
    public static final String TRACEPARENT_HEADER = "traceparent";

    private final CredentialPoolManager credentialPoolManager;
    private final SecureRandomUtils secureRandomUtils;

    public Map<String, String> headers() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(CREDENTIAL_HEADER, credentialPoolManager.getCredential());
        headers.put(TRACEPARENT_HEADER, secureRandomUtils.generateTraceparent());
        return headers;
    }
}
