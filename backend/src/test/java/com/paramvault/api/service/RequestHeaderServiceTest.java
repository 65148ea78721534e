package com.paramvault.api.service;

import com.paramvault.api.exception.PoolExhaustedException;
import com.paramvault.api.exception.RefillFailedException;
import com.paramvault.api.util.SecureRandomUtils;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@DisplayName("RequestHeaderService")
@ExtendWith(MockitoExtension.class)
class RequestHeaderServiceTest {

    @Mock private CredentialPoolManager credentialPoolManager;
    @Mock private SecureRandomUtils secureRandomUtils;

    @InjectMocks
    private RequestHeaderService requestHeaderService;

    @Test
    @DisplayName("should combine a pooled credential with a fresh traceparent")
    void shouldBuildHeaders() {
        when(credentialPoolManager.getCredential()).thenReturn("cred-1");
        when(secureRandomUtils.generateTraceparent())
                .thenReturn("00-4bf92f3577b34da6a3ce929d0e0e4736-00f067aa0ba902b7-01");

        Map<String, String> headers = requestHeaderService.headers();

        assertThat(headers).containsExactly(
                Map.entry("specialencodeparam", "cred-1"),
                Map.entry("traceparent", "00-4bf92f3577b34da6a3ce929d0e0e4736-00f067aa0ba902b7-01"));
    }

    @Test
    @DisplayName("should propagate refill failures")
    void shouldPropagateRefillFailure() {
        when(credentialPoolManager.getCredential()).thenThrow(new RefillFailedException("empty batch", new PoolExhaustedException("pool empty")));

        assertThatThrownBy(requestHeaderService::headers).isInstanceOf(RefillFailedException.class);
        verify(secureRandomUtils, never()).generateTraceparent();
    }
}
