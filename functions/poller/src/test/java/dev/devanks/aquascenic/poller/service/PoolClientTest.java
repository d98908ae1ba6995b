// functions/poller/src/test/java/dev/devanks/aquascenic/poller/service/PoolClientTest.java
package dev.devanks.aquascenic.poller.service;

import dev.devanks.aquascenic.poller.client.FirestoreClient;
import dev.devanks.aquascenic.poller.codec.DocumentCodec;
import dev.devanks.aquascenic.poller.exception.PoolApiException;
import dev.devanks.aquascenic.poller.exception.PoolAuthException;
import dev.devanks.aquascenic.poller.model.FirestoreDocument;
import dev.devanks.aquascenic.poller.model.TypedValue;
import dev.devanks.aquascenic.poller.session.SessionManager;
import feign.FeignException;
import feign.Request;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PoolClientTest {

    @Mock
    private FirestoreClient mockFirestoreClient;
    @Mock
    private SessionManager mockSessionManager;

    @Captor
    private ArgumentCaptor<FirestoreDocument> patchCaptor;

    private PoolClient poolClient;

    private static final String POOL_ID = "pool-1";

    @BeforeEach
    void setUp() {
        poolClient = new PoolClient(mockFirestoreClient, mockSessionManager, new DocumentCodec());
    }

    @Test
    @DisplayName("fetch - Success returns the decoded, flattened document")
    void fetch_Success() {
        // Arrange
        when(mockSessionManager.ensureValid()).thenReturn("token-1");
        when(mockFirestoreClient.getPool("Bearer token-1", POOL_ID)).thenReturn(poolDocument());

        // Act
        Map<String, Object> data = poolClient.fetch(POOL_ID);

        // Assert
        assertThat(data)
                .containsEntry("present", true)
                .containsEntry("main_temperature", 28.5)
                .containsEntry("modules_ph_current", 740L)
                .containsEntry("filtration_mode", 1L);
        verify(mockSessionManager, never()).invalidate();
    }

    @Test
    @DisplayName("fetch - 401 re-authenticates and retries exactly once")
    void fetch_Unauthorized_RetriesOnce() {
        // Arrange
        when(mockSessionManager.ensureValid()).thenReturn("token-1", "token-2");
        when(mockFirestoreClient.getPool("Bearer token-1", POOL_ID)).thenThrow(feignError(401));
        when(mockFirestoreClient.getPool("Bearer token-2", POOL_ID)).thenReturn(poolDocument());

        // Act
        Map<String, Object> data = poolClient.fetch(POOL_ID);

        // Assert
        assertThat(data).containsEntry("modules_ph_current", 740L);
        verify(mockSessionManager, times(1)).invalidate();
        verify(mockFirestoreClient, times(2)).getPool(anyString(), eq(POOL_ID));
    }

    @Test
    @DisplayName("fetch - 403 on the retry as well surfaces an API error")
    void fetch_ForbiddenTwice_Fails() {
        // Arrange
        when(mockSessionManager.ensureValid()).thenReturn("token-1", "token-2");
        when(mockFirestoreClient.getPool(anyString(), eq(POOL_ID))).thenThrow(feignError(403));

        // Act & Assert
        assertThatThrownBy(() -> poolClient.fetch(POOL_ID))
                .isInstanceOf(PoolApiException.class)
                .isNotInstanceOf(PoolAuthException.class)
                .hasMessage("Failed to fetch pool data after re-authentication: HTTP 403")
                .extracting("statusCode").isEqualTo(403);
        verify(mockSessionManager, times(1)).invalidate();
        verify(mockFirestoreClient, times(2)).getPool(anyString(), eq(POOL_ID));
    }

    @Test
    @DisplayName("fetch - Server error is not retried")
    void fetch_ServerError_NoRetry() {
        // Arrange
        when(mockSessionManager.ensureValid()).thenReturn("token-1");
        when(mockFirestoreClient.getPool("Bearer token-1", POOL_ID)).thenThrow(feignError(503));

        // Act & Assert
        assertThatThrownBy(() -> poolClient.fetch(POOL_ID))
                .isInstanceOf(PoolApiException.class)
                .hasMessage("Failed to fetch pool data: HTTP 503")
                .extracting("statusCode").isEqualTo(503);
        verify(mockSessionManager, never()).invalidate();
        verify(mockFirestoreClient, times(1)).getPool(anyString(), anyString());
    }

    @Test
    @DisplayName("fetch - Session failure propagates as an auth error")
    void fetch_SessionFailure() {
        // Arrange
        when(mockSessionManager.ensureValid())
                .thenThrow(new PoolAuthException("Authentication failed: INVALID_PASSWORD", 400));

        // Act & Assert
        assertThatThrownBy(() -> poolClient.fetch(POOL_ID)).isInstanceOf(PoolAuthException.class);
        verifyNoInteractions(mockFirestoreClient);
    }

    @Test
    @DisplayName("write - PATCH carries the nested field and an update mask for the path only")
    void write_Success() {
        // Arrange
        when(mockSessionManager.ensureValid()).thenReturn("token-1");

        // Act
        poolClient.write(POOL_ID, "hidro.level", 50L);

        // Assert
        verify(mockFirestoreClient).patchPool(eq("Bearer token-1"), eq(POOL_ID), eq("hidro.level"),
                patchCaptor.capture());
        FirestoreDocument patch = patchCaptor.getValue();
        assertThat(patch.getName()).isNull();
        assertThat(patch.getFields()).containsOnlyKeys("hidro");
        assertThat(patch.getFields().get("hidro"))
                .isEqualTo(TypedValue.ofMap(Map.of("level", TypedValue.ofInteger(50L))));
    }

    @Test
    @DisplayName("write - 401 drops the session and fails without retry")
    void write_Unauthorized() {
        // Arrange
        when(mockSessionManager.ensureValid()).thenReturn("token-1");
        when(mockFirestoreClient.patchPool(anyString(), anyString(), anyString(), any(FirestoreDocument.class)))
                .thenThrow(feignError(401));

        // Act & Assert
        assertThatThrownBy(() -> poolClient.write(POOL_ID, "filtration.mode", 3L))
                .isInstanceOf(PoolApiException.class)
                .hasMessage("Failed to write filtration.mode: HTTP 401");
        verify(mockSessionManager).invalidate();
        verify(mockFirestoreClient, times(1))
                .patchPool(anyString(), anyString(), anyString(), any(FirestoreDocument.class));
    }

    @Test
    @DisplayName("testCredentials - Rejected sign-in reports false")
    void testCredentials_Rejected() {
        when(mockSessionManager.authenticate()).thenThrow(new PoolAuthException("Authentication failed: INVALID_PASSWORD"));

        assertThat(poolClient.testCredentials()).isFalse();
    }

    @Test
    @DisplayName("testConnection - Unknown pool reports false")
    void testConnection_UnknownPool() {
        when(mockSessionManager.ensureValid()).thenReturn("token-1");
        when(mockFirestoreClient.getPool("Bearer token-1", "nope")).thenThrow(feignError(404));

        assertThat(poolClient.testConnection("nope")).isFalse();
    }

    @Test
    @DisplayName("testConnection - Readable pool reports true")
    void testConnection_Success() {
        when(mockSessionManager.ensureValid()).thenReturn("token-1");
        when(mockFirestoreClient.getPool("Bearer token-1", POOL_ID)).thenReturn(poolDocument());

        assertThat(poolClient.testConnection(POOL_ID)).isTrue();
    }

    private static FirestoreDocument poolDocument() {
        return FirestoreDocument.builder()
                .name("projects/hayward-europe/databases/(default)/documents/pools/" + POOL_ID)
                .fields(Map.of(
                        "present", TypedValue.ofBoolean(true),
                        "main", TypedValue.ofMap(Map.of("temperature", TypedValue.ofDouble(28.5))),
                        "modules", TypedValue.ofMap(Map.of(
                                "ph", TypedValue.ofMap(Map.of("current", TypedValue.ofInteger("740"))))),
                        "filtration", TypedValue.ofMap(Map.of("mode", TypedValue.ofInteger("1")))))
                .updateTime("2024-05-01T10:00:00Z")
                .build();
    }

    private static FeignException feignError(int status) {
        Request request = Request.create(Request.HttpMethod.GET, "/fake", Collections.emptyMap(), null,
                StandardCharsets.UTF_8, null);
        switch (status) {
            case 401:
                return new FeignException.Unauthorized("Unauthorized", request, null, Collections.emptyMap());
            case 403:
                return new FeignException.Forbidden("Forbidden", request, null, Collections.emptyMap());
            case 404:
                return new FeignException.NotFound("Not Found", request, null, Collections.emptyMap());
            default:
                return new FeignException.ServiceUnavailable("Service down", request, null, Collections.emptyMap());
        }
    }
}
