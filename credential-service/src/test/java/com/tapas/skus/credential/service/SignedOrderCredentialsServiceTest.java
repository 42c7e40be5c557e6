package com.tapas.skus.credential.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tapas.skus.credential.domain.OrderCreds;
import com.tapas.skus.credential.domain.TimeLimitedV2Creds;
import com.tapas.skus.credential.dto.CredentialMetadata;
import com.tapas.skus.credential.dto.SignedOrderStatus;
import com.tapas.skus.credential.dto.SigningOrderResult;
import com.tapas.skus.credential.dto.SigningOrderResult.SignedOrder;
import com.tapas.skus.credential.exception.DataIntegrityException;
import com.tapas.skus.credential.exception.NotFoundException;
import com.tapas.skus.credential.exception.UpstreamStatusException;
import com.tapas.skus.credential.repository.CredentialStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SignedOrderCredentialsServiceTest {

    private static final Instant VALID_FROM = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant VALID_TO = Instant.parse("2024-03-02T00:00:00Z");

    @Mock
    private CredentialStore credentialStore;

    @Mock
    private OrderExpiryGate orderExpiryGate;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private SignedOrderCredentialsService service;

    private final UUID requestId = UUID.randomUUID();
    private final UUID orderId = UUID.randomUUID();
    private final UUID itemId = UUID.randomUUID();
    private final UUID issuerId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        service = new SignedOrderCredentialsService(credentialStore, orderExpiryGate, objectMapper);
    }

    @Test
    void store_singleUseInsertsCredentialsAndCompletesOutbox() throws Exception {
        when(credentialStore.insertOrderCreds(any(OrderCreds.class))).thenReturn(true);
        when(credentialStore.markOutboxCompleted(eq(requestId), any(Instant.class))).thenReturn(1);

        service.store(result(signed("single-use", SignedOrderStatus.OK, null, null)));

        ArgumentCaptor<OrderCreds> captor = ArgumentCaptor.forClass(OrderCreds.class);
        verify(credentialStore).insertOrderCreds(captor.capture());
        OrderCreds creds = captor.getValue();
        assertThat(creds.itemId()).isEqualTo(itemId);
        assertThat(creds.orderId()).isEqualTo(orderId);
        assertThat(creds.issuerId()).isEqualTo(issuerId);
        assertThat(creds.blindedCreds()).containsExactly("blinded-1", "blinded-2");
        assertThat(creds.signedCreds()).containsExactly("signed-1", "signed-2");
        assertThat(creds.batchProof()).isEqualTo("proof");
        assertThat(creds.publicKey()).isEqualTo("public-key");
        verify(credentialStore).markOutboxCompleted(eq(requestId), any(Instant.class));
    }

    @Test
    void store_singleUseReplayIsSkippedWithoutError() throws Exception {
        when(credentialStore.insertOrderCreds(any(OrderCreds.class))).thenReturn(false);
        when(credentialStore.markOutboxCompleted(eq(requestId), any(Instant.class))).thenReturn(1);

        service.store(result(signed("single-use", SignedOrderStatus.OK, null, null)));

        verify(credentialStore).markOutboxCompleted(eq(requestId), any(Instant.class));
    }

    @Test
    void store_timeLimitedV2InsertsWindowWithinOrderExpiry() throws Exception {
        when(orderExpiryGate.allows(orderId, VALID_FROM)).thenReturn(true);
        when(credentialStore.insertTimeLimitedV2Creds(any(TimeLimitedV2Creds.class))).thenReturn(true);
        when(credentialStore.markOutboxCompleted(eq(requestId), any(Instant.class))).thenReturn(1);

        service.store(result(signed("time-limited-v2", SignedOrderStatus.OK,
                "2024-03-01T00:00:00Z", "2024-03-02T00:00:00Z")));

        ArgumentCaptor<TimeLimitedV2Creds> captor = ArgumentCaptor.forClass(TimeLimitedV2Creds.class);
        verify(credentialStore).insertTimeLimitedV2Creds(captor.capture());
        TimeLimitedV2Creds creds = captor.getValue();
        assertThat(creds.requestId()).isEqualTo(requestId);
        assertThat(creds.validFrom()).isEqualTo(VALID_FROM);
        assertThat(creds.validTo()).isEqualTo(VALID_TO);
        assertThat(creds.signedCreds()).containsExactly("signed-1", "signed-2");
    }

    @Test
    void store_timeLimitedV2ReplayDoesNotFail() throws Exception {
        when(orderExpiryGate.allows(orderId, VALID_FROM)).thenReturn(true);
        when(credentialStore.insertTimeLimitedV2Creds(any(TimeLimitedV2Creds.class))).thenReturn(true, false);
        when(credentialStore.markOutboxCompleted(eq(requestId), any(Instant.class))).thenReturn(1);

        var result = result(signed("time-limited-v2", SignedOrderStatus.OK,
                "2024-03-01T00:00:00Z", "2024-03-02T00:00:00Z"));
        service.store(result);
        service.store(result);

        verify(credentialStore, times(2)).insertTimeLimitedV2Creds(any(TimeLimitedV2Creds.class));
        verify(credentialStore, times(2)).markOutboxCompleted(eq(requestId), any(Instant.class));
    }

    @Test
    void store_timeLimitedV2WindowStartingAfterExpiryIsDropped() throws Exception {
        when(orderExpiryGate.allows(orderId, VALID_FROM)).thenReturn(false);
        when(credentialStore.markOutboxCompleted(eq(requestId), any(Instant.class))).thenReturn(1);

        service.store(result(signed("time-limited-v2", SignedOrderStatus.OK,
                "2024-03-01T00:00:00Z", "2024-03-02T00:00:00Z")));

        verify(credentialStore, never()).insertTimeLimitedV2Creds(any(TimeLimitedV2Creds.class));
        verify(credentialStore).markOutboxCompleted(eq(requestId), any(Instant.class));
    }

    @Test
    void store_timeLimitedV2WithoutOrderExpiryIsDropped() throws Exception {
        when(orderExpiryGate.allows(orderId, VALID_FROM)).thenReturn(false);

        service.store(result(signed("time-limited-v2", SignedOrderStatus.OK,
                "2024-03-01T00:00:00Z", "2024-03-02T00:00:00Z")));

        verify(credentialStore, never()).insertTimeLimitedV2Creds(any(TimeLimitedV2Creds.class));
    }

    @Test
    void store_timeLimitedV2UnknownOrderIsFatal() throws Exception {
        when(orderExpiryGate.allows(orderId, VALID_FROM)).thenThrow(new NotFoundException("order not found"));

        assertThatThrownBy(() -> service.store(result(signed("time-limited-v2", SignedOrderStatus.OK,
                "2024-03-01T00:00:00Z", "2024-03-02T00:00:00Z"))))
                .isInstanceOf(DataIntegrityException.class);
    }

    @Test
    void store_timeLimitedV2MissingValidFromIsFatal() throws Exception {
        assertThatThrownBy(() -> service.store(result(signed("time-limited-v2", SignedOrderStatus.OK,
                null, "2024-03-02T00:00:00Z"))))
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("valid_from");
    }

    @Test
    void store_timeLimitedV2UnparsableValidToIsFatal() throws Exception {
        assertThatThrownBy(() -> service.store(result(signed("time-limited-v2", SignedOrderStatus.OK,
                "2024-03-01T00:00:00Z", "tomorrow"))))
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("valid_to");
    }

    @Test
    void store_emptyResultIsFatal() {
        var empty = new SigningOrderResult(requestId.toString(), List.of());

        assertThatThrownBy(() -> service.store(empty))
                .isInstanceOf(DataIntegrityException.class);
        verify(credentialStore, never()).markOutboxCompleted(any(), any());
    }

    @Test
    void store_nonOkStatusRejectsWholeMessage() throws Exception {
        var ok = signed("single-use", SignedOrderStatus.OK, null, null);
        var rejected = signed("single-use", SignedOrderStatus.INVALID_ISSUER, null, null);
        when(credentialStore.insertOrderCreds(any(OrderCreds.class))).thenReturn(true);

        assertThatThrownBy(() -> service.store(new SigningOrderResult(requestId.toString(), List.of(ok, rejected))))
                .isInstanceOf(UpstreamStatusException.class)
                .satisfies(e -> assertThat(((UpstreamStatusException) e).getStatus())
                        .isEqualTo(SignedOrderStatus.INVALID_ISSUER));
        verify(credentialStore, never()).markOutboxCompleted(any(), any());
    }

    @Test
    void store_missingMetadataIsFatal() {
        var signed = new SignedOrder("public-key", "proof", SignedOrderStatus.OK,
                List.of("signed-1"), List.of("blinded-1"), null, null, null);

        assertThatThrownBy(() -> service.store(new SigningOrderResult(requestId.toString(), List.of(signed))))
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("associated data");
    }

    @Test
    void store_incompleteMetadataIsFatal() throws Exception {
        byte[] metadata = objectMapper.writeValueAsBytes(new CredentialMetadata(itemId, null, issuerId, "single-use"));
        var signed = new SignedOrder("public-key", "proof", SignedOrderStatus.OK,
                List.of("signed-1"), List.of("blinded-1"), null, null, metadata);

        assertThatThrownBy(() -> service.store(new SigningOrderResult(requestId.toString(), List.of(signed))))
                .isInstanceOf(DataIntegrityException.class);
    }

    @Test
    void store_emptySignedTokensIsFatal() throws Exception {
        byte[] metadata = objectMapper.writeValueAsBytes(new CredentialMetadata(itemId, orderId, issuerId, "single-use"));
        var signed = new SignedOrder("public-key", "proof", SignedOrderStatus.OK,
                List.of(), List.of("blinded-1"), null, null, metadata);

        assertThatThrownBy(() -> service.store(new SigningOrderResult(requestId.toString(), List.of(signed))))
                .isInstanceOf(DataIntegrityException.class);
        verify(credentialStore, never()).insertOrderCreds(any());
    }

    @Test
    void store_unknownCredentialTypeIsFatal() throws Exception {
        assertThatThrownBy(() -> service.store(result(signed("multi-use", SignedOrderStatus.OK, null, null))))
                .isInstanceOf(DataIntegrityException.class)
                .hasMessageContaining("multi-use");
    }

    @Test
    void decode_readsSnakeCasePayload() throws Exception {
        String associatedData = java.util.Base64.getEncoder().encodeToString(
                objectMapper.writeValueAsBytes(new CredentialMetadata(itemId, orderId, issuerId, "time-limited-v2")));
        String payload = """
                {"request_id":"%s","data":[{"public_key":"pk","proof":"pr","status":"ok",
                "signed_tokens":["s"],"blinded_tokens":["b"],"valid_from":"2024-03-01T00:00:00Z",
                "valid_to":"2024-03-02T00:00:00Z","associated_data":"%s"}]}
                """.formatted(requestId, associatedData);

        SigningOrderResult decoded = service.decode(payload);

        assertThat(decoded.requestId()).isEqualTo(requestId.toString());
        assertThat(decoded.data()).hasSize(1);
        SignedOrder signed = decoded.data().get(0);
        assertThat(signed.status()).isEqualTo(SignedOrderStatus.OK);
        assertThat(signed.validFrom()).isEqualTo("2024-03-01T00:00:00Z");
        assertThat(objectMapper.readValue(signed.associatedData(), CredentialMetadata.class).orderId())
                .isEqualTo(orderId);
    }

    @Test
    void decode_malformedPayloadIsFatal() {
        assertThatThrownBy(() -> service.decode("{not json"))
                .isInstanceOf(DataIntegrityException.class);
    }

    private SigningOrderResult result(SignedOrder signed) {
        return new SigningOrderResult(requestId.toString(), List.of(signed));
    }

    private SignedOrder signed(String type, SignedOrderStatus status, String validFrom, String validTo)
            throws Exception {
        byte[] metadata = objectMapper.writeValueAsBytes(new CredentialMetadata(itemId, orderId, issuerId, type));
        return new SignedOrder("public-key", "proof", status,
                List.of("signed-1", "signed-2"), List.of("blinded-1", "blinded-2"),
                validTo, validFrom, metadata);
    }
}
