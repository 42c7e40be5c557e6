package com.tapas.skus.credential.api;

import com.tapas.skus.credential.api.dto.CreateItemCredentialsRequest;
import com.tapas.skus.credential.api.dto.OrderCredentialsResponse;
import com.tapas.skus.credential.api.dto.TimeLimitedV2CredentialsResponse;
import com.tapas.skus.credential.outbox.RetryAfterEstimator;
import com.tapas.skus.credential.service.CredentialIssuanceService;
import com.tapas.skus.credential.service.CredentialQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.headers.Header;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/v1/orders/{orderId}/credentials")
public class CredentialController {

    private final CredentialIssuanceService issuanceService;
    private final CredentialQueryService queryService;
    private final RetryAfterEstimator retryAfterEstimator;

    public CredentialController(CredentialIssuanceService issuanceService,
            CredentialQueryService queryService,
            RetryAfterEstimator retryAfterEstimator) {
        this.issuanceService = issuanceService;
        this.queryService = queryService;
        this.retryAfterEstimator = retryAfterEstimator;
    }

    @Operation(
            summary = "Submit blinded credentials for signing",
            description = "Queues a signing request for a time-limited-v2 item. Resubmitting the same credentials is a no-op.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Queued or already submitted"),
                    @ApiResponse(responseCode = "409", description = "Request id already used with other credentials")
            }
    )
    @PostMapping("/items/{itemId}/batches/{requestId}")
    public ResponseEntity<Void> createItemCredentials(
            @Parameter(description = "Order identifier") @PathVariable UUID orderId,
            @Parameter(description = "Order item identifier") @PathVariable UUID itemId,
            @Parameter(description = "Issuance request identifier") @PathVariable UUID requestId,
            @RequestBody @Valid CreateItemCredentialsRequest request
    ) {
        issuanceService.createOrderCredentials(orderId, itemId, requestId, request.blindedCreds());
        return ResponseEntity.ok().build();
    }

    @Operation(
            summary = "Signed time-limited-v2 credentials of a request",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Unexpired credentials, possibly empty"),
                    @ApiResponse(responseCode = "202", description = "Signing in progress",
                            headers = @Header(name = HttpHeaders.RETRY_AFTER, description = "Seconds to wait"))
            }
    )
    @GetMapping("/items/{itemId}/batches/{requestId}")
    public ResponseEntity<Object> timeLimitedV2Credentials(
            @PathVariable UUID orderId,
            @PathVariable UUID itemId,
            @PathVariable UUID requestId
    ) {
        var lookup = queryService.timeLimitedV2Credentials(orderId, itemId, requestId);
        if (lookup.pending()) {
            return pending();
        }
        return ResponseEntity.ok(lookup.credentials().stream()
                .map(TimeLimitedV2CredentialsResponse::from)
                .toList());
    }

    @Operation(
            summary = "Signed single-use credentials of an item",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Signed credentials"),
                    @ApiResponse(responseCode = "202", description = "Signing in progress",
                            headers = @Header(name = HttpHeaders.RETRY_AFTER, description = "Seconds to wait"))
            }
    )
    @GetMapping("/{itemId}")
    public ResponseEntity<Object> singleUseCredentials(
            @PathVariable UUID orderId,
            @PathVariable UUID itemId
    ) {
        var lookup = queryService.singleUseCredentials(orderId, itemId);
        if (lookup.pending()) {
            return pending();
        }
        return ResponseEntity.ok(OrderCredentialsResponse.from(lookup.credentials().get(0)));
    }

    @Operation(summary = "Delete all credentials and signing requests of an order")
    @DeleteMapping
    public ResponseEntity<Void> deleteOrderCredentials(@PathVariable UUID orderId) {
        issuanceService.deleteOrderCredentials(orderId);
        return ResponseEntity.noContent().build();
    }

    private ResponseEntity<Object> pending() {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterEstimator.estimateSeconds()))
                .body(Map.of());
    }
}
