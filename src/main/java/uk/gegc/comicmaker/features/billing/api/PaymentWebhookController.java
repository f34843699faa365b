package uk.gegc.comicmaker.features.billing.api;

import io.swagger.v3.oas.annotations.Hidden;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import uk.gegc.comicmaker.features.billing.application.PaymentWebhookService;
import uk.gegc.comicmaker.shared.config.FeatureFlags;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Tag(name = "Payment Webhooks", description = "Inbound gateway events (not for public use)")
public class PaymentWebhookController {

    static final String SIGNATURE_HEADER = "X-Razorpay-Signature";
    static final String EVENT_ID_HEADER = "X-Razorpay-Event-Id";

    private final PaymentWebhookService webhookService;
    private final FeatureFlags featureFlags;

    @Operation(summary = "Handle payment gateway webhook",
            description = "Verifies the HMAC signature over the raw body and applies the event once.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Event applied, ignored or already processed"),
            @ApiResponse(responseCode = "403", description = "Missing or invalid signature"),
            @ApiResponse(responseCode = "404", description = "Billing feature disabled")
    })
    @Hidden
    @PostMapping("/webhook")
    public ResponseEntity<Map<String, String>> handleWebhook(
            @Parameter(hidden = true) @RequestBody byte[] rawBody,
            @RequestHeader(name = SIGNATURE_HEADER, required = false) String signature,
            @RequestHeader(name = EVENT_ID_HEADER, required = false) String eventId) {
        if (!featureFlags.isBilling()) {
            log.warn("Billing feature is disabled, rejecting webhook");
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }

        var result = webhookService.process(rawBody, signature, eventId);
        return ResponseEntity.ok(switch (result) {
            case OK, IGNORED -> Map.of("status", "ok");
            case DUPLICATE -> Map.of("status", "ok", "message", "Event already processed");
        });
    }
}
