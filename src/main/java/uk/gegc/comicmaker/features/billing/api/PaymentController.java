package uk.gegc.comicmaker.features.billing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;
import uk.gegc.comicmaker.features.billing.api.dto.CreateOrderRequest;
import uk.gegc.comicmaker.features.billing.api.dto.CreateOrderResponse;
import uk.gegc.comicmaker.features.billing.api.dto.OrderStatusResponse;
import uk.gegc.comicmaker.features.billing.application.PaymentService;
import uk.gegc.comicmaker.features.user.application.CurrentUserResolver;
import uk.gegc.comicmaker.features.user.domain.model.User;
import uk.gegc.comicmaker.shared.config.FeatureFlags;

@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Plan purchase orders")
@SecurityRequirement(name = "bearerAuth")
public class PaymentController {

    private final PaymentService paymentService;
    private final CurrentUserResolver currentUserResolver;
    private final FeatureFlags featureFlags;

    @Operation(summary = "Create a payment order", description = "Creates a gateway order for PRO or CREATIVE. The amount comes from server configuration.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Order created",
                    content = @Content(schema = @Schema(implementation = CreateOrderResponse.class))),
            @ApiResponse(responseCode = "400", description = "Plan cannot be purchased",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Billing feature disabled"),
            @ApiResponse(responseCode = "502", description = "Gateway rejected the order",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/orders")
    public ResponseEntity<CreateOrderResponse> createOrder(@Valid @RequestBody CreateOrderRequest request,
                                                           Authentication authentication) {
        if (!featureFlags.isBilling()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        User user = currentUserResolver.resolve(authentication);
        return ResponseEntity.status(HttpStatus.CREATED).body(paymentService.createOrder(user, request.plan()));
    }

    @Operation(summary = "Get payment order status")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Order found"),
            @ApiResponse(responseCode = "404", description = "Order not found for this user",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/orders/{orderId}")
    public ResponseEntity<OrderStatusResponse> getOrder(
            @Parameter(description = "Gateway order id", required = true) @PathVariable String orderId,
            Authentication authentication) {
        if (!featureFlags.isBilling()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).build();
        }
        User user = currentUserResolver.resolve(authentication);
        return ResponseEntity.ok(paymentService.getOrder(user, orderId));
    }
}
