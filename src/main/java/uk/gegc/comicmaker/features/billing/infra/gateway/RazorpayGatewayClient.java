package uk.gegc.comicmaker.features.billing.infra.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;
import uk.gegc.comicmaker.features.billing.application.PaymentGatewayClient;
import uk.gegc.comicmaker.features.billing.config.RazorpayProperties;
import uk.gegc.comicmaker.features.billing.domain.exception.PaymentOrderCreateFailedException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Razorpay Orders API over {@link RestClient} with HTTP basic auth (key id / key secret).
 */
@Slf4j
@Component
public class RazorpayGatewayClient implements PaymentGatewayClient {

    private final RazorpayProperties properties;
    private final RestClient restClient;

    public RazorpayGatewayClient(RazorpayProperties properties, RestClient.Builder restClientBuilder) {
        this.properties = properties;
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getConnectTimeout());
        requestFactory.setReadTimeout(properties.getReadTimeout());
        this.restClient = restClientBuilder
                .baseUrl(properties.getApiBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }

    @Override
    public GatewayOrder createOrder(long amount, String currency, String receipt, Map<String, String> notes) {
        if (properties.getKeyId() == null || properties.getKeySecret() == null) {
            throw new PaymentOrderCreateFailedException("Payment gateway credentials not configured");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("amount", amount);
        body.put("currency", currency);
        body.put("receipt", receipt);
        body.put("payment_capture", 1);
        if (notes != null && !notes.isEmpty()) {
            body.put("notes", notes);
        }

        try {
            JsonNode response = restClient.post()
                    .uri("/orders")
                    .headers(h -> h.setBasicAuth(properties.getKeyId(), properties.getKeySecret()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
            if (response == null || !response.hasNonNull("id")) {
                throw new PaymentOrderCreateFailedException("Payment gateway returned no order id");
            }
            return new GatewayOrder(
                    response.get("id").asText(),
                    response.path("amount").asLong(amount),
                    response.path("currency").asText(currency),
                    response.path("status").asText("created"),
                    response.path("receipt").asText(receipt));
        } catch (RestClientResponseException e) {
            log.error("Payment gateway rejected order creation: status={}", e.getStatusCode().value());
            throw new PaymentOrderCreateFailedException(
                    "Payment gateway rejected order creation", e.getStatusCode().is5xxServerError(), e);
        } catch (ResourceAccessException e) {
            log.error("Payment gateway unreachable: {}", e.getMessage());
            throw new PaymentOrderCreateFailedException("Payment gateway unreachable", true, e);
        }
    }
}
