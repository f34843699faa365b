package uk.gegc.comicmaker.features.billing.application;

import uk.gegc.comicmaker.features.billing.api.dto.CreateOrderResponse;
import uk.gegc.comicmaker.features.billing.api.dto.OrderStatusResponse;
import uk.gegc.comicmaker.features.plan.domain.model.PlanTier;
import uk.gegc.comicmaker.features.user.domain.model.User;

public interface PaymentService {

    CreateOrderResponse createOrder(User user, PlanTier plan);

    OrderStatusResponse getOrder(User user, String orderId);
}
