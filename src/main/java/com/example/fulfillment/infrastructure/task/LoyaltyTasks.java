package com.example.fulfillment.infrastructure.task;

import com.example.fulfillment.application.dto.OrderView;
import com.example.fulfillment.application.dto.TaskResult;
import com.example.fulfillment.application.port.in.LoyaltyLedgerUseCase;
import com.example.fulfillment.application.port.in.OrderLifecycleUseCase;
import com.example.fulfillment.domain.exception.OrderNotFoundException;
import com.example.fulfillment.domain.exception.UserNotFoundException;
import com.example.fulfillment.domain.model.LoyaltyTier;
import com.example.fulfillment.domain.model.OrderStatus;
import io.github.resilience4j.retry.annotation.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Loyalty tasks executed by the task worker.
 * <p>
 * Every task is idempotent, so a transient failure is simply retried with
 * backoff. Once retries are exhausted, or for a non-retryable domain error,
 * the fallback turns the failure into an error {@link TaskResult}.
 */
@Component
public class LoyaltyTasks {

    private static final Logger log = LoggerFactory.getLogger(LoyaltyTasks.class);
    private static final String RETRY_NAME = "loyaltyTask";

    private final LoyaltyLedgerUseCase ledger;
    private final OrderLifecycleUseCase orders;

    public LoyaltyTasks(LoyaltyLedgerUseCase ledger, OrderLifecycleUseCase orders) {
        this.ledger = ledger;
        this.orders = orders;
    }

    @Retry(name = RETRY_NAME, fallbackMethod = "processOrderPointsFallback")
    public TaskResult processOrderPoints(Long orderId) {
        OrderView order = orders.getOrder(orderId);
        if (!OrderStatus.COMPLETED.name().equals(order.status())) {
            log.warn("Skipping points award for order {} in status {}", orderId, order.status());
            return TaskResult.success(Map.of("order_id", orderId, "points_awarded", 0, "skipped", order.status()));
        }

        int awarded = ledger.awardOrderPoints(orderId);
        int bonus = 0;
        // awarded is 0 when a retry follows a committed award
        if (order.userId() != null && ledger.hasEarnedPoints(orderId)) {
            bonus = ledger.checkNewCustomerBonus(order.userId(), orderId);
            ledger.recalculateTier(order.userId());
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("order_id", orderId);
        data.put("points_awarded", awarded);
        data.put("bonus_points", bonus);
        return TaskResult.success(data);
    }

    @Retry(name = RETRY_NAME, fallbackMethod = "reverseOrderPointsFallback")
    public TaskResult reverseOrderPoints(Long orderId) {
        int reversed = ledger.reverseOrderPoints(orderId);
        return TaskResult.success(Map.of("order_id", orderId, "points_reversed", reversed));
    }

    @Retry(name = RETRY_NAME, fallbackMethod = "recalculateUserTierFallback")
    public TaskResult recalculateUserTier(Long userId) {
        Optional<LoyaltyTier> tier = ledger.recalculateTier(userId);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("user_id", userId);
        data.put("tier", tier.map(LoyaltyTier::name).orElse(null));
        return TaskResult.success(data);
    }

    @Retry(name = RETRY_NAME, fallbackMethod = "processPointsExpirationFallback")
    public TaskResult processPointsExpiration() {
        int created = ledger.processExpiration();
        return TaskResult.success(Map.of("transactions_created", created));
    }

    @SuppressWarnings("unused")
    private TaskResult processOrderPointsFallback(Long orderId, Throwable throwable) {
        log.error("Points award failed for order {}: {}", orderId, throwable.getMessage());
        return TaskResult.error(reasonFor(throwable), Map.of("order_id", orderId));
    }

    @SuppressWarnings("unused")
    private TaskResult reverseOrderPointsFallback(Long orderId, Throwable throwable) {
        log.error("Points reversal failed for order {}: {}", orderId, throwable.getMessage());
        return TaskResult.error(reasonFor(throwable), Map.of("order_id", orderId));
    }

    @SuppressWarnings("unused")
    private TaskResult recalculateUserTierFallback(Long userId, Throwable throwable) {
        log.error("Tier recalculation failed for user {}: {}", userId, throwable.getMessage());
        return TaskResult.error(reasonFor(throwable), Map.of("user_id", userId));
    }

    @SuppressWarnings("unused")
    private TaskResult processPointsExpirationFallback(Throwable throwable) {
        log.error("Points expiration failed: {}", throwable.getMessage());
        return TaskResult.error(reasonFor(throwable));
    }

    private static String reasonFor(Throwable throwable) {
        if (throwable instanceof OrderNotFoundException) {
            return "order_not_found";
        }
        if (throwable instanceof UserNotFoundException) {
            return "user_not_found";
        }
        return throwable.getMessage() != null ? throwable.getMessage() : throwable.getClass().getSimpleName();
    }
}
