package com.example.fulfillment.integration;

import com.example.fulfillment.application.dto.OrderView;
import com.example.fulfillment.application.dto.PlaceOrderCommand;
import com.example.fulfillment.application.dto.PlaceOrderCommand.OrderLineDto;
import com.example.fulfillment.application.port.in.LoyaltyLedgerUseCase;
import com.example.fulfillment.application.port.in.LoyaltyQueryUseCase;
import com.example.fulfillment.application.port.in.OrderLifecycleUseCase;
import com.example.fulfillment.application.port.in.PlaceOrderUseCase;
import com.example.fulfillment.application.service.LoyaltySettings;
import com.example.fulfillment.domain.model.OrderStatus;
import com.example.fulfillment.domain.model.TransactionType;
import com.example.fulfillment.infrastructure.persistence.entity.PointsTransactionEntity;
import com.example.fulfillment.infrastructure.persistence.repository.PointsTransactionRepository;
import com.example.fulfillment.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Ledger operations against the real database with the task worker switched off,
 * so only the calls made here touch the ledger.
 */
@DisplayName("Loyalty Ledger Concurrency Tests")
@TestPropertySource(properties = "loyalty.tasks.worker.enabled=false")
class LoyaltyLedgerConcurrencyTest extends IntegrationTestSupport {

    private static final int THREADS = 8;

    @Autowired
    private PlaceOrderUseCase placeOrderUseCase;

    @Autowired
    private OrderLifecycleUseCase orderLifecycleUseCase;

    @Autowired
    private LoyaltyLedgerUseCase loyaltyLedgerUseCase;

    @Autowired
    private LoyaltyQueryUseCase loyaltyQueryUseCase;

    @Autowired
    private PointsTransactionRepository pointsTransactionRepository;

    private Long completedOrder(Long userId, List<OrderLineDto> lines) {
        OrderView order = placeOrderUseCase.placeOrder(new PlaceOrderCommand(userId, "EUR", null, lines, null));
        for (OrderStatus status : List.of(OrderStatus.PROCESSING, OrderStatus.SHIPPED,
                OrderStatus.DELIVERED, OrderStatus.COMPLETED)) {
            orderLifecycleUseCase.changeStatus(order.id(), status, null);
        }
        return order.id();
    }

    @Test
    @DisplayName("should_award_order_points_once_under_concurrent_calls")
    void should_award_order_points_once_under_concurrent_calls() throws Exception {
        // Given
        setting(LoyaltySettings.ENABLED, true);
        Long userId = createUser().getId();
        Long keyboard = createProduct("Mechanical Keyboard", "100.00", 10).getId();
        Long cable = createProduct("USB Cable", "50.00", 10).getId();
        Long orderId = completedOrder(userId, List.of(new OrderLineDto(keyboard, 2), new OrderLineDto(cable, 1)));

        // When
        List<Integer> awarded = runConcurrently(() -> loyaltyLedgerUseCase.awardOrderPoints(orderId));

        // Then
        assertThat(awarded.stream().mapToInt(Integer::intValue).sum()).isEqualTo(250);
        assertThat(awarded).filteredOn(points -> points > 0).hasSize(1);
        assertThat(loyaltyQueryUseCase.getBalance(userId)).isEqualTo(250);
        assertThat(pointsTransactionRepository.findByOrderIdAndTransactionTypeOrderByIdAsc(orderId,
                TransactionType.EARN))
                .extracting(PointsTransactionEntity::getPoints)
                .containsExactly(200, 50);
        assertThat(userAccountRepository.findById(userId))
                .hasValueSatisfying(user -> assertThat(user.getTotalXp()).isEqualTo(250));
    }

    @Test
    @DisplayName("should_deny_new_customer_bonus_without_order_to_returning_customer")
    void should_deny_new_customer_bonus_without_order_to_returning_customer() {
        // Given
        setting(LoyaltySettings.ENABLED, true);
        setting(LoyaltySettings.NEW_CUSTOMER_BONUS_ENABLED, true);
        Long userId = createUser().getId();
        Long productId = createProduct("Notebook", "20.00", 10).getId();
        Long orderId = completedOrder(userId, List.of(new OrderLineDto(productId, 1)));
        loyaltyLedgerUseCase.awardOrderPoints(orderId);

        // When
        int bonus = loyaltyLedgerUseCase.checkNewCustomerBonus(userId, null);

        // Then
        assertThat(bonus).isZero();
        assertThat(loyaltyQueryUseCase.getBalance(userId)).isEqualTo(20);
    }

    @Test
    @DisplayName("should_grant_new_customer_bonus_without_order_to_first_time_customer")
    void should_grant_new_customer_bonus_without_order_to_first_time_customer() {
        // Given
        setting(LoyaltySettings.ENABLED, true);
        setting(LoyaltySettings.NEW_CUSTOMER_BONUS_ENABLED, true);
        setting(LoyaltySettings.NEW_CUSTOMER_BONUS_POINTS, 75);
        Long userId = createUser().getId();

        // When
        int bonus = loyaltyLedgerUseCase.checkNewCustomerBonus(userId, null);

        // Then
        assertThat(bonus).isEqualTo(75);
        assertThat(loyaltyQueryUseCase.getBalance(userId)).isEqualTo(75);
    }

    private List<Integer> runConcurrently(Callable<Integer> attempt) throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < THREADS; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return attempt.call();
                }));
            }
            start.countDown();
            List<Integer> results = new ArrayList<>();
            for (Future<Integer> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }
}
