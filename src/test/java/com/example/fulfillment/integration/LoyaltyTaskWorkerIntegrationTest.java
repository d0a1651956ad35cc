package com.example.fulfillment.integration;

import com.example.fulfillment.application.dto.OrderView;
import com.example.fulfillment.application.dto.PlaceOrderCommand;
import com.example.fulfillment.application.dto.PlaceOrderCommand.OrderLineDto;
import com.example.fulfillment.application.port.in.LoyaltyQueryUseCase;
import com.example.fulfillment.application.port.in.OrderLifecycleUseCase;
import com.example.fulfillment.application.port.in.PlaceOrderUseCase;
import com.example.fulfillment.application.port.out.TaskQueuePort;
import com.example.fulfillment.application.port.out.TaskQueuePort.TaskType;
import com.example.fulfillment.application.service.LoyaltySettings;
import com.example.fulfillment.domain.model.OrderStatus;
import com.example.fulfillment.infrastructure.config.LoyaltyTasksEndpoint;
import com.example.fulfillment.infrastructure.persistence.entity.LoyaltyTaskEntity;
import com.example.fulfillment.infrastructure.persistence.entity.LoyaltyTaskStatus;
import com.example.fulfillment.infrastructure.persistence.repository.LoyaltyTaskRepository;
import com.example.fulfillment.infrastructure.task.LoyaltyTaskWorker;
import com.example.fulfillment.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Integration tests for the loyalty task queue: lifecycle events enqueue tasks,
 * the worker runs them and records the outcome.
 */
@DisplayName("Loyalty Task Worker Integration Tests")
class LoyaltyTaskWorkerIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private PlaceOrderUseCase placeOrderUseCase;

    @Autowired
    private OrderLifecycleUseCase orderLifecycleUseCase;

    @Autowired
    private LoyaltyQueryUseCase loyaltyQueryUseCase;

    @Autowired
    private TaskQueuePort taskQueue;

    @Autowired
    private LoyaltyTaskRepository taskRepository;

    @Autowired
    private LoyaltyTasksEndpoint loyaltyTasksEndpoint;

    @Autowired
    private LoyaltyTaskWorker loyaltyTaskWorker;

    private Long placeAndComplete(Long userId, Long productId, int quantity) {
        OrderView order = placeOrderUseCase.placeOrder(new PlaceOrderCommand(userId, "EUR", null,
                List.of(new OrderLineDto(productId, quantity)), null));
        for (OrderStatus status : List.of(OrderStatus.PROCESSING, OrderStatus.SHIPPED,
                OrderStatus.DELIVERED, OrderStatus.COMPLETED)) {
            orderLifecycleUseCase.changeStatus(order.id(), status, null);
        }
        return order.id();
    }

    private LoyaltyTaskEntity awaitTask(String aggregateId, TaskType type, LoyaltyTaskStatus status) {
        await().atMost(10, TimeUnit.SECONDS)
                .pollInterval(200, TimeUnit.MILLISECONDS)
                .untilAsserted(() -> assertThat(taskRepository.findByAggregateIdAndTaskType(aggregateId, type))
                        .singleElement()
                        .extracting(LoyaltyTaskEntity::getStatus)
                        .isEqualTo(status));
        return taskRepository.findByAggregateIdAndTaskType(aggregateId, type).get(0);
    }

    @Test
    @DisplayName("should_award_points_after_order_completion")
    void should_award_points_after_order_completion() {
        // Given
        setting(LoyaltySettings.ENABLED, true);
        Long userId = createUser().getId();
        Long productId = createProduct("Espresso Machine", "100.00", 10).getId();

        // When
        Long orderId = placeAndComplete(userId, productId, 2);

        // Then
        LoyaltyTaskEntity task = awaitTask(orderId.toString(), TaskType.PROCESS_ORDER_POINTS,
                LoyaltyTaskStatus.PROCESSED);
        assertThat(task.getResult()).contains("\"points_awarded\":200");
        assertThat(task.getAttempts()).isEqualTo(1);
        assertThat(loyaltyQueryUseCase.getBalance(userId)).isEqualTo(200);
        assertThat(loyaltyQueryUseCase.getSummary(userId).totalXp()).isEqualTo(200);
    }

    @Test
    @DisplayName("should_reverse_points_when_completed_order_is_returned")
    void should_reverse_points_when_completed_order_is_returned() {
        // Given
        setting(LoyaltySettings.ENABLED, true);
        Long userId = createUser().getId();
        Long productId = createProduct("Grinder", "60.00", 10).getId();
        Long orderId = placeAndComplete(userId, productId, 1);
        awaitTask(orderId.toString(), TaskType.PROCESS_ORDER_POINTS, LoyaltyTaskStatus.PROCESSED);

        // When
        orderLifecycleUseCase.changeStatus(orderId, OrderStatus.RETURNED, "Customer sent it back");

        // Then
        LoyaltyTaskEntity task = awaitTask(orderId.toString(), TaskType.REVERSE_ORDER_POINTS,
                LoyaltyTaskStatus.PROCESSED);
        assertThat(task.getResult()).contains("\"points_reversed\":60");
        assertThat(loyaltyQueryUseCase.getBalance(userId)).isZero();
    }

    @Test
    @DisplayName("should_not_enqueue_tasks_for_guest_orders")
    void should_not_enqueue_tasks_for_guest_orders() {
        // Given
        Long productId = createProduct("Gift Card", "25.00", 10).getId();

        // When
        Long orderId = placeAndComplete(null, productId, 1);

        // Then
        assertThat(taskRepository.findByAggregateIdAndTaskType(orderId.toString(), TaskType.PROCESS_ORDER_POINTS))
                .isEmpty();
    }

    @Test
    @DisplayName("should_record_terminal_failure_for_missing_order")
    void should_record_terminal_failure_for_missing_order() {
        // When
        taskQueue.enqueue(TaskType.PROCESS_ORDER_POINTS, "987654");

        // Then
        LoyaltyTaskEntity task = awaitTask("987654", TaskType.PROCESS_ORDER_POINTS, LoyaltyTaskStatus.FAILED);
        assertThat(task.getErrorMessage()).isEqualTo("order_not_found");
        assertThat(task.getResult()).contains("\"status\":\"error\"");
    }

    @Test
    @DisplayName("should_list_and_requeue_failed_tasks")
    @SuppressWarnings("unchecked")
    void should_list_and_requeue_failed_tasks() {
        // Given
        String taskId = taskQueue.enqueue(TaskType.RECALCULATE_USER_TIER, "424242");
        awaitTask("424242", TaskType.RECALCULATE_USER_TIER, LoyaltyTaskStatus.FAILED);

        // When
        Map<String, Object> failed = loyaltyTasksEndpoint.failedTasks();
        Map<String, Object> requeued = loyaltyTasksEndpoint.requeue(taskId);

        // Then
        assertThat((List<Map<String, Object>>) failed.get("failed"))
                .anySatisfy(view -> {
                    assertThat(view.get("id")).isEqualTo(taskId);
                    assertThat(view.get("error")).isEqualTo("user_not_found");
                });
        assertThat(requeued.get("status")).isEqualTo("PENDING");
        await().atMost(10, TimeUnit.SECONDS)
                .untilAsserted(() -> assertThat(taskRepository.findById(taskId))
                        .hasValueSatisfying(task -> {
                            assertThat(task.getStatus()).isEqualTo(LoyaltyTaskStatus.FAILED);
                            assertThat(task.getAttempts()).isEqualTo(2);
                        }));
    }

    @Test
    @DisplayName("should_run_expiration_task_as_no_op_when_disabled")
    void should_run_expiration_task_as_no_op_when_disabled() {
        // When
        taskQueue.enqueue(TaskType.PROCESS_POINTS_EXPIRATION, "expiration-manual");

        // Then
        LoyaltyTaskEntity task = awaitTask("expiration-manual", TaskType.PROCESS_POINTS_EXPIRATION,
                LoyaltyTaskStatus.PROCESSED);
        assertThat(task.getResult()).contains("\"transactions_created\":0");
    }

    @Test
    @DisplayName("should_requeue_task_abandoned_in_processing_after_lease")
    void should_requeue_task_abandoned_in_processing_after_lease() {
        // Given
        String userId = String.valueOf(createUser().getId());
        String otherUserId = String.valueOf(createUser().getId());
        LoyaltyTaskEntity abandoned = processingTask(userId, Instant.now().minus(1, ChronoUnit.HOURS));
        LoyaltyTaskEntity running = processingTask(otherUserId, Instant.now());

        // When
        loyaltyTaskWorker.reclaimStaleTasks();

        // Then
        LoyaltyTaskEntity rerun = awaitTask(userId, TaskType.RECALCULATE_USER_TIER, LoyaltyTaskStatus.PROCESSED);
        assertThat(rerun.getId()).isEqualTo(abandoned.getId());
        assertThat(rerun.getAttempts()).isEqualTo(2);
        assertThat(taskRepository.findById(running.getId()))
                .hasValueSatisfying(task -> assertThat(task.getStatus()).isEqualTo(LoyaltyTaskStatus.PROCESSING));
    }

    private LoyaltyTaskEntity processingTask(String userId, Instant startedAt) {
        LoyaltyTaskEntity task = new LoyaltyTaskEntity();
        task.setId(UUID.randomUUID().toString());
        task.setTaskType(TaskType.RECALCULATE_USER_TIER);
        task.setAggregateId(userId);
        task.markProcessing();
        task.setStartedAt(startedAt);
        return taskRepository.saveAndFlush(task);
    }
}
