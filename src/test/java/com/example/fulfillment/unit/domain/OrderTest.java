package com.example.fulfillment.unit.domain;

import com.example.fulfillment.domain.exception.CurrencyMismatchException;
import com.example.fulfillment.domain.exception.InvalidOrderDataException;
import com.example.fulfillment.domain.exception.InvalidTransitionException;
import com.example.fulfillment.domain.model.Money;
import com.example.fulfillment.domain.model.Order;
import com.example.fulfillment.domain.model.OrderItem;
import com.example.fulfillment.domain.model.OrderStatus;
import com.example.fulfillment.domain.model.PaymentStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the Order aggregate.
 */
@DisplayName("Order Domain Tests")
class OrderTest {

    private static Order orderInStatus(OrderStatus status) {
        List<OrderItem> items = List.of(
                OrderItem.reconstitute(1L, 100L, "Keyboard", Money.of("40.00", "EUR"), 2, 0, 2),
                OrderItem.reconstitute(2L, 200L, "Mouse", Money.of("15.00", "EUR"), 1, 0, 1)
        );
        return Order.reconstitute(10L, UUID.randomUUID(), 7L, "EUR", items, Money.of("5.00", "EUR"),
                Money.of("100.00", "EUR"), status, PaymentStatus.PENDING, null, null, Map.of(), false,
                Instant.now(), Instant.now());
    }

    @Nested
    @DisplayName("Order Creation")
    class OrderCreation {

        @Test
        @DisplayName("should_create_pending_order_with_paid_amount_of_items_and_shipping")
        void should_create_pending_order_with_paid_amount_of_items_and_shipping() {
            // Given: 2 x 40.00 + 1 x 15.00, shipping 5.00
            List<OrderItem> items = List.of(
                    OrderItem.create(100L, "Keyboard", Money.of("40.00", "EUR"), 2),
                    OrderItem.create(200L, "Mouse", Money.of("15.00", "EUR"), 1)
            );

            // When
            Order order = Order.create(7L, "EUR", Money.of("5.00", "EUR"), items);

            // Then
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
            assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);
            assertThat(order.getItemsTotal()).isEqualTo(Money.of("95.00", "EUR"));
            assertThat(order.getPaidAmount()).isEqualTo(Money.of("100.00", "EUR"));
            assertThat(order.getUuid()).isNotNull();
            assertThat(order.isGuestOrder()).isFalse();
        }

        @Test
        @DisplayName("should_reject_empty_items")
        void should_reject_empty_items() {
            assertThatThrownBy(() -> Order.create(7L, "EUR", Money.zero("EUR"), Collections.emptyList()))
                    .isInstanceOf(InvalidOrderDataException.class)
                    .hasMessageContaining("at least one item");
        }

        @Test
        @DisplayName("should_reject_items_in_other_currency")
        void should_reject_items_in_other_currency() {
            List<OrderItem> items = List.of(OrderItem.create(100L, "Keyboard", Money.of("40.00", "USD"), 1));

            assertThatThrownBy(() -> Order.create(7L, "EUR", Money.zero("EUR"), items))
                    .isInstanceOf(CurrencyMismatchException.class);
        }

        @Test
        @DisplayName("should_treat_order_without_user_as_guest_order")
        void should_treat_order_without_user_as_guest_order() {
            Order order = Order.create(null, "EUR", Money.zero("EUR"),
                    List.of(OrderItem.create(100L, "Keyboard", Money.of("40.00", "EUR"), 1)));

            assertThat(order.isGuestOrder()).isTrue();
        }
    }

    @Nested
    @DisplayName("Status Transitions")
    class StatusTransitions {

        @Test
        @DisplayName("should_move_pending_order_to_processing")
        void should_move_pending_order_to_processing() {
            // Given
            Order order = orderInStatus(OrderStatus.PENDING);

            // When
            boolean changed = order.transitionTo(OrderStatus.PROCESSING);

            // Then
            assertThat(changed).isTrue();
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PROCESSING);
        }

        @Test
        @DisplayName("should_reject_pending_to_delivered_and_keep_status")
        void should_reject_pending_to_delivered_and_keep_status() {
            // Given
            Order order = orderInStatus(OrderStatus.PENDING);

            // When & Then
            assertThatThrownBy(() -> order.transitionTo(OrderStatus.DELIVERED))
                    .isInstanceOf(InvalidTransitionException.class)
                    .satisfies(e -> {
                        InvalidTransitionException ex = (InvalidTransitionException) e;
                        assertThat(ex.getCurrentStatus()).isEqualTo(OrderStatus.PENDING);
                        assertThat(ex.getRequestedStatus()).isEqualTo(OrderStatus.DELIVERED);
                        assertThat(ex.getAllowedStatuses())
                                .containsExactlyInAnyOrder(OrderStatus.PROCESSING, OrderStatus.CANCELED);
                    });
            assertThat(order.getStatus()).isEqualTo(OrderStatus.PENDING);
        }

        @Test
        @DisplayName("should_treat_same_status_as_no_op")
        void should_treat_same_status_as_no_op() {
            Order order = orderInStatus(OrderStatus.COMPLETED);

            assertThat(order.transitionTo(OrderStatus.COMPLETED)).isFalse();
            assertThat(order.getStatus()).isEqualTo(OrderStatus.COMPLETED);
        }
    }

    @Nested
    @DisplayName("Item Edits And Refunds")
    class ItemEdits {

        @Test
        @DisplayName("should_return_quantity_delta_and_recalculate_paid_amount")
        void should_return_quantity_delta_and_recalculate_paid_amount() {
            // Given
            Order order = orderInStatus(OrderStatus.PENDING);

            // When
            int delta = order.changeItemQuantity(1L, 5);

            // Then: 5 x 40.00 + 15.00 + 5.00 shipping
            assertThat(delta).isEqualTo(3);
            assertThat(order.getPaidAmount()).isEqualTo(Money.of("220.00", "EUR"));
            assertThat(order.getItem(1L).getOriginalQuantity()).isEqualTo(2);
        }

        @Test
        @DisplayName("should_reject_item_edits_after_shipping")
        void should_reject_item_edits_after_shipping() {
            Order order = orderInStatus(OrderStatus.SHIPPED);

            assertThatThrownBy(() -> order.changeItemQuantity(1L, 3))
                    .isInstanceOf(InvalidOrderDataException.class);
            assertThatThrownBy(() -> order.addItem(OrderItem.create(300L, "Cable", Money.of("3.00", "EUR"), 1)))
                    .isInstanceOf(InvalidOrderDataException.class);
        }

        @Test
        @DisplayName("should_mark_partial_then_full_refund")
        void should_mark_partial_then_full_refund() {
            // Given
            Order order = orderInStatus(OrderStatus.COMPLETED);

            // When
            Money first = order.refundItem(1L, 1);

            // Then
            assertThat(first).isEqualTo(Money.of("40.00", "EUR"));
            assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PARTIALLY_REFUNDED);
            assertThat(order.getItem(1L).getNetQuantity()).isEqualTo(1);

            // When
            order.refundItem(1L, 1);
            order.refundItem(2L, 1);

            // Then
            assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.REFUNDED);
        }

        @Test
        @DisplayName("should_reject_refund_beyond_remaining_quantity")
        void should_reject_refund_beyond_remaining_quantity() {
            Order order = orderInStatus(OrderStatus.COMPLETED);

            assertThatThrownBy(() -> order.refundItem(2L, 2))
                    .isInstanceOf(InvalidOrderDataException.class)
                    .hasMessageContaining("only 1 refundable");
        }

        @Test
        @DisplayName("should_apply_loyalty_discount_floored_at_zero")
        void should_apply_loyalty_discount_floored_at_zero() {
            Order order = orderInStatus(OrderStatus.PENDING);

            order.applyDiscount(Money.of("500.00", "EUR"));

            assertThat(order.getPaidAmount().isZero()).isTrue();
        }
    }
}
