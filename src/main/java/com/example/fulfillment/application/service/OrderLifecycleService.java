package com.example.fulfillment.application.service;

import com.example.fulfillment.application.dto.OrderView;
import com.example.fulfillment.application.dto.PlaceOrderCommand;
import com.example.fulfillment.application.dto.PlaceOrderCommand.OrderLineDto;
import com.example.fulfillment.application.dto.RedeemPointsCommand;
import com.example.fulfillment.application.dto.RedemptionResult;
import com.example.fulfillment.application.port.in.OrderLifecycleUseCase;
import com.example.fulfillment.application.port.in.PlaceOrderUseCase;
import com.example.fulfillment.application.port.in.RedeemPointsUseCase;
import com.example.fulfillment.application.port.out.OrderRepositoryPort;
import com.example.fulfillment.application.port.out.ProductCatalogPort;
import com.example.fulfillment.application.port.out.StockGuard;
import com.example.fulfillment.domain.event.OrderEvent;
import com.example.fulfillment.domain.event.OrderEventBus;
import com.example.fulfillment.domain.event.OrderEventType;
import com.example.fulfillment.domain.exception.CurrencyMismatchException;
import com.example.fulfillment.domain.exception.InsufficientStockException;
import com.example.fulfillment.domain.exception.InvalidOrderDataException;
import com.example.fulfillment.domain.exception.InvalidTransitionException;
import com.example.fulfillment.domain.exception.OrderNotFoundException;
import com.example.fulfillment.domain.exception.ProductNotFoundException;
import com.example.fulfillment.domain.model.Money;
import com.example.fulfillment.domain.model.Order;
import com.example.fulfillment.domain.model.OrderHistoryEntry;
import com.example.fulfillment.domain.model.OrderItem;
import com.example.fulfillment.domain.model.OrderStatus;
import com.example.fulfillment.domain.model.Product;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Application service that runs the order state machine.
 * <p>
 * A status write, its history entry, its stock side effects and its event
 * handlers all run in the caller's transaction, so either all of them apply
 * or none does.
 */
@Service
public class OrderLifecycleService implements PlaceOrderUseCase, OrderLifecycleUseCase {

    private static final Logger log = LoggerFactory.getLogger(OrderLifecycleService.class);

    private final OrderRepositoryPort orders;
    private final ProductCatalogPort products;
    private final StockGuard stockGuard;
    private final OrderEventBus eventBus;
    private final RedeemPointsUseCase redeemPoints;
    private final String defaultCurrency;

    public OrderLifecycleService(
            OrderRepositoryPort orders,
            ProductCatalogPort products,
            StockGuard stockGuard,
            OrderEventBus eventBus,
            RedeemPointsUseCase redeemPoints,
            @Value("${orders.default-currency:EUR}") String defaultCurrency) {
        this.orders = orders;
        this.products = products;
        this.stockGuard = stockGuard;
        this.eventBus = eventBus;
        this.redeemPoints = redeemPoints;
        this.defaultCurrency = defaultCurrency;
    }

    @Override
    @Transactional
    public OrderView placeOrder(PlaceOrderCommand command) {
        String currency = command.currency() == null || command.currency().isBlank()
                ? defaultCurrency
                : command.currency().trim().toUpperCase(Locale.ROOT);
        log.info("Placing order for user {} with {} lines in {}", command.userId(), command.items().size(), currency);

        List<OrderItem> items = new ArrayList<>();
        for (OrderLineDto line : command.items()) {
            Product product = products.findById(line.productId())
                    .orElseThrow(() -> new ProductNotFoundException(line.productId()));
            if (!product.getPrice().hasCurrency(currency)) {
                throw new CurrencyMismatchException(currency, product.getPrice().getCurrency());
            }
            if (line.quantity() > product.getStock()) {
                throw new InsufficientStockException(product.getId(), line.quantity(), product.getStock());
            }
            items.add(OrderItem.create(product.getId(), product.getName(), product.getFinalPrice(), line.quantity()));
        }

        BigDecimal shipping = command.shippingPrice() == null ? BigDecimal.ZERO : command.shippingPrice();
        Order order = orders.save(Order.create(command.userId(), currency, Money.of(shipping, currency), items));
        for (OrderItem item : order.getItems()) {
            stockGuard.reserve(item.getProductId(), item.getQuantity(), order.getId());
        }
        orders.appendHistory(OrderHistoryEntry.created(order.getId()));

        if (command.redeemsPoints()) {
            if (order.isGuestOrder()) {
                throw new InvalidOrderDataException("Guest orders cannot redeem loyalty points");
            }
            RedemptionResult redemption = redeemPoints.redeemPoints(new RedeemPointsCommand(
                    command.userId(), command.loyaltyPointsToRedeem(), currency, order.getId()));
            Order redeemed = load(order.getId());
            redeemed.applyDiscount(Money.of(redemption.discountAmount(), currency));
            order = orders.save(redeemed);
        }

        log.info("Order {} placed: id={}, paidAmount={}", order.getUuid(), order.getId(), order.getPaidAmount());
        return OrderView.from(order);
    }

    @Override
    @Transactional
    public OrderView changeStatus(Long orderId, OrderStatus target, String note) {
        Order order = loadForUpdate(orderId);
        applyTransition(order, target, note);
        return OrderView.from(order);
    }

    @Override
    @Transactional
    public OrderView cancelOrder(Long orderId, String reason) {
        Order order = loadForUpdate(orderId);
        OrderStatus previous = order.getStatus();
        if (previous == OrderStatus.CANCELED) {
            log.info("Order {} is already canceled", orderId);
            return OrderView.from(order);
        }
        if (!previous.canTransitionTo(OrderStatus.CANCELED)) {
            log.warn("Rejected cancellation of order {} in status {}", orderId, previous);
            throw new InvalidTransitionException(previous, OrderStatus.CANCELED, previous.allowedTransitions());
        }

        Map<String, Object> cancellation = new LinkedHashMap<>();
        cancellation.put("reason", reason == null ? "" : reason);
        cancellation.put("canceled_at", Instant.now().toString());
        cancellation.put("previous_status", previous.name());
        order.putMetadata(Order.METADATA_CANCELLATION, cancellation);

        applyTransition(order, OrderStatus.CANCELED, reason == null ? "Order canceled" : "Order canceled: " + reason);
        return OrderView.from(order);
    }

    @Override
    @Transactional
    public OrderView markPaid(Long orderId) {
        Order order = loadForUpdate(orderId);
        order.markPaymentCompleted();
        if (order.getStatus() == OrderStatus.PENDING) {
            applyTransition(order, OrderStatus.PROCESSING, "Payment received");
        } else {
            orders.save(order);
        }
        return OrderView.from(order);
    }

    @Override
    @Transactional
    public OrderView addTrackingInfo(Long orderId, String trackingNumber, String carrier) {
        Order order = loadForUpdate(orderId);
        order.recordTracking(trackingNumber, carrier);
        if (order.getStatus() == OrderStatus.PENDING) {
            applyTransition(order, OrderStatus.PROCESSING, "Tracking number added");
        }
        if (order.getStatus() == OrderStatus.PROCESSING) {
            applyTransition(order, OrderStatus.SHIPPED, "Shipped with tracking number " + trackingNumber);
        } else {
            orders.save(order);
        }
        return OrderView.from(order);
    }

    @Override
    @Transactional
    public OrderView addItem(Long orderId, Long productId, int quantity) {
        if (quantity <= 0) {
            throw new InvalidOrderDataException("Quantity must be positive: " + quantity);
        }
        Order order = loadForUpdate(orderId);
        Product product = products.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
        order.addItem(OrderItem.create(product.getId(), product.getName(), product.getFinalPrice(), quantity));
        stockGuard.reserve(productId, quantity, orderId);
        Order saved = orders.save(order);
        orders.appendHistory(new OrderHistoryEntry(orderId, OrderHistoryEntry.ChangeType.NOTE,
                saved.getStatus(), saved.getStatus(),
                String.format("Added %d x %s", quantity, product.getName()), Instant.now()));
        log.info("Added {} x product {} to order {}", quantity, productId, orderId);
        return OrderView.from(saved);
    }

    @Override
    @Transactional
    public OrderView updateItemQuantity(Long orderId, Long itemId, int quantity) {
        Order order = loadForUpdate(orderId);
        int delta = order.changeItemQuantity(itemId, quantity);
        OrderItem item = order.getItem(itemId);
        if (delta > 0) {
            stockGuard.deductExempt(item.getProductId(), delta, orderId);
        } else if (delta < 0) {
            stockGuard.restore(item.getProductId(), -delta, orderId);
        }
        Order saved = orders.save(order);
        if (delta != 0) {
            orders.appendHistory(new OrderHistoryEntry(orderId, OrderHistoryEntry.ChangeType.NOTE,
                    saved.getStatus(), saved.getStatus(),
                    String.format("Quantity of item %d changed by %+d to %d", itemId, delta, quantity),
                    Instant.now()));
        }
        log.info("Item {} of order {} quantity changed by {} to {}", itemId, orderId, delta, quantity);
        return OrderView.from(saved);
    }

    @Override
    @Transactional
    public Money refundItem(Long orderId, Long itemId, int quantity) {
        Order order = loadForUpdate(orderId);
        if (order.getStatus() == OrderStatus.CANCELED) {
            throw new InvalidOrderDataException("Cannot refund items of canceled order " + orderId);
        }
        Money refunded = order.refundItem(itemId, quantity);
        OrderItem item = order.getItem(itemId);
        stockGuard.restore(item.getProductId(), quantity, orderId);
        orders.save(order);
        orders.appendHistory(OrderHistoryEntry.refund(orderId, order.getStatus(),
                String.format("Refunded %d x %s (%s)", quantity, item.getProductName(), refunded)));
        log.info("Refunded {} units of item {} on order {}: {}", quantity, itemId, orderId, refunded);
        return refunded;
    }

    @Override
    @Transactional(readOnly = true)
    public OrderView getOrder(Long orderId) {
        return OrderView.from(load(orderId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderHistoryEntry> getHistory(Long orderId) {
        load(orderId);
        return orders.findHistory(orderId);
    }

    @Override
    @Transactional
    public void deleteOrder(Long orderId) {
        Order order = loadForUpdate(orderId);
        order.softDelete();
        orders.save(order);
        log.info("Order {} soft-deleted", orderId);
    }

    private void applyTransition(Order order, OrderStatus target, String note) {
        OrderStatus previous = order.getStatus();
        if (previous != target && !previous.canTransitionTo(target)) {
            log.warn("Rejected transition of order {}: {} -> {}", order.getId(), previous, target);
        }
        if (!order.transitionTo(target)) {
            log.info("Order {} already in status {}, nothing to do", order.getId(), target);
            return;
        }

        if (target == OrderStatus.CANCELED) {
            restoreStock(order);
        }
        orders.save(order);
        orders.appendHistory(OrderHistoryEntry.statusChange(order.getId(), previous, target, note));
        OrderEventType.forStatus(target)
                .ifPresent(type -> eventBus.publish(OrderEvent.of(type, order.getId(), order.getUserId())));
        log.info("Order {} status changed: {} -> {}", order.getId(), previous, target);
    }

    private void restoreStock(Order order) {
        for (OrderItem item : order.getItems()) {
            if (item.getNetQuantity() > 0) {
                stockGuard.restore(item.getProductId(), item.getNetQuantity(), order.getId());
            }
        }
    }

    private Order load(Long orderId) {
        return orders.findById(orderId)
                .filter(order -> !order.isDeleted())
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    private Order loadForUpdate(Long orderId) {
        return orders.findByIdForUpdate(orderId)
                .filter(order -> !order.isDeleted())
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }
}
