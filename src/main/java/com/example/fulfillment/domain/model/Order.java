package com.example.fulfillment.domain.model;

import com.example.fulfillment.domain.exception.CurrencyMismatchException;
import com.example.fulfillment.domain.exception.InvalidOrderDataException;
import com.example.fulfillment.domain.exception.InvalidTransitionException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Aggregate Root representing a customer order.
 * All monetary fields share the order currency.
 */
public final class Order {

    public static final String METADATA_LOYALTY_REDEMPTION = "loyalty_redemption";
    public static final String METADATA_CANCELLATION = "cancellation";

    private final Long id;
    private final UUID uuid;
    private final Long userId;
    private final String currency;
    private final List<OrderItem> items;
    private final Money shippingPrice;
    private final Map<String, Object> metadata;
    private final Instant createdAt;
    private OrderStatus status;
    private PaymentStatus paymentStatus;
    private Money paidAmount;
    private String trackingNumber;
    private String carrier;
    private boolean deleted;
    private Instant statusUpdatedAt;

    private Order(Long id, UUID uuid, Long userId, String currency, List<OrderItem> items, Money shippingPrice,
                  Money paidAmount, OrderStatus status, PaymentStatus paymentStatus, String trackingNumber,
                  String carrier, Map<String, Object> metadata, boolean deleted, Instant createdAt,
                  Instant statusUpdatedAt) {
        this.id = id;
        this.uuid = Objects.requireNonNull(uuid, "Uuid cannot be null");
        this.userId = userId;
        this.currency = Objects.requireNonNull(currency, "Currency cannot be null");
        this.items = new ArrayList<>(Objects.requireNonNull(items, "Items cannot be null"));
        this.shippingPrice = Objects.requireNonNull(shippingPrice, "ShippingPrice cannot be null");
        this.paidAmount = Objects.requireNonNull(paidAmount, "PaidAmount cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.paymentStatus = Objects.requireNonNull(paymentStatus, "PaymentStatus cannot be null");
        this.trackingNumber = trackingNumber;
        this.carrier = carrier;
        this.metadata = new LinkedHashMap<>(metadata == null ? Map.of() : metadata);
        this.deleted = deleted;
        this.createdAt = Objects.requireNonNull(createdAt, "CreatedAt cannot be null");
        this.statusUpdatedAt = statusUpdatedAt;

        if (items.isEmpty()) {
            throw new InvalidOrderDataException("Order must have at least one item");
        }
        requireCurrency(shippingPrice);
        requireCurrency(paidAmount);
        items.forEach(item -> requireCurrency(item.getUnitPrice()));
    }

    /**
     * Creates a new PENDING order. The paid amount starts as items total plus shipping.
     *
     * @param userId        owning user, or null for a guest order
     * @param currency      the order currency
     * @param shippingPrice shipping cost in the order currency
     * @param items         the order items (must not be empty)
     * @return new Order instance
     */
    public static Order create(Long userId, String currency, Money shippingPrice, List<OrderItem> items) {
        Instant now = Instant.now();
        Money itemsTotal = items.stream()
                .map(OrderItem::getSubtotal)
                .reduce(Money.zero(currency), Money::add);
        return new Order(
                null,
                UUID.randomUUID(),
                userId,
                currency,
                items,
                shippingPrice,
                itemsTotal.add(shippingPrice),
                OrderStatus.PENDING,
                PaymentStatus.PENDING,
                null,
                null,
                Map.of(),
                false,
                now,
                now
        );
    }

    /**
     * Reconstitutes an Order from persistence.
     */
    public static Order reconstitute(Long id, UUID uuid, Long userId, String currency, List<OrderItem> items,
                                     Money shippingPrice, Money paidAmount, OrderStatus status,
                                     PaymentStatus paymentStatus, String trackingNumber, String carrier,
                                     Map<String, Object> metadata, boolean deleted, Instant createdAt,
                                     Instant statusUpdatedAt) {
        return new Order(id, uuid, userId, currency, items, shippingPrice, paidAmount, status, paymentStatus,
                trackingNumber, carrier, metadata, deleted, createdAt, statusUpdatedAt);
    }

    /**
     * Calculates the sum of all line subtotals.
     *
     * @return the items total as Money
     */
    public Money getItemsTotal() {
        return items.stream()
                .map(OrderItem::getSubtotal)
                .reduce(Money.zero(currency), Money::add);
    }

    /**
     * Moves the order to the target status.
     *
     * @param target the requested status
     * @return false when the order already has the target status, true when it changed
     * @throws InvalidTransitionException if the transition is not allowed; the order is left unchanged
     */
    public boolean transitionTo(OrderStatus target) {
        Objects.requireNonNull(target, "Target status cannot be null");
        if (this.status == target) {
            return false;
        }
        if (!this.status.canTransitionTo(target)) {
            throw new InvalidTransitionException(this.status, target, this.status.allowedTransitions());
        }
        this.status = target;
        this.statusUpdatedAt = Instant.now();
        return true;
    }

    /**
     * Appends a new line. Only allowed before the order ships.
     */
    public void addItem(OrderItem item) {
        requireEditable();
        requireCurrency(item.getUnitPrice());
        items.add(item);
        recalculatePaidAmount();
    }

    /**
     * Changes the quantity of an existing line.
     *
     * @return signed quantity difference
     */
    public int changeItemQuantity(Long itemId, int newQuantity) {
        requireEditable();
        int delta = getItem(itemId).changeQuantity(newQuantity);
        recalculatePaidAmount();
        return delta;
    }

    /**
     * Refunds units of a line and updates the payment status accordingly.
     *
     * @return refunded amount
     */
    public Money refundItem(Long itemId, int quantity) {
        Money refunded = getItem(itemId).refund(quantity);
        this.paymentStatus = items.stream().allMatch(OrderItem::isFullyRefunded)
                ? PaymentStatus.REFUNDED
                : PaymentStatus.PARTIALLY_REFUNDED;
        return refunded;
    }

    /**
     * Applies a loyalty discount: paid amount becomes items total plus shipping minus the discount, never negative.
     */
    public void applyDiscount(Money discount) {
        requireCurrency(discount);
        this.paidAmount = getItemsTotal().add(shippingPrice).subtractFloored(discount);
    }

    private void recalculatePaidAmount() {
        Money gross = getItemsTotal().add(shippingPrice);
        this.paidAmount = gross.subtractFloored(getLoyaltyDiscount().orElse(Money.zero(currency)));
    }

    /**
     * Discount recorded by a points redemption, if any.
     */
    public Optional<Money> getLoyaltyDiscount() {
        Object redemption = metadata.get(METADATA_LOYALTY_REDEMPTION);
        if (redemption instanceof Map<?, ?> map && map.get("discount") != null) {
            return Optional.of(Money.of(new BigDecimal(map.get("discount").toString()), currency));
        }
        return Optional.empty();
    }

    public void markPaymentCompleted() {
        this.paymentStatus = PaymentStatus.COMPLETED;
    }

    public void recordTracking(String trackingNumber, String carrier) {
        if (trackingNumber == null || trackingNumber.isBlank()) {
            throw new InvalidOrderDataException("Tracking number is required");
        }
        this.trackingNumber = trackingNumber;
        this.carrier = carrier;
    }

    public void putMetadata(String key, Object value) {
        metadata.put(Objects.requireNonNull(key, "Metadata key cannot be null"), value);
    }

    public void softDelete() {
        this.deleted = true;
    }

    public boolean isGuestOrder() {
        return userId == null;
    }

    public OrderItem getItem(Long itemId) {
        return items.stream()
                .filter(item -> Objects.equals(item.getId(), itemId))
                .findFirst()
                .orElseThrow(() -> new InvalidOrderDataException(
                        "Order " + id + " has no item " + itemId));
    }

    private void requireEditable() {
        if (!status.isEditable()) {
            throw new InvalidOrderDataException(
                    "Items can only be changed while the order is PENDING or PROCESSING, current: " + status);
        }
    }

    private void requireCurrency(Money money) {
        if (!money.hasCurrency(currency)) {
            throw new CurrencyMismatchException(currency, money.getCurrency());
        }
    }

    public Long getId() {
        return id;
    }

    public UUID getUuid() {
        return uuid;
    }

    public Long getUserId() {
        return userId;
    }

    public String getCurrency() {
        return currency;
    }

    public List<OrderItem> getItems() {
        return Collections.unmodifiableList(items);
    }

    public Money getShippingPrice() {
        return shippingPrice;
    }

    public Money getPaidAmount() {
        return paidAmount;
    }

    public OrderStatus getStatus() {
        return status;
    }

    public PaymentStatus getPaymentStatus() {
        return paymentStatus;
    }

    public String getTrackingNumber() {
        return trackingNumber;
    }

    public String getCarrier() {
        return carrier;
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public boolean isDeleted() {
        return deleted;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStatusUpdatedAt() {
        return statusUpdatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Order order = (Order) o;
        return Objects.equals(uuid, order.uuid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uuid);
    }

    @Override
    public String toString() {
        return "Order{" +
                "id=" + id +
                ", uuid=" + uuid +
                ", status=" + status +
                ", itemCount=" + items.size() +
                ", paidAmount=" + paidAmount +
                '}';
    }
}
