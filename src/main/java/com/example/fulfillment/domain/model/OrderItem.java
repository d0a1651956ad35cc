package com.example.fulfillment.domain.model;

import com.example.fulfillment.domain.exception.InvalidOrderDataException;

import java.util.Objects;

/**
 * Entity representing a single line of an order.
 * The unit price is a snapshot taken when the line was created.
 */
public final class OrderItem {

    private final Long id;
    private final Long productId;
    private final String productName;
    private final Money unitPrice;
    private final int originalQuantity;
    private int quantity;
    private int refundedQuantity;

    private OrderItem(Long id, Long productId, String productName, Money unitPrice,
                      int quantity, int refundedQuantity, int originalQuantity) {
        this.id = id;
        this.productId = Objects.requireNonNull(productId, "ProductId cannot be null");
        this.productName = productName;
        this.unitPrice = Objects.requireNonNull(unitPrice, "UnitPrice cannot be null");
        if (quantity <= 0) {
            throw new InvalidOrderDataException("Quantity must be positive: " + quantity);
        }
        if (refundedQuantity < 0 || refundedQuantity > quantity) {
            throw new InvalidOrderDataException(
                    "Refunded quantity must be between 0 and " + quantity + ": " + refundedQuantity);
        }
        this.quantity = quantity;
        this.refundedQuantity = refundedQuantity;
        this.originalQuantity = originalQuantity;
    }

    /**
     * Creates a new, not yet persisted OrderItem.
     *
     * @param productId   the referenced product
     * @param productName product name at the time of purchase
     * @param unitPrice   unit price snapshot
     * @param quantity    the quantity (must be positive)
     * @return new OrderItem instance
     */
    public static OrderItem create(Long productId, String productName, Money unitPrice, int quantity) {
        return new OrderItem(null, productId, productName, unitPrice, quantity, 0, quantity);
    }

    public static OrderItem reconstitute(Long id, Long productId, String productName, Money unitPrice,
                                         int quantity, int refundedQuantity, int originalQuantity) {
        return new OrderItem(id, productId, productName, unitPrice, quantity, refundedQuantity, originalQuantity);
    }

    /**
     * Calculates the subtotal for this item (quantity * unitPrice).
     *
     * @return the subtotal as Money
     */
    public Money getSubtotal() {
        return unitPrice.multiply(quantity);
    }

    /**
     * Quantity still held by the customer, i.e. not refunded.
     */
    public int getNetQuantity() {
        return quantity - refundedQuantity;
    }

    public boolean isFullyRefunded() {
        return refundedQuantity == quantity;
    }

    /**
     * Books a refund for part of this line.
     *
     * @param refundQuantity units to refund
     * @return refunded amount
     * @throws InvalidOrderDataException if the quantity is not positive or exceeds the refundable units
     */
    public Money refund(int refundQuantity) {
        if (refundQuantity <= 0) {
            throw new InvalidOrderDataException("Refund quantity must be positive: " + refundQuantity);
        }
        if (refundedQuantity + refundQuantity > quantity) {
            throw new InvalidOrderDataException(String.format(
                    "Cannot refund %d units of item %d: only %d refundable",
                    refundQuantity, id, getNetQuantity()));
        }
        this.refundedQuantity += refundQuantity;
        return unitPrice.multiply(refundQuantity);
    }

    /**
     * Changes the ordered quantity.
     *
     * @param newQuantity the new quantity
     * @return signed difference to the previous quantity
     */
    public int changeQuantity(int newQuantity) {
        if (newQuantity <= 0) {
            throw new InvalidOrderDataException("Quantity must be positive: " + newQuantity);
        }
        if (newQuantity < refundedQuantity) {
            throw new InvalidOrderDataException(String.format(
                    "Quantity %d is below the refunded quantity %d", newQuantity, refundedQuantity));
        }
        int delta = newQuantity - quantity;
        this.quantity = newQuantity;
        return delta;
    }

    public Long getId() {
        return id;
    }

    public Long getProductId() {
        return productId;
    }

    public String getProductName() {
        return productName;
    }

    public Money getUnitPrice() {
        return unitPrice;
    }

    public int getQuantity() {
        return quantity;
    }

    public int getRefundedQuantity() {
        return refundedQuantity;
    }

    public int getOriginalQuantity() {
        return originalQuantity;
    }

    @Override
    public String toString() {
        return "OrderItem{" +
                "id=" + id +
                ", productId=" + productId +
                ", quantity=" + quantity +
                ", refundedQuantity=" + refundedQuantity +
                ", unitPrice=" + unitPrice +
                '}';
    }
}
