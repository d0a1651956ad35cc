package com.example.fulfillment.infrastructure.persistence.entity;

public enum StockOperation {
    RESERVE,
    RESTORE,
    ADJUST
}
