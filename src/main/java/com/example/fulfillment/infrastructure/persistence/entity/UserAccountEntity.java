package com.example.fulfillment.infrastructure.persistence.entity;

import jakarta.persistence.*;

/**
 * Loyalty columns of a user account. The points balance is never stored.
 */
@Entity
@Table(name = "user_accounts")
public class UserAccountEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "email", nullable = false, unique = true)
    private String email;

    @Column(name = "total_xp", nullable = false)
    private long totalXp;

    @Column(name = "loyalty_tier_id")
    private Long loyaltyTierId;

    public Long getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public long getTotalXp() {
        return totalXp;
    }

    public void setTotalXp(long totalXp) {
        this.totalXp = totalXp;
    }

    public Long getLoyaltyTierId() {
        return loyaltyTierId;
    }

    public void setLoyaltyTierId(Long loyaltyTierId) {
        this.loyaltyTierId = loyaltyTierId;
    }
}
