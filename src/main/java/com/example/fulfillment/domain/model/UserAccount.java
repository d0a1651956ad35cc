package com.example.fulfillment.domain.model;

import java.util.Objects;

/**
 * Loyalty-relevant view of a user account. The tier reference is a cache
 * of the tier derived from total XP.
 */
public final class UserAccount {

    private final Long id;
    private final String email;
    private long totalXp;
    private Long loyaltyTierId;

    private UserAccount(Long id, String email, long totalXp, Long loyaltyTierId) {
        this.id = Objects.requireNonNull(id, "Id cannot be null");
        this.email = email;
        if (totalXp < 0) {
            throw new IllegalArgumentException("Total XP cannot be negative: " + totalXp);
        }
        this.totalXp = totalXp;
        this.loyaltyTierId = loyaltyTierId;
    }

    public static UserAccount of(Long id, String email, long totalXp, Long loyaltyTierId) {
        return new UserAccount(id, email, totalXp, loyaltyTierId);
    }

    public void addXp(long xp) {
        if (xp < 0) {
            throw new IllegalArgumentException("XP to add cannot be negative: " + xp);
        }
        this.totalXp += xp;
    }

    /**
     * Removes XP, flooring the total at zero.
     */
    public void removeXp(long xp) {
        if (xp < 0) {
            throw new IllegalArgumentException("XP to remove cannot be negative: " + xp);
        }
        this.totalXp = Math.max(0, this.totalXp - xp);
    }

    /**
     * @return true if the cached tier changed
     */
    public boolean assignTier(Long tierId) {
        if (Objects.equals(this.loyaltyTierId, tierId)) {
            return false;
        }
        this.loyaltyTierId = tierId;
        return true;
    }

    public Long getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public long getTotalXp() {
        return totalXp;
    }

    public Long getLoyaltyTierId() {
        return loyaltyTierId;
    }
}
