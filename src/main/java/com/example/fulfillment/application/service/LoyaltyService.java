package com.example.fulfillment.application.service;

import com.example.fulfillment.application.dto.LedgerEntryView;
import com.example.fulfillment.application.dto.LoyaltySummary;
import com.example.fulfillment.application.dto.RedeemPointsCommand;
import com.example.fulfillment.application.dto.RedemptionResult;
import com.example.fulfillment.application.port.in.LoyaltyLedgerUseCase;
import com.example.fulfillment.application.port.in.LoyaltyQueryUseCase;
import com.example.fulfillment.application.port.in.RedeemPointsUseCase;
import com.example.fulfillment.application.port.out.LoyaltyTierPort;
import com.example.fulfillment.application.port.out.OrderRepositoryPort;
import com.example.fulfillment.application.port.out.PointsLedgerPort;
import com.example.fulfillment.application.port.out.ProductCatalogPort;
import com.example.fulfillment.application.port.out.UserAccountPort;
import com.example.fulfillment.domain.exception.CurrencyMismatchException;
import com.example.fulfillment.domain.exception.InvalidOrderDataException;
import com.example.fulfillment.domain.exception.LoyaltyValidationException;
import com.example.fulfillment.domain.exception.OrderNotFoundException;
import com.example.fulfillment.domain.exception.ProductNotFoundException;
import com.example.fulfillment.domain.exception.UserNotFoundException;
import com.example.fulfillment.domain.model.LoyaltyTier;
import com.example.fulfillment.domain.model.Order;
import com.example.fulfillment.domain.model.OrderItem;
import com.example.fulfillment.domain.model.PointsTransaction;
import com.example.fulfillment.domain.model.Product;
import com.example.fulfillment.domain.model.TransactionType;
import com.example.fulfillment.domain.model.UserAccount;
import com.example.fulfillment.domain.service.PointsCalculator;
import com.example.fulfillment.domain.service.TierResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Application service owning every write to the points ledger.
 * <p>
 * Balance, level and tier are derived from the ledger and the user's total XP.
 * Each mutation locks the user's account row first, so the idempotency check
 * and the balance read happen under the same lock as the inserts.
 */
@Service
public class LoyaltyService implements LoyaltyLedgerUseCase, RedeemPointsUseCase, LoyaltyQueryUseCase {

    private static final Logger log = LoggerFactory.getLogger(LoyaltyService.class);

    private final PointsLedgerPort ledger;
    private final UserAccountPort users;
    private final LoyaltyTierPort tiers;
    private final OrderRepositoryPort orders;
    private final ProductCatalogPort products;
    private final LoyaltySettings settings;

    public LoyaltyService(
            PointsLedgerPort ledger,
            UserAccountPort users,
            LoyaltyTierPort tiers,
            OrderRepositoryPort orders,
            ProductCatalogPort products,
            LoyaltySettings settings) {
        this.ledger = ledger;
        this.users = users;
        this.tiers = tiers;
        this.orders = orders;
        this.products = products;
        this.settings = settings;
    }

    @Override
    @Transactional
    public int awardOrderPoints(Long orderId) {
        if (!settings.isEnabled()) {
            log.debug("Loyalty system disabled, not awarding points for order {}", orderId);
            return 0;
        }
        Optional<Order> found = orders.findById(orderId);
        if (found.isEmpty()) {
            log.warn("Cannot award points: order {} not found", orderId);
            return 0;
        }
        Order order = found.get();
        if (order.isGuestOrder()) {
            log.debug("Order {} is a guest order, no points awarded", orderId);
            return 0;
        }
        Optional<UserAccount> lockedUser = users.findByIdForUpdate(order.getUserId());
        if (lockedUser.isEmpty()) {
            log.warn("Cannot award points for order {}: user {} not found", orderId, order.getUserId());
            return 0;
        }
        UserAccount user = lockedUser.get();
        if (ledger.existsForOrder(orderId, TransactionType.EARN)) {
            log.info("Points already awarded for order {}", orderId);
            return 0;
        }

        PointsCalculator calculator = settings.pointsCalculator();
        BigDecimal multiplier = tierMultiplier(user);
        int total = 0;
        for (OrderItem item : order.getItems()) {
            int quantity = item.getNetQuantity();
            Product product = products.findById(item.getProductId())
                    .orElseThrow(() -> new ProductNotFoundException(item.getProductId()));
            int points = calculator.calculateItemPoints(product, quantity, multiplier);
            if (points > 0) {
                ledger.append(PointsTransaction.earn(user.getId(), points, orderId,
                        String.format("Points earned for %s x%d", product.getName(), quantity)));
                total += points;
            }
        }

        if (total > 0) {
            user.addXp(total);
            refreshTier(user);
            users.save(user);
        }
        log.info("Awarded {} points to user {} for order {}", total, user.getId(), orderId);
        return total;
    }

    @Override
    @Transactional
    public int reverseOrderPoints(Long orderId) {
        Optional<Order> found = orders.findById(orderId);
        if (found.isEmpty()) {
            log.warn("Cannot reverse points: order {} not found", orderId);
            return 0;
        }
        Order order = found.get();
        if (order.isGuestOrder()) {
            return 0;
        }
        Optional<UserAccount> lockedUser = users.findByIdForUpdate(order.getUserId());
        if (lockedUser.isEmpty()) {
            log.warn("Cannot reverse points for order {}: user {} not found", orderId, order.getUserId());
            return 0;
        }
        UserAccount user = lockedUser.get();
        if (ledger.existsForOrder(orderId, TransactionType.ADJUST)) {
            log.info("Points already reversed for order {}", orderId);
            return 0;
        }
        List<PointsTransaction> earned = ledger.findForOrder(orderId, TransactionType.EARN);
        if (earned.isEmpty()) {
            log.debug("No earned points to reverse for order {}", orderId);
            return 0;
        }

        long balance = ledger.balance(user.getId());
        int reversed = 0;
        for (PointsTransaction earn : earned) {
            int amount;
            if (ledger.isOffset(earn.getId())) {
                amount = 0;
            } else {
                amount = (int) Math.min(earn.getPoints(), Math.max(0, balance));
                if (amount < earn.getPoints()) {
                    log.warn("Clamping reversal of transaction {} for order {}: earned {}, reversing {} (balance {})",
                            earn.getId(), orderId, earn.getPoints(), amount, balance);
                }
            }
            ledger.append(PointsTransaction.reversal(earn, amount, "Points reversed for order " + order.getUuid()));
            balance -= amount;
            reversed += amount;
        }

        user.removeXp(reversed);
        refreshTier(user);
        users.save(user);
        log.info("Reversed {} points of user {} for order {}", reversed, user.getId(), orderId);
        return reversed;
    }

    @Override
    @Transactional
    public RedemptionResult redeemPoints(RedeemPointsCommand command) {
        if (!settings.isEnabled()) {
            throw LoyaltyValidationException.disabled();
        }
        if (command.points() <= 0) {
            throw LoyaltyValidationException.nonPositiveAmount();
        }
        String currency = command.currency() == null ? null : command.currency().trim().toUpperCase(Locale.ROOT);
        if (currency == null || !settings.supportedCurrencies().contains(currency)) {
            throw LoyaltyValidationException.unsupportedCurrency(command.currency());
        }
        UserAccount user = users.findByIdForUpdate(command.userId())
                .orElseThrow(() -> new UserNotFoundException(command.userId()));
        long balance = ledger.balance(user.getId());
        if (command.points() > balance) {
            throw LoyaltyValidationException.insufficientBalance(balance, command.points());
        }

        Order order = null;
        if (command.orderId() != null) {
            order = orders.findByIdForUpdate(command.orderId())
                    .orElseThrow(() -> new OrderNotFoundException(command.orderId()));
            if (!Objects.equals(order.getUserId(), user.getId())) {
                throw new InvalidOrderDataException(
                        "Order " + order.getId() + " does not belong to user " + user.getId());
            }
            if (!order.getCurrency().equals(currency)) {
                throw new CurrencyMismatchException(order.getCurrency(), currency);
            }
        }

        BigDecimal discount = BigDecimal.valueOf(command.points())
                .divide(settings.redemptionRatio(currency), 2, RoundingMode.HALF_UP);
        String description = order == null
                ? "Points redeemed"
                : "Points redeemed for order " + order.getUuid();
        ledger.append(PointsTransaction.redeem(user.getId(), command.points(), command.orderId(), description));

        if (order != null) {
            Map<String, Object> redemption = new LinkedHashMap<>();
            redemption.put("points_redeemed", command.points());
            redemption.put("discount", discount);
            redemption.put("currency", currency);
            order.putMetadata(Order.METADATA_LOYALTY_REDEMPTION, redemption);
            orders.save(order);
        }

        long remaining = balance - command.points();
        log.info("User {} redeemed {} points for {} {} (remaining balance {})",
                user.getId(), command.points(), discount, currency, remaining);
        return new RedemptionResult(user.getId(), command.points(), discount, currency, remaining);
    }

    @Override
    @Transactional
    public int processExpiration() {
        int days = settings.expirationDays();
        if (days <= 0) {
            log.debug("Points expiration disabled");
            return 0;
        }
        Instant cutoff = Instant.now().minus(days, ChronoUnit.DAYS);
        int created = 0;
        for (Long userId : ledger.findUserIdsWithUnoffsetEarnsBefore(cutoff)) {
            users.findByIdForUpdate(userId); // lock only
            long balance = ledger.balance(userId);
            for (PointsTransaction earn : ledger.findUnoffsetEarnsBefore(userId, cutoff)) {
                int amount = (int) Math.min(earn.getPoints(), Math.max(0, balance));
                if (amount < earn.getPoints()) {
                    log.warn("Clamping expiration of transaction {} for user {}: earned {}, expiring {} (balance {})",
                            earn.getId(), userId, earn.getPoints(), amount, balance);
                }
                ledger.append(PointsTransaction.expire(earn, amount));
                balance -= amount;
                created++;
            }
        }
        log.info("Points expiration created {} transactions (cutoff {})", created, cutoff);
        return created;
    }

    @Override
    @Transactional
    public int checkNewCustomerBonus(Long userId, Long orderId) {
        if (!settings.isEnabled() || !settings.isNewCustomerBonusEnabled()) {
            return 0;
        }
        Optional<UserAccount> lockedUser = users.findByIdForUpdate(userId);
        if (lockedUser.isEmpty()) {
            log.warn("Cannot check new customer bonus: user {} not found", userId);
            return 0;
        }
        if (ledger.existsForUser(userId, TransactionType.BONUS)) {
            return 0;
        }
        if (ledger.hasEarnOutsideOrder(userId, orderId)) {
            return 0;
        }
        int points = settings.newCustomerBonusPoints();
        if (points <= 0) {
            return 0;
        }
        ledger.append(PointsTransaction.bonus(userId, points, orderId, "New customer bonus"));
        log.info("Awarded new customer bonus of {} points to user {}", points, userId);
        return points;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasEarnedPoints(Long orderId) {
        return ledger.existsForOrder(orderId, TransactionType.EARN);
    }

    @Override
    @Transactional
    public Optional<LoyaltyTier> recalculateTier(Long userId) {
        UserAccount user = users.findByIdForUpdate(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));
        Optional<LoyaltyTier> tier = refreshTier(user);
        users.save(user);
        return tier;
    }

    @Override
    @Transactional(readOnly = true)
    public long getBalance(Long userId) {
        requireUser(userId);
        return ledger.balance(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public int getLevel(Long userId) {
        return TierResolver.levelFor(requireUser(userId).getTotalXp(), settings.xpPerLevel());
    }

    @Override
    @Transactional(readOnly = true)
    public LoyaltySummary getSummary(Long userId) {
        UserAccount user = requireUser(userId);
        int level = TierResolver.levelFor(user.getTotalXp(), settings.xpPerLevel());
        List<LoyaltyTier> allTiers = tiers.findAllOrdered();
        Optional<LoyaltyTier> current = TierResolver.tierFor(level, allTiers);
        int xpPerLevel = settings.xpPerLevel() > 0 ? settings.xpPerLevel() : LoyaltySettings.DEFAULT_XP_PER_LEVEL;
        Long pointsToNextTier = TierResolver.nextTier(level, allTiers)
                .map(next -> Math.max(0L, (long) (next.requiredLevel() - 1) * xpPerLevel - user.getTotalXp()))
                .orElse(null);

        return new LoyaltySummary(
                user.getId(),
                ledger.balance(userId),
                user.getTotalXp(),
                level,
                current.map(LoyaltyTier::name).orElse(null),
                current.map(LoyaltyTier::pointsMultiplier).orElse(BigDecimal.ONE),
                pointsToNextTier
        );
    }

    @Override
    @Transactional(readOnly = true)
    public List<LedgerEntryView> getTransactions(Long userId) {
        requireUser(userId);
        return ledger.findByUser(userId).stream()
                .map(LedgerEntryView::from)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<LoyaltyTier> listTiers() {
        return tiers.findAllOrdered();
    }

    @Override
    @Transactional(readOnly = true)
    public int getProductPotentialPoints(Long productId, Long userId) {
        if (!settings.isEnabled()) {
            return 0;
        }
        Product product = products.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
        BigDecimal multiplier = userId == null
                ? BigDecimal.ONE
                : users.findById(userId).map(this::tierMultiplier).orElse(BigDecimal.ONE);
        return settings.pointsCalculator().calculateItemPoints(product, 1, multiplier);
    }

    private UserAccount requireUser(Long userId) {
        return users.findById(userId).orElseThrow(() -> new UserNotFoundException(userId));
    }

    private BigDecimal tierMultiplier(UserAccount user) {
        if (user.getLoyaltyTierId() == null) {
            return BigDecimal.ONE;
        }
        return tiers.findById(user.getLoyaltyTierId())
                .map(LoyaltyTier::pointsMultiplier)
                .orElse(BigDecimal.ONE);
    }

    private Optional<LoyaltyTier> refreshTier(UserAccount user) {
        int level = TierResolver.levelFor(user.getTotalXp(), settings.xpPerLevel());
        Optional<LoyaltyTier> tier = TierResolver.tierFor(level, tiers.findAllOrdered());
        if (user.assignTier(tier.map(LoyaltyTier::id).orElse(null))) {
            log.info("User {} moved to tier {} (level {}, xp {})",
                    user.getId(), tier.map(LoyaltyTier::name).orElse("none"), level, user.getTotalXp());
        }
        return tier;
    }
}
