package com.aerotravel.realtime.domain;

import com.aerotravel.realtime.api.ChangeEvent;
import com.aerotravel.realtime.api.ChannelConfig;
import com.aerotravel.realtime.api.ChannelName;
import com.aerotravel.realtime.api.RowChangePayload;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Follows the balance of one partner or guide wallet.
 *
 * <p>Channel {@code wallet-<type>-<userId>} on the wallet's transactions table,
 * every event type, filtered by {@code user_id}. Each ledger row yields the
 * balance it implies: {@code balance_after}, else {@code balance_before},
 * else zero.</p>
 */
public final class WalletBalanceAdapter extends DomainAdapter<WalletBalance> {

    private final WalletType walletType;
    private final String userId;

    public WalletBalanceAdapter(ObjectMapper mapper, WalletType walletType, String userId) {
        super(mapper);
        this.walletType = Objects.requireNonNull(walletType, "walletType");
        this.userId = requireId(userId, "userId");
    }

    @Override
    public ChannelName channelName() {
        return ChannelName.of("wallet-" + walletType.key(), userId);
    }

    @Override
    public ChannelConfig config() {
        return ChannelConfig.of(walletType.transactionsTable(), ChangeEvent.ALL, ChannelConfig.eq("user_id", userId));
    }

    @Override
    public Optional<WalletBalance> transform(RowChangePayload<JsonNode> payload) {
        WalletTransaction tx = readRow(payload.latestImage(), WalletTransaction.class);
        return Optional.of(new WalletBalance(walletType, userId, balanceOf(tx), tx.id()));
    }

    /**
     * {@code balance_after}, else {@code balance_before}, else zero. The order
     * is fixed: a row carrying both reports the post-transaction balance.
     */
    public static BigDecimal balanceOf(WalletTransaction tx) {
        if (tx.balanceAfter() != null) {
            return tx.balanceAfter();
        }
        if (tx.balanceBefore() != null) {
            return tx.balanceBefore();
        }
        return BigDecimal.ZERO;
    }
}
