package com.aerotravel.realtime.domain;

import com.aerotravel.realtime.api.ChangeEvent;
import com.aerotravel.realtime.api.ChannelConfig;
import com.aerotravel.realtime.api.ChannelName;
import com.aerotravel.realtime.api.RowChangePayload;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;
import java.util.Optional;

/**
 * Streams new ledger rows of one wallet, for transaction lists:
 * channel {@code wallet-transactions-<type>-<userId>}, INSERT only.
 */
public final class WalletTransactionsAdapter extends DomainAdapter<WalletTransaction> {

    private final WalletType walletType;
    private final String userId;

    public WalletTransactionsAdapter(ObjectMapper mapper, WalletType walletType, String userId) {
        super(mapper);
        this.walletType = Objects.requireNonNull(walletType, "walletType");
        this.userId = requireId(userId, "userId");
    }

    @Override
    public ChannelName channelName() {
        return ChannelName.of("wallet-transactions-" + walletType.key(), userId);
    }

    @Override
    public ChannelConfig config() {
        return ChannelConfig.of(walletType.transactionsTable(), ChangeEvent.INSERT, ChannelConfig.eq("user_id", userId));
    }

    @Override
    public Optional<WalletTransaction> transform(RowChangePayload<JsonNode> payload) {
        return payload.newImage().map(row -> readFullRow(row, WalletTransaction.class));
    }
}
