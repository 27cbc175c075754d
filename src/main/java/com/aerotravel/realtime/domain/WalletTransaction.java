package com.aerotravel.realtime.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * A wallet ledger row from {@code mitra_wallet_transactions} or
 * {@code guide_wallet_transactions}.
 */
public record WalletTransaction(
        String id,
        String walletId,
        BigDecimal amount,
        BigDecimal balanceBefore,
        BigDecimal balanceAfter,
        String transactionType,
        String description,
        String createdAt,
        JsonNode row
) implements RowRecord<WalletTransaction> {

    @Override
    public WalletTransaction withRow(JsonNode row) {
        return new WalletTransaction(id, walletId, amount, balanceBefore, balanceAfter,
                transactionType, description, createdAt, row);
    }
}
