package com.aerotravel.realtime.domain;

import java.math.BigDecimal;

/**
 * The wallet balance implied by the most recent ledger row.
 */
public record WalletBalance(WalletType walletType, String userId, BigDecimal balance, String transactionId) {
}
