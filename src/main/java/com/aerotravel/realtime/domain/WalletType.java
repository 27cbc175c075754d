package com.aerotravel.realtime.domain;

/**
 * Which wallet ledger a balance channel follows.
 */
public enum WalletType {
    /** Partner (mitra) wallets. */
    PARTNER("partner", "mitra_wallet_transactions"),
    GUIDE("guide", "guide_wallet_transactions");

    private final String key;
    private final String transactionsTable;

    WalletType(String key, String transactionsTable) {
        this.key = key;
        this.transactionsTable = transactionsTable;
    }

    /**
     * The token used in channel names, e.g. {@code wallet-partner-<userId>}.
     */
    public String key() {
        return key;
    }

    public String transactionsTable() {
        return transactionsTable;
    }
}
