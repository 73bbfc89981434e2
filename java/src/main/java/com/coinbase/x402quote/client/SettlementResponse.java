package com.coinbase.x402quote.client;

import com.coinbase.x402quote.model.SettlementResponseHeader;

/** JSON returned by POST /settle on the facilitator. */
public class SettlementResponse {
    /** Whether the payment settlement succeeded. */
    public boolean success;

    /** Reason reported when settlement failed. */
    public String errorReason;

    /** Transaction hash of the settled payment. */
    public String transaction;

    /** Network ID where the settlement occurred. */
    public String network;

    /** Address of the paying wallet. */
    public String payer;

    /** Converts to the body of the X-PAYMENT-RESPONSE header. */
    public SettlementResponseHeader toHeader() {
        SettlementResponseHeader header = new SettlementResponseHeader(success, transaction, network, payer);
        header.errorReason = errorReason;
        return header;
    }
}
