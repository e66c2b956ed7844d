package com.twinkle.x402.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.twinkle.x402.model.SettlementResponseHeader;

/** Outcome of a successful provider purchase. */
public class PurchaseResult {
    /** JSON body the provider delivered. */
    public final JsonNode data;

    /** Amount paid through the payment protocol in atomic units, "0" when it was not used. */
    public final String paymentCost;

    /** Whether the provider demanded payment and a signed retry was needed. */
    public final boolean x402Used;

    /** Settlement confirmation decoded from the response header, if the provider sent one. */
    public final SettlementResponseHeader settlement;

    public PurchaseResult(JsonNode data, String paymentCost, boolean x402Used,
                          SettlementResponseHeader settlement) {
        this.data = data;
        this.paymentCost = paymentCost;
        this.x402Used = x402Used;
        this.settlement = settlement;
    }

    public static PurchaseResult free(JsonNode data) {
        return new PurchaseResult(data, "0", false, null);
    }
}
