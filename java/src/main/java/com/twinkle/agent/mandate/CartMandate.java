package com.twinkle.agent.mandate;

import java.time.Instant;
import java.util.List;

/** Agreement to purchase one provider's service under the run's intent. */
public final class CartMandate extends Mandate {

    public static final class LineItem {
        public final String service;
        public final Amount price;
        public final String description;

        public LineItem(String service, Amount price, String description) {
            this.service = service;
            this.price = price;
            this.description = description;
        }
    }

    public final String provider;
    public final String providerName;
    public final List<LineItem> items;
    public final Amount totalPrice;
    public final String x402Endpoint;

    CartMandate(String id, Instant timestamp, String intentId, String provider, String providerName,
                List<LineItem> items, String x402Endpoint) {
        super(id, MandateType.CART, timestamp, intentId);
        this.provider = provider;
        this.providerName = providerName;
        this.items = List.copyOf(items);
        this.totalPrice = total(items);
        this.x402Endpoint = x402Endpoint;
    }

    private static Amount total(List<LineItem> items) {
        Amount sum = null;
        for (LineItem item : items) {
            sum = sum == null ? item.price : new Amount(sum.amount.add(item.price.amount), sum.asset);
        }
        return sum;
    }
}
