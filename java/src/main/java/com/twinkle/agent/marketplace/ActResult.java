package com.twinkle.agent.marketplace;

import com.twinkle.agent.runner.ProcurementReceipt;

public class ActResult {
    public final String category;
    public final ProcurementReceipt receipt;
    public final long durationMs;

    public ActResult(String category, ProcurementReceipt receipt, long durationMs) {
        this.category = category;
        this.receipt = receipt;
        this.durationMs = durationMs;
    }
}
