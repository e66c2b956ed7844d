package com.twinkle.agent.mandate;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;

/** A decimal amount of a named asset, e.g. 0.10 USDC. */
public final class Amount {

    /** Decimals of the settlement token. */
    public static final int TOKEN_DECIMALS = 6;

    public final BigDecimal amount;
    public final String asset;

    public Amount(BigDecimal amount, String asset) {
        this.amount = Objects.requireNonNull(amount, "amount");
        this.asset = Objects.requireNonNull(asset, "asset");
    }

    public static Amount of(String amount, String asset) {
        return new Amount(new BigDecimal(amount), asset);
    }

    /** Value in token base units. */
    public BigInteger toAtomic() {
        return amount.movePointRight(TOKEN_DECIMALS).setScale(0, RoundingMode.DOWN).toBigIntegerExact();
    }

    /** Two-decimal display string used in receipts, e.g. {@code "0.10"}. */
    public static String format(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Amount)) return false;
        Amount other = (Amount) o;
        return amount.compareTo(other.amount) == 0 && asset.equals(other.asset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount.stripTrailingZeros(), asset);
    }

    @Override
    public String toString() {
        return amount.toPlainString() + " " + asset;
    }
}
