package io.txevents.demo.orders.domain;

/**
 * Amount in minor currency units with an ISO 4217 currency code.
 */
public record Money(long amount, String currency) {
    public static final String DEFAULT_CURRENCY = "USD";

    public Money {
        if (currency == null || currency.length() != 3) {
            throw new IllegalArgumentException("currency must be a 3-letter ISO code, got: " + currency);
        }
    }

    public static Money zero(String currency) {
        return new Money(0, currency);
    }

    /**
     * @throws IllegalArgumentException if the currencies differ
     */
    public Money add(Money other) {
        if (!currency.equals(other.currency)) {
            throw new IllegalArgumentException(
                    "cannot add different currencies: " + currency + " and " + other.currency);
        }
        return new Money(amount + other.amount, currency);
    }

    public Money multiply(long factor) {
        return new Money(amount * factor, currency);
    }

    public boolean isZero() {
        return amount == 0;
    }

    @Override
    public String toString() {
        return amount + " " + currency;
    }
}
