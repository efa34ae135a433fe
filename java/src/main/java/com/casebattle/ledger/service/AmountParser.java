package com.casebattle.ledger.service;

import com.casebattle.ledger.exception.InvalidAmountException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Turns user-typed amount text into a ledger amount.
 *
 * Accepts either '.' or ',' as the decimal separator and surrounding whitespace.
 * The result is always strictly positive with exactly two fractional digits, rounded
 * half-even ("0.005" becomes 0.00 and is rejected, "0.015" becomes 0.02), and at most
 * {@link #MAX_AMOUNT}, the widest value the {@code amount DECIMAL(19, 2)} column holds.
 * The transaction log trusts this and does not validate amounts again.
 */
@Component
@Slf4j
public class AmountParser {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;
    public static final BigDecimal MAX_AMOUNT = new BigDecimal("99999999999999999.99");

    // Anything at or below this rounds to 0.00
    private static final BigDecimal HALF_CENT = new BigDecimal("0.005");

    public BigDecimal parse(String raw) {
        if (raw == null) {
            throw new InvalidAmountException(null, "Amount is required");
        }

        String normalized = raw.replace(',', '.').trim();
        BigDecimal value;
        try {
            value = new BigDecimal(normalized);
        } catch (NumberFormatException e) {
            log.debug("Rejected non-numeric amount: '{}'", raw);
            throw new InvalidAmountException(raw, "Amount must be a number, got '" + raw + "'", e);
        }

        // Bounds are checked before setScale, which would expand an exponent such as "1e999999999"
        if (value.compareTo(HALF_CENT) <= 0) {
            log.debug("Rejected non-positive amount: '{}'", raw);
            throw new InvalidAmountException(raw, "Amount must be greater than 0, got '" + raw + "'");
        }
        if (value.compareTo(MAX_AMOUNT) > 0) {
            log.debug("Rejected oversized amount: '{}'", raw);
            throw new InvalidAmountException(raw,
                    "Amount must be at most " + MAX_AMOUNT.toPlainString() + ", got '" + raw + "'");
        }
        return value.setScale(SCALE, ROUNDING);
    }
}
