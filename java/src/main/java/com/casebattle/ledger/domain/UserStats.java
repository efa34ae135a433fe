package com.casebattle.ledger.domain;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Aggregate figures for one user. A user without transactions has all-zero stats.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class UserStats {

    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);

    private final BigDecimal deposits;
    private final BigDecimal withdrawals;
    private final BigDecimal balance;
    private final BigDecimal roiPercent;

    public static UserStats empty() {
        return new UserStats(ZERO, ZERO, ZERO, ZERO);
    }

    public static UserStats from(UserSummary summary) {
        return new UserStats(
                summary.getDeposits(),
                summary.getWithdrawals(),
                summary.getBalance(),
                summary.getRoiPercent()
        );
    }

    public BigDecimal getProfitAndLoss() {
        return withdrawals.subtract(deposits);
    }

    public boolean isProfit() {
        return getProfitAndLoss().signum() >= 0;
    }
}
