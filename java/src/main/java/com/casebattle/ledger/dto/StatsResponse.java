package com.casebattle.ledger.dto;

import com.casebattle.ledger.domain.UserStats;
import lombok.*;

import java.math.BigDecimal;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StatsResponse {
    private Long userId;
    private BigDecimal deposits;
    private BigDecimal withdrawals;
    private BigDecimal balance;
    private BigDecimal roiPercent;
    private BigDecimal profitAndLoss;
    private boolean profit;

    public static StatsResponse from(long userId, UserStats stats) {
        return StatsResponse.builder()
                .userId(userId)
                .deposits(stats.getDeposits())
                .withdrawals(stats.getWithdrawals())
                .balance(stats.getBalance())
                .roiPercent(stats.getRoiPercent())
                .profitAndLoss(stats.getProfitAndLoss())
                .profit(stats.isProfit())
                .build();
    }
}
