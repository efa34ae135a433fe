package com.casebattle.ledger.dto;

import lombok.*;

import java.math.BigDecimal;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BalanceResponse {
    private Long userId;
    private BigDecimal balance;
    private BigDecimal roiPercent;
}
