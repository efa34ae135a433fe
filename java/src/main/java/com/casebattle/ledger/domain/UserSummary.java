package com.casebattle.ledger.domain;

import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
public class UserSummary {

    private Long userId;
    private BigDecimal deposits;
    private BigDecimal withdrawals;
    private BigDecimal balance;
    private BigDecimal roiPercent;
    private LocalDateTime updatedAt;
}
