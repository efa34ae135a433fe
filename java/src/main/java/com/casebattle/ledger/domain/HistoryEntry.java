package com.casebattle.ledger.domain;

import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class HistoryEntry {

    private TransactionKind kind;
    private BigDecimal amount;
    private LocalDateTime timestamp;
}
