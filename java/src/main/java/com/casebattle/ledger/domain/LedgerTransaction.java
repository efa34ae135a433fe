package com.casebattle.ledger.domain;

import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * One deposit or withdrawal event in the transaction log.
 *
 * Rows are never updated once inserted. The store-assigned {@code id} grows with
 * insertion and is the only ordering the log guarantees.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class LedgerTransaction {

    public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private Long id;
    private Long userId;
    private TransactionKind kind;
    private BigDecimal amount;
    private LocalDateTime createdAt;

    public LedgerTransaction(Long userId, TransactionKind kind, BigDecimal amount, LocalDateTime createdAt) {
        this.userId = userId;
        this.kind = kind;
        this.amount = amount;
        this.createdAt = createdAt;
    }
}
