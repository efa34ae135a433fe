package com.casebattle.ledger.dto;

import com.casebattle.ledger.domain.LedgerTransaction;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransactionResponse {

    private Long userId;
    private String type;
    private BigDecimal amount;
    private String timestamp;
    private BigDecimal balance;

    public static TransactionResponse from(LedgerTransaction transaction, BigDecimal balanceAfter) {
        return new TransactionResponse(
                transaction.getUserId(),
                transaction.getKind().getCode(),
                transaction.getAmount(),
                transaction.getCreatedAt().format(LedgerTransaction.TIMESTAMP_FORMAT),
                balanceAfter
        );
    }
}
