package com.casebattle.ledger.dto;

import com.casebattle.ledger.domain.HistoryEntry;
import com.casebattle.ledger.domain.LedgerTransaction;
import lombok.*;

import java.math.BigDecimal;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HistoryEntryResponse {
    private String type;
    private BigDecimal amount;
    private String timestamp;

    public static HistoryEntryResponse from(HistoryEntry entry) {
        return HistoryEntryResponse.builder()
                .type(entry.getKind().getCode())
                .amount(entry.getAmount())
                .timestamp(entry.getTimestamp().format(LedgerTransaction.TIMESTAMP_FORMAT))
                .build();
    }
}
