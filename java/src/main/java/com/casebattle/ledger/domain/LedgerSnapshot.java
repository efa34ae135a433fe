package com.casebattle.ledger.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Both ledger tables as of one committed state.
 */
@Getter
@AllArgsConstructor
public class LedgerSnapshot {

    private final List<LedgerTransaction> transactions;
    private final List<UserSummary> summaries;
}
