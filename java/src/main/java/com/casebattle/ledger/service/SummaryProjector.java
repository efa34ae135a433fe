package com.casebattle.ledger.service;

import com.casebattle.ledger.domain.LedgerTransaction;
import com.casebattle.ledger.domain.TransactionKind;
import com.casebattle.ledger.domain.UserSummary;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Rebuilds every user's summary from the complete transaction log.
 *
 * Summaries are never patched incrementally. Each mutation replays the whole log, so a
 * summary row exists exactly for the users that still have at least one transaction.
 */
@Component
public class SummaryProjector {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(AmountParser.SCALE);

    /**
     * Group the log by user and compute totals, balance and ROI.
     *
     * @param log          full log snapshot, in any order
     * @param recomputedAt timestamp stamped on every produced row
     * @return summaries keyed by user id, ascending
     */
    public SortedMap<Long, UserSummary> recompute(List<LedgerTransaction> log, LocalDateTime recomputedAt) {
        SortedMap<Long, Totals> totalsByUser = new TreeMap<>();
        for (LedgerTransaction transaction : log) {
            Totals totals = totalsByUser.computeIfAbsent(transaction.getUserId(), id -> new Totals());
            if (transaction.getKind() == TransactionKind.DEPOSIT) {
                totals.deposits = totals.deposits.add(transaction.getAmount());
            } else {
                totals.withdrawals = totals.withdrawals.add(transaction.getAmount());
            }
        }

        SortedMap<Long, UserSummary> summaries = new TreeMap<>();
        totalsByUser.forEach((userId, totals) -> summaries.put(userId, UserSummary.builder()
                .userId(userId)
                .deposits(totals.deposits)
                .withdrawals(totals.withdrawals)
                .balance(totals.deposits.subtract(totals.withdrawals))
                .roiPercent(roiPercent(totals.deposits, totals.withdrawals))
                .updatedAt(recomputedAt)
                .build()));
        return Collections.unmodifiableSortedMap(summaries);
    }

    /**
     * (withdrawals - deposits) / deposits * 100, rounded half-even to two places.
     * Zero when nothing has been deposited.
     */
    static BigDecimal roiPercent(BigDecimal deposits, BigDecimal withdrawals) {
        if (deposits.signum() <= 0) {
            return ZERO;
        }
        return withdrawals.subtract(deposits)
                .multiply(HUNDRED)
                .divide(deposits, AmountParser.SCALE, RoundingMode.HALF_EVEN);
    }

    private static final class Totals {
        private BigDecimal deposits = ZERO;
        private BigDecimal withdrawals = ZERO;
    }
}
