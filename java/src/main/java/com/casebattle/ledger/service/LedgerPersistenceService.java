package com.casebattle.ledger.service;

import com.casebattle.ledger.domain.LedgerSnapshot;
import com.casebattle.ledger.domain.LedgerTransaction;
import com.casebattle.ledger.domain.TransactionKind;
import com.casebattle.ledger.domain.UserSummary;
import com.casebattle.ledger.eventlog.Event;
import com.casebattle.ledger.eventlog.FileEventLogWriter;
import com.casebattle.ledger.exception.LedgerStorageException;
import com.casebattle.ledger.mapper.TransactionMapper;
import com.casebattle.ledger.mapper.UserSummaryMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Writes the transaction log and the summary table as one database transaction.
 *
 * Each mutation runs: change the log, replay the full log through {@link SummaryProjector},
 * replace the summary table, then journal the event. Any failure along the way rolls
 * everything back, so the tables always describe the same committed log.
 */
@Service
public class LedgerPersistenceService {

    private static final Logger logger = LoggerFactory.getLogger(LedgerPersistenceService.class);

    private final TransactionMapper transactionMapper;
    private final UserSummaryMapper userSummaryMapper;
    private final SummaryProjector summaryProjector;
    private final FileEventLogWriter eventLogWriter;
    private final Clock clock;

    public LedgerPersistenceService(TransactionMapper transactionMapper,
                                    UserSummaryMapper userSummaryMapper,
                                    SummaryProjector summaryProjector,
                                    FileEventLogWriter eventLogWriter,
                                    Clock clock) {
        this.transactionMapper = transactionMapper;
        this.userSummaryMapper = userSummaryMapper;
        this.summaryProjector = summaryProjector;
        this.eventLogWriter = eventLogWriter;
        this.clock = clock;
    }

    @Transactional
    public LedgerTransaction recordTransaction(long userId, TransactionKind kind, BigDecimal amount) {
        LocalDateTime now = now();
        LedgerTransaction transaction = new LedgerTransaction(userId, kind, amount, now);
        transactionMapper.insert(transaction);
        logger.debug("Appended transaction {} for user {}", transaction.getId(), userId);

        int users = rebuildSummaries(now);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("transaction_id", transaction.getId());
        payload.put("user_id", userId);
        payload.put("type", kind.getCode());
        payload.put("amount", amount.toPlainString());
        payload.put("timestamp", now.format(LedgerTransaction.TIMESTAMP_FORMAT));
        writeEvent(Event.EventType.TRANSACTION_RECORDED, payload, userId);

        logger.info("Recorded {} of {} for user {}, {} summary rows rebuilt", kind.getCode(), amount, userId, users);
        return transaction;
    }

    @Transactional
    public int deleteUserTransactions(long userId) {
        LocalDateTime now = now();
        int removed = transactionMapper.deleteByUserId(userId);
        int users = rebuildSummaries(now);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("user_id", userId);
        payload.put("removed", removed);
        payload.put("timestamp", now.format(LedgerTransaction.TIMESTAMP_FORMAT));
        writeEvent(Event.EventType.USER_RESET, payload, userId);

        logger.info("Deleted {} transactions of user {}, {} summary rows rebuilt", removed, userId, users);
        return removed;
    }

    @Transactional(readOnly = true)
    public LedgerSnapshot loadSnapshot() {
        return new LedgerSnapshot(transactionMapper.findAll(), userSummaryMapper.findAll());
    }

    private int rebuildSummaries(LocalDateTime recomputedAt) {
        List<LedgerTransaction> log = transactionMapper.findAll();
        SortedMap<Long, UserSummary> summaries = summaryProjector.recompute(log, recomputedAt);

        userSummaryMapper.deleteAll();
        if (!summaries.isEmpty()) {
            userSummaryMapper.insertAll(new ArrayList<>(summaries.values()));
        }
        logger.debug("Recomputed {} summaries from {} transactions", summaries.size(), log.size());
        return summaries.size();
    }

    private void writeEvent(Event.EventType type, Map<String, Object> payload, long userId) {
        try {
            eventLogWriter.append(type, payload);
        } catch (IOException e) {
            logger.error("Failed to journal {} for user {}", type, userId, e);
            throw new LedgerStorageException("Failed to write event log", e);
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS);
    }
}
