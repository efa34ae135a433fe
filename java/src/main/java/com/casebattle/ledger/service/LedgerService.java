package com.casebattle.ledger.service;

import com.casebattle.ledger.domain.HistoryEntry;
import com.casebattle.ledger.domain.LedgerSnapshot;
import com.casebattle.ledger.domain.LedgerTransaction;
import com.casebattle.ledger.domain.TransactionKind;
import com.casebattle.ledger.domain.UserStats;
import com.casebattle.ledger.exception.LedgerStorageException;
import com.casebattle.ledger.export.WorkbookExporter;
import com.casebattle.ledger.mapper.TransactionMapper;
import com.casebattle.ledger.mapper.UserSummaryMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Entry point to the ledger for request handlers.
 *
 * Mutations are serialized by a write lock held across the whole database transaction
 * (including commit), so no two "mutate, recompute, persist" sequences interleave.
 * Queries share a read lock and only ever see fully committed states. Queries for a user
 * without transactions return zero stats and an empty history, never an error.
 */
@Service
public class LedgerService {

    private static final Logger logger = LoggerFactory.getLogger(LedgerService.class);

    private final LedgerPersistenceService persistenceService;
    private final TransactionMapper transactionMapper;
    private final UserSummaryMapper userSummaryMapper;
    private final WorkbookExporter workbookExporter;
    private final int defaultHistoryLimit;
    private final int maxHistoryLimit;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<TransactionKind, Counter> recordedCounters = new EnumMap<>(TransactionKind.class);
    private final Counter resetCounter;

    public LedgerService(LedgerPersistenceService persistenceService,
                         TransactionMapper transactionMapper,
                         UserSummaryMapper userSummaryMapper,
                         WorkbookExporter workbookExporter,
                         MeterRegistry meterRegistry,
                         @Value("${ledger.history.default-limit:10}") int defaultHistoryLimit,
                         @Value("${ledger.history.max-limit:100}") int maxHistoryLimit) {
        this.persistenceService = persistenceService;
        this.transactionMapper = transactionMapper;
        this.userSummaryMapper = userSummaryMapper;
        this.workbookExporter = workbookExporter;
        this.defaultHistoryLimit = defaultHistoryLimit;
        this.maxHistoryLimit = maxHistoryLimit;

        for (TransactionKind kind : TransactionKind.values()) {
            recordedCounters.put(kind, Counter.builder("ledger.transactions.recorded")
                    .description("Total number of transactions appended to the ledger")
                    .tag("kind", kind.getCode())
                    .register(meterRegistry));
        }
        this.resetCounter = Counter.builder("ledger.users.reset")
                .description("Total number of user resets")
                .register(meterRegistry);
    }

    /**
     * Append a deposit or withdrawal. The amount must already come from {@link AmountParser}.
     * The returned balance is read after commit but before the write lock is released, so it
     * reflects exactly this transaction and nothing recorded after it.
     */
    public TransactionRecordResult addTransaction(long userId, TransactionKind kind, BigDecimal amount) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(amount, "amount");

        TransactionRecordResult result = withLock(lock.writeLock(), "record transaction", () -> {
            LedgerTransaction transaction = persistenceService.recordTransaction(userId, kind, amount);
            return new TransactionRecordResult(transaction, readStats(userId).getBalance());
        });
        recordedCounters.get(kind).increment();
        return result;
    }

    /**
     * Delete all of a user's transactions and, through recomputation, their summary row.
     * Resetting a user without transactions is a no-op.
     */
    public void resetUser(long userId) {
        withLock(lock.writeLock(), "reset user", () -> persistenceService.deleteUserTransactions(userId));
        resetCounter.increment();
    }

    public UserStats getUserStats(long userId) {
        return withLock(lock.readLock(), "read stats", () -> readStats(userId));
    }

    private UserStats readStats(long userId) {
        return userSummaryMapper.findByUserId(userId)
                .map(UserStats::from)
                .orElseGet(UserStats::empty);
    }

    public List<HistoryEntry> getUserHistory(long userId) {
        return getUserHistory(userId, defaultHistoryLimit);
    }

    /**
     * Most recent transactions first, at most {@code limit} of them (capped at the configured maximum).
     */
    public List<HistoryEntry> getUserHistory(long userId, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("History limit must be positive, got " + limit);
        }
        int effectiveLimit = Math.min(limit, maxHistoryLimit);

        List<LedgerTransaction> recent = withLock(lock.readLock(), "read history",
                () -> transactionMapper.findRecentByUserId(userId, effectiveLimit));
        return recent.stream()
                .map(tx -> new HistoryEntry(tx.getKind(), tx.getAmount(), tx.getCreatedAt()))
                .collect(Collectors.toList());
    }

    /**
     * Both tables as one .xlsx workbook, taken from a single committed state.
     */
    public byte[] exportSnapshot() {
        LedgerSnapshot snapshot = withLock(lock.readLock(), "load snapshot", persistenceService::loadSnapshot);
        try {
            return workbookExporter.render(snapshot);
        } catch (IOException e) {
            logger.error("Failed to render ledger snapshot", e);
            throw new LedgerStorageException("Failed to export ledger snapshot", e);
        }
    }

    private <T> T withLock(Lock held, String operation, Supplier<T> action) {
        held.lock();
        try {
            return action.get();
        } catch (DataAccessException | TransactionException e) {
            logger.error("Storage failure during {}", operation, e);
            throw new LedgerStorageException("Storage failure during " + operation, e);
        } finally {
            held.unlock();
        }
    }
}
