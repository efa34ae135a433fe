package com.casebattle.ledger.controller;

import com.casebattle.ledger.domain.TransactionKind;
import com.casebattle.ledger.domain.UserStats;
import com.casebattle.ledger.dto.BalanceResponse;
import com.casebattle.ledger.dto.CreateTransactionRequest;
import com.casebattle.ledger.dto.HistoryEntryResponse;
import com.casebattle.ledger.dto.StatsResponse;
import com.casebattle.ledger.dto.TransactionResponse;
import com.casebattle.ledger.service.AmountParser;
import com.casebattle.ledger.service.LedgerService;
import com.casebattle.ledger.service.TransactionRecordResult;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/v1")
@Slf4j
public class LedgerController {

    static final MediaType XLSX =
            MediaType.parseMediaType("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final LedgerService ledgerService;
    private final AmountParser amountParser;
    private final String exportFileName;

    public LedgerController(LedgerService ledgerService,
                            AmountParser amountParser,
                            @Value("${ledger.export.file-name:case_battle_ledger.xlsx}") String exportFileName) {
        this.ledgerService = ledgerService;
        this.amountParser = amountParser;
        this.exportFileName = exportFileName;
    }

    @PostMapping("/users/{userId}/transactions")
    public ResponseEntity<TransactionResponse> addTransaction(@PathVariable long userId,
                                                              @Valid @RequestBody CreateTransactionRequest request) {
        log.info("POST /api/v1/users/{}/transactions type={}", userId, request.getType());

        BigDecimal amount = amountParser.parse(request.getAmount());
        TransactionKind kind = TransactionKind.fromCode(request.getType());

        TransactionRecordResult result = ledgerService.addTransaction(userId, kind, amount);

        return ResponseEntity.status(HttpStatus.CREATED)
                .body(TransactionResponse.from(result.getTransaction(), result.getBalance()));
    }

    @DeleteMapping("/users/{userId}/transactions")
    public ResponseEntity<Void> resetUser(@PathVariable long userId) {
        log.info("DELETE /api/v1/users/{}/transactions", userId);
        ledgerService.resetUser(userId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/users/{userId}/stats")
    public ResponseEntity<StatsResponse> getStats(@PathVariable long userId) {
        log.debug("GET /api/v1/users/{}/stats", userId);
        return ResponseEntity.ok(StatsResponse.from(userId, ledgerService.getUserStats(userId)));
    }

    @GetMapping("/users/{userId}/balance")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable long userId) {
        log.debug("GET /api/v1/users/{}/balance", userId);
        UserStats stats = ledgerService.getUserStats(userId);
        return ResponseEntity.ok(BalanceResponse.builder()
                .userId(userId)
                .balance(stats.getBalance())
                .roiPercent(stats.getRoiPercent())
                .build());
    }

    @GetMapping("/users/{userId}/history")
    public ResponseEntity<List<HistoryEntryResponse>> getHistory(@PathVariable long userId,
                                                                 @RequestParam(required = false) Integer limit) {
        log.debug("GET /api/v1/users/{}/history?limit={}", userId, limit);

        List<HistoryEntryResponse> responses = (limit == null
                ? ledgerService.getUserHistory(userId)
                : ledgerService.getUserHistory(userId, limit))
                .stream()
                .map(HistoryEntryResponse::from)
                .collect(Collectors.toList());

        return ResponseEntity.ok(responses);
    }

    @GetMapping("/export")
    public ResponseEntity<byte[]> export() {
        log.info("GET /api/v1/export");
        byte[] workbook = ledgerService.exportSnapshot();
        return ResponseEntity.ok()
                .contentType(XLSX)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(exportFileName).build().toString())
                .body(workbook);
    }
}
