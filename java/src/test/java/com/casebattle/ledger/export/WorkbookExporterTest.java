package com.casebattle.ledger.export;

import com.casebattle.ledger.domain.LedgerSnapshot;
import com.casebattle.ledger.domain.LedgerTransaction;
import com.casebattle.ledger.domain.TransactionKind;
import com.casebattle.ledger.domain.UserSummary;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class WorkbookExporterTest {

    private static final LocalDateTime T1 = LocalDateTime.of(2026, 10, 19, 9, 15, 30);
    private static final LocalDateTime T2 = LocalDateTime.of(2026, 10, 19, 9, 16, 0);

    private final WorkbookExporter exporter = new WorkbookExporter();

    @Test
    void testRender_TwoSheetsWithHeadersAndRows() throws IOException {
        LedgerSnapshot snapshot = new LedgerSnapshot(
                List.of(
                        new LedgerTransaction(1L, 42L, TransactionKind.DEPOSIT, new BigDecimal("1000.00"), T1),
                        new LedgerTransaction(2L, 42L, TransactionKind.WITHDRAW, new BigDecimal("300.00"), T2)
                ),
                List.of(UserSummary.builder()
                        .userId(42L)
                        .deposits(new BigDecimal("1000.00"))
                        .withdrawals(new BigDecimal("300.00"))
                        .balance(new BigDecimal("700.00"))
                        .roiPercent(new BigDecimal("-70.00"))
                        .updatedAt(T2)
                        .build())
        );

        byte[] bytes = exporter.render(snapshot);

        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(bytes))) {
            assertThat(workbook.getNumberOfSheets()).isEqualTo(2);
            assertThat(workbook.getSheetName(0)).isEqualTo("Transactions");
            assertThat(workbook.getSheetName(1)).isEqualTo("Summary");

            Sheet transactions = workbook.getSheet("Transactions");
            assertThat(headers(transactions)).containsExactly("user_id", "type", "amount", "timestamp");
            assertThat(transactions.getLastRowNum()).isEqualTo(2);

            Row first = transactions.getRow(1);
            assertThat(first.getCell(0).getNumericCellValue()).isEqualTo(42.0);
            assertThat(first.getCell(1).getStringCellValue()).isEqualTo("deposit");
            assertThat(first.getCell(2).getNumericCellValue()).isEqualTo(1000.0);
            assertThat(first.getCell(3).getStringCellValue()).isEqualTo("2026-10-19 09:15:30");
            assertThat(transactions.getRow(2).getCell(1).getStringCellValue()).isEqualTo("withdraw");

            Sheet summary = workbook.getSheet("Summary");
            assertThat(headers(summary))
                    .containsExactly("user_id", "deposits", "withdrawals", "balance", "roi_percent", "updated_at");
            Row row = summary.getRow(1);
            assertThat(row.getCell(3).getNumericCellValue()).isEqualTo(700.0);
            assertThat(row.getCell(4).getNumericCellValue()).isEqualTo(-70.0);
            assertThat(row.getCell(5).getStringCellValue()).isEqualTo("2026-10-19 09:16:00");

            int headerFont = transactions.getRow(0).getCell(0).getCellStyle().getFontIndex();
            assertThat(workbook.getFontAt(headerFont).getBold()).isTrue();
        }
    }

    @Test
    void testRender_EmptyLedger_HeaderRowsOnly() throws IOException {
        byte[] bytes = exporter.render(new LedgerSnapshot(List.of(), List.of()));

        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(bytes))) {
            assertThat(workbook.getSheet("Transactions").getLastRowNum()).isZero();
            assertThat(workbook.getSheet("Summary").getLastRowNum()).isZero();
        }
    }

    private static List<String> headers(Sheet sheet) {
        List<String> headers = new ArrayList<>();
        sheet.getRow(0).forEach(cell -> headers.add(cell.getStringCellValue()));
        return headers;
    }
}
