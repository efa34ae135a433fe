package com.casebattle.ledger.export;

import com.casebattle.ledger.domain.LedgerSnapshot;
import com.casebattle.ledger.domain.LedgerTransaction;
import com.casebattle.ledger.domain.UserSummary;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;

/**
 * Renders a ledger snapshot as an .xlsx workbook with a "Transactions" and a "Summary" sheet.
 *
 * Column order of both sheets is part of the export format and must not change.
 */
@Component
@Slf4j
public class WorkbookExporter {

    public static final String TRANSACTIONS_SHEET = "Transactions";
    public static final String SUMMARY_SHEET = "Summary";
    public static final List<String> TRANSACTION_HEADERS = List.of("user_id", "type", "amount", "timestamp");
    public static final List<String> SUMMARY_HEADERS =
            List.of("user_id", "deposits", "withdrawals", "balance", "roi_percent", "updated_at");

    private static final byte[] HEADER_FILL_RGB = {(byte) 0x44, (byte) 0x72, (byte) 0xC4};
    private static final int MAX_COLUMN_WIDTH = 255 * 256;

    public byte[] render(LedgerSnapshot snapshot) throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {

            CellStyle headerStyle = headerStyle(workbook);

            Sheet transactions = workbook.createSheet(TRANSACTIONS_SHEET);
            writeHeader(transactions, TRANSACTION_HEADERS, headerStyle);
            int rowIndex = 1;
            for (LedgerTransaction tx : snapshot.getTransactions()) {
                Row row = transactions.createRow(rowIndex++);
                row.createCell(0).setCellValue(tx.getUserId());
                row.createCell(1).setCellValue(tx.getKind().getCode());
                row.createCell(2).setCellValue(toDouble(tx.getAmount()));
                row.createCell(3).setCellValue(tx.getCreatedAt().format(LedgerTransaction.TIMESTAMP_FORMAT));
            }
            sizeColumns(transactions, TRANSACTION_HEADERS.size());

            Sheet summary = workbook.createSheet(SUMMARY_SHEET);
            writeHeader(summary, SUMMARY_HEADERS, headerStyle);
            rowIndex = 1;
            for (UserSummary s : snapshot.getSummaries()) {
                Row row = summary.createRow(rowIndex++);
                row.createCell(0).setCellValue(s.getUserId());
                row.createCell(1).setCellValue(toDouble(s.getDeposits()));
                row.createCell(2).setCellValue(toDouble(s.getWithdrawals()));
                row.createCell(3).setCellValue(toDouble(s.getBalance()));
                row.createCell(4).setCellValue(toDouble(s.getRoiPercent()));
                row.createCell(5).setCellValue(s.getUpdatedAt().format(LedgerTransaction.TIMESTAMP_FORMAT));
            }
            sizeColumns(summary, SUMMARY_HEADERS.size());

            workbook.write(out);
            log.debug("Rendered workbook: {} transactions, {} summaries, {} bytes",
                    snapshot.getTransactions().size(), snapshot.getSummaries().size(), out.size());
            return out.toByteArray();
        }
    }

    private static CellStyle headerStyle(XSSFWorkbook workbook) {
        XSSFFont font = workbook.createFont();
        font.setBold(true);
        font.setColor(IndexedColors.WHITE.getIndex());

        XSSFCellStyle style = workbook.createCellStyle();
        style.setFont(font);
        style.setFillForegroundColor(new XSSFColor(HEADER_FILL_RGB, null));
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        style.setAlignment(HorizontalAlignment.CENTER);
        return style;
    }

    private static void writeHeader(Sheet sheet, List<String> headers, CellStyle style) {
        Row header = sheet.createRow(0);
        for (int i = 0; i < headers.size(); i++) {
            Cell cell = header.createCell(i);
            cell.setCellValue(headers.get(i));
            cell.setCellStyle(style);
        }
    }

    // Width from the longest rendered value; Sheet.autoSizeColumn needs AWT fonts.
    private static void sizeColumns(Sheet sheet, int columns) {
        DataFormatter formatter = new DataFormatter();
        for (int col = 0; col < columns; col++) {
            int maxLength = 0;
            for (Row row : sheet) {
                Cell cell = row.getCell(col);
                if (cell != null) {
                    maxLength = Math.max(maxLength, formatter.formatCellValue(cell).length());
                }
            }
            sheet.setColumnWidth(col, Math.min((maxLength + 2) * 256, MAX_COLUMN_WIDTH));
        }
    }

    private static double toDouble(BigDecimal value) {
        return value.doubleValue();
    }
}
