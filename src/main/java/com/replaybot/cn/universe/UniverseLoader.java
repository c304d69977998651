package com.replaybot.cn.universe;

import com.replaybot.cn.model.FetchTarget;
import com.replaybot.cn.output.CsvSupport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 读取股票清单（CSV 或 XLS/XLSX）。
 * 列：stock_code、stock_name、exchange（上海/深圳/北交所 或 SH/SZ/BJ），可选 market_type 覆盖市场代码。
 * 代码补零到 6 位并去重；无法确定市场的行跳过并计数告警。
 */
public final class UniverseLoader {
    private static final Logger LOG = LogManager.getLogger(UniverseLoader.class);
    private static final int HEADER_SCAN_ROWS = 40;
    private static final Map<String, Integer> EXCHANGE_MARKETS = buildExchangeMarkets();

    public List<FetchTarget> load(Path path) throws IOException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new IllegalStateException("universe file not found: " + path);
        }
        byte[] bytes = Files.readAllBytes(path);
        String lower = path.getFileName().toString().toLowerCase(Locale.ROOT);
        ParseResult parsed = lower.endsWith(".xls") || lower.endsWith(".xlsx")
                ? parseExcel(bytes)
                : parseCsv(bytes);
        if (parsed.targets.isEmpty()) {
            throw new IllegalStateException("universe is empty: " + path
                    + (parsed.skippedUnknownExchange > 0 ? " (" + parsed.skippedUnknownExchange + " rows with unknown exchange)" : ""));
        }
        if (parsed.skippedUnknownExchange > 0) {
            LOG.warn("skipped {} universe rows with an unknown exchange and no market_type", parsed.skippedUnknownExchange);
        }
        LOG.info("universe loaded from {}: {} targets {}", path, parsed.targets.size(), countByExchange(parsed.targets));
        return parsed.targets;
    }

    /**
     * Keeps the targets whose code is in {@code codes}, preserving universe order.
     */
    public static List<FetchTarget> restrictTo(List<FetchTarget> universe, Collection<String> codes) {
        Set<String> allowed = new HashSet<>(codes);
        List<FetchTarget> out = new ArrayList<>();
        for (FetchTarget target : universe) {
            if (allowed.contains(target.code)) {
                out.add(target);
            }
        }
        return out;
    }

    /**
     * Market code for an exchange label, or -1 when the label is unknown.
     */
    public static int marketOf(String exchange) {
        String key = exchange == null ? "" : exchange.trim().toUpperCase(Locale.ROOT);
        return EXCHANGE_MARKETS.getOrDefault(key, -1);
    }

    static String normalizeCode(String input) {
        if (input == null) {
            return "";
        }
        String raw = input.trim();
        int dot = raw.indexOf('.');
        if (dot > 0 && raw.substring(dot + 1).matches("0*")) {
            raw = raw.substring(0, dot);
        }
        String digits = raw.replaceAll("[^0-9]", "");
        if (digits.isEmpty() || digits.length() > 6) {
            return "";
        }
        return "0".repeat(6 - digits.length()) + digits;
    }

    private ParseResult parseCsv(byte[] bytes) {
        String text = CsvSupport.stripBom(decode(bytes));
        String[] lines = text.split("\\r?\\n");
        ParseResult result = new ParseResult();
        Columns columns = null;
        for (String rawLine : lines) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                continue;
            }
            List<String> cols = CsvSupport.splitLine(line);
            if (columns == null) {
                columns = Columns.detect(cols);
                if (columns.codeCol < 0) {
                    throw new IllegalStateException("universe header has no stock_code column: " + line);
                }
                continue;
            }
            result.accept(
                    cell(cols, columns.codeCol),
                    cell(cols, columns.nameCol),
                    cell(cols, columns.exchangeCol),
                    cell(cols, columns.marketTypeCol)
            );
        }
        return result;
    }

    private ParseResult parseExcel(byte[] bytes) throws IOException {
        try (Workbook wb = WorkbookFactory.create(new ByteArrayInputStream(bytes))) {
            DataFormatter formatter = new DataFormatter(Locale.ROOT);
            for (int s = 0; s < wb.getNumberOfSheets(); s++) {
                Sheet sheet = wb.getSheetAt(s);
                int headerRow = -1;
                Columns columns = null;
                for (int r = 0; r <= Math.min(sheet.getLastRowNum(), HEADER_SCAN_ROWS); r++) {
                    Row row = sheet.getRow(r);
                    if (row == null) {
                        continue;
                    }
                    List<String> texts = new ArrayList<>();
                    for (int c = 0; c < Math.max(0, row.getLastCellNum()); c++) {
                        texts.add(getCellText(row, c, formatter));
                    }
                    Columns candidate = Columns.detect(texts);
                    if (candidate.codeCol >= 0) {
                        headerRow = r;
                        columns = candidate;
                        break;
                    }
                }
                if (columns == null) {
                    continue;
                }
                ParseResult result = new ParseResult();
                for (int r = headerRow + 1; r <= sheet.getLastRowNum(); r++) {
                    Row row = sheet.getRow(r);
                    if (row == null) {
                        continue;
                    }
                    result.accept(
                            getCellText(row, columns.codeCol, formatter),
                            getCellText(row, columns.nameCol, formatter),
                            getCellText(row, columns.exchangeCol, formatter),
                            getCellText(row, columns.marketTypeCol, formatter)
                    );
                }
                return result;
            }
        }
        throw new IllegalStateException("no sheet with a stock_code header found in universe workbook");
    }

    private String getCellText(Row row, int colIndex, DataFormatter formatter) {
        if (row == null || colIndex < 0) {
            return "";
        }
        Cell cell = row.getCell(colIndex);
        if (cell == null) {
            return "";
        }
        return formatter.formatCellValue(cell);
    }

    private static String cell(List<String> cols, int index) {
        if (index < 0 || index >= cols.size()) {
            return "";
        }
        return cols.get(index).trim();
    }

    // Files exported by Chinese tooling are often GBK.
    private static String decode(byte[] bytes) {
        String utf8 = new String(bytes, StandardCharsets.UTF_8);
        if (utf8.indexOf('\uFFFD') >= 0) {
            return new String(bytes, Charset.forName("GBK"));
        }
        return utf8;
    }

    private static Map<String, Integer> countByExchange(List<FetchTarget> targets) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (FetchTarget target : targets) {
            String key = target.exchange.isEmpty() ? "market=" + target.market : target.exchange;
            counts.merge(key, 1, Integer::sum);
        }
        return counts;
    }

    private static Map<String, Integer> buildExchangeMarkets() {
        Map<String, Integer> map = new LinkedHashMap<>();
        map.put("上海", 1);
        map.put("上交所", 1);
        map.put("SH", 1);
        map.put("SSE", 1);
        map.put("深圳", 0);
        map.put("深交所", 0);
        map.put("SZ", 0);
        map.put("SZSE", 0);
        map.put("北交所", 2);
        map.put("北京", 2);
        map.put("BJ", 2);
        map.put("BSE", 2);
        return map;
    }

    private static final class Columns {
        final int codeCol;
        final int nameCol;
        final int exchangeCol;
        final int marketTypeCol;

        private Columns(int codeCol, int nameCol, int exchangeCol, int marketTypeCol) {
            this.codeCol = codeCol;
            this.nameCol = nameCol;
            this.exchangeCol = exchangeCol;
            this.marketTypeCol = marketTypeCol;
        }

        static Columns detect(List<String> header) {
            int code = -1;
            int name = -1;
            int exchange = -1;
            int marketType = -1;
            for (int c = 0; c < header.size(); c++) {
                String normalized = normalizeHeader(header.get(c));
                if (marketType < 0 && normalized.equals("markettype")) {
                    marketType = c;
                } else if (code < 0 && (normalized.equals("stockcode") || normalized.equals("code")
                        || normalized.equals("代码") || normalized.equals("股票代码"))) {
                    code = c;
                } else if (name < 0 && (normalized.equals("stockname") || normalized.equals("name")
                        || normalized.equals("名称") || normalized.equals("股票名称"))) {
                    name = c;
                } else if (exchange < 0 && (normalized.equals("exchange") || normalized.equals("交易所")
                        || normalized.equals("市场"))) {
                    exchange = c;
                }
            }
            return new Columns(code, name, exchange, marketType);
        }

        private static String normalizeHeader(String text) {
            if (text == null) {
                return "";
            }
            return CsvSupport.stripBom(text).trim().toLowerCase(Locale.ROOT)
                    .replace(" ", "")
                    .replace("\u3000", "")
                    .replace("-", "")
                    .replace("_", "");
        }
    }

    private static final class ParseResult {
        final List<FetchTarget> targets = new ArrayList<>();
        final Set<String> seen = new HashSet<>();
        int skippedUnknownExchange;

        void accept(String rawCode, String name, String exchange, String marketType) {
            String code = normalizeCode(rawCode);
            if (code.isEmpty()) {
                return;
            }
            int market = parseMarketType(marketType);
            if (market < 0) {
                market = marketOf(exchange);
            }
            if (market < 0) {
                skippedUnknownExchange++;
                return;
            }
            if (seen.add(code)) {
                targets.add(new FetchTarget(code, name, exchange, market));
            }
        }

        private static int parseMarketType(String raw) {
            String value = raw == null ? "" : raw.trim();
            if (value.endsWith(".0")) {
                value = value.substring(0, value.length() - 2);
            }
            if (value.equals("0") || value.equals("1") || value.equals("2")) {
                return Integer.parseInt(value);
            }
            return -1;
        }
    }
}
