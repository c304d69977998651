package com.replaybot.cn.output;

import com.replaybot.cn.model.DownloadMode;
import com.replaybot.cn.model.FetchTarget;
import com.replaybot.cn.model.TickRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 单个运行目录（{@code <output>/<mode>_<date>/}）下的逐股产物读写。
 * 产物先写入 {@code .part} 临时文件再原子改名，因此目录中出现的 {@code <code>.csv} 都是完整文件。
 */
public final class ArtifactStore {
    private static final Logger LOG = LogManager.getLogger(ArtifactStore.class);

    public static final String TICK_HEADER = "time,price,vol,buyorsell,stock_code,stock_name,exchange,date";
    public static final String PRE_CLOSE_HEADER = "stock_code,pre_close,exchange,date";
    private static final Pattern ARTIFACT_NAME = Pattern.compile("(\\d{6})\\.csv");
    private static final String PART_SUFFIX = ".part";

    private final Path runDir;
    private final int date;

    public ArtifactStore(Path outputRoot, DownloadMode mode, int date) {
        this.runDir = runDir(outputRoot, mode, date);
        this.date = date;
    }

    public static Path runDir(Path outputRoot, DownloadMode mode, int date) {
        return outputRoot.resolve(mode.dirPrefix() + "_" + date);
    }

    public Path runDir() {
        return runDir;
    }

    public Path artifactPath(String code) {
        return runDir.resolve(code + ".csv");
    }

    public boolean exists(String code) {
        return Files.isRegularFile(artifactPath(code));
    }

    public void writeTicks(FetchTarget target, List<TickRecord> records) throws IOException {
        List<String> lines = new ArrayList<>(records.size() + 1);
        lines.add(TICK_HEADER);
        for (TickRecord record : records) {
            lines.add(CsvSupport.joinLine(List.of(
                    record.time,
                    formatDecimal(record.price),
                    Long.toString(record.vol),
                    Integer.toString(record.buyOrSell),
                    target.code,
                    target.name,
                    target.exchange,
                    Integer.toString(date)
            )));
        }
        writeLinesAtomically(artifactPath(target.code), lines);
    }

    public void writePreClose(FetchTarget target, double preClose) throws IOException {
        List<String> lines = List.of(
                PRE_CLOSE_HEADER,
                CsvSupport.joinLine(List.of(
                        target.code,
                        formatDecimal(preClose),
                        target.exchange,
                        Integer.toString(date)
                ))
        );
        writeLinesAtomically(artifactPath(target.code), lines);
    }

    /**
     * Codes with a finished artifact in this run directory, sorted.
     */
    public List<String> listCodes() throws IOException {
        if (!Files.isDirectory(runDir)) {
            return List.of();
        }
        List<String> codes = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(runDir)) {
            for (Path path : stream) {
                Matcher m = ARTIFACT_NAME.matcher(path.getFileName().toString());
                if (m.matches() && Files.isRegularFile(path)) {
                    codes.add(m.group(1));
                }
            }
        }
        codes.sort(Comparator.naturalOrder());
        return codes;
    }

    /**
     * Concatenates every per-code pre-close row into one CSV; returns the number of rows written.
     */
    public int mergePreClose(Path outFile) throws IOException {
        List<String> lines = new ArrayList<>();
        lines.add(PRE_CLOSE_HEADER);
        for (String code : listCodes()) {
            List<String> rows = Files.readAllLines(artifactPath(code), StandardCharsets.UTF_8);
            for (int i = 1; i < rows.size(); i++) {
                String row = rows.get(i).trim();
                if (!row.isEmpty()) {
                    lines.add(row);
                }
            }
        }
        writeLinesAtomically(outFile, lines);
        return lines.size() - 1;
    }

    /**
     * Lists {@code <prefix>_yyyyMMdd} directories under the output root, newest first.
     */
    public static List<RunDirectory> scanRunDirectories(Path outputRoot, DownloadMode mode) throws IOException {
        if (outputRoot == null || !Files.isDirectory(outputRoot)) {
            return List.of();
        }
        Pattern dirName = Pattern.compile(Pattern.quote(mode.dirPrefix()) + "_(\\d{8})");
        List<RunDirectory> out = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(outputRoot)) {
            for (Path path : stream) {
                Matcher m = dirName.matcher(path.getFileName().toString());
                if (!m.matches() || !Files.isDirectory(path)) {
                    continue;
                }
                int date = Integer.parseInt(m.group(1));
                int count = new ArtifactStore(outputRoot, mode, date).listCodes().size();
                out.add(new RunDirectory(path.getFileName().toString(), date, count));
            }
        }
        out.sort(Comparator.comparingInt(RunDirectory::date).reversed());
        return out;
    }

    public static void writeLinesAtomically(Path target, List<String> lines) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path part = target.resolveSibling(target.getFileName() + PART_SUFFIX);
        try {
            Files.write(part, lines, StandardCharsets.UTF_8);
            try {
                Files.move(part, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(part);
            } catch (IOException cleanup) {
                LOG.debug("could not remove partial file {}: {}", part, cleanup.getMessage());
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    static String formatDecimal(double value) {
        if (!Double.isFinite(value)) {
            return "";
        }
        String text = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        return "-0".equals(text) ? "0" : text;
    }

    public record RunDirectory(String name, int date, int artifactCount) {
    }
}
