package com.replaybot.app;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ReplayBotApplicationTest {

    private static CommandLine parse(String... args) throws Exception {
        return new DefaultParser().parse(ReplayBotApplication.buildOptions(), args);
    }

    @Test
    void run_shouldReturnZeroForHelp() {
        assertEquals(ReplayBotApplication.EXIT_OK, new ReplayBotApplication().run(new String[]{"--help"}));
    }

    @Test
    void run_shouldReturnUsageForBadArguments() {
        ReplayBotApplication app = new ReplayBotApplication();
        assertEquals(ReplayBotApplication.EXIT_USAGE, app.run(new String[]{"--no-such-flag"}));
        assertEquals(ReplayBotApplication.EXIT_USAGE, app.run(new String[]{"--date", "20250230"}));
        assertEquals(ReplayBotApplication.EXIT_USAGE, app.run(new String[]{"--date", "20251216", "--mode", "minute"}));
        assertEquals(ReplayBotApplication.EXIT_USAGE, app.run(new String[]{"--workers", "0"}));
    }

    @Test
    void parseDateArg_shouldAcceptOnlyCalendarDates() {
        assertEquals(20251216, ReplayBotApplication.parseDateArg("20251216"));
        assertEquals(20240229, ReplayBotApplication.parseDateArg(" 20240229 "));
        assertThrows(IllegalArgumentException.class, () -> ReplayBotApplication.parseDateArg("20230229"));
        assertThrows(IllegalArgumentException.class, () -> ReplayBotApplication.parseDateArg("2025-12-16"));
        assertThrows(IllegalArgumentException.class, () -> ReplayBotApplication.parseDateArg(null));
    }

    @Test
    void resolveDates_shouldHandleSingleDateAndRange() throws Exception {
        assertArrayEquals(new int[]{20251216}, ReplayBotApplication.resolveDates(parse("--date", "20251216")));
        assertArrayEquals(new int[]{20251201, 20251205},
                ReplayBotApplication.resolveDates(parse("--start-date", "20251201", "--end-date", "20251205")));
        assertEquals(1, ReplayBotApplication.resolveDates(parse()).length);
    }

    @Test
    void resolveDates_shouldRejectInconsistentCombinations() throws Exception {
        CommandLine mixed = parse("--date", "20251216", "--start-date", "20251201", "--end-date", "20251205");
        CommandLine halfRange = parse("--start-date", "20251201");
        CommandLine reversed = parse("--start-date", "20251205", "--end-date", "20251201");

        assertThrows(IllegalArgumentException.class, () -> ReplayBotApplication.resolveDates(mixed));
        assertThrows(IllegalArgumentException.class, () -> ReplayBotApplication.resolveDates(halfRange));
        assertThrows(IllegalArgumentException.class, () -> ReplayBotApplication.resolveDates(reversed));
    }

    @Test
    void overridesFrom_shouldMapFlagsToConfigKeys() throws Exception {
        Map<String, String> overrides = ReplayBotApplication.overridesFrom(parse(
                "--mode", "pre_close",
                "--workers", "6",
                "--max-retry", "0",
                "--output-dir", "/tmp/out",
                "--from-tick-dir"
        ));

        assertEquals("pre-close", overrides.get("download.mode"));
        assertEquals("6", overrides.get("download.max_workers"));
        assertEquals("0", overrides.get("download.max_retry"));
        assertEquals("/tmp/out", overrides.get("download.output_dir"));
        assertEquals("true", overrides.get("download.pre_close.from_tick_dir"));
        assertThrows(IllegalArgumentException.class, () -> ReplayBotApplication.overridesFrom(parse("--max-retry", "-1")));
    }
}
