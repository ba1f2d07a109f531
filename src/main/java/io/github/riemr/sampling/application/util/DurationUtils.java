package io.github.riemr.sampling.application.util;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.format.DateTimeParseException;

/**
 * 設定値の時間表記を寛容に解釈する。ISO-8601（PT30S）と 30s / 500ms / 2m / 1h / 秒数のみ を受け付ける。
 */
@Slf4j
public final class DurationUtils {
    private DurationUtils() {}

    public static Duration parseTolerant(String raw, Duration def) {
        if (raw == null || raw.isBlank()) return def;
        String s = raw.trim();
        try {
            if (s.startsWith("P") || s.startsWith("p")) {
                s = s.toUpperCase();
                if (s.matches("^PT\\d+$")) s = s + "S"; // 単位の書き忘れ
                return Duration.parse(s);
            }
            String ls = s.toLowerCase();
            if (ls.endsWith("ms")) return Duration.ofMillis(Long.parseLong(ls.substring(0, ls.length() - 2).trim()));
            if (ls.endsWith("s")) return Duration.ofSeconds(Long.parseLong(ls.substring(0, ls.length() - 1).trim()));
            if (ls.endsWith("m")) return Duration.ofMinutes(Long.parseLong(ls.substring(0, ls.length() - 1).trim()));
            if (ls.endsWith("h")) return Duration.ofHours(Long.parseLong(ls.substring(0, ls.length() - 1).trim()));
            if (ls.matches("^\\d+$")) return Duration.ofSeconds(Long.parseLong(ls));
        } catch (NumberFormatException | DateTimeParseException e) {
            log.warn("Unparseable duration '{}', falling back to {}", raw, def);
            return def;
        }
        log.warn("Unknown duration format '{}', falling back to {}", raw, def);
        return def;
    }
}
