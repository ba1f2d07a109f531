package io.github.riemr.sampling.application.service;

import io.github.riemr.sampling.domain.exception.InvalidInputException;
import io.github.riemr.sampling.domain.model.AvailabilityRule;
import io.github.riemr.sampling.domain.model.BlackoutDates;
import io.github.riemr.sampling.domain.model.WeekdayRestriction;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 作業者マスタの備考欄を解釈する。
 * <ul>
 *   <li>「分析優先」… 割当を控えめにする補正の対象</li>
 *   <li>「月火のみ」のような 曜日 + のみ … 曜日制限</li>
 *   <li>「休:2025-04-01;2025-04-03」 … 指定日は作業不可</li>
 * </ul>
 * それ以外の記述は表示用にそのまま残す。
 */
@Component
public class NotesRuleParser {

    public static final String ANALYSIS_PRIORITY = "分析優先";

    // 「月火のみ」「水曜日のみ」「月曜・火曜のみ」
    private static final Pattern WEEKDAY_ONLY = Pattern.compile("((?:[月火水木金土日](?:曜日?)?[・、,]?)+)のみ");
    private static final Pattern BLACKOUT = Pattern.compile("休[:：]([0-9;；\\-/\\s]+)");

    private static final DateTimeFormatter FLEXIBLE_DATE = DateTimeFormatter.ofPattern("uuuu-M-d");

    static final Map<Character, DayOfWeek> WEEKDAY_KANJI = Map.of(
            '月', DayOfWeek.MONDAY,
            '火', DayOfWeek.TUESDAY,
            '水', DayOfWeek.WEDNESDAY,
            '木', DayOfWeek.THURSDAY,
            '金', DayOfWeek.FRIDAY,
            '土', DayOfWeek.SATURDAY,
            '日', DayOfWeek.SUNDAY);

    public boolean isAnalysisPriority(String notes) {
        return notes != null && notes.contains(ANALYSIS_PRIORITY);
    }

    public List<AvailabilityRule> parseRules(String notes) {
        List<AvailabilityRule> rules = new ArrayList<>();
        if (notes == null || notes.isBlank()) {
            return rules;
        }

        Matcher weekday = WEEKDAY_ONLY.matcher(notes);
        if (weekday.find()) {
            Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
            String kanji = weekday.group(1).replace("曜日", "").replace("曜", "");
            for (char c : kanji.toCharArray()) {
                DayOfWeek day = WEEKDAY_KANJI.get(c);
                if (day != null) {
                    days.add(day);
                }
            }
            rules.add(new WeekdayRestriction(days));
        }

        Matcher blackout = BLACKOUT.matcher(notes);
        if (blackout.find()) {
            Set<LocalDate> dates = new LinkedHashSet<>();
            for (String token : blackout.group(1).split("[;；]")) {
                String s = token.strip();
                if (s.isEmpty()) continue;
                try {
                    dates.add(LocalDate.parse(s.replace('/', '-'), FLEXIBLE_DATE));
                } catch (DateTimeParseException e) {
                    throw new InvalidInputException("Invalid date in notes '" + notes + "': " + s, e);
                }
            }
            if (!dates.isEmpty()) {
                rules.add(new BlackoutDates(dates));
            }
        }
        return rules;
    }
}
