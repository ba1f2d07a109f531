package io.github.riemr.sampling.application.service;

import io.github.riemr.sampling.application.util.CsvUtils;
import io.github.riemr.sampling.domain.exception.InvalidInputException;
import io.github.riemr.sampling.domain.model.MasterData;
import io.github.riemr.sampling.domain.model.ScheduleEntry;
import io.github.riemr.sampling.domain.model.TaskDefinition;
import io.github.riemr.sampling.domain.model.Worker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 作業者マスタ・業務マスタ・スケジュールの CSV 読み込み。
 * ヘッダは元の Excel シートの日本語列名、または英語名のどちらでもよい。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MasterDataLoader {

    /** Excel シリアル値の起点。シリアル 46113 が 2025-04-01 になるよう合わせてある */
    static final LocalDate EXCEL_BASE = LocalDate.of(1899, 12, 31);
    static final int EXCEL_OFFSET = 366;

    private static final DateTimeFormatter FLEXIBLE_DATE = DateTimeFormatter.ofPattern("uuuu-M-d");

    private static final Map<String, String> WORKER_HEADERS = aliases(
            "name", "名前", "氏名", "", "unnamed: 0",
            "priority", "優先順位",
            "skill", "技量",
            "trouble", "トラブル",
            "personality", "性情",
            "strength", "力",
            "ship", "船上",
            "driving", "運転",
            "navigation", "操縦",
            "notes", "備考");

    private static final Map<String, String> TASK_HEADERS = aliases(
            "task_id", "番号",
            "task_name", "業務名（略）", "業務名",
            "area", "地区",
            "required_workers", "人工",
            "required_skill", "技量",
            "required_strength", "体力",
            "urgency", "緊急対応",
            "ship_work", "船上",
            "navigation_required", "操船",
            "duration", "所要時間");

    private final ResourceLoader resourceLoader;
    private final NotesRuleParser notesRuleParser;

    /**
     * @param workersLocation  classpath: / file: 付き、または素のファイルパス
     */
    public MasterData load(String workersLocation, String tasksLocation, String scheduleLocation) {
        log.info("Loading master data: workers={}, tasks={}, schedule={}",
                workersLocation, tasksLocation, scheduleLocation);
        List<Worker> workers;
        List<TaskDefinition> tasks;
        List<ScheduleEntry> schedule;
        try (Reader w = open(workersLocation); Reader t = open(tasksLocation); Reader s = open(scheduleLocation)) {
            workers = readWorkers(w);
            tasks = readTasks(t);
            schedule = readSchedule(s);
        } catch (IOException e) {
            throw new InvalidInputException("Failed to read CSV: " + e.getMessage(), e);
        }
        log.info("Loaded workers={}, tasks={}, schedule entries={}", workers.size(), tasks.size(), schedule.size());
        return MasterData.builder()
                .workers(workers)
                .tasks(tasks)
                .schedule(schedule)
                .loadedAt(Instant.now())
                .source(workersLocation + ", " + tasksLocation + ", " + scheduleLocation)
                .build();
    }

    public List<Worker> readWorkers(Reader in) throws IOException {
        List<Worker> list = new ArrayList<>();
        try (BufferedReader br = new BufferedReader(in)) {
            Header h = readHeader(br, WORKER_HEADERS, "workers", List.of("name", "skill", "strength"));
            String line;
            int lineNo = 1;
            while ((line = br.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) continue;
                Row r = h.row(CsvUtils.splitLine(line), "workers", lineNo);
                String notes = r.text("notes", "");
                list.add(Worker.builder()
                        .name(r.required("name"))
                        .priority(r.integer("priority", list.size() + 1))
                        .skill(r.integer("skill", null))
                        .strength(r.integer("strength", null))
                        .troubleTolerance(r.integer("trouble", 0))
                        .temperament(r.integer("personality", 0))
                        .vesselAbility(r.level("ship"))
                        .canDrive(r.flag("driving"))
                        .navigationAbility(r.level("navigation"))
                        .analysisPriority(notesRuleParser.isAnalysisPriority(notes))
                        .availabilityRules(notesRuleParser.parseRules(notes))
                        .notes(notes)
                        .build());
            }
        }
        return list;
    }

    public List<TaskDefinition> readTasks(Reader in) throws IOException {
        List<TaskDefinition> list = new ArrayList<>();
        try (BufferedReader br = new BufferedReader(in)) {
            Header h = readHeader(br, TASK_HEADERS, "tasks",
                    List.of("task_name", "area", "required_workers", "required_skill", "required_strength"));
            String line;
            int lineNo = 1;
            while ((line = br.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) continue;
                Row r = h.row(CsvUtils.splitLine(line), "tasks", lineNo);
                list.add(TaskDefinition.builder()
                        .id(r.integer("task_id", list.size() + 1))
                        .name(r.required("task_name"))
                        .area(r.required("area"))
                        .requiredWorkers(r.integer("required_workers", null))
                        .requiredSkill(r.integer("required_skill", null))
                        .requiredStrength(r.integer("required_strength", null))
                        .urgency(r.integer("urgency", 3))
                        .requiresVesselWork(r.integer("ship_work", 0))
                        .requiresNavigation(r.integer("navigation_required", 0))
                        .duration(parseDuration(r.text("duration", "")))
                        .build());
            }
        }
        return list;
    }

    /** 2 列（日付, 業務名）。先頭セルが日付として読めない先頭行はヘッダとして読み飛ばす */
    public List<ScheduleEntry> readSchedule(Reader in) throws IOException {
        List<ScheduleEntry> list = new ArrayList<>();
        try (BufferedReader br = new BufferedReader(in)) {
            String line;
            int lineNo = 0;
            while ((line = br.readLine()) != null) {
                lineNo++;
                if (lineNo == 1) line = CsvUtils.stripBom(line);
                if (line.isBlank()) continue;
                List<String> cells = CsvUtils.splitLine(line);
                if (lineNo == 1 && tryParseDate(cells.get(0)) == null) {
                    continue;
                }
                if (cells.size() < 2 || cells.size() > 2 && !cells.subList(2, cells.size()).stream().allMatch(String::isEmpty)) {
                    throw new InvalidInputException("schedule line " + lineNo + ": expected 2 cells but got " + cells.size());
                }
                LocalDate date = tryParseDate(cells.get(0));
                if (date == null) {
                    throw new InvalidInputException("schedule line " + lineNo + ": invalid date '" + cells.get(0) + "'");
                }
                if (cells.get(1).isEmpty()) {
                    throw new InvalidInputException("schedule line " + lineNo + ": missing task name");
                }
                list.add(new ScheduleEntry(date, cells.get(1)));
            }
        }
        return list;
    }

    /** "0.5～3" のような範囲は中央値。空欄・解釈不能は 1.0 */
    static double parseDuration(String raw) {
        if (raw == null || raw.isBlank()) return 1.0;
        String s = raw.strip().replace('～', '~').replace('〜', '~');
        try {
            if (s.contains("~")) {
                String[] parts = s.split("~");
                return (Double.parseDouble(parts[0].strip()) + Double.parseDouble(parts[1].strip())) / 2;
            }
            return Double.parseDouble(s);
        } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
            log.debug("Unparseable duration '{}', using 1.0", raw);
            return 1.0;
        }
    }

    /** ISO 形式・スラッシュ区切り・Excel シリアル値を受け付ける。読めなければ null */
    static LocalDate tryParseDate(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String s = raw.strip();
        if (s.matches("^\\d+(\\.0+)?$")) {
            long serial = (long) Double.parseDouble(s);
            return EXCEL_BASE.plusDays(serial - EXCEL_OFFSET);
        }
        try {
            return LocalDate.parse(s.replace('/', '-'), FLEXIBLE_DATE);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private Reader open(String location) throws IOException {
        if (location == null || location.isBlank()) {
            throw new InvalidInputException("CSV location is not configured");
        }
        String resolved = location.contains(":") && !location.matches("^[A-Za-z]:[\\\\/].*") ? location : "file:" + location;
        Resource resource = resourceLoader.getResource(resolved);
        if (!resource.exists()) {
            throw new InvalidInputException("CSV not found: " + location);
        }
        return new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8);
    }

    private static Header readHeader(BufferedReader br, Map<String, String> aliases, String file,
                                     List<String> required) throws IOException {
        String line = br.readLine();
        if (line == null) {
            throw new InvalidInputException(file + ": empty file");
        }
        List<String> cells = CsvUtils.splitLine(CsvUtils.stripBom(line));
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < cells.size(); i++) {
            String key = aliases.get(cells.get(i).toLowerCase());
            if (key != null) {
                index.putIfAbsent(key, i);
            }
        }
        for (String col : required) {
            if (!index.containsKey(col)) {
                throw new InvalidInputException(file + ": missing column '" + col + "' in header " + cells);
            }
        }
        return new Header(index, cells.size());
    }

    private static Map<String, String> aliases(String... groups) {
        // 英小文字の識別子で始まるグループ: 英語名, 別名...
        Map<String, String> map = new HashMap<>();
        String current = null;
        for (String g : groups) {
            if (g.matches("[a-z_]+")) {
                current = g;
            }
            map.putIfAbsent(g.toLowerCase(), current);
        }
        return map;
    }

    private record Header(Map<String, Integer> index, int width) {
        Row row(List<String> cells, String file, int lineNo) {
            if (cells.size() > width) {
                throw new InvalidInputException(file + " line " + lineNo + ": expected at most " + width
                        + " cells but got " + cells.size());
            }
            return new Row(this, cells, file, lineNo);
        }
    }

    private record Row(Header header, List<String> cells, String file, int lineNo) {

        String text(String column, String def) {
            Integer i = header.index().get(column);
            if (i == null || i >= cells.size() || cells.get(i).isEmpty()) return def;
            return cells.get(i);
        }

        String required(String column) {
            String v = text(column, null);
            if (v == null) {
                throw new InvalidInputException(file + " line " + lineNo + ": '" + column + "' is blank");
            }
            return v;
        }

        /** def が null の列は必須 */
        int integer(String column, Integer def) {
            String v = text(column, null);
            if (v == null) {
                if (def == null) {
                    throw new InvalidInputException(file + " line " + lineNo + ": '" + column + "' is blank");
                }
                return def;
            }
            try {
                double d = Double.parseDouble(v);
                if (d != Math.rint(d)) {
                    throw new InvalidInputException(file + " line " + lineNo + ": '" + column
                            + "' must be an integer: " + v);
                }
                return (int) d;
            } catch (NumberFormatException e) {
                throw new InvalidInputException(file + " line " + lineNo + ": '" + column
                        + "' is not numeric: " + v, e);
            }
        }

        /** ○/× 等の可否は 1/0、数値はそのまま能力の段階として読む */
        int level(String column) {
            String v = text(column, "");
            if (v.matches("^\\d+(\\.0+)?$")) {
                return (int) Double.parseDouble(v);
            }
            return flag(column) ? 1 : 0;
        }

        /** 1 / ○ / true / yes を可とみなす */
        boolean flag(String column) {
            String v = text(column, "");
            switch (v.toLowerCase()) {
                case "1", "1.0", "○", "◯", "true", "yes", "y", "可":
                    return true;
                case "", "0", "0.0", "×", "✕", "-", "false", "no", "n", "不可":
                    return false;
                default:
                    throw new InvalidInputException(file + " line " + lineNo + ": '" + column
                            + "' is not a yes/no value: " + v);
            }
        }
    }
}
