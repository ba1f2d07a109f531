package io.github.riemr.sampling.application.service;

import io.github.riemr.sampling.application.util.CsvUtils;
import io.github.riemr.sampling.domain.model.DayAssignment;
import io.github.riemr.sampling.domain.model.DayFailure;
import io.github.riemr.sampling.domain.model.ScheduleResult;
import io.github.riemr.sampling.domain.model.TaskAssignment;
import org.springframework.stereotype.Service;

import java.io.PrintWriter;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 人員配置表の CSV 出力。1 行 = 1 業務枠。担当者列は最低 4 列、それを超える枠があれば列を増やす。
 */
@Service
public class AssignmentExportService {

    public static final int MIN_WORKER_COLUMNS = 4;
    static final String UNREGISTERED_NOTE = "マスタ未登録";

    private static final String[] WEEKDAY_KANJI = {"月", "火", "水", "木", "金", "土", "日"};

    public void writeCsv(ScheduleResult result, PrintWriter writer) {
        int columns = workerColumns(result);
        List<String> header = new ArrayList<>(List.of("日付", "曜日", "業務名"));
        for (int i = 1; i <= columns; i++) {
            header.add("担当者" + i);
        }
        header.add("状態");
        writer.println(String.join(",", header));

        for (LocalDate date : result.dates()) {
            DayAssignment day = result.getAssignments().get(date);
            if (day != null) {
                for (TaskAssignment t : day.getTasks()) {
                    String status = t.unregistered() ? day.getStatus() + " " + UNREGISTERED_NOTE : day.getStatus().name();
                    writer.println(row(date, t.taskName(), t.workers(), columns, status));
                }
                continue;
            }
            DayFailure failure = result.getFailures().get(date);
            for (String taskName : failure.taskNames()) {
                writer.println(row(date, taskName, List.of(), columns, failure.kind().name()));
            }
        }
        writer.flush();
    }

    static String weekday(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return WEEKDAY_KANJI[dow.getValue() - 1];
    }

    private static int workerColumns(ScheduleResult result) {
        int max = MIN_WORKER_COLUMNS;
        for (DayAssignment day : result.getAssignments().values()) {
            for (TaskAssignment t : day.getTasks()) {
                max = Math.max(max, t.workers().size());
            }
        }
        return max;
    }

    private static String row(LocalDate date, String taskName, List<String> workers, int columns, String status) {
        List<String> cells = new ArrayList<>();
        cells.add(date.toString());
        cells.add(weekday(date));
        cells.add(CsvUtils.escape(taskName));
        for (int i = 0; i < columns; i++) {
            cells.add(i < workers.size() ? CsvUtils.escape(workers.get(i)) : "");
        }
        cells.add(status);
        return String.join(",", cells);
    }
}
