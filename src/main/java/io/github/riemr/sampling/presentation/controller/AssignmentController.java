package io.github.riemr.sampling.presentation.controller;

import io.github.riemr.sampling.application.dto.DataOverviewResponse;
import io.github.riemr.sampling.application.dto.DayOptimizeResponse;
import io.github.riemr.sampling.application.dto.OptimizeResponse;
import io.github.riemr.sampling.application.dto.PersonsResponse;
import io.github.riemr.sampling.application.dto.ReloadResponse;
import io.github.riemr.sampling.application.dto.ScheduleViewResponse;
import io.github.riemr.sampling.application.dto.WorkerView;
import io.github.riemr.sampling.application.service.AssignmentExportService;
import io.github.riemr.sampling.application.service.SamplingAssignmentService;
import io.github.riemr.sampling.domain.exception.ResultNotAvailableException;
import io.github.riemr.sampling.domain.model.MasterData;
import io.github.riemr.sampling.domain.model.ScheduleResult;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

@RestController
@RequestMapping("/api")
public class AssignmentController {

    private final SamplingAssignmentService assignmentService;
    private final AssignmentExportService exportService;

    public AssignmentController(SamplingAssignmentService assignmentService, AssignmentExportService exportService) {
        this.assignmentService = assignmentService;
        this.exportService = exportService;
    }

    @GetMapping("/data")
    public DataOverviewResponse data() {
        return assignmentService.overview();
    }

    @PostMapping("/optimize")
    public OptimizeResponse optimize() {
        return OptimizeResponse.from(assignmentService.optimizeAll());
    }

    @PostMapping("/optimize/day/{date}")
    public DayOptimizeResponse optimizeDay(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return DayOptimizeResponse.from(assignmentService.optimizeDay(date));
    }

    @GetMapping("/schedule/{date}")
    public ScheduleViewResponse schedule(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return assignmentService.scheduleFor(date);
    }

    @GetMapping("/persons")
    public PersonsResponse persons() {
        return new PersonsResponse(true, assignmentService.persons().stream().map(WorkerView::from).toList());
    }

    @PostMapping("/data/reload")
    public ReloadResponse reload() {
        MasterData data = assignmentService.reload();
        return new ReloadResponse(true, data.getWorkers().size(), data.getTasks().size(),
                data.getSchedule().size(), data.getLoadedAt());
    }

    @GetMapping("/download")
    public void download(HttpServletResponse response) throws IOException {
        ScheduleResult result = assignmentService.latestResult()
                .orElseThrow(() -> new ResultNotAvailableException("最適化が実行されていません。先に最適化を実行してください。"));

        String filename = "人員配置表_" + LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss")) + ".csv";
        response.setContentType("text/csv; charset=UTF-8");
        response.setHeader("Content-Disposition",
                "attachment; filename*=UTF-8''" + URLEncoder.encode(filename, StandardCharsets.UTF_8).replace("+", "%20"));
        exportService.writeCsv(result, response.getWriter());
    }
}
