package com.example.timesheet.interfaces.api;

import com.example.timesheet.application.service.ScheduleCsvExportService;
import com.example.timesheet.application.service.TimesheetService;
import com.example.timesheet.config.TimesheetProperties;
import com.example.timesheet.domain.exception.DomainException;
import com.example.timesheet.domain.model.TimesheetExtractionResult;
import com.example.timesheet.infrastructure.exception.InfrastructureException;
import com.example.timesheet.interfaces.api.dto.WeekScheduleResponse;
import jakarta.servlet.http.HttpSession;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;

/**
 * Interfaces-layer MVC controller that handles timesheet uploads, the JSON API and CSV exports.
 */
@Controller
public class TimesheetController {

    private static final String SESSION_RESULT_KEY = "LATEST_TIMESHEET_RESULT";

    private final TimesheetService timesheetService;
    private final ScheduleCsvExportService csvExportService;
    private final TimesheetProperties properties;

    public TimesheetController(TimesheetService timesheetService,
                               ScheduleCsvExportService csvExportService,
                               TimesheetProperties properties) {
        this.timesheetService = timesheetService;
        this.csvExportService = csvExportService;
        this.properties = properties;
    }

    /**
     * Renders the upload page and pre-populates it with any cached week from the session.
     *
     * @param model   model used to expose attributes to the Thymeleaf view
     * @param session HTTP session storing the last extraction result
     * @return upload view name
     */
    @GetMapping("/")
    public String showUploadForm(Model model, HttpSession session) {
        model.addAttribute("result", session.getAttribute(SESSION_RESULT_KEY));
        model.addAttribute("error", null);
        model.addAttribute("targetName", properties.getTargetName());
        return "upload";
    }

    /**
     * Handles form submissions; failures are rendered inline instead of as error payloads.
     *
     * @param file    uploaded timesheet
     * @param model   model used for view rendering
     * @param session HTTP session for caching the result
     * @return upload view name populated with success or error data
     */
    @PostMapping("/extract")
    public String handleUpload(@RequestParam(value = "file", required = false) MultipartFile file,
                               Model model,
                               HttpSession session) {
        model.addAttribute("targetName", properties.getTargetName());
        try {
            TimesheetExtractionResult result = timesheetService.extractSchedule(file);
            session.setAttribute(SESSION_RESULT_KEY, result);
            model.addAttribute("result", result);
            model.addAttribute("error", null);
        } catch (DomainException ex) {
            model.addAttribute("result", null);
            model.addAttribute("error", ex.getMessage());
        } catch (InfrastructureException ex) {
            model.addAttribute("result", null);
            model.addAttribute("error", "We couldn't read that PDF. Please try another file.");
        }
        return "upload";
    }

    /**
     * JSON endpoint used by the browser client; the multipart field is named {@code pdf}.
     *
     * @param file    uploaded timesheet
     * @param session HTTP session for caching the result
     * @return resolved week
     */
    @PostMapping(value = "/parse", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<WeekScheduleResponse> parse(@RequestParam(value = "pdf", required = false) MultipartFile file,
                                                      HttpSession session) {
        TimesheetExtractionResult result = timesheetService.extractSchedule(file);
        session.setAttribute(SESSION_RESULT_KEY, result);
        return ResponseEntity.ok(WeekScheduleResponse.from(result));
    }

    /**
     * REST endpoint that mirrors the HTML upload form but returns JSON.
     *
     * @param file uploaded timesheet
     * @return resolved week
     */
    @PostMapping(value = "/api/extract", produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ResponseEntity<WeekScheduleResponse> handleUploadApi(@RequestParam(value = "file", required = false) MultipartFile file) {
        return ResponseEntity.ok(WeekScheduleResponse.from(timesheetService.extractSchedule(file)));
    }

    /**
     * Streams the cached week as a CSV download.
     *
     * @param session HTTP session storing the cached extraction result
     * @return CSV document
     */
    @PostMapping("/export")
    public ResponseEntity<byte[]> exportCsv(HttpSession session) {
        TimesheetExtractionResult cached = (TimesheetExtractionResult) session.getAttribute(SESSION_RESULT_KEY);
        String csv = csvExportService.exportWeek(cached);
        String fileName = cached.week().weekEnding() != null
                ? "schedule-" + cached.week().weekEnding().replace('/', '-') + ".csv"
                : "schedule.csv";
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + fileName + "\"")
                .contentType(MediaType.TEXT_PLAIN)
                .body(csv.getBytes(StandardCharsets.UTF_8));
    }
}
