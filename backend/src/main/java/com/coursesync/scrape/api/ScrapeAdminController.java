package com.coursesync.scrape.api;

import com.coursesync.scrape.model.AuditEntry;
import com.coursesync.scrape.model.QueueStatusResponse;
import com.coursesync.scrape.model.RateLimitStatus;
import com.coursesync.scrape.model.ScrapeJob;
import com.coursesync.scrape.model.ScrapeOutcome;
import com.coursesync.scrape.model.ScrapeResult;
import com.coursesync.scrape.model.ScraperSettingsView;
import com.coursesync.scrape.model.ScraperStatsResponse;
import com.coursesync.scrape.model.SessionStatus;
import com.coursesync.scrape.model.SubjectSchedule;
import com.coursesync.scrape.model.TickSummary;
import com.coursesync.scrape.service.ScrapeAdminService;
import com.coursesync.scrape.service.ScrapeScheduler;
import com.coursesync.scrape.service.ScrapeWorkerPool;
import com.coursesync.scrape.service.ScraperSettingsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/scraper")
public class ScrapeAdminController {
    private final ScrapeAdminService adminService;
    private final ScrapeWorkerPool workerPool;
    private final ScrapeScheduler scheduler;
    private final ScraperSettingsService settingsService;

    public ScrapeAdminController(
        ScrapeAdminService adminService,
        ScrapeWorkerPool workerPool,
        ScrapeScheduler scheduler,
        ScraperSettingsService settingsService
    ) {
        this.adminService = adminService;
        this.workerPool = workerPool;
        this.scheduler = scheduler;
        this.settingsService = settingsService;
    }

    @GetMapping("/queue")
    public QueueStatusResponse queue() {
        return adminService.queueStatus();
    }

    @GetMapping("/jobs")
    public List<ScrapeJob> jobs(
        @RequestParam(name = "status", required = false) String status,
        @RequestParam(name = "limit", required = false, defaultValue = "50") int limit
    ) {
        return adminService.jobs(status, limit);
    }

    @GetMapping("/results")
    public List<ScrapeResult> results(
        @RequestParam(name = "subject", required = false) String subject,
        @RequestParam(name = "limit", required = false, defaultValue = "50") int limit
    ) {
        return adminService.results(subject, limit);
    }

    @GetMapping("/stats")
    public ScraperStatsResponse stats(@RequestParam(name = "hours", required = false, defaultValue = "24") int hours) {
        return adminService.stats(hours);
    }

    @GetMapping("/subjects")
    public List<SubjectSchedule> subjects() {
        return adminService.subjects();
    }

    @GetMapping("/subjects/{subject}")
    public SubjectSchedule subject(@PathVariable("subject") String subject) {
        return adminService.subject(subject);
    }

    @PostMapping("/subjects/{subject}/pause")
    public SubjectSchedule pause(@PathVariable("subject") String subject) {
        return adminService.pause(subject);
    }

    @PostMapping("/subjects/{subject}/resume")
    public SubjectSchedule resume(@PathVariable("subject") String subject) {
        return adminService.resume(subject);
    }

    @PostMapping("/subjects/{subject}/scrape")
    public ScrapeOutcome scrape(@PathVariable("subject") String subject) {
        return adminService.scrapeNow(subject);
    }

    @GetMapping("/audits")
    public List<AuditEntry> audits(
        @RequestParam(name = "subject", required = false) String subject,
        @RequestParam(name = "limit", required = false, defaultValue = "100") int limit
    ) {
        return adminService.audits(subject, limit);
    }

    @GetMapping("/settings")
    public ScraperSettingsView settings() {
        return settingsService.reload();
    }

    @PutMapping("/settings/priority-subjects")
    public ScraperSettingsView updatePrioritySubjects(@RequestBody PrioritySubjectsRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("subjects is required");
        }
        return settingsService.updatePrioritySubjects(request.subjects());
    }

    @PutMapping("/settings/intervals")
    public ScraperSettingsView updateIntervals(@RequestBody IntervalSettingsRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body is required");
        }
        return settingsService.updateIntervals(
            request.minIntervalMinutes(),
            request.maxIntervalHours(),
            request.minSpacingMinutes()
        );
    }

    @GetMapping("/session")
    public SessionStatus session() {
        return adminService.sessionStatus();
    }

    @GetMapping("/rate-limit")
    public RateLimitStatus rateLimit() {
        return adminService.rateLimitStatus();
    }

    @PostMapping("/workers/start")
    public QueueStatusResponse startWorkers() {
        workerPool.start();
        return adminService.queueStatus();
    }

    @PostMapping("/workers/stop")
    public QueueStatusResponse stopWorkers() {
        workerPool.stop();
        return adminService.queueStatus();
    }

    @PostMapping("/scheduler/start")
    public QueueStatusResponse startScheduler() {
        scheduler.start();
        return adminService.queueStatus();
    }

    @PostMapping("/scheduler/stop")
    public QueueStatusResponse stopScheduler() {
        scheduler.stop();
        return adminService.queueStatus();
    }

    @PostMapping("/scheduler/tick")
    public TickSummary tick() {
        return scheduler.tick();
    }
}
