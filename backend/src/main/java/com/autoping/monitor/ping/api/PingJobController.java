package com.autoping.monitor.ping.api;

import com.autoping.monitor.ping.model.PingJobView;
import com.autoping.monitor.ping.service.PingJobService;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/jobs")
public class PingJobController {
    private final PingJobService jobService;

    public PingJobController(PingJobService jobService) {
        this.jobService = jobService;
    }

    @GetMapping
    public List<PingJobView> listJobs() {
        return jobService.listJobs();
    }

    @GetMapping("/{id}")
    public PingJobView getJob(@PathVariable("id") long id) {
        return jobService.getJob(id);
    }

    @PostMapping
    public PingJobView createJob(@RequestBody(required = false) CreateJobRequest request) {
        if (request == null || isBlank(request.url()) || isBlank(request.interval())) {
            throw new ResponseStatusException(BAD_REQUEST, "URL and interval are required");
        }
        return jobService.createJob(
            request.url(),
            request.interval(),
            request.alertEmail(),
            request.emailRateLimit()
        );
    }

    @PatchMapping("/{id}/toggle")
    public PingJobView toggleJob(@PathVariable("id") long id) {
        return jobService.toggleJob(id);
    }

    @PatchMapping("/{id}/reset")
    public PingJobView resetJob(@PathVariable("id") long id) {
        return jobService.resetJob(id);
    }

    @PatchMapping("/{id}/email")
    public PingJobView updateEmail(
        @PathVariable("id") long id,
        @RequestBody(required = false) UpdateEmailRequest request
    ) {
        return jobService.updateAlertEmail(id, request == null ? null : request.alertEmail());
    }

    @DeleteMapping("/{id}")
    public Map<String, Object> deleteJob(@PathVariable("id") long id) {
        jobService.deleteJob(id);
        return Map.of("message", "Job deleted", "id", id);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
