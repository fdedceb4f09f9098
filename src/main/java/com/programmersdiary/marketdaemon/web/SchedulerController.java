package com.programmersdiary.marketdaemon.web;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.programmersdiary.marketdaemon.scheduling.JobStatus;
import com.programmersdiary.marketdaemon.scheduling.RefreshScheduler;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/scheduler")
public class SchedulerController {

    private final RefreshScheduler refreshScheduler;

    public SchedulerController(RefreshScheduler refreshScheduler) {
        this.refreshScheduler = refreshScheduler;
    }

    @GetMapping
    public StatusResponse status() {
        var status = refreshScheduler.status();
        return new StatusResponse("Refresh scheduler status", status.jobs(), status.totalJobs());
    }

    @PostMapping
    public ResponseEntity<?> control(@RequestBody SchedulerCommand command) {
        var action = command.action() == null ? "" : command.action().trim();
        return switch (action) {
            case "start" -> {
                var result = refreshScheduler.start();
                yield ResponseEntity.ok(new StartResponse(
                        "Refresh jobs started", result.schedules(), result.timezone()));
            }
            case "stop" -> {
                refreshScheduler.stop();
                yield ResponseEntity.ok(new StopResponse("Refresh jobs stopped", 0));
            }
            case "test" -> {
                var result = refreshScheduler.fireOnce();
                var body = new TestResponse(
                        result.success() ? "Market indicators refresh test completed" : "Market indicators refresh test failed",
                        result.success(), result.status(), result.payload(), result.error());
                yield ResponseEntity.status(result.success() ? HttpStatus.OK : HttpStatus.BAD_GATEWAY).body(body);
            }
            default -> throw new InvalidActionException(
                    "Invalid action '" + action + "', expected one of: start, stop, test");
        };
    }

    @DeleteMapping
    public StopResponse clear() {
        refreshScheduler.stop();
        return new StopResponse("All refresh jobs cleared", 0);
    }

    public record SchedulerCommand(String action) {}

    public record StatusResponse(String message, List<JobStatus> jobs, int totalJobs) {}

    public record StartResponse(String message, List<String> schedules, String timezone) {}

    public record StopResponse(String message, int totalJobs) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TestResponse(String message, boolean success, Integer status, JsonNode payload, String error) {}
}
