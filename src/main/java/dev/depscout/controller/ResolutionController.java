package dev.depscout.controller;

import dev.depscout.dto.request.ResolutionSubmitRequest;
import dev.depscout.dto.response.ResolutionStatusResponse;
import dev.depscout.dto.response.SubmissionResponse;
import dev.depscout.exception.JobNotFoundException;
import dev.depscout.service.ResolutionQueryService;
import dev.depscout.service.ResolutionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Submission and polling API. Submissions return 202 Accepted as soon as the job row is
 * written; the pipeline runs in the background.
 */
@RestController
@RequestMapping("/resolutions")
public class ResolutionController {
    private final ResolutionService resolutionService;
    private final ResolutionQueryService queryService;

    public ResolutionController(ResolutionService resolutionService, ResolutionQueryService queryService) {
        this.resolutionService = resolutionService;
        this.queryService = queryService;
    }

    @PostMapping
    public ResponseEntity<SubmissionResponse> submit(@RequestBody ResolutionSubmitRequest body) {
        UUID id = resolutionService.submit(body);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(SubmissionResponse.accepted(id));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ResolutionStatusResponse> status(@PathVariable String id) {
        UUID jobId = parseId(id);
        return queryService.findStatus(jobId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new JobNotFoundException(id));
    }

    // IDs are opaque to callers: a malformed one is just an unknown one.
    private static UUID parseId(String id) {
        try {
            return UUID.fromString(id);
        } catch (IllegalArgumentException e) {
            throw new JobNotFoundException(id);
        }
    }
}
