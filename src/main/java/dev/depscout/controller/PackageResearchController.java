package dev.depscout.controller;

import dev.depscout.agent.report.ReportCompiler;
import dev.depscout.agent.research.PackageResearchAgent;
import dev.depscout.domain.valueobject.PackageResearchOutcome;
import dev.depscout.dto.response.ResearchResponse;
import dev.depscout.exception.SubmissionValidationException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.regex.Pattern;

/** Single-package research, outside any resolution job. */
@RestController
@RequestMapping("/packages")
public class PackageResearchController {
    private static final Pattern PACKAGE_NAME = Pattern.compile("[A-Za-z0-9\\-_.]{1,214}");

    private final PackageResearchAgent researchAgent;

    public PackageResearchController(PackageResearchAgent researchAgent) { this.researchAgent = researchAgent; }

    @GetMapping("/{name}/research")
    public ResponseEntity<ResearchResponse> research(@PathVariable String name) {
        if (!PACKAGE_NAME.matcher(name).matches()) {
            throw new SubmissionValidationException("Invalid package name: " + name);
        }
        PackageResearchOutcome outcome = researchAgent.research(name);
        return ResponseEntity.ok(new ResearchResponse(outcome.name(), outcome, ReportCompiler.describe(outcome)));
    }
}
