package com.ward.core.service.api.controller;

import com.ward.core.service.api.dto.ApiResponse;
import com.ward.core.service.runtime.SessionTracker;
import com.ward.core.session.Resource;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Controller for cross-session resource queries.
 */
@Slf4j
@RestController
@RequestMapping("/resources")
@Tag(name = "Resources", description = "Endpoints for failed and slow resources across sessions")
@RequiredArgsConstructor
public class ResourceController {

    private static final String DEFAULT_SLOW_THRESHOLD_MS = "500";

    private final SessionTracker sessionTracker;

    @GetMapping("/errors")
    @Operation(summary = "List failed resources",
               description = "Resources with error status or an HTTP status of 400 and above, most recent first")
    public ResponseEntity<ApiResponse<List<Resource>>> getErrors() {
        List<Resource> errors = sessionTracker.getErrors();
        log.debug("Returning {} failed resources", errors.size());
        return ResponseEntity.ok(ApiResponse.success(errors));
    }

    @GetMapping("/slow")
    @Operation(summary = "List slow resources", description = "Resources at least thresholdMs long, slowest first")
    public ResponseEntity<ApiResponse<List<Resource>>> getSlowResources(
            @Parameter(description = "Minimum duration in milliseconds")
            @RequestParam(defaultValue = DEFAULT_SLOW_THRESHOLD_MS) double thresholdMs) {
        List<Resource> slow = sessionTracker.getSlowResources(thresholdMs);
        log.debug("Returning {} resources slower than {}ms", slow.size(), thresholdMs);
        return ResponseEntity.ok(ApiResponse.success(slow));
    }
}
