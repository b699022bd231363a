package com.reviewmate.backend.modules.stats.presentation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.reviewmate.backend.modules.stats.application.StatsService;
import com.reviewmate.backend.modules.stats.presentation.dto.StatsResponse;

import io.swagger.v3.oas.annotations.Operation;

@RestController
@RequestMapping("/stats")
public class StatsController {

    private final StatsService statsService;

    public StatsController(StatsService statsService) {
        this.statsService = statsService;
    }

    @GetMapping
    @Operation(summary = "Pull request and reviewer assignment statistics")
    public ResponseEntity<StatsResponse> getStats() {
        return ResponseEntity.ok(statsService.getStats());
    }
}
