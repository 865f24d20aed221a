package com.kmg.classifier.api;

import com.kmg.classifier.dto.StatsView;
import com.kmg.classifier.service.ClassificationStatsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/stats")
public class StatsController {
    private final ClassificationStatsService statsService;

    public StatsController(ClassificationStatsService statsService) {
        this.statsService = statsService;
    }

    @GetMapping
    public StatsView stats() {
        return statsService.getStats();
    }
}
