package com.researchplatform.monitor.controller;

import com.researchplatform.common.model.Alert;
import com.researchplatform.common.store.AlertLog;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

@RestController
@RequestMapping("/api/v1/alerts")
public class AlertController {

    private static final int MAX_LIMIT = 100;

    private final AlertLog alertLog;

    public AlertController(AlertLog alertLog) {
        this.alertLog = alertLog;
    }

    /** Newest first. */
    @GetMapping
    public Mono<ResponseEntity<List<Alert>>> recent(@RequestParam(value = "limit", defaultValue = "20") int limit) {
        int bounded = Math.max(0, Math.min(limit, MAX_LIMIT));
        return Mono.fromCallable(() -> alertLog.recent(bounded))
            .subscribeOn(Schedulers.boundedElastic())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
