package com.researchplatform.orchestrator.controller;

import com.researchplatform.orchestrator.model.ResearchReport;
import com.researchplatform.orchestrator.service.ResearchService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/research")
public class ResearchController {

    private final ResearchService researchService;

    public ResearchController(ResearchService researchService) {
        this.researchService = researchService;
    }

    @PostMapping
    public Mono<ResponseEntity<ResearchReport>> research(@RequestBody ResearchRequest request) {
        if (request == null || request.task() == null || request.task().isBlank()) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        return researchService.research(request.task().trim()).map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
