package com.example.corprisk;

import com.example.corprisk.http.RegistryCache;
import com.example.corprisk.http.SlidingWindowRateLimiter;
import com.example.corprisk.model.AnalysisEvent;
import com.example.corprisk.model.AnalyzeRequest;
import com.example.corprisk.model.CompanyReport;
import com.example.corprisk.service.RiskAnalysisOrchestrator;
import com.example.corprisk.util.CompanyNumbers;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Tag(name = "Risk API", description = "Six-dimension company risk analysis")
public class RiskAnalysisController {

    private static final Logger log = LoggerFactory.getLogger(RiskAnalysisController.class);

    private final RiskAnalysisOrchestrator orchestrator;
    private final SlidingWindowRateLimiter rateLimiter;
    private final RegistryCache cache;

    public RiskAnalysisController(RiskAnalysisOrchestrator orchestrator,
                                  SlidingWindowRateLimiter rateLimiter,
                                  RegistryCache cache) {
        this.orchestrator = orchestrator;
        this.rateLimiter = rateLimiter;
        this.cache = cache;
    }

    @PostMapping("/analyze")
    @Operation(summary = "Full risk report", description = "Runs all six dimensions concurrently and returns them in one report. "
            + "404 when the company does not exist, 503 when the registry cannot be reached")
    public Mono<CompanyReport> analyze(@RequestBody AnalyzeRequest request) {
        String cn = companyNumber(request);
        log.info("Analysis requested for {}", cn);
        return orchestrator.analyze(cn);
    }

    @PostMapping(value = "/analyze/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    @Operation(summary = "Streamed risk report", description = "SSE: profile first, one dimension event per analyzer as it "
            + "completes, then complete. A lone error event when the company cannot be found")
    public Flux<ServerSentEvent<AnalysisEvent>> stream(@RequestBody AnalyzeRequest request) {
        String cn = companyNumber(request);
        log.info("Streamed analysis requested for {}", cn);
        return orchestrator.stream(cn)
                .index()
                .map(e -> ServerSentEvent.<AnalysisEvent>builder(e.getT2())
                        .id(cn + ":" + e.getT1())
                        .event(e.getT2().type())
                        .build());
    }

    @GetMapping("/health")
    @Operation(summary = "Service health", description = "Rate-limit budget left in the current window and cached response count")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("rate_limit_remaining", rateLimiter.remaining());
        body.put("cache_size", cache.size());
        return body;
    }

    @DeleteMapping("/cache")
    @Operation(summary = "Clear response cache", description = "Drops every cached registry response")
    public Map<String, Object> clearCache() {
        long cleared = cache.clear();
        log.info("Response cache cleared ({} entries)", cleared);
        return Map.of("cleared", cleared);
    }

    private static String companyNumber(AnalyzeRequest request) {
        String raw = request == null ? null : request.companyNumber();
        return CompanyNumbers.normalize(raw)
                .orElseThrow(() -> new IllegalArgumentException("Invalid company number"));
    }
}
