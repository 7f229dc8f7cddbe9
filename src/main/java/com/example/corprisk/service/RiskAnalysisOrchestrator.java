package com.example.corprisk.service;

import com.example.corprisk.exception.NotFoundException;
import com.example.corprisk.exception.UpstreamUnavailableException;
import com.example.corprisk.http.RegistryClient;
import com.example.corprisk.http.RegistryResult;
import com.example.corprisk.model.AnalysisEvent;
import com.example.corprisk.model.CompanyProfile;
import com.example.corprisk.model.CompanyReport;
import com.example.corprisk.model.DimensionResult;
import com.example.corprisk.model.ReportMetadata;
import com.example.corprisk.service.analyzer.Dimension;
import com.example.corprisk.service.analyzer.DimensionAnalyzer;
import com.example.corprisk.util.RegistryJson;
import com.example.corprisk.util.RiskHeuristics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs the six analyzers for one company.
 * <ol>
 *   <li>Profile lookup, fresh; not found or unavailable fails the whole request</li>
 *   <li>One task per analyzer on a pool sized to the analyzer count, created per request</li>
 *   <li>Each task returns a {@link UnitOutcome}; a failed unit becomes an investigate placeholder</li>
 *   <li>Results keyed by dimension id, or streamed in completion order</li>
 * </ol>
 */
@Service
public class RiskAnalysisOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RiskAnalysisOrchestrator.class);

    private final RegistryClient registry;
    private final List<DimensionAnalyzer> analyzers;
    private final Clock clock;

    public RiskAnalysisOrchestrator(RegistryClient registry, List<DimensionAnalyzer> analyzers, Clock clock) {
        this.registry = registry;
        this.analyzers = analyzers.stream()
                .sorted(Comparator.comparing(DimensionAnalyzer::dimension))
                .toList();
        this.clock = clock;

        long distinct = this.analyzers.stream().map(DimensionAnalyzer::dimension).distinct().count();
        if (distinct != this.analyzers.size()) {
            throw new IllegalStateException("More than one analyzer registered for a dimension");
        }
    }

    public Mono<CompanyReport> analyze(String companyNumber) {
        return Mono.defer(() -> {
            long started = System.nanoTime();
            String analyzedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS).toString();

            return loadProfile(companyNumber)
                    .flatMap(profile -> runUnits(companyNumber)
                            .collectList()
                            .map(outcomes -> {
                                double elapsed = RiskHeuristics.round((System.nanoTime() - started) / 1e9, 1);
                                log.info("Analysis of {} completed in {}s", companyNumber, elapsed);
                                return new CompanyReport(profile, byDimension(outcomes),
                                        new ReportMetadata(analyzedAt, elapsed));
                            }));
        });
    }

    /**
     * Profile first, then one event per dimension as each finishes, then {@code complete}.
     * A company that cannot be resolved yields a single {@code error} event instead.
     */
    public Flux<AnalysisEvent> stream(String companyNumber) {
        return loadProfile(companyNumber)
                .flatMapMany(profile -> Flux.concat(
                        Mono.just(AnalysisEvent.profile(profile)),
                        runUnits(companyNumber).map(outcome -> AnalysisEvent.dimension(outcome.toResult())),
                        Mono.fromSupplier(AnalysisEvent::complete)))
                .onErrorResume(NotFoundException.class, e -> Flux.just(AnalysisEvent.error("Company not found")))
                .onErrorResume(UpstreamUnavailableException.class, e -> Flux.just(AnalysisEvent.error(e.getMessage())));
    }

    Mono<CompanyProfile> loadProfile(String companyNumber) {
        return Mono.fromCallable(() -> registry.lookupCompany(companyNumber))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> toProfile(companyNumber, result));
    }

    private static CompanyProfile toProfile(String companyNumber, RegistryResult result) {
        if (result.isNotFound()) {
            throw new NotFoundException("Company not found. Check the number and try again.");
        }
        JsonNode p = result.payload().orElseThrow(() ->
                new UpstreamUnavailableException("Company registry unavailable: " + result.detail()));
        JsonNode address = p.get("registered_office_address");
        return CompanyProfile.builder()
                .companyNumber(companyNumber)
                .companyName(RegistryJson.text(p, "company_name", "Unknown"))
                .companyStatus(RegistryJson.text(p, "company_status"))
                .type(RegistryJson.text(p, "type"))
                .dateOfCreation(RegistryJson.text(p, "date_of_creation"))
                .registeredOfficeAddress(address != null ? address : JsonNodeFactory.instance.objectNode())
                .sicCodes(RegistryJson.strings(p, "sic_codes"))
                .build();
    }

    /**
     * Launches every analyzer on its own pool thread and emits outcomes as they finish.
     * The pool lives for one subscription.
     */
    Flux<UnitOutcome> runUnits(String companyNumber) {
        return Flux.defer(() -> {
            ExecutorService pool = Executors.newFixedThreadPool(analyzers.size(),
                    new CustomizableThreadFactory("analyzer-"));
            List<Mono<UnitOutcome>> tasks = analyzers.stream()
                    .map(analyzer -> Mono.fromFuture(
                            CompletableFuture.supplyAsync(() -> runUnit(analyzer, companyNumber), pool)))
                    .toList();
            return Flux.merge(tasks).doFinally(signal -> pool.shutdown());
        });
    }

    private UnitOutcome runUnit(DimensionAnalyzer analyzer, String companyNumber) {
        Dimension dimension = analyzer.dimension();
        long started = System.nanoTime();
        try {
            DimensionResult result = analyzer.analyze(registry, companyNumber);
            log.debug("{} for {} rated {} in {} ms", dimension.id(), companyNumber,
                    result.getRating().wire(), (System.nanoTime() - started) / 1_000_000);
            return UnitOutcome.completed(dimension, result);
        } catch (Exception e) {
            log.error("Analyzer {} failed for {}: {}", dimension.id(), companyNumber, e.getMessage(), e);
            return UnitOutcome.failed(dimension, e);
        }
    }

    private static Map<String, DimensionResult> byDimension(List<UnitOutcome> outcomes) {
        Map<Dimension, DimensionResult> results = new EnumMap<>(Dimension.class);
        outcomes.forEach(o -> results.put(o.dimension(), o.toResult()));
        Map<String, DimensionResult> keyed = new LinkedHashMap<>();
        results.forEach((dimension, result) -> keyed.put(dimension.id(), result));
        return keyed;
    }
}
