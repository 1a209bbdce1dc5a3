package com.kotsin.advisor.controller;

import com.kotsin.advisor.autogen.AutoGenerator;
import com.kotsin.advisor.model.GenerationConfig;
import com.kotsin.advisor.model.MarketKind;
import com.kotsin.advisor.model.Signal;
import com.kotsin.advisor.model.SignalAccuracy;
import com.kotsin.advisor.model.SignalCategory;
import com.kotsin.advisor.model.VenueKind;
import com.kotsin.advisor.monitor.CatchUpReport;
import com.kotsin.advisor.monitor.MonitorStats;
import com.kotsin.advisor.monitor.SignalCatchUpService;
import com.kotsin.advisor.monitor.SignalMonitor;
import com.kotsin.advisor.service.SignalAccuracyService;
import com.kotsin.advisor.store.SignalStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/signals")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Signals", description = "Active and completed signals, generation and monitoring controls")
public class SignalController {

    private final SignalStore store;
    private final AutoGenerator autoGenerator;
    private final SignalMonitor monitor;
    private final SignalCatchUpService catchUpService;
    private final SignalAccuracyService accuracyService;
    private final Clock clock;

    @GetMapping("/active")
    @Operation(summary = "Active signals", description = "All active signals, or one category's partition")
    public ResponseEntity<List<Signal>> active(
            @Parameter(description = "standard, fast or flow") @RequestParam(required = false) String category) {
        if (category == null || category.isBlank()) {
            return ResponseEntity.ok(store.getAllActive());
        }
        return ResponseEntity.ok(store.getActive(SignalCategory.fromKey(category)));
    }

    @GetMapping("/completed")
    @Operation(summary = "Completed archive", description = "Completed and stopped signals in archive order")
    public ResponseEntity<List<Signal>> completed() {
        return ResponseEntity.ok(store.getCompleted());
    }

    @GetMapping("/accuracy")
    @Operation(summary = "Accuracy over the completed archive")
    public ResponseEntity<SignalAccuracy> accuracy() {
        return ResponseEntity.ok(accuracyService.calculate(store.getCompleted()));
    }

    @PostMapping("/generate/{category}")
    @Operation(summary = "Generate a batch now", description = "Runs one generation pass; a non-empty batch replaces the category's active signals")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Batch generated (possibly empty)"),
            @ApiResponse(responseCode = "400", description = "Unknown category")
    })
    public ResponseEntity<List<Signal>> generate(@PathVariable String category,
                                                 @RequestParam(required = false) VenueKind venue,
                                                 @RequestParam(required = false) MarketKind marketKind) {
        SignalCategory c = SignalCategory.fromKey(category);
        log.info("manual_generate category={} venue={} marketKind={}", c, venue, marketKind);
        return ResponseEntity.ok(autoGenerator.generateNow(c, config(venue, marketKind)));
    }

    @PostMapping("/autogen/{category}/start")
    @Operation(summary = "Start auto-generation for a category")
    public ResponseEntity<Map<String, Object>> startAutogen(@PathVariable String category,
                                                            @RequestParam(required = false) VenueKind venue,
                                                            @RequestParam(required = false) MarketKind marketKind) {
        SignalCategory c = SignalCategory.fromKey(category);
        List<Signal> first = autoGenerator.start(c, config(venue, marketKind));
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("category", c.key());
        response.put("enabled", true);
        response.put("generated", first.size());
        response.put("intervalSeconds", autoGenerator.interval(c).getSeconds());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/autogen/{category}/stop")
    @Operation(summary = "Stop auto-generation for a category")
    public ResponseEntity<Map<String, Object>> stopAutogen(@PathVariable String category) {
        SignalCategory c = SignalCategory.fromKey(category);
        autoGenerator.stop(c);
        return ResponseEntity.ok(Map.of("category", c.key(), "enabled", false));
    }

    @GetMapping("/autogen")
    @Operation(summary = "Auto-generation status per category")
    public ResponseEntity<Map<String, Object>> autogenStatus() {
        Map<String, Object> response = new LinkedHashMap<>();
        for (SignalCategory c : SignalCategory.values()) {
            Map<String, Object> status = new LinkedHashMap<>();
            status.put("enabled", autoGenerator.isEnabled(c));
            status.put("scheduled", autoGenerator.isScheduled(c));
            status.put("secondsUntilNext", autoGenerator.secondsUntilNext(c, clock.instant()));
            response.put(c.key(), status);
        }
        return ResponseEntity.ok(response);
    }

    @PostMapping("/monitor/start")
    @Operation(summary = "Start the background monitor")
    public ResponseEntity<MonitorStats> startMonitor() {
        monitor.start();
        return ResponseEntity.ok(monitor.stats());
    }

    @PostMapping("/monitor/stop")
    @Operation(summary = "Stop the background monitor")
    public ResponseEntity<MonitorStats> stopMonitor() {
        monitor.stop();
        return ResponseEntity.ok(monitor.stats());
    }

    @GetMapping("/monitor/stats")
    @Operation(summary = "Monitor status")
    public ResponseEntity<MonitorStats> monitorStats() {
        return ResponseEntity.ok(monitor.stats());
    }

    @PostMapping("/catchup")
    @Operation(summary = "Reconcile active signals against current prices")
    public ResponseEntity<CatchUpReport> catchUp() {
        return ResponseEntity.ok(catchUpService.reconcileAll());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        log.warn("bad_request reason={}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    private GenerationConfig config(VenueKind venue, MarketKind marketKind) {
        GenerationConfig config = autoGenerator.defaultConfig();
        if (venue != null) config.setVenue(venue);
        if (marketKind != null) config.setMarketKind(marketKind);
        return config;
    }
}
