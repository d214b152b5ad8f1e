package smart.organizer.app.controller;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import smart.organizer.app.api.ClassifyRequest;
import smart.organizer.app.api.ClassifyResponse;
import smart.organizer.app.api.HealthResponse;
import smart.organizer.app.api.ViewRequest;
import smart.organizer.app.api.ViewResponse;
import smart.organizer.app.config.OrganizerProperties;
import smart.organizer.app.entity.BatchResult;
import smart.organizer.app.entity.Insight;
import smart.organizer.app.entity.MessageView;
import smart.organizer.app.entity.ViewState;
import smart.organizer.app.service.BatchClassificationService;
import smart.organizer.app.service.InsightService;
import smart.organizer.app.service.MessageClassificationService;
import smart.organizer.app.service.MessageViewService;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
public class ClassificationController {
    static final String SERVICE_NAME = "Smart Message Organizer API";
    static final String VERSION = "1.0.0";

    private final BatchClassificationService batchClassificationService;
    private final InsightService insightService;
    private final MessageViewService messageViewService;
    private final MessageClassificationService messageClassificationService;
    private final OrganizerProperties properties;

    public ClassificationController(
            BatchClassificationService batchClassificationService,
            InsightService insightService,
            MessageViewService messageViewService,
            MessageClassificationService messageClassificationService,
            OrganizerProperties properties) {
        this.batchClassificationService = batchClassificationService;
        this.insightService = insightService;
        this.messageViewService = messageViewService;
        this.messageClassificationService = messageClassificationService;
        this.properties = properties;
    }

    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("health", "/health");
        endpoints.put("classify", "/classify");
        endpoints.put("view", "/view");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", SERVICE_NAME);
        body.put("version", VERSION);
        body.put("status", "running");
        body.put("endpoints", endpoints);
        return body;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        OrganizerProperties.Model model = properties.getModel();
        return new HealthResponse(
                "healthy",
                Instant.now(),
                SERVICE_NAME,
                VERSION,
                messageClassificationService.name(),
                model.isEnabled(),
                model.isEnabled() ? model.resolvedName() : null,
                model.isUseAccelerator());
    }

    /**
     * Classify a batch of messages and derive insights for it.
     * Insight failures never fail the request; the response just carries no insights.
     */
    @PostMapping("/classify")
    public ResponseEntity<ClassifyResponse> classify(@Valid @RequestBody ClassifyRequest request) {
        log.info("Received classification request for {} messages", request.getMessages().size());
        BatchResult result = batchClassificationService.classifyBatch(request.getMessages());

        List<Insight> insights = null;
        try {
            insights = insightService.generate(result);
        } catch (RuntimeException e) {
            log.error("Insight generation failed, returning results without insights: {}", e.getMessage(), e);
        }

        return ResponseEntity.ok(ClassifyResponse.of(result, insights));
    }

    @PostMapping("/view")
    public ResponseEntity<ViewResponse> view(@Valid @RequestBody ViewRequest request) {
        ViewState viewState = ViewState.builder()
                .query(request.getQuery() != null ? request.getQuery() : "")
                .category(ViewState.parseCategoryFilter(request.getCategory()))
                .sortKey(ViewState.SortKey.fromValue(request.getSort()))
                .direction(ViewState.SortDirection.fromValue(request.getDirection()))
                .build();

        MessageView view = messageViewService.apply(request.getCategorized().toBuckets(), viewState);
        return ResponseEntity.ok(ViewResponse.of(view));
    }
}
