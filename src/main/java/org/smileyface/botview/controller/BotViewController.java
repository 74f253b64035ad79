package org.smileyface.botview.controller;

import org.smileyface.botview.model.AnalyzeRequest;
import org.smileyface.botview.model.AnalyzeResponse;
import org.smileyface.botview.model.FetchOutcome;
import org.smileyface.botview.model.GooglebotViewResponse;
import org.smileyface.botview.model.HealthResponse;
import org.smileyface.botview.model.Identity;
import org.smileyface.botview.model.PreviewResponse;
import org.smileyface.botview.service.SeoAnalysisService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

@RestController
@RequestMapping("/api")
class BotViewController {

    private final SeoAnalysisService service;

    BotViewController(SeoAnalysisService service) {
        this.service = service;
    }

    @GetMapping("/googlebot-view")
    public GooglebotViewResponse googlebotView(@RequestParam("url") String url,
                                               @RequestParam(value = "mode", defaultValue = "bot") String mode) {
        return GooglebotViewResponse.from(service.view(url, Identity.fromMode(mode)));
    }

    @GetMapping("/googlebot-view/raw")
    public ResponseEntity<String> googlebotViewRaw(@RequestParam("url") String url,
                                                   @RequestParam(value = "mode", defaultValue = "bot") String mode) {
        FetchOutcome outcome = service.view(url, Identity.fromMode(mode));
        if (!outcome.isSuccess()) {
            throw new ResponseStatusException(HttpStatus.BAD_GATEWAY,
                    outcome.getError() != null ? outcome.getError() : "Failed to fetch");
        }
        return ResponseEntity.ok().contentType(MediaType.TEXT_HTML).body(outcome.getHtml());
    }

    @GetMapping("/googlebot-preview")
    public PreviewResponse googlebotPreview(@RequestParam("url") String url,
                                            @RequestParam(value = "includeUser", defaultValue = "true") boolean includeUser) {
        return service.preview(url, includeUser);
    }

    @GetMapping("/analyze")
    public AnalyzeResponse analyze(@RequestParam("url") String url,
                                   @RequestParam(value = "detectCloaking", defaultValue = "false") boolean detectCloaking,
                                   @RequestParam(value = "includeHtml", defaultValue = "false") boolean includeHtml) {
        return service.analyze(url, detectCloaking, includeHtml);
    }

    @PostMapping("/analyze")
    public AnalyzeResponse analyze(@RequestBody AnalyzeRequest request) {
        if (request == null || request.url() == null) {
            throw new IllegalArgumentException("url is required");
        }
        return service.analyze(request.url(), request.detectCloaking(), request.includeHtml());
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return service.health();
    }

    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest()
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("success", false, "error", String.valueOf(e.getMessage())));
    }
}
