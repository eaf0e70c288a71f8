package com.dataPlatform.platformFacade.gateway.controller;

import com.dataPlatform.platformFacade.facade.dto.CompetitionSearchRequest;
import com.dataPlatform.platformFacade.facade.dto.DatasetSearchRequest;
import com.dataPlatform.platformFacade.facade.dto.DownloadRequest;
import com.dataPlatform.platformFacade.facade.dto.ModelSearchRequest;
import com.dataPlatform.platformFacade.facade.dto.OperationResponse;
import com.dataPlatform.platformFacade.facade.service.CompetitionService;
import com.dataPlatform.platformFacade.facade.service.DatasetService;
import com.dataPlatform.platformFacade.facade.service.ModelService;
import com.dataPlatform.platformFacade.report.service.PlatformReportService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Platform REST controller - thin HTTP layer over the facade operations.
 *
 * Responsibilities:
 * - Map query parameters and bodies onto facade requests
 * - Return operation envelopes unchanged (HTTP 200 for success and error envelopes)
 * - Serve text reports as Markdown
 */
@RestController
@RequestMapping("/api/v1/platform")
@RequiredArgsConstructor
public class PlatformController {

    static final String MARKDOWN = "text/markdown";

    private final CompetitionService competitionService;
    private final DatasetService datasetService;
    private final ModelService modelService;
    private final PlatformReportService reportService;

    /**
     * Query parameters: search, category, sortBy, page, pageSize.
     */
    @GetMapping("/competitions")
    public ResponseEntity<OperationResponse> searchCompetitions(@ModelAttribute CompetitionSearchRequest request) {
        return ResponseEntity.ok(competitionService.searchCompetitions(request));
    }

    @GetMapping("/competitions/{competitionId}")
    public ResponseEntity<OperationResponse> getCompetitionDetails(@PathVariable String competitionId) {
        return ResponseEntity.ok(competitionService.getCompetitionDetails(competitionId));
    }

    /**
     * Downloads competition files into the requested (or default) directory.
     *
     * @param competitionId Competition identifier
     * @param request Optional download options; {@code target} is taken from the path
     */
    @PostMapping("/competitions/{competitionId}/download")
    public ResponseEntity<OperationResponse> downloadCompetitionFiles(
            @PathVariable String competitionId,
            @RequestBody(required = false) DownloadRequest request) {

        DownloadRequest download = request != null ? request : new DownloadRequest();
        download.setTarget(competitionId);
        return ResponseEntity.ok(competitionService.downloadCompetitionFiles(download));
    }

    @GetMapping("/datasets")
    public ResponseEntity<OperationResponse> searchDatasets(@ModelAttribute DatasetSearchRequest request) {
        return ResponseEntity.ok(datasetService.searchDatasets(request));
    }

    /**
     * The reference is a query parameter so malformed values reach validation.
     */
    @GetMapping("/datasets/detail")
    public ResponseEntity<OperationResponse> getDatasetDetails(@RequestParam(name = "ref", required = false) String datasetRef) {
        return ResponseEntity.ok(datasetService.getDatasetDetails(datasetRef));
    }

    @PostMapping("/datasets/download")
    public ResponseEntity<OperationResponse> downloadDataset(@RequestBody DownloadRequest request) {
        return ResponseEntity.ok(datasetService.downloadDataset(request));
    }

    @GetMapping("/models")
    public ResponseEntity<OperationResponse> listModels(@ModelAttribute ModelSearchRequest request) {
        return ResponseEntity.ok(modelService.listModels(request));
    }

    @GetMapping(value = "/reports/active-competitions", produces = MARKDOWN)
    public ResponseEntity<String> activeCompetitions() {
        return ResponseEntity.ok(reportService.activeCompetitions());
    }

    @GetMapping(value = "/reports/popular-datasets", produces = MARKDOWN)
    public ResponseEntity<String> popularDatasets() {
        return ResponseEntity.ok(reportService.popularDatasets());
    }

    @GetMapping(value = "/reports/upcoming-deadlines", produces = MARKDOWN)
    public ResponseEntity<String> upcomingDeadlines() {
        return ResponseEntity.ok(reportService.upcomingDeadlines());
    }

    @GetMapping(value = "/reports/platform-stats", produces = MARKDOWN)
    public ResponseEntity<String> platformStatistics() {
        return ResponseEntity.ok(reportService.platformStatistics());
    }

    @GetMapping(value = "/reports/hot-topics", produces = MARKDOWN)
    public ResponseEntity<String> hotTopics() {
        return ResponseEntity.ok(reportService.hotTopics());
    }

    @GetMapping(value = "/reports/getting-started", produces = MARKDOWN)
    public ResponseEntity<String> beginnerGuide() {
        return ResponseEntity.ok(reportService.beginnerGuide());
    }
}
