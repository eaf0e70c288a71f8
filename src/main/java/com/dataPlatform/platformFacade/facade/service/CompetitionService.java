package com.dataPlatform.platformFacade.facade.service;

import com.dataPlatform.platformFacade.config.FacadeSettings;
import com.dataPlatform.platformFacade.facade.cache.CacheCategory;
import com.dataPlatform.platformFacade.facade.dto.CompetitionSearchRequest;
import com.dataPlatform.platformFacade.facade.dto.DownloadRequest;
import com.dataPlatform.platformFacade.facade.dto.OperationResponse;
import com.dataPlatform.platformFacade.facade.validation.RequestValidator;
import com.dataPlatform.platformFacade.platform.PlatformClient;
import com.dataPlatform.platformFacade.platform.exception.PlatformClientException;
import com.dataPlatform.platformFacade.platform.model.CompetitionRecord;
import com.dataPlatform.platformFacade.util.FileNames;
import com.dataPlatform.platformFacade.util.PrizeAmounts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Competition operations: search, detail lookup and file download.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompetitionService {

    static final String DEFAULT_CATEGORY = "all";
    static final String DEFAULT_SORT = "deadline";

    private final PlatformClient platformClient;
    private final OperationRunner operationRunner;
    private final RequestValidator requestValidator;
    private final DownloadDirectoryService downloadDirectoryService;
    private final FacadeSettings settings;

    /**
     * Lists competitions matching the search term and category, sorted and paged.
     *
     * @param request Search parameters
     * @return {competitions, total_count, page, page_size} or an error envelope
     */
    public OperationResponse searchCompetitions(CompetitionSearchRequest request) {
        String search = Objects.requireNonNullElse(request.getSearch(), "");
        String category = Objects.requireNonNullElse(request.getCategory(), DEFAULT_CATEGORY);
        String sortBy = Objects.requireNonNullElse(request.getSortBy(), DEFAULT_SORT);
        int page = Objects.requireNonNullElse(request.getPage(), 1);
        int pageSize = Objects.requireNonNullElse(request.getPageSize(), settings.getDefaultPageSize());

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("search", search);
        parameters.put("category", category);
        parameters.put("sort_by", sortBy);
        parameters.put("page", page);
        parameters.put("page_size", pageSize);

        return operationRunner.execute(FacadeOperation.builder()
                .name("competitions.search")
                .parameters(parameters)
                .validation(requestValidator.validatePagination(page, pageSize))
                .cacheCategory(CacheCategory.COMPETITIONS)
                .upstreamCall(() -> {
                    List<CompetitionRecord> matches = platformClient.listCompetitions().stream()
                            .filter(competition -> matchesSearch(competition, search))
                            .filter(competition -> matchesCategory(competition, category))
                            .sorted(comparatorFor(sortBy))
                            .toList();

                    List<Map<String, Object>> competitions = slice(matches, page, pageSize).stream()
                            .map(CompetitionService::competitionFields)
                            .toList();

                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put("competitions", competitions);
                    payload.put("total_count", matches.size());
                    payload.put("page", page);
                    payload.put("page_size", pageSize);
                    return payload;
                })
                .build());
    }

    /**
     * Looks up one competition by id, ref or URL slug.
     *
     * @param competitionId Competition identifier
     * @return Competition fields plus tags and timeline, or an error envelope
     */
    public OperationResponse getCompetitionDetails(String competitionId) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("competition_id", competitionId);

        return operationRunner.execute(FacadeOperation.builder()
                .name("competitions.detail")
                .parameters(parameters)
                .validation(RequestValidator.requireIdentifier(competitionId, "Competition ID"))
                .cacheCategory(CacheCategory.COMPETITIONS)
                .upstreamCall(() -> {
                    CompetitionRecord competition = platformClient.listCompetitions().stream()
                            .filter(candidate -> matchesIdentifier(candidate, competitionId))
                            .findFirst()
                            .orElseThrow(() -> new PlatformClientException(
                                    "404 Not Found - competition " + competitionId));

                    Map<String, Object> timeline = new LinkedHashMap<>();
                    timeline.put("start_date", competition.getEnabledDate());
                    timeline.put("deadline", competition.getDeadline());
                    timeline.put("evaluation_end_date", competition.getEvaluationEndDate());

                    Map<String, Object> payload = competitionFields(competition);
                    payload.put("tags", competition.getTags() != null ? competition.getTags() : List.of());
                    payload.put("timeline", timeline);
                    return payload;
                })
                .build());
    }

    /**
     * Downloads one file, or all files, of a competition. Never cached.
     *
     * @param request Download parameters; {@code target} is the competition id
     * @return {competition_id, download_path, downloaded_files, total_files} or an error envelope
     */
    public OperationResponse downloadCompetitionFiles(DownloadRequest request) {
        String competitionId = request.getTarget();
        String downloadPath = settings.resolveDownloadPath(request.getDownloadPath());

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("competition_id", competitionId);
        parameters.put("download_path", downloadPath);
        parameters.put("file_name", request.getFileName());
        parameters.put("force", request.isForce());

        return operationRunner.execute(FacadeOperation.builder()
                .name("competitions.download")
                .parameters(parameters)
                .validation(RequestValidator.requirePathSegment(competitionId, "Competition ID"))
                .upstreamCall(() -> {
                    Path directory = downloadDirectoryService.ensureDownloadDirectory(downloadPath);
                    List<String> downloadedFiles;
                    if (request.getFileName() != null && !request.getFileName().isBlank()) {
                        platformClient.competitionDownloadFile(competitionId, request.getFileName(), directory,
                                request.isForce(), request.quietOrDefault());
                        downloadedFiles = List.of(FileNames.sanitize(request.getFileName()));
                    } else {
                        platformClient.competitionDownloadFiles(competitionId, directory,
                                request.isForce(), request.quietOrDefault());
                        downloadedFiles = downloadDirectoryService.listFiles(
                                downloadDirectoryService.resolveInside(directory, competitionId));
                    }

                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put("competition_id", competitionId);
                    payload.put("download_path", downloadPath);
                    payload.put("downloaded_files", downloadedFiles);
                    payload.put("total_files", downloadedFiles.size());
                    return payload;
                })
                .build());
    }

    static Map<String, Object> competitionFields(CompetitionRecord competition) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("id", competition.getId());
        fields.put("ref", competition.getRef());
        fields.put("title", competition.getTitle());
        fields.put("url", competition.getUrl());
        fields.put("description", competition.getDescription());
        fields.put("category", competition.getCategory());
        fields.put("reward", competition.getReward());
        fields.put("deadline", competition.getDeadline());
        fields.put("max_team_size", competition.getMaxTeamSize());
        fields.put("evaluation_metric", competition.getEvaluationMetric());
        fields.put("total_teams", competition.getTotalTeams());
        fields.put("user_has_entered", competition.getUserHasEntered());
        return fields;
    }

    static boolean matchesIdentifier(CompetitionRecord competition, String competitionId) {
        if (competition.getId() != null && String.valueOf(competition.getId()).equals(competitionId)) {
            return true;
        }
        if (competitionId.equals(competition.getRef())) {
            return true;
        }
        return competition.getUrl() != null && competition.getUrl().endsWith("/" + competitionId);
    }

    private static boolean matchesSearch(CompetitionRecord competition, String search) {
        if (search.isBlank()) {
            return true;
        }
        String term = search.toLowerCase(Locale.ROOT).trim();
        return containsIgnoreCase(competition.getTitle(), term) || containsIgnoreCase(competition.getDescription(), term);
    }

    private static boolean matchesCategory(CompetitionRecord competition, String category) {
        if (category.isBlank() || DEFAULT_CATEGORY.equalsIgnoreCase(category)) {
            return true;
        }
        return category.equalsIgnoreCase(competition.getCategory());
    }

    private static boolean containsIgnoreCase(String text, String lowerTerm) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(lowerTerm);
    }

    /**
     * Unknown sort keys keep the upstream order (stable sort with an all-equal comparator).
     */
    private static Comparator<CompetitionRecord> comparatorFor(String sortBy) {
        return switch (sortBy) {
            case "deadline" -> Comparator.comparing(CompetitionRecord::getDeadline,
                    Comparator.nullsLast(Comparator.naturalOrder()));
            case "prize" -> Comparator.comparingLong(
                    (CompetitionRecord competition) -> PrizeAmounts.parse(competition.getReward())).reversed();
            case "numberOfTeams" -> Comparator.comparing(CompetitionRecord::getTotalTeams,
                    Comparator.nullsLast(Comparator.reverseOrder()));
            case "recentlyCreated" -> Comparator.comparing(CompetitionRecord::getEnabledDate,
                    Comparator.nullsLast(Comparator.reverseOrder()));
            default -> (left, right) -> 0;
        };
    }

    static <T> List<T> slice(List<T> items, int page, int pageSize) {
        long from = (long) (page - 1) * pageSize;
        if (from >= items.size()) {
            return List.of();
        }
        int to = (int) Math.min(from + pageSize, items.size());
        return items.subList((int) from, to);
    }
}
