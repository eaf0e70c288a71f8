package com.dataPlatform.platformFacade.platform;

import com.dataPlatform.platformFacade.config.FacadeSettings;
import com.dataPlatform.platformFacade.platform.dto.CompetitionDto;
import com.dataPlatform.platformFacade.platform.dto.DatasetDto;
import com.dataPlatform.platformFacade.platform.dto.DatasetFilesResponse;
import com.dataPlatform.platformFacade.platform.dto.ModelsResponse;
import com.dataPlatform.platformFacade.platform.exception.PlatformClientException;
import com.dataPlatform.platformFacade.platform.model.CompetitionRecord;
import com.dataPlatform.platformFacade.platform.model.DatasetFileRecord;
import com.dataPlatform.platformFacade.platform.model.DatasetQuery;
import com.dataPlatform.platformFacade.platform.model.DatasetRecord;
import com.dataPlatform.platformFacade.platform.model.ModelQuery;
import com.dataPlatform.platformFacade.platform.model.ModelRecord;
import com.dataPlatform.platformFacade.util.FileNames;
import com.dataPlatform.platformFacade.util.ZipArchives;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriBuilder;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Platform client over the public REST API (v1).
 *
 * Handles:
 * - HTTP basic credentials from configuration
 * - Mapping API JSON to platform records
 * - Streaming downloads to disk, with optional archive extraction
 * - Translating HTTP and I/O failures into {@link PlatformClientException}
 *   whose message starts with the HTTP status (e.g. "404 Not Found")
 */
@Slf4j
public class KagglePlatformClient implements PlatformClient {

    private static final String ARCHIVE_SUFFIX = ".zip";

    private final RestClient restClient;

    /**
     * @param builder Pre-configured builder (timeouts, request factory)
     * @param settings Base URL and credentials
     */
    public KagglePlatformClient(RestClient.Builder builder, FacadeSettings settings) {
        RestClient.Builder configured = builder
                .baseUrl(settings.getApiBaseUrl())
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE);
        if (isSet(settings.getUsername()) && isSet(settings.getApiKey())) {
            configured = configured.defaultHeaders(headers -> headers.setBasicAuth(settings.getUsername(), settings.getApiKey()));
        }
        this.restClient = configured.build();
    }

    @Override
    public List<CompetitionRecord> listCompetitions() {
        List<CompetitionDto> competitions = call("list competitions", () -> restClient.get()
                .uri("/competitions/list")
                .retrieve()
                .body(new ParameterizedTypeReference<List<CompetitionDto>>() {}));

        return competitions == null ? List.of() : competitions.stream().map(CompetitionDto::toRecord).toList();
    }

    @Override
    public void competitionDownloadFile(String competitionId, String fileName, Path path, boolean force, boolean quiet) {
        Path target = path.resolve(FileNames.sanitize(fileName));
        if (!force && Files.exists(target)) {
            log.info("File already downloaded, skipping - competitionId: {}, file: {}", competitionId, target);
            return;
        }
        call("download competition file " + competitionId + "/" + fileName, () ->
                downloadTo(target, quiet, "/competitions/data/download/{id}/{fileName}", competitionId, fileName));
    }

    @Override
    public void competitionDownloadFiles(String competitionId, Path path, boolean force, boolean quiet) {
        Path directory = subdirectory(path, competitionId);
        if (!force && hasFiles(directory)) {
            log.info("Competition files already downloaded, skipping - competitionId: {}, directory: {}", competitionId, directory);
            return;
        }
        call("download competition files " + competitionId, () -> {
            Path archive = downloadTo(directory.resolve(competitionId + ARCHIVE_SUFFIX), quiet,
                    "/competitions/data/download-all/{id}", competitionId);
            extractArchive(archive, directory);
            return archive;
        });
    }

    @Override
    public List<DatasetRecord> listDatasets(DatasetQuery query) {
        List<DatasetDto> datasets = call("list datasets", () -> restClient.get()
                .uri(builder -> {
                    builder.path("/datasets/list");
                    queryParam(builder, "search", query.getSearch());
                    queryParam(builder, "sortBy", query.getSortBy());
                    queryParam(builder, "size", query.getSize());
                    queryParam(builder, "filetype", query.getFileType());
                    queryParam(builder, "license", query.getLicenseName());
                    queryParam(builder, "tagids", query.getTagIds());
                    queryParam(builder, "user", query.getUser());
                    queryParam(builder, "page", query.getPage() > 0 ? query.getPage() : null);
                    return builder.build();
                })
                .retrieve()
                .body(new ParameterizedTypeReference<List<DatasetDto>>() {}));

        return datasets == null ? List.of() : datasets.stream().map(DatasetDto::toRecord).toList();
    }

    @Override
    public DatasetRecord viewDataset(String owner, String datasetName) {
        DatasetDto dataset = call("view dataset " + owner + "/" + datasetName, () -> restClient.get()
                .uri("/datasets/view/{owner}/{slug}", owner, datasetName)
                .retrieve()
                .body(DatasetDto.class));

        if (dataset == null) {
            throw new PlatformClientException("404 Not Found - dataset " + owner + "/" + datasetName + " returned no body");
        }
        return dataset.toRecord();
    }

    @Override
    public List<DatasetFileRecord> listDatasetFiles(String owner, String datasetName) {
        DatasetFilesResponse files = call("list dataset files " + owner + "/" + datasetName, () -> restClient.get()
                .uri("/datasets/list/{owner}/{slug}", owner, datasetName)
                .retrieve()
                .body(DatasetFilesResponse.class));

        return files == null ? List.of() : files.toRecords();
    }

    @Override
    public void datasetDownloadFile(String owner, String datasetName, String fileName, Path path, boolean force, boolean quiet) {
        Path target = path.resolve(FileNames.sanitize(fileName));
        if (!force && Files.exists(target)) {
            log.info("File already downloaded, skipping - dataset: {}/{}, file: {}", owner, datasetName, target);
            return;
        }
        call("download dataset file " + owner + "/" + datasetName + "/" + fileName, () ->
                downloadTo(target, quiet, "/datasets/download/{owner}/{slug}/{fileName}", owner, datasetName, fileName));
    }

    @Override
    public void datasetDownloadFiles(String owner, String datasetName, Path path, boolean force, boolean quiet, boolean unzip) {
        Path directory = subdirectory(path, datasetName);
        if (!force && hasFiles(directory)) {
            log.info("Dataset already downloaded, skipping - dataset: {}/{}, directory: {}", owner, datasetName, directory);
            return;
        }
        call("download dataset " + owner + "/" + datasetName, () -> {
            Path archive = downloadTo(directory.resolve(datasetName + ARCHIVE_SUFFIX), quiet,
                    "/datasets/download/{owner}/{slug}", owner, datasetName);
            if (unzip) {
                extractArchive(archive, directory);
            }
            return archive;
        });
    }

    @Override
    public List<ModelRecord> listModels(ModelQuery query) {
        ModelsResponse models = call("list models", () -> restClient.get()
                .uri(builder -> {
                    builder.path("/models/list");
                    queryParam(builder, "search", query.getSearch());
                    queryParam(builder, "sortBy", query.getSortBy());
                    queryParam(builder, "owner", query.getOwner());
                    queryParam(builder, "pageSize", query.getPageSize() > 0 ? query.getPageSize() : null);
                    queryParam(builder, "pageToken", query.getPageToken());
                    return builder.build();
                })
                .retrieve()
                .body(ModelsResponse.class));

        return models == null ? List.of() : models.toRecords();
    }

    /**
     * Streams a GET response body into {@code target}.
     */
    private Path downloadTo(Path target, boolean quiet, String uriTemplate, Object... uriVariables) {
        logProgress(quiet, "Downloading - uri: {}, target: {}", uriTemplate, target);
        return restClient.get()
                .uri(uriTemplate, uriVariables)
                .exchange((request, response) -> {
                    if (response.getStatusCode().isError()) {
                        throw new PlatformClientException(response.getStatusCode().value() + " "
                                + response.getStatusText() + " - GET " + request.getURI());
                    }
                    Files.createDirectories(target.getParent());
                    try (InputStream body = response.getBody()) {
                        long bytes = Files.copy(body, target, StandardCopyOption.REPLACE_EXISTING);
                        logProgress(quiet, "Downloaded - target: {}, bytes: {}", target, bytes);
                    }
                    return target;
                });
    }

    private void extractArchive(Path archive, Path directory) {
        try {
            if (!ZipArchives.isZip(archive)) {
                log.debug("Download is not an archive, keeping as-is - file: {}", archive);
                return;
            }
            ZipArchives.extract(archive, directory);
            Files.delete(archive);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to extract " + archive, e);
        }
    }

    /**
     * Resolves a per-resource directory, which must stay directly under {@code path}.
     */
    static Path subdirectory(Path path, String name) {
        Path root = path.toAbsolutePath().normalize();
        Path directory = root.resolve(name).normalize();
        if (!root.equals(directory.getParent())) {
            throw new IllegalArgumentException("Invalid directory name: " + name);
        }
        return directory;
    }

    private static boolean hasFiles(Path directory) {
        if (!Files.isDirectory(directory)) {
            return false;
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries.findAny().isPresent();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + directory, e);
        }
    }

    /**
     * Runs an API call, translating failures so the status text survives in the message.
     */
    private <T> T call(String description, Supplier<T> apiCall) {
        try {
            return apiCall.get();
        } catch (PlatformClientException e) {
            log.error("Platform API call failed - call: {}, error: {}", description, e.getMessage());
            throw e;
        } catch (RestClientResponseException e) {
            log.error("Platform API returned error - call: {}, status: {}", description, e.getStatusCode());
            throw new PlatformClientException(e.getStatusCode().value() + " " + e.getStatusText()
                    + " - " + description + ": " + e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            log.error("Platform API unreachable - call: {}", description, e);
            String prefix = isTimeout(e) ? "Request timeout" : "I/O error";
            throw new PlatformClientException(prefix + " - " + description + ": " + e.getMessage(), e);
        } catch (RestClientException | UncheckedIOException e) {
            log.error("Error calling platform API - call: {}", description, e);
            throw new PlatformClientException("Failed to call platform API - " + description + ": " + e.getMessage(), e);
        }
    }

    private static boolean isTimeout(Throwable failure) {
        for (Throwable cause = failure; cause != null; cause = cause.getCause()) {
            if (cause instanceof SocketTimeoutException || cause instanceof HttpTimeoutException) {
                return true;
            }
        }
        return false;
    }

    private static void queryParam(UriBuilder builder, String name, Object value) {
        if (value != null && !(value instanceof String text && text.isBlank())) {
            builder.queryParam(name, value);
        }
    }

    private static void logProgress(boolean quiet, String message, Object... args) {
        if (quiet) {
            log.debug(message, args);
        } else {
            log.info(message, args);
        }
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
