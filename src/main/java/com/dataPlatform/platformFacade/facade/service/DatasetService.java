package com.dataPlatform.platformFacade.facade.service;

import com.dataPlatform.platformFacade.config.FacadeSettings;
import com.dataPlatform.platformFacade.facade.cache.CacheCategory;
import com.dataPlatform.platformFacade.facade.dto.DatasetSearchRequest;
import com.dataPlatform.platformFacade.facade.dto.DownloadRequest;
import com.dataPlatform.platformFacade.facade.dto.OperationResponse;
import com.dataPlatform.platformFacade.facade.validation.ReferenceValidation;
import com.dataPlatform.platformFacade.facade.validation.RequestValidator;
import com.dataPlatform.platformFacade.facade.validation.ResourceRef;
import com.dataPlatform.platformFacade.platform.PlatformClient;
import com.dataPlatform.platformFacade.platform.model.DatasetFileRecord;
import com.dataPlatform.platformFacade.platform.model.DatasetQuery;
import com.dataPlatform.platformFacade.platform.model.DatasetRecord;
import com.dataPlatform.platformFacade.util.FileNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dataset operations.
 *
 * Handles:
 * - Search with optional size, file type, license, tag and owner filters
 * - Detail lookup including the file listing
 * - Single-file and whole-dataset downloads
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatasetService {

    static final String DEFAULT_SORT = "hottest";
    private static final String ANY = "all";

    private final PlatformClient platformClient;
    private final OperationRunner operationRunner;
    private final RequestValidator requestValidator;
    private final DownloadDirectoryService downloadDirectoryService;
    private final FacadeSettings settings;

    public OperationResponse searchDatasets(DatasetSearchRequest request) {
        int page = Objects.requireNonNullElse(request.getPage(), 1);
        int pageSize = Objects.requireNonNullElse(request.getPageSize(), settings.getDefaultPageSize());

        DatasetQuery query = DatasetQuery.builder()
                .search(filter(request.getSearch()))
                .sortBy(Objects.requireNonNullElse(filter(request.getSortBy()), DEFAULT_SORT))
                .size(filter(request.getSize()))
                .fileType(filter(request.getFileType()))
                .licenseName(filter(request.getLicenseName()))
                .tagIds(filter(request.getTagIds()))
                .user(filter(request.getUser()))
                .page(page)
                .pageSize(pageSize)
                .build();

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("search", query.getSearch());
        parameters.put("sort_by", query.getSortBy());
        parameters.put("size", query.getSize());
        parameters.put("file_type", query.getFileType());
        parameters.put("license_name", query.getLicenseName());
        parameters.put("tag_ids", query.getTagIds());
        parameters.put("user", query.getUser());
        parameters.put("page", page);
        parameters.put("page_size", pageSize);

        return operationRunner.execute(FacadeOperation.builder()
                .name("datasets.search")
                .parameters(parameters)
                .validation(requestValidator.validatePagination(page, pageSize))
                .cacheCategory(CacheCategory.DATASETS)
                .upstreamCall(() -> {
                    List<Map<String, Object>> datasets = platformClient.listDatasets(query).stream()
                            .limit(pageSize)
                            .map(this::datasetFields)
                            .toList();

                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put("datasets", datasets);
                    payload.put("total_count", datasets.size());
                    payload.put("page", page);
                    payload.put("page_size", pageSize);
                    return payload;
                })
                .build());
    }

    /**
     * Dataset metadata plus its files.
     *
     * @param datasetRef "owner/name"
     */
    public OperationResponse getDatasetDetails(String datasetRef) {
        ReferenceValidation reference = RequestValidator.validateDatasetRef(datasetRef);

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("dataset_ref", datasetRef);

        return operationRunner.execute(FacadeOperation.builder()
                .name("datasets.detail")
                .parameters(parameters)
                .validation(reference.result())
                .cacheCategory(CacheCategory.DATASETS)
                .upstreamCall(() -> {
                    ResourceRef ref = reference.ref();
                    DatasetRecord dataset = platformClient.viewDataset(ref.owner(), ref.name());
                    List<DatasetFileRecord> files = platformClient.listDatasetFiles(ref.owner(), ref.name());

                    Map<String, Object> payload = datasetFields(dataset);
                    payload.put("subtitle", dataset.getSubtitle());
                    payload.put("description", dataset.getDescription());
                    payload.put("files", files.stream().map(DatasetService::fileFields).toList());
                    return payload;
                })
                .build());
    }

    /**
     * Downloads one file or the whole dataset. Never cached.
     *
     * @param request Download parameters; {@code target} is the dataset reference
     */
    public OperationResponse downloadDataset(DownloadRequest request) {
        String datasetRef = request.getTarget();
        ReferenceValidation reference = RequestValidator.validateDatasetRef(datasetRef);
        String downloadPath = settings.resolveDownloadPath(request.getDownloadPath());

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("dataset_ref", datasetRef);
        parameters.put("download_path", downloadPath);
        parameters.put("file_name", request.getFileName());
        parameters.put("force", request.isForce());
        parameters.put("unzip", request.unzipOrDefault());

        return operationRunner.execute(FacadeOperation.builder()
                .name("datasets.download")
                .parameters(parameters)
                .validation(reference.result())
                .upstreamCall(() -> {
                    ResourceRef ref = reference.ref();
                    Path directory = downloadDirectoryService.ensureDownloadDirectory(downloadPath);
                    List<String> downloadedFiles;
                    if (request.getFileName() != null && !request.getFileName().isBlank()) {
                        platformClient.datasetDownloadFile(ref.owner(), ref.name(), request.getFileName(), directory,
                                request.isForce(), request.quietOrDefault());
                        downloadedFiles = List.of(FileNames.sanitize(request.getFileName()));
                    } else {
                        platformClient.datasetDownloadFiles(ref.owner(), ref.name(), directory,
                                request.isForce(), request.quietOrDefault(), request.unzipOrDefault());
                        downloadedFiles = downloadDirectoryService.listFiles(
                                downloadDirectoryService.resolveInside(directory, ref.name()));
                    }

                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put("dataset_ref", datasetRef);
                    payload.put("download_path", downloadPath);
                    payload.put("downloaded_files", downloadedFiles);
                    payload.put("total_files", downloadedFiles.size());
                    return payload;
                })
                .build());
    }

    private Map<String, Object> datasetFields(DatasetRecord dataset) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("ref", dataset.getRef());
        fields.put("title", dataset.getTitle());
        fields.put("size", dataset.getSize());
        fields.put("last_updated", dataset.getLastUpdated());
        fields.put("download_count", dataset.getDownloadCount());
        fields.put("vote_count", dataset.getVoteCount());
        fields.put("usability_rating", dataset.getUsabilityRating());
        fields.put("license_name", dataset.getLicenseName());
        fields.put("tags", dataset.getTags() != null ? dataset.getTags() : List.of());
        fields.put("url", settings.getSiteUrl() + "/datasets/" + dataset.getRef());
        return fields;
    }

    private static Map<String, Object> fileFields(DatasetFileRecord file) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", file.getName());
        fields.put("size", file.getSize());
        fields.put("size_display", file.getSize() != null ? file.getSize().display() : null);
        fields.put("creation_date", file.getCreationDate());
        return fields;
    }

    /**
     * Blank and "all" mean no filter.
     */
    private static String filter(String value) {
        if (value == null || value.isBlank() || ANY.equalsIgnoreCase(value)) {
            return null;
        }
        return value;
    }
}
