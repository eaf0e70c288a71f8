package com.dataPlatform.platformFacade.facade.service;

import com.dataPlatform.platformFacade.config.FacadeSettings;
import com.dataPlatform.platformFacade.facade.cache.CacheCategory;
import com.dataPlatform.platformFacade.facade.dto.ModelSearchRequest;
import com.dataPlatform.platformFacade.facade.dto.OperationResponse;
import com.dataPlatform.platformFacade.facade.validation.RequestValidator;
import com.dataPlatform.platformFacade.platform.PlatformClient;
import com.dataPlatform.platformFacade.platform.model.ModelQuery;
import com.dataPlatform.platformFacade.platform.model.ModelRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Service
@RequiredArgsConstructor
public class ModelService {

    static final String DEFAULT_SORT = "hotness";

    private final PlatformClient platformClient;
    private final OperationRunner operationRunner;
    private final RequestValidator requestValidator;
    private final FacadeSettings settings;

    /**
     * Lists models. Pages past the first are requested with the page number as continuation token.
     */
    public OperationResponse listModels(ModelSearchRequest request) {
        int page = Objects.requireNonNullElse(request.getPage(), 1);
        int pageSize = Objects.requireNonNullElse(request.getPageSize(), settings.getDefaultPageSize());
        String search = blankToNull(request.getSearch());
        String sortBy = Objects.requireNonNullElse(blankToNull(request.getSortBy()), DEFAULT_SORT);
        String owner = blankToNull(request.getOwner());

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("search", search);
        parameters.put("sort_by", sortBy);
        parameters.put("owner", owner);
        parameters.put("page", page);
        parameters.put("page_size", pageSize);

        return operationRunner.execute(FacadeOperation.builder()
                .name("models.list")
                .parameters(parameters)
                .validation(requestValidator.validatePagination(page, pageSize))
                .cacheCategory(CacheCategory.MODELS)
                .upstreamCall(() -> {
                    ModelQuery query = ModelQuery.builder()
                            .search(search)
                            .sortBy(sortBy)
                            .owner(owner)
                            .pageSize(pageSize)
                            .pageToken(page > 1 ? String.valueOf(page) : null)
                            .build();

                    List<Map<String, Object>> models = platformClient.listModels(query).stream()
                            .map(this::modelFields)
                            .toList();

                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put("models", models);
                    payload.put("total_count", models.size());
                    payload.put("page", page);
                    payload.put("page_size", pageSize);
                    return payload;
                })
                .build());
    }

    private Map<String, Object> modelFields(ModelRecord model) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("ref", model.getRef());
        fields.put("title", model.getTitle());
        fields.put("subtitle", model.getSubtitle());
        fields.put("author", model.getAuthor());
        fields.put("slug", model.getSlug());
        fields.put("is_private", model.getPrivateModel());
        fields.put("description", model.getDescription());
        fields.put("publish_time", model.getPublishTime());
        fields.put("url", settings.getSiteUrl() + "/models/" + model.getRef());
        return fields;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
