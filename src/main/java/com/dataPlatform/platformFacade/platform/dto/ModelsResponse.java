package com.dataPlatform.platformFacade.platform.dto;

import com.dataPlatform.platformFacade.platform.model.ModelRecord;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of GET /models/list.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelsResponse {

    private List<Model> models;
    private String nextPageToken;

    public List<ModelRecord> toRecords() {
        if (models == null) {
            return List.of();
        }
        return models.stream().map(Model::toRecord).toList();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Model {
        private Long id;
        private String ref;
        private String title;
        private String subtitle;
        private String author;
        private String slug;

        @JsonProperty("isPrivate")
        private Boolean privateModel;

        private String description;
        private String publishTime;

        ModelRecord toRecord() {
            return ModelRecord.builder()
                    .id(id)
                    .ref(ref)
                    .title(title)
                    .subtitle(subtitle)
                    .author(author)
                    .slug(slug)
                    .privateModel(privateModel)
                    .description(description)
                    .publishTime(PlatformTimestamps.parse(publishTime))
                    .build();
        }
    }
}
