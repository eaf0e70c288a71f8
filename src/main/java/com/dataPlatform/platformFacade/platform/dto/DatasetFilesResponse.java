package com.dataPlatform.platformFacade.platform.dto;

import com.dataPlatform.platformFacade.platform.model.ByteSize;
import com.dataPlatform.platformFacade.platform.model.DatasetFileRecord;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of GET /datasets/list/{owner}/{slug}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatasetFilesResponse {

    private List<DatasetFile> datasetFiles;

    public List<DatasetFileRecord> toRecords() {
        if (datasetFiles == null) {
            return List.of();
        }
        return datasetFiles.stream().map(DatasetFile::toRecord).toList();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DatasetFile {
        private String name;
        private Long totalBytes;
        private String creationDate;

        DatasetFileRecord toRecord() {
            return DatasetFileRecord.builder()
                    .name(name)
                    .size(ByteSize.ofNullable(totalBytes))
                    .creationDate(PlatformTimestamps.parse(creationDate))
                    .build();
        }
    }
}
