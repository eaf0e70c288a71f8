package com.dataPlatform.platformFacade.platform.dto;

import com.dataPlatform.platformFacade.platform.model.ByteSize;
import com.dataPlatform.platformFacade.platform.model.DatasetRecord;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Dataset entry of GET /datasets/list and body of GET /datasets/view/{owner}/{slug}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatasetDto {

    private String ref;
    private String title;
    private String subtitle;
    private String description;
    private Long totalBytes;
    private String lastUpdated;
    private Long downloadCount;
    private Long voteCount;
    private Double usabilityRating;
    private String licenseName;
    private List<TagDto> tags;

    public DatasetRecord toRecord() {
        return DatasetRecord.builder()
                .ref(ref)
                .title(title)
                .subtitle(subtitle)
                .description(description)
                .size(ByteSize.ofNullable(totalBytes))
                .lastUpdated(PlatformTimestamps.parse(lastUpdated))
                .downloadCount(downloadCount)
                .voteCount(voteCount)
                .usabilityRating(usabilityRating)
                .licenseName(licenseName)
                .tags(TagDto.toTags(tags))
                .build();
    }
}
