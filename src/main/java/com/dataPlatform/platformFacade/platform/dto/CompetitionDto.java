package com.dataPlatform.platformFacade.platform.dto;

import com.dataPlatform.platformFacade.platform.model.CompetitionRecord;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Competition entry of GET /competitions/list.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class CompetitionDto {

    private Long id;
    private String ref;
    private String title;
    private String url;
    private String description;
    private String category;
    private String reward;
    private String deadline;
    private Integer maxTeamSize;
    private String evaluationMetric;
    private Integer teamCount;
    private Boolean userHasEntered;
    private List<TagDto> tags;
    private String enabledDate;
    private String evaluationEndDate;

    public CompetitionRecord toRecord() {
        return CompetitionRecord.builder()
                .id(id)
                .ref(ref)
                .title(title)
                .url(url)
                .description(description)
                .category(category)
                .reward(reward)
                .deadline(PlatformTimestamps.parse(deadline))
                .maxTeamSize(maxTeamSize)
                .evaluationMetric(evaluationMetric)
                .totalTeams(teamCount)
                .userHasEntered(userHasEntered)
                .tags(TagDto.toTags(tags))
                .enabledDate(PlatformTimestamps.parse(enabledDate))
                .evaluationEndDate(PlatformTimestamps.parse(evaluationEndDate))
                .build();
    }
}
