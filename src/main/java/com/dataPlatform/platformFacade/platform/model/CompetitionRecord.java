package com.dataPlatform.platformFacade.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Competition as returned by the platform client.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CompetitionRecord {

    private Long id;

    /**
     * Slug used in URLs and download endpoints (e.g. "titanic").
     */
    private String ref;

    private String title;
    private String url;
    private String description;
    private String category;

    /**
     * Free-form reward text, e.g. "$25,000 Usd" or "Knowledge".
     */
    private String reward;

    private Instant deadline;
    private Integer maxTeamSize;
    private String evaluationMetric;
    private Integer totalTeams;
    private Boolean userHasEntered;
    private List<PlatformTag> tags;
    private Instant enabledDate;
    private Instant evaluationEndDate;
}
