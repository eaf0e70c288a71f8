package com.dataPlatform.platformFacade.facade.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Competition search parameters. Null fields fall back to defaults:
 * empty search, category "all", sort "deadline", page 1, configured page size.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CompetitionSearchRequest {

    private String search;

    /**
     * all, featured, research, recruitment, gettingStarted, ...
     */
    private String category;

    /**
     * deadline, prize, numberOfTeams, recentlyCreated
     */
    private String sortBy;

    private Integer page;
    private Integer pageSize;
}
