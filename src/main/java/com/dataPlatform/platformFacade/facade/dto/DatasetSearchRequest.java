package com.dataPlatform.platformFacade.facade.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dataset search parameters. "all" or empty filters are not applied.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DatasetSearchRequest {

    private String search;

    /**
     * hottest, votes, updated, active, published
     */
    private String sortBy;

    /**
     * all, small, medium, large
     */
    private String size;

    private String fileType;
    private String licenseName;

    /**
     * Comma-separated tag ids.
     */
    private String tagIds;

    private String user;
    private Integer page;
    private Integer pageSize;
}
