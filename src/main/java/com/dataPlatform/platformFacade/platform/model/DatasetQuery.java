package com.dataPlatform.platformFacade.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dataset search filters. Null fields are not sent upstream.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DatasetQuery {

    private String search;
    private String sortBy;
    private String size;
    private String fileType;
    private String licenseName;

    /**
     * Comma-separated tag ids.
     */
    private String tagIds;

    private String user;
    private int page;
    private int pageSize;
}
