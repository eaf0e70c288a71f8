package com.dataPlatform.platformFacade.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Model listing filters. Null fields are not sent upstream.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModelQuery {

    private String search;
    private String sortBy;
    private String owner;
    private int pageSize;

    /**
     * Opaque continuation token; null for the first page.
     */
    private String pageToken;
}
