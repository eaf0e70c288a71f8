package com.dataPlatform.platformFacade.facade.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModelSearchRequest {

    private String search;

    /**
     * hotness, downloadCount, voteCount, createTime
     */
    private String sortBy;

    private String owner;
    private Integer page;
    private Integer pageSize;
}
