package com.dataPlatform.platformFacade.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Model as returned by the platform client.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ModelRecord {

    private Long id;
    private String ref;
    private String title;
    private String subtitle;
    private String author;
    private String slug;
    private Boolean privateModel;
    private String description;
    private Instant publishTime;
}
