package com.dataPlatform.platformFacade.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Dataset as returned by the platform client.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DatasetRecord {

    /**
     * "owner/slug"
     */
    private String ref;

    private String title;
    private String subtitle;
    private String description;
    private ByteSize size;
    private Instant lastUpdated;
    private Long downloadCount;
    private Long voteCount;
    private Double usabilityRating;
    private String licenseName;
    private List<PlatformTag> tags;
}
