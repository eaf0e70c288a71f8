package com.dataPlatform.platformFacade.facade.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Download parameters shared by competitions and datasets.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DownloadRequest {

    /**
     * Competition id or dataset reference ("owner/name").
     */
    private String target;

    /**
     * Local directory; the configured default when null.
     */
    private String downloadPath;

    /**
     * Single file to fetch; all files when null.
     */
    private String fileName;

    private boolean force;

    /**
     * Defaults to true when null.
     */
    private Boolean quiet;

    /**
     * Datasets only. Defaults to true when null.
     */
    private Boolean unzip;

    public boolean quietOrDefault() {
        return !Boolean.FALSE.equals(quiet);
    }

    public boolean unzipOrDefault() {
        return !Boolean.FALSE.equals(unzip);
    }
}
