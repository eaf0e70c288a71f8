package com.dataPlatform.platformFacade.platform.model;

import com.dataPlatform.platformFacade.facade.normalization.ValueCarrier;
import com.dataPlatform.platformFacade.util.FileSizes;

/**
 * Size in bytes as reported by the platform. Normalizes to the raw byte count.
 */
public record ByteSize(long bytes) implements ValueCarrier {

    public static ByteSize ofNullable(Long bytes) {
        return bytes != null ? new ByteSize(bytes) : null;
    }

    @Override
    public Object getValue() {
        return bytes;
    }

    /**
     * Human-readable form, e.g. "1.5 MB".
     */
    public String display() {
        return FileSizes.format(bytes);
    }

    @Override
    public String toString() {
        return display();
    }
}
