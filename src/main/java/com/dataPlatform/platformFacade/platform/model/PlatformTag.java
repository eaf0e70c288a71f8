package com.dataPlatform.platformFacade.platform.model;

import com.dataPlatform.platformFacade.facade.normalization.Named;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Tag attached to a competition or dataset. Normalizes to its name.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlatformTag implements Named {

    private String ref;
    private String name;
}
