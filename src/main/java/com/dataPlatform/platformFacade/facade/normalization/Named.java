package com.dataPlatform.platformFacade.facade.normalization;

/**
 * Capability for enumeration-like values identified by a name.
 */
public interface Named {

    String getName();
}
