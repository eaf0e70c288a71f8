package com.dataPlatform.platformFacade.facade.normalization;

/**
 * Capability for wrapper values that expose a single underlying value.
 */
public interface ValueCarrier {

    Object getValue();
}
