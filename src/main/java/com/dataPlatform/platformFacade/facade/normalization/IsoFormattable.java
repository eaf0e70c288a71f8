package com.dataPlatform.platformFacade.facade.normalization;

/**
 * Capability for values that render themselves as an ISO-8601 timestamp.
 */
public interface IsoFormattable {

    String toIsoString();
}
