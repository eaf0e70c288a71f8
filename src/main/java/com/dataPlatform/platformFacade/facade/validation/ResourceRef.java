package com.dataPlatform.platformFacade.facade.validation;

/**
 * An "owner/name" reference split into its parts.
 */
public record ResourceRef(String owner, String name) {

    @Override
    public String toString() {
        return owner + ReferenceValidation.SEPARATOR + name;
    }
}
