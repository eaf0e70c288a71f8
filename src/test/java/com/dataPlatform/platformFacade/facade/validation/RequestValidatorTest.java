package com.dataPlatform.platformFacade.facade.validation;

import com.dataPlatform.platformFacade.config.FacadeSettings;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RequestValidatorTest {

    @Test
    void validatePagination_PageZero_Invalid() {
        ValidationResult result = RequestValidator.validatePagination(0, 20, 100);

        assertThat(result.valid()).isFalse();
        assertThat(result.message()).isEqualTo("Page number must be 1 or greater");
    }

    @Test
    void validatePagination_PageSizeZero_Invalid() {
        ValidationResult result = RequestValidator.validatePagination(1, 0, 100);

        assertThat(result.valid()).isFalse();
        assertThat(result.message()).isEqualTo("Page size must be 1 or greater");
    }

    @Test
    void validatePagination_PageSizeAboveMax_Invalid() {
        ValidationResult result = RequestValidator.validatePagination(1, 150, 100);

        assertThat(result.valid()).isFalse();
        assertThat(result.message()).isEqualTo("Page size cannot exceed 100");
    }

    @Test
    void validatePagination_WithinBounds_Valid() {
        assertThat(RequestValidator.validatePagination(2, 50, 100).valid()).isTrue();
        assertThat(RequestValidator.validatePagination(1, 100, 100).valid()).isTrue();
    }

    @Test
    void validatePagination_UsesConfiguredMax() {
        // given
        RequestValidator validator = new RequestValidator(FacadeSettings.builder().maxPageSize(10).build());

        // when
        ValidationResult result = validator.validatePagination(1, 11);

        // then
        assertThat(result.message()).isEqualTo("Page size cannot exceed 10");
    }

    @Test
    void validateDatasetRef_OwnerAndName_ValidWithParts() {
        // when
        ReferenceValidation validation = RequestValidator.validateDatasetRef("alice/titanic");

        // then
        assertThat(validation.isValid()).isTrue();
        assertThat(validation.ref()).isEqualTo(new ResourceRef("alice", "titanic"));
        assertThat(validation.ref().toString()).isEqualTo("alice/titanic");
    }

    @Test
    void validateDatasetRef_NoSeparator_Invalid() {
        ReferenceValidation validation = RequestValidator.validateDatasetRef("titanic");

        assertThat(validation.isValid()).isFalse();
        assertThat(validation.result().message()).isEqualTo("Dataset reference must be in format 'username/dataset-name'");
        assertThat(validation.ref()).isNull();
    }

    @Test
    void validateDatasetRef_MultipleSeparators_Invalid() {
        assertThat(RequestValidator.validateDatasetRef("a/b/c").result().message())
                .isEqualTo("Dataset reference must contain exactly one '/' separator");
        assertThat(RequestValidator.validateDatasetRef("a/b/").isValid()).isFalse();
    }

    @Test
    void validateDatasetRef_EmptySide_Invalid() {
        assertThat(RequestValidator.validateDatasetRef("/titanic").result().message())
                .isEqualTo("Both username and dataset name must be non-empty");
        assertThat(RequestValidator.validateDatasetRef("alice/").isValid()).isFalse();
    }

    @Test
    void validateDatasetRef_Blank_Invalid() {
        assertThat(RequestValidator.validateDatasetRef(null).result().message())
                .isEqualTo("Dataset reference cannot be empty");
        assertThat(RequestValidator.validateDatasetRef("  ").isValid()).isFalse();
    }

    @Test
    void requireIdentifier_Blank_Invalid() {
        assertThat(RequestValidator.requireIdentifier("", "Competition ID").message())
                .isEqualTo("Competition ID cannot be empty");
        assertThat(RequestValidator.requireIdentifier("titanic", "Competition ID").valid()).isTrue();
    }

    @Test
    void validateDatasetRef_DotSegments_Invalid() {
        assertThat(RequestValidator.validateDatasetRef("alice/..").result().message())
                .isEqualTo("Username and dataset name cannot be '.' or '..' or contain '\\'");
        assertThat(RequestValidator.validateDatasetRef("../titanic").isValid()).isFalse();
        assertThat(RequestValidator.validateDatasetRef("alice/.").isValid()).isFalse();
        assertThat(RequestValidator.validateDatasetRef("alice/a\\b").isValid()).isFalse();
        assertThat(RequestValidator.validateDatasetRef("alice/titanic.v2").isValid()).isTrue();
    }

    @Test
    void requirePathSegment_RejectsTraversal() {
        assertThat(RequestValidator.requirePathSegment("..", "Competition ID").message())
                .isEqualTo("Competition ID cannot be '.' or '..' or contain '/' or '\\'");
        assertThat(RequestValidator.requirePathSegment("a/b", "Competition ID").valid()).isFalse();
        assertThat(RequestValidator.requirePathSegment(" ", "Competition ID").message())
                .isEqualTo("Competition ID cannot be empty");
        assertThat(RequestValidator.requirePathSegment("titanic", "Competition ID").valid()).isTrue();
    }
}
