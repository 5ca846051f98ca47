package io.marketminer.internal;

import io.marketminer.core.JobValidationException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobRequestValidatorTest {

    @Test
    void validRequestShouldPass() {
        assertDoesNotThrow(() -> JobRequestValidator.validate("shop.example", List.of("https://shop.example/a")));
    }

    @Test
    void blankDomainShouldFail() {
        JobValidationException ex = assertThrows(JobValidationException.class,
                () -> JobRequestValidator.validate("  ", List.of("https://shop.example/a")));
        assertEquals(List.of("domain must not be blank"), ex.getErrors());
    }

    @Test
    void emptyUrlsShouldFail() {
        JobValidationException ex = assertThrows(JobValidationException.class,
                () -> JobRequestValidator.validate("shop.example", List.of()));
        assertEquals(List.of("urls must contain at least one URL"), ex.getErrors());
    }

    @Test
    void everyInvalidUrlShouldBeReported() {
        JobValidationException ex = assertThrows(JobValidationException.class,
                () -> JobRequestValidator.validate("shop.example", Arrays.asList("/relative", "https://shop.example/ok", null)));
        assertEquals(List.of("Invalid URL: /relative", "Invalid URL: null"), ex.getErrors());
    }

    @Test
    void isAbsoluteUrlShouldRequireSchemeAndHost() {
        assertTrue(JobRequestValidator.isAbsoluteUrl("http://shop.example"));
        assertFalse(JobRequestValidator.isAbsoluteUrl("shop.example/a"));
        assertFalse(JobRequestValidator.isAbsoluteUrl("mailto:someone@shop.example"));
        assertFalse(JobRequestValidator.isAbsoluteUrl("https://shop example/a"));
    }
}
