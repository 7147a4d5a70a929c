package com.chicu.tradeads.service;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TradeAdValidatorTest {

    private final TradeAdValidator validator = new TradeAdValidator();

    private List<String> check(List<Long> offers, List<Long> requests, List<String> tags, String cookie) {
        return validator.validate(offers, requests, tags, cookie, true);
    }

    @Test
    void validAd_shouldHaveNoProblems() {
        assertTrue(check(List.of(1L, 2L), List.of(3L), List.of("any", "Demand"), "cookie").isEmpty());
    }

    @Test
    void offers_shouldBeBetweenOneAndFour() {
        assertTrue(check(List.of(), List.of(3L), List.of(), "c")
                .contains("You must offer at least one item"));
        assertTrue(check(null, List.of(3L), List.of(), "c")
                .contains("You must offer at least one item"));
        assertTrue(check(List.of(1L, 2L, 3L, 4L, 5L), List.of(3L), List.of(), "c")
                .contains("You can only offer up to 4 items"));
    }

    @Test
    void requests_shouldCountItemsAndTagsTogether() {
        assertTrue(check(List.of(1L), List.of(), List.of(), "c")
                .contains("You must request at least one item or tag"));
        assertTrue(check(List.of(1L), List.of(2L, 3L, 4L), List.of("any", "rap"), "c")
                .contains("You can only request up to 4 items (combined item IDs and tags)"));
    }

    @Test
    void unknownTag_shouldBeReported() {
        assertEquals(List.of("Unknown request tag: cheap"), check(List.of(1L), List.of(), List.of("cheap"), "c"));
    }

    @Test
    void emptyElements_shouldBeReportedInsteadOfFailing() {
        List<String> problems = check(
                Arrays.asList(1L, null, 2L),
                Arrays.asList((Long) null),
                Arrays.asList("any", null),
                "c");

        assertTrue(problems.contains(TradeAdValidator.EMPTY_OFFER_ID));
        assertTrue(problems.contains(TradeAdValidator.EMPTY_REQUEST_ID));
        assertTrue(problems.contains(TradeAdValidator.EMPTY_TAG));
        assertFalse(problems.contains("Unknown request tag: null"));
    }

    @Test
    void credential_shouldOnlyBeRequiredWhenAsked() {
        assertTrue(validator.validate(List.of(1L), List.of(2L), List.of(), null, true)
                .contains("Roli verification cookie is required"));
        assertTrue(validator.validate(List.of(1L), List.of(2L), List.of(), " ", false).isEmpty());
    }

    @Test
    void isValidTag_shouldIgnoreCaseAndSpaces() {
        assertTrue(validator.isValidTag(" Upgrade "));
        assertFalse(validator.isValidTag("nope"));
        assertFalse(validator.isValidTag(null));
    }
}
