package io.marketminer.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QueueNamesTest {

    @Test
    void defaultPrefixShouldBePrices() {
        assertEquals("prices-shop.example", new QueueNames().forDomain("shop.example"));
    }

    @Test
    void sameDomainShouldAlwaysMapToSameQueue() {
        QueueNames names = new QueueNames("scrape-");
        assertEquals(names.forDomain("a.example"), names.forDomain("a.example"));
        assertEquals("scrape-a.example", names.forDomain("a.example"));
    }

    @Test
    void blankDomainShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new QueueNames().forDomain(" "));
        assertThrows(IllegalArgumentException.class, () -> new QueueNames().forDomain(null));
    }
}
