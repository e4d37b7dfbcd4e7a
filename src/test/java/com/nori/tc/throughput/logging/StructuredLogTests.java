package com.nori.tc.throughput.logging;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class StructuredLogTests {

    @Test
    void renders_event_then_pairs() {
        assertEquals("event=attach_completed ueId=ue1 attachedCount=2",
                StructuredLog.event("attach_completed", "ueId", "ue1", "attachedCount", 2));
    }

    @Test
    void doubles_are_trimmed_to_four_places() {
        assertEquals("event=x shortfall=0.2 ratio=0.3333 whole=3",
                StructuredLog.event("x", "shortfall", 0.2, "ratio", 1.0 / 3, "whole", 3.0));
    }

    @Test
    void durations_and_collections() {
        assertEquals("event=x limit=21000ms ids=ue1,ue2",
                StructuredLog.event("x", "limit", Duration.ofSeconds(21), "ids", List.of("ue1", "ue2")));
    }

    @Test
    void values_with_spaces_or_quotes_are_quoted() {
        assertEquals("event=x detail=\"connection refused\" q=\"a\\\"b\" eq=\"k=v\"",
                StructuredLog.event("x", "detail", "connection refused", "q", "a\"b", "eq", "k=v"));
    }

    @Test
    void odd_trailing_key_and_null_values() {
        assertEquals("event=x a=null", StructuredLog.event("x", "a", null, "dangling"));
        assertEquals("", StructuredLog.kv());
    }
}
