package com.stakeduel.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.stakeduel.model.EventKind;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class EventResponses {

    private EventResponses() {
    }

    public record Event(
            long eventId,
            String accountId,
            long sequenceNumber,
            EventKind kind,
            UUID referenceId,
            JsonNode payload,
            OffsetDateTime createdAt
    ) {
    }

    /**
     * {@code nextCursor} is the last returned id, or the request cursor for an empty page.
     */
    public record EventPage(
            List<Event> events,
            long nextCursor
    ) {
    }
}
