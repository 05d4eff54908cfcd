package com.stakeduel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stakeduel.model.EventKind;
import com.stakeduel.model.EventLogEntry;
import com.stakeduel.model.EventStreamHead;
import com.stakeduel.model.LedgerAccount;
import com.stakeduel.repository.EventLogEntryRepository;
import com.stakeduel.repository.EventStreamHeadRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Append-only settlement event stream. Entries are written as the final step of the
 * transaction that produced them, so a visible event always has committed state behind it.
 * Appends take the {@link EventStreamHead} lock and keep it until commit, which makes
 * {@code eventId} order match commit order for readers of {@link #listEvents(long, int)}.
 */
@Service
public class EventLogService {

    static final int MAX_PAGE_SIZE = 500;

    private static final Logger log = LoggerFactory.getLogger(EventLogService.class);

    private final EventLogEntryRepository eventLogEntryRepository;
    private final EventStreamHeadRepository eventStreamHeadRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public EventLogService(
            EventLogEntryRepository eventLogEntryRepository,
            EventStreamHeadRepository eventStreamHeadRepository,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.eventLogEntryRepository = eventLogEntryRepository;
        this.eventStreamHeadRepository = eventStreamHeadRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Appends an event for a locked account and advances its event sequence. Must be the last
     * write of the caller's transaction, since the stream head stays locked until commit.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public EventLogEntry append(LedgerAccount account, EventKind kind, UUID referenceId, Object payload) {
        EventStreamHead head = eventStreamHeadRepository.findByStreamIdForUpdate(EventStreamHead.SINGLETON_ID)
                .orElseThrow(() -> new IllegalStateException("Event stream head row is missing"));
        OffsetDateTime now = OffsetDateTime.now(clock);

        long sequenceNumber = account.getEventSequence() + 1;
        account.setEventSequence(sequenceNumber);

        EventLogEntry entry = new EventLogEntry();
        entry.setAccountId(account.getAccountId());
        entry.setSequenceNumber(sequenceNumber);
        entry.setKind(kind);
        entry.setReferenceId(referenceId);
        entry.setPayload(encode(payload));
        entry.setCreatedAt(now);

        EventLogEntry saved = eventLogEntryRepository.save(entry);
        head.setLastEventId(saved.getEventId());
        head.setUpdatedAt(now);
        log.debug("event_appended accountId={} sequence={} kind={} referenceId={}",
                account.getAccountId(), sequenceNumber, kind, referenceId);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<EventLogEntry> listEvents(long afterEventId, int limit) {
        return eventLogEntryRepository.findByEventIdGreaterThanOrderByEventIdAsc(
                afterEventId,
                PageRequest.of(0, clampLimit(limit))
        );
    }

    @Transactional(readOnly = true)
    public List<EventLogEntry> listAccountEvents(String accountId, long afterSequenceNumber, int limit) {
        return eventLogEntryRepository.findByAccountIdAndSequenceNumberGreaterThanOrderBySequenceNumberAsc(
                accountId,
                afterSequenceNumber,
                PageRequest.of(0, clampLimit(limit))
        );
    }

    private String encode(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize event payload " + payload.getClass().getSimpleName(), ex);
        }
    }

    private static int clampLimit(int limit) {
        return Math.max(1, Math.min(limit, MAX_PAGE_SIZE));
    }
}
