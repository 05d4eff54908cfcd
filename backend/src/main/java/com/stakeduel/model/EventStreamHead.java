package com.stakeduel.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Singleton row locked by every event append. Holding it until commit keeps event ids
 * in commit order, so a reader paging by id never passes an event that commits later.
 */
@Getter
@Setter
@Entity
@Table(name = "event_stream_head")
public class EventStreamHead {

    public static final int SINGLETON_ID = 1;

    @Id
    @Column(name = "stream_id", nullable = false, updatable = false)
    private Integer streamId = SINGLETON_ID;

    @Column(name = "last_event_id", nullable = false)
    private long lastEventId;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;
}
