package com.stakeduel.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Resolved round. Written once and never updated.
 */
@Getter
@Setter
@Entity
@Table(name = "duel_matches")
public class DuelMatch {

    @Id
    @Column(name = "match_id", nullable = false, updatable = false)
    private UUID matchId;

    @Column(name = "account_id", nullable = false, updatable = false, length = 128)
    private String accountId;

    @Column(name = "sequence_number", nullable = false, updatable = false)
    private long sequenceNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "player_action", nullable = false, updatable = false, length = 16)
    private DuelAction playerAction;

    @Enumerated(EnumType.STRING)
    @Column(name = "opponent_action", nullable = false, updatable = false, length = 16)
    private DuelAction opponentAction;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, updatable = false, length = 8)
    private DuelOutcome outcome;

    @Enumerated(EnumType.STRING)
    @Column(name = "difficulty", nullable = false, updatable = false, length = 16)
    private OpponentDifficulty difficulty;

    @Column(name = "stake", nullable = false, updatable = false)
    private long stake;

    @Column(name = "payout", nullable = false, updatable = false)
    private long payout;

    @Column(name = "balance_after", nullable = false, updatable = false)
    private long balanceAfter;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
