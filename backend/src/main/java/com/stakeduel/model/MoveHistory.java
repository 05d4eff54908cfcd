package com.stakeduel.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Recent player inputs, oldest first, one action code per character.
 */
@Getter
@Setter
@Entity
@Table(name = "move_histories")
public class MoveHistory {

    public static final int MAX_WINDOW = 64;

    @Id
    @Column(name = "account_id", nullable = false, updatable = false, length = 128)
    private String accountId;

    @Column(name = "moves", nullable = false, length = MAX_WINDOW)
    private String moves = "";

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
