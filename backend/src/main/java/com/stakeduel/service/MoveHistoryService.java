package com.stakeduel.service;

import com.stakeduel.model.DuelAction;
import com.stakeduel.model.MoveHistory;
import com.stakeduel.repository.MoveHistoryRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Sliding window of each account's recent round inputs, oldest first.
 */
@Service
public class MoveHistoryService {

    private final MoveHistoryRepository moveHistoryRepository;
    private final Clock clock;

    public MoveHistoryService(MoveHistoryRepository moveHistoryRepository, Clock clock) {
        this.moveHistoryRepository = moveHistoryRepository;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public List<DuelAction> getHistory(String accountId) {
        return moveHistoryRepository.findById(accountId)
                .map(history -> decode(history.getMoves()))
                .orElseGet(List::of);
    }

    /**
     * Appends one input and evicts the oldest ones beyond {@code windowSize}.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<DuelAction> append(String accountId, DuelAction action, int windowSize) {
        int window = Math.max(1, Math.min(windowSize, MoveHistory.MAX_WINDOW));
        MoveHistory history = moveHistoryRepository.findById(accountId).orElseGet(() -> {
            MoveHistory created = new MoveHistory();
            created.setAccountId(accountId);
            return created;
        });

        String moves = history.getMoves() + action.getCode();
        if (moves.length() > window) {
            moves = moves.substring(moves.length() - window);
        }
        history.setMoves(moves);
        history.setUpdatedAt(OffsetDateTime.now(clock));
        moveHistoryRepository.save(history);
        return decode(moves);
    }

    static List<DuelAction> decode(String moves) {
        List<DuelAction> actions = new ArrayList<>(moves.length());
        for (int i = 0; i < moves.length(); i++) {
            actions.add(DuelAction.fromCode(moves.charAt(i)));
        }
        return List.copyOf(actions);
    }
}
