package com.scorebook.common.state;

import com.scorebook.common.classifier.ScoringRulesClassifier;
import com.scorebook.common.exception.ValidationException;
import com.scorebook.common.model.AtBatEvent;
import com.scorebook.common.model.LineupSlot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Replays an at-bat log into the current {@link InGameState}.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Validate and sort the lineup by batting order.</li>
 *   <li>Validate and sort events by {@link AtBatOrdering#CHRONOLOGICAL}.</li>
 *   <li>Start at inning 1, 0 outs, batter 0.</li>
 *   <li>For each event add {@link ScoringRulesClassifier#outCount(String)} to the outs,
 *       rolling every 3 outs into the next inning, then advance the batter. The batter
 *       advances on every at-bat regardless of its outcome.</li>
 * </ol>
 *
 * <p>Identical {@code (events, lineup)} input always yields an identical result, so state
 * can be rebuilt after a crash, on another device, or for audit without any stored
 * "current state" record. Neither input collection is modified.
 *
 * <p>No Spring dependencies. No I/O. Pure function.
 */
public final class GameStateReducer {

    private static final int OUTS_PER_INNING = 3;

    private GameStateReducer() { /* utility class */ }

    /**
     * Derives the game state from the given events and lineup.
     *
     * @param events at-bat log in any order; {@code null} is treated as empty
     * @param lineup batting-order slots for the game
     * @return the derived state; never null
     * @throws ValidationException if the lineup is empty or invalid, or an event is malformed
     */
    public static InGameState compute(Collection<AtBatEvent> events, Collection<LineupSlot> lineup) {
        List<LineupSlot> battingOrder = sortedLineup(lineup);
        List<AtBatEvent> replay = sortedEvents(events);

        int inning = 1;
        int outs = 0;
        int batterIndex = 0;

        for (AtBatEvent event : replay) {
            outs += ScoringRulesClassifier.outCount(event.result());
            while (outs >= OUTS_PER_INNING) {
                inning++;
                outs -= OUTS_PER_INNING;
            }
            batterIndex = (batterIndex + 1) % battingOrder.size();
        }

        return new InGameState(inning, outs, batterIndex, battingOrder.get(batterIndex).playerId());
    }

    // ── validation ─────────────────────────────────────────────────────────

    static List<LineupSlot> sortedLineup(Collection<LineupSlot> lineup) {
        if (lineup == null || lineup.isEmpty()) {
            throw new ValidationException("lineup", "Lineup cannot be empty");
        }
        Set<Integer> seenOrders = new HashSet<>();
        for (LineupSlot slot : lineup) {
            if (slot == null || slot.playerId() == null || slot.playerId().isBlank()) {
                throw new ValidationException("lineup", "Lineup slot is missing a playerId");
            }
            if (slot.battingOrder() < 1) {
                throw new ValidationException("lineup",
                    "Batting order must be positive, got " + slot.battingOrder() + " for " + slot.playerId());
            }
            if (!seenOrders.add(slot.battingOrder())) {
                throw new ValidationException("lineup", "Duplicate batting order " + slot.battingOrder());
            }
        }
        List<LineupSlot> sorted = new ArrayList<>(lineup);
        sorted.sort(Comparator.comparingInt(LineupSlot::battingOrder));
        return sorted;
    }

    static List<AtBatEvent> sortedEvents(Collection<AtBatEvent> events) {
        if (events == null || events.isEmpty()) {
            return List.of();
        }
        for (AtBatEvent event : events) {
            if (event == null) {
                throw new ValidationException("atBat", "At-bat log contains a null event");
            }
            if (event.createdAt() == null) {
                throw new ValidationException("atBat", "At-bat " + event.atBatId() + " has no createdAt");
            }
            if (event.result() == null || event.result().isBlank()) {
                throw new ValidationException("atBat", "At-bat " + event.atBatId() + " has no result");
            }
        }
        List<AtBatEvent> sorted = new ArrayList<>(events);
        sorted.sort(AtBatOrdering.CHRONOLOGICAL);
        return sorted;
    }
}
