package com.scorebook.common.state;

import com.scorebook.common.exception.ValidationException;
import com.scorebook.common.model.AtBatEvent;
import com.scorebook.common.model.LineupSlot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Replay behaviour of {@link GameStateReducer}: scoring scenarios, ordering of the log,
 * input validation and determinism.
 */
class GameStateReducerTest {

    private static final Instant T0 = Instant.parse("2026-05-01T18:00:00Z");

    private static final List<LineupSlot> LINEUP = List.of(
        LineupSlot.of("p1", 1), LineupSlot.of("p2", 2), LineupSlot.of("p3", 3));

    private static AtBatEvent event(String id, String result, int secondsAfterStart) {
        return event(id, result, T0.plusSeconds(secondsAfterStart), null);
    }

    private static AtBatEvent event(String id, String result, Instant createdAt, Long sequence) {
        return new AtBatEvent(id, "g1", "t1", "p?", result, 1, 0, null, null, null, null,
                              createdAt, createdAt, sequence);
    }

    private static List<AtBatEvent> log(String... results) {
        List<AtBatEvent> events = new ArrayList<>();
        for (int i = 0; i < results.length; i++) {
            events.add(event("ab" + i, results[i], i));
        }
        return events;
    }

    // ── scenarios ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("scoring scenarios")
    class ScenarioTests {

        @Test
        @DisplayName("empty log starts at inning 1, no outs, leadoff batter")
        void emptyLog() {
            InGameState state = GameStateReducer.compute(List.of(), LINEUP);
            assertEquals(1, state.inning());
            assertEquals(0, state.outs());
            assertEquals(0, state.batterIndex());
            assertEquals("p1", state.batterPlayerId());
        }

        @Test
        @DisplayName("null log is treated as empty")
        void nullLog() {
            assertEquals(GameStateReducer.compute(List.of(), LINEUP), GameStateReducer.compute(null, LINEUP));
        }

        @Test
        @DisplayName("[K, 1B, GO] with three batters: 2 outs, back to the leadoff batter")
        void strikeoutSingleGroundout() {
            InGameState state = GameStateReducer.compute(log("K", "1B", "GO"), LINEUP);
            assertEquals(1, state.inning());
            assertEquals(2, state.outs());
            assertEquals(0, state.batterIndex());
            assertEquals("p1", state.batterPlayerId());
        }

        @Test
        @DisplayName("[DP] records two outs and advances one batter")
        void doublePlay() {
            InGameState state = GameStateReducer.compute(log("DP"), LINEUP);
            assertEquals(1, state.inning());
            assertEquals(2, state.outs());
            assertEquals(1, state.batterIndex());
            assertEquals("p2", state.batterPlayerId());
        }

        @Test
        @DisplayName("[TP] ends the inning immediately")
        void triplePlay() {
            InGameState state = GameStateReducer.compute(log("TP"), LINEUP);
            assertEquals(2, state.inning());
            assertEquals(0, state.outs());
            assertEquals(1, state.batterIndex());
        }

        @Test
        @DisplayName("a double play with two outs carries one out into the next inning")
        void doublePlayAcrossInningBoundary() {
            InGameState state = GameStateReducer.compute(log("K", "K", "DP"), LINEUP);
            assertEquals(2, state.inning());
            assertEquals(1, state.outs());
        }

        @Test
        @DisplayName("hits, walks and errors do not change outs")
        void nonOutsKeepOuts() {
            InGameState state = GameStateReducer.compute(log("1B", "BB", "HBP", "E", "HR"), LINEUP);
            assertEquals(1, state.inning());
            assertEquals(0, state.outs());
            assertEquals(5 % LINEUP.size(), state.batterIndex());
        }

        @Test
        @DisplayName("unknown result codes advance the batter only")
        void unknownCodes() {
            InGameState state = GameStateReducer.compute(log("??", "WILD"), LINEUP);
            assertEquals(0, state.outs());
            assertEquals(2, state.batterIndex());
        }

        @Test
        @DisplayName("nine strikeouts reach the fourth inning")
        void threeFullInnings() {
            InGameState state = GameStateReducer.compute(
                log("K", "K", "K", "K", "K", "K", "K", "K", "K"), LINEUP);
            assertEquals(4, state.inning());
            assertEquals(0, state.outs());
            assertEquals(0, state.batterIndex());
        }
    }

    // ── invariants ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("invariants")
    class InvariantTests {

        @Test
        @DisplayName("outs stay in [0, 2] and batterIndex equals N mod lineup size for any log")
        void boundsHoldForRandomLogs() {
            String[] codes = {"K", "1B", "GO", "DP", "TP", "BB", "E", "HR", "FO", "SF"};
            Random random = new Random(42);
            for (int run = 0; run < 200; run++) {
                int n = random.nextInt(40);
                String[] results = new String[n];
                for (int i = 0; i < n; i++) {
                    results[i] = codes[random.nextInt(codes.length)];
                }
                InGameState state = GameStateReducer.compute(log(results), LINEUP);
                assertTrue(state.outs() >= 0 && state.outs() <= 2, "outs=" + state.outs());
                assertTrue(state.inning() >= 1);
                assertEquals(n % LINEUP.size(), state.batterIndex());
                assertEquals(LINEUP.get(state.batterIndex()).playerId(), state.batterPlayerId());
            }
        }

        @Test
        @DisplayName("same input always yields the same output")
        void deterministic() {
            List<AtBatEvent> events = log("K", "1B", "DP", "BB", "GO");
            InGameState first = GameStateReducer.compute(events, LINEUP);
            for (int i = 0; i < 50; i++) {
                assertEquals(first, GameStateReducer.compute(events, LINEUP));
            }
        }

        @Test
        @DisplayName("inputs are not modified")
        void inputsUntouched() {
            List<AtBatEvent> events = new ArrayList<>(log("K", "1B", "GO"));
            Collections.reverse(events);
            List<AtBatEvent> eventsBefore = List.copyOf(events);
            List<LineupSlot> lineup = new ArrayList<>(List.of(
                LineupSlot.of("p3", 3), LineupSlot.of("p1", 1), LineupSlot.of("p2", 2)));
            List<LineupSlot> lineupBefore = List.copyOf(lineup);

            GameStateReducer.compute(events, lineup);

            assertEquals(eventsBefore, events);
            assertEquals(lineupBefore, lineup);
        }

        @Test
        @DisplayName("lineup is applied in batting order, not list order")
        void lineupSortedByBattingOrder() {
            List<LineupSlot> shuffled = List.of(
                LineupSlot.of("p3", 3), LineupSlot.of("p1", 1), LineupSlot.of("p2", 2));
            InGameState state = GameStateReducer.compute(log("K"), shuffled);
            assertEquals("p2", state.batterPlayerId());
        }
    }

    // ── ordering ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("event ordering")
    class OrderingTests {

        @Test
        @DisplayName("log order does not matter, createdAt does")
        void shuffledLogSameResult() {
            List<AtBatEvent> events = log("K", "1B", "TP", "GO", "BB", "DP");
            InGameState expected = GameStateReducer.compute(events, LINEUP);

            List<AtBatEvent> shuffled = new ArrayList<>(events);
            Collections.shuffle(shuffled, new Random(7));
            assertEquals(expected, GameStateReducer.compute(shuffled, LINEUP));
        }

        @Test
        @DisplayName("createdAt ties are broken by sequence, then atBatId")
        void tieBreak() {
            AtBatEvent withSeq2 = event("a", "K", T0, 2L);
            AtBatEvent withSeq1 = event("b", "1B", T0, 1L);
            AtBatEvent noSeqZ   = event("z", "GO", T0, null);
            AtBatEvent noSeqY   = event("y", "BB", T0, null);

            List<AtBatEvent> sorted = new ArrayList<>(Arrays.asList(noSeqZ, withSeq2, noSeqY, withSeq1));
            sorted.sort(AtBatOrdering.CHRONOLOGICAL);

            assertEquals(List.of(withSeq1, withSeq2, noSeqY, noSeqZ), sorted);
        }

        @Test
        @DisplayName("a triple play tied with a strikeout yields the same state in any input order")
        void tiedEventsDeterministic() {
            AtBatEvent tp = event("ab-1", "TP", T0, null);
            AtBatEvent k  = event("ab-2", "K", T0, null);
            assertEquals(GameStateReducer.compute(List.of(tp, k), LINEUP),
                         GameStateReducer.compute(List.of(k, tp), LINEUP));
        }
    }

    // ── validation ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("validation")
    class ValidationTests {

        @Test
        @DisplayName("empty lineup is rejected")
        void emptyLineup() {
            ValidationException e = assertThrows(ValidationException.class,
                () -> GameStateReducer.compute(log("K"), List.of()));
            assertEquals("lineup", e.getField());
        }

        @Test
        @DisplayName("null lineup is rejected")
        void nullLineup() {
            assertThrows(ValidationException.class, () -> GameStateReducer.compute(List.of(), null));
        }

        @Test
        void duplicateBattingOrder() {
            assertThrows(ValidationException.class, () -> GameStateReducer.compute(List.of(),
                List.of(LineupSlot.of("p1", 1), LineupSlot.of("p2", 1))));
        }

        @Test
        void nonPositiveBattingOrder() {
            assertThrows(ValidationException.class, () -> GameStateReducer.compute(List.of(),
                List.of(LineupSlot.of("p1", 0))));
        }

        @Test
        void blankPlayerId() {
            assertThrows(ValidationException.class, () -> GameStateReducer.compute(List.of(),
                List.of(LineupSlot.of(" ", 1))));
        }

        @Test
        @DisplayName("event without createdAt is malformed")
        void missingCreatedAt() {
            AtBatEvent malformed = event("ab", "K", null, null);
            ValidationException e = assertThrows(ValidationException.class,
                () -> GameStateReducer.compute(List.of(malformed), LINEUP));
            assertEquals("atBat", e.getField());
        }

        @Test
        @DisplayName("event without result is malformed")
        void missingResult() {
            assertThrows(ValidationException.class,
                () -> GameStateReducer.compute(List.of(event("ab", "", 0)), LINEUP));
        }

        @Test
        @DisplayName("null event in the log is malformed")
        void nullEvent() {
            List<AtBatEvent> events = new ArrayList<>();
            events.add(null);
            assertThrows(ValidationException.class, () -> GameStateReducer.compute(events, LINEUP));
        }
    }
}
