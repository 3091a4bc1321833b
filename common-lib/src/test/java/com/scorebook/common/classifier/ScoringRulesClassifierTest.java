package com.scorebook.common.classifier;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScoringRulesClassifierTest {

    @Nested
    @DisplayName("outs")
    class OutTests {

        @Test
        @DisplayName("strikeouts, flyouts, groundouts and sacrifices are single outs")
        void singleOuts() {
            for (String code : List.of("K", "OUT", "FO", "GO", "PO", "LO", "F8", "L7", "P4", "G6", "SF", "SH", "SAC")) {
                assertTrue(ScoringRulesClassifier.isOut(code), code);
                assertEquals(1, ScoringRulesClassifier.outCount(code), code);
            }
        }

        @Test
        @DisplayName("double plays count two outs")
        void doublePlays() {
            assertEquals(2, ScoringRulesClassifier.outCount("DP"));
            assertEquals(2, ScoringRulesClassifier.outCount("DP643"));
            assertEquals(2, ScoringRulesClassifier.outCount("DOUBLE_PLAY"));
            assertTrue(ScoringRulesClassifier.isOut("DP"));
        }

        @Test
        @DisplayName("triple plays count three outs")
        void triplePlays() {
            assertEquals(3, ScoringRulesClassifier.outCount("TP"));
            assertEquals(3, ScoringRulesClassifier.outCount("TRIPLE_PLAY"));
            assertTrue(ScoringRulesClassifier.isOut("TP"));
        }

        @Test
        @DisplayName("hits, walks and errors are not outs")
        void nonOuts() {
            for (String code : List.of("1B", "HR", "BB", "HBP", "E", "FC")) {
                assertFalse(ScoringRulesClassifier.isOut(code), code);
                assertEquals(0, ScoringRulesClassifier.outCount(code), code);
            }
        }
    }

    @Nested
    @DisplayName("reaching base")
    class ReachTests {

        @Test
        void hits() {
            for (String code : List.of("1B", "2B", "3B", "HR", "SINGLE", "DOUBLE", "TRIPLE", "HOMERUN", "HOME_RUN")) {
                assertTrue(ScoringRulesClassifier.isHit(code), code);
                assertTrue(ScoringRulesClassifier.reachesBase(code), code);
            }
        }

        @Test
        void walksAndHitByPitch() {
            assertTrue(ScoringRulesClassifier.isWalk("BB"));
            assertTrue(ScoringRulesClassifier.isWalk("WALK"));
            assertTrue(ScoringRulesClassifier.isHitByPitch("HIT_BY_PITCH"));
            assertTrue(ScoringRulesClassifier.reachesBase("BASE_ON_BALLS"));
            assertTrue(ScoringRulesClassifier.reachesBase("HBP"));
            assertFalse(ScoringRulesClassifier.isHit("BB"));
        }

        @Test
        @DisplayName("errors and fielder's choice reach base without being hits")
        void errorsAndFieldersChoice() {
            for (String code : List.of("E", "ERROR", "FC", "FIELDERS_CHOICE")) {
                assertTrue(ScoringRulesClassifier.reachesBase(code), code);
                assertFalse(ScoringRulesClassifier.isHit(code), code);
            }
        }

        @Test
        void outsDoNotReachBase() {
            assertFalse(ScoringRulesClassifier.reachesBase("K"));
            assertFalse(ScoringRulesClassifier.reachesBase("DP"));
        }
    }

    @Nested
    @DisplayName("normalization")
    class NormalizationTests {

        @Test
        @DisplayName("codes are trimmed and case-insensitive")
        void trimmedAndUppercased() {
            assertEquals("1B", ScoringRulesClassifier.normalize(" 1b "));
            assertTrue(ScoringRulesClassifier.isOut("k"));
            assertTrue(ScoringRulesClassifier.isHit(" hr"));
            assertEquals(2, ScoringRulesClassifier.outCount("dp"));
        }

        @Test
        @DisplayName("null and unknown codes are neither outs nor hits")
        void nullAndUnknown() {
            assertEquals("", ScoringRulesClassifier.normalize(null));
            assertFalse(ScoringRulesClassifier.isOut(null));
            assertEquals(0, ScoringRulesClassifier.outCount(null));
            assertFalse(ScoringRulesClassifier.isOut("XYZ"));
            assertFalse(ScoringRulesClassifier.isHit("XYZ"));
            assertFalse(ScoringRulesClassifier.reachesBase(""));
        }
    }
}
