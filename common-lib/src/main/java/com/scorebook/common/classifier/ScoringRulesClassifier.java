package com.scorebook.common.classifier;

import java.util.Locale;
import java.util.Set;

/**
 * Pure stateless classifier for at-bat result codes.
 *
 * <p>Every consumer that needs to know what a result code means (the game-state reducer,
 * stat aggregation, input validation) goes through this class, so the vocabulary lives in
 * exactly one place.
 *
 * <p>Codes are compared after {@link #normalize(String) normalization}
 * (trimmed, upper-cased). Unrecognized codes are neither outs nor hits: callers get a
 * safe zero-out result rather than an error.
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class ScoringRulesClassifier {

    /** Results that retire exactly one batter. */
    private static final Set<String> SINGLE_OUTS = Set.of(
        "K",                          // strikeout
        "OUT",
        "FO", "GO", "PO", "LO",       // fly / ground / pop / line out
        "F7", "F8", "F9",
        "L7", "L8", "L9",
        "P3", "P4", "P5", "P6",
        "G3", "G4", "G5", "G6",
        "SF",                         // sacrifice fly
        "SH", "SAC"                   // sacrifice bunt
    );

    private static final Set<String> HITS = Set.of(
        "1B", "2B", "3B", "HR", "SINGLE", "DOUBLE", "TRIPLE", "HOMERUN", "HOME_RUN");

    private static final Set<String> WALKS = Set.of("BB", "BASE_ON_BALLS", "WALK");

    private static final Set<String> HIT_BY_PITCH = Set.of("HBP", "HIT_BY_PITCH");

    /** Batter reaches without a hit: error or fielder's choice. */
    private static final Set<String> REACHED_ON_FIELDING = Set.of(
        "E", "ERROR", "FC", "FIELDERS_CHOICE");

    private ScoringRulesClassifier() {}

    /**
     * Canonical form of a result code: trimmed and upper-cased.
     * {@code null} normalizes to the empty string.
     */
    public static String normalize(String code) {
        return code == null ? "" : code.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * True when the result retires at least one batter or runner, including any
     * double- or triple-play code.
     */
    public static boolean isOut(String code) {
        String normalized = normalize(code);
        return SINGLE_OUTS.contains(normalized)
            || isDoublePlay(normalized)
            || isTriplePlay(normalized);
    }

    /**
     * Number of outs the result records: 3 for triple plays, 2 for double plays,
     * 1 for any other out, 0 otherwise.
     */
    public static int outCount(String code) {
        String normalized = normalize(code);
        if (isTriplePlay(normalized)) {
            return 3;
        }
        if (isDoublePlay(normalized)) {
            return 2;
        }
        return SINGLE_OUTS.contains(normalized) ? 1 : 0;
    }

    public static boolean isHit(String code) {
        return HITS.contains(normalize(code));
    }

    public static boolean isWalk(String code) {
        return WALKS.contains(normalize(code));
    }

    public static boolean isHitByPitch(String code) {
        return HIT_BY_PITCH.contains(normalize(code));
    }

    /**
     * True when the batter ends the plate appearance on base: hit, walk, hit-by-pitch,
     * error or fielder's choice.
     */
    public static boolean reachesBase(String code) {
        String normalized = normalize(code);
        return HITS.contains(normalized)
            || WALKS.contains(normalized)
            || HIT_BY_PITCH.contains(normalized)
            || REACHED_ON_FIELDING.contains(normalized);
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static boolean isDoublePlay(String normalized) {
        return normalized.startsWith("DP") || normalized.equals("DOUBLE_PLAY");
    }

    private static boolean isTriplePlay(String normalized) {
        return normalized.startsWith("TP") || normalized.equals("TRIPLE_PLAY");
    }
}
