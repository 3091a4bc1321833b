package com.scorebook.common.state;

import com.scorebook.common.model.AtBatEvent;

import java.util.Comparator;

/**
 * Replay order of at-bat events.
 *
 * <p>Primary key is {@code createdAt}. Clock-resolution collisions are broken by the
 * client-assigned {@code sequence} (events without one sort after events with one), and
 * finally by {@code atBatId}, so two different logs never compare as equal unless they
 * hold the same events.
 */
public final class AtBatOrdering {

    public static final Comparator<AtBatEvent> CHRONOLOGICAL =
        Comparator.comparing(AtBatEvent::createdAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(AtBatEvent::sequence, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(AtBatEvent::atBatId, Comparator.nullsLast(Comparator.naturalOrder()));

    private AtBatOrdering() {}
}
