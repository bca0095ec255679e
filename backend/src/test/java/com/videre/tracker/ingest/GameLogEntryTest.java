package com.videre.tracker.ingest;

import com.videre.tracker.model.GameLogType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GameLogEntryTest {

    private static final Instant T0 = Instant.parse("2025-03-01T18:00:00Z");

    @Test
    void identicalContentDerivesTheSameId() {
        GameLogEntry a = new GameLogEntry(42, T0, GameLogType.ZONE_CHANGE, "Island moved to Battlefield");
        GameLogEntry b = new GameLogEntry(42, T0, GameLogType.ZONE_CHANGE, "Island moved to Battlefield");
        assertThat(a.derivedId()).isEqualTo(b.derivedId());
        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
    }

    @Test
    void derivedIdStaysInsideTheGameBucket() {
        long gameId = 987654;
        for (int i = 0; i < 200; i++) {
            long id = new GameLogEntry(gameId, T0.plusMillis(i), GameLogType.LOG_MESSAGE, "msg " + i).derivedId();
            assertThat(id).isBetween(gameId * GameLogEntry.ID_RANGE, gameId * GameLogEntry.ID_RANGE + GameLogEntry.ID_RANGE - 1);
        }
    }

    @Test
    void anyFieldChangeUsuallyChangesTheId() {
        GameLogEntry base = new GameLogEntry(7, T0, GameLogType.LIFE_CHANGE, "20 -> 17");
        assertThat(new GameLogEntry(7, T0.plusMillis(1), GameLogType.LIFE_CHANGE, "20 -> 17").derivedId()).isNotEqualTo(base.derivedId());
        assertThat(new GameLogEntry(7, T0, GameLogType.LOG_MESSAGE, "20 -> 17").derivedId()).isNotEqualTo(base.derivedId());
        assertThat(new GameLogEntry(7, T0, GameLogType.LIFE_CHANGE, "20 -> 16").derivedId()).isNotEqualTo(base.derivedId());
    }

    @Test
    void nullDataIsTreatedAsEmpty() {
        GameLogEntry a = new GameLogEntry(3, T0, GameLogType.TURN_CHANGE, null);
        GameLogEntry b = new GameLogEntry(3, T0, GameLogType.TURN_CHANGE, "");
        assertThat(a.getData()).isEmpty();
        assertThat(a.derivedId()).isEqualTo(b.derivedId());
    }

    @Test
    void ordersByTimestampThenGameId() {
        GameLogEntry late = new GameLogEntry(1, T0.plusSeconds(5), GameLogType.PHASE_CHANGE, "combat");
        GameLogEntry earlyHigh = new GameLogEntry(9, T0, GameLogType.PHASE_CHANGE, "main");
        GameLogEntry earlyLow = new GameLogEntry(2, T0, GameLogType.PHASE_CHANGE, "main");

        List<GameLogEntry> entries = new ArrayList<>(List.of(late, earlyHigh, earlyLow));
        Collections.sort(entries);

        assertThat(entries).containsExactly(earlyLow, earlyHigh, late);
    }

    @Test
    void rejectsGameIdsThatWouldOverflowTheBucket() {
        assertThatThrownBy(() -> new GameLogEntry(-1, T0, GameLogType.GAME_ACTION, "x"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GameLogEntry(Long.MAX_VALUE / GameLogEntry.ID_RANGE, T0, GameLogType.GAME_ACTION, "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
