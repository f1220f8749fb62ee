package com.cardhub.gameservice.games.bigtwo.infrastructure.local;

import com.cardhub.gameservice.games.bigtwo.domain.dto.GameStateRecord;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class LocalGameStateRepositoryTest {

    private final LocalGameStateRepository repo = new LocalGameStateRepository();

    private static GameStateRecord record(long version) {
        GameStateRecord r = new GameStateRecord();
        r.setRoomId("r1");
        r.setVersion(version);
        return r;
    }

    @Test
    void compareAndSetChecksVersion() {
        repo.save("r1", record(3), Duration.ofMinutes(1));

        assertThat(repo.compareAndSet("r1", 2, record(4), Duration.ofMinutes(1))).isFalse();
        assertThat(repo.get("r1").orElseThrow().getVersion()).isEqualTo(3);

        assertThat(repo.compareAndSet("r1", 3, record(4), Duration.ofMinutes(1))).isTrue();
        assertThat(repo.get("r1").orElseThrow().getVersion()).isEqualTo(4);
    }

    @Test
    void missingRoomCannotBeSwapped() {
        assertThat(repo.compareAndSet("r9", 0, record(1), Duration.ofMinutes(1))).isFalse();
        assertThat(repo.get("r9")).isEmpty();
    }

    @Test
    void deleteRemoves() {
        repo.save("r1", record(1), Duration.ofMinutes(1));
        repo.delete("r1");

        assertThat(repo.get("r1")).isEmpty();
    }
}
