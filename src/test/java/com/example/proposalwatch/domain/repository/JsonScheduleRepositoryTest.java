package com.example.proposalwatch.domain.repository;

import com.example.proposalwatch.domain.enums.TriggerMode;
import com.example.proposalwatch.domain.model.Schedule;
import com.example.proposalwatch.exception.StoreWriteException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JsonScheduleRepository Tests")
class JsonScheduleRepositoryTest {

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private Path file;
    private JsonScheduleRepository repository;

    @BeforeEach
    void setUp() {
        objectMapper = JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
        file = tempDir.resolve("store").resolve("schedules.json");
        repository = new JsonScheduleRepository(objectMapper, file);
    }

    private static Schedule schedule(String id, int minutes) {
        return Schedule.builder()
                .id(id)
                .name("Every " + minutes + " minutes")
                .mode(TriggerMode.INTERVAL)
                .intervalMinutes(minutes)
                .createdAt(Instant.parse("2024-03-01T00:00:00Z"))
                .build();
    }

    @Nested
    @DisplayName("Persistence Tests")
    class PersistenceTests {

        @Test
        @DisplayName("Should start empty when no file exists")
        void shouldStartEmpty() {
            assertThat(repository.findAll()).isEmpty();
            assertThat(repository.findById("abc")).isEmpty();
        }

        @Test
        @DisplayName("Should write the schedule and leave no temporary file behind")
        void shouldSaveSchedule() {
            // When
            repository.save(schedule("abc", 30));

            // Then
            assertThat(file).exists();
            assertThat(tempDir.resolve("store").resolve("schedules.json.tmp")).doesNotExist();
            assertThat(new JsonScheduleRepository(objectMapper, file).findById("abc"))
                    .hasValueSatisfying(found -> {
                        assertThat(found.getIntervalMinutes()).isEqualTo(30);
                        assertThat(found.getMode()).isEqualTo(TriggerMode.INTERVAL);
                        assertThat(found.getCreatedAt()).isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
                    });
        }

        @Test
        @DisplayName("Should replace a schedule with the same id")
        void shouldUpsertById() {
            repository.save(schedule("abc", 30));
            repository.save(schedule("def", 10));

            repository.save(schedule("abc", 45));

            assertThat(repository.findAll()).extracting(Schedule::getId).containsExactly("abc", "def");
            assertThat(repository.findById("abc")).hasValueSatisfying(
                    found -> assertThat(found.getIntervalMinutes()).isEqualTo(45));
        }

        @Test
        @DisplayName("Should update the last run of a stored schedule only")
        void shouldUpdateLastRun() {
            repository.save(schedule("abc", 30));
            var lastRun = Instant.parse("2024-03-12T09:00:00Z");

            assertThat(repository.updateLastRun("abc", lastRun)).isTrue();
            assertThat(repository.updateLastRun("missing", lastRun)).isFalse();
            assertThat(repository.findById("abc")).hasValueSatisfying(
                    found -> assertThat(found.getLastRun()).isEqualTo(lastRun));
        }

        @Test
        @DisplayName("Should delete by id")
        void shouldDelete() {
            repository.save(schedule("abc", 30));

            assertThat(repository.deleteById("abc")).isTrue();
            assertThat(repository.deleteById("abc")).isFalse();
            assertThat(repository.findAll()).isEmpty();
        }
    }

    @Nested
    @DisplayName("External file Tests")
    class ExternalFileTests {

        @Test
        @DisplayName("Should read hand-written files with legacy and unknown fields")
        void shouldReadLegacyFile() throws IOException {
            // Given
            Files.createDirectories(file.getParent());
            Files.writeString(file, """
                    [
                      {
                        "id": "legacy",
                        "name": "Mornings",
                        "chains": ["ethereum", "tron"],
                        "mode": "CRON",
                        "cron_expression": "0 9 * * 1-5",
                        "weekdays_only": false,
                        "ui_color": "#ff0000"
                      }
                    ]
                    """);

            // When
            var found = repository.findById("legacy");

            // Then
            assertThat(found).hasValueSatisfying(schedule -> {
                assertThat(schedule.getMode()).isEqualTo(TriggerMode.CRON);
                assertThat(schedule.getCron()).isEqualTo("0 9 * * 1-5");
                assertThat(schedule.getChains()).containsExactly("ethereum", "tron");
                assertThat(schedule.isWeekdaysOnlyEffective()).isFalse();
                assertThat(schedule.isEnabled()).isTrue();
            });
        }

        @Test
        @DisplayName("Should serve the last committed view when the file is corrupt")
        void shouldServeCommittedViewOnCorruptFile() throws IOException {
            // Given
            repository.save(schedule("abc", 30));
            Files.writeString(file, "[{\"id\": \"abc\", ");

            // When
            var schedules = repository.findAll();

            // Then
            assertThat(schedules).extracting(Schedule::getId).containsExactly("abc");
        }

        @Test
        @DisplayName("Should refuse to overwrite a file that was never read successfully")
        void shouldKeepUnreadableFileIntact() throws IOException {
            // Given
            Files.createDirectories(file.getParent());
            var truncated = "[{\"id\": \"a\", \"name\": \"A\", \"mode\": \"interval\", \"interval_minutes\": 30},"
                    + " {\"id\": \"b\", \"name\": \"B\", \"mode\": \"inter";
            Files.writeString(file, truncated);

            // When / Then
            assertThatThrownBy(() -> repository.save(schedule("c", 15)))
                    .isInstanceOf(StoreWriteException.class);
            assertThatThrownBy(() -> repository.updateLastRun("a", Instant.now()))
                    .isInstanceOf(StoreWriteException.class);
            assertThatThrownBy(() -> repository.deleteById("a"))
                    .isInstanceOf(StoreWriteException.class);
            assertThat(Files.readString(file)).isEqualTo(truncated);

            // Once repaired, writes go through and keep the stored schedules
            Files.writeString(file, objectMapper.writeValueAsString(List.of(schedule("a", 30), schedule("b", 60))));
            repository.save(schedule("c", 15));
            assertThat(repository.findAll()).extracting(Schedule::getId).containsExactly("a", "b", "c");
        }

        @Test
        @DisplayName("Should report write failures without changing the committed view")
        void shouldFailOnUnwritablePath() throws IOException {
            // Given
            Files.createDirectories(file.resolve("occupied"));

            // When / Then
            assertThatThrownBy(() -> repository.save(schedule("abc", 30)))
                    .isInstanceOf(StoreWriteException.class)
                    .hasMessageContaining("schedules.json");
            assertThat(repository.findAll()).isEmpty();
        }
    }

    @Test
    @DisplayName("Should hand out copies")
    void shouldReturnCopies() {
        repository.save(schedule("abc", 30));

        var copy = repository.findById("abc").orElseThrow();
        copy.setTimes(List.of("09:00"));
        copy.getChains().add("bitcoin");

        assertThat(repository.findById("abc")).hasValueSatisfying(found -> {
            assertThat(found.getTimes()).isEmpty();
            assertThat(found.getChains()).isEmpty();
        });
    }
}
