package com.roadmonitor.db;

import com.roadmonitor.model.AccelerometerSample;
import com.roadmonitor.model.AgentRecord;
import com.roadmonitor.model.GpsSample;
import com.roadmonitor.model.ProcessedRecord;
import com.roadmonitor.model.RoadState;
import com.roadmonitor.model.StoredRecord;
import com.roadmonitor.model.TestRecords;
import org.junit.jupiter.api.*;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
class JdbcRecordStoreIntegrationTest {

  @Container
  private static final PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>("postgres:15")
          .withDatabaseName("road_db")
          .withUsername("road_user")
          .withPassword("road_pass");

  private final JdbcRecordStore store = new JdbcRecordStore();

  @BeforeAll
  static void setUp() {
    // Настройка БД через системные свойства
    System.setProperty("db.url", postgres.getJdbcUrl());
    System.setProperty("db.user", postgres.getUsername());
    System.setProperty("db.password", postgres.getPassword());
    DatabaseConnection.initializeDatabase();
    // Повторная инициализация не должна падать
    DatabaseConnection.initializeDatabase();
  }

  @AfterAll
  static void tearDown() {
    System.clearProperty("db.url");
    System.clearProperty("db.user");
    System.clearProperty("db.password");
  }

  @Test
  @DisplayName("Вставка возвращает новый id, запись читается в плоском виде")
  void shouldInsertAndRead() throws Exception {
    OffsetDateTime kyivTime = OffsetDateTime.of(2024, 1, 1, 2, 0, 0, 0, ZoneOffset.ofHours(2));
    ProcessedRecord record = new ProcessedRecord(RoadState.SMALL_PITS,
        new AgentRecord(11, new AccelerometerSample(1.5, -2.5, 13000), new GpsSample(50.45, 30.52), kyivTime));

    StoredRecord first = store.insert(record);
    StoredRecord second = store.insert(TestRecords.processed(11, 15000));
    assertThat(second.getId()).isGreaterThan(first.getId());

    StoredRecord read = store.findById(first.getId()).orElseThrow();
    assertThat(read.getRoadState()).isEqualTo(RoadState.SMALL_PITS);
    assertThat(read.getUserId()).isEqualTo(11);
    assertThat(read.getY()).isEqualTo(-2.5);
    assertThat(read.getLatitude()).isEqualTo(50.45);
    assertThat(read.getTimestamp().toInstant()).isEqualTo(kyivTime.toInstant());

    // Данные действительно в таблице
    try (Connection conn = DatabaseConnection.getConnection();
         Statement stmt = conn.createStatement()) {
      ResultSet rs = stmt.executeQuery("SELECT road_state FROM processed_agent_data WHERE id = " + first.getId());
      assertThat(rs.next()).isTrue();
      assertThat(rs.getString("road_state")).isEqualTo("small_pits");
    }
  }

  @Test
  @DisplayName("Обновление и удаление возвращают запись, отсутствующий id → пусто")
  void shouldUpdateAndDelete() {
    long id = store.insert(TestRecords.processed(12, 15000)).getId();

    Optional<StoredRecord> updated = store.update(id, TestRecords.processed(12, 16500));
    assertThat(updated).isPresent();
    assertThat(updated.get().getZ()).isEqualTo(16500);
    assertThat(store.findById(id).orElseThrow().getZ()).isEqualTo(16500);

    Optional<StoredRecord> deleted = store.delete(id);
    assertThat(deleted).isPresent();
    assertThat(deleted.get().getId()).isEqualTo(id);

    assertThat(store.findById(id)).isEmpty();
    assertThat(store.update(id, TestRecords.processed(12, 15000))).isEmpty();
    assertThat(store.delete(id)).isEmpty();
  }

  @Test
  @DisplayName("Список упорядочен по id")
  void shouldListInIdOrder() {
    long a = store.insert(TestRecords.processed(13, 15000)).getId();
    long b = store.insert(TestRecords.processed(13, 15100)).getId();

    assertThat(store.findAll())
        .extracting(StoredRecord::getId)
        .contains(a, b)
        .isSorted();
  }
}
