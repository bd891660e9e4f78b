package io.rowstream.stream.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.rowstream.stream.api.EventType;
import io.rowstream.stream.api.StreamEvent;
import io.rowstream.stream.error.CursorRegressionException;
import io.rowstream.stream.error.MetadataDisabledException;
import io.rowstream.stream.error.WriteRejectedException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class MySqlEventLogIntegrationTest {

  @Container
  static final MySQLContainer<?> MYSQL = new MySQLContainer<>("mysql:8.0")
      .withDatabaseName("rowstream")
      .withUsername("rowstream")
      .withPassword("rowstream")
      .withUrlParam("connectionTimeZone", "UTC")
      .withUrlParam("forceConnectionTimeZoneToSession", "true");

  private static JdbcTemplate jdbc;
  private static JdbcTemplate readOnlyJdbc;

  private final MySqlErrorClassifier classifier = new MySqlErrorClassifier();

  @BeforeAll
  static void setup() {
    jdbc = new JdbcTemplate(new DriverManagerDataSource(MYSQL.getJdbcUrl(), MYSQL.getUsername(), MYSQL.getPassword()));
    jdbc.execute("""
        CREATE TABLE events (
          id BIGINT NOT NULL AUTO_INCREMENT PRIMARY KEY,
          foreign_id VARCHAR(255) NOT NULL,
          timestamp DATETIME(6) NOT NULL,
          type INT NOT NULL,
          metadata BLOB
        )
        """);
    jdbc.execute("""
        CREATE TABLE bare_events (
          id BIGINT NOT NULL AUTO_INCREMENT PRIMARY KEY,
          foreign_id VARCHAR(255) NOT NULL,
          timestamp DATETIME(6) NOT NULL,
          type INT NOT NULL
        )
        """);
    jdbc.execute("""
        CREATE TABLE cursors (
          id VARCHAR(255) NOT NULL PRIMARY KEY,
          last_event_id BIGINT NOT NULL,
          updated_at DATETIME(6) NOT NULL
        )
        """);

    JdbcTemplate root = new JdbcTemplate(new DriverManagerDataSource(MYSQL.getJdbcUrl(), "root", MYSQL.getPassword()));
    root.execute("CREATE USER 'reader'@'%' IDENTIFIED BY 'reader'");
    root.execute("GRANT SELECT ON rowstream.* TO 'reader'@'%'");
    readOnlyJdbc = new JdbcTemplate(new DriverManagerDataSource(MYSQL.getJdbcUrl(), "reader", "reader"));
  }

  @BeforeEach
  void clean() {
    jdbc.execute("DELETE FROM events");
    jdbc.execute("DELETE FROM cursors");
  }

  @Test
  void readsEventsAfterCursorInIdOrder() {
    JdbcEventLog log = metadataLog();
    log.insert("order-1", EventType.of(1));
    log.insert("order-2", EventType.of(2), new byte[] {42});
    log.insert("order-3", EventType.of(1));

    List<StreamEvent> all = log.nextBatch(0, Duration.ZERO);

    assertThat(all).extracting(StreamEvent::foreignId).containsExactly("order-1", "order-2", "order-3");
    assertThat(all).extracting(StreamEvent::idAsLong).isSorted().doesNotHaveDuplicates();
    assertThat(all.get(0).metadata()).isNull();
    assertThat(all.get(1).metadata()).containsExactly(42);
    assertThat(log.latestId()).isEqualTo(all.get(2).idAsLong());

    assertThat(log.nextBatch(all.get(0).idAsLong(), Duration.ZERO))
        .extracting(StreamEvent::foreignId)
        .containsExactly("order-2", "order-3");
    assertThat(log.nextBatch(log.latestId(), Duration.ZERO)).isEmpty();
  }

  @Test
  void lagHidesRecentEvents() {
    JdbcEventLog log = metadataLog();
    log.insert("order-1", EventType.of(1));

    assertThat(log.nextBatch(0, Duration.ofHours(1))).isEmpty();
    assertThat(log.nextBatch(0, Duration.ZERO)).hasSize(1);
  }

  @Test
  void batchesAreCappedAndDrainInOrder() {
    List<Object[]> rows = new ArrayList<>();
    for (int i = 1; i <= 1500; i++) {
      rows.add(new Object[] {"order-" + i, 1});
    }
    jdbc.batchUpdate("INSERT INTO events (foreign_id, timestamp, type) VALUES (?, NOW(6), ?)", rows);
    JdbcEventLog log = metadataLog();

    List<StreamEvent> first = log.nextBatch(0, Duration.ZERO);
    assertThat(first).hasSize(JdbcEventLog.BATCH_SIZE);
    assertThat(first).extracting(StreamEvent::idAsLong).isSorted();

    List<StreamEvent> second = log.nextBatch(first.get(first.size() - 1).idAsLong(), Duration.ZERO);
    assertThat(second).hasSize(500);
    assertThat(second.get(second.size() - 1).foreignId()).isEqualTo("order-1500");
    assertThat(log.nextBatch(log.latestId(), Duration.ZERO)).isEmpty();
  }

  @Test
  void lagWindowReleasesEventsOnceTheyAreOldEnough() throws InterruptedException {
    JdbcEventLog log = metadataLog();
    Duration lag = Duration.ofSeconds(2);
    log.insert("order-1", EventType.of(1));

    assertThat(log.nextBatch(0, lag)).isEmpty();

    Thread.sleep(lag.plusMillis(500).toMillis());

    List<StreamEvent> released = log.nextBatch(0, lag);
    assertThat(released).extracting(StreamEvent::foreignId).containsExactly("order-1");
    assertThat(log.nextBatch(released.get(0).idAsLong(), lag)).isEmpty();
  }

  @Test
  void tableWithoutMetadataRejectsPayloads() {
    JdbcEventLog log = new JdbcEventLog(jdbc, EventLogSchema.of("bare_events"), classifier);

    assertThatThrownBy(() -> log.insert("order-1", EventType.of(1), new byte[] {1}))
        .isInstanceOf(MetadataDisabledException.class);

    log.insert("order-1", EventType.of(1));
    assertThat(log.nextBatch(0, Duration.ZERO)).singleElement()
        .satisfies(event -> assertThat(event.hasMetadata()).isFalse());
  }

  @Test
  void cursorOnlyMovesForward() {
    JdbcCursorStore store = new JdbcCursorStore(jdbc, CursorSchema.of("cursors"), classifier);

    assertThat(store.get("indexer")).isEqualTo("0");

    store.advance("indexer", "9");
    store.advance("indexer", "10");
    assertThat(store.get("indexer")).isEqualTo("10");

    assertThatThrownBy(() -> store.advance("indexer", "10")).isInstanceOf(CursorRegressionException.class);
    assertThatThrownBy(() -> store.advance("indexer", "2")).isInstanceOf(CursorRegressionException.class);
    assertThat(store.get("indexer")).isEqualTo("10");
  }

  @Test
  void readOnlyUserCannotWrite() {
    JdbcEventLog log = new JdbcEventLog(readOnlyJdbc, metadataSchema(), classifier);
    JdbcCursorStore store = new JdbcCursorStore(readOnlyJdbc, CursorSchema.of("cursors"), classifier);

    assertThatThrownBy(() -> log.insert("order-1", EventType.of(1))).isInstanceOf(WriteRejectedException.class);
    assertThatThrownBy(() -> store.advance("indexer", "1")).isInstanceOf(WriteRejectedException.class);
    assertThat(log.latestId()).isZero();
  }

  private JdbcEventLog metadataLog() {
    return new JdbcEventLog(jdbc, metadataSchema(), classifier);
  }

  private static EventLogSchema metadataSchema() {
    return EventLogSchema.builder("events").metadataField("metadata").build();
  }
}
