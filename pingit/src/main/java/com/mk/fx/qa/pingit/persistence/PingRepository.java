package com.mk.fx.qa.pingit.persistence;

import com.mk.fx.qa.pingit.model.DisconnectEvent;
import com.mk.fx.qa.pingit.model.ErrorKind;
import com.mk.fx.qa.pingit.model.ProbeResult;
import com.mk.fx.qa.pingit.model.TargetState;
import com.mk.fx.qa.pingit.model.TargetStats;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * JDBC access to the ping history, statistics and disconnect tables. Timestamps are stored as epoch
 * milliseconds.
 */
@Slf4j
@Repository
public class PingRepository {

  private static final String INSERT_PING =
      "INSERT INTO ping_history "
          + "(target_name, host, timestamp, success, response_time_ms, error_kind) "
          + "VALUES (?, ?, ?, ?, ?, ?)";

  private static final String INSERT_STATS =
      "INSERT INTO ping_statistics "
          + "(target_name, host, total_pings, successful_pings, failed_pings, success_rate, "
          + "avg_response_time, min_response_time, max_response_time, last_status, timestamp) "
          + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) "
          + "ON CONFLICT(target_name, timestamp) DO UPDATE SET "
          + "host = excluded.host, total_pings = excluded.total_pings, "
          + "successful_pings = excluded.successful_pings, failed_pings = excluded.failed_pings, "
          + "success_rate = excluded.success_rate, avg_response_time = excluded.avg_response_time, "
          + "min_response_time = excluded.min_response_time, "
          + "max_response_time = excluded.max_response_time, last_status = excluded.last_status";

  private static final String UPSERT_DISCONNECT =
      "INSERT INTO disconnect_events "
          + "(target_name, host, start_time, end_time, disconnect_count, reason, duration_seconds) "
          + "VALUES (?, ?, ?, ?, ?, ?, ?) "
          + "ON CONFLICT(target_name, start_time) DO UPDATE SET "
          + "host = excluded.host, end_time = excluded.end_time, "
          + "disconnect_count = excluded.disconnect_count, reason = excluded.reason, "
          + "duration_seconds = excluded.duration_seconds";

  private static final String CLOSE_OPEN_DISCONNECTS =
      "UPDATE disconnect_events SET end_time = ?, duration_seconds = (? - start_time) / 1000 "
          + "WHERE target_name = ? AND end_time IS NULL AND start_time <= ?";

  private final JdbcTemplate jdbc;
  private final TransactionTemplate transactions;

  public PingRepository(JdbcTemplate jdbc, PlatformTransactionManager transactionManager) {
    this.jdbc = jdbc;
    this.transactions = new TransactionTemplate(transactionManager);
  }

  /**
   * Writes a batch in a single transaction. Rows of each table keep their queue order, and
   * disconnect upserts and closes are applied in exactly the order they were queued.
   *
   * @throws PersistenceException if any statement fails; nothing of the batch is kept
   */
  public void writeBatch(List<PendingWrite> batch) {
    if (batch.isEmpty()) {
      return;
    }
    List<Object[]> pings = new ArrayList<>();
    List<Object[]> stats = new ArrayList<>();
    List<PendingWrite> disconnects = new ArrayList<>();
    for (PendingWrite write : batch) {
      if (write instanceof PingRecord ping) {
        pings.add(pingRow(ping));
      } else if (write instanceof StatsRecord snapshot) {
        stats.add(statsRow(snapshot.stats()));
      } else if (write instanceof DisconnectRecord || write instanceof DisconnectCloseRecord) {
        disconnects.add(write);
      }
    }
    try {
      transactions.executeWithoutResult(
          status -> {
            if (!pings.isEmpty()) {
              jdbc.batchUpdate(INSERT_PING, pings, PING_TYPES);
            }
            if (!stats.isEmpty()) {
              jdbc.batchUpdate(INSERT_STATS, stats, STATS_TYPES);
            }
            writeDisconnects(disconnects);
          });
      log.debug(
          "Persisted batch: {} pings, {} stats, {} disconnect updates",
          pings.size(),
          stats.size(),
          disconnects.size());
    } catch (DataAccessException ex) {
      throw new PersistenceException("Failed to write batch of " + batch.size(), ex);
    }
  }

  /** Upserts runs of consecutive events in one batch, closing dangling events in between. */
  private void writeDisconnects(List<PendingWrite> writes) {
    List<Object[]> upserts = new ArrayList<>();
    for (PendingWrite write : writes) {
      if (write instanceof DisconnectRecord disconnect) {
        upserts.add(disconnectRow(disconnect.event()));
      } else if (write instanceof DisconnectCloseRecord close) {
        flushUpserts(upserts);
        long closedAt = close.closedAt().toEpochMilli();
        int closed =
            jdbc.update(CLOSE_OPEN_DISCONNECTS, closedAt, closedAt, close.targetName(), closedAt);
        if (closed > 0) {
          log.info(
              "Closed {} dangling disconnect event(s) of {} at {}",
              closed,
              close.targetName(),
              close.closedAt());
        }
      }
    }
    flushUpserts(upserts);
  }

  private void flushUpserts(List<Object[]> upserts) {
    if (!upserts.isEmpty()) {
      jdbc.batchUpdate(UPSERT_DISCONNECT, upserts, DISCONNECT_TYPES);
      upserts.clear();
    }
  }

  /** Most recent statistics snapshot stored for a target. */
  public Optional<TargetStats> latestStatistics(String targetName) {
    try {
      List<TargetStats> rows =
          jdbc.query(
              "SELECT * FROM ping_statistics WHERE target_name = ? ORDER BY timestamp DESC LIMIT 1",
              (rs, i) -> mapStats(rs),
              targetName);
      return rows.stream().findFirst();
    } catch (DataAccessException ex) {
      throw new PersistenceException("Failed to read statistics of " + targetName, ex);
    }
  }

  /** Disconnect events of a target, newest first. */
  public List<DisconnectEvent> disconnects(String targetName, int limit) {
    try {
      return jdbc.query(
          "SELECT * FROM disconnect_events WHERE target_name = ? "
              + "ORDER BY start_time DESC LIMIT ?",
          (rs, i) -> mapDisconnect(rs),
          targetName,
          limit);
    } catch (DataAccessException ex) {
      throw new PersistenceException("Failed to read disconnect events of " + targetName, ex);
    }
  }

  /** Ping history of a target at or after {@code sinceMs}, newest first. */
  public List<PingRecord> history(String targetName, long sinceMs, int limit) {
    try {
      return jdbc.query(
          "SELECT * FROM ping_history WHERE target_name = ? AND timestamp >= ? "
              + "ORDER BY timestamp DESC, id DESC LIMIT ?",
          (rs, i) -> mapPing(rs),
          targetName,
          sinceMs,
          limit);
    } catch (DataAccessException ex) {
      throw new PersistenceException("Failed to read ping history of " + targetName, ex);
    }
  }

  // -----------------------------------------------------
  // Row mapping
  // -----------------------------------------------------
  private static final int[] PING_TYPES = {
    Types.VARCHAR, Types.VARCHAR, Types.BIGINT, Types.INTEGER, Types.DOUBLE, Types.VARCHAR
  };

  private static final int[] STATS_TYPES = {
    Types.VARCHAR, Types.VARCHAR, Types.BIGINT, Types.BIGINT, Types.BIGINT, Types.DOUBLE,
    Types.DOUBLE, Types.DOUBLE, Types.DOUBLE, Types.INTEGER, Types.BIGINT
  };

  private static final int[] DISCONNECT_TYPES = {
    Types.VARCHAR, Types.VARCHAR, Types.BIGINT, Types.BIGINT, Types.INTEGER, Types.VARCHAR,
    Types.BIGINT
  };

  private static Object[] pingRow(PingRecord ping) {
    ProbeResult result = ping.result();
    return new Object[] {
      result.targetName(),
      ping.host(),
      result.timestamp().toEpochMilli(),
      result.success() ? 1 : 0,
      result.responseTimeMs(),
      result.errorKind() == null ? null : result.errorKind().name()
    };
  }

  private static Object[] statsRow(TargetStats stats) {
    return new Object[] {
      stats.targetName(),
      stats.host(),
      stats.pingCount(),
      stats.successCount(),
      stats.failureCount(),
      stats.successRate(),
      stats.avgRt(),
      stats.minRt(),
      stats.maxRt(),
      stats.currentState().toStatusCode(),
      stats.timestamp().toEpochMilli()
    };
  }

  private static Object[] disconnectRow(DisconnectEvent event) {
    return new Object[] {
      event.targetName(),
      event.host(),
      event.startTime().toEpochMilli(),
      event.endTime() == null ? null : event.endTime().toEpochMilli(),
      event.consecutiveFailureCount(),
      event.reason() == null ? null : event.reason().name(),
      event.durationSeconds().orElse(null)
    };
  }

  private static PingRecord mapPing(ResultSet rs) throws SQLException {
    Instant timestamp = Instant.ofEpochMilli(rs.getLong("timestamp"));
    String name = rs.getString("target_name");
    ProbeResult result =
        rs.getInt("success") == 1
            ? ProbeResult.success(name, timestamp, rs.getDouble("response_time_ms"))
            : ProbeResult.failure(name, timestamp, ErrorKind.valueOf(rs.getString("error_kind")));
    return new PingRecord(rs.getString("host"), result);
  }

  private static TargetStats mapStats(ResultSet rs) throws SQLException {
    return new TargetStats(
        rs.getString("target_name"),
        rs.getString("host"),
        rs.getLong("total_pings"),
        rs.getLong("successful_pings"),
        rs.getLong("failed_pings"),
        nullableDouble(rs, "min_response_time"),
        nullableDouble(rs, "max_response_time"),
        nullableDouble(rs, "avg_response_time"),
        TargetState.fromStatusCode(nullableInt(rs, "last_status")),
        Instant.ofEpochMilli(rs.getLong("timestamp")));
  }

  private static DisconnectEvent mapDisconnect(ResultSet rs) throws SQLException {
    long end = rs.getLong("end_time");
    Instant endTime = rs.wasNull() ? null : Instant.ofEpochMilli(end);
    String reason = rs.getString("reason");
    return new DisconnectEvent(
        rs.getString("target_name"),
        rs.getString("host"),
        Instant.ofEpochMilli(rs.getLong("start_time")),
        endTime,
        rs.getInt("disconnect_count"),
        reason == null ? null : ErrorKind.valueOf(reason));
  }

  private static Double nullableDouble(ResultSet rs, String column) throws SQLException {
    double value = rs.getDouble(column);
    return rs.wasNull() ? null : value;
  }

  private static Integer nullableInt(ResultSet rs, String column) throws SQLException {
    int value = rs.getInt(column);
    return rs.wasNull() ? null : value;
  }
}
