package com.roadmonitor.db;

import com.roadmonitor.model.AccelerometerSample;
import com.roadmonitor.model.AgentRecord;
import com.roadmonitor.model.GpsSample;
import com.roadmonitor.model.ProcessedRecord;
import com.roadmonitor.model.RoadState;
import com.roadmonitor.model.StoredRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Хранилище записей в таблице processed_agent_data (PostgreSQL).
 * Каждая операция выполняется в своём соединении с автокоммитом.
 */
public class JdbcRecordStore implements RecordStore {

  private static final String COLUMNS =
      "id, road_state, user_id, x, y, z, latitude, longitude, \"timestamp\"";

  @Override
  public StoredRecord insert(ProcessedRecord record) {
    String sql = "INSERT INTO processed_agent_data "
        + "(road_state, user_id, x, y, z, latitude, longitude, \"timestamp\") "
        + "VALUES (?, ?, ?, ?, ?, ?, ?, ?) RETURNING id";
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      bindRecord(pstmt, record);
      try (ResultSet rs = pstmt.executeQuery()) {
        rs.next();
        return new StoredRecord(rs.getLong("id"), record);
      }
    } catch (SQLException e) {
      throw new StorageException("Не удалось сохранить запись в базу данных. Пользователь: "
          + record.getAgentData().getUserId(), e);
    }
  }

  @Override
  public Optional<StoredRecord> findById(long id) {
    String sql = "SELECT " + COLUMNS + " FROM processed_agent_data WHERE id = ?";
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setLong(1, id);
      return querySingle(pstmt);
    } catch (SQLException e) {
      throw new StorageException("Не удалось прочитать запись " + id, e);
    }
  }

  @Override
  public List<StoredRecord> findAll() {
    String sql = "SELECT " + COLUMNS + " FROM processed_agent_data ORDER BY id";
    List<StoredRecord> records = new ArrayList<>();
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql);
         ResultSet rs = pstmt.executeQuery()) {
      while (rs.next()) {
        records.add(mapRow(rs));
      }
      return records;
    } catch (SQLException e) {
      throw new StorageException("Не удалось прочитать список записей", e);
    }
  }

  @Override
  public Optional<StoredRecord> update(long id, ProcessedRecord record) {
    String sql = "UPDATE processed_agent_data SET road_state = ?, user_id = ?, x = ?, y = ?, z = ?, "
        + "latitude = ?, longitude = ?, \"timestamp\" = ? WHERE id = ? RETURNING " + COLUMNS;
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      bindRecord(pstmt, record);
      pstmt.setLong(9, id);
      return querySingle(pstmt);
    } catch (SQLException e) {
      throw new StorageException("Не удалось обновить запись " + id, e);
    }
  }

  @Override
  public Optional<StoredRecord> delete(long id) {
    String sql = "DELETE FROM processed_agent_data WHERE id = ? RETURNING " + COLUMNS;
    try (Connection conn = DatabaseConnection.getConnection();
         PreparedStatement pstmt = conn.prepareStatement(sql)) {
      pstmt.setLong(1, id);
      return querySingle(pstmt);
    } catch (SQLException e) {
      throw new StorageException("Не удалось удалить запись " + id, e);
    }
  }

  private static void bindRecord(PreparedStatement pstmt, ProcessedRecord record) throws SQLException {
    AgentRecord agent = record.getAgentData();
    pstmt.setString(1, record.getRoadState().value());
    pstmt.setInt(2, agent.getUserId());
    pstmt.setDouble(3, agent.getAccelerometer().getX());
    pstmt.setDouble(4, agent.getAccelerometer().getY());
    pstmt.setDouble(5, agent.getAccelerometer().getZ());
    pstmt.setDouble(6, agent.getGps().getLatitude());
    pstmt.setDouble(7, agent.getGps().getLongitude());
    pstmt.setObject(8, agent.getTimestamp());
  }

  private static Optional<StoredRecord> querySingle(PreparedStatement pstmt) throws SQLException {
    try (ResultSet rs = pstmt.executeQuery()) {
      return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
    }
  }

  private static StoredRecord mapRow(ResultSet rs) throws SQLException {
    AgentRecord agent = new AgentRecord(
        rs.getInt("user_id"),
        new AccelerometerSample(rs.getDouble("x"), rs.getDouble("y"), rs.getDouble("z")),
        new GpsSample(rs.getDouble("latitude"), rs.getDouble("longitude")),
        rs.getObject("timestamp", OffsetDateTime.class)
    );
    return new StoredRecord(rs.getLong("id"), new ProcessedRecord(RoadState.fromValue(rs.getString("road_state")), agent));
  }
}
