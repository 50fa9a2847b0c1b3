package com.roadmonitor.db;

import com.roadmonitor.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Класс для управления соединением с PostgreSQL и инициализации таблиц.
 * Параметры подключения: db.url, db.user, db.password (см. {@link Config}).
 */
public final class DatabaseConnection {

  private static final Logger logger = LoggerFactory.getLogger(DatabaseConnection.class);

  private DatabaseConnection() {
  }

  /**
   * Создаёт новое соединение с базой данных.
   * @return Новое соединение с PostgreSQL.
   * @throws StorageException если подключение не удалось.
   */
  public static Connection getConnection() {
    String url = Config.getRequiredProperty("db.url");
    try {
      return DriverManager.getConnection(url,
          Config.getRequiredProperty("db.user"),
          Config.getProperty("db.password", ""));
    } catch (SQLException e) {
      throw new StorageException(
          "Не удалось подключиться к базе данных по адресу: " + url
              + ". Проверьте, что PostgreSQL запущен и параметры подключения верны.",
          e
      );
    }
  }

  /**
   * Инициализирует базу данных: создаёт таблицу processed_agent_data, если она отсутствует.
   * Вызывается при старте приложения.
   * @throws StorageException если не удалось создать таблицу.
   */
  public static void initializeDatabase() {
    try (Connection conn = getConnection();
         Statement stmt = conn.createStatement()) {

      String createTableSQL = """
                CREATE TABLE IF NOT EXISTS processed_agent_data (
                    id BIGSERIAL PRIMARY KEY,
                    road_state VARCHAR(32) NOT NULL,
                    user_id INTEGER NOT NULL,
                    x DOUBLE PRECISION NOT NULL,
                    y DOUBLE PRECISION NOT NULL,
                    z DOUBLE PRECISION NOT NULL,
                    latitude DOUBLE PRECISION NOT NULL,
                    longitude DOUBLE PRECISION NOT NULL,
                    "timestamp" TIMESTAMPTZ NOT NULL
                );
                """;
      stmt.execute(createTableSQL);
      logger.info("✅ Таблица 'processed_agent_data' создана или уже существует.");

    } catch (SQLException e) {
      throw new StorageException(
          "Не удалось инициализировать базу данных. Ошибка при создании таблицы 'processed_agent_data'.",
          e
      );
    }
  }
}
