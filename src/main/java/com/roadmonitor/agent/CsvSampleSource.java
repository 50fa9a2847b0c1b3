package com.roadmonitor.agent;

import com.roadmonitor.model.AccelerometerSample;
import com.roadmonitor.model.AgentRecord;
import com.roadmonitor.model.GpsSample;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Источник замеров из двух CSV-файлов (акселерометр и GPS), читаемых по кругу.
 * <p>
 * Файлы читаются независимо: каждый перематывается на начало, когда заканчивается.
 * Заголовок акселерометра: {@code X,Y,Z}, GPS: {@code longitude,latitude}
 * (порядок колонок и регистр не важны).
 */
public class CsvSampleSource implements SampleSource {

  private final CsvFileReader accelerometerReader;
  private final CsvFileReader gpsReader;
  private final int userId;
  private final Clock clock;

  public CsvSampleSource(Path accelerometerFile, Path gpsFile, int userId) {
    this(accelerometerFile, gpsFile, userId, Clock.systemUTC());
  }

  public CsvSampleSource(Path accelerometerFile, Path gpsFile, int userId, Clock clock) {
    this.accelerometerReader = new CsvFileReader(accelerometerFile, List.of("x", "y", "z"));
    this.gpsReader = new CsvFileReader(gpsFile, List.of("longitude", "latitude"));
    this.userId = userId;
    this.clock = clock;
  }

  @Override
  public void open() throws IOException {
    accelerometerReader.open();
    gpsReader.open();
  }

  @Override
  public AgentRecord next() {
    Map<String, Double> acc = accelerometerReader.read();
    Map<String, Double> gps = gpsReader.read();
    return new AgentRecord(
        userId,
        new AccelerometerSample(acc.get("x"), acc.get("y"), acc.get("z")),
        new GpsSample(gps.get("latitude"), gps.get("longitude")),
        OffsetDateTime.now(clock)
    );
  }

  @Override
  public void close() throws IOException {
    try {
      accelerometerReader.close();
    } finally {
      gpsReader.close();
    }
  }

  /**
   * Чтение одного CSV-файла с заголовком и перемоткой в начало.
   */
  private static final class CsvFileReader {

    private final Path file;
    private final List<String> columns;
    private final Map<String, Integer> columnIndex = new HashMap<>();
    private BufferedReader reader;
    private int lineNumber;

    CsvFileReader(Path file, List<String> columns) {
      this.file = file;
      this.columns = columns;
    }

    void open() throws IOException {
      reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
      lineNumber = 1;
      try {
        readHeader(reader.readLine());
      } catch (IOException e) {
        close();
        throw e;
      }
    }

    private void readHeader(String header) throws IOException {
      if (header == null) {
        throw new IOException("Файл " + file + " пуст: нет заголовка");
      }
      columnIndex.clear();
      String[] names = header.split(",");
      for (int i = 0; i < names.length; i++) {
        columnIndex.put(names[i].trim().toLowerCase(Locale.ROOT), i);
      }
      for (String column : columns) {
        if (!columnIndex.containsKey(column)) {
          throw new IOException("В файле " + file + " нет колонки '" + column + "'");
        }
      }
    }

    Map<String, Double> read() {
      if (reader == null) {
        throw new IllegalStateException("Файл " + file + " не открыт");
      }
      try {
        String line = nextDataLine();
        if (line == null) {
          // Конец файла, начинаем заново
          reader.close();
          open();
          line = nextDataLine();
          if (line == null) {
            throw new IllegalStateException("Файл " + file + " не содержит данных");
          }
        }
        return parse(line);
      } catch (IOException e) {
        throw new UncheckedIOException("Ошибка чтения файла " + file, e);
      }
    }

    private String nextDataLine() throws IOException {
      String line;
      do {
        line = reader.readLine();
        lineNumber++;
      } while (line != null && line.isBlank());
      return line;
    }

    private Map<String, Double> parse(String line) {
      String[] values = line.split(",");
      Map<String, Double> row = new HashMap<>();
      for (String column : columns) {
        int index = columnIndex.get(column);
        if (index >= values.length) {
          throw new IllegalStateException(file + ":" + lineNumber + ": не хватает значения '" + column + "'");
        }
        try {
          row.put(column, Double.parseDouble(values[index].trim()));
        } catch (NumberFormatException e) {
          throw new IllegalStateException(file + ":" + lineNumber + ": некорректное число в колонке '"
              + column + "': " + values[index], e);
        }
      }
      return row;
    }

    void close() throws IOException {
      if (reader != null) {
        reader.close();
        reader = null;
      }
    }
  }
}
