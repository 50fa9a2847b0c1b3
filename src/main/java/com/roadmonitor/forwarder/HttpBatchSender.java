package com.roadmonitor.forwarder;

import com.roadmonitor.model.Json;
import com.roadmonitor.model.ProcessedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;

/**
 * Отправка пакетов в сервис хранения через HTTP POST {@code /processed_agent_data/}.
 * <p>
 * Успех: 2xx. Временная ошибка: 408, 429 и 5xx. Остальные коды считаются отказом.
 */
public class HttpBatchSender implements BatchSender {

  private static final Logger logger = LoggerFactory.getLogger(HttpBatchSender.class);

  private final HttpClient httpClient;
  private final URI endpoint;
  private final Duration timeout;

  /**
   * @param apiBaseUrl Базовый URL сервиса хранения, например "http://localhost:8000".
   * @param timeout    Ограничение на установку соединения и на весь запрос.
   */
  public HttpBatchSender(String apiBaseUrl, Duration timeout) {
    this(HttpClient.newBuilder()
        .version(HttpClient.Version.HTTP_1_1)
        .connectTimeout(timeout)
        .build(), apiBaseUrl, timeout);
  }

  public HttpBatchSender(HttpClient httpClient, String apiBaseUrl, Duration timeout) {
    this.httpClient = httpClient;
    this.endpoint = URI.create(stripTrailingSlash(apiBaseUrl) + "/processed_agent_data/");
    this.timeout = timeout;
  }

  @Override
  public void send(List<ProcessedRecord> batch) throws TransientDeliveryException, PermanentRejectionException {
    String jsonBody = Json.toJson(batch);

    HttpRequest request = HttpRequest.newBuilder()
        .uri(endpoint)
        .header("Content-Type", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
        .timeout(timeout)
        .build();

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (HttpTimeoutException e) {
      throw new TransientDeliveryException("Таймаут отправки пакета в " + endpoint, e);
    } catch (IOException e) {
      throw new TransientDeliveryException("Сетевая ошибка при отправке пакета в " + endpoint, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransientDeliveryException("Отправка пакета прервана", e);
    }

    int status = response.statusCode();
    if (status >= 200 && status < 300) {
      logger.debug("Пакет из {} записей принят: HTTP {}", batch.size(), status);
      return;
    }
    if (status == 408 || status == 429 || status >= 500) {
      throw new TransientDeliveryException("Сервис хранения вернул HTTP " + status + ": " + response.body());
    }
    throw new PermanentRejectionException(status, response.body());
  }

  public URI getEndpoint() {
    return endpoint;
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
