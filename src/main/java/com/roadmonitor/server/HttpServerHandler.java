package com.roadmonitor.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.roadmonitor.db.StorageException;
import com.roadmonitor.model.Json;
import com.roadmonitor.model.StoredRecord;
import com.roadmonitor.service.BatchIngestException;
import com.roadmonitor.service.IngestResult;
import com.roadmonitor.service.IngestionService;
import com.roadmonitor.service.RecordNotFoundException;
import com.roadmonitor.service.ValidationException;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import io.netty.util.CharsetUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Обработчик HTTP-запросов к ресурсу {@code /processed_agent_data/}.
 * <p>
 * Делегирует обработку данных сервису {@link IngestionService}.
 */
public class HttpServerHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

  private static final Logger logger = LoggerFactory.getLogger(HttpServerHandler.class);

  static final String RESOURCE_PATH = "/processed_agent_data";

  private final IngestionService ingestionService;

  /**
   * Конструктор обработчика.
   *
   * @param ingestionService Сервис приёма и чтения записей.
   */
  public HttpServerHandler(IngestionService ingestionService) {
    this.ingestionService = ingestionService;
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
    String path = normalize(new QueryStringDecoder(request.uri()).path());
    HttpMethod method = request.method();
    logger.debug("📥 {} {}", method, path);

    FullHttpResponse response;
    try {
      response = route(method, path, request);
    } catch (RecordNotFoundException e) {
      response = createJsonResponse(HttpResponseStatus.NOT_FOUND, error("detail", "Data not found"));
    } catch (ValidationException e) {
      response = createJsonResponse(HttpResponseStatus.UNPROCESSABLE_ENTITY, error("error", e.getMessage()));
    } catch (StorageException e) {
      logger.error("❌ Ошибка хранилища при обработке {} {}", method, path, e);
      response = createJsonResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR, error("error", "Storage unavailable"));
    } catch (RuntimeException e) {
      logger.error("❌ Непредвиденная ошибка при обработке {} {}", method, path, e);
      response = createJsonResponse(HttpResponseStatus.INTERNAL_SERVER_ERROR, error("error", "Internal server error"));
    }

    ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
  }

  private FullHttpResponse route(HttpMethod method, String path, FullHttpRequest request) {
    if (RESOURCE_PATH.equals(path)) {
      if (method == HttpMethod.POST) {
        return handleIngest(request);
      }
      if (method == HttpMethod.GET) {
        return createJsonResponse(HttpResponseStatus.OK, Json.toJson(ingestionService.list()));
      }
      return methodNotAllowed();
    }

    if (path.startsWith(RESOURCE_PATH + "/")) {
      long id;
      try {
        id = Long.parseLong(path.substring(RESOURCE_PATH.length() + 1));
      } catch (NumberFormatException e) {
        return createJsonResponse(HttpResponseStatus.BAD_REQUEST, error("error", "Invalid id"));
      }
      if (method == HttpMethod.GET) {
        return recordResponse(ingestionService.read(id));
      }
      if (method == HttpMethod.PUT) {
        JsonNode body = readBody(request);
        if (body == null) {
          return createJsonResponse(HttpResponseStatus.BAD_REQUEST, error("error", "Invalid JSON"));
        }
        return recordResponse(ingestionService.update(id, body));
      }
      if (method == HttpMethod.DELETE) {
        return recordResponse(ingestionService.delete(id));
      }
      return methodNotAllowed();
    }

    return createJsonResponse(HttpResponseStatus.NOT_FOUND, error("error", "404"));
  }

  private FullHttpResponse handleIngest(FullHttpRequest request) {
    JsonNode body = readBody(request);
    if (body == null) {
      return createJsonResponse(HttpResponseStatus.BAD_REQUEST, error("error", "Invalid JSON"));
    }
    if (!body.isArray()) {
      return createJsonResponse(HttpResponseStatus.BAD_REQUEST, error("error", "Expected JSON array"));
    }

    List<JsonNode> batch = new ArrayList<>(body.size());
    body.forEach(batch::add);

    try {
      IngestResult result = ingestionService.ingest(batch);
      ObjectNode json = Json.mapper().createObjectNode();
      json.put("status", "saved");
      json.put("count", result.size());
      ArrayNode ids = json.putArray("ids");
      result.getIds().forEach(ids::add);
      return createJsonResponse(HttpResponseStatus.OK, json.toString());
    } catch (BatchIngestException e) {
      ObjectNode json = Json.mapper().createObjectNode();
      json.put("error", e.getCause().getMessage());
      json.put("index", e.getFailedIndex());
      ArrayNode committed = json.putArray("committed");
      e.getCommitted().forEach(stored -> committed.add(stored.getId()));
      HttpResponseStatus status = e.isValidationFailure()
          ? HttpResponseStatus.UNPROCESSABLE_ENTITY
          : HttpResponseStatus.INTERNAL_SERVER_ERROR;
      return createJsonResponse(status, json.toString());
    }
  }

  private JsonNode readBody(FullHttpRequest request) {
    String body = request.content().toString(CharsetUtil.UTF_8);
    try {
      JsonNode node = Json.mapper().readTree(body);
      // Пустое тело readTree возвращает как MissingNode
      return node == null || node.isMissingNode() ? null : node;
    } catch (JsonProcessingException e) {
      logger.warn("Некорректный JSON в запросе: {}", e.getOriginalMessage());
      return null;
    }
  }

  private FullHttpResponse recordResponse(StoredRecord record) {
    return createJsonResponse(HttpResponseStatus.OK, Json.toJson(record));
  }

  private FullHttpResponse methodNotAllowed() {
    return createJsonResponse(HttpResponseStatus.METHOD_NOT_ALLOWED, error("error", "Method not allowed"));
  }

  private static String error(String field, String message) {
    ObjectNode json = Json.mapper().createObjectNode();
    json.put(field, message);
    return json.toString();
  }

  private static String normalize(String path) {
    return path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
  }

  private FullHttpResponse createJsonResponse(HttpResponseStatus status, String body) {
    FullHttpResponse res = new DefaultFullHttpResponse(
        HttpVersion.HTTP_1_1,
        status,
        Unpooled.copiedBuffer(body, CharsetUtil.UTF_8)
    );
    res.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json; charset=UTF-8");
    res.headers().set(HttpHeaderNames.CONTENT_LENGTH, res.content().readableBytes());
    return res;
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    logger.error("Ошибка в HTTP-канале {}", ctx.channel().remoteAddress(), cause);
    ctx.close();
  }
}
