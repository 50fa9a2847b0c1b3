package com.roadmonitor.server;

import com.roadmonitor.config.Config;
import com.roadmonitor.db.DatabaseConnection;
import com.roadmonitor.db.JdbcRecordStore;
import com.roadmonitor.service.IngestionService;
import com.roadmonitor.service.IngestionServiceImpl;
import com.roadmonitor.subscription.SubscriptionRegistry;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * Сервис хранения: HTTP API записей и WebSocket-подписки на Netty.
 * <p>
 * Обращения к БД выполняются в отдельной группе потоков, а не в event loop.
 */
public class HttpServer {

  private static final Logger logger = LoggerFactory.getLogger(HttpServer.class);

  private static final int MAX_CONTENT_LENGTH = 1024 * 1024;

  private final int port;
  private final int serviceThreads;
  private final IngestionService ingestionService;
  private final SubscriptionRegistry registry;

  private EventLoopGroup bossGroup;
  private EventLoopGroup workerGroup;
  private EventExecutorGroup serviceGroup;
  private Channel serverChannel;

  /**
   * Конструктор HTTP-сервера.
   * @param port             Порт, на котором будет работать сервер (0: любой свободный).
   * @param serviceThreads   Число потоков для обращений к сервису и БД.
   * @param ingestionService Сервис приёма записей.
   * @param registry         Реестр подписчиков.
   */
  public HttpServer(int port, int serviceThreads, IngestionService ingestionService, SubscriptionRegistry registry) {
    this.port = port;
    this.serviceThreads = serviceThreads;
    this.ingestionService = ingestionService;
    this.registry = registry;
  }

  /**
   * Запускает сервер и возвращает управление после привязки к порту.
   * @throws InterruptedException если ожидание привязки прервано.
   */
  public void start() throws InterruptedException {
    bossGroup = new NioEventLoopGroup(1);
    workerGroup = new NioEventLoopGroup();
    serviceGroup = new DefaultEventExecutorGroup(serviceThreads);
    WebSocketServerProtocolConfig wsConfig = WebSocketServerProtocolConfig.newBuilder()
        .websocketPath(SubscriptionHandler.WS_PATH)
        .checkStartsWith(true)
        .build();

    ServerBootstrap b = new ServerBootstrap();
    b.group(bossGroup, workerGroup)
        .channel(NioServerSocketChannel.class)
        .childHandler(new ChannelInitializer<SocketChannel>() {
          @Override
          public void initChannel(SocketChannel ch) {
            ch.pipeline()
                .addLast(new HttpServerCodec())
                .addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH))
                .addLast(new WebSocketServerProtocolHandler(wsConfig))
                .addLast(new SubscriptionHandler(registry))
                .addLast(serviceGroup, new HttpServerHandler(ingestionService));
          }
        })
        .option(ChannelOption.SO_BACKLOG, 128)
        .childOption(ChannelOption.SO_KEEPALIVE, true);

    try {
      serverChannel = b.bind(port).sync().channel();
    } catch (Exception e) {
      // bind может выбросить и BindException
      stop();
      throw e;
    }
    logger.info("🚀 Сервер запущен на http://localhost:{}", getPort());
  }

  /**
   * Фактический порт (полезно при запуске на порту 0).
   */
  public int getPort() {
    return ((InetSocketAddress) serverChannel.localAddress()).getPort();
  }

  /**
   * Блокирует вызывающий поток до закрытия серверного канала.
   */
  public void blockUntilShutdown() throws InterruptedException {
    serverChannel.closeFuture().sync();
  }

  public void stop() {
    if (serverChannel != null) {
      serverChannel.close().syncUninterruptibly();
    }
    if (workerGroup != null) {
      workerGroup.shutdownGracefully();
    }
    if (bossGroup != null) {
      bossGroup.shutdownGracefully();
    }
    if (serviceGroup != null) {
      serviceGroup.shutdownGracefully();
    }
    logger.info("Сервер остановлен");
  }

  /**
   * Точка входа сервиса хранения.
   * Инициализирует БД и запускает сервер на порту server.port.
   * @param args Аргументы командной строки (не используются).
   * @throws Exception если произошла ошибка при запуске.
   */
  public static void main(String[] args) throws Exception {
    DatabaseConnection.initializeDatabase();
    SubscriptionRegistry registry = new SubscriptionRegistry();
    IngestionService service = new IngestionServiceImpl(new JdbcRecordStore(), registry);
    HttpServer server = new HttpServer(
        Config.getIntProperty("server.port", 8000),
        Config.getIntProperty("server.worker.threads", 8),
        service,
        registry
    );
    server.start();
    Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "server-shutdown"));
    server.blockUntilShutdown();
  }
}
