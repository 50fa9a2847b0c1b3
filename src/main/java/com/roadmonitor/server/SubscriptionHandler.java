package com.roadmonitor.server;

import com.roadmonitor.subscription.SubscriptionRegistry;
import com.roadmonitor.subscription.WebSocketSubscriberChannel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * WebSocket-подписка {@code /ws/{user_id}}.
 * <p>
 * После рукопожатия канал регистрируется в {@link SubscriptionRegistry} и снимается с учёта
 * при закрытии соединения. Входящие кадры от подписчика игнорируются.
 */
public class SubscriptionHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

  private static final Logger logger = LoggerFactory.getLogger(SubscriptionHandler.class);

  static final String WS_PATH = "/ws";

  private final SubscriptionRegistry registry;

  public SubscriptionHandler(SubscriptionRegistry registry) {
    this.registry = registry;
  }

  @Override
  public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
    if (!(evt instanceof WebSocketServerProtocolHandler.HandshakeComplete)) {
      super.userEventTriggered(ctx, evt);
      return;
    }
    String uri = ((WebSocketServerProtocolHandler.HandshakeComplete) evt).requestUri();
    Integer producerId = parseProducerId(uri);
    if (producerId == null) {
      logger.warn("Отклонена подписка с некорректным user_id: {}", uri);
      ctx.writeAndFlush(new CloseWebSocketFrame(WebSocketCloseStatus.POLICY_VIOLATION, "invalid user_id"))
          .addListener(ChannelFutureListener.CLOSE);
      return;
    }

    WebSocketSubscriberChannel channel = new WebSocketSubscriberChannel(ctx.channel());
    registry.subscribe(producerId, channel);
    ctx.channel().closeFuture().addListener(future -> registry.unsubscribe(producerId, channel));
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
    // keep-alive от клиента, содержимое не используется
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    logger.warn("Ошибка в канале подписчика {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
    ctx.close();
  }

  /**
   * @return user_id из пути {@code /ws/{user_id}} или null, если он не является неотрицательным числом.
   */
  static Integer parseProducerId(String uri) {
    String path = new QueryStringDecoder(uri).path();
    String prefix = WS_PATH + "/";
    if (!path.startsWith(prefix)) {
      return null;
    }
    String idText = path.substring(prefix.length());
    if (idText.endsWith("/")) {
      idText = idText.substring(0, idText.length() - 1);
    }
    try {
      int id = Integer.parseInt(idText);
      return id >= 0 ? id : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
