package com.roadmonitor.subscription;

import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Подписчик, подключённый по WebSocket через Netty.
 */
public final class WebSocketSubscriberChannel implements SubscriberChannel {

  private final Channel channel;

  public WebSocketSubscriberChannel(Channel channel) {
    this.channel = Objects.requireNonNull(channel, "channel");
  }

  @Override
  public boolean isOpen() {
    return channel.isActive();
  }

  @Override
  public CompletableFuture<Void> send(String message) {
    CompletableFuture<Void> result = new CompletableFuture<>();
    channel.writeAndFlush(new TextWebSocketFrame(message)).addListener(future -> {
      if (future.isSuccess()) {
        result.complete(null);
      } else {
        result.completeExceptionally(future.cause());
      }
    });
    return result;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof WebSocketSubscriberChannel)) {
      return false;
    }
    return channel.equals(((WebSocketSubscriberChannel) o).channel);
  }

  @Override
  public int hashCode() {
    return channel.hashCode();
  }

  @Override
  public String toString() {
    return "WebSocketSubscriberChannel{" + channel.remoteAddress() + "}";
  }
}
