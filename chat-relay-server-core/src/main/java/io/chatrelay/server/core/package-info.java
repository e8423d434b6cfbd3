/**
 * Fan-out engine and framework-neutral HTTP handling for the chat relay.
 *
 * <p>{@link io.chatrelay.server.core.SubscriberRegistry}, {@link io.chatrelay.server.core.SubscriptionManager}
 * and {@link io.chatrelay.server.core.BroadcastDispatcher} deliver envelopes to live event streams;
 * {@link io.chatrelay.server.core.ChatRelayHandler} exposes them over HTTP through any host that can
 * translate {@link io.chatrelay.server.core.ServerRequest} and {@link io.chatrelay.server.core.ServerResponse}.
 */
package io.chatrelay.server.core;
