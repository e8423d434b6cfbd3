/**
 * {@link io.chatrelay.server.spi.MessageStore} backed by a PostgREST table.
 */
package io.chatrelay.store.postgrest;
