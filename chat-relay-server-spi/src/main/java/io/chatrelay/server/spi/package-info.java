/**
 * Server-side SPI for the chat relay.
 *
 * <p>The SPI is blocking and minimal: the relay core reads and writes messages only through
 * {@link io.chatrelay.server.spi.MessageStore}, so storage engines plug in without touching fan-out code.
 */
package io.chatrelay.server.spi;
