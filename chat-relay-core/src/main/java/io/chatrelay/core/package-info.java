/**
 * Protocol-centric core for the chat relay.
 *
 * <p>This module is deliberately framework-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants (routes, wire field names, envelope tags)</li>
 *   <li>The message, submission, envelope and change-event models</li>
 *   <li>Timestamp parsing shared by codecs and stores</li>
 * </ul>
 *
 * <p>JSON bindings, HTTP hosting and storage live in other modules.
 */
package io.chatrelay.core;
