/**
 * Envelope codec for state events.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.concord.events.StateEvent}: the typed envelope
 *   <li>{@link com.concord.events.StateEventDecoder} and {@link com.concord.events.StateEventEncoder}:
 *       order-independent decoding and canonical encoding of the wire object
 *   <li>{@link com.concord.events.StateEventContentResolver}: the extension point through which
 *       content schemas are plugged in, with {@link com.concord.events.StateEventContentRegistry}
 *       as the standard implementation
 *   <li>{@link com.concord.events.Timestamps}: conversion of {@code origin_server_ts}
 * </ul>
 */
package com.concord.events;
