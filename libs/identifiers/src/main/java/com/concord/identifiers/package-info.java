/**
 * Validated protocol identifiers.
 *
 * <p>Each identifier is a record wrapping its wire string. Construction validates the sigil, the
 * localpart, the server name and the 255-byte length limit, so an instance is always well-formed.
 * Instances serialize to and from plain JSON strings through Jackson annotations.
 */
package com.concord.identifiers;
