package com.concord.identifiers;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Shared parsing rules for sigil-prefixed identifiers of the form {@code <sigil><localpart>:<server>}.
 */
final class IdentifierParser {

    /** Identifiers, sigil included, may not exceed this many bytes of UTF-8. */
    static final int MAX_BYTES = 255;

    private IdentifierParser() {
        // utility class
    }

    /**
     * A successfully split identifier.
     *
     * @param localpart text between the sigil and the first colon
     * @param serverName text after the first colon, absent for server-less ids
     */
    record Parts(String localpart, Optional<String> serverName) {}

    /**
     * Splits and validates an identifier that must carry a server name.
     *
     * @throws InvalidIdentifierException if any rule is violated
     */
    static Parts parse(String kind, char sigil, String value) {
        checkCommon(kind, sigil, value);
        int colon = value.indexOf(':');
        if (colon < 0) {
            throw new InvalidIdentifierException(kind, value, "missing ':' before the server name");
        }
        return split(kind, value, colon);
    }

    /**
     * Splits and validates an identifier whose server name is optional. Without a colon the whole
     * remainder after the sigil is the localpart.
     */
    static Parts parseServerOptional(String kind, char sigil, String value) {
        checkCommon(kind, sigil, value);
        int colon = value.indexOf(':');
        if (colon < 0) {
            return new Parts(value.substring(1), Optional.empty());
        }
        return split(kind, value, colon);
    }

    static boolean isValidServerName(String serverName) {
        if (serverName == null || serverName.isEmpty()) {
            return false;
        }
        String host;
        String port = null;
        if (serverName.startsWith("[")) {
            int close = serverName.indexOf(']');
            if (close < 0) {
                return false;
            }
            host = serverName.substring(1, close);
            String rest = serverName.substring(close + 1);
            if (!rest.isEmpty()) {
                if (!rest.startsWith(":")) {
                    return false;
                }
                port = rest.substring(1);
            }
            if (host.isEmpty() || !host.chars().allMatch(c -> isHexDigit(c) || c == ':' || c == '.')) {
                return false;
            }
        } else {
            int colon = serverName.lastIndexOf(':');
            host = colon < 0 ? serverName : serverName.substring(0, colon);
            port = colon < 0 ? null : serverName.substring(colon + 1);
            if (host.isEmpty() || !host.chars().allMatch(c -> isAsciiAlphanumeric(c) || c == '-' || c == '.')) {
                return false;
            }
        }
        return port == null || isValidPort(port);
    }

    private static void checkCommon(String kind, char sigil, String value) {
        if (value == null) {
            throw new InvalidIdentifierException(kind, null, "must not be null");
        }
        if (value.getBytes(StandardCharsets.UTF_8).length > MAX_BYTES) {
            throw new InvalidIdentifierException(kind, value, "longer than " + MAX_BYTES + " bytes");
        }
        if (value.isEmpty() || value.charAt(0) != sigil) {
            throw new InvalidIdentifierException(kind, value, "must start with '" + sigil + "'");
        }
        if (value.length() == 1) {
            throw new InvalidIdentifierException(kind, value, "localpart must not be empty");
        }
    }

    private static Parts split(String kind, String value, int colon) {
        String localpart = value.substring(1, colon);
        String serverName = value.substring(colon + 1);
        if (localpart.isEmpty()) {
            throw new InvalidIdentifierException(kind, value, "localpart must not be empty");
        }
        if (!isValidServerName(serverName)) {
            throw new InvalidIdentifierException(kind, value, "invalid server name '" + serverName + "'");
        }
        return new Parts(localpart, Optional.of(serverName));
    }

    private static boolean isValidPort(String port) {
        if (port.isEmpty() || port.length() > 5 || !port.chars().allMatch(c -> c >= '0' && c <= '9')) {
            return false;
        }
        return Integer.parseInt(port) <= 65535;
    }

    private static boolean isHexDigit(int c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isAsciiAlphanumeric(int c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
}
