package com.concord.events;

/**
 * Options for {@link StateEventDecoder}.
 *
 * @param rejectUnknownFields fail with {@link StateEventDecodeException.Reason#UNKNOWN_FIELD} on
 *     top-level keys the codec does not recognize instead of skipping them
 */
public record StateEventCodecConfig(boolean rejectUnknownFields) {

    private static final StateEventCodecConfig DEFAULTS = new StateEventCodecConfig(false);

    /** Permissive decoding: unknown top-level keys are ignored. */
    public static StateEventCodecConfig defaults() {
        return DEFAULTS;
    }

    /** Strict decoding: unknown top-level keys are rejected. */
    public static StateEventCodecConfig strict() {
        return new StateEventCodecConfig(true);
    }
}
