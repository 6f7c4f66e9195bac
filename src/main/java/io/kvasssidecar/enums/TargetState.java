package io.kvasssidecar.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Enum representing the assignment state of a scrape target on this shard.
 *
 * <ul>
 *   <li><strong>NORMAL</strong> - Target is owned by this shard and scraped normally</li>
 *   <li><strong>IN_TRANSFER</strong> - Target is being handed over to another shard</li>
 * </ul>
 */
public enum TargetState {
    /**
     * Target is scraped normally. Written as an empty string on the wire.
     */
    NORMAL(""),

    /**
     * Target is being moved to another shard.
     */
    IN_TRANSFER("in_transfer");

    private final String value;

    TargetState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TargetState fromString(String value) {
        if (value == null) {
            return NORMAL;
        }

        String normalizedValue = value.trim();
        if (normalizedValue.isEmpty() || normalizedValue.equalsIgnoreCase("normal")) {
            return NORMAL;
        }
        for (TargetState state : values()) {
            if (state.value.equalsIgnoreCase(normalizedValue) || state.name().equalsIgnoreCase(normalizedValue)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown target state: " + value);
    }
}
