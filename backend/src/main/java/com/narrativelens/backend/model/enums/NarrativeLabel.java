package com.narrativelens.backend.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.List;

/**
 * Narrative categories scored for every article. FACTUAL and NEUTRAL are catch-all labels that are
 * only populated when no keyword label scores strongly.
 */
public enum NarrativeLabel {
    FACTUAL("Factual", true),
    NEUTRAL("Neutral", true),
    PRO_RUSSIA("Pro-Russia", false),
    ANTI_WEST("Anti-West", false),
    ANTI_FRANCE("Anti-France", false),
    SENSATIONALIST("Sensationalist", false),
    ANTI_US("Anti-US", false),
    OPINION("Opinion", false),
    BUSINESS("Business", false),
    POLITICS("Politics", false);

    private final String displayName;
    private final boolean catchAll;

    NarrativeLabel(String displayName, boolean catchAll) {
        this.displayName = displayName;
        this.catchAll = catchAll;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    public boolean isCatchAll() {
        return catchAll;
    }

    public static List<NarrativeLabel> keywordLabels() {
        return Arrays.stream(values()).filter(label -> !label.catchAll).toList();
    }

    public static NarrativeLabel fromDisplayName(String displayName) {
        for (NarrativeLabel label : values()) {
            if (label.displayName.equalsIgnoreCase(displayName) || label.name().equalsIgnoreCase(displayName)) {
                return label;
            }
        }
        throw new IllegalArgumentException("Unknown narrative label: " + displayName);
    }
}
