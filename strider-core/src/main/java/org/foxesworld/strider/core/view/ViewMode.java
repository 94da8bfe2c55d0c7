package org.foxesworld.strider.core.view;

import java.util.Locale;

public enum ViewMode {
    FIRST_PERSON,
    THIRD_PERSON;

    public ViewMode other() {
        return this == FIRST_PERSON ? THIRD_PERSON : FIRST_PERSON;
    }

    /**
     * Lenient parse for tuning files: "firstPerson", "first_person", "fp", "tp"...
     * Returns {@code fallback} for anything unknown.
     */
    public static ViewMode parse(String raw, ViewMode fallback) {
        if (raw == null) return fallback;
        String s = raw.trim().toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
        return switch (s) {
            case "firstperson", "fp", "first" -> FIRST_PERSON;
            case "thirdperson", "tp", "third" -> THIRD_PERSON;
            default -> fallback;
        };
    }
}
