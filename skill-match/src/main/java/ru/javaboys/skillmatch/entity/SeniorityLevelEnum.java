package ru.javaboys.skillmatch.entity;

import org.springframework.lang.Nullable;

import java.util.Locale;

public enum SeniorityLevelEnum {

    INTERN("INTERN"),
    JUNIOR("JUNIOR"),
    MIDDLE("MIDDLE"),
    SENIOR("SENIOR"),
    LEAD("LEAD"),
    PRINCIPAL("PRINCIPAL");

    private final String id;

    SeniorityLevelEnum(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    @Nullable
    public static SeniorityLevelEnum fromId(String id) {
        if (id == null) {
            return null;
        }
        String normalized = id.trim().toUpperCase(Locale.ROOT);
        for (SeniorityLevelEnum at : SeniorityLevelEnum.values()) {
            if (at.getId().equals(normalized)) {
                return at;
            }
        }
        return null;
    }
}
