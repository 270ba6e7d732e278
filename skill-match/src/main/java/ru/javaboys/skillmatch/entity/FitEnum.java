package ru.javaboys.skillmatch.entity;

import org.springframework.lang.Nullable;

public enum FitEnum {

    EXCELLENT("excellent"),
    GOOD("good"),
    FAIR("fair"),
    POOR("poor");

    private final String id;

    FitEnum(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    @Nullable
    public static FitEnum fromId(String id) {
        for (FitEnum at : FitEnum.values()) {
            if (at.getId().equals(id)) {
                return at;
            }
        }
        return null;
    }
}
