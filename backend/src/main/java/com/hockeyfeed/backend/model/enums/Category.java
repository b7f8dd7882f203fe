package com.hockeyfeed.backend.model.enums;

import lombok.Getter;

@Getter
public enum Category {
    EXTRALIGA("extraliga"),
    REPREZENTACIA("reprezentacia");

    private final String slug;

    Category(String slug) {
        this.slug = slug;
    }

    /**
     * Find Category by slug or enum name (case-insensitive)
     */
    public static Category fromSlug(String value) {
        if (value == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        String normalized = value.trim();
        for (Category category : values()) {
            if (category.slug.equalsIgnoreCase(normalized) || category.name().equalsIgnoreCase(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown category: " + value);
    }
}
