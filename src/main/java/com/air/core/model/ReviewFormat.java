package com.air.core.model;

/**
 * Review artifact formats kept per patch.
 */
public enum ReviewFormat {
    JSON("json", "review.json"),
    MARKDOWN("markdown", "review.md"),
    INLINE("inline", "review-inline.txt");

    private final String label;
    private final String fileName;

    ReviewFormat(String label, String fileName) {
        this.label = label;
        this.fileName = fileName;
    }

    public String label() {
        return label;
    }

    public String fileName() {
        return fileName;
    }

    public static ReviewFormat fromLabel(String label) {
        for (var format : values()) {
            if (format.label.equalsIgnoreCase(label) || format.name().equalsIgnoreCase(label)) {
                return format;
            }
        }
        throw new ValidationException("Unknown review format: " + label);
    }
}
