package com.pantiviewer.model;

/**
 * Audience of a watched root and of the change signals it produces.
 * Restricted (admin-only) audiences also see everything public.
 */
public enum Visibility {
    PUBLIC,
    RESTRICTED;

    /**
     * @return the tier that reaches the wider audience of the two.
     */
    public static Visibility mostVisible(Visibility a, Visibility b) {
        if (a == PUBLIC || b == PUBLIC) {
            return PUBLIC;
        }
        return RESTRICTED;
    }

    /**
     * Whether a listener registered for this audience must receive a signal emitted for {@code tier}.
     */
    public boolean receives(Visibility tier) {
        return this == RESTRICTED || tier == PUBLIC;
    }

    public static Visibility parse(String value) {
        if (value == null || value.isBlank()) {
            return RESTRICTED;
        }
        switch (value.trim().toLowerCase()) {
            case "public":
                return PUBLIC;
            case "restricted":
            case "admin":
            case "admin_only":
                return RESTRICTED;
            default:
                throw new IllegalArgumentException("Unknown visibility: " + value);
        }
    }
}
