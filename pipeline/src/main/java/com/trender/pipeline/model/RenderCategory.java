package com.trender.pipeline.model;

import java.util.Locale;

/**
 * Who maintains a project that uses Render.
 */
public enum RenderCategory {
    OFFICIAL,
    EMPLOYEE,
    BLUEPRINT,
    COMMUNITY;

    /**
     * Column value stored in the warehouse.
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
