package com.musicbox.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Resultado de procesar una detección de tag.
 */
public enum DetectionAction {

    TAG_DETECTED("tag_detected"),
    ASSOCIATION_SUCCESS("association_success"),
    DUPLICATE_ASSOCIATION("duplicate_association"),
    ASSOCIATION_ERROR("association_error");

    private final String code;

    DetectionAction(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
