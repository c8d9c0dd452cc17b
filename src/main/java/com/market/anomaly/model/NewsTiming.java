package com.market.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * When an article was published relative to the anomaly it is linked to.
 */
public enum NewsTiming {
    BEFORE("before"),
    DURING("during"),
    AFTER("after");

    private final String code;

    NewsTiming(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Accepts the pipeline's stored tags (pre_event, post_event) as well as the API codes.
     *
     * @return null for a missing or unrecognised tag
     */
    public static NewsTiming fromTag(String tag) {
        if (tag == null) return null;
        switch (tag.trim().toLowerCase(Locale.ROOT)) {
            case "pre_event":
            case "before":
                return BEFORE;
            case "during":
                return DURING;
            case "post_event":
            case "after":
                return AFTER;
            default:
                return null;
        }
    }
}
