package com.maildraft.domain.email.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The four-field email record produced by extraction and checked by validation.
 */
public record EmailDraft(String subject, String greeting, String body, String closing) {

    public static final String SUBJECT = "subject";
    public static final String GREETING = "greeting";
    public static final String BODY = "body";
    public static final String CLOSING = "closing";

    /**
     * Fields in canonical order, keyed by their wire name.
     */
    public Map<String, String> fields() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(SUBJECT, subject);
        fields.put(GREETING, greeting);
        fields.put(BODY, body);
        fields.put(CLOSING, closing);
        return fields;
    }
}
