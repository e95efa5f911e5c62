package com.maildraft.infrastructure.ai.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.maildraft.domain.email.exception.MalformedOutputException;
import com.maildraft.domain.email.model.EmailDraft;
import com.maildraft.domain.email.model.GeneratedText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Recovers the four-field email record from free-form generated text.
 * <p>
 * Every {@code '{'} position is paired with every later {@code '}'} position (start ascending, then
 * end ascending) and each candidate is parsed strictly. The first candidate that is a JSON object
 * whose {@code subject}, {@code greeting}, {@code body} and {@code closing} are all JSON strings wins;
 * other fields are ignored. Prose around the record and malformed fragments before it are skipped.
 * A record that is an element of a JSON array is a {@code NON_RECORD_SHAPE}, wherever the array sits.
 * </p>
 */
@Slf4j
@Component
public class StructuredExtractor {

    static final int MAX_CANDIDATES = 10_000;

    private static final List<String> REQUIRED_FIELDS = List.of(
            EmailDraft.SUBJECT, EmailDraft.GREETING, EmailDraft.BODY, EmailDraft.CLOSING);

    private final ObjectReader strictReader;

    public StructuredExtractor(ObjectMapper objectMapper) {
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public EmailDraft extract(GeneratedText generated) {
        String text = generated == null ? null : generated.content();
        if (text == null || text.isBlank()) {
            throw new MalformedOutputException("EMPTY_OUTPUT", "Generated output is empty");
        }

        String trimmed = text.strip();
        if (trimmed.startsWith("[") && isJsonArray(trimmed)) {
            throw new MalformedOutputException("NON_RECORD_SHAPE", "Generated output is a JSON array, not a record");
        }

        List<Integer> starts = positionsOf(text, '{');
        List<Integer> ends = positionsOf(text, '}');

        int tried = 0;
        for (int start : starts) {
            for (int end : ends) {
                if (end <= start) {
                    continue;
                }
                if (++tried > MAX_CANDIDATES) {
                    log.warn("[Extraction] Candidate cap {} reached without a usable record", MAX_CANDIDATES);
                    throw new MalformedOutputException("NO_RECORD_FOUND", "No email record found in generated output");
                }
                EmailDraft draft = tryParse(text.substring(start, end + 1));
                if (draft != null) {
                    if (insideArray(text, start, end)) {
                        log.warn("[Extraction] Record at [{}, {}] is an element of a JSON array", start, end);
                        throw new MalformedOutputException("NON_RECORD_SHAPE",
                                "Generated output is a JSON array, not a record");
                    }
                    log.debug("[Extraction] Record found at [{}, {}] after {} candidates", start, end, tried);
                    return draft;
                }
            }
        }

        log.warn("[Extraction] No usable record among {} candidates (output length={})", tried, text.length());
        throw new MalformedOutputException("NO_RECORD_FOUND", "No email record found in generated output");
    }

    private EmailDraft tryParse(String candidate) {
        JsonNode node;
        try {
            node = strictReader.readTree(candidate);
        } catch (JsonProcessingException e) {
            return null;
        }
        if (node == null || !node.isObject()) {
            return null;
        }
        for (String field : REQUIRED_FIELDS) {
            JsonNode value = node.get(field);
            if (value == null || !value.isTextual()) {
                return null;
            }
        }
        return new EmailDraft(
                node.get(EmailDraft.SUBJECT).textValue(),
                node.get(EmailDraft.GREETING).textValue(),
                node.get(EmailDraft.BODY).textValue(),
                node.get(EmailDraft.CLOSING).textValue());
    }

    /**
     * True when some {@code '['}...{@code ']'} span enclosing the record parses strictly as a JSON array.
     */
    private boolean insideArray(String text, int recordStart, int recordEnd) {
        int tried = 0;
        for (int open = recordStart - 1; open >= 0; open--) {
            if (text.charAt(open) != '[') {
                continue;
            }
            for (int close = recordEnd + 1; close < text.length(); close++) {
                if (text.charAt(close) != ']') {
                    continue;
                }
                if (++tried > MAX_CANDIDATES) {
                    return false;
                }
                if (isJsonArray(text.substring(open, close + 1))) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean isJsonArray(String candidate) {
        try {
            JsonNode node = strictReader.readTree(candidate);
            return node != null && node.isArray();
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    private static List<Integer> positionsOf(String text, char c) {
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                positions.add(i);
            }
        }
        return positions;
    }
}
