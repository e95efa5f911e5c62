package com.maildraft.infrastructure.ai.preprocessing;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Cleans a raw description before it is length-checked and classified:
 * NFC normalization, removal of invisible and control characters, and whitespace collapsing.
 * Line breaks survive (at most one blank line in a row) so multi-line descriptions keep their shape.
 */
@Component
public class TextNormalizer {

    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // Control characters except \n, \r, \t
    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]"
    );

    private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[ \\t\\u00A0\\u2007\\u202F]+");

    private static final Pattern SPACE_AROUND_NEWLINE = Pattern.compile(" ?\\n ?");

    private static final Pattern EXCESSIVE_NEWLINES = Pattern.compile("\\n{3,}");

    /**
     * @param text raw user input, may be null
     * @return normalized text, or null when the input was null
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        String result = Normalizer.normalize(text, Normalizer.Form.NFC);
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");
        result = CONTROL_CHARS.matcher(result).replaceAll("");
        result = result.replace("\r\n", "\n").replace('\r', '\n');
        result = HORIZONTAL_WHITESPACE.matcher(result).replaceAll(" ");
        result = SPACE_AROUND_NEWLINE.matcher(result).replaceAll("\n");
        result = EXCESSIVE_NEWLINES.matcher(result).replaceAll("\n\n");

        return result.strip();
    }
}
