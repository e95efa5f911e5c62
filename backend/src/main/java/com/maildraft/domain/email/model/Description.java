package com.maildraft.domain.email.model;

import com.maildraft.domain.email.exception.InputRejectedException;

/**
 * User-supplied description of the email to write. Trimmed and bounds-checked on creation.
 */
public record Description(String content) {

    public static final int MIN_LENGTH = 10;
    public static final int MAX_LENGTH = 500;

    public Description {
        if (content == null) {
            throw new InputRejectedException("DESCRIPTION_MISSING", "Description is required");
        }
        content = content.strip();
        if (content.length() < MIN_LENGTH) {
            throw new InputRejectedException("DESCRIPTION_TOO_SHORT",
                    String.format("Description must be at least %d characters", MIN_LENGTH));
        }
        if (content.length() > MAX_LENGTH) {
            throw new InputRejectedException("DESCRIPTION_TOO_LONG",
                    String.format("Description must not exceed %d characters", MAX_LENGTH));
        }
    }

    public static Description of(String raw) {
        return new Description(raw);
    }

    public int length() {
        return content.length();
    }
}
