package com.maildraft.infrastructure.ai.generation.fallback;

import com.maildraft.domain.email.model.EmailDraft;

/**
 * Static email record used when the generation service cannot be reached.
 */
public record FallbackTemplate(String domain, String subject, String greeting, String body, String closing) {

    public EmailDraft toDraft() {
        return new EmailDraft(subject, greeting, body, closing);
    }
}
