package com.maildraft.infrastructure.ai.generation.fallback;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Domain-keyed fallback templates. Lookups for an unknown domain fall back to {@code general}.
 * Template text carries no placeholders and invents no facts, so it passes output validation
 * under either confidence tier.
 */
@Component
public class FallbackTemplateRegistry {

    public static final String GENERAL = "general";

    private final Map<String, FallbackTemplate> templates = new LinkedHashMap<>();

    public FallbackTemplateRegistry() {
        register(new FallbackTemplate(GENERAL,
                "Following up on my request",
                "Hello,",
                "I am writing to follow up on the matter I described earlier. "
                        + "I would appreciate it if you could look into it when you have a moment "
                        + "and let me know how we should proceed. Thank you for your time.",
                "Kind regards,"));

        register(new FallbackTemplate("education",
                "Request regarding my enquiry",
                "Dear Sir or Madam,",
                "I am writing regarding an academic matter that needs your attention. "
                        + "I would be grateful if you could review my enquiry and advise me on the next steps. "
                        + "Please let me know if any further information is required from my side.",
                "Yours sincerely,"));

        register(new FallbackTemplate("hr",
                "Request for assistance from HR",
                "Dear HR Team,",
                "I am writing to request your assistance with an employment-related matter. "
                        + "Could you please review my request and let me know the applicable process? "
                        + "I am happy to provide any additional details you may need.",
                "Best regards,"));

        register(new FallbackTemplate("corporate",
                "Update on current work",
                "Hello,",
                "I would like to share a brief update and discuss the next steps on my current work. "
                        + "Please let me know a convenient time to talk, or reply with any guidance you would like me to follow.",
                "Best regards,"));

        register(new FallbackTemplate("recruitment",
                "Regarding your application",
                "Dear Candidate,",
                "Thank you for your interest and for the time you have invested in the application process. "
                        + "We are reviewing the next steps and will contact you with further information as soon as possible.",
                "Kind regards,"));

        register(new FallbackTemplate("business",
                "Following up on our discussion",
                "Dear Client,",
                "Thank you for your continued cooperation. "
                        + "I am writing to follow up on our recent discussion and to confirm how we can best support you. "
                        + "Please let us know if you have any questions.",
                "Kind regards,"));

        register(new FallbackTemplate("consulting",
                "Follow-up on advisory matters",
                "Dear Sir or Madam,",
                "I am writing to follow up on the advisory matters we have been discussing. "
                        + "I would welcome the opportunity to review the current situation with you and to agree on the next steps. "
                        + "Please let me know a suitable time for a conversation.",
                "Yours sincerely,"));
    }

    private void register(FallbackTemplate template) {
        templates.put(template.domain(), template);
    }

    /**
     * Template for the domain, or the general template when the domain has none.
     */
    public Optional<FallbackTemplate> find(String domain) {
        FallbackTemplate template = domain == null ? null : templates.get(domain);
        if (template == null) {
            template = templates.get(GENERAL);
        }
        return Optional.ofNullable(template);
    }

    public Map<String, FallbackTemplate> getAll() {
        return Collections.unmodifiableMap(templates);
    }
}
