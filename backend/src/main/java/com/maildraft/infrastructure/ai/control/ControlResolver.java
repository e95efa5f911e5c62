package com.maildraft.infrastructure.ai.control;

import com.maildraft.domain.email.model.ClassificationResult;
import com.maildraft.domain.email.model.ConfidenceTier;
import com.maildraft.domain.email.model.ControlRecord;
import com.maildraft.domain.email.model.LengthTarget;
import com.maildraft.domain.email.model.Tone;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves a classification into a fully-populated {@link ControlRecord}.
 * New intents are supported by adding a row to the lookup table, nowhere else.
 */
@Slf4j
@Component
public class ControlResolver {

    /**
     * Tier is HIGH only when the confidence strictly exceeds this value; a score equal to the
     * threshold resolves to LOW.
     */
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.6;

    private static final RoleProfile GENERAL =
            new RoleProfile("individual", "recipient", "general", Tone.NEUTRAL, LengthTarget.MEDIUM);

    private static final Map<String, RoleProfile> PROFILES;

    static {
        Map<String, RoleProfile> profiles = new LinkedHashMap<>();
        profiles.put(ClassificationResult.DEFAULT_LABEL, GENERAL);
        profiles.put("student_to_institution",
                new RoleProfile("student", "college administration", "education", Tone.FORMAL, LengthTarget.MEDIUM));
        profiles.put("institution_to_student",
                new RoleProfile("institute administration", "student", "education", Tone.FORMAL, LengthTarget.MEDIUM));
        profiles.put("employee_to_hr",
                new RoleProfile("employee", "HR department", "hr", Tone.FORMAL, LengthTarget.MEDIUM));
        profiles.put("employee_to_manager",
                new RoleProfile("employee", "manager", "corporate", Tone.FORMAL, LengthTarget.SHORT));
        profiles.put("hr_to_candidate",
                new RoleProfile("HR team", "candidate", "recruitment", Tone.FORMAL, LengthTarget.MEDIUM));
        profiles.put("business_to_client",
                new RoleProfile("company representative", "client", "business", Tone.FORMAL, LengthTarget.MEDIUM));
        profiles.put("parent_to_teacher",
                new RoleProfile("parent", "teacher", "education", Tone.FORMAL, LengthTarget.SHORT));
        profiles.put("advisor_to_institution",
                new RoleProfile("consultant", "institution leadership", "consulting", Tone.FORMAL, LengthTarget.LONG));
        PROFILES = Collections.unmodifiableMap(profiles);
    }

    private final double confidenceThreshold;

    public ControlResolver(@Value("${pipeline.confidence-threshold:0.6}") double confidenceThreshold) {
        if (confidenceThreshold < 0.0 || confidenceThreshold > 1.0) {
            throw new IllegalArgumentException("confidence threshold must be within [0, 1]: " + confidenceThreshold);
        }
        this.confidenceThreshold = confidenceThreshold;
    }

    public ControlRecord resolve(ClassificationResult classification) {
        ClassificationResult result = classification != null ? classification : ClassificationResult.fallback();

        RoleProfile profile = PROFILES.get(result.label());
        String intent = result.label();
        if (profile == null) {
            log.warn("No role profile for intent '{}', using '{}'", result.label(), ClassificationResult.DEFAULT_LABEL);
            profile = GENERAL;
            intent = ClassificationResult.DEFAULT_LABEL;
        }

        ConfidenceTier tier = result.confidence() > confidenceThreshold ? ConfidenceTier.HIGH : ConfidenceTier.LOW;

        return new ControlRecord(
                profile.senderRole(),
                profile.recipientRole(),
                profile.tone(),
                profile.lengthTarget(),
                profile.domain(),
                intent,
                tier,
                result.confidence()
        );
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public static Set<String> knownIntents() {
        return PROFILES.keySet();
    }

    public static Set<String> knownDomains() {
        return PROFILES.values().stream().map(RoleProfile::domain).collect(Collectors.toUnmodifiableSet());
    }
}
