package com.maildraft.infrastructure.ai.validation;

import com.maildraft.domain.email.model.ControlRecord;
import com.maildraft.domain.email.model.EmailDraft;
import com.maildraft.domain.email.model.Tone;
import com.maildraft.domain.email.model.ValidationIssue;
import com.maildraft.domain.email.model.ValidationIssue.Severity;
import com.maildraft.domain.email.model.ValidationIssueType;
import com.maildraft.domain.email.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based validator for extracted email drafts.
 * Layers run in order (length, placeholder, structure, tone, sensitive data, consistency) and
 * validation stops at the first layer that reports an ERROR. WARNING issues are returned as suppressed
 * findings and never reject the draft.
 */
@Slf4j
@Component
public class OutputValidator {

    // Layer 1: field lengths (after trim)
    static final int SUBJECT_MIN = 3;
    static final int SUBJECT_MAX = 150;
    static final int GREETING_MAX = 50;
    static final int BODY_MIN = 20;
    static final int BODY_MAX = 1000;
    static final int CLOSING_MAX = 50;

    // Layer 2: placeholders
    private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile(
            "\\[[^\\[\\]]*\\]|\\{[^{}]*\\}|<[^<>]*>|_{3,}");

    static final Set<String> WHITELISTED_PLACEHOLDERS = Set.of(
            "[your name]", "[name]", "[recipient name]", "[date]");

    // Layer 4: tone
    private static final Pattern HOSTILE_PATTERN = Pattern.compile(
            "\\b(stupid|idiot(?:s|ic)?|incompetent|useless|pathetic|ridiculous|shut up|"
                    + "damn|hell|disgrace(?:ful)?|i demand|you people|how dare)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern INFORMAL_PATTERN = Pattern.compile(
            "\\b(hey|hiya|yo|lol|lmao|omg|btw|thx|pls|plz|gonna|wanna|gotta|kinda|dude|cheers mate|asap)\\b"
                    + "|:\\)|:\\(|:D|;\\)|xoxo",
            Pattern.CASE_INSENSITIVE);

    static final double UPPERCASE_RATIO_LIMIT = 0.30;
    static final int UPPERCASE_MIN_LETTERS = 4;
    static final int EXCLAMATION_LIMIT = 2;

    // Layer 5: sensitive patterns
    private static final Pattern GOVERNMENT_ID_PATTERN = Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b");
    private static final Pattern CARD_CANDIDATE_PATTERN = Pattern.compile("\\b\\d(?:[ -]?\\d){12,18}\\b");
    private static final Pattern EMAIL_PATTERN = Pattern.compile(
            "[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");

    // Layer 6: consistency
    static final int HIGH_TIER_BODY_MIN = 60;

    private final List<BiConsumer<Context, List<ValidationIssue>>> layers = List.of(
            this::checkLengths,
            this::checkPlaceholders,
            this::checkStructure,
            this::checkTone,
            this::checkSensitiveData,
            this::checkConsistency
    );

    private record Context(EmailDraft draft, ControlRecord control) {
    }

    public ValidationResult validate(EmailDraft draft, ControlRecord control) {
        List<ValidationIssue> issues = new ArrayList<>();
        Context context = new Context(draft, control);

        for (BiConsumer<Context, List<ValidationIssue>> layer : layers) {
            layer.accept(context, issues);
            if (issues.stream().anyMatch(i -> i.severity() == Severity.ERROR)) {
                break;
            }
        }

        ValidationResult result = ValidationResult.of(issues);
        if (!issues.isEmpty()) {
            log.info("Validation completed: passed={}, {} issues ({} warnings){}",
                    result.passed(), issues.size(), result.warnings().size(),
                    result.rejection().map(r -> ", rejected by " + r.type()).orElse(""));
        }
        return result;
    }

    // Layer 1: length
    private void checkLengths(Context context, List<ValidationIssue> issues) {
        EmailDraft draft = context.draft();
        checkLength(EmailDraft.SUBJECT, draft.subject(), SUBJECT_MIN, SUBJECT_MAX, ValidationIssueType.SUBJECT_LENGTH, issues);
        checkLength(EmailDraft.GREETING, draft.greeting(), 1, GREETING_MAX, ValidationIssueType.GREETING_LENGTH, issues);
        checkLength(EmailDraft.BODY, draft.body(), BODY_MIN, BODY_MAX, ValidationIssueType.BODY_LENGTH, issues);
        checkLength(EmailDraft.CLOSING, draft.closing(), 1, CLOSING_MAX, ValidationIssueType.CLOSING_LENGTH, issues);
    }

    private void checkLength(String field, String value, int min, int max,
                             ValidationIssueType type, List<ValidationIssue> issues) {
        String trimmed = value == null ? "" : value.strip();
        if (trimmed.isEmpty()) {
            issues.add(new ValidationIssue(ValidationIssueType.EMPTY_FIELD, Severity.ERROR, field,
                    "Field '" + field + "' is empty", null));
            return;
        }
        int length = trimmed.length();
        if (length < min || length > max) {
            issues.add(new ValidationIssue(type, Severity.ERROR, field,
                    "Field '" + field + "' has " + length + " characters, expected " + min + "-" + max, null));
        }
    }

    // Layer 2: placeholders
    private void checkPlaceholders(Context context, List<ValidationIssue> issues) {
        boolean lowTier = !context.control().isHighConfidence();
        for (Map.Entry<String, String> field : context.draft().fields().entrySet()) {
            Matcher matcher = PLACEHOLDER_PATTERN.matcher(field.getValue());
            while (matcher.find()) {
                String found = matcher.group();
                boolean whitelisted = WHITELISTED_PLACEHOLDERS.contains(found.toLowerCase(Locale.ROOT));
                if (whitelisted && lowTier) {
                    issues.add(new ValidationIssue(ValidationIssueType.WHITELISTED_PLACEHOLDER, Severity.WARNING,
                            field.getKey(), "Generic placeholder accepted: \"" + found + "\"", found));
                } else {
                    issues.add(new ValidationIssue(ValidationIssueType.PLACEHOLDER, Severity.ERROR,
                            field.getKey(), "Placeholder detected: \"" + found + "\"", found));
                }
            }
        }
    }

    // Layer 3: structure
    private void checkStructure(Context context, List<ValidationIssue> issues) {
        for (Map.Entry<String, String> field : context.draft().fields().entrySet()) {
            String value = field.getValue();

            long straightQuotes = value.chars().filter(c -> c == '"').count();
            long openingCurly = value.chars().filter(c -> c == '“').count();
            long closingCurly = value.chars().filter(c -> c == '”').count();
            if (straightQuotes % 2 != 0 || openingCurly != closingCurly) {
                issues.add(new ValidationIssue(ValidationIssueType.UNBALANCED_QUOTES, Severity.ERROR,
                        field.getKey(), "Unbalanced quotation marks in '" + field.getKey() + "'", null));
            }

            if (!bracketsBalanced(value)) {
                issues.add(new ValidationIssue(ValidationIssueType.UNBALANCED_BRACKETS, Severity.ERROR,
                        field.getKey(), "Unbalanced brackets in '" + field.getKey() + "'", null));
            }
        }
    }

    static boolean bracketsBalanced(String value) {
        Deque<Character> stack = new ArrayDeque<>();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '(', '[', '{' -> stack.push(c);
                case ')', ']', '}' -> {
                    if (stack.isEmpty() || stack.pop() != opening(c)) {
                        return false;
                    }
                }
                default -> {
                }
            }
        }
        return stack.isEmpty();
    }

    private static char opening(char closing) {
        return switch (closing) {
            case ')' -> '(';
            case ']' -> '[';
            default -> '{';
        };
    }

    // Layer 4: tone
    private void checkTone(Context context, List<ValidationIssue> issues) {
        boolean formal = context.control().tone() == Tone.FORMAL;

        for (Map.Entry<String, String> field : context.draft().fields().entrySet()) {
            String value = field.getValue();

            Matcher hostile = HOSTILE_PATTERN.matcher(value);
            if (hostile.find()) {
                issues.add(new ValidationIssue(ValidationIssueType.HOSTILE_LANGUAGE, Severity.ERROR,
                        field.getKey(), "Hostile or demanding language: \"" + hostile.group() + "\"", hostile.group()));
            }

            if (!formal) {
                continue;
            }

            Matcher informal = INFORMAL_PATTERN.matcher(value);
            if (informal.find()) {
                issues.add(new ValidationIssue(ValidationIssueType.INFORMAL_MARKER, Severity.ERROR,
                        field.getKey(), "Informal marker in formal email: \"" + informal.group() + "\"", informal.group()));
            }

            long letters = value.chars().filter(Character::isLetter).count();
            if (letters >= UPPERCASE_MIN_LETTERS) {
                double ratio = (double) shoutedCapitals(value) / letters;
                if (ratio > UPPERCASE_RATIO_LIMIT) {
                    issues.add(new ValidationIssue(ValidationIssueType.EXCESSIVE_UPPERCASE, Severity.ERROR,
                            field.getKey(), String.format(Locale.ROOT,
                            "Uppercase ratio %.0f%% in '%s' exceeds %.0f%%", ratio * 100, field.getKey(),
                            UPPERCASE_RATIO_LIMIT * 100), null));
                }
            }

            long exclamations = value.chars().filter(c -> c == '!').count();
            if (exclamations > EXCLAMATION_LIMIT) {
                issues.add(new ValidationIssue(ValidationIssueType.EXCESSIVE_EXCLAMATION, Severity.ERROR,
                        field.getKey(), exclamations + " exclamation marks in '" + field.getKey() + "'", null));
            }
        }
    }

    /**
     * Counts uppercase letters that follow another letter. Word-initial capitals (names, title case)
     * are not counted, so "Dear HR Team," scores 1 while "PLEASE SEND" scores 8.
     */
    static int shoutedCapitals(String value) {
        int count = 0;
        for (int i = 1; i < value.length(); i++) {
            if (Character.isUpperCase(value.charAt(i)) && Character.isLetter(value.charAt(i - 1))) {
                count++;
            }
        }
        return count;
    }

    // Layer 5: sensitive data
    private void checkSensitiveData(Context context, List<ValidationIssue> issues) {
        Set<String> addresses = new LinkedHashSet<>();

        for (Map.Entry<String, String> field : context.draft().fields().entrySet()) {
            String value = field.getValue();

            Matcher governmentId = GOVERNMENT_ID_PATTERN.matcher(value);
            if (governmentId.find()) {
                issues.add(new ValidationIssue(ValidationIssueType.GOVERNMENT_ID, Severity.ERROR,
                        field.getKey(), "Identification number detected", null));
            }

            Matcher card = CARD_CANDIDATE_PATTERN.matcher(value);
            while (card.find()) {
                String digits = card.group().replaceAll("[ -]", "");
                if (digits.length() >= 13 && digits.length() <= 19 && luhnValid(digits)) {
                    issues.add(new ValidationIssue(ValidationIssueType.PAYMENT_CARD, Severity.ERROR,
                            field.getKey(), "Payment card number detected", null));
                    break;
                }
            }

            Matcher email = EMAIL_PATTERN.matcher(value);
            while (email.find()) {
                addresses.add(email.group().toLowerCase(Locale.ROOT));
            }
        }

        if (addresses.size() > 1) {
            issues.add(new ValidationIssue(ValidationIssueType.MULTIPLE_CONTACT_ADDRESSES, Severity.ERROR,
                    null, addresses.size() + " different e-mail addresses in draft", null));
        }
    }

    static boolean luhnValid(String digits) {
        int sum = 0;
        boolean doubleIt = false;
        for (int i = digits.length() - 1; i >= 0; i--) {
            int d = digits.charAt(i) - '0';
            if (doubleIt) {
                d *= 2;
                if (d > 9) {
                    d -= 9;
                }
            }
            sum += d;
            doubleIt = !doubleIt;
        }
        return sum % 10 == 0;
    }

    // Layer 6: consistency with the control record
    private void checkConsistency(Context context, List<ValidationIssue> issues) {
        if (!context.control().isHighConfidence()) {
            return;
        }
        int bodyLength = context.draft().body().strip().length();
        if (bodyLength < HIGH_TIER_BODY_MIN) {
            issues.add(new ValidationIssue(ValidationIssueType.BODY_TOO_THIN, Severity.ERROR, EmailDraft.BODY,
                    "Body has " + bodyLength + " characters, too thin for a resolved intent", null));
        }
    }
}
