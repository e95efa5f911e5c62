package com.maildraft.infrastructure.ai.control;

import com.maildraft.domain.email.model.LengthTarget;
import com.maildraft.domain.email.model.Tone;

/**
 * Row of the label lookup table: who writes to whom, in which domain and register.
 */
public record RoleProfile(String senderRole, String recipientRole, String domain, Tone tone, LengthTarget lengthTarget) {}
