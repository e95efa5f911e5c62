package com.maildraft.application.email;

import com.maildraft.domain.email.model.ConfidenceTier;
import com.maildraft.domain.email.model.DraftMetadata;
import com.maildraft.domain.email.model.EmailDraft;
import com.maildraft.domain.email.model.FailureKind;
import com.maildraft.domain.email.model.PipelineOutcome;
import com.maildraft.domain.email.service.EmailDraftService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmailAppServiceTest {

    @Mock
    private EmailDraftService emailDraftService;

    @InjectMocks
    private EmailAppService emailAppService;

    @Test
    @DisplayName("success outcome is returned")
    void success() {
        PipelineOutcome.Success success = new PipelineOutcome.Success("id",
                new EmailDraft("Subject", "Hello,", "A body that is long enough to pass.", "Regards,"),
                new DraftMetadata("general", 0.3, ConfidenceTier.LOW, false, 1, false, List.of()));
        when(emailDraftService.process("description text", "id")).thenReturn(success);

        assertThat(emailAppService.generate("description text", "id")).isSameAs(success);
    }

    @Test
    @DisplayName("failure outcome is raised with its details")
    void failure() {
        PipelineOutcome.Failure failure = new PipelineOutcome.Failure("id", FailureKind.OUTPUT_REJECTED,
                "LENGTH.BODY_LENGTH", "Body too short");
        when(emailDraftService.process("description text", "id")).thenReturn(failure);

        assertThatThrownBy(() -> emailAppService.generate("description text", "id"))
                .isInstanceOf(EmailGenerationException.class)
                .hasMessage("Body too short")
                .satisfies(e -> assertThat(((EmailGenerationException) e).getFailure()).isSameAs(failure));
    }
}
