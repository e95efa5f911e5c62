package com.maildraft.application.email;

import com.maildraft.domain.email.model.PipelineOutcome;
import com.maildraft.domain.email.service.EmailDraftService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class EmailAppService {

    private final EmailDraftService emailDraftService;

    /**
     * Runs the drafting pipeline and returns the accepted draft.
     *
     * @throws EmailGenerationException when the pipeline ends in a typed failure
     */
    public PipelineOutcome.Success generate(String description, String correlationId) {
        PipelineOutcome outcome = emailDraftService.process(description, correlationId);
        if (outcome instanceof PipelineOutcome.Success success) {
            return success;
        }
        throw new EmailGenerationException((PipelineOutcome.Failure) outcome);
    }
}
