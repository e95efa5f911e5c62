package com.maildraft.interfaces.api.email;

import com.maildraft.application.email.EmailAppService;
import com.maildraft.domain.email.model.PipelineOutcome;
import com.maildraft.global.filter.CorrelationIdFilter;
import com.maildraft.interfaces.api.dto.EmailResponse;
import com.maildraft.interfaces.api.dto.GenerateEmailRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/emails")
@RequiredArgsConstructor
public class EmailController {

    private final EmailAppService emailAppService;

    @PostMapping("/generate")
    public ResponseEntity<EmailResponse> generate(@Valid @RequestBody GenerateEmailRequest request) {
        PipelineOutcome.Success success = emailAppService.generate(
                request.description(), MDC.get(CorrelationIdFilter.MDC_KEY));
        return ResponseEntity.ok(EmailResponse.from(success));
    }
}
