package com.kmmedia.institute.payments.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmmedia.institute.payments.config.AppProperties;
import com.kmmedia.institute.payments.service.WebhookReconciler;
import com.kmmedia.institute.payments.service.dto.WebhookEvent;
import com.kmmedia.institute.payments.service.dto.WebhookOutcome;
import com.kmmedia.institute.payments.service.gateway.WebhookSignatureVerifier;
import com.kmmedia.institute.payments.web.dto.WebhookRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validator;
import java.io.IOException;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Gateway callbacks.
 *
 * <p>The body is taken raw because the signature covers the exact bytes sent; it is parsed and
 * validated only after the signature checks out.</p>
 */
@Slf4j
@RestController
@RequestMapping("/payments/webhook")
public class WebhookController {

    private final WebhookSignatureVerifier signatureVerifier;
    private final WebhookReconciler reconciler;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    public WebhookController(
            WebhookSignatureVerifier signatureVerifier,
            WebhookReconciler reconciler,
            ObjectMapper objectMapper,
            Validator validator
    ) {
        this.signatureVerifier = signatureVerifier;
        this.reconciler = reconciler;
        this.objectMapper = objectMapper;
        this.validator = validator;
    }

    /**
     * Handles one gateway event. 200 covers applied events, replays and pending acknowledgements;
     * everything else is an error status so the gateway or an operator follows up.
     *
     * @param gateway     gateway name, must be configured under {@code app.gateways}
     * @param body        raw body
     * @param httpRequest servlet request, for the gateway's signature header
     * @return outcome
     */
    @PostMapping(value = "/{gateway}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public WebhookOutcome handle(@PathVariable String gateway, @RequestBody byte[] body, HttpServletRequest httpRequest) {
        AppProperties.Gateway config = signatureVerifier.gateway(gateway);
        signatureVerifier.verify(gateway, body, httpRequest.getHeader(config.getSignatureHeader()));

        WebhookRequest request = parse(body);
        return reconciler.handle(new WebhookEvent(
                gateway,
                request.reference().trim(),
                request.status(),
                request.amount(),
                request.currency().trim(),
                request.metadata() == null || request.metadata().isNull() ? null : request.metadata().toString()
        ));
    }

    private WebhookRequest parse(byte[] body) {
        WebhookRequest request;
        try {
            request = objectMapper.readValue(body, WebhookRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed webhook body: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new IllegalArgumentException("Unreadable webhook body", e);
        }
        if (request == null) {
            throw new IllegalArgumentException("Webhook body is empty");
        }
        Set<ConstraintViolation<WebhookRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException(violations);
        }
        return request;
    }
}
