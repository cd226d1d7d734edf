package com.kmmedia.institute.payments.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmmedia.institute.payments.domain.PaymentRecord;
import com.kmmedia.institute.payments.service.InstallmentPlanTracker;
import com.kmmedia.institute.payments.service.PaymentInitiationService;
import com.kmmedia.institute.payments.service.PaymentRecordStore;
import com.kmmedia.institute.payments.service.RequestHashService;
import com.kmmedia.institute.payments.service.catalog.CourseCatalog;
import com.kmmedia.institute.payments.service.catalog.CourseFeeTerms;
import com.kmmedia.institute.payments.service.dto.IdempotentResult;
import com.kmmedia.institute.payments.error.PaymentErrorCode;
import com.kmmedia.institute.payments.error.PaymentException;
import com.kmmedia.institute.payments.web.caller.Caller;
import com.kmmedia.institute.payments.web.dto.CreatePlanRequest;
import com.kmmedia.institute.payments.web.dto.InitiatePaymentRequest;
import com.kmmedia.institute.payments.web.dto.InstallmentPlanResponse;
import com.kmmedia.institute.payments.web.dto.PaymentResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Student-facing payment API.
 */
@RestController
@RequestMapping("/payments")
public class PaymentsController {

    /** Header used to provide an idempotency key. */
    public static final String IDEMPOTENCY_KEY_HEADER = "X-Idempotency-Key";

    /** Header returned when the response was replayed. */
    public static final String IDEMPOTENCY_REPLAYED_HEADER = "X-Idempotency-Replayed";

    /** Header returning the request hash for debugging. */
    public static final String IDEMPOTENCY_REQUEST_HASH_HEADER = "X-Idempotency-Request-Hash";

    private static final int IDEMPOTENCY_KEY_MAX = 128;
    private static final Pattern IDEMPOTENCY_KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._:-]{1,128}$");

    private final PaymentInitiationService initiationService;
    private final PaymentRecordStore paymentRecordStore;
    private final InstallmentPlanTracker planTracker;
    private final CourseCatalog courseCatalog;
    private final RequestHashService requestHashService;
    private final ObjectMapper objectMapper;

    public PaymentsController(
            PaymentInitiationService initiationService,
            PaymentRecordStore paymentRecordStore,
            InstallmentPlanTracker planTracker,
            CourseCatalog courseCatalog,
            RequestHashService requestHashService,
            ObjectMapper objectMapper
    ) {
        this.initiationService = initiationService;
        this.paymentRecordStore = paymentRecordStore;
        this.planTracker = planTracker;
        this.courseCatalog = courseCatalog;
        this.requestHashService = requestHashService;
        this.objectMapper = objectMapper;
    }

    /**
     * Starts a gateway charge idempotently. Replays return the stored response unchanged.
     *
     * @param caller         authenticated student
     * @param idempotencyKey idempotency key (required)
     * @param request        request
     * @return stored or replayed response
     */
    @PostMapping(value = "/initialize", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> initialize(
            @RequestAttribute(name = Caller.ATTRIBUTE, required = false) Caller caller,
            @RequestHeader(name = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody InitiatePaymentRequest request
    ) {
        Caller student = Caller.require(caller);
        String normalizedKey = normalizeKeyOrThrow(idempotencyKey);

        IdempotentResult result = initiationService.initiate(student.userId(), normalizedKey, request);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(IDEMPOTENCY_KEY_HEADER, normalizedKey);
        headers.set(IDEMPOTENCY_REQUEST_HASH_HEADER, requestHashService.hash(request));
        if (result.replayed()) {
            headers.set(IDEMPOTENCY_REPLAYED_HEADER, "true");
        }

        ResponseEntity.BodyBuilder builder = ResponseEntity.status(result.httpStatus()).headers(headers);
        if (result.httpStatus() == HttpStatus.CREATED.value()) {
            builder.location(URI.create("/payments/" + referenceOf(result.responseBodyJson())));
        }
        return builder.body(result.responseBodyJson());
    }

    @GetMapping("/history")
    public List<PaymentResponse> history(@RequestAttribute(name = Caller.ATTRIBUTE, required = false) Caller caller) {
        Caller student = Caller.require(caller);
        return paymentRecordStore.listForUser(student.userId()).stream()
                .map(PaymentResponse::from)
                .toList();
    }

    @GetMapping("/{reference}")
    public PaymentResponse get(
            @RequestAttribute(name = Caller.ATTRIBUTE, required = false) Caller caller,
            @PathVariable String reference
    ) {
        Caller.require(caller);
        PaymentRecord record = paymentRecordStore.get(reference);
        Caller.requireOwnerOrAdmin(caller, record.getUserId());
        return PaymentResponse.from(record);
    }

    /**
     * Opens an installment plan for the caller. The total fee is the catalog course fee.
     */
    @PostMapping("/installment-plan")
    public ResponseEntity<InstallmentPlanResponse> createPlan(
            @RequestAttribute(name = Caller.ATTRIBUTE, required = false) Caller caller,
            @Valid @RequestBody CreatePlanRequest request
    ) {
        Caller student = Caller.require(caller);
        CourseFeeTerms terms = courseCatalog.feeTerms(request.courseId());
        if (!terms.installmentsOffered()) {
            throw PaymentException.of(PaymentErrorCode.INSTALLMENTS_NOT_OFFERED,
                    "Course " + request.courseId() + " does not offer installment plans");
        }
        InstallmentPlanResponse body = InstallmentPlanResponse.from(planTracker.createPlan(
                student.userId(), request.courseId(), terms.courseFee(), request.totalInstallments(), request.paymentPlan()));
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @GetMapping("/installment-plan/{courseId}")
    public InstallmentPlanResponse plan(
            @RequestAttribute(name = Caller.ATTRIBUTE, required = false) Caller caller,
            @PathVariable String courseId
    ) {
        Caller student = Caller.require(caller);
        return InstallmentPlanResponse.from(planTracker.findForStudent(student.userId(), courseId));
    }

    private String referenceOf(String responseJson) {
        try {
            return objectMapper.readTree(responseJson).path("reference").asText();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored initialization response is not valid JSON", e);
        }
    }

    private String normalizeKeyOrThrow(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ErrorResponseException(HttpStatus.BAD_REQUEST,
                    ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, "Missing " + IDEMPOTENCY_KEY_HEADER + " header"),
                    null);
        }
        String k = raw.trim();
        if (k.length() > IDEMPOTENCY_KEY_MAX || !IDEMPOTENCY_KEY_PATTERN.matcher(k).matches()) {
            throw new ErrorResponseException(HttpStatus.BAD_REQUEST,
                    ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST,
                            "Invalid " + IDEMPOTENCY_KEY_HEADER + ". Allowed: [A-Za-z0-9._:-], max length " + IDEMPOTENCY_KEY_MAX),
                    null);
        }
        return k;
    }
}
