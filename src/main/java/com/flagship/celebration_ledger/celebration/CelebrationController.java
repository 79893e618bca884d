package com.flagship.celebration_ledger.celebration;

import com.flagship.celebration_ledger.celebration.dto.CelebrationResponse;
import com.flagship.celebration_ledger.celebration.dto.CreateCelebrationRequest;
import com.flagship.celebration_ledger.celebration.dto.StatusHistoryResponse;
import com.flagship.celebration_ledger.celebration.dto.StatusResponse;
import com.flagship.celebration_ledger.celebration.dto.TransitionRequest;
import com.flagship.celebration_ledger.celebration.exception.GlobalExceptionHandler.ErrorResponse;
import com.flagship.celebration_ledger.compliance.ContributorProfile;
import com.flagship.celebration_ledger.observability.CelebrationMetrics;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpSession;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * REST Controller for celebrations.
 *
 * Creation is idempotent on the Idempotency-Key header: a replay returns the
 * original celebration with 200 instead of 201. Status changes go through
 * {@link CelebrationTransitionService}, which owns conflict retries.
 */
@RestController
@RequestMapping("/api/celebrations")
@RequiredArgsConstructor
@Slf4j
public class CelebrationController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final ContributionIntakeService intakeService;
    private final CelebrationTransitionService transitionService;
    private final CelebrationQueryService queryService;
    private final CelebrationMetrics metrics;

    @PostMapping
    public ResponseEntity<CelebrationResponse> createCelebration(
            @Valid @RequestBody CreateCelebrationRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            HttpServletRequest httpRequest) {

        long startTime = System.currentTimeMillis();
        log.info("Received celebration request: idempotencyKey={}, recipient={}, amount={}",
                idempotencyKey, request.getRecipientId(), request.getAmount());

        CreateCelebrationCommand command = CreateCelebrationCommand.builder()
                .idempotencyKey(idempotencyKey)
                .contributorId(request.getContributorId())
                .recipientId(request.getRecipientId())
                .recipientJurisdiction(request.getRecipientJurisdiction())
                .conditionId(request.getConditionId())
                .amount(request.getAmount())
                .tip(request.getTip())
                .processingFee(request.getProcessingFee())
                .profile(request.getDonor() != null ? request.getDonor().toProfile() : ContributorProfile.empty())
                .trigger(TransitionTrigger.builder()
                        .triggeredBy(TriggeredBy.USER)
                        .id(request.getContributorId())
                        .auditTrail(auditTrailOf(httpRequest))
                        .build())
                .build();

        IntakeResult result = intakeService.create(command);
        metrics.recordLatency("create", System.currentTimeMillis() - startTime);

        CelebrationResponse body = CelebrationResponse.from(result.getRecord());
        return result.isCreated()
                ? ResponseEntity.status(HttpStatus.CREATED).body(body)
                : ResponseEntity.ok(body);
    }

    @GetMapping("/{id}")
    public ResponseEntity<CelebrationResponse> getCelebration(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(CelebrationResponse.from(queryService.getRecord(id)));
    }

    @GetMapping("/{id}/status")
    public ResponseEntity<StatusResponse> getStatus(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(new StatusResponse(id, queryService.getCurrentStatus(id)));
    }

    @GetMapping("/{id}/history")
    public ResponseEntity<StatusHistoryResponse> getHistory(
            @PathVariable("id") UUID id,
            @RequestParam(value = "limit", defaultValue = "10") int limit) {
        return ResponseEntity.ok(StatusHistoryResponse.from(queryService.getStatusHistory(id, limit)));
    }

    /**
     * Requests a status change.
     *
     * 200 with the updated celebration on success; otherwise 404 for an
     * unknown id, 409 for a move the current status does not allow or a
     * conflict that outlasted the retries, 422 when reactivation would break
     * a limit, 503 when the limit cannot be determined.
     */
    @PostMapping("/{id}/transitions")
    public ResponseEntity<?> requestTransition(
            @PathVariable("id") UUID id,
            @Valid @RequestBody TransitionRequest request,
            HttpServletRequest httpRequest) {

        MDC.put("targetStatus", request.getTargetStatus().name());
        try {
            TransitionTrigger trigger = TransitionTrigger.builder()
                    .triggeredBy(request.getTriggeredBy())
                    .id(request.getTriggeredById())
                    .name(request.getTriggeredByName())
                    .auditTrail(auditTrailOf(httpRequest))
                    .build();

            TransitionResult result = transitionService.requestTransition(id, request.getTargetStatus(),
                    request.getReason(), trigger,
                    request.getMetadata() != null ? request.getMetadata().toMetadata(request.getTargetStatus()) : null);

            if (result.isSuccess()) {
                return ResponseEntity.ok(CelebrationResponse.from(result.getRecord()));
            }
            return failureResponse(result);
        } finally {
            MDC.remove("targetStatus");
        }
    }

    private ResponseEntity<ErrorResponse> failureResponse(TransitionResult result) {
        HttpStatus status = switch (result.getError()) {
            case UNKNOWN_RECORD -> HttpStatus.NOT_FOUND;
            case INVALID_TRANSITION, CONCURRENT_MODIFICATION -> HttpStatus.CONFLICT;
            case LIMIT_EXCEEDED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case LIMIT_UNDETERMINED -> HttpStatus.SERVICE_UNAVAILABLE;
        };

        Map<String, String> details = new HashMap<>();
        details.put("code", result.getError().name());
        details.put("retryable", String.valueOf(result.getError().isRetryable()));
        if (result.getRecord() != null) {
            details.put("current_status", result.getRecord().getCurrentStatus().name());
        }

        ErrorResponse body = ErrorResponse.builder()
            .error("Transition Failed")
            .message(result.getMessage())
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }

    private static AuditTrail auditTrailOf(HttpServletRequest request) {
        HttpSession session = request.getSession(false);
        return new AuditTrail(
                request.getRemoteAddr(),
                request.getHeader(HttpHeaders.USER_AGENT),
                session != null ? session.getId() : null);
    }
}
