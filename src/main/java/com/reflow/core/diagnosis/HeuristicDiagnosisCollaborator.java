package com.reflow.core.diagnosis;

import com.reflow.core.model.FaultLayer;
import com.reflow.core.model.StepError;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Locale;

/**
 * Offline stand-in for a reasoning model: keyword rules over the error kind and message.
 * <p>
 * One diagnosis in ten (chosen by an MD5 of task id, error kind and step index) is degraded
 * to {@code persistent} with confidence at most 0.55, so the heuristic is not an oracle.
 */
public class HeuristicDiagnosisCollaborator implements DiagnosisCollaborator {

    private static final double CONFIDENT = 0.85;
    private static final double UNSURE = 0.65;
    private static final double NOISY_CEILING = 0.55;
    private static final int MAX_TRANSIENT_RETRIES = 3;

    @Override
    public DiagnosisResponse diagnose(DiagnosisRequest request) {
        DiagnosisResponse proposal = propose(request);
        if (isNoisy(request)) {
            return new DiagnosisResponse(FaultLayer.PERSISTENT, proposal.action(),
                    Math.min(proposal.confidence(), NOISY_CEILING), proposal.reasoning() + " (low signal)");
        }
        return proposal;
    }

    private DiagnosisResponse propose(DiagnosisRequest request) {
        String kind = request.error().kind() == null ? "Unknown" : request.error().kind();
        switch (kind) {
            case "Timeout", "HTTP_500", "RateLimited" -> {
                if (request.retryCount() > MAX_TRANSIENT_RETRIES) {
                    return new DiagnosisResponse(FaultLayer.PERSISTENT, DiagnosisAction.ESCALATE, CONFIDENT,
                            kind + " keeps recurring after " + request.retryCount() + " attempts");
                }
                return new DiagnosisResponse(FaultLayer.TRANSIENT, DiagnosisAction.RETRY, CONFIDENT,
                        kind + " is transient, retry recommended");
            }
            case "Conflict" -> {
                return new DiagnosisResponse(FaultLayer.CASCADE, DiagnosisAction.ROLLBACK, CONFIDENT,
                        "Conflict indicates stale state, rollback and retry");
            }
            case "NotFound" -> {
                return new DiagnosisResponse(FaultLayer.PERSISTENT, DiagnosisAction.ESCALATE, CONFIDENT,
                        "NotFound likely persistent, escalation required");
            }
            case "AuthDenied", "PolicyRejected", "BadRequest" -> {
                return new DiagnosisResponse(FaultLayer.SEMANTIC, DiagnosisAction.ESCALATE, CONFIDENT,
                        kind + " requires escalation");
            }
            case "StateCorruption", "PartialFailure" -> {
                return new DiagnosisResponse(FaultLayer.CASCADE, DiagnosisAction.COMPENSATE, CONFIDENT,
                        kind + " left partial effects, compensate and escalate");
            }
            case StepError.POST_CONDITION_VIOLATED -> {
                if (request.retryCount() <= 1) {
                    return new DiagnosisResponse(FaultLayer.SEMANTIC, DiagnosisAction.RETRY, 0.72,
                            "Write acknowledged but not visible, one retry");
                }
                return new DiagnosisResponse(FaultLayer.SEMANTIC, DiagnosisAction.ESCALATE, CONFIDENT,
                        "Write repeatedly lost, escalation required");
            }
            default -> {
                return byKeywords(kind, request);
            }
        }
    }

    private DiagnosisResponse byKeywords(String kind, DiagnosisRequest request) {
        String text = (kind + " " + request.error().message() + " " + request.step().stepName())
                .toLowerCase(Locale.ROOT);
        if (containsAny(text, List.of("timeout", "http_500", "temporar", "throttle"))) {
            return new DiagnosisResponse(FaultLayer.TRANSIENT, DiagnosisAction.RETRY, UNSURE, kind + " looks transient");
        }
        if (containsAny(text, List.of("conflict", "rollback", "state"))) {
            return new DiagnosisResponse(FaultLayer.CASCADE, DiagnosisAction.ROLLBACK, UNSURE, kind + " looks cascade-like");
        }
        if (containsAny(text, List.of("auth", "policy", "badrequest", "validation"))) {
            return new DiagnosisResponse(FaultLayer.SEMANTIC, DiagnosisAction.ESCALATE, UNSURE, kind + " looks semantic");
        }
        return new DiagnosisResponse(FaultLayer.PERSISTENT, DiagnosisAction.ESCALATE, UNSURE, kind + " uncertain, escalating");
    }

    private static boolean containsAny(String text, List<String> tokens) {
        return tokens.stream().anyMatch(text::contains);
    }

    static boolean isNoisy(DiagnosisRequest request) {
        String seed = request.step().taskId() + ":" + request.error().kind() + ":" + request.step().stepIndex();
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(seed.getBytes(StandardCharsets.UTF_8));
            return new BigInteger(1, digest).mod(BigInteger.TEN).signum() == 0;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 unavailable", e);
        }
    }
}
