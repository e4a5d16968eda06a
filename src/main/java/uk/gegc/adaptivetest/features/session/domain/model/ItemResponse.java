package uk.gegc.adaptivetest.features.session.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * One scored answer with the ability snapshot taken right after it.
 * Topic and difficulty are copied from the item at answer time.
 */
public record ItemResponse(
        String itemId,
        int sequenceNumber,
        String topic,
        double difficulty,
        JsonNode answer,
        boolean correct,
        Double responseTimeSeconds,
        double thetaBefore,
        double thetaAfter,
        double seAfter,
        Instant answeredAt
) {
}
