package uk.gegc.adaptivetest.features.pool.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A calibrated test item. Immutable once published; a recalibrated item gets a new id.
 *
 * @param difficulty     b parameter
 * @param discrimination a parameter, strictly positive
 * @param guessing       c parameter (pseudo-chance), in [0, 1)
 * @param correctAnswer  used for scoring only, shape depends on {@link ItemType}
 */
@Builder(toBuilder = true)
public record Item(
        String id,
        String text,
        ItemType type,
        double difficulty,
        double discrimination,
        double guessing,
        String topic,
        String subtopic,
        String cognitiveLevel,
        List<String> options,
        JsonNode correctAnswer
) {

    public static final String UNASSIGNED_TOPIC = "unassigned";

    public Item {
        // null entries are kept so the type handler can reject them
        options = options == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(options));
    }

    public String topicKey() {
        return topic == null || topic.isBlank() ? UNASSIGNED_TOPIC : topic;
    }
}
