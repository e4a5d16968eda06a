package uk.gegc.adaptivetest.features.pool.infra.handler;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import uk.gegc.adaptivetest.features.pool.domain.model.Item;
import uk.gegc.adaptivetest.features.pool.domain.model.ItemType;
import uk.gegc.adaptivetest.shared.exception.InvalidItemParametersException;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class TrueFalseHandler extends ItemHandler {

    private static final Set<String> BOOLEAN_OPTIONS = Set.of("true", "false");

    @Override
    public ItemType supportedType() {
        return ItemType.TRUE_FALSE;
    }

    @Override
    public void validate(Item item) throws InvalidItemParametersException {
        JsonNode correct = item.correctAnswer();
        if (correct == null || !correct.isBoolean()) {
            throw new InvalidItemParametersException(item.id(), "TRUE_FALSE requires a boolean correct answer");
        }
        if (!item.options().isEmpty()) {
            Set<String> options = item.options().stream()
                    .map(o -> o == null ? "" : o.trim().toLowerCase(Locale.ROOT))
                    .collect(Collectors.toSet());
            if (item.options().size() != 2 || !options.equals(BOOLEAN_OPTIONS)) {
                throw new InvalidItemParametersException(item.id(), "TRUE_FALSE options must be exactly 'true' and 'false'");
            }
        }
    }

    @Override
    protected boolean doScore(Item item, JsonNode answer) {
        boolean correctAnswer = item.correctAnswer().asBoolean();
        Boolean userAnswer = toBoolean(answer);
        return userAnswer != null && userAnswer == correctAnswer;
    }

    private Boolean toBoolean(JsonNode answer) {
        if (answer.isBoolean()) {
            return answer.asBoolean();
        }
        if (answer.isTextual()) {
            String text = answer.asText().trim().toLowerCase(Locale.ROOT);
            if (BOOLEAN_OPTIONS.contains(text)) {
                return Boolean.parseBoolean(text);
            }
        }
        return null;
    }
}
