package uk.gegc.adaptivetest.features.pool.infra.handler;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import uk.gegc.adaptivetest.features.pool.domain.model.Item;
import uk.gegc.adaptivetest.features.pool.domain.model.ItemType;
import uk.gegc.adaptivetest.shared.exception.InvalidItemParametersException;

import java.util.HashSet;
import java.util.Set;

/**
 * Multiple choice items. The correct answer is either a single option text or
 * an array of option texts, in which case the response must select exactly that set.
 */
@Component
public class MultipleChoiceHandler extends ItemHandler {

    @Override
    public ItemType supportedType() {
        return ItemType.MULTIPLE_CHOICE;
    }

    @Override
    public void validate(Item item) throws InvalidItemParametersException {
        if (item.options().size() < 2) {
            throw new InvalidItemParametersException(item.id(), "MULTIPLE_CHOICE must have at least 2 options");
        }
        Set<String> options = new HashSet<>();
        for (String option : item.options()) {
            if (option == null || option.isBlank()) {
                throw new InvalidItemParametersException(item.id(), "Options must be non-empty strings");
            }
            if (!options.add(option)) {
                throw new InvalidItemParametersException(item.id(), "Options must be unique, found duplicate: " + option);
            }
        }

        Set<String> correct = answerSet(item.correctAnswer());
        if (correct == null || correct.isEmpty()) {
            throw new InvalidItemParametersException(item.id(),
                    "MULTIPLE_CHOICE correct answer must be an option text or a non-empty array of option texts");
        }
        for (String answer : correct) {
            if (!options.contains(answer)) {
                throw new InvalidItemParametersException(item.id(), "Correct answer '" + answer + "' is not one of the options");
            }
        }
    }

    @Override
    protected boolean doScore(Item item, JsonNode answer) {
        Set<String> selected = answerSet(answer);
        return selected != null && selected.equals(answerSet(item.correctAnswer()));
    }

    private Set<String> answerSet(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isTextual()) {
            return Set.of(node.asText());
        }
        if (!node.isArray()) {
            return null;
        }
        Set<String> values = new HashSet<>();
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                return null;
            }
            values.add(element.asText());
        }
        return values;
    }
}
