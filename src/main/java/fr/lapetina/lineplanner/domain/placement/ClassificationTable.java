package fr.lapetina.lineplanner.domain.placement;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Ordered table of (predicate, outcome) rules over free-text labels.
 *
 * Rules are evaluated in insertion order and the first match wins, so
 * precedence is visible in the table itself. Labels are lower-cased before
 * matching.
 *
 * @param <T> outcome type
 */
public final class ClassificationTable<T> {

    private final List<Rule<T>> rules;

    private ClassificationTable(List<Rule<T>> rules) {
        this.rules = List.copyOf(rules);
    }

    /**
     * Returns the outcome of the first matching rule.
     */
    public Optional<T> classify(String label) {
        String normalized = label == null ? "" : label.toLowerCase(Locale.ROOT);
        for (Rule<T> rule : rules) {
            if (rule.predicate().test(normalized)) {
                return Optional.of(rule.outcome());
            }
        }
        return Optional.empty();
    }

    public T classifyOrDefault(String label, T fallback) {
        return classify(label).orElse(fallback);
    }

    public List<Rule<T>> getRules() {
        return rules;
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    /**
     * One row of the table.
     *
     * @param name      human-readable rule name, for logs and tests
     * @param predicate test over the lower-cased label
     * @param outcome   value returned when the predicate matches
     */
    public record Rule<T>(String name, Predicate<String> predicate, T outcome) {
        public Rule {
            Objects.requireNonNull(name, "Rule name is required");
            Objects.requireNonNull(predicate, "Predicate is required");
            Objects.requireNonNull(outcome, "Outcome is required");
        }
    }

    public static final class Builder<T> {
        private final List<Rule<T>> rules = new ArrayList<>();

        public Builder<T> rule(String name, Predicate<String> predicate, T outcome) {
            rules.add(new Rule<>(name, predicate, outcome));
            return this;
        }

        /**
         * Adds a rule matching labels that contain any of the keywords.
         */
        public Builder<T> whenContainsAny(List<String> keywords, T outcome) {
            List<String> lowered = keywords.stream()
                    .map(k -> k.toLowerCase(Locale.ROOT))
                    .toList();
            return rule("contains any of " + lowered,
                    label -> lowered.stream().anyMatch(label::contains),
                    outcome);
        }

        public ClassificationTable<T> build() {
            return new ClassificationTable<>(rules);
        }
    }
}
