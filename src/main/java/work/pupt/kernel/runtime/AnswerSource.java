package work.pupt.kernel.runtime;

import java.util.Optional;

/**
 * Supplies answers that were not pre-seeded. Called synchronously from an interactive component's
 * resolve step, in document order.
 */
@FunctionalInterface
public interface AnswerSource {
    AnswerSource NONE = requirement -> Optional.empty();

    Optional<Object> answer(InputRequirement requirement) throws Exception;
}
