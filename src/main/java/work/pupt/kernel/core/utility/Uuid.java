package work.pupt.kernel.core.utility;

import work.pupt.kernel.runtime.EnvironmentFacts.RuntimeFacts;
import work.pupt.kernel.runtime.Props;

public final class Uuid extends RuntimeFactComponent {
    public Uuid() {
        super("Uuid");
    }

    @Override
    Object fact(RuntimeFacts facts, Props props) {
        return facts.uuid();
    }
}
