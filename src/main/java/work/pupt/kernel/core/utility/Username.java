package work.pupt.kernel.core.utility;

import work.pupt.kernel.runtime.EnvironmentFacts.RuntimeFacts;
import work.pupt.kernel.runtime.Props;

public final class Username extends RuntimeFactComponent {
    public Username() {
        super("Username");
    }

    @Override
    Object fact(RuntimeFacts facts, Props props) {
        return facts.username();
    }
}
