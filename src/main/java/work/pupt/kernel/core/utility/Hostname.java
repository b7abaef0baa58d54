package work.pupt.kernel.core.utility;

import work.pupt.kernel.runtime.EnvironmentFacts.RuntimeFacts;
import work.pupt.kernel.runtime.Props;

public final class Hostname extends RuntimeFactComponent {
    public Hostname() {
        super("Hostname");
    }

    @Override
    Object fact(RuntimeFacts facts, Props props) {
        return facts.hostname();
    }
}
