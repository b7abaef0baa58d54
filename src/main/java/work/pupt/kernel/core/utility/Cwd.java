package work.pupt.kernel.core.utility;

import work.pupt.kernel.runtime.EnvironmentFacts.RuntimeFacts;
import work.pupt.kernel.runtime.Props;

public final class Cwd extends RuntimeFactComponent {
    public Cwd() {
        super("Cwd");
    }

    @Override
    Object fact(RuntimeFacts facts, Props props) {
        return facts.cwd();
    }
}
