package work.pupt.kernel.core.ask;

public final class AskLabel extends AskChoice {
    public AskLabel() {
        super("Ask.Label");
    }
}
