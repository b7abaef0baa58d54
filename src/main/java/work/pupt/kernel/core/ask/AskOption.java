package work.pupt.kernel.core.ask;

public final class AskOption extends AskChoice {
    public AskOption() {
        super("Ask.Option");
    }
}
