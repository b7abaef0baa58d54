package work.pupt.kernel.core.ask;

public final class AskText extends AskComponent {
    public AskText() {
        super("Ask.Text", "text");
    }
}
