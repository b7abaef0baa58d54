package work.pupt.kernel.core.post;

import work.pupt.kernel.core.BuiltinComponent;
import work.pupt.kernel.runtime.PostExecutionAction;
import work.pupt.kernel.runtime.Props;
import work.pupt.kernel.runtime.RenderContext;

public final class OpenUrl extends BuiltinComponent {
    public OpenUrl() {
        super("OpenUrl");
    }

    @Override
    public Object render(Props props, Object resolved, RenderContext context) {
        context.addPostExecution(new PostExecutionAction.OpenUrl(props.string("url"), props.string("browser")));
        return null;
    }
}
