package work.pupt.kernel.core.post;

import work.pupt.kernel.core.BuiltinComponent;
import work.pupt.kernel.runtime.PostExecutionAction;
import work.pupt.kernel.runtime.Props;
import work.pupt.kernel.runtime.RenderContext;

public final class ReviewFile extends BuiltinComponent {
    public ReviewFile() {
        super("ReviewFile");
    }

    @Override
    public Object render(Props props, Object resolved, RenderContext context) {
        context.addPostExecution(new PostExecutionAction.ReviewFile(props.string("file"), props.string("editor")));
        return null;
    }
}
