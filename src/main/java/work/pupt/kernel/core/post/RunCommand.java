package work.pupt.kernel.core.post;

import java.util.LinkedHashMap;
import java.util.Map;

import work.pupt.kernel.core.BuiltinComponent;
import work.pupt.kernel.runtime.PostExecutionAction;
import work.pupt.kernel.runtime.Props;
import work.pupt.kernel.runtime.RenderContext;

public final class RunCommand extends BuiltinComponent {
    public RunCommand() {
        super("RunCommand");
    }

    @Override
    public Object render(Props props, Object resolved, RenderContext context) {
        Map<String, String> env = new LinkedHashMap<>();
        props.map("env").forEach((key, value) -> env.put(key, String.valueOf(value)));
        context.addPostExecution(new PostExecutionAction.RunCommand(props.string("command"), props.string("cwd"), env));
        return null;
    }
}
