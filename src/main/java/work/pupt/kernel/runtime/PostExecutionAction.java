package work.pupt.kernel.runtime;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Action emitted during a render and carried out after the prompt has been delivered.
 */
public interface PostExecutionAction {
    String type();

    Map<String, Object> toMap();

    record ReviewFile(String file, String editor) implements PostExecutionAction {
        public ReviewFile {
            Objects.requireNonNull(file, "file");
        }

        @Override
        public String type() {
            return "reviewFile";
        }

        @Override
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("type", type());
            map.put("file", file);
            if (editor != null) {
                map.put("editor", editor);
            }
            return map;
        }
    }

    record OpenUrl(String url, String browser) implements PostExecutionAction {
        public OpenUrl {
            Objects.requireNonNull(url, "url");
        }

        @Override
        public String type() {
            return "openUrl";
        }

        @Override
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("type", type());
            map.put("url", url);
            if (browser != null) {
                map.put("browser", browser);
            }
            return map;
        }
    }

    record RunCommand(String command, String cwd, Map<String, String> env) implements PostExecutionAction {
        public RunCommand {
            Objects.requireNonNull(command, "command");
            env = env == null ? Map.of() : Map.copyOf(env);
        }

        @Override
        public String type() {
            return "runCommand";
        }

        @Override
        public Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("type", type());
            map.put("command", command);
            if (cwd != null) {
                map.put("cwd", cwd);
            }
            if (!env.isEmpty()) {
                map.put("env", env);
            }
            return map;
        }
    }
}
