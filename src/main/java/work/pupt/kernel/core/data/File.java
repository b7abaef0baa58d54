package work.pupt.kernel.core.data;

import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

import work.pupt.kernel.core.BuiltinComponent;
import work.pupt.kernel.runtime.Props;
import work.pupt.kernel.runtime.RenderContext;

/**
 * Embeds a local file as a fenced code block. Read failures surface as runtime errors.
 */
public final class File extends BuiltinComponent {
    private static final Map<String, String> LANGUAGES = Map.ofEntries(
        Map.entry("ts", "typescript"),
        Map.entry("tsx", "tsx"),
        Map.entry("js", "javascript"),
        Map.entry("jsx", "jsx"),
        Map.entry("mjs", "javascript"),
        Map.entry("py", "python"),
        Map.entry("rb", "ruby"),
        Map.entry("java", "java"),
        Map.entry("kt", "kotlin"),
        Map.entry("go", "go"),
        Map.entry("rs", "rust"),
        Map.entry("c", "c"),
        Map.entry("h", "c"),
        Map.entry("cpp", "cpp"),
        Map.entry("cs", "csharp"),
        Map.entry("swift", "swift"),
        Map.entry("php", "php"),
        Map.entry("sh", "bash"),
        Map.entry("bash", "bash"),
        Map.entry("sql", "sql"),
        Map.entry("html", "html"),
        Map.entry("css", "css"),
        Map.entry("json", "json"),
        Map.entry("yaml", "yaml"),
        Map.entry("yml", "yaml"),
        Map.entry("toml", "toml"),
        Map.entry("xml", "xml"),
        Map.entry("md", "markdown")
    );

    public File() {
        super("File");
    }

    @Override
    public Object render(Props props, Object resolved, RenderContext context) throws Exception {
        String location = props.string("path");
        Path path = Path.of(location);
        String content = Files.readString(path, Charset.forName(props.string("encoding", "UTF-8")));
        String language = props.string("language", languageFor(path));
        StringBuilder out = new StringBuilder();
        out.append("<!-- ").append(location).append(" -->\n");
        out.append("```").append(language).append('\n');
        out.append(content);
        if (!content.endsWith("\n")) {
            out.append('\n');
        }
        return out.append("```\n").toString();
    }

    static String languageFor(Path path) {
        String fileName = path.getFileName() == null ? "" : path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "";
        }
        return LANGUAGES.getOrDefault(fileName.substring(dot + 1).toLowerCase(Locale.ROOT), "");
    }
}
