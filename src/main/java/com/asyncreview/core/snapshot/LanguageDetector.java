package com.asyncreview.core.snapshot;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Maps file names to language tags by special filename or extension.
 */
public final class LanguageDetector {

    private static final Map<String, String> SPECIAL_NAMES = Map.of(
            "dockerfile", "dockerfile",
            "makefile", "makefile",
            "gemfile", "ruby",
            "rakefile", "ruby",
            ".gitignore", "text",
            ".dockerignore", "text",
            ".env", "text",
            ".env.example", "text"
    );

    private static final Map<String, String> EXTENSIONS = Map.ofEntries(
            Map.entry(".py", "python"),
            Map.entry(".js", "javascript"), Map.entry(".jsx", "javascript"),
            Map.entry(".ts", "typescript"), Map.entry(".tsx", "typescript"),
            Map.entry(".rs", "rust"),
            Map.entry(".go", "go"),
            Map.entry(".java", "java"),
            Map.entry(".kt", "kotlin"), Map.entry(".kts", "kotlin"),
            Map.entry(".c", "c"), Map.entry(".h", "c"),
            Map.entry(".cpp", "cpp"), Map.entry(".hpp", "cpp"), Map.entry(".cc", "cpp"), Map.entry(".cxx", "cpp"),
            Map.entry(".cs", "csharp"),
            Map.entry(".rb", "ruby"),
            Map.entry(".php", "php"),
            Map.entry(".swift", "swift"),
            Map.entry(".scala", "scala"),
            Map.entry(".sh", "shell"), Map.entry(".bash", "shell"), Map.entry(".zsh", "shell"), Map.entry(".fish", "shell"),
            Map.entry(".ps1", "powershell"),
            Map.entry(".sql", "sql"),
            Map.entry(".html", "html"), Map.entry(".htm", "html"),
            Map.entry(".css", "css"), Map.entry(".scss", "scss"), Map.entry(".sass", "sass"), Map.entry(".less", "less"),
            Map.entry(".json", "json"),
            Map.entry(".yaml", "yaml"), Map.entry(".yml", "yaml"),
            Map.entry(".toml", "toml"),
            Map.entry(".xml", "xml"),
            Map.entry(".md", "markdown"), Map.entry(".mdx", "markdown"),
            Map.entry(".rst", "restructuredtext"),
            Map.entry(".txt", "text"),
            Map.entry(".dockerfile", "dockerfile"),
            Map.entry(".vue", "vue"), Map.entry(".svelte", "svelte"), Map.entry(".astro", "astro"),
            Map.entry(".lua", "lua"),
            Map.entry(".r", "r"),
            Map.entry(".jl", "julia"),
            Map.entry(".ex", "elixir"), Map.entry(".exs", "elixir"),
            Map.entry(".erl", "erlang"), Map.entry(".hrl", "erlang"),
            Map.entry(".hs", "haskell"),
            Map.entry(".ml", "ocaml"), Map.entry(".mli", "ocaml"),
            Map.entry(".clj", "clojure"), Map.entry(".cljs", "clojure"), Map.entry(".cljc", "clojure"),
            Map.entry(".dart", "dart"),
            Map.entry(".nim", "nim"),
            Map.entry(".zig", "zig"),
            Map.entry(".sol", "solidity"),
            Map.entry(".proto", "protobuf"),
            Map.entry(".graphql", "graphql"), Map.entry(".gql", "graphql")
    );

    private LanguageDetector() {}

    public static String detect(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        String special = SPECIAL_NAMES.get(name);
        if (special != null) {
            return special;
        }
        int dot = name.lastIndexOf('.');
        if (dot <= 0) {
            return "text";
        }
        return EXTENSIONS.getOrDefault(name.substring(dot), "text");
    }
}
