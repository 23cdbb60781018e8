package com.asyncreview.core.snapshot;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Deny, include and priority rules applied while discovering files for a snapshot.
 * <p>
 * All patterns use Java glob syntax against {@code /}-separated paths relative to
 * the repository root: {@code *} stays within one segment, {@code **} crosses segments.
 */
public class PathRules {

    /** Always excluded. Matched against every path segment and the full relative path. */
    static final List<String> DEFAULT_DENY = List.of(
            "node_modules", ".venv", "venv", "__pycache__", ".git", ".svn", ".hg",
            "dist", "build", ".next", ".nuxt", "target",
            "*.pyc", "*.pyo", "*.so", "*.dylib", "*.dll", "*.exe", "*.bin", "*.o", "*.a",
            "*.class", "*.jar", "*.war", "*.ear",
            "*.zip", "*.tar", "*.gz", "*.rar", "*.7z",
            "*.png", "*.jpg", "*.jpeg", "*.gif", "*.ico", "*.svg",
            "*.woff", "*.woff2", "*.ttf", "*.eot",
            "*.mp3", "*.mp4", "*.avi", "*.mov",
            "*.pdf", "*.doc", "*.docx", "*.xls", "*.xlsx", "*.ppt", "*.pptx",
            "*.lock", "package-lock.json", "yarn.lock", "pnpm-lock.yaml", "bun.lockb",
            "poetry.lock", "Cargo.lock", ".DS_Store", "Thumbs.db"
    );

    /** Priority patterns matched against the file name, at any depth. */
    static final List<String> PRIORITY_NAMES = List.of(
            // documentation
            "README*", "readme*",
            // manifests
            "package.json", "pyproject.toml", "Cargo.toml", "go.mod", "requirements.txt",
            "setup.py", "setup.cfg", "pom.xml", "build.gradle", "build.gradle.kts",
            // build files
            "Makefile", "Dockerfile", "docker-compose*.yml", ".env.example"
    );

    /** Priority patterns matched against the full relative path. */
    static final List<String> PRIORITY_PATHS = List.of(
            // root-level source
            "*.py", "*.ts", "*.js", "*.tsx", "*.jsx", "*.go", "*.rs", "*.java", "*.rb", "*.php",
            // conventional source and test directories
            "src/**", "lib/**", "app/**", "pkg/**", "cmd/**",
            "tests/**", "test/**", "spec/**"
    );

    private final List<PathMatcher> defaultDeny;
    private final List<PathMatcher> exclude;
    private final List<PathMatcher> include;
    private final List<PathMatcher> priorityNames;
    private final List<PathMatcher> priorityPaths;

    public PathRules(List<String> includeGlobs, List<String> excludeGlobs) {
        this.defaultDeny = compile(DEFAULT_DENY);
        this.exclude = compile(excludeGlobs);
        this.include = compile(includeGlobs);
        this.priorityNames = compile(PRIORITY_NAMES);
        this.priorityPaths = compile(PRIORITY_PATHS);
    }

    /**
     * Returns {@code true} when a directory or file must never be visited:
     * default deny-list first, then the user exclude globs.
     */
    public boolean isDenied(Path relative) {
        for (PathMatcher matcher : defaultDeny) {
            if (matcher.matches(relative)) return true;
            for (Path segment : relative) {
                if (matcher.matches(segment)) return true;
            }
        }
        for (PathMatcher matcher : exclude) {
            if (matcher.matches(relative)) return true;
        }
        return false;
    }

    /**
     * Full per-file filter: not denied, and matching an include glob when any are configured.
     */
    public boolean accepts(Path relative) {
        if (isDenied(relative)) {
            return false;
        }
        if (include.isEmpty()) {
            return true;
        }
        return include.stream().anyMatch(m -> m.matches(relative));
    }

    /**
     * Documentation, manifest and build files are priority at any depth; source globs
     * only at the root or under the conventional source and test directories.
     */
    public boolean isPriority(Path relative) {
        Path name = relative.getFileName();
        if (name != null && priorityNames.stream().anyMatch(m -> m.matches(name))) {
            return true;
        }
        return priorityPaths.stream().anyMatch(m -> m.matches(relative));
    }

    /**
     * Orders relative paths: priority group first, then the rest, each alphabetically.
     */
    public List<String> prioritize(List<String> relativePaths) {
        var first = new ArrayList<String>();
        var rest = new ArrayList<String>();
        for (String path : relativePaths) {
            (isPriority(Path.of(path)) ? first : rest).add(path);
        }
        first.sort(Comparator.naturalOrder());
        rest.sort(Comparator.naturalOrder());
        first.addAll(rest);
        return first;
    }

    private static List<PathMatcher> compile(List<String> globs) {
        var matchers = new ArrayList<PathMatcher>();
        if (globs == null) {
            return matchers;
        }
        for (String glob : globs) {
            if (glob != null && !glob.isBlank()) {
                matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + glob.strip()));
            }
        }
        return matchers;
    }
}
