package com.asyncreview.provider;

import com.asyncreview.core.InvalidInputException;
import com.asyncreview.core.model.ChangeSet;
import com.asyncreview.core.model.ChangedFile;
import com.asyncreview.core.model.CommentSummary;
import com.asyncreview.core.model.CommitSummary;
import com.asyncreview.core.model.FileContents;
import com.asyncreview.core.model.FileStatus;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.asyncreview.provider.ProviderHttpClient.text;

/**
 * GitHub pull requests over the REST v3 API.
 *
 * <p>Handles {@code https://github.com/owner/repo/pull/123} and GitHub Enterprise hosts
 * whose name contains "github"; the API base comes from {@code asyncreview.providers.github.api-base}.
 */
@Component
public class GitHubProvider implements ChangeRequestProvider {

    private static final Logger log = LoggerFactory.getLogger(GitHubProvider.class);

    static final Pattern URL_PATTERN = Pattern.compile("(github[^/]*)/([^/]+)/([^/]+)/pull/(\\d+)");

    private static final String RAW_ACCEPT = "application/vnd.github.v3.raw";

    private final ProviderProperties.Host config;
    private final ProviderHttpClient http;

    @Autowired
    public GitHubProvider(ProviderProperties properties) {
        this(properties.getGithub(), new ProviderHttpClient(properties.getTimeout()));
    }

    GitHubProvider(ProviderProperties.Host config, ProviderHttpClient http) {
        this.config = config;
        this.http = http;
    }

    @Override
    public String name() {
        return "github";
    }

    @Override
    public boolean canHandle(String url) {
        return url != null && URL_PATTERN.matcher(url).find();
    }

    @Override
    public ChangeSet load(String url, String sessionId) {
        Matcher m = URL_PATTERN.matcher(url);
        if (!m.find()) {
            throw new InvalidInputException("Invalid GitHub PR URL: " + url);
        }
        String host = m.group(1);
        String owner = m.group(2);
        String repo = m.group(3);
        int number = Integer.parseInt(m.group(4));
        String base = config.getApiBase() + "/repos/" + owner + "/" + repo;

        JsonNode pr = http.getJson(base + "/pulls/" + number, headers());
        JsonNode filesJson = http.getJson(base + "/pulls/" + number + "/files?per_page=100", headers());

        var files = new ArrayList<ChangedFile>();
        for (JsonNode f : filesJson) {
            JsonNode patch = f.path("patch");
            files.add(new ChangedFile(
                    text(f, "filename"),
                    FileStatus.fromWire(text(f, "status")),
                    f.path("additions").asInt(0),
                    f.path("deletions").asInt(0),
                    patch.isMissingNode() || patch.isNull() ? null : patch.asText()));
        }

        List<CommitSummary> commits = loadCommits(base + "/pulls/" + number + "/commits?per_page=100");
        List<CommentSummary> comments = loadComments(base + "/issues/" + number + "/comments?per_page=100");

        log.info("Loaded GitHub PR {}/{}#{}: {} files, {} commits, {} comments",
                owner, repo, number, files.size(), commits.size(), comments.size());
        return new ChangeSet(
                sessionId,
                name(),
                host,
                owner,
                repo,
                number,
                text(pr, "title"),
                text(pr, "body"),
                pr.path("base").path("sha").asText(),
                pr.path("head").path("sha").asText(),
                files,
                pr.path("user").path("login").asText(""),
                pr.path("state").asText("open"),
                pr.path("draft").asBoolean(false),
                pr.path("head").path("ref").asText(""),
                pr.path("base").path("ref").asText(""),
                commits,
                comments,
                pr.path("additions").asInt(0),
                pr.path("deletions").asInt(0),
                Instant.now());
    }

    @Override
    public FileVersions fetchContent(ChangeSet changeSet, String path) {
        FileStatus status = statusOf(changeSet, path);
        FileContents oldFile = status == FileStatus.ADDED ? null : fetch(changeSet, path, changeSet.baseSha());
        FileContents newFile = status == FileStatus.REMOVED ? null : fetch(changeSet, path, changeSet.headSha());
        return new FileVersions(oldFile, newFile);
    }

    private FileContents fetch(ChangeSet changeSet, String path, String sha) {
        var rawHeaders = new LinkedHashMap<>(headers());
        rawHeaders.put("Accept", RAW_ACCEPT);
        String url = config.getApiBase() + "/repos/" + changeSet.owner() + "/" + changeSet.repo()
                + "/contents/" + ProviderHttpClient.encodePath(path) + "?ref=" + sha;
        return http.getText(url, rawHeaders)
                .map(text -> new FileContents(path, text,
                        changeSet.owner() + "/" + changeSet.repo() + "/" + sha + "/" + path))
                .orElse(null);
    }

    private List<CommitSummary> loadCommits(String url) {
        try {
            var commits = new ArrayList<CommitSummary>();
            for (JsonNode c : http.getJson(url, headers())) {
                JsonNode author = c.path("commit").path("author");
                commits.add(new CommitSummary(
                        text(c, "sha"),
                        c.path("commit").path("message").asText(""),
                        author.path("name").asText(""),
                        c.path("author").path("login").asText(null),
                        author.path("date").asText(""),
                        text(c, "html_url")));
            }
            return commits;
        } catch (TransientProviderException e) {
            log.warn("Could not load commits from {}: {}", url, e.getMessage());
            return List.of();
        }
    }

    private List<CommentSummary> loadComments(String url) {
        try {
            var comments = new ArrayList<CommentSummary>();
            for (JsonNode c : http.getJson(url, headers())) {
                comments.add(new CommentSummary(
                        text(c, "id"),
                        c.path("user").path("login").asText(""),
                        text(c, "body"),
                        text(c, "created_at"),
                        text(c, "html_url")));
            }
            return comments;
        } catch (TransientProviderException e) {
            log.warn("Could not load comments from {}: {}", url, e.getMessage());
            return List.of();
        }
    }

    static FileStatus statusOf(ChangeSet changeSet, String path) {
        return changeSet.files().stream()
                .filter(f -> f.path().equals(path))
                .map(ChangedFile::status)
                .findFirst()
                .orElse(FileStatus.MODIFIED);
    }

    private Map<String, String> headers() {
        var headers = new LinkedHashMap<String, String>();
        headers.put("Accept", "application/vnd.github.v3+json");
        headers.put("User-Agent", "asyncreview");
        if (config.hasToken()) {
            headers.put("Authorization", "token " + config.getToken());
        }
        return headers;
    }
}
