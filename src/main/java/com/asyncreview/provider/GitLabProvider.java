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

import static com.asyncreview.provider.ProviderHttpClient.encode;
import static com.asyncreview.provider.ProviderHttpClient.text;

/**
 * GitLab merge requests over the REST v4 API.
 *
 * <p>Handles {@code https://gitlab.com/group/subgroup/project/-/merge_requests/456} and
 * self-hosted instances. The API base is {@code asyncreview.providers.gitlab.api-base}
 * when it names the same host, otherwise {@code https://<host>/api/v4}.
 */
@Component
public class GitLabProvider implements ChangeRequestProvider {

    private static final Logger log = LoggerFactory.getLogger(GitLabProvider.class);

    static final Pattern URL_PATTERN = Pattern.compile("([^/]+\\.[^/]+)/(.+?)/-/merge_requests/(\\d+)");

    private final ProviderProperties.Host config;
    private final ProviderHttpClient http;

    @Autowired
    public GitLabProvider(ProviderProperties properties) {
        this(properties.getGitlab(), new ProviderHttpClient(properties.getTimeout()));
    }

    GitLabProvider(ProviderProperties.Host config, ProviderHttpClient http) {
        this.config = config;
        this.http = http;
    }

    @Override
    public String name() {
        return "gitlab";
    }

    @Override
    public boolean canHandle(String url) {
        return url != null && url.contains("/-/merge_requests/");
    }

    @Override
    public ChangeSet load(String url, String sessionId) {
        Matcher m = URL_PATTERN.matcher(url);
        if (!m.find()) {
            throw new InvalidInputException("Invalid GitLab MR URL: " + url);
        }
        String host = m.group(1);
        String projectPath = m.group(2);
        int iid = Integer.parseInt(m.group(3));
        String base = apiBase(host) + "/projects/" + encode(projectPath) + "/merge_requests/" + iid;

        JsonNode mr = http.getJson(base, headers());
        JsonNode changes = http.getJson(base + "/changes", headers());

        var files = new ArrayList<ChangedFile>();
        int additions = 0;
        int deletions = 0;
        for (JsonNode change : changes.path("changes")) {
            String diff = text(change, "diff");
            int added = Math.max(0, count(diff, "\n+") - count(diff, "\n+++"));
            int removed = Math.max(0, count(diff, "\n-") - count(diff, "\n---"));
            String path = text(change, "new_path");
            files.add(new ChangedFile(
                    path.isEmpty() ? text(change, "old_path") : path,
                    statusOf(change),
                    added,
                    removed,
                    diff));
            additions += added;
            deletions += removed;
        }

        List<CommitSummary> commits = loadCommits(base + "/commits?per_page=100");
        List<CommentSummary> comments = loadNotes(base + "/notes?per_page=100", url);

        int slash = projectPath.lastIndexOf('/');
        String owner = slash < 0 ? "" : projectPath.substring(0, slash);
        String repo = slash < 0 ? projectPath : projectPath.substring(slash + 1);

        log.info("Loaded GitLab MR {}!{}: {} files, {} commits, {} comments",
                projectPath, iid, files.size(), commits.size(), comments.size());
        return new ChangeSet(
                sessionId,
                name(),
                host,
                owner,
                repo,
                iid,
                text(mr, "title"),
                text(mr, "description"),
                mr.path("diff_refs").path("base_sha").asText(),
                mr.path("diff_refs").path("head_sha").asText(),
                files,
                mr.path("author").path("username").asText(""),
                mr.path("state").asText("opened"),
                mr.path("draft").asBoolean(false) || mr.path("work_in_progress").asBoolean(false),
                text(mr, "source_branch"),
                text(mr, "target_branch"),
                commits,
                comments,
                additions,
                deletions,
                Instant.now());
    }

    @Override
    public FileVersions fetchContent(ChangeSet changeSet, String path) {
        FileStatus status = GitHubProvider.statusOf(changeSet, path);
        FileContents oldFile = status == FileStatus.ADDED ? null : fetch(changeSet, path, changeSet.baseSha());
        FileContents newFile = status == FileStatus.REMOVED ? null : fetch(changeSet, path, changeSet.headSha());
        return new FileVersions(oldFile, newFile);
    }

    private FileContents fetch(ChangeSet changeSet, String path, String sha) {
        String projectPath = projectPath(changeSet);
        String url = apiBase(changeSet.host()) + "/projects/" + encode(projectPath)
                + "/repository/files/" + encode(path) + "/raw?ref=" + sha;
        return http.getText(url, headers())
                .map(text -> new FileContents(path, text, projectPath + "/" + sha + "/" + path))
                .orElse(null);
    }

    private List<CommitSummary> loadCommits(String url) {
        try {
            var commits = new ArrayList<CommitSummary>();
            for (JsonNode c : http.getJson(url, headers())) {
                commits.add(new CommitSummary(
                        text(c, "id"),
                        text(c, "message"),
                        text(c, "author_name"),
                        c.path("author_email").asText(null),
                        text(c, "created_at"),
                        text(c, "web_url")));
            }
            return commits;
        } catch (TransientProviderException e) {
            log.warn("Could not load commits from {}: {}", url, e.getMessage());
            return List.of();
        }
    }

    private List<CommentSummary> loadNotes(String url, String mrUrl) {
        try {
            var comments = new ArrayList<CommentSummary>();
            for (JsonNode n : http.getJson(url, headers())) {
                if (n.path("system").asBoolean(false)) {
                    continue;
                }
                String id = text(n, "id");
                comments.add(new CommentSummary(
                        id,
                        n.path("author").path("username").asText(""),
                        text(n, "body"),
                        text(n, "created_at"),
                        mrUrl + "#note_" + id));
            }
            return comments;
        } catch (TransientProviderException e) {
            log.warn("Could not load notes from {}: {}", url, e.getMessage());
            return List.of();
        }
    }

    String apiBase(String host) {
        String configured = config.getApiBase();
        if (configured != null && !configured.isBlank() && configured.contains(host)) {
            return configured;
        }
        return "https://" + host + "/api/v4";
    }

    private static String projectPath(ChangeSet changeSet) {
        return changeSet.owner().isEmpty() ? changeSet.repo() : changeSet.owner() + "/" + changeSet.repo();
    }

    private static FileStatus statusOf(JsonNode change) {
        if (change.path("new_file").asBoolean(false)) return FileStatus.ADDED;
        if (change.path("deleted_file").asBoolean(false)) return FileStatus.REMOVED;
        if (change.path("renamed_file").asBoolean(false)) return FileStatus.RENAMED;
        return FileStatus.MODIFIED;
    }

    static int count(String text, String needle) {
        int count = 0;
        for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + needle.length())) {
            count++;
        }
        return count;
    }

    private Map<String, String> headers() {
        var headers = new LinkedHashMap<String, String>();
        headers.put("User-Agent", "asyncreview");
        if (config.hasToken()) {
            headers.put("PRIVATE-TOKEN", config.getToken());
        }
        return headers;
    }
}
