package com.asyncreview.provider;

import com.asyncreview.core.model.ChangeSet;
import com.asyncreview.core.model.ChangedFile;
import com.asyncreview.core.model.FileStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link GitLabProvider}.
 */
class GitLabProviderTest {

    private static final String MR_API = "https://gitlab.com/api/v4/projects/group%2Fsub%2Fproj/merge_requests/456";

    private ProviderHttpClient http;
    private ProviderProperties.Host config;
    private GitLabProvider provider;

    @BeforeEach
    void setUp() {
        http = mock(ProviderHttpClient.class);
        config = new ProviderProperties.Host("");
        provider = new GitLabProvider(config, http);
    }

    @Test
    @DisplayName("handles merge request URLs only")
    void canHandle() {
        assertTrue(provider.canHandle("https://gitlab.com/group/sub/proj/-/merge_requests/456"));
        assertTrue(provider.canHandle("https://git.internal.io/team/app/-/merge_requests/7"));
        assertFalse(provider.canHandle("https://github.com/acme/widgets/pull/12"));
    }

    @Test
    @DisplayName("API base comes from config only when it names the same host")
    void apiBase() {
        assertEquals("https://gitlab.com/api/v4", provider.apiBase("gitlab.com"));
        config.setApiBase("https://git.internal.io/api/v4");
        assertEquals("https://git.internal.io/api/v4", provider.apiBase("git.internal.io"));
        assertEquals("https://gitlab.com/api/v4", provider.apiBase("gitlab.com"));
    }

    @Test
    @DisplayName("loads a nested-group merge request, counting diff lines and skipping system notes")
    void load() throws Exception {
        var mapper = new ObjectMapper();
        when(http.getJson(eq(MR_API), anyMap())).thenReturn(mapper.readTree("""
                {"title":"Add cache","description":"Speeds up reads","state":"opened",
                 "author":{"username":"dev"},"work_in_progress":true,
                 "source_branch":"cache","target_branch":"main",
                 "diff_refs":{"base_sha":"b1","head_sha":"h1"}}
                """));
        when(http.getJson(eq(MR_API + "/changes"), anyMap())).thenReturn(mapper.readTree("""
                {"changes":[
                  {"old_path":"c.py","new_path":"c.py","new_file":true,"diff":"@@ -0,0 +1,2 @@\\n+a\\n+b"},
                  {"old_path":"d.py","new_path":"d.py","deleted_file":true,"diff":"@@ -1 +0,0 @@\\n-x"}
                ]}
                """));
        when(http.getJson(eq(MR_API + "/commits?per_page=100"), anyMap())).thenReturn(mapper.readTree("[]"));
        when(http.getJson(eq(MR_API + "/notes?per_page=100"), anyMap())).thenReturn(mapper.readTree("""
                [{"id":1,"system":true,"body":"changed the description"},
                 {"id":2,"system":false,"author":{"username":"rev"},"body":"Nice"}]
                """));

        ChangeSet cs = provider.load("https://gitlab.com/group/sub/proj/-/merge_requests/456", "S2");

        assertEquals("gitlab", cs.provider());
        assertEquals("group/sub", cs.owner());
        assertEquals("proj", cs.repo());
        assertEquals(456, cs.number());
        assertTrue(cs.draft());
        assertEquals(FileStatus.ADDED, cs.files().get(0).status());
        assertEquals(2, cs.files().get(0).additions());
        assertEquals(FileStatus.REMOVED, cs.files().get(1).status());
        assertEquals(1, cs.files().get(1).deletions());
        assertEquals(2, cs.additions());
        assertEquals(1, cs.comments().size());
        assertEquals("https://gitlab.com/group/sub/proj/-/merge_requests/456#note_2", cs.comments().get(0).url());
    }

    @Test
    @DisplayName("raw file fetches encode the project and file path")
    void fetchContentUrl() {
        ChangeSet cs = new ChangeSet("S2", "gitlab", "gitlab.com", "group/sub", "proj", 456, "t", "", "b1", "h1",
                List.of(new ChangedFile("src/x.py", FileStatus.MODIFIED, 1, 1, "")),
                "dev", "opened", false, "s", "t", null, null, 0, 0, Instant.now());
        when(http.getText(anyString(), anyMap())).thenReturn(Optional.of("body"));

        FileVersions v = provider.fetchContent(cs, "src/x.py");

        verify(http).getText(eq("https://gitlab.com/api/v4/projects/group%2Fsub%2Fproj/repository/files/src%2Fx.py/raw?ref=h1"), anyMap());
        assertEquals("group/sub/proj/b1/src/x.py", v.oldFile().hash());
    }

    @Test
    @DisplayName("count finds non-overlapping occurrences")
    void count() {
        assertEquals(2, GitLabProvider.count("\n+a\n+b", "\n+"));
        assertEquals(0, GitLabProvider.count("", "\n+"));
    }
}
