package com.asyncreview.provider;

import com.asyncreview.core.InvalidInputException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Ordered provider lookup: GitLab first (its URL shape is the more specific), then GitHub.
 * The first provider that can handle a URL wins.
 */
@Component
public class ProviderRegistry {

    private final List<ChangeRequestProvider> providers;

    @Autowired
    public ProviderRegistry(GitLabProvider gitLab, GitHubProvider gitHub) {
        this(List.of(gitLab, gitHub));
    }

    ProviderRegistry(List<ChangeRequestProvider> providers) {
        this.providers = List.copyOf(providers);
    }

    public ChangeRequestProvider forUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new InvalidInputException("A pull or merge request URL is required");
        }
        return providers.stream()
                .filter(p -> p.canHandle(url))
                .findFirst()
                .orElseThrow(() -> new InvalidInputException("No provider found for URL: " + url));
    }

    public ChangeRequestProvider byName(String name) {
        return providers.stream()
                .filter(p -> p.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Unknown provider: " + name));
    }

    public List<ChangeRequestProvider> providers() {
        return providers;
    }
}
