package com.asyncreview.provider;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "asyncreview.providers")
public class ProviderProperties {

    private Duration timeout = Duration.ofSeconds(30);
    private Host github = new Host("https://api.github.com");
    private Host gitlab = new Host("");

    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }
    public Host getGithub() { return github; }
    public void setGithub(Host github) { this.github = github; }
    public Host getGitlab() { return gitlab; }
    public void setGitlab(Host gitlab) { this.gitlab = gitlab; }

    public static class Host {
        private String token = "";
        private String apiBase;

        public Host() {
            this("");
        }

        public Host(String apiBase) {
            this.apiBase = apiBase;
        }

        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }
        public String getApiBase() { return apiBase; }
        public void setApiBase(String apiBase) { this.apiBase = apiBase; }

        public boolean hasToken() {
            return token != null && !token.isBlank();
        }
    }
}
