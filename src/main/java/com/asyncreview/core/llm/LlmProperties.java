package com.asyncreview.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Model names for the two tiers: the main model drives the reasoning loop,
 * the sub model serves single-pass review and suggestions. Every call is bounded
 * by {@code call-timeout}.
 */
@Component
@ConfigurationProperties(prefix = "asyncreview.llm")
public class LlmProperties {

    private String mainModel = "gpt-4o";
    private String subModel = "gpt-4o-mini";
    private Duration callTimeout = Duration.ofSeconds(120);

    public String getMainModel() {
        return mainModel;
    }

    public void setMainModel(String mainModel) {
        this.mainModel = mainModel;
    }

    public String getSubModel() {
        return subModel;
    }

    public void setSubModel(String subModel) {
        this.subModel = subModel;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public void setCallTimeout(Duration callTimeout) {
        this.callTimeout = callTimeout;
    }
}
