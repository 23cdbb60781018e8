package com.asyncreview.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

@Configuration
public class SandboxConfig {

    private static final String DEFAULT_UNIX_SOCKET = "unix:///var/run/docker.sock";

    @Bean
    @Lazy
    @ConditionalOnProperty(name = "asyncreview.sandbox.provider", havingValue = "docker", matchIfMissing = true)
    public DockerClient dockerClient() {
        String dockerHost = System.getenv().getOrDefault("DOCKER_HOST", DEFAULT_UNIX_SOCKET);
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        // ZerodepDockerHttpClient has built-in Unix socket support (no junixsocket needed)
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    @ConditionalOnProperty(name = "asyncreview.sandbox.provider", havingValue = "docker", matchIfMissing = true)
    public ExecutionSandbox dockerPythonSandbox(@Lazy DockerClient dockerClient, SandboxProperties properties) {
        return new DockerPythonSandbox(dockerClient, properties);
    }

    @Bean
    @ConditionalOnProperty(name = "asyncreview.sandbox.provider", havingValue = "process")
    public ExecutionSandbox localProcessSandbox(SandboxProperties properties) {
        return new LocalProcessSandbox(properties);
    }
}
