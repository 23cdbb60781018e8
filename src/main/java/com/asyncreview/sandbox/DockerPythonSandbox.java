package com.asyncreview.sandbox;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.command.WaitContainerResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Volume;
import com.github.dockerjava.core.command.LogContainerResultCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Docker-based {@link ExecutionSandbox}.
 *
 * <p>Each cell runs in a fresh, network-less container of the configured Python image:
 * <ul>
 *   <li>The session workspace is bind-mounted at {@code /work}</li>
 *   <li>Command: {@code python /work/runner.py /work}</li>
 *   <li>Memory limited to {@code asyncreview.sandbox.memory-limit-mb}</li>
 * </ul>
 * Globals survive between cells through the runner's pickled state file.
 */
public class DockerPythonSandbox implements ExecutionSandbox {

    private static final Logger log = LoggerFactory.getLogger(DockerPythonSandbox.class);

    private static final String CONTAINER_WORKDIR = "/work";

    private final DockerClient dockerClient;
    private final SandboxProperties properties;

    public DockerPythonSandbox(DockerClient dockerClient, SandboxProperties properties) {
        this.dockerClient = dockerClient;
        this.properties = properties;
    }

    @Override
    public SandboxSession openSession(String runId) {
        ensureImage(properties.getImage());
        var workspace = RunnerWorkspace.create(Path.of(properties.getWorkRoot()), runId);
        log.info("Opened Docker sandbox session {} (workspace {})", runId, workspace.dir());
        return new DockerSession(runId, workspace);
    }

    private void ensureImage(String image) {
        try {
            dockerClient.inspectImageCmd(image).exec();
        } catch (NotFoundException e) {
            log.info("Image {} not found locally, pulling", image);
            try {
                dockerClient.pullImageCmd(image)
                        .exec(new PullImageResultCallback())
                        .awaitCompletion(5, TimeUnit.MINUTES);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new SandboxExecutionException("Interrupted while pulling " + image, ie);
            }
        } catch (RuntimeException e) {
            throw new SandboxExecutionException("Docker is not available: " + e.getMessage(), e);
        }
    }

    private final class DockerSession implements SandboxSession {

        private final String runId;
        private final RunnerWorkspace workspace;
        private int cellCount;

        DockerSession(String runId, RunnerWorkspace workspace) {
            this.runId = runId;
            this.workspace = workspace;
        }

        @Override
        public ExecutionResult execute(String code, Map<String, Object> variables) throws SandboxExecutionException {
            workspace.prepareCell(code, variables);
            cellCount++;

            var hostConfig = HostConfig.newHostConfig()
                    .withBinds(new Bind(workspace.dir().toString(), new Volume(CONTAINER_WORKDIR), AccessMode.rw))
                    .withMemory((long) properties.getMemoryLimitMb() * 1024 * 1024)
                    .withNetworkMode("none");

            String containerId = null;
            try {
                containerId = dockerClient.createContainerCmd(properties.getImage())
                        .withName("asyncreview-" + runId + "-" + cellCount)
                        .withHostConfig(hostConfig)
                        .withWorkingDir(CONTAINER_WORKDIR)
                        .withCmd("python", CONTAINER_WORKDIR + "/" + RunnerWorkspace.RUNNER, CONTAINER_WORKDIR)
                        .exec()
                        .getId();
                dockerClient.startContainerCmd(containerId).exec();

                Integer status = dockerClient.waitContainerCmd(containerId)
                        .exec(new WaitContainerResultCallback())
                        .awaitStatusCode(properties.getTimeoutSeconds(), TimeUnit.SECONDS);
                String output = captureOutput(containerId);
                if (status == null || status != 0) {
                    throw new SandboxExecutionException(output.isBlank() ? "Cell exited with status " + status : output.strip());
                }
                return new ExecutionResult(output, workspace.readSubmission());
            } catch (SandboxExecutionException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new SandboxExecutionException("Sandbox execution failed: " + e.getMessage(), e);
            } finally {
                if (containerId != null) {
                    removeContainer(containerId);
                }
            }
        }

        private String captureOutput(String containerId) {
            var sb = new StringBuilder();
            try {
                dockerClient.logContainerCmd(containerId)
                        .withStdOut(true)
                        .withStdErr(true)
                        .withFollowStream(false)
                        .exec(new LogContainerResultCallback() {
                            @Override
                            public void onNext(Frame frame) {
                                sb.append(new String(frame.getPayload(), StandardCharsets.UTF_8));
                            }
                        }).awaitCompletion(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while capturing output from container {}", containerId);
            }
            return sb.toString();
        }

        private void removeContainer(String containerId) {
            try {
                dockerClient.removeContainerCmd(containerId).withForce(true).exec();
            } catch (RuntimeException e) {
                log.warn("Failed to remove container {}: {}", containerId, e.getMessage());
            }
        }

        @Override
        public void close() {
            workspace.delete();
            log.debug("Closed Docker sandbox session {} after {} cells", runId, cellCount);
        }
    }
}
