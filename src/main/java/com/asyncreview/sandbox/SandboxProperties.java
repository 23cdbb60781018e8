package com.asyncreview.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "asyncreview.sandbox")
public class SandboxProperties {

    private String provider = "docker";
    private String image = "python:3.12-slim";
    private String pythonCommand = "python3";
    private int timeoutSeconds = 60;
    private int memoryLimitMb = 512;
    private String workRoot = System.getProperty("java.io.tmpdir");

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public String getImage() { return image; }
    public void setImage(String image) { this.image = image; }
    public String getPythonCommand() { return pythonCommand; }
    public void setPythonCommand(String pythonCommand) { this.pythonCommand = pythonCommand; }
    public int getTimeoutSeconds() { return timeoutSeconds; }
    public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
    public int getMemoryLimitMb() { return memoryLimitMb; }
    public void setMemoryLimitMb(int memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }
    public String getWorkRoot() { return workRoot; }
    public void setWorkRoot(String workRoot) { this.workRoot = workRoot; }
}
