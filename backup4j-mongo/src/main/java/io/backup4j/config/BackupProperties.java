package io.backup4j.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the backup service.
 */
@ConfigurationProperties(prefix = "backup")
public class BackupProperties {
    private boolean enabled = true;
    private String secretKey; // falls back to SECRET_KEY
    private int maxConcurrency = 4;
    private Duration taskTimeLimit = Duration.ofHours(1);
    private String reloadTopic = "backup4j.schedules";
    private String reloadGroupId = "backup4j-dispatcher";
    private Duration reloadPollTimeout = Duration.ofSeconds(1);
    private Duration reconnectMaxBackoff = Duration.ofSeconds(60);
    private Duration shutdownGrace = Duration.ofSeconds(30);
    private String timezone = "UTC";
    private Path workDir = Paths.get(System.getProperty("java.io.tmpdir"), "backup4j");
    private boolean ensureIndexesOnStartup = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getSecretKey() {
        return secretKey;
    }

    public void setSecretKey(String secretKey) {
        this.secretKey = secretKey;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getTaskTimeLimit() {
        return taskTimeLimit;
    }

    public void setTaskTimeLimit(Duration taskTimeLimit) {
        this.taskTimeLimit = taskTimeLimit;
    }

    public String getReloadTopic() {
        return reloadTopic;
    }

    public void setReloadTopic(String reloadTopic) {
        this.reloadTopic = reloadTopic;
    }

    public String getReloadGroupId() {
        return reloadGroupId;
    }

    public void setReloadGroupId(String reloadGroupId) {
        this.reloadGroupId = reloadGroupId;
    }

    public Duration getReloadPollTimeout() {
        return reloadPollTimeout;
    }

    public void setReloadPollTimeout(Duration reloadPollTimeout) {
        this.reloadPollTimeout = reloadPollTimeout;
    }

    public Duration getReconnectMaxBackoff() {
        return reconnectMaxBackoff;
    }

    public void setReconnectMaxBackoff(Duration reconnectMaxBackoff) {
        this.reconnectMaxBackoff = reconnectMaxBackoff;
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    public void setShutdownGrace(Duration shutdownGrace) {
        this.shutdownGrace = shutdownGrace;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public Path getWorkDir() {
        return workDir;
    }

    public void setWorkDir(Path workDir) {
        this.workDir = workDir;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
