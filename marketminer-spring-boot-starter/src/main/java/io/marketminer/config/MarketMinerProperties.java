package io.marketminer.config;

import io.marketminer.utils.QueueNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Runtime configuration for job admission and dispatch.
 */
@ConfigurationProperties(prefix = "marketminer")
public class MarketMinerProperties {
    private boolean enabled = true;
    private String queuePrefix = QueueNames.DEFAULT_PREFIX;
    private Duration boundaryTimeout = Duration.ofSeconds(10); // 0 = no deadline
    private boolean ensureIndexesOnStartup = false;
    private final Dispatch dispatch = new Dispatch();
    private final Reconciler reconciler = new Reconciler();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getQueuePrefix() {
        return queuePrefix;
    }

    public void setQueuePrefix(String queuePrefix) {
        this.queuePrefix = queuePrefix;
    }

    public Duration getBoundaryTimeout() {
        return boundaryTimeout;
    }

    public void setBoundaryTimeout(Duration boundaryTimeout) {
        this.boundaryTimeout = boundaryTimeout;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public Reconciler getReconciler() {
        return reconciler;
    }

    /**
     * Worker invocation target. Either {@code targetUri} or all of project, region and worker job.
     */
    public static class Dispatch {
        private String project;
        private String region;
        private String workerJob;
        private String invokerIdentity;
        private String targetUri;

        public String getProject() {
            return project;
        }

        public void setProject(String project) {
            this.project = project;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getWorkerJob() {
            return workerJob;
        }

        public void setWorkerJob(String workerJob) {
            this.workerJob = workerJob;
        }

        public String getInvokerIdentity() {
            return invokerIdentity;
        }

        public void setInvokerIdentity(String invokerIdentity) {
            this.invokerIdentity = invokerIdentity;
        }

        public String getTargetUri() {
            return targetUri;
        }

        public void setTargetUri(String targetUri) {
            this.targetUri = targetUri;
        }
    }

    public static class Reconciler {
        private boolean enabled = false;
        private Duration interval = Duration.ofMinutes(5);
        private Duration staleAfter = Duration.ofHours(2);
        private int batchSize = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public Duration getStaleAfter() {
            return staleAfter;
        }

        public void setStaleAfter(Duration staleAfter) {
            this.staleAfter = staleAfter;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }
}
