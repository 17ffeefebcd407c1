package net.syncron.bootstrap.props;

import net.syncron.core.config.SchedulerOptions;
import net.syncron.core.model.TimeMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("syncron")
public class SyncronProperties {
    private boolean enabled = true;
    /** false 면 원장 준비와 잡 등록까지만 하고 타이머는 켜지 않는다 */
    private boolean autoStart = true;
    private boolean log = true;
    private String storeName = SchedulerOptions.DEFAULT_STORE_NAME;
    private TimeMode timeMode = TimeMode.LOCAL;
    private long retentionSeconds = SchedulerOptions.DEFAULT_RETENTION_SECONDS;
    private boolean failOnInitError = true;
    private Duration purgeInterval = Duration.ofSeconds(60);
    private int workerThreads = 4;
    private Catalog catalog = new Catalog();

    public SchedulerOptions toOptions() {
        return SchedulerOptions.builder()
                .log(log)
                .storeName(storeName)
                .timeMode(timeMode)
                .retentionSeconds(retentionSeconds)
                .failOnInitError(failOnInitError)
                .purgeInterval(purgeInterval)
                .workerThreads(workerThreads)
                .build();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public boolean isLog() {
        return log;
    }

    public void setLog(boolean log) {
        this.log = log;
    }

    public String getStoreName() {
        return storeName;
    }

    public void setStoreName(String storeName) {
        this.storeName = storeName;
    }

    public TimeMode getTimeMode() {
        return timeMode;
    }

    public void setTimeMode(TimeMode timeMode) {
        this.timeMode = timeMode;
    }

    public long getRetentionSeconds() {
        return retentionSeconds;
    }

    public void setRetentionSeconds(long retentionSeconds) {
        this.retentionSeconds = retentionSeconds;
    }

    public boolean isFailOnInitError() {
        return failOnInitError;
    }

    public void setFailOnInitError(boolean failOnInitError) {
        this.failOnInitError = failOnInitError;
    }

    public Duration getPurgeInterval() {
        return purgeInterval;
    }

    public void setPurgeInterval(Duration purgeInterval) {
        this.purgeInterval = purgeInterval;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<JobDef> jobs = new ArrayList<>(); // ← 가변

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<JobDef> getJobs() {
            return jobs;
        }

        public void setJobs(List<JobDef> jobs) {
            this.jobs = jobs;
        }
    }

    /** cron 과 every 중 정확히 하나 */
    public static class JobDef {
        private String name;
        private String cron;
        private Duration every;
        /** JobHandler 빈 이름 */
        private String handler;
        private boolean persist = true;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getCron() {
            return cron;
        }

        public void setCron(String cron) {
            this.cron = cron;
        }

        public Duration getEvery() {
            return every;
        }

        public void setEvery(Duration every) {
            this.every = every;
        }

        public String getHandler() {
            return handler;
        }

        public void setHandler(String handler) {
            this.handler = handler;
        }

        public boolean isPersist() {
            return persist;
        }

        public void setPersist(boolean persist) {
            this.persist = persist;
        }

        @Override
        public String toString() {
            return "JobDef{" +
                    "name='" + name + '\'' +
                    ", cron='" + cron + '\'' +
                    ", every=" + every +
                    ", handler='" + handler + '\'' +
                    ", persist=" + persist +
                    '}';
        }
    }
}
