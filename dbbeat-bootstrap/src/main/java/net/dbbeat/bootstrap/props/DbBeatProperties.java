package net.dbbeat.bootstrap.props;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties("dbbeat")
public class DbBeatProperties {
    private String zone = "Asia/Shanghai";
    private Scheduler scheduler = new Scheduler();
    private Retention retention = new Retention();
    private RunRecords runRecords = new RunRecords();
    private Catalog catalog = new Catalog();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    public RunRecords getRunRecords() {
        return runRecords;
    }

    public void setRunRecords(RunRecords runRecords) {
        this.runRecords = runRecords;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public static class Scheduler {
        private boolean enabled = true;
        private Duration maxInterval = Duration.ofSeconds(5);
        private Duration syncEvery = Duration.ofSeconds(5);
        private Duration changeCheckInterval = Duration.ofSeconds(5);
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getMaxInterval() {
            return maxInterval;
        }

        public void setMaxInterval(Duration maxInterval) {
            this.maxInterval = maxInterval;
        }

        public Duration getSyncEvery() {
            return syncEvery;
        }

        public void setSyncEvery(Duration syncEvery) {
            this.syncEvery = syncEvery;
        }

        public Duration getChangeCheckInterval() {
            return changeCheckInterval;
        }

        public void setChangeCheckInterval(Duration changeCheckInterval) {
            this.changeCheckInterval = changeCheckInterval;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    /** 주기는 dbbeat.retention.run-every-ms 로 @Scheduled 에서 직접 읽는다 */
    public static class Retention {
        private boolean enabled = true;
        private Duration keep = Duration.ofDays(7);
        private long runEveryMs = 3_600_000L;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getKeep() {
            return keep;
        }

        public void setKeep(Duration keep) {
            this.keep = keep;
        }

        public long getRunEveryMs() {
            return runEveryMs;
        }

        public void setRunEveryMs(long runEveryMs) {
            this.runEveryMs = runEveryMs;
        }
    }

    public static class RunRecords {
        private boolean recordSubmissions = true;

        public boolean isRecordSubmissions() {
            return recordSubmissions;
        }

        public void setRecordSubmissions(boolean recordSubmissions) {
            this.recordSubmissions = recordSubmissions;
        }
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

    /** interval(every + unit) 또는 cron 필드 중 하나만 */
    public static class JobDef {
        private String name;
        private String target;
        private Long every;
        private String unit;
        private Cron cron;
        private List<Object> args = new ArrayList<>();
        private Map<String, Object> kwargs = new LinkedHashMap<>();
        private String queue;
        private Integer priority;
        private boolean oneOff;
        private boolean enabled = true;
        private String description;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getTarget() {
            return target;
        }

        public void setTarget(String target) {
            this.target = target;
        }

        public Long getEvery() {
            return every;
        }

        public void setEvery(Long every) {
            this.every = every;
        }

        public String getUnit() {
            return unit;
        }

        public void setUnit(String unit) {
            this.unit = unit;
        }

        public Cron getCron() {
            return cron;
        }

        public void setCron(Cron cron) {
            this.cron = cron;
        }

        public List<Object> getArgs() {
            return args;
        }

        public void setArgs(List<Object> args) {
            this.args = args;
        }

        public Map<String, Object> getKwargs() {
            return kwargs;
        }

        public void setKwargs(Map<String, Object> kwargs) {
            this.kwargs = kwargs;
        }

        public String getQueue() {
            return queue;
        }

        public void setQueue(String queue) {
            this.queue = queue;
        }

        public Integer getPriority() {
            return priority;
        }

        public void setPriority(Integer priority) {
            this.priority = priority;
        }

        public boolean isOneOff() {
            return oneOff;
        }

        public void setOneOff(boolean oneOff) {
            this.oneOff = oneOff;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        @Override
        public String toString() {
            return "JobDef{" +
                    "name='" + name + '\'' +
                    ", target='" + target + '\'' +
                    ", every=" + every +
                    ", unit='" + unit + '\'' +
                    ", cron=" + cron +
                    ", enabled=" + enabled +
                    '}';
        }
    }

    public static class Cron {
        private String minute;
        private String hour;
        private String dayOfMonth;
        private String monthOfYear;
        private String dayOfWeek;
        private String timezone;

        public String getMinute() {
            return minute;
        }

        public void setMinute(String minute) {
            this.minute = minute;
        }

        public String getHour() {
            return hour;
        }

        public void setHour(String hour) {
            this.hour = hour;
        }

        public String getDayOfMonth() {
            return dayOfMonth;
        }

        public void setDayOfMonth(String dayOfMonth) {
            this.dayOfMonth = dayOfMonth;
        }

        public String getMonthOfYear() {
            return monthOfYear;
        }

        public void setMonthOfYear(String monthOfYear) {
            this.monthOfYear = monthOfYear;
        }

        public String getDayOfWeek() {
            return dayOfWeek;
        }

        public void setDayOfWeek(String dayOfWeek) {
            this.dayOfWeek = dayOfWeek;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        @Override
        public String toString() {
            return minute + " " + hour + " " + dayOfMonth + " " + monthOfYear + " " + dayOfWeek
                    + (timezone == null ? "" : " (" + timezone + ")");
        }
    }
}
