package com.mirrorsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

@ConfigurationProperties(prefix = "mirror")
public class MirrorSyncProperties {
    private static final String DEFAULT_ZONE = "Europe/Berlin";
    private static final String DEFAULT_RSYNC_BINARY = "rsync";

    private Storage storage = new Storage();
    private Scheduler scheduler = new Scheduler();
    private Rsync rsync = new Rsync();

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Rsync getRsync() {
        return rsync;
    }

    public void setRsync(Rsync rsync) {
        this.rsync = rsync;
    }

    public static class Storage {
        private String dataDir = ".";
        private String jobsFile = "backups.json";
        private String logDir = "logs";

        public String getDataDir() {
            return dataDir;
        }

        public void setDataDir(String dataDir) {
            this.dataDir = dataDir == null || dataDir.isBlank() ? "." : dataDir.trim();
        }

        public String getJobsFile() {
            return jobsFile;
        }

        public void setJobsFile(String jobsFile) {
            this.jobsFile = jobsFile;
        }

        public String getLogDir() {
            return logDir;
        }

        public void setLogDir(String logDir) {
            this.logDir = logDir;
        }

        public Path resolveDataDir() {
            return Path.of(dataDir).toAbsolutePath().normalize();
        }

        public Path resolveJobsFile() {
            return resolveDataDir().resolve(jobsFile);
        }

        /**
         * Log directory; relative values are resolved against the data directory.
         */
        public Path resolveLogDir() {
            Path path = Path.of(logDir);
            if (path.isAbsolute()) {
                return path.normalize();
            }
            return resolveDataDir().resolve(path).normalize();
        }
    }

    public static class Scheduler {
        private String zone = DEFAULT_ZONE;
        private long misfireGraceSeconds = 3600;
        private int workerThreads = 4;

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }

        public ZoneId zoneId() {
            if (zone == null || zone.isBlank()) {
                return ZoneId.of(DEFAULT_ZONE);
            }
            try {
                return ZoneId.of(zone.trim());
            } catch (DateTimeException e) {
                throw new IllegalStateException("Unknown scheduler zone: " + zone, e);
            }
        }

        public long getMisfireGraceSeconds() {
            return Math.max(0, misfireGraceSeconds);
        }

        public void setMisfireGraceSeconds(long misfireGraceSeconds) {
            this.misfireGraceSeconds = Math.max(0, misfireGraceSeconds);
        }

        public int getWorkerThreads() {
            return Math.max(1, workerThreads);
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = Math.max(1, workerThreads);
        }
    }

    public static class Rsync {
        private String binary = DEFAULT_RSYNC_BINARY;
        private List<Integer> acceptedExitCodes = new ArrayList<>(List.of(0, 23, 24));

        public String getBinary() {
            return binary == null || binary.isBlank() ? DEFAULT_RSYNC_BINARY : binary.trim();
        }

        public void setBinary(String binary) {
            this.binary = binary;
        }

        public List<Integer> getAcceptedExitCodes() {
            return acceptedExitCodes;
        }

        public void setAcceptedExitCodes(List<Integer> acceptedExitCodes) {
            this.acceptedExitCodes = acceptedExitCodes == null ? new ArrayList<>() : acceptedExitCodes;
        }

        /**
         * Exit 0 is always accepted, whatever is configured.
         */
        public Set<Integer> acceptedExitCodeSet() {
            Set<Integer> codes = new TreeSet<>(acceptedExitCodes);
            codes.add(0);
            return codes;
        }
    }
}
