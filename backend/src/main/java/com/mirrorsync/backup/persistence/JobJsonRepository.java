package com.mirrorsync.backup.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mirrorsync.backup.model.BackupJob;
import com.mirrorsync.config.MirrorSyncProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persists the whole job table as one JSON document. Every save rewrites the full table into a
 * sibling temp file and renames it over the canonical file.
 */
@Repository
public class JobJsonRepository {
    private static final Logger log = LoggerFactory.getLogger(JobJsonRepository.class);
    private static final TypeReference<LinkedHashMap<String, BackupJob>> TABLE_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Path jobsFile;

    public JobJsonRepository(ObjectMapper objectMapper, MirrorSyncProperties properties) {
        this.objectMapper = objectMapper;
        this.jobsFile = properties.getStorage().resolveJobsFile();
    }

    public Path getJobsFile() {
        return jobsFile;
    }

    public Map<String, BackupJob> load() {
        if (!Files.exists(jobsFile)) {
            log.info("No job table at {}, starting empty", jobsFile);
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, BackupJob> jobs = objectMapper.readValue(jobsFile.toFile(), TABLE_TYPE);
            return jobs == null ? new LinkedHashMap<>() : jobs;
        } catch (IOException e) {
            throw new JobStoreException("Failed to read job table " + jobsFile, e);
        }
    }

    public synchronized void save(Map<String, BackupJob> jobs) {
        Path tempFile = tempFile();
        try {
            Path parent = jobsFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(tempFile)) {
                objectMapper.writeValue(out, new LinkedHashMap<>(jobs));
            }
            commit(tempFile);
        } catch (IOException e) {
            throw new JobStoreException("Failed to write job table " + jobsFile, e);
        }
    }

    Path tempFile() {
        return jobsFile.resolveSibling(jobsFile.getFileName() + ".tmp");
    }

    void commit(Path tempFile) throws IOException {
        try {
            Files.move(tempFile, jobsFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to plain replace", jobsFile);
            Files.move(tempFile, jobsFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
