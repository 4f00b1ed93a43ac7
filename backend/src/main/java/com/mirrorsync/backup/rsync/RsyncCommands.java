package com.mirrorsync.backup.rsync;

import com.mirrorsync.config.MirrorSyncProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Builds rsync command lines and classifies exit codes. Both the dry-run probe and the real run
 * share the archive base flags so the probe predicts exactly what the real run would do.
 */
@Component
public class RsyncCommands {
    private static final List<String> BASE_FLAGS = List.of("-a", "--delete");
    private static final List<String> PREVIEW_FLAGS = List.of("--dry-run", "--itemize-changes");

    private final String binary;
    private final Set<Integer> acceptedExitCodes;

    public RsyncCommands(MirrorSyncProperties properties) {
        this.binary = properties.getRsync().getBinary();
        this.acceptedExitCodes = properties.getRsync().acceptedExitCodeSet();
    }

    public List<String> preview(String source, String target) {
        return build(PREVIEW_FLAGS, source, target);
    }

    public List<String> mirror(String source, String target) {
        return build(List.of(), source, target);
    }

    public boolean isAccepted(int exitCode) {
        return acceptedExitCodes.contains(exitCode);
    }

    public void ensureDirectory(String target) {
        try {
            Files.createDirectories(Path.of(target));
        } catch (IOException e) {
            throw new SyncToolException("Failed to create target directory " + target + ": " + e.getMessage(), e);
        }
    }

    private List<String> build(List<String> modeFlags, String source, String target) {
        List<String> command = new ArrayList<>();
        command.add(binary);
        command.addAll(BASE_FLAGS);
        command.addAll(modeFlags);
        command.add(asDirectoryContents(source));
        command.add(asDirectoryContents(target));
        return command;
    }

    /**
     * rsync copies a directory's contents, not the directory itself, only when the path ends in '/'.
     */
    static String asDirectoryContents(String path) {
        String trimmed = path;
        while (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed.equals("/") ? trimmed : trimmed + "/";
    }
}
