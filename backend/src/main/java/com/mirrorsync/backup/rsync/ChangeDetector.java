package com.mirrorsync.backup.rsync;

import com.mirrorsync.backup.model.CommandResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Pre-flight probe: runs rsync in dry-run mode with itemized output and reports whether a real
 * run would change anything. Any itemized line counts as a change, metadata-only lines included.
 */
@Service
public class ChangeDetector {
    private static final Logger log = LoggerFactory.getLogger(ChangeDetector.class);

    private final RsyncCommands commands;
    private final RsyncCommandRunner runner;

    public ChangeDetector(RsyncCommands commands, RsyncCommandRunner runner) {
        this.commands = commands;
        this.runner = runner;
    }

    /**
     * @throws DetectionException if rsync exits with a status outside the accepted set
     * @throws SyncToolException if the target cannot be created or rsync cannot be started
     */
    public boolean hasChanges(String source, String target) {
        commands.ensureDirectory(target);
        CommandResult result = runner.capture(commands.preview(source, target));
        if (!commands.isAccepted(result.exitCode())) {
            throw new DetectionException(result.exitCode(), result.diagnostic());
        }
        String itemized = result.stdout() == null ? "" : result.stdout().trim();
        if (log.isDebugEnabled()) {
            log.debug("Dry-run {} -> {} rc={} itemizedLines={}",
                source, target, result.exitCode(), itemized.isEmpty() ? 0 : itemized.lines().count());
        }
        return !itemized.isEmpty();
    }
}
