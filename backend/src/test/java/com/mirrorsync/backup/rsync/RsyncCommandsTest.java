package com.mirrorsync.backup.rsync;

import com.mirrorsync.config.MirrorSyncProperties;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RsyncCommandsTest {

    private final RsyncCommands commands = new RsyncCommands(new MirrorSyncProperties());

    @Test
    void previewAddsDryRunAndItemizeToArchiveFlags() {
        assertThat(commands.preview("/data/src", "/backup/dst"))
            .containsExactly("rsync", "-a", "--delete", "--dry-run", "--itemize-changes", "/data/src/", "/backup/dst/");
    }

    @Test
    void mirrorUsesOnlyArchiveFlags() {
        assertThat(commands.mirror("/data/src///", "/backup/dst/"))
            .containsExactly("rsync", "-a", "--delete", "/data/src/", "/backup/dst/");
    }

    @Test
    void rootPathStaysRoot() {
        assertThat(RsyncCommands.asDirectoryContents("/")).isEqualTo("/");
    }

    @Test
    void benignExitCodesAreAccepted() {
        assertThat(commands.isAccepted(0)).isTrue();
        assertThat(commands.isAccepted(23)).isTrue();
        assertThat(commands.isAccepted(24)).isTrue();
        assertThat(commands.isAccepted(1)).isFalse();
        assertThat(commands.isAccepted(12)).isFalse();
    }

    @Test
    void configuredBinaryIsUsed() {
        MirrorSyncProperties properties = new MirrorSyncProperties();
        properties.getRsync().setBinary("/usr/local/bin/rsync");
        assertThat(new RsyncCommands(properties).mirror("/a", "/b").get(0)).isEqualTo("/usr/local/bin/rsync");
    }
}
