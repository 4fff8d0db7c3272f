package com.example.proposalwatch.service.refresh;

import com.example.proposalwatch.config.ProposalWatchProperties;
import com.example.proposalwatch.exception.RefreshFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisabledOnOs(OS.WINDOWS)
@DisplayName("CommandDatasetRefresher Tests")
class CommandDatasetRefresherTest {

    @TempDir
    Path workingDir;

    private ProposalWatchProperties properties;
    private CommandDatasetRefresher refresher;

    @BeforeEach
    void setUp() {
        properties = new ProposalWatchProperties();
        properties.getRefresh().setWorkingDir(workingDir.toString());
        refresher = new CommandDatasetRefresher(properties);
    }

    private void command(String script) {
        properties.getRefresh().setCommand(List.of("sh", "-c", script));
    }

    @Test
    @DisplayName("Should run the command in the working directory")
    void shouldRunCommand() {
        command("echo '{\"items\": []}' > eips.json");

        assertThatCode(() -> refresher.refresh()).doesNotThrowAnyException();
        assertThat(workingDir.resolve("eips.json")).exists();
    }

    @Test
    @DisplayName("Should report the exit code and the output tail")
    void shouldReportExitCode() {
        command("echo 'GitHub API rate limit exceeded' >&2; exit 3");

        assertThatThrownBy(() -> refresher.refresh())
                .isInstanceOfSatisfying(RefreshFailureException.class, e -> {
                    assertThat(e.getExitCode()).isEqualTo(3);
                    assertThat(e.isTimedOut()).isFalse();
                    assertThat(e.getStderrExcerpt()).contains("rate limit exceeded");
                });
    }

    @Test
    @DisplayName("Should keep only the tail of long output")
    void shouldTruncateOutput() {
        command("i=0; while [ $i -lt 300 ]; do echo \"line $i of noisy output\"; i=$((i+1)); done; exit 1");

        assertThatThrownBy(() -> refresher.refresh())
                .isInstanceOfSatisfying(RefreshFailureException.class, e -> {
                    assertThat(e.getStderrExcerpt()).hasSizeLessThanOrEqualTo(1000);
                    assertThat(e.getStderrExcerpt()).endsWith("line 299 of noisy output");
                });
    }

    @Test
    @DisplayName("Should kill the command when it exceeds the timeout")
    void shouldTimeOut() {
        properties.getRefresh().setTimeoutSeconds(1);
        command("sleep 30");

        assertThatThrownBy(() -> refresher.refresh())
                .isInstanceOfSatisfying(RefreshFailureException.class, e -> {
                    assertThat(e.isTimedOut()).isTrue();
                    assertThat(e.getExitCode()).isNull();
                });
    }

    @Test
    @DisplayName("Should report a command that cannot be started")
    void shouldReportMissingCommand() throws IOException {
        properties.getRefresh().setCommand(List.of(workingDir.resolve("missing-script").toString()));

        assertThatThrownBy(() -> refresher.refresh())
                .isInstanceOf(RefreshFailureException.class)
                .hasCauseInstanceOf(IOException.class);
        try (var files = Files.list(workingDir)) {
            assertThat(files).isEmpty();
        }
    }
}
