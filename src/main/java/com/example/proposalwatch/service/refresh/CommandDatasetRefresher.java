package com.example.proposalwatch.service.refresh;

import com.example.proposalwatch.config.ProposalWatchProperties;
import com.example.proposalwatch.exception.RefreshFailureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * Runs the configured external command that regenerates the datasets.
 * <p>
 * Combined stdout and stderr go to a temporary file so a chatty command cannot block on a full
 * pipe; the tail of it is kept for failure messages.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandDatasetRefresher implements DatasetRefresher {

    private static final int OUTPUT_EXCERPT_CHARS = 1000;

    private final ProposalWatchProperties properties;

    @Override
    public void refresh() {
        var refresh = properties.getRefresh();
        var command = refresh.getCommand();
        log.info("Refreshing datasets: {}", String.join(" ", command));

        Path output = null;
        try {
            output = Files.createTempFile("proposal-refresh-", ".log");
            var process = new ProcessBuilder(command)
                    .directory(new File(refresh.getWorkingDir()))
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile())
                    .start();

            if (!process.waitFor(refresh.getTimeoutSeconds(), TimeUnit.SECONDS)) {
                process.destroyForcibly();
                log.error("Dataset refresh timed out after {}s", refresh.getTimeoutSeconds());
                throw new RefreshFailureException(refresh.getTimeoutSeconds());
            }

            var exitCode = process.exitValue();
            if (exitCode != 0) {
                var excerpt = tail(output);
                log.error("Dataset refresh exited with code {}: {}", exitCode, excerpt);
                throw new RefreshFailureException(exitCode, excerpt);
            }

            log.info("Datasets refreshed");
            if (log.isDebugEnabled()) {
                log.debug("Refresh output: {}", tail(output));
            }
        } catch (IOException e) {
            log.error("Dataset refresh could not be started: {}", e.getMessage(), e);
            throw new RefreshFailureException(e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RefreshFailureException("interrupted while waiting for the refresh command", e);
        } finally {
            deleteQuietly(output);
        }
    }

    private static String tail(Path output) {
        try {
            var text = Files.readString(output, StandardCharsets.UTF_8).strip();
            return text.length() <= OUTPUT_EXCERPT_CHARS ? text : text.substring(text.length() - OUTPUT_EXCERPT_CHARS);
        } catch (IOException e) {
            return "<output unavailable: " + e.getMessage() + ">";
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", path, e.getMessage());
        }
    }
}
