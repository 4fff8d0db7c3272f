package com.example.proposalwatch.service.notification;

import com.example.proposalwatch.config.NotificationProperties;
import com.example.proposalwatch.exception.NotificationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Shows a desktop popup through {@code notify-send} on Linux or {@code osascript} on macOS.
 */
@Slf4j
@Component
public class DesktopNotificationChannel implements NotificationChannel {

    private static final String POPUP_TITLE = "New Blockchain Proposals";
    private static final long COMMAND_TIMEOUT_SECONDS = 10;

    private final NotificationProperties.Desktop properties;
    private final String osName;

    public DesktopNotificationChannel(NotificationProperties properties) {
        this.properties = properties.getDesktop();
        this.osName = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
    }

    @Override
    public String getName() {
        return "desktop";
    }

    @Override
    public boolean isEnabled() {
        return properties.isEnabled();
    }

    @Override
    public void send(ProposalDigest digest) {
        var message = digest.getTotalCount() + " new proposals detected";
        var command = popupCommand(osName, POPUP_TITLE, message);

        try {
            var process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            if (!process.waitFor(COMMAND_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new NotificationException(getName(), "popup command timed out");
            }
            if (process.exitValue() != 0) {
                throw new NotificationException(getName(), "popup command exited with code " + process.exitValue());
            }
        } catch (IOException e) {
            throw new NotificationException(getName(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationException(getName(), e);
        }
    }

    static List<String> popupCommand(String osName, String title, String message) {
        if (osName.contains("mac")) {
            var script = "display notification \"" + escapeAppleScript(message)
                    + "\" with title \"" + escapeAppleScript(title) + "\"";
            return List.of("osascript", "-e", script);
        }
        if (osName.contains("linux") || osName.contains("nix") || osName.contains("bsd")) {
            return List.of("notify-send", title, message);
        }
        throw new NotificationException("desktop", "desktop popups are not supported on " + osName);
    }

    private static String escapeAppleScript(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
