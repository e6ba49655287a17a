package jump.email.watcher.service;

import jump.email.watcher.model.PlatformSupport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Desktop notifications through the platform's own command-line tools
 * ({@code osascript}, {@code notify-send}, PowerShell). Commands are started without a shell
 * and every interpolated text is sanitized first.
 */
@Slf4j
@Service
public class DesktopNotificationService {
    private static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(5);
    private static final String LINUX_SOUND_FILE = "/usr/share/sounds/freedesktop/stereo/message-new-instant.oga";
    private static final int MAX_TEXT_LENGTH = 200;

    public enum Platform {
        MAC, LINUX, WINDOWS, OTHER
    }

    /**
     * Runs an external command and returns its exit code.
     */
    public interface CommandRunner {
        int run(List<String> command, Duration timeout) throws IOException, InterruptedException;
    }

    private final CommandRunner commandRunner;
    private final Platform platform;

    public DesktopNotificationService() {
        this(DesktopNotificationService::runProcess, detectPlatform(System.getProperty("os.name", "")));
    }

    public DesktopNotificationService(CommandRunner commandRunner, Platform platform) {
        this.commandRunner = commandRunner;
        this.platform = platform;
    }

    public Platform getPlatform() {
        return platform;
    }

    /**
     * Shows a notification. Text is sanitized here, so callers may pass raw subjects and names.
     * Line breaks in the body are kept; each line is sanitized on its own.
     *
     * @throws IOException if the tool is missing or exits with an error
     */
    public void notify(String title, String body, boolean sound) throws IOException, InterruptedException {
        String safeTitle = sanitizeForShell(title);
        String safeBody = sanitizeLines(body);
        switch (platform) {
            case MAC:
                String soundClause = sound ? " sound name \"Glass\"" : "";
                run(List.of("osascript", "-e",
                        "display notification \"" + safeBody + "\" with title \"" + safeTitle + "\"" + soundClause));
                break;
            case LINUX:
                run(List.of("notify-send", "-u", sound ? "critical" : "normal", safeTitle, safeBody));
                if (sound) {
                    playLinuxSound();
                }
                break;
            case WINDOWS:
                run(List.of("powershell", "-NoProfile", "-Command",
                        "[System.Reflection.Assembly]::LoadWithPartialName('System.Windows.Forms'); "
                                + "$n = New-Object System.Windows.Forms.NotifyIcon; "
                                + "$n.Icon = [System.Drawing.SystemIcons]::Information; "
                                + "$n.Visible = $true; "
                                + "$n.ShowBalloonTip(5000, '" + safeTitle + "', '" + safeBody + "', 'Info')"));
                break;
            default:
                throw new IOException("Desktop notifications are not supported on " + platform);
        }
    }

    public PlatformSupport checkPlatformSupport() {
        PlatformSupport.PlatformSupportBuilder builder = PlatformSupport.builder()
                .platform(platform.name().toLowerCase(Locale.ROOT));
        switch (platform) {
            case MAC:
                boolean osascript = isOnPath("osascript");
                builder.desktopTool(new PlatformSupport.Tool("osascript", osascript))
                        .soundTool(new PlatformSupport.Tool("afplay", isOnPath("afplay")))
                        .supported(osascript)
                        .setupInstruction("Open System Settings > Notifications and allow notifications for "
                                + "Script Editor (osascript posts as Script Editor).")
                        .setupInstruction("Make sure Focus / Do Not Disturb is off while testing.");
                if (!osascript) {
                    builder.issue("osascript was not found on PATH");
                }
                break;
            case LINUX:
                boolean notifySend = isOnPath("notify-send");
                boolean paplay = isOnPath("paplay");
                builder.desktopTool(new PlatformSupport.Tool("notify-send", notifySend))
                        .soundTool(new PlatformSupport.Tool("paplay", paplay))
                        .supported(notifySend)
                        .setupInstruction("Install libnotify: sudo apt install libnotify-bin (Debian/Ubuntu) "
                                + "or sudo dnf install libnotify (Fedora).")
                        .setupInstruction("A notification daemon must be running (most desktop environments ship one).")
                        .setupInstruction("For sound alerts install pulseaudio-utils to get paplay.");
                if (!notifySend) {
                    builder.issue("notify-send was not found on PATH");
                }
                if (!paplay) {
                    builder.issue("paplay was not found on PATH; sound alerts will be silent");
                }
                break;
            case WINDOWS:
                boolean powershell = isOnPath("powershell");
                builder.desktopTool(new PlatformSupport.Tool("powershell", powershell))
                        .soundTool(new PlatformSupport.Tool("system notification sound", powershell))
                        .supported(powershell)
                        .setupInstruction("Open Settings > System > Notifications and enable notifications.")
                        .setupInstruction("Turn off Focus Assist while testing.");
                if (!powershell) {
                    builder.issue("powershell was not found on PATH");
                }
                break;
            default:
                builder.desktopTool(new PlatformSupport.Tool("none", false))
                        .soundTool(new PlatformSupport.Tool("none", false))
                        .supported(false)
                        .issue("Unsupported platform: " + System.getProperty("os.name"))
                        .setupInstruction("Use a webhook (hooks.alerts.webhook-url) to receive alerts on this platform.");
                break;
        }
        return builder.build();
    }

    /**
     * Strips quote, backtick, backslash and dollar characters, flattens control whitespace,
     * drops other control characters and caps the length.
     */
    public static String sanitizeForShell(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = text
                .replaceAll("[\\\\\"'`$]", "")
                .replaceAll("[\\n\\r\\t]", " ")
                .replaceAll("[^\\x20-\\x7E\\u00A0-\\uFFFF]", "");
        return cleaned.length() > MAX_TEXT_LENGTH ? cleaned.substring(0, MAX_TEXT_LENGTH) : cleaned;
    }

    static String sanitizeLines(String text) {
        if (text == null) {
            return "";
        }
        return Arrays.stream(text.split("\n", -1))
                .map(DesktopNotificationService::sanitizeForShell)
                .collect(Collectors.joining("\n"));
    }

    static Platform detectPlatform(String osName) {
        String os = osName.toLowerCase(Locale.ROOT);
        if (os.contains("mac") || os.contains("darwin")) {
            return Platform.MAC;
        }
        if (os.contains("win")) {
            return Platform.WINDOWS;
        }
        if (os.contains("linux") || os.contains("nux")) {
            return Platform.LINUX;
        }
        return Platform.OTHER;
    }

    private void playLinuxSound() {
        try {
            run(List.of("paplay", LINUX_SOUND_FILE));
        } catch (IOException e) {
            log.debug("Sound alert failed: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void run(List<String> command) throws IOException, InterruptedException {
        int exit = commandRunner.run(command, COMMAND_TIMEOUT);
        if (exit != 0) {
            throw new IOException(command.get(0) + " exited with status " + exit);
        }
    }

    private static boolean isOnPath(String executable) {
        String path = System.getenv("PATH");
        if (path == null) {
            return false;
        }
        List<String> candidates = new ArrayList<>(List.of(executable));
        if (detectPlatform(System.getProperty("os.name", "")) == Platform.WINDOWS) {
            candidates.add(executable + ".exe");
        }
        for (String dir : path.split(File.pathSeparator)) {
            for (String candidate : candidates) {
                File file = new File(dir, candidate);
                if (file.isFile() && file.canExecute()) {
                    return true;
                }
            }
        }
        return false;
    }

    private static int runProcess(List<String> command, Duration timeout) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        Process process = pb.start();
        try (InputStream output = process.getInputStream()) {
            output.transferTo(OutputStream.nullOutputStream());
        }
        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            throw new IOException(command.get(0) + " timed out after " + timeout.toSeconds() + "s");
        }
        return process.exitValue();
    }
}
