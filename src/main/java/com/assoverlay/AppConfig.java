package com.assoverlay;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Application configuration: HTTP port, dev mode, log location and an optional script to preload.
 */
public class AppConfig {

    private static final String APP_NAME = "ASS-Overlay";
    public static final int DEFAULT_PORT = 8080;

    private final Path subtitlePath;
    private final Path logPath;
    private final int port;
    private final boolean devMode;

    private AppConfig(Path subtitlePath, Path logPath, int port, boolean devMode) {
        this.subtitlePath = subtitlePath;
        this.logPath = logPath;
        this.port = port;
        this.devMode = devMode;
    }

    /**
     * Script to load at startup, or null.
     */
    public Path getSubtitlePath() {
        return subtitlePath;
    }

    public Path getLogPath() {
        return logPath;
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\ASS-Overlay\logs
     * macOS: ~/Library/Logs/ASS-Overlay
     * Linux: ~/.local/share/ASS-Overlay/logs
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            if (appData == null) {
                appData = Paths.get(userHome, "AppData", "Roaming").toString();
            }
            return Paths.get(appData, APP_NAME, "logs");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Logs", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
        }
    }

    public static Path getLogFilePath() {
        return getLogDirectory().resolve("ass-overlay.log");
    }

    /**
     * Returns the preferred port when it is free, otherwise an ephemeral one.
     * If neither can be bound the preferred port is returned and the server start fails.
     */
    public static int findAvailablePort(int preferredPort) {
        try (ServerSocket socket = new ServerSocket(preferredPort)) {
            socket.setReuseAddress(true);
            return preferredPort;
        } catch (IOException busy) {
            try (ServerSocket socket = new ServerSocket(0)) {
                return socket.getLocalPort();
            } catch (IOException e) {
                return preferredPort;
            }
        }
    }

    public static Path ensureLogDirectory() throws IOException {
        Files.createDirectories(getLogDirectory());
        return getLogFilePath();
    }

    public static class Builder {
        private Path subtitlePath = null;
        private int preferredPort = DEFAULT_PORT;
        private boolean devMode = false;

        public Builder subtitlePath(String path) {
            if (path != null && !path.isEmpty()) {
                this.subtitlePath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder port(int port) {
            this.preferredPort = port;
            return this;
        }

        public Builder devMode(boolean devMode) {
            this.devMode = devMode;
            return this;
        }

        public Path getSubtitlePath() {
            return subtitlePath;
        }

        public int getPreferredPort() {
            return preferredPort;
        }

        public boolean isDevMode() {
            return devMode;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];

                // --subtitles=value or --subtitles value
                if (arg.startsWith("--subtitles=")) {
                    subtitlePath(arg.substring("--subtitles=".length()));
                } else if ("--subtitles".equals(arg) && i + 1 < args.length) {
                    subtitlePath(args[++i]);
                }

                // --port=value or --port value
                else if (arg.startsWith("--port=")) {
                    parsePort(arg.substring("--port=".length()));
                } else if ("--port".equals(arg) && i + 1 < args.length) {
                    parsePort(args[++i]);
                }

                else if ("--dev".equals(arg)) {
                    this.devMode = true;
                }
            }
            return this;
        }

        private void parsePort(String value) {
            try {
                this.preferredPort = Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                System.err.println("Ignoring invalid port '" + value + "', using " + preferredPort);
            }
        }

        public AppConfig build() throws IOException {
            int port = findAvailablePort(preferredPort);
            Path logPath = ensureLogDirectory();
            return new AppConfig(subtitlePath, logPath, port, devMode);
        }
    }
}
