package com.autosort;

import com.autosort.models.OracleEndpointConfig;
import com.autosort.models.OracleKind;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Application configuration handling platform-specific paths and settings.
 */
public class AppConfig {

    private static final String APP_NAME = "AutoSort";
    static final int DEFAULT_PORT = 8095;

    private final Path rootPath;
    private final Path logPath;
    private final Path dataDirectory;
    private final int port;
    private final boolean devMode;
    private final OracleEndpointConfig oracle;
    private final int workers;
    private final boolean refine;
    private final boolean fresh;

    private AppConfig(Builder b, Path rootPath, Path logPath, Path dataDirectory, int port,
                      OracleEndpointConfig oracle) {
        this.rootPath = rootPath;
        this.logPath = logPath;
        this.dataDirectory = dataDirectory;
        this.port = port;
        this.devMode = b.devMode;
        this.oracle = oracle;
        this.workers = b.workers;
        this.refine = b.refine;
        this.fresh = b.fresh;
    }

    public Path getRootPath() {
        return rootPath;
    }

    public Path getLogPath() {
        return logPath;
    }

    public Path getDataDirectory() {
        return dataDirectory;
    }

    public Path getCachePath() {
        return dataDirectory.resolve("suggestion-cache.json");
    }

    public int getPort() {
        return port;
    }

    public boolean isDevMode() {
        return devMode;
    }

    public OracleEndpointConfig getOracle() {
        return oracle;
    }

    /**
     * Worker pool size; 0 means the default.
     */
    public int getWorkers() {
        return workers;
    }

    public boolean isRefine() {
        return refine;
    }

    public boolean isFresh() {
        return fresh;
    }

    /**
     * Get the log directory path based on the operating system.
     * Windows: %APPDATA%\AutoSort\logs
     * macOS: ~/Library/Logs/AutoSort
     * Linux: ~/.local/share/AutoSort/logs
     */
    public static Path getLogDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            return appDataDirectory(userHome).resolve("logs");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Logs", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME, "logs");
        }
    }

    /**
     * Directory for the suggestion cache and scan journals.
     * Windows: %APPDATA%\AutoSort
     * macOS: ~/Library/Application Support/AutoSort
     * Linux: ~/.local/share/AutoSort
     */
    public static Path getDefaultDataDirectory() {
        String os = System.getProperty("os.name").toLowerCase();
        String userHome = System.getProperty("user.home");

        if (os.contains("win")) {
            return appDataDirectory(userHome);
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Application Support", APP_NAME);
        } else {
            return Paths.get(userHome, ".local", "share", APP_NAME);
        }
    }

    private static Path appDataDirectory(String userHome) {
        String appData = System.getenv("APPDATA");
        if (appData == null) {
            appData = Paths.get(userHome, "AppData", "Roaming").toString();
        }
        return Paths.get(appData, APP_NAME);
    }

    /**
     * Find an available port, starting with the preferred port.
     * If the preferred port is in use, finds the next available port.
     */
    public static int findAvailablePort(int preferredPort) {
        if (isPortAvailable(preferredPort)) {
            return preferredPort;
        }

        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            for (int port = preferredPort + 1; port < preferredPort + 100; port++) {
                if (isPortAvailable(port)) {
                    return port;
                }
            }
        }

        // Last resort: return the preferred port and let it fail later with a clear error
        return preferredPort;
    }

    public static boolean isPortAvailable(int port) {
        try (ServerSocket socket = new ServerSocket(port)) {
            socket.setReuseAddress(true);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * Builder for AppConfig.
     */
    public static class Builder {
        private Path rootPath = null;
        private Path dataDirectory = null;
        private Path logDirectory = null;
        private int preferredPort = DEFAULT_PORT;
        private boolean devMode = false;
        private String provider = "ollama";
        private String model = null;
        private String baseUrl = null;
        private String apiKey = null;
        private int workers = 0;
        private boolean refine = true;
        private boolean fresh = false;
        private Map<String, String> environment = System.getenv();

        public Builder rootPath(String path) {
            if (path != null && !path.isEmpty()) {
                this.rootPath = Paths.get(path).toAbsolutePath().normalize();
            }
            return this;
        }

        public Builder dataDirectory(Path dataDirectory) {
            this.dataDirectory = dataDirectory;
            return this;
        }

        public Builder logDirectory(Path logDirectory) {
            this.logDirectory = logDirectory;
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

        public Builder provider(String provider) {
            OracleKind.fromName(provider);
            this.provider = provider;
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            this.environment = environment != null ? environment : Map.of();
            return this;
        }

        public Builder parseArgs(String[] args) {
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                String name = arg;
                String value = null;
                int eq = arg.indexOf('=');
                if (arg.startsWith("--") && eq > 0) {
                    name = arg.substring(0, eq);
                    value = arg.substring(eq + 1);
                }

                switch (name) {
                    case "--dev":
                        this.devMode = true;
                        continue;
                    case "--no-refine":
                        this.refine = false;
                        continue;
                    case "--fresh":
                        this.fresh = true;
                        continue;
                    default:
                        break;
                }

                boolean consumedNext = false;
                if (value == null) {
                    if (i + 1 >= args.length) {
                        continue;
                    }
                    value = args[++i];
                    consumedNext = true;
                }
                switch (name) {
                    case "--root":
                        rootPath(value);
                        break;
                    case "--port":
                        this.preferredPort = parseInt(name, value);
                        break;
                    case "--provider":
                        provider(value);
                        break;
                    case "--model":
                        this.model = value;
                        break;
                    case "--base-url":
                        this.baseUrl = value;
                        break;
                    case "--api-key":
                        this.apiKey = value;
                        break;
                    case "--workers":
                        this.workers = Math.max(0, parseInt(name, value));
                        break;
                    default:
                        // unknown flag: leave the following argument to the next iteration
                        if (consumedNext) {
                            i--;
                        }
                        break;
                }
            }
            return this;
        }

        private static int parseInt(String name, String value) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + " expects a number: " + value);
            }
        }

        OracleEndpointConfig resolveOracle() {
            OracleKind kind = OracleKind.fromName(provider);
            OracleEndpointConfig config = OracleEndpointConfig.defaultsFor(kind);
            if (model != null && !model.isBlank()) {
                config.setModel(model.trim());
            }
            if (baseUrl != null && !baseUrl.isBlank()) {
                config.setBaseUrl(baseUrl.trim());
            }
            config.setApiKey(resolveApiKey(kind));
            return config;
        }

        private String resolveApiKey(OracleKind kind) {
            if (apiKey != null && !apiKey.isBlank()) {
                return apiKey.trim();
            }
            if (!kind.isHosted()) {
                return null;
            }
            String key = environment.get("AUTOSORT_API_KEY");
            if (key == null || key.isBlank()) {
                key = environment.get(kind == OracleKind.GROK ? "XAI_API_KEY" : "OPENAI_API_KEY");
            }
            return key == null || key.isBlank() ? null : key.trim();
        }

        public AppConfig build() throws IOException {
            Path root = rootPath != null ? rootPath : Paths.get("").toAbsolutePath().normalize();
            Path data = dataDirectory != null ? dataDirectory : getDefaultDataDirectory();
            Path logs = logDirectory != null ? logDirectory : getLogDirectory();
            Files.createDirectories(data);
            Files.createDirectories(logs);
            int port = findAvailablePort(preferredPort);
            return new AppConfig(this, root, logs.resolve("autosort.log"), data, port, resolveOracle());
        }
    }
}
