package com.convoviewer.viewer.adapter;

import org.springframework.util.StringUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Default log locations per operating system.
 */
public final class PlatformPaths {

    private PlatformPaths() {
    }

    /**
     * Use the configured path when set, the default otherwise. A leading {@code ~} is expanded.
     */
    public static Path resolve(String configured, Path fallback) {
        if (!StringUtils.hasText(configured)) {
            return fallback;
        }
        String value = configured.trim();
        if (value.equals("~") || value.startsWith("~/")) {
            value = System.getProperty("user.home") + value.substring(1);
        }
        return Paths.get(value).toAbsolutePath().normalize();
    }

    public static Path home() {
        return Paths.get(System.getProperty("user.home"));
    }

    public static Path claudeProjects() {
        return home().resolve(".claude").resolve("projects");
    }

    public static Path qwenTmp() {
        return home().resolve(".qwen").resolve("tmp");
    }

    /**
     * {@code workspaceStorage} directory of a VS Code based editor.
     *
     * @param appName - Application directory name, e.g. "Cursor"
     */
    public static Path workspaceStorage(String appName) {
        return workspaceStorage(appName, System.getProperty("os.name", ""), home(), System.getenv("APPDATA"));
    }

    static Path workspaceStorage(String appName, String osName, Path home, String appData) {
        String os = osName.toLowerCase(Locale.ROOT);
        Path userDir;
        if (os.contains("mac") || os.contains("darwin")) {
            userDir = home.resolve("Library").resolve("Application Support").resolve(appName).resolve("User");
        } else if (os.contains("win")) {
            Path base = StringUtils.hasText(appData) ? Paths.get(appData) : home.resolve("AppData").resolve("Roaming");
            userDir = base.resolve(appName).resolve("User");
        } else {
            userDir = home.resolve(".config").resolve(appName).resolve("User");
        }
        return userDir.resolve("workspaceStorage");
    }
}
