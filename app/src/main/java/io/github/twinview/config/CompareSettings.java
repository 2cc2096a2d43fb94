package io.github.twinview.config;

import io.github.twinview.api.CompareOptions;
import io.github.twinview.api.ViewId;
import io.github.twinview.util.AtomicWrites;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * User settings of the compare engine.
 *
 * <p>Loaded from a {@code compare.properties} file. Keys:
 * <ul>
 *   <li>{@code compare.newFileView}: MAIN|SUB</li>
 *   <li>{@code compare.firstFileIsNew}: boolean</li>
 *   <li>{@code compare.ignoreSpaces} / {@code ignoreCase} / {@code ignoreEmptyLines} / {@code ignoreLineNumbers} /
 *       {@code detectMoves} / {@code charPrecision}: boolean</li>
 *   <li>{@code view.showOnlyDiffs} / {@code showOnlySelections} / {@code followCaret} / {@code wrapAround} /
 *       {@code gotoFirstDiff}: boolean</li>
 *   <li>{@code edit.autoRecompare}: boolean</li>
 *   <li>{@code edit.replaceDetectionWindowMs}: int</li>
 *   <li>{@code status.type}: COMPARE_SUMMARY|COMPARE_OPTIONS|STATUS_DISABLED</li>
 * </ul>
 *
 * <p>Every key can be overridden with a system property of the same name prefixed by {@code twinview.}. The file
 * lives in a platform-appropriate folder:
 * <ul>
 *   <li>Windows: %APPDATA%/TwinView</li>
 *   <li>macOS: ~/Library/Application Support/TwinView</li>
 *   <li>Linux: $XDG_CONFIG_HOME/TwinView (fallback: ~/.config/TwinView)</li>
 * </ul>
 */
public final class CompareSettings {
    private static final Logger logger = LogManager.getLogger(CompareSettings.class);

    public static final String FILE_NAME = "compare.properties";
    private static final String SYSTEM_PROPERTY_PREFIX = "twinview.";

    private static final String KEY_NEW_FILE_VIEW = "compare.newFileView";
    private static final String KEY_FIRST_FILE_IS_NEW = "compare.firstFileIsNew";
    private static final String KEY_IGNORE_SPACES = "compare.ignoreSpaces";
    private static final String KEY_IGNORE_CASE = "compare.ignoreCase";
    private static final String KEY_IGNORE_EMPTY_LINES = "compare.ignoreEmptyLines";
    private static final String KEY_IGNORE_LINE_NUMBERS = "compare.ignoreLineNumbers";
    private static final String KEY_DETECT_MOVES = "compare.detectMoves";
    private static final String KEY_CHAR_PRECISION = "compare.charPrecision";
    private static final String KEY_SHOW_ONLY_DIFFS = "view.showOnlyDiffs";
    private static final String KEY_SHOW_ONLY_SELECTIONS = "view.showOnlySelections";
    private static final String KEY_FOLLOW_CARET = "view.followCaret";
    private static final String KEY_WRAP_AROUND = "view.wrapAround";
    private static final String KEY_GOTO_FIRST_DIFF = "view.gotoFirstDiff";
    private static final String KEY_AUTO_RECOMPARE = "edit.autoRecompare";
    private static final String KEY_REPLACE_WINDOW = "edit.replaceDetectionWindowMs";
    private static final String KEY_STATUS_TYPE = "status.type";

    private ViewId newFileView = ViewId.SUB;
    private boolean firstFileIsNew = false;

    private boolean ignoreSpaces = false;
    private boolean ignoreCase = false;
    private boolean ignoreEmptyLines = false;
    private boolean ignoreLineNumbers = false;
    private boolean detectMoves = true;
    private boolean charPrecision = false;

    private boolean showOnlyDiffs = false;
    private boolean showOnlySelections = true;
    private boolean followCaret = true;
    private boolean wrapAround = false;
    private boolean gotoFirstDiff = false;

    private boolean autoRecompare = false;
    private int replaceDetectionWindowMs = TimingConstants.REPLACE_DETECTION_WINDOW_MS;

    private StatusType statusType = StatusType.COMPARE_SUMMARY;

    public CompareSettings() {}

    public static Path getConfigDir() {
        var os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            var appData = System.getenv("APPDATA");
            Path base = (appData != null && !appData.isBlank())
                    ? Path.of(appData)
                    : Path.of(System.getProperty("user.home"), "AppData", "Roaming");
            return base.resolve("TwinView");
        } else if (os.contains("mac")) {
            return Path.of(System.getProperty("user.home"), "Library", "Application Support", "TwinView");
        } else {
            var xdg = System.getenv("XDG_CONFIG_HOME");
            Path base = (xdg != null && !xdg.isBlank())
                    ? Path.of(xdg)
                    : Path.of(System.getProperty("user.home"), ".config");
            return base.resolve("TwinView");
        }
    }

    /** Settings from the platform config folder, defaults when the file is missing or unreadable. */
    public static CompareSettings loadDefault() {
        return load(getConfigDir().resolve(FILE_NAME));
    }

    public static CompareSettings load(Path file) {
        var props = new Properties();
        if (Files.exists(file)) {
            try (var reader = Files.newBufferedReader(file)) {
                props.load(reader);
            } catch (IOException e) {
                logger.warn("Failed to load compare settings from {}: {}", file, e.getMessage());
            }
        }
        return fromProperties(props);
    }

    public void save(Path file) throws IOException {
        AtomicWrites.saveProperties(file, toProperties(), "TwinView compare settings");
        logger.debug("Saved compare settings to {}", file);
    }

    /** Writes the settings to the platform config folder; failures are logged, the settings stay in effect. */
    public void saveDefault() {
        var file = getConfigDir().resolve(FILE_NAME);
        try {
            save(file);
        } catch (IOException e) {
            logger.warn("Failed to save compare settings to {}: {}", file, e.getMessage());
        }
    }

    /** Settings from a classpath resource, defaults when it does not exist. */
    public static CompareSettings loadResource(String resourceName) {
        var props = new Properties();
        try (InputStream in = CompareSettings.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in != null) {
                props.load(in);
            } else {
                logger.debug("No compare settings resource {}, using defaults", resourceName);
            }
        } catch (IOException e) {
            logger.warn("Failed to load compare settings resource {}: {}", resourceName, e.getMessage());
        }
        return fromProperties(props);
    }

    public static CompareSettings fromProperties(Properties props) {
        var settings = new CompareSettings();

        settings.newFileView = getEnum(props, KEY_NEW_FILE_VIEW, ViewId.class, settings.newFileView);
        settings.firstFileIsNew = getBoolean(props, KEY_FIRST_FILE_IS_NEW, settings.firstFileIsNew);
        settings.ignoreSpaces = getBoolean(props, KEY_IGNORE_SPACES, settings.ignoreSpaces);
        settings.ignoreCase = getBoolean(props, KEY_IGNORE_CASE, settings.ignoreCase);
        settings.ignoreEmptyLines = getBoolean(props, KEY_IGNORE_EMPTY_LINES, settings.ignoreEmptyLines);
        settings.ignoreLineNumbers = getBoolean(props, KEY_IGNORE_LINE_NUMBERS, settings.ignoreLineNumbers);
        settings.detectMoves = getBoolean(props, KEY_DETECT_MOVES, settings.detectMoves);
        settings.charPrecision = getBoolean(props, KEY_CHAR_PRECISION, settings.charPrecision);
        settings.showOnlyDiffs = getBoolean(props, KEY_SHOW_ONLY_DIFFS, settings.showOnlyDiffs);
        settings.showOnlySelections = getBoolean(props, KEY_SHOW_ONLY_SELECTIONS, settings.showOnlySelections);
        settings.followCaret = getBoolean(props, KEY_FOLLOW_CARET, settings.followCaret);
        settings.wrapAround = getBoolean(props, KEY_WRAP_AROUND, settings.wrapAround);
        settings.gotoFirstDiff = getBoolean(props, KEY_GOTO_FIRST_DIFF, settings.gotoFirstDiff);
        settings.autoRecompare = getBoolean(props, KEY_AUTO_RECOMPARE, settings.autoRecompare);
        settings.replaceDetectionWindowMs = getInt(props, KEY_REPLACE_WINDOW, settings.replaceDetectionWindowMs);
        settings.statusType = getEnum(props, KEY_STATUS_TYPE, StatusType.class, settings.statusType);

        if (settings.replaceDetectionWindowMs < 0) {
            logger.warn("Negative {} ({}), using default", KEY_REPLACE_WINDOW, settings.replaceDetectionWindowMs);
            settings.replaceDetectionWindowMs = TimingConstants.REPLACE_DETECTION_WINDOW_MS;
        }

        return settings;
    }

    public Properties toProperties() {
        var props = new Properties();
        props.setProperty(KEY_NEW_FILE_VIEW, newFileView.name());
        props.setProperty(KEY_FIRST_FILE_IS_NEW, Boolean.toString(firstFileIsNew));
        props.setProperty(KEY_IGNORE_SPACES, Boolean.toString(ignoreSpaces));
        props.setProperty(KEY_IGNORE_CASE, Boolean.toString(ignoreCase));
        props.setProperty(KEY_IGNORE_EMPTY_LINES, Boolean.toString(ignoreEmptyLines));
        props.setProperty(KEY_IGNORE_LINE_NUMBERS, Boolean.toString(ignoreLineNumbers));
        props.setProperty(KEY_DETECT_MOVES, Boolean.toString(detectMoves));
        props.setProperty(KEY_CHAR_PRECISION, Boolean.toString(charPrecision));
        props.setProperty(KEY_SHOW_ONLY_DIFFS, Boolean.toString(showOnlyDiffs));
        props.setProperty(KEY_SHOW_ONLY_SELECTIONS, Boolean.toString(showOnlySelections));
        props.setProperty(KEY_FOLLOW_CARET, Boolean.toString(followCaret));
        props.setProperty(KEY_WRAP_AROUND, Boolean.toString(wrapAround));
        props.setProperty(KEY_GOTO_FIRST_DIFF, Boolean.toString(gotoFirstDiff));
        props.setProperty(KEY_AUTO_RECOMPARE, Boolean.toString(autoRecompare));
        props.setProperty(KEY_REPLACE_WINDOW, Integer.toString(replaceDetectionWindowMs));
        props.setProperty(KEY_STATUS_TYPE, statusType.name());
        return props;
    }

    /** Copies the compare-time options into {@code options}. Selection state is left alone. */
    public void applyTo(CompareOptions options) {
        options.setNewFileView(newFileView);
        options.setIgnoreSpaces(ignoreSpaces);
        options.setIgnoreCase(ignoreCase);
        options.setIgnoreEmptyLines(ignoreEmptyLines);
        options.setIgnoreLineNumbers(ignoreLineNumbers);
        options.setDetectMoves(detectMoves);
        options.setCharPrecision(charPrecision);
    }

    private static @Nullable String lookup(Properties props, String key) {
        var override = System.getProperty(SYSTEM_PROPERTY_PREFIX + key);
        if (override != null && !override.isBlank()) {
            return override.trim();
        }
        var raw = props.getProperty(key);
        return raw == null || raw.isBlank() ? null : raw.trim();
    }

    private static boolean getBoolean(Properties props, String key, boolean fallback) {
        var raw = lookup(props, key);
        if (raw == null) return fallback;
        if (raw.equalsIgnoreCase("true") || raw.equalsIgnoreCase("false")) {
            return Boolean.parseBoolean(raw);
        }
        logger.warn("Invalid boolean for {}: '{}', using {}", key, raw, fallback);
        return fallback;
    }

    private static int getInt(Properties props, String key, int fallback) {
        var raw = lookup(props, key);
        if (raw == null) return fallback;
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer for {}: '{}', using {}", key, raw, fallback);
            return fallback;
        }
    }

    private static <E extends Enum<E>> E getEnum(Properties props, String key, Class<E> type, E fallback) {
        var raw = lookup(props, key);
        if (raw == null) return fallback;
        try {
            return Enum.valueOf(type, raw.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("Invalid value for {}: '{}', using {}", key, raw, fallback);
            return fallback;
        }
    }

    public ViewId getNewFileView() {
        return newFileView;
    }

    public void setNewFileView(ViewId newFileView) {
        this.newFileView = newFileView;
    }

    public boolean isFirstFileIsNew() {
        return firstFileIsNew;
    }

    public void setFirstFileIsNew(boolean firstFileIsNew) {
        this.firstFileIsNew = firstFileIsNew;
    }

    public boolean isIgnoreSpaces() {
        return ignoreSpaces;
    }

    public void setIgnoreSpaces(boolean ignoreSpaces) {
        this.ignoreSpaces = ignoreSpaces;
    }

    public boolean isIgnoreCase() {
        return ignoreCase;
    }

    public void setIgnoreCase(boolean ignoreCase) {
        this.ignoreCase = ignoreCase;
    }

    public boolean isIgnoreEmptyLines() {
        return ignoreEmptyLines;
    }

    public void setIgnoreEmptyLines(boolean ignoreEmptyLines) {
        this.ignoreEmptyLines = ignoreEmptyLines;
    }

    public boolean isIgnoreLineNumbers() {
        return ignoreLineNumbers;
    }

    public void setIgnoreLineNumbers(boolean ignoreLineNumbers) {
        this.ignoreLineNumbers = ignoreLineNumbers;
    }

    public boolean isDetectMoves() {
        return detectMoves;
    }

    public void setDetectMoves(boolean detectMoves) {
        this.detectMoves = detectMoves;
    }

    public boolean isCharPrecision() {
        return charPrecision;
    }

    public void setCharPrecision(boolean charPrecision) {
        this.charPrecision = charPrecision;
    }

    public boolean isShowOnlyDiffs() {
        return showOnlyDiffs;
    }

    public void setShowOnlyDiffs(boolean showOnlyDiffs) {
        this.showOnlyDiffs = showOnlyDiffs;
    }

    public boolean isShowOnlySelections() {
        return showOnlySelections;
    }

    public void setShowOnlySelections(boolean showOnlySelections) {
        this.showOnlySelections = showOnlySelections;
    }

    public boolean isFollowCaret() {
        return followCaret;
    }

    public void setFollowCaret(boolean followCaret) {
        this.followCaret = followCaret;
    }

    public boolean isWrapAround() {
        return wrapAround;
    }

    public void setWrapAround(boolean wrapAround) {
        this.wrapAround = wrapAround;
    }

    public boolean isGotoFirstDiff() {
        return gotoFirstDiff;
    }

    public void setGotoFirstDiff(boolean gotoFirstDiff) {
        this.gotoFirstDiff = gotoFirstDiff;
    }

    public boolean isAutoRecompare() {
        return autoRecompare;
    }

    public void setAutoRecompare(boolean autoRecompare) {
        this.autoRecompare = autoRecompare;
    }

    /** Heuristic window pairing a pre-delete with a following insert as one "replace"; not a guarantee. */
    public int getReplaceDetectionWindowMs() {
        return replaceDetectionWindowMs;
    }

    public void setReplaceDetectionWindowMs(int replaceDetectionWindowMs) {
        this.replaceDetectionWindowMs = replaceDetectionWindowMs;
    }

    public StatusType getStatusType() {
        return statusType;
    }

    public void setStatusType(StatusType statusType) {
        this.statusType = statusType;
    }
}
