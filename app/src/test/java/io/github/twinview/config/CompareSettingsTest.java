package io.github.twinview.config;

import static org.junit.jupiter.api.Assertions.*;

import io.github.twinview.api.CompareOptions;
import io.github.twinview.api.ViewId;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompareSettingsTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearOverrides() {
        System.clearProperty("twinview.view.followCaret");
    }

    @Test
    void defaults() {
        var settings = new CompareSettings();

        assertEquals(ViewId.SUB, settings.getNewFileView());
        assertTrue(settings.isDetectMoves());
        assertTrue(settings.isShowOnlySelections());
        assertTrue(settings.isFollowCaret());
        assertFalse(settings.isAutoRecompare());
        assertEquals(TimingConstants.REPLACE_DETECTION_WINDOW_MS, settings.getReplaceDetectionWindowMs());
        assertEquals(StatusType.COMPARE_SUMMARY, settings.getStatusType());
    }

    @Test
    void invalidValuesFallBackToDefaults() {
        var settings = CompareSettings.loadResource("compare-test.properties");

        assertEquals(ViewId.MAIN, settings.getNewFileView(), "enum values are case insensitive");
        assertTrue(settings.isIgnoreCase());
        assertTrue(settings.isWrapAround());
        assertFalse(settings.isAutoRecompare(), "'yes' is not a boolean");
        assertEquals(TimingConstants.REPLACE_DETECTION_WINDOW_MS, settings.getReplaceDetectionWindowMs());
        assertEquals(StatusType.COMPARE_OPTIONS, settings.getStatusType());
    }

    @Test
    void missingResourceGivesDefaults() {
        var settings = CompareSettings.loadResource("no-such-settings.properties");
        assertEquals(ViewId.SUB, settings.getNewFileView());
    }

    @Test
    void saveAndLoad() throws IOException {
        var settings = new CompareSettings();
        settings.setShowOnlyDiffs(true);
        settings.setIgnoreSpaces(true);
        settings.setReplaceDetectionWindowMs(75);
        settings.setStatusType(StatusType.STATUS_DISABLED);

        Path file = tempDir.resolve("nested").resolve(CompareSettings.FILE_NAME);
        settings.save(file);

        assertTrue(Files.exists(file));
        var loaded = CompareSettings.load(file);
        assertTrue(loaded.isShowOnlyDiffs());
        assertTrue(loaded.isIgnoreSpaces());
        assertEquals(75, loaded.getReplaceDetectionWindowMs());
        assertEquals(StatusType.STATUS_DISABLED, loaded.getStatusType());
    }

    @Test
    void missingFileGivesDefaults() {
        var settings = CompareSettings.load(tempDir.resolve("absent.properties"));
        assertFalse(settings.isShowOnlyDiffs());
    }

    @Test
    void everyDocumentedKeyIsRead() {
        var props = new Properties();
        props.setProperty("compare.newFileView", "MAIN");
        props.setProperty("compare.firstFileIsNew", "true");
        props.setProperty("compare.ignoreSpaces", "true");
        props.setProperty("compare.ignoreCase", "true");
        props.setProperty("compare.ignoreEmptyLines", "true");
        props.setProperty("compare.ignoreLineNumbers", "true");
        props.setProperty("compare.detectMoves", "false");
        props.setProperty("compare.charPrecision", "true");
        props.setProperty("view.showOnlyDiffs", "true");
        props.setProperty("view.showOnlySelections", "false");
        props.setProperty("view.followCaret", "false");
        props.setProperty("view.wrapAround", "true");
        props.setProperty("view.gotoFirstDiff", "true");
        props.setProperty("edit.autoRecompare", "true");
        props.setProperty("edit.replaceDetectionWindowMs", "60");
        props.setProperty("status.type", "STATUS_DISABLED");

        var settings = CompareSettings.fromProperties(props);

        assertEquals(ViewId.MAIN, settings.getNewFileView());
        assertTrue(settings.isFirstFileIsNew());
        assertTrue(settings.isIgnoreSpaces());
        assertTrue(settings.isIgnoreCase());
        assertTrue(settings.isIgnoreEmptyLines());
        assertTrue(settings.isIgnoreLineNumbers());
        assertFalse(settings.isDetectMoves());
        assertTrue(settings.isCharPrecision());
        assertTrue(settings.isShowOnlyDiffs());
        assertFalse(settings.isShowOnlySelections());
        assertFalse(settings.isFollowCaret());
        assertTrue(settings.isWrapAround());
        assertTrue(settings.isGotoFirstDiff());
        assertTrue(settings.isAutoRecompare());
        assertEquals(60, settings.getReplaceDetectionWindowMs());
        assertEquals(StatusType.STATUS_DISABLED, settings.getStatusType());
    }

    @Test
    void systemPropertyOverridesFile() {
        var props = new Properties();
        props.setProperty("view.followCaret", "true");
        System.setProperty("twinview.view.followCaret", "false");

        assertFalse(CompareSettings.fromProperties(props).isFollowCaret());
    }

    @Test
    void applyToCopiesCompareOptionsOnly() {
        var settings = new CompareSettings();
        settings.setNewFileView(ViewId.MAIN);
        settings.setIgnoreEmptyLines(true);
        settings.setDetectMoves(false);

        var options = new CompareOptions();
        options.setFindUniqueMode(true);
        settings.applyTo(options);

        assertEquals(ViewId.MAIN, options.getNewFileView());
        assertEquals(ViewId.SUB, options.getOldFileView());
        assertTrue(options.isIgnoreEmptyLines());
        assertFalse(options.isDetectMoves());
        assertTrue(options.isFindUniqueMode(), "mode flags are left alone");
    }

    @Test
    void statusTypeCycles() {
        assertEquals(StatusType.COMPARE_OPTIONS, StatusType.COMPARE_SUMMARY.next());
        assertEquals(StatusType.STATUS_DISABLED, StatusType.COMPARE_OPTIONS.next());
        assertEquals(StatusType.COMPARE_SUMMARY, StatusType.STATUS_DISABLED.next());
    }
}
