package com.assetdiffbot.core.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AssetDiffPropertiesTest {

    private final AssetDiffProperties properties = new AssetDiffProperties();

    @Test
    void defaults() {
        assertEquals(Path.of("./repos"), properties.getReposDir());
        assertEquals("mdb", properties.getBranchPrefix());
        assertEquals(55_000, properties.getReport().getDetailCeiling());
        assertEquals(60_000, properties.getReport().getReportCeiling());
        assertEquals("0 30 11 * * *", properties.getMaintenance().getCron());
    }

    @Test
    void assetTypeIsMatchedByExtensionIgnoringCase() {
        assertTrue(properties.isSpriteFile("icons/door.dmi"));
        assertTrue(properties.isSpriteFile("icons/DOOR.DMI"));
        assertFalse(properties.isSpriteFile("icons/door.dmi.txt"));
        assertTrue(properties.isMapFile("maps/station.dmm"));
        assertFalse(properties.isMapFile(null));
    }

    @Test
    void extensionsAreConfigurable() {
        properties.getRender().setSpriteExtensions(List.of(".png"));

        assertTrue(properties.isSpriteFile("a.png"));
        assertFalse(properties.isSpriteFile("a.dmi"));
    }

    @Test
    void remoteUrlFromTemplate() {
        assertEquals("https://github.com/owner/repo.git", properties.remoteUrlFor("owner/repo"));
    }

    @Test
    void nonPositiveThreadCountUsesAvailableProcessors() {
        properties.getRender().setThreads(0);
        assertEquals(Runtime.getRuntime().availableProcessors(), properties.getRenderThreads());

        properties.getRender().setThreads(3);
        assertEquals(3, properties.getRenderThreads());
    }
}
