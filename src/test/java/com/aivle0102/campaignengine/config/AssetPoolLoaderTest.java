package com.aivle0102.campaignengine.config;

import com.aivle0102.campaignengine.domain.AssetCategory;
import com.aivle0102.campaignengine.domain.AssetRecord;
import com.aivle0102.campaignengine.service.AssetMatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AssetPoolLoaderTest {

    @TempDir
    Path tempDir;

    private AssetPoolLoader loader;
    private static final List<String> PRODUCTS = List.of("Widget Pro", "Gadget Mini");

    @BeforeEach
    void setUp() {
        CampaignProperties properties = new CampaignProperties();
        properties.setBaseDir(tempDir.toString());
        loader = new AssetPoolLoader(properties, new AssetMatcher());
    }

    private void write(String category, String filename) throws IOException {
        Path dir = tempDir.resolve("input/assets").resolve(category);
        Files.createDirectories(dir);
        Files.writeString(dir.resolve(filename), filename);
    }

    @Test
    @DisplayName("scans logos, backgrounds, product images in that order, files sorted by name")
    void scanOrder() throws Exception {
        write("product-images", "widget_pro_front.png");
        write("backgrounds", "studio.jpg");
        write("logos", "z_logo.png");
        write("logos", "a_logo.png");

        List<AssetRecord> pool = loader.load(PRODUCTS);

        assertEquals(List.of("a_logo.png", "z_logo.png", "studio.jpg", "widget_pro_front.png"),
                pool.stream().map(AssetRecord::getFilename).toList());
        assertEquals(List.of(AssetCategory.LOGO, AssetCategory.LOGO, AssetCategory.BACKGROUND, AssetCategory.PRODUCT_IMAGE),
                pool.stream().map(AssetRecord::getCategory).toList());
    }

    @Test
    @DisplayName("tags each asset with its best product match")
    void productMatch() throws Exception {
        write("product-images", "gadget_mini_hero.PNG");
        write("logos", "brand.svg");

        List<AssetRecord> pool = loader.load(PRODUCTS);

        AssetRecord logo = pool.get(0);
        assertTrue(logo.isGeneric());
        assertEquals("image/svg+xml", logo.getMimeType());

        AssetRecord hero = pool.get(1);
        assertEquals("Gadget Mini", hero.getProductMatch());
        assertEquals("image/png", hero.getMimeType());
        assertArrayEquals("gadget_mini_hero.PNG".getBytes(), hero.getPayload());
        assertEquals(Path.of("input/assets/product-images/gadget_mini_hero.PNG").toString(), hero.getSourcePath());
    }

    @Test
    @DisplayName("skips hidden files, non-images and nested directories")
    void skipsNonImages() throws Exception {
        write("logos", ".hidden.png");
        write("logos", "notes.txt");
        write("logos", "logo.jpeg");
        Files.createDirectories(tempDir.resolve("input/assets/logos/old.png"));

        List<AssetRecord> pool = loader.load(PRODUCTS);

        assertEquals(1, pool.size());
        assertEquals("logo.jpeg", pool.get(0).getFilename());
        assertEquals("image/jpeg", pool.get(0).getMimeType());
    }

    @Test
    @DisplayName("missing asset directories yield an empty pool")
    void missingDirectories() {
        assertTrue(loader.load(PRODUCTS).isEmpty());
    }

    @Test
    @DisplayName("mime types by extension")
    void mimeTypes() {
        assertEquals("image/jpeg", AssetPoolLoader.mimeTypeOf("a.JPG"));
        assertEquals("image/png", AssetPoolLoader.mimeTypeOf("a.png"));
        assertEquals("image/png", AssetPoolLoader.mimeTypeOf("noextension"));
    }
}
