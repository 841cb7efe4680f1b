/*
 * The MIT License (MIT)
 *
 * Copyright (c) 2023-2026 Daniel Alievsky, AlgART Laboratory (http://algart.net)
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package net.algart.compression.tests.app;

import net.algart.compression.app.ImageCompress;
import net.algart.compression.codecs.DecompressionException;
import net.algart.compression.codecs.UnsupportedCompressionException;
import net.algart.compression.io.RGBImage;
import net.algart.compression.io.RGBImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ImageCompressTest {
    @TempDir
    Path tempDir;

    private Path imageFile;
    private RGBImage image;

    @BeforeEach
    void setUp() throws IOException {
        final BufferedImage bufferedImage = new BufferedImage(64, 48, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < bufferedImage.getHeight(); y++) {
            for (int x = 0; x < bufferedImage.getWidth(); x++) {
                bufferedImage.setRGB(x, y, (x / 8) * 0x200000 + (y / 8) * 0x2000 + 0x40);
            }
        }
        imageFile = tempDir.resolve("sample.png");
        assertTrue(ImageIO.write(bufferedImage, "png", imageFile.toFile()));
        image = RGBImages.readRGB(imageFile);
    }

    private void checkRoundTrip(String... options) throws IOException {
        final Path compressed = tempDir.resolve("compressed.bin");
        final Path restored = tempDir.resolve("restored.raw");
        final String[] compressArgs = new String[options.length + 2];
        System.arraycopy(options, 0, compressArgs, 0, options.length);
        compressArgs[options.length] = imageFile.toString();
        compressArgs[options.length + 1] = compressed.toString();
        ImageCompress.main(compressArgs);
        assertTrue(Files.size(compressed) < image.bytes().length);

        final String[] decompressArgs = new String[options.length + 3];
        decompressArgs[0] = "-decompress";
        System.arraycopy(options, 0, decompressArgs, 1, options.length);
        decompressArgs[options.length + 1] = compressed.toString();
        decompressArgs[options.length + 2] = restored.toString();
        ImageCompress.main(decompressArgs);
        assertArrayEquals(image.bytes(), Files.readAllBytes(restored));
    }

    @Test
    void testDefaultLzw() throws IOException {
        checkRoundTrip();
    }

    @Test
    void testLzwWithTableSize() throws IOException {
        checkRoundTrip("-algorithm=lzw", "-maxTableSize=65536");
    }

    @Test
    void testDeflate() throws IOException {
        checkRoundTrip("-algorithm=deflate", "-level=9");
    }

    @Test
    void testConfigFile() throws IOException {
        final Path config = tempDir.resolve("settings.json");
        Files.writeString(config, "{\"compression_algorithm\": \"deflate\", \"compression_level\": 1}");
        checkRoundTrip("-config=" + config);
        checkRoundTrip("-config=" + config, "-algorithm=lzw");
    }

    @Test
    void testCorruptedInput() throws IOException {
        final Path corrupted = tempDir.resolve("corrupted.bin");
        Files.write(corrupted, new byte[]{0, 0x41, 0x7F});
        final Path restored = tempDir.resolve("restored.raw");
        assertThrows(DecompressionException.class, () -> ImageCompress.main(
                new String[]{"-decompress", corrupted.toString(), restored.toString()}));
        assertFalse(Files.exists(restored));
    }

    @Test
    void testInvalidOptions() {
        assertThrows(UnsupportedCompressionException.class,
                () -> ImageCompress.main(new String[]{"-algorithm=rle", "a.png", "b.bin"}));
        assertThrows(IllegalArgumentException.class,
                () -> ImageCompress.main(new String[]{"-unknown", "a.png", "b.bin"}));
    }

    @Test
    void testUsage() throws IOException {
        ImageCompress.main(new String[0]);
        ImageCompress.main(new String[]{"-algorithm=lzw", "only-input.png"});
    }
}
