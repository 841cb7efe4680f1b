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

package net.algart.compression.tests.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import net.algart.compression.codecs.CompressionAlgorithm;
import net.algart.compression.codecs.CompressionException;
import net.algart.compression.codecs.Compressor;
import net.algart.compression.codecs.DeflateCodec;
import net.algart.compression.codecs.LZWCodec;
import net.algart.compression.config.CompressionConfig;
import net.algart.compression.config.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CompressionConfigTest {
    @TempDir
    Path tempDir;

    @Test
    void testLoadFromResource() throws IOException, URISyntaxException {
        final Path file = Path.of(CompressionConfigTest.class.getResource("deflate.json").toURI());
        final CompressionConfig config = CompressionConfig.load(file);
        assertEquals("deflate", config.getCompressionAlgorithm());
        assertEquals(9, config.getCompressionLevel());
        assertEquals(CompressionAlgorithm.DEFLATE, config.algorithm());
        final Compressor compressor = config.newCompressor();
        assertInstanceOf(DeflateCodec.class, compressor);
        assertEquals(9, ((DeflateCodec) compressor).level());
    }

    @Test
    void testLoadLzw() throws IOException {
        final Path file = tempDir.resolve("lzw.json");
        Files.writeString(file, "{\"compression_algorithm\": \"LZW\", \"max_table_size\": 1024}");
        final CompressionConfig config = CompressionConfig.load(file);
        assertNull(config.getCompressionLevel());
        final Compressor compressor = config.newCompressor();
        assertInstanceOf(LZWCodec.class, compressor);
        assertEquals(1024, ((LZWCodec) compressor).maxTableSize());
    }

    @Test
    void testDefaults() throws IOException {
        final CompressionConfig config = CompressionConfig.valueOf("{\"compression_algorithm\": \"lzw\"}");
        assertEquals(LZWCodec.DEFAULT_MAX_TABLE_SIZE, config.getMaxTableSize());
        assertNull(config.getCompressionLevel());
        final CompressionConfig deflate = CompressionConfig.valueOf("{\"compression_algorithm\": \"deflate\"}");
        assertEquals(DeflateCodec.DEFAULT_LEVEL, ((DeflateCodec) deflate.newCompressor()).level());
    }

    @Test
    void testInvalidValues() {
        assertThrows(ConfigurationException.class, () -> CompressionConfig.valueOf("{}"));
        assertThrows(ConfigurationException.class,
                () -> CompressionConfig.valueOf("{\"compression_algorithm\": \"zstd\"}"));
        assertThrows(ConfigurationException.class,
                () -> CompressionConfig.valueOf("{\"compression_algorithm\": \"deflate\", \"compression_level\": 10}"));
        assertThrows(ConfigurationException.class,
                () -> CompressionConfig.valueOf("{\"compression_algorithm\": \"lzw\", \"max_table_size\": 100}"));
        assertThrows(ConfigurationException.class,
                () -> CompressionConfig.valueOf("{\"compression_algorithm\": \"lzw\", \"max_table_size\": 70000}"));
        assertThrows(ConfigurationException.class, () -> CompressionConfig.valueOf("null"));
    }

    @Test
    void testConfigurationExceptionIsCompressionException() {
        assertThrows(CompressionException.class, () -> new CompressionConfig().newCompressor());
    }

    @Test
    void testInvalidJson() throws IOException {
        assertThrows(JsonProcessingException.class, () -> CompressionConfig.valueOf("{\"compression_algorithm\": "));
        final Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "compression_algorithm = lzw");
        assertThrows(IOException.class, () -> CompressionConfig.load(file));
        assertThrows(IOException.class, () -> CompressionConfig.load(tempDir.resolve("missing.json")));
    }

    @Test
    void testSetters() throws ConfigurationException {
        final CompressionConfig config = new CompressionConfig()
                .setAlgorithm(CompressionAlgorithm.DEFLATE)
                .setCompressionLevel(1)
                .setMaxTableSize(512);
        assertEquals("deflate", config.getCompressionAlgorithm());
        assertEquals(1, ((DeflateCodec) config.newCompressor()).level());
        config.setCompressionAlgorithm("lzw");
        assertEquals(512, ((LZWCodec) config.newCompressor()).maxTableSize());
    }
}
