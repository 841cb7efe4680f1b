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

package net.algart.compression.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import net.algart.compression.codecs.CompressionAlgorithm;
import net.algart.compression.codecs.Compressor;
import net.algart.compression.codecs.DeflateCodec;
import net.algart.compression.codecs.LZWCodec;
import net.algart.compression.codecs.UnsupportedCompressionException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Settings selecting the codec, usually loaded from a JSON file like the following:
 * <pre>
 * {
 *   "compression_algorithm": "deflate",
 *   "compression_level": 9
 * }
 * </pre>
 *
 * <p>Fields <code>compression_level</code> (used by Deflate) and <code>max_table_size</code>
 * (used by LZW, 4096 by default) are optional. Unknown fields are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CompressionConfig {
    private static final System.Logger LOG = System.getLogger(CompressionConfig.class.getName());

    static final ObjectMapper OBJECT_MAPPER = JsonMapper.builder()
            .enable(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION)
            .build();

    @JsonProperty("compression_algorithm")
    private String compressionAlgorithm = null;
    @JsonProperty("compression_level")
    private Integer compressionLevel = null;
    @JsonProperty("max_table_size")
    private int maxTableSize = LZWCodec.DEFAULT_MAX_TABLE_SIZE;

    public CompressionConfig() {
    }

    /**
     * Loads and checks the configuration.
     *
     * @param file JSON file.
     * @return the loaded configuration.
     * @throws ConfigurationException if the file is a correct JSON, but some values are invalid.
     * @throws IOException            if the file cannot be read or is not a correct JSON.
     */
    public static CompressionConfig load(Path file) throws IOException {
        Objects.requireNonNull(file, "Null file");
        final CompressionConfig result = OBJECT_MAPPER.readValue(file.toFile(), CompressionConfig.class);
        if (result == null) {
            throw new ConfigurationException("Empty configuration file " + file);
        }
        result.check();
        LOG.log(System.Logger.Level.DEBUG, () -> "Loaded configuration from " + file + ": " + result);
        return result;
    }

    public static CompressionConfig valueOf(String json) throws IOException {
        Objects.requireNonNull(json, "Null JSON");
        final CompressionConfig result = OBJECT_MAPPER.readValue(json, CompressionConfig.class);
        if (result == null) {
            throw new ConfigurationException("Empty configuration JSON");
        }
        return result.check();
    }

    public String getCompressionAlgorithm() {
        return compressionAlgorithm;
    }

    public CompressionConfig setCompressionAlgorithm(String compressionAlgorithm) {
        this.compressionAlgorithm = compressionAlgorithm;
        return this;
    }

    @JsonIgnore
    public CompressionConfig setAlgorithm(CompressionAlgorithm algorithm) {
        Objects.requireNonNull(algorithm, "Null algorithm");
        return setCompressionAlgorithm(algorithm.algorithmName());
    }

    public Integer getCompressionLevel() {
        return compressionLevel;
    }

    public CompressionConfig setCompressionLevel(Integer compressionLevel) {
        this.compressionLevel = compressionLevel;
        return this;
    }

    public int getMaxTableSize() {
        return maxTableSize;
    }

    public CompressionConfig setMaxTableSize(int maxTableSize) {
        this.maxTableSize = maxTableSize;
        return this;
    }

    public CompressionAlgorithm algorithm() throws ConfigurationException {
        if (compressionAlgorithm == null) {
            throw new ConfigurationException("Compression algorithm is not specified");
        }
        try {
            return CompressionAlgorithm.ofName(compressionAlgorithm);
        } catch (UnsupportedCompressionException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    public CompressionConfig check() throws ConfigurationException {
        algorithm();
        if (compressionLevel != null) {
            try {
                DeflateCodec.checkLevel(compressionLevel);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(e.getMessage(), e);
            }
        }
        try {
            LZWCodec.checkMaxTableSize(maxTableSize);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
        return this;
    }

    public Compressor newCompressor() throws ConfigurationException {
        check();
        return algorithm().newCompressor(compressionLevel, maxTableSize);
    }

    @Override
    public String toString() {
        return "CompressionConfig: " +
                "compressionAlgorithm=" + compressionAlgorithm +
                ", compressionLevel=" + compressionLevel +
                ", maxTableSize=" + maxTableSize;
    }
}
