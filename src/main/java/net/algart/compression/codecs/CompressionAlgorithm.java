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

package net.algart.compression.codecs;

import java.util.Locale;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Compression algorithms, which can be selected by name, for example, in a configuration file.
 */
public enum CompressionAlgorithm {
    LZW("lzw", (level, maxTableSize) -> new LZWCodec(maxTableSize)),
    // - the level is not used by LZW
    DEFLATE("deflate", (level, maxTableSize) -> level == null ? new DeflateCodec() : new DeflateCodec(level));

    private final String algorithmName;
    private final BiFunction<Integer, Integer, Compressor> factory;

    CompressionAlgorithm(String algorithmName, BiFunction<Integer, Integer, Compressor> factory) {
        this.algorithmName = Objects.requireNonNull(algorithmName);
        this.factory = Objects.requireNonNull(factory);
    }

    public String algorithmName() {
        return algorithmName;
    }

    /**
     * Creates new codec for this algorithm.
     *
     * @param level        compression level (used by {@link #DEFLATE}); <code>null</code> means the default level.
     * @param maxTableSize maximal dictionary size (used by {@link #LZW}).
     * @return new codec.
     * @throws IllegalArgumentException if the level or the table size is out of the allowed range.
     */
    public Compressor newCompressor(Integer level, int maxTableSize) {
        return factory.apply(level, maxTableSize);
    }

    public Compressor newCompressor() {
        return newCompressor(null, LZWCodec.DEFAULT_MAX_TABLE_SIZE);
    }

    public static CompressionAlgorithm ofName(String algorithmName) throws UnsupportedCompressionException {
        Objects.requireNonNull(algorithmName, "Null algorithm name");
        final String name = algorithmName.trim().toLowerCase(Locale.ROOT);
        for (CompressionAlgorithm value : values()) {
            if (value.algorithmName.equals(name)) {
                return value;
            }
        }
        throw new UnsupportedCompressionException("Unknown compression algorithm: \"" + algorithmName + "\"");
    }

    @Override
    public String toString() {
        return algorithmName;
    }
}
