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

import java.io.ByteArrayOutputStream;
import java.util.Objects;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * This class implements raw Deflate (RFC 1951) compression/decompression, without ZLIB header and checksum.
 */
public class DeflateCodec implements Compressor {
    public static final int DEFAULT_LEVEL = 6;

    private static final int BUFFER_SIZE = 65536;

    private final int level;

    public DeflateCodec() {
        this(DEFAULT_LEVEL);
    }

    public DeflateCodec(int level) {
        this.level = checkLevel(level);
    }

    public int level() {
        return level;
    }

    public static int checkLevel(int level) {
        if (level < Deflater.NO_COMPRESSION || level > Deflater.BEST_COMPRESSION) {
            throw new IllegalArgumentException("Invalid Deflate compression level " + level +
                    ": must be in range " + Deflater.NO_COMPRESSION + ".." + Deflater.BEST_COMPRESSION);
        }
        return level;
    }

    @Override
    public byte[] compress(byte[] data) {
        Objects.requireNonNull(data, "Null data");
        final Deflater deflater = new Deflater(level, true);
        try {
            deflater.setInput(data);
            deflater.finish();

            final ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
            final byte[] buffer = new byte[BUFFER_SIZE];
            while (!deflater.finished()) {
                final int compressedSize = deflater.deflate(buffer);
                outputStream.write(buffer, 0, compressedSize);
            }
            return outputStream.toByteArray();
        } finally {
            deflater.end();
        }
    }

    @Override
    public byte[] decompress(byte[] data) throws DecompressionException {
        Objects.requireNonNull(data, "Null data");
        final Inflater inflater = new Inflater(true);
        try {
            inflater.setInput(data);

            final ByteArrayOutputStream outputStream = new ByteArrayOutputStream();
            final byte[] buffer = new byte[BUFFER_SIZE];
            while (!inflater.finished()) {
                final int decompressedSize = inflater.inflate(buffer);
                if (decompressedSize == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new DecompressionException("Invalid Deflate data: unexpected end of compressed block");
                }
                outputStream.write(buffer, 0, decompressedSize);
            }
            return outputStream.toByteArray();
        } catch (DataFormatException e) {
            throw new DecompressionException("Invalid Deflate data: broken compressed block", e);
        } finally {
            inflater.end();
        }
    }

    @Override
    public String toString() {
        return "Deflate codec (compression level " + level + ")";
    }
}
