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
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Adaptive LZW (Lempel-Ziv-Welch) codec with fixed-width 16-bit codes.
 *
 * <p>The compressed stream is a flat sequence of codes, 2 bytes per code, big-endian,
 * without any header. The dictionary is seeded by 256 single-byte literals (codes 0..255)
 * and grows by one entry per emitted code until it contains {@link #maxTableSize()} entries;
 * after this, it is frozen, and the matching continues against the existing entries.
 *
 * <p>Note: the table size is not stored in the stream. Decompressing by a codec with another
 * {@link #maxTableSize()} than was used for compression usually produces wrong data
 * without any exception.
 */
public class LZWCodec implements Compressor {
    public static final int NUMBER_OF_LITERALS = 256;
    public static final int CODE_WIDTH_IN_BYTES = 2;
    public static final int MAX_POSSIBLE_TABLE_SIZE = 1 << (8 * CODE_WIDTH_IN_BYTES);
    public static final int DEFAULT_MAX_TABLE_SIZE = 4096;

    private static final int INITIAL_RESULT_CAPACITY = 1 << 24;

    private static final System.Logger LOG = System.getLogger(LZWCodec.class.getName());
    private static final boolean LOGGABLE_DEBUG = LOG.isLoggable(System.Logger.Level.DEBUG);

    private final int maxTableSize;

    public LZWCodec() {
        this(DEFAULT_MAX_TABLE_SIZE);
    }

    public LZWCodec(int maxTableSize) {
        this.maxTableSize = checkMaxTableSize(maxTableSize);
    }

    public int maxTableSize() {
        return maxTableSize;
    }

    public static int checkMaxTableSize(int maxTableSize) {
        if (maxTableSize < NUMBER_OF_LITERALS || maxTableSize > MAX_POSSIBLE_TABLE_SIZE) {
            throw new IllegalArgumentException("Invalid LZW maximal table size " + maxTableSize +
                    ": must be in range " + NUMBER_OF_LITERALS + ".." + MAX_POSSIBLE_TABLE_SIZE);
        }
        return maxTableSize;
    }

    @Override
    public byte[] compress(byte[] data) throws CompressionException {
        Objects.requireNonNull(data, "Null data");
        final Map<Integer, Integer> table = new HashMap<>();
        // - key is (prefixCode << 8) | nextByte; literals are not stored here, their code is the byte itself
        final ByteArrayOutputStream result = new ByteArrayOutputStream(data.length);
        int tableSize = NUMBER_OF_LITERALS;
        int w = -1;
        // - code of the current match; -1 means the empty match
        for (byte b : data) {
            final int k = b & 0xFF;
            if (w == -1) {
                w = k;
                continue;
            }
            final int key = (w << 8) | k;
            final Integer wk = table.get(key);
            if (wk != null) {
                w = wk;
            } else {
                writeCode(result, w);
                if (tableSize < maxTableSize) {
                    table.put(key, tableSize++);
                }
                w = k;
            }
        }
        if (w != -1) {
            writeCode(result, w);
        }
        if (LOGGABLE_DEBUG) {
            LOG.log(System.Logger.Level.DEBUG, () -> String.format(
                    "LZW compressed %d bytes to %d codes (table %d/%d entries)",
                    data.length, result.size() / CODE_WIDTH_IN_BYTES, table.size() + NUMBER_OF_LITERALS,
                    maxTableSize));
        }
        return result.toByteArray();
    }

    @Override
    public byte[] decompress(byte[] data) throws CompressionException {
        Objects.requireNonNull(data, "Null data");
        if (data.length == 0) {
            throw new DecompressionException("Invalid LZW data: empty stream does not contain any code");
        }
        if (data.length % CODE_WIDTH_IN_BYTES != 0) {
            throw new DecompressionException("Invalid LZW data: stream length " + data.length +
                    " is not a multiple of the code width " + CODE_WIDTH_IN_BYTES);
        }
        final List<byte[]> table = new ArrayList<>(
                (int) Math.min(maxTableSize, (long) data.length + NUMBER_OF_LITERALS));
        for (int i = 0; i < NUMBER_OF_LITERALS; i++) {
            table.add(new byte[]{(byte) i});
        }
        final ByteArrayOutputStream result = new ByteArrayOutputStream(
                (int) Math.min(2L * data.length, INITIAL_RESULT_CAPACITY));
        final int firstCode = readCode(data, 0);
        if (firstCode >= NUMBER_OF_LITERALS) {
            throw new DecompressionException("Invalid LZW data: the first code " + firstCode +
                    " is not a literal");
        }
        byte[] w = table.get(firstCode);
        result.writeBytes(w);
        for (int p = CODE_WIDTH_IN_BYTES; p < data.length; p += CODE_WIDTH_IN_BYTES) {
            final int k = readCode(data, p);
            final int tableSize = table.size();
            final byte[] entry;
            if (k < tableSize) {
                entry = table.get(k);
            } else if (k == tableSize) {
                // - the encoder has just added this code for the previous match
                entry = append(w, w[0]);
            } else {
                throw new DecompressionException("Invalid LZW data: code " + k + " at position " + p +
                        " is out of the table (" + tableSize + " entries)");
            }
            result.writeBytes(entry);
            if (tableSize < maxTableSize) {
                table.add(append(w, entry[0]));
            }
            w = entry;
        }
        return result.toByteArray();
    }

    @Override
    public String toString() {
        return "LZW codec (maximal table size " + maxTableSize + ")";
    }

    private static void writeCode(ByteArrayOutputStream stream, int code) {
        assert code >= 0 && code < MAX_POSSIBLE_TABLE_SIZE;
        stream.write(code >>> 8);
        stream.write(code & 0xFF);
    }

    private static int readCode(byte[] data, int offset) {
        return ((data[offset] & 0xFF) << 8) | (data[offset + 1] & 0xFF);
    }

    private static byte[] append(byte[] sequence, byte last) {
        final byte[] result = new byte[sequence.length + 1];
        System.arraycopy(sequence, 0, result, 0, sequence.length);
        result[sequence.length] = last;
        return result;
    }
}
