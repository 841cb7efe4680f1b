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

package net.algart.compression.data;

import java.util.Objects;

public class ByteStatistics {
    private ByteStatistics() {
    }

    public static long[] histogram(byte[] data) {
        Objects.requireNonNull(data, "Null data");
        final long[] result = new long[256];
        for (byte b : data) {
            result[b & 0xFF]++;
        }
        return result;
    }

    /**
     * Returns Shannon entropy of the byte values, in bits per byte: from 0.0 (empty array
     * or single repeated value) to 8.0 (all 256 values are equally probable).
     *
     * @param data some bytes.
     * @return entropy in bits per byte.
     */
    public static double entropy(byte[] data) {
        final long[] histogram = histogram(data);
        if (data.length == 0) {
            return 0.0;
        }
        final double length = data.length;
        double result = 0.0;
        for (long count : histogram) {
            if (count != 0) {
                final double p = count / length;
                result -= p * Math.log(p);
            }
        }
        return Math.max(result / Math.log(2.0), 0.0);
        // - avoiding -0.0 for a single repeated value
    }

    /**
     * Returns the ratio <code>originalLength/compressedLength</code>; for empty compressed data,
     * returns {@link Double#POSITIVE_INFINITY} (or 1.0 when both lengths are zero).
     */
    public static double compressionRatio(long originalLength, long compressedLength) {
        if (originalLength < 0) {
            throw new IllegalArgumentException("Negative originalLength = " + originalLength);
        }
        if (compressedLength < 0) {
            throw new IllegalArgumentException("Negative compressedLength = " + compressedLength);
        }
        if (compressedLength == 0) {
            return originalLength == 0 ? 1.0 : Double.POSITIVE_INFINITY;
        }
        return (double) originalLength / (double) compressedLength;
    }
}
