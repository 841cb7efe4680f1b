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

/**
 * Lossless codec working with whole data blocks in memory.
 *
 * <p>Implementations do not keep any state between calls: every call creates its own working
 * structures, so one instance may be used from several threads simultaneously.
 */
public interface Compressor {
    /**
     * Compresses a block of data.
     *
     * @param data the data to be compressed.
     * @return the compressed data.
     * @throws CompressionException     if the data cannot be compressed.
     * @throws NullPointerException if <code>data</code> is <code>null</code>.
     */
    byte[] compress(byte[] data) throws CompressionException;

    /**
     * Decompresses a block of data.
     *
     * @param data the data to be decompressed.
     * @return the decompressed data.
     * @throws DecompressionException if data is not a valid compressed block for this codec.
     * @throws CompressionException   in a case of other problems.
     * @throws NullPointerException if <code>data</code> is <code>null</code>.
     */
    byte[] decompress(byte[] data) throws CompressionException;
}
