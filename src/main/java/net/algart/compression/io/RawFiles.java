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

package net.algart.compression.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reading and writing files as plain byte sequences, without any header.
 */
public class RawFiles {
    private static final System.Logger LOG = System.getLogger(RawFiles.class.getName());

    private RawFiles() {
    }

    public static byte[] read(Path file) throws IOException {
        Objects.requireNonNull(file, "Null file");
        final byte[] result = Files.readAllBytes(file);
        LOG.log(System.Logger.Level.DEBUG, () -> "Read " + result.length + " bytes from " + file);
        return result;
    }

    /**
     * Writes all bytes into the file; the file is created or truncated if it already exists.
     *
     * @param file target file.
     * @param data bytes to write.
     * @throws IOException in the case of any I/O errors.
     */
    public static void write(Path file, byte[] data) throws IOException {
        Objects.requireNonNull(file, "Null file");
        Objects.requireNonNull(data, "Null data");
        Files.write(file, data);
        LOG.log(System.Logger.Level.DEBUG, () -> "Written " + data.length + " bytes to " + file);
    }
}
