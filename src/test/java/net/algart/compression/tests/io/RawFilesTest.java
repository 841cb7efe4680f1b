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

package net.algart.compression.tests.io;

import net.algart.compression.io.RawFiles;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RawFilesTest {
    @TempDir
    Path tempDir;

    @Test
    void testWriteAndRead() throws IOException {
        final Path file = tempDir.resolve("output.bin");
        final byte[] data = {1, 2, 3, (byte) 0xFF, 0};
        RawFiles.write(file, data);
        assertArrayEquals(data, Files.readAllBytes(file));
        assertArrayEquals(data, RawFiles.read(file));
    }

    @Test
    void testOverwriteTruncates() throws IOException {
        final Path file = tempDir.resolve("output.bin");
        RawFiles.write(file, new byte[1000]);
        RawFiles.write(file, new byte[]{42});
        assertEquals(1, Files.size(file));
        assertArrayEquals(new byte[]{42}, RawFiles.read(file));
    }

    @Test
    void testEmptyData() throws IOException {
        final Path file = tempDir.resolve("empty.bin");
        RawFiles.write(file, new byte[0]);
        assertTrue(Files.exists(file));
        assertEquals(0, RawFiles.read(file).length);
    }

    @Test
    void testErrors() {
        assertThrows(NoSuchFileException.class, () -> RawFiles.read(tempDir.resolve("missing.bin")));
        assertThrows(IOException.class, () -> RawFiles.write(tempDir.resolve("no-dir").resolve("a.bin"), new byte[1]));
        assertThrows(NullPointerException.class, () -> RawFiles.write(tempDir.resolve("a.bin"), null));
    }
}
