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

package net.algart.compression.app;

import net.algart.compression.codecs.CompressionAlgorithm;
import net.algart.compression.codecs.Compressor;
import net.algart.compression.config.CompressionConfig;
import net.algart.compression.data.ByteStatistics;
import net.algart.compression.io.RGBImage;
import net.algart.compression.io.RGBImages;
import net.algart.compression.io.RawFiles;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

public class ImageCompress {
    private static final System.Logger LOG = System.getLogger(ImageCompress.class.getName());

    boolean decompress = false;
    Path configFile = null;
    CompressionAlgorithm algorithm = null;
    Integer level = null;
    Integer maxTableSize = null;

    public static void main(String[] args) throws IOException {
        doMain(args, true);
    }

    static boolean doMain(String[] args, boolean printUsage) throws IOException {
        final ImageCompress compress = new ImageCompress();
        int startArgIndex = 0;
        for (; startArgIndex < args.length && args[startArgIndex].startsWith("-"); startArgIndex++) {
            final String arg = args[startArgIndex];
            final String lower = arg.toLowerCase(Locale.ROOT);
            if (lower.equals("-decompress")) {
                compress.decompress = true;
            } else if (lower.startsWith("-config=")) {
                compress.configFile = Paths.get(arg.substring("-config=".length()));
            } else if (lower.startsWith("-algorithm=")) {
                compress.algorithm = CompressionAlgorithm.ofName(arg.substring("-algorithm=".length()));
            } else if (lower.startsWith("-level=")) {
                final String s = lower.substring("-level=".length());
                compress.level = s.equals("null") ? null : Integer.parseInt(s);
            } else if (lower.startsWith("-maxtablesize=")) {
                compress.maxTableSize = Integer.parseInt(lower.substring("-maxtablesize=".length()));
            } else {
                throw new IllegalArgumentException("Unknown option " + arg);
            }
        }
        if (args.length < startArgIndex + 2) {
            if (printUsage) {
                System.out.printf("Usage:%n    %s [-decompress] [-config=settings.json] [-algorithm=lzw|deflate] " +
                                "[-level=0..9] [-maxTableSize=256..65536] input output%n",
                        ImageCompress.class.getSimpleName());
                System.out.println("""
                        Without -decompress, the input image (jpg/png/bmp/gif/...) is converted to raw 8-bit RGB \
                        samples, which are compressed and written to the output file without any header.
                        With -decompress, the input file is decompressed and the raw bytes are written \
                        to the output file.
                        Options override the settings from the configuration file; the default algorithm is LZW \
                        with the maximal table size 4096.
                        Note: the same algorithm and table size must be used for compression and decompression.""");
            }
            return false;
        }
        final Path inputFile = Paths.get(args[startArgIndex++]);
        final Path outputFile = Paths.get(args[startArgIndex]);
        if (compress.decompress) {
            compress.decompress(inputFile, outputFile);
        } else {
            compress.compress(inputFile, outputFile);
        }
        return true;
    }

    public CompressionConfig config() throws IOException {
        final CompressionConfig config = configFile != null ?
                CompressionConfig.load(configFile) :
                new CompressionConfig().setAlgorithm(CompressionAlgorithm.LZW);
        if (algorithm != null) {
            config.setAlgorithm(algorithm);
        }
        if (level != null) {
            config.setCompressionLevel(level);
        }
        if (maxTableSize != null) {
            config.setMaxTableSize(maxTableSize);
        }
        return config.check();
    }

    public void compress(Path imageFile, Path targetFile) throws IOException {
        final Compressor compressor = config().newCompressor();
        System.out.printf("Reading image %s...%n", imageFile);
        long t1 = System.nanoTime();
        final RGBImage image = RGBImages.readRGB(imageFile);
        final byte[] bytes = image.bytes();
        long t2 = System.nanoTime();
        System.out.printf("Compressing %s by %s...%n", image, compressor);
        final byte[] compressed = compressor.compress(bytes);
        long t3 = System.nanoTime();
        RawFiles.write(targetFile, compressed);
        long t4 = System.nanoTime();
        LOG.log(System.Logger.Level.INFO, () -> "Compressed " + imageFile + " to " + targetFile);

        System.out.printf(Locale.US, "%d bytes (entropy %.3f bits/byte) compressed to %d bytes, ratio %.3f%n",
                bytes.length, ByteStatistics.entropy(bytes), compressed.length,
                ByteStatistics.compressionRatio(bytes.length, compressed.length));
        System.out.printf(Locale.US,
                "Image compressed successfully: %.3f seconds reading, %.3f seconds compressing, " +
                        "%.3f seconds writing %s%n",
                (t2 - t1) * 1e-9, (t3 - t2) * 1e-9, (t4 - t3) * 1e-9, targetFile);
    }

    public void decompress(Path compressedFile, Path targetFile) throws IOException {
        final Compressor compressor = config().newCompressor();
        System.out.printf("Decompressing %s by %s...%n", compressedFile, compressor);
        long t1 = System.nanoTime();
        final byte[] compressed = RawFiles.read(compressedFile);
        final byte[] bytes = compressor.decompress(compressed);
        long t2 = System.nanoTime();
        RawFiles.write(targetFile, bytes);
        long t3 = System.nanoTime();
        LOG.log(System.Logger.Level.INFO, () -> "Decompressed " + compressedFile + " to " + targetFile);

        System.out.printf(Locale.US,
                "%d bytes decompressed to %d bytes: %.3f seconds decompressing, %.3f seconds writing %s%n",
                compressed.length, bytes.length, (t2 - t1) * 1e-9, (t3 - t2) * 1e-9, targetFile);
    }
}
