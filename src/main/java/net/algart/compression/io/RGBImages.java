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

import net.algart.arrays.Matrices;
import net.algart.arrays.Matrix;
import net.algart.arrays.UpdatablePArray;

import javax.imageio.ImageIO;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.Raster;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reading images into raw 8-bit RGB samples.
 *
 * <p>Images are decoded by {@link ImageIO}: all formats of the standard JDK plugins
 * and of any other ImageIO plugins available in the class path (for example, jai-imageio) are supported.
 */
public class RGBImages {
    private static final System.Logger LOG = System.getLogger(RGBImages.class.getName());

    private RGBImages() {
    }

    public static RGBImage readRGB(Path file) throws IOException {
        Objects.requireNonNull(file, "Null file");
        if (!Files.isRegularFile(file)) {
            throw new FileNotFoundException("Image file " + file + " does not exist or is not a regular file");
        }
        final BufferedImage image = ImageIO.read(file.toFile());
        if (image == null) {
            throw new IOException("Cannot read image " + file + ": unsupported image format");
        }
        LOG.log(System.Logger.Level.DEBUG, () -> "Read image " + file + ": " + image);
        return toRGB(image);
    }

    /**
     * Converts the image into 8-bit RGB samples. Alpha channel, if exists, is dropped (not blended);
     * grayscale images are converted by repeating the intensity in all 3 channels;
     * 16-bit samples are rounded to 8 bits.
     *
     * @param image some image.
     * @return interleaved RGB samples.
     */
    public static RGBImage toRGB(BufferedImage image) {
        Objects.requireNonNull(image, "Null image");
        final int width = image.getWidth();
        final int height = image.getHeight();
        final byte[][] channels = getRGBChannels(image);
        return new RGBImage(width, height, toInterleavedBytes(channels, width * height));
    }

    /**
     * Extracts pixel data as 3 arrays of unsigned bytes: red, green and blue channels.
     */
    public static byte[][] getRGBChannels(BufferedImage image) {
        Objects.requireNonNull(image, "Null image");
        final int w = image.getWidth();
        final int h = image.getHeight();
        final byte[][] result = new byte[RGBImage.NUMBER_OF_CHANNELS][w * h];
        final Raster r = image.getRaster();
        final int colorSpaceType = image.getColorModel().getColorSpace().getType();
        final int transferType = r.getTransferType();
        if (image.getColorModel() instanceof ComponentColorModel
                && (transferType == DataBuffer.TYPE_BYTE || transferType == DataBuffer.TYPE_USHORT)
                && (colorSpaceType == ColorSpace.TYPE_GRAY || colorSpaceType == ColorSpace.TYPE_RGB)) {
            final boolean gray = colorSpaceType == ColorSpace.TYPE_GRAY;
            final boolean shorts = transferType == DataBuffer.TYPE_USHORT;
            final int[] buf = new int[w * h];
            for (int i = 0; i < result.length; i++) {
                r.getSamples(0, 0, w, h, gray ? 0 : i, buf);
                final byte[] samples = result[i];
                for (int j = 0; j < buf.length; j++) {
                    samples[j] = (byte) (shorts ? (buf[j] * 255 + 32767) / 65535 : buf[j]);
                }
            }
        } else {
            // - indexed or packed color models: ColorModel performs the conversion
            final int[] rgb = new int[w];
            for (int y = 0, disp = 0; y < h; y++) {
                image.getRGB(0, y, w, 1, rgb, 0, w);
                for (int x = 0; x < w; x++, disp++) {
                    final int v = rgb[x];
                    result[0][disp] = (byte) (v >>> 16);
                    result[1][disp] = (byte) (v >>> 8);
                    result[2][disp] = (byte) v;
                }
            }
        }
        return result;
    }

    public static byte[] toInterleavedBytes(byte[][] channels, int numberOfPixels) {
        Objects.requireNonNull(channels, "Null channels");
        if (numberOfPixels < 0) {
            throw new IllegalArgumentException("Negative numberOfPixels = " + numberOfPixels);
        }
        final int numberOfChannels = channels.length;
        final byte[] separated = new byte[numberOfChannels * numberOfPixels];
        for (int i = 0; i < numberOfChannels; i++) {
            Objects.requireNonNull(channels[i], "Null channel #" + i);
            if (channels[i].length != numberOfPixels) {
                throw new IllegalArgumentException("Channel #" + i + " contains " + channels[i].length +
                        " samples instead of " + numberOfPixels);
            }
            System.arraycopy(channels[i], 0, separated, i * numberOfPixels, numberOfPixels);
        }
        if (numberOfChannels == 1 || numberOfPixels == 0) {
            return separated;
        }
        final byte[] interleaved = new byte[separated.length];
        final Matrix<UpdatablePArray> mI = Matrix.as(interleaved, numberOfChannels, numberOfPixels);
        final Matrix<UpdatablePArray> mS = Matrix.as(separated, numberOfPixels, numberOfChannels);
        Matrices.interleave(null, mI, mS.asLayers());
        return interleaved;
    }
}
