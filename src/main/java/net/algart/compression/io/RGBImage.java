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

import java.util.Arrays;
import java.util.Objects;

/**
 * Image as raw 8-bit RGB samples, interleaved: R, G, B of the pixel (0,0), then R, G, B of the pixel (1,0), etc.
 *
 * <p>The samples array is not cloned; images are equal when they have the same sizes and samples.
 *
 * @param width  image width.
 * @param height image height.
 * @param bytes  interleaved samples, <code>3*width*height</code> bytes.
 */
public record RGBImage(int width, int height, byte[] bytes) {
    public static final int NUMBER_OF_CHANNELS = 3;

    public RGBImage {
        if (width < 0) {
            throw new IllegalArgumentException("Negative width = " + width);
        }
        if (height < 0) {
            throw new IllegalArgumentException("Negative height = " + height);
        }
        Objects.requireNonNull(bytes, "Null bytes");
        if ((long) NUMBER_OF_CHANNELS * (long) width * (long) height != bytes.length) {
            throw new IllegalArgumentException("Length of bytes array " + bytes.length +
                    " does not match image sizes " + width + "x" + height + "x" + NUMBER_OF_CHANNELS);
        }
    }

    public int numberOfPixels() {
        return width * height;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RGBImage that)) {
            return false;
        }
        return width == that.width && height == that.height && Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "RGB image " + width + "x" + height + " (" + bytes.length + " bytes)";
    }
}
