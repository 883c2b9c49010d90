/*
 * Copyright (c) 2024  Tommy Ettinger
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 *
 *
 */

package com.github.tommyettinger.neuquant;

import com.badlogic.gdx.graphics.Pixmap;

/**
 * NeuQuant neural-net color quantization, which reduces a true-color image to a palette of 256 colors that follows
 * the image's own color distribution. Typical use with a Pixmap looks like:
 * <pre>
 * NeuQuant nq = new NeuQuant(pixmap, 10);
 * byte[] colorTab = nq.process(); // 768 bytes, r, g, b per palette entry
 * int[] palette = nq.paletteArray(); // the same colors as RGBA8888, usable with PaletteReducer
 * </pre>
 * Each instance keeps its own network, so separate instances can run on separate threads, but one instance must not
 * be used by more than one thread at a time.
 * <br>
 * NEUQUANT Neural-Net quantization algorithm by Anthony Dekker, 1994.
 * See "Kohonen neural networks for optimal colour quantization"
 * in "Network: Computation in Neural Systems" Vol. 5 (1994) pp 351-367.
 * for a discussion of the algorithm.
 */
public class NeuQuant {
    /**
     * The fewest pixels an image can have; this is the largest of the primes {@link LearningSchedule} steps by.
     */
    public static final int MIN_PIXELS = LearningSchedule.PRIME4;
    public static final int MIN_SAMPLE_FACTOR = 1;
    public static final int MAX_SAMPLE_FACTOR = 30;

    private final int[] pixels;
    private int sampleFactor;
    private int visitedPixels;
    private PaletteIndex index;

    /**
     * Prepares to quantize the given RGB888 pixels with a sample factor of 1, which gives the best quality.
     * @param pixels pixel colors packed as {@code 0xRRGGBB}; must have at least {@link #MIN_PIXELS} items
     * @throws ImageTooSmallException if pixels has fewer than {@link #MIN_PIXELS} items
     */
    public NeuQuant(int[] pixels) {
        this(pixels, MIN_SAMPLE_FACTOR);
    }

    /**
     * Prepares to quantize the given RGB888 pixels. The array is copied, so later changes to it have no effect.
     * @param pixels pixel colors packed as {@code 0xRRGGBB}; must have at least {@link #MIN_PIXELS} items
     * @param sampleFactor from 1 to 30; higher is faster but lower-quality
     * @throws IllegalArgumentException if sampleFactor is out of range
     * @throws ImageTooSmallException if pixels has fewer than {@link #MIN_PIXELS} items
     */
    public NeuQuant(int[] pixels, int sampleFactor) {
        this.sampleFactor = checkSampleFactor(sampleFactor);
        checkPixelCount(pixels.length);
        this.pixels = pixels.clone();
    }

    /**
     * Prepares to quantize the given Pixmap with a sample factor of 1, which gives the best quality.
     * @param pixmap a Pixmap with at least {@link #MIN_PIXELS} pixels; alpha is ignored
     * @throws ImageTooSmallException if pixmap has fewer than {@link #MIN_PIXELS} pixels
     */
    public NeuQuant(Pixmap pixmap) {
        this(pixmap, MIN_SAMPLE_FACTOR);
    }

    /**
     * Prepares to quantize the given Pixmap. Its pixels are read once here, so the Pixmap can be changed or disposed
     * afterward.
     * @param pixmap a Pixmap with at least {@link #MIN_PIXELS} pixels; alpha is ignored
     * @param sampleFactor from 1 to 30; higher is faster but lower-quality
     * @throws IllegalArgumentException if sampleFactor is out of range
     * @throws ImageTooSmallException if pixmap has fewer than {@link #MIN_PIXELS} pixels
     */
    public NeuQuant(Pixmap pixmap, int sampleFactor) {
        this.sampleFactor = checkSampleFactor(sampleFactor);
        this.pixels = pixelsFrom(pixmap);
    }

    /**
     * Reads every pixel of {@code pixmap}, row by row, as an RGB888 int packed as {@code 0xRRGGBB}; alpha is
     * dropped. The size is checked before any pixel is read.
     * @param pixmap a non-null Pixmap with at least {@link #MIN_PIXELS} pixels
     * @return a new int array with {@code width * height} items
     * @throws ImageTooSmallException if pixmap has fewer than {@link #MIN_PIXELS} pixels
     */
    public static int[] pixelsFrom(Pixmap pixmap) {
        final int width = pixmap.getWidth(), height = pixmap.getHeight();
        checkPixelCount(width * height);
        final int[] pixels = new int[width * height];
        for (int y = 0, i = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                pixels[i++] = pixmap.getPixel(x, y) >>> 8;
            }
        }
        return pixels;
    }

    public int getSampleFactor() {
        return sampleFactor;
    }

    /**
     * Sets how sparsely pixels are sampled during training; 1 visits as many pixels as the image has, and 10 visits
     * a tenth as many. Takes effect on the next {@link #process()}.
     * @param sampleFactor from 1 to 30, inclusive
     * @throws IllegalArgumentException if sampleFactor is out of range
     */
    public final void setSampleFactor(int sampleFactor) {
        this.sampleFactor = checkSampleFactor(sampleFactor);
    }

    /**
     * Checks that a sample factor is in the usable range.
     * @param sampleFactor should be from {@link #MIN_SAMPLE_FACTOR} to {@link #MAX_SAMPLE_FACTOR}, inclusive
     * @return sampleFactor, unchanged
     * @throws IllegalArgumentException if sampleFactor is out of range
     */
    public static int checkSampleFactor(int sampleFactor) {
        if (sampleFactor < MIN_SAMPLE_FACTOR || sampleFactor > MAX_SAMPLE_FACTOR)
            throw new IllegalArgumentException("Sample factor must be between " + MIN_SAMPLE_FACTOR + " and "
                    + MAX_SAMPLE_FACTOR + ", but was " + sampleFactor);
        return sampleFactor;
    }

    /**
     * Checks that an image has enough pixels for the fixed-step sampling to reach all of them.
     * @param pixelCount how many pixels the image has
     * @return pixelCount, unchanged
     * @throws ImageTooSmallException if pixelCount is less than {@link #MIN_PIXELS}
     */
    public static int checkPixelCount(int pixelCount) {
        if (pixelCount < MIN_PIXELS)
            throw new ImageTooSmallException(pixelCount);
        return pixelCount;
    }

    /**
     * Trains a fresh network on the pixels, rounds it, and builds its index. Running this again gives the same
     * result unless the sample factor changed.
     * @return the palette as a GIF color table, with red, green, and blue bytes per entry, in learned order
     */
    public byte[] process() {
        NeuralNetwork net = new NeuralNetwork();
        LearningSchedule schedule = new LearningSchedule(net, pixels, sampleFactor);
        schedule.learn();
        visitedPixels = schedule.getVisited();
        index = PaletteIndex.build(net);
        return index.toColorTable();
    }

    /**
     * @return the result of the last {@link #process()}, or null if it hasn't been called yet
     */
    public PaletteIndex getPaletteIndex() {
        return index;
    }

    /**
     * Gets the palette from the last {@link #process()} as opaque RGBA8888 ints, in learned order; this can be given
     * to PaletteReducer's {@code exact(int[])} to dither an image with these colors.
     * @return a new 256-element int array
     * @throws IllegalStateException if {@link #process()} has not been called
     */
    public int[] paletteArray() {
        if (index == null)
            throw new IllegalStateException("process() must be called before paletteArray()");
        return index.toRgba8888();
    }

    /**
     * @return how many pixels the last {@link #process()} trained on
     */
    public int getVisitedPixels() {
        return visitedPixels;
    }

    public int getPixelCount() {
        return pixels.length;
    }
}
