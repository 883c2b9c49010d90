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

import java.util.logging.Level;
import java.util.logging.Logger;

import static com.github.tommyettinger.neuquant.NeuralNetwork.NET_SIZE;
import static com.github.tommyettinger.neuquant.NeuralNetwork.SPECIALS;

/**
 * Drives training of a {@link NeuralNetwork}: walks through the pixels in a fixed-step order that looks shuffled but
 * is fully deterministic, runs a {@link NeuronContest} for each visited pixel, and decays the learning rate and the
 * neighborhood radius over {@link #NUM_CYCLES} cycles.
 * <br>
 * Both decaying values are kept as biased ints, as in Dekker's NeuQuant: alpha starts at
 * {@code 1 << 10} (meaning 1.0), and the radius starts at {@code 32 << 6} (meaning 32 neurons).
 * <br>
 * Use {@link #learn()} to run the whole schedule, or {@link #visit()} to step through it one pixel at a time.
 */
public class LearningSchedule {
    public static final int NUM_CYCLES = 100;

    public static final int INIT_RAD = NET_SIZE >> 3;
    public static final int RAD_BIAS_SHIFT = 6;
    public static final int RAD_BIAS = 1 << RAD_BIAS_SHIFT;
    public static final int INIT_BIAS_RADIUS = INIT_RAD * RAD_BIAS;
    public static final int RAD_DEC = 30;

    public static final int ALPHA_BIAS_SHIFT = 10;
    public static final int INIT_ALPHA = 1 << ALPHA_BIAS_SHIFT;

    // Four primes near 500; no image is expected to have a pixel count divisible by all four.
    public static final int PRIME1 = 499;
    public static final int PRIME2 = 491;
    public static final int PRIME3 = 487;
    public static final int PRIME4 = 503;

    private final NeuralNetwork net;
    private final NeuronContest contest;
    private final int[] pixels;

    private final int sampleFactor;
    private final int samplePixels;
    private final int delta;
    private final int alphaDec;
    private final int step;

    private int alpha;
    private int biasRadius;
    private int radius;
    private int position;
    private int visited;

    /**
     * Prepares a schedule over {@code pixels}; this does not change the network until {@link #visit()} or
     * {@link #learn()} is called. The pixels are read but never modified.
     * @param net the network to train
     * @param pixels RGB888 pixels, each packed as {@code 0xRRGGBB}; must have at least
     *               {@link NeuQuant#MIN_PIXELS} items
     * @param sampleFactor how sparsely to sample, from 1 (every pixel) to 30
     * @throws IllegalArgumentException if sampleFactor is out of range
     * @throws ImageTooSmallException if pixels has fewer than {@link NeuQuant#MIN_PIXELS} items
     */
    public LearningSchedule(NeuralNetwork net, int[] pixels, int sampleFactor) {
        this.sampleFactor = NeuQuant.checkSampleFactor(sampleFactor);
        NeuQuant.checkPixelCount(pixels.length);
        this.net = net;
        this.contest = new NeuronContest(net);
        this.pixels = pixels;

        final int lengthCount = pixels.length;
        samplePixels = lengthCount / sampleFactor;
        delta = Math.max(samplePixels / NUM_CYCLES, 1);
        alphaDec = 30 + ((sampleFactor - 1) / 3);
        step = chooseStep(lengthCount);

        alpha = INIT_ALPHA;
        biasRadius = INIT_BIAS_RADIUS;
        radius = calcRadius(biasRadius);
    }

    /**
     * Gets the first of {@link #PRIME1}, {@link #PRIME2}, {@link #PRIME3} that does not evenly divide
     * {@code lengthCount}, or {@link #PRIME4} if they all do.
     * @param lengthCount how many pixels there are in total
     * @return the step to advance by between visited pixels
     */
    public static int chooseStep(int lengthCount) {
        if (lengthCount % PRIME1 != 0)
            return PRIME1;
        if (lengthCount % PRIME2 != 0)
            return PRIME2;
        if (lengthCount % PRIME3 != 0)
            return PRIME3;
        return PRIME4;
    }

    /**
     * Converts a biased radius to a count of neurons; anything that would be 1 or less becomes 0, which turns off
     * neighborhood learning.
     */
    public static int calcRadius(int biasRadius) {
        final int rad = biasRadius >> RAD_BIAS_SHIFT;
        return rad <= 1 ? 0 : rad;
    }

    /**
     * Visits every sampled pixel, training the network on each.
     */
    public void learn() {
        final Logger logger = Logger.getGlobal();
        logger.log(Level.INFO, "NeuQuant: learning " + samplePixels + " of " + pixels.length
                + " pixels, sample factor " + sampleFactor + ", step " + step + ", alpha decay " + alphaDec);
        while (visited < samplePixels) {
            visit();
            if (visited % delta == 0 && logger.isLoggable(Level.FINE))
                logger.log(Level.FINE, "NeuQuant: cycle " + (visited / delta) + " alpha " + alpha
                        + " radius " + radius);
        }
        logger.log(Level.INFO, "NeuQuant: finished after " + visited + " pixels");
    }

    /**
     * Trains on the pixel at the current position, then advances the position and, at the end of a cycle, decays
     * alpha and the radius. Does nothing once {@link #isFinished()} is true.
     */
    public void visit() {
        if (visited >= samplePixels)
            return;
        final int p = pixels[position];
        final double r = p >>> 16 & 0xFF, g = p >>> 8 & 0xFF, b = p & 0xFF;

        if (visited == 0)
            net.setBackground(r, g, b);

        int j = contest.specialFind(r, g, b);
        if (j < 0)
            j = contest.contest(r, g, b);

        // specials never learn
        if (j >= SPECIALS) {
            final double a = (double) alpha / INIT_ALPHA;
            contest.alterSingle(a, j, r, g, b);
            if (radius > 0)
                contest.alterNeighbors(a, radius, j, r, g, b);
        }

        position = (position + step) % pixels.length;

        if (++visited % delta == 0) {
            alpha -= alpha / alphaDec;
            biasRadius -= biasRadius / RAD_DEC;
            radius = calcRadius(biasRadius);
        }
    }

    public boolean isFinished() {
        return visited >= samplePixels;
    }

    public NeuralNetwork getNetwork() {
        return net;
    }

    public NeuronContest getContest() {
        return contest;
    }

    public int getSampleFactor() {
        return sampleFactor;
    }

    public int getSamplePixels() {
        return samplePixels;
    }

    /**
     * @return how many pixels are visited per cycle, between decays
     */
    public int getDelta() {
        return delta;
    }

    public int getAlphaDec() {
        return alphaDec;
    }

    public int getStep() {
        return step;
    }

    /**
     * @return the current learning rate, biased so that {@link #INIT_ALPHA} means 1.0
     */
    public int getAlpha() {
        return alpha;
    }

    /**
     * @return the current neighborhood radius, biased by {@link #RAD_BIAS_SHIFT} bits
     */
    public int getBiasRadius() {
        return biasRadius;
    }

    /**
     * @return the current neighborhood radius in neurons; 0 means only the winner learns
     */
    public int getRadius() {
        return radius;
    }

    /**
     * @return the index of the next pixel to visit
     */
    public int getPosition() {
        return position;
    }

    public int getVisited() {
        return visited;
    }
}
