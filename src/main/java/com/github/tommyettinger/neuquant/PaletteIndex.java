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

import com.badlogic.gdx.math.MathUtils;

import static com.github.tommyettinger.neuquant.NeuralNetwork.NET_SIZE;

/**
 * The finished result of a NeuQuant run: every neuron rounded to an RGB888 color, kept both in the order the network
 * learned them and sorted by green, plus {@link #netIndex}, which maps any green value to a position in the sorted
 * order where a nearest-color search can start.
 * <br>
 * Created with {@link #build(NeuralNetwork)}; the network is only read.
 */
public class PaletteIndex {
    /**
     * Rounded colors in learned order; {@code learned[i]} holds red, green, blue for neuron i.
     */
    public final int[][] learned = new int[NET_SIZE][3];
    /**
     * Rounded colors sorted by green, ascending.
     */
    public final int[][] sorted = new int[NET_SIZE][3];
    /**
     * For each slot in {@link #sorted}, the neuron index (in {@link #learned}) it came from.
     */
    public final int[] origin = new int[NET_SIZE];
    /**
     * For each green value from 0 to 255, a position in {@link #sorted} to start searching from.
     */
    public final int[] netIndex = new int[256];

    private PaletteIndex() {
    }

    /**
     * Rounds every neuron in {@code net} and builds the sorted order and {@link #netIndex} from the rounded colors.
     * @param net a trained network
     * @return a new PaletteIndex
     */
    public static PaletteIndex build(NeuralNetwork net) {
        PaletteIndex index = new PaletteIndex();
        index.fix(net);
        index.inxBuild();
        return index;
    }

    /**
     * Rounds a channel to the nearest int, with halves going up, and clamps it to the 0 to 255 range.
     */
    public static int roundToColorValue(double x) {
        return MathUtils.clamp((int) (0.5 + x), 0, 255);
    }

    private void fix(NeuralNetwork net) {
        for (int i = 0; i < NET_SIZE; i++) {
            final double[] n = net.network[i];
            for (int j = 0; j < 3; j++) {
                learned[i][j] = sorted[i][j] = roundToColorValue(n[j]);
            }
            origin[i] = i;
        }
    }

    /**
     * Selection sort of {@link #sorted} by green, building {@link #netIndex} as each new green value appears.
     */
    private void inxBuild() {
        final int maxNetPos = NET_SIZE - 1;
        int prevCol = 0, startPos = 0;

        for (int i = 0; i < NET_SIZE; i++) {
            final int[] p = sorted[i];
            int smallPos = i, smallVal = p[1];
            for (int j = i + 1; j < NET_SIZE; j++) {
                if (sorted[j][1] < smallVal) {
                    smallPos = j;
                    smallVal = sorted[j][1];
                }
            }
            if (i != smallPos) {
                final int[] q = sorted[smallPos];
                int t = p[0]; p[0] = q[0]; q[0] = t;
                t = p[1]; p[1] = q[1]; q[1] = t;
                t = p[2]; p[2] = q[2]; q[2] = t;
                t = origin[i]; origin[i] = origin[smallPos]; origin[smallPos] = t;
            }
            if (smallVal != prevCol) {
                netIndex[prevCol] = (startPos + i) >> 1;
                for (int j = prevCol + 1; j < smallVal; j++) {
                    netIndex[j] = i;
                }
                prevCol = smallVal;
                startPos = i;
            }
        }
        netIndex[prevCol] = (startPos + maxNetPos) >> 1;
        for (int j = prevCol + 1; j < 256; j++) {
            netIndex[j] = maxNetPos;
        }
    }

    /**
     * @param i a neuron index, from 0 to 255
     * @return the rounded color of neuron i, as {@code 0xRRGGBB}
     */
    public int getLearnedColor(int i) {
        final int[] c = learned[i];
        return c[0] << 16 | c[1] << 8 | c[2];
    }

    /**
     * @param i a position in green-sorted order, from 0 to 255
     * @return the color at that position, as {@code 0xRRGGBB}
     */
    public int getSortedColor(int i) {
        final int[] c = sorted[i];
        return c[0] << 16 | c[1] << 8 | c[2];
    }

    public int getSortedOrigin(int i) {
        return origin[i];
    }

    /**
     * @param green a green channel value, from 0 to 255
     * @return a position in green-sorted order near where colors with that green value are
     */
    public int getNetIndex(int green) {
        return netIndex[green & 255];
    }

    /**
     * Gets the learned colors as a color table the way GIF stores one: red, green, and blue bytes for each entry,
     * in learned order.
     * @return a new 768-element byte array
     */
    public byte[] toColorTable() {
        final byte[] colorTab = new byte[NET_SIZE * 3];
        for (int i = 0, bi = 0; i < NET_SIZE; i++) {
            colorTab[bi++] = (byte) learned[i][0];
            colorTab[bi++] = (byte) learned[i][1];
            colorTab[bi++] = (byte) learned[i][2];
        }
        return colorTab;
    }

    /**
     * Gets the learned colors as opaque RGBA8888 ints, in learned order; this is the format PaletteReducer and
     * Pixmap use for colors.
     * @return a new 256-element int array
     */
    public int[] toRgba8888() {
        final int[] rgba = new int[NET_SIZE];
        for (int i = 0; i < NET_SIZE; i++) {
            rgba[i] = getLearnedColor(i) << 8 | 0xFF;
        }
        return rgba;
    }
}
