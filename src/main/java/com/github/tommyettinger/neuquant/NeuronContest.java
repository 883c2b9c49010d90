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

import static com.github.tommyettinger.neuquant.NeuralNetwork.NET_SIZE;
import static com.github.tommyettinger.neuquant.NeuralNetwork.SPECIALS;

/**
 * Finds which neuron in a {@link NeuralNetwork} should learn a given color, and moves that neuron (and its neighbors
 * by index) toward the color. Winners are picked by Manhattan distance in RGB, corrected by each neuron's bias so
 * that neurons that rarely win become more likely to win later.
 */
public class NeuronContest {
    /**
     * How much each neuron's frequency leaks per contest; 1/1024.
     */
    public static final double BETA = 1.0 / 1024.0;
    /**
     * Scales frequency into bias; 1024.
     */
    public static final double GAMMA = 1024.0;
    public static final double BETA_GAMMA = BETA * GAMMA;

    /**
     * How far apart two channel values can be while still counting as an exact match for a reserved neuron.
     */
    public static final double EPSILON = 1e-5;

    private final NeuralNetwork net;

    public NeuronContest(NeuralNetwork net) {
        this.net = net;
    }

    public NeuralNetwork getNetwork() {
        return net;
    }

    /**
     * Looks for a reserved neuron that already holds exactly the given color.
     * @param r red, from 0 to 255
     * @param g green, from 0 to 255
     * @param b blue, from 0 to 255
     * @return the index of the first reserved neuron matching the color, or -1 if none match
     */
    public int specialFind(double r, double g, double b) {
        for (int i = 0; i < SPECIALS; i++) {
            final double[] p = net.network[i];
            if (Math.abs(p[0] - r) < EPSILON && Math.abs(p[1] - g) < EPSILON && Math.abs(p[2] - b) < EPSILON)
                return i;
        }
        return -1;
    }

    /**
     * Runs one contest among the learning neurons for the given color. Every learning neuron's frequency leaks by
     * {@link #BETA} and its bias grows with what frequency it has left; then the neuron closest to the color, without
     * bias, gets its frequency back and its bias reduced. The winner is the neuron whose distance minus bias is
     * smallest, which is not always the closest one.
     * @param r red, from 0 to 255
     * @param g green, from 0 to 255
     * @param b blue, from 0 to 255
     * @return the index of the winning neuron, always at least {@link NeuralNetwork#SPECIALS}
     */
    public int contest(double r, double g, double b) {
        final double[][] network = net.network;
        final double[] freq = net.freq, bias = net.bias;
        double bestDist = Double.MAX_VALUE, bestBiasDist = Double.MAX_VALUE;
        int bestPos = -1, bestBiasPos = -1;

        for (int i = SPECIALS; i < NET_SIZE; i++) {
            final double[] p = network[i];
            final double dist = Math.abs(p[0] - r) + Math.abs(p[1] - g) + Math.abs(p[2] - b);
            if (dist < bestDist) {
                bestDist = dist;
                bestPos = i;
            }
            final double biasDist = dist - bias[i];
            if (biasDist < bestBiasDist) {
                bestBiasDist = biasDist;
                bestBiasPos = i;
            }
            freq[i] -= BETA * freq[i];
            bias[i] += BETA_GAMMA * freq[i];
        }
        freq[bestPos] += BETA;
        bias[bestPos] -= BETA_GAMMA;
        return bestBiasPos;
    }

    /**
     * Moves neuron {@code i} a fraction {@code alpha} of the way toward the given color.
     * @param alpha how far to move, from 0 (not at all) to 1 (all the way)
     * @param i the neuron to move
     * @param r red, from 0 to 255
     * @param g green, from 0 to 255
     * @param b blue, from 0 to 255
     */
    public void alterSingle(double alpha, int i, double r, double g, double b) {
        final double[] p = net.network[i];
        p[0] -= alpha * (p[0] - r);
        p[1] -= alpha * (p[1] - g);
        p[2] -= alpha * (p[2] - b);
    }

    /**
     * Moves the neurons within {@code rad} indices of neuron {@code i} (but not {@code i} itself) toward the given
     * color. The two neurons adjacent to {@code i} move by the full {@code alpha}; farther ones move by
     * {@code alpha * (rad * rad - c * c) / (rad * rad)}, where c grows by one per step outward. The low end stops
     * before reaching {@code SPECIALS - 1} and the high end stops at the end of the network.
     * @param alpha the largest fraction to move by
     * @param rad the neighborhood radius, in indices; should be greater than 0
     * @param i the neuron that won the contest
     * @param r red, from 0 to 255
     * @param g green, from 0 to 255
     * @param b blue, from 0 to 255
     */
    public void alterNeighbors(double alpha, int rad, int i, double r, double g, double b) {
        final double[][] network = net.network;
        int lo = i - rad, hi = i + rad;
        if (lo < SPECIALS)
            lo = SPECIALS - 1;
        if (hi > NET_SIZE)
            hi = NET_SIZE;

        final double radSq = rad * rad;
        int j = i + 1, k = i - 1, c = 0;
        while (j < hi || k > lo) {
            final double a = (alpha * (radSq - c * c)) / radSq;
            c++;
            if (j < hi) {
                final double[] p = network[j++];
                p[0] -= a * (p[0] - r);
                p[1] -= a * (p[1] - g);
                p[2] -= a * (p[2] - b);
            }
            if (k > lo) {
                final double[] p = network[k--];
                p[0] -= a * (p[0] - r);
                p[1] -= a * (p[1] - g);
                p[2] -= a * (p[2] - b);
            }
        }
    }
}
