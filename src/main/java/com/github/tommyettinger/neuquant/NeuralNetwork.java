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

/**
 * The mutable state of a NeuQuant network: 256 neurons as points in RGB space, plus a frequency and a bias value
 * for each neuron. The first {@link #SPECIALS} neurons are reserved (black, white, and the background color) and
 * never take part in the contest; the rest start on a grayscale ramp from black to white.
 * <br>
 * This holds no behavior beyond {@link #setUp()}; {@link NeuronContest} and {@link LearningSchedule} mutate the
 * public arrays directly.
 */
public class NeuralNetwork {
    /**
     * How many neurons (and so, palette entries) the network has.
     */
    public static final int NET_SIZE = 256;
    /**
     * How many neurons at the start of the network are reserved: black, white, and the background color.
     */
    public static final int SPECIALS = 3;
    /**
     * Index of the neuron that holds the first sampled pixel's color.
     */
    public static final int BACKGROUND = SPECIALS - 1;

    /**
     * Neuron positions, indexed by neuron and then by channel (0 is red, 1 is green, 2 is blue).
     */
    public final double[][] network = new double[NET_SIZE][3];
    public final double[] freq = new double[NET_SIZE];
    public final double[] bias = new double[NET_SIZE];

    public NeuralNetwork() {
        setUp();
    }

    /**
     * Resets every neuron to its starting position and every frequency and bias to its starting value.
     */
    public void setUp() {
        double[] p = network[0];
        p[0] = p[1] = p[2] = 0.0;
        p = network[1];
        p[0] = p[1] = p[2] = 255.0;
        p = network[BACKGROUND];
        p[0] = p[1] = p[2] = 0.0;

        final int cutNetSize = NET_SIZE - SPECIALS;
        for (int i = SPECIALS; i < NET_SIZE; i++) {
            p = network[i];
            p[0] = p[1] = p[2] = (255.0 * (i - SPECIALS)) / cutNetSize;
        }
        for (int i = 0; i < NET_SIZE; i++) {
            freq[i] = 1.0 / NET_SIZE;
            bias[i] = 0.0;
        }
    }

    /**
     * Sets the background neuron to the given color.
     */
    public void setBackground(double r, double g, double b) {
        final double[] p = network[BACKGROUND];
        p[0] = r;
        p[1] = g;
        p[2] = b;
    }

    /**
     * Adds up the frequency of every neuron, reserved ones included.
     * @return the total frequency mass of the network
     */
    public double frequencySum() {
        double sum = 0.0;
        for (int i = 0; i < NET_SIZE; i++) {
            sum += freq[i];
        }
        return sum;
    }

    /**
     * Adds up the frequency of the neurons that can win a contest, which excludes the {@link #SPECIALS}.
     * @return the frequency mass of the learning neurons
     */
    public double learningFrequencySum() {
        double sum = 0.0;
        for (int i = SPECIALS; i < NET_SIZE; i++) {
            sum += freq[i];
        }
        return sum;
    }
}
