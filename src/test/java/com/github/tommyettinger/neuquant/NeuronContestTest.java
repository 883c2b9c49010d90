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

import org.junit.jupiter.api.Test;

import java.util.Random;

import static com.github.tommyettinger.neuquant.NeuralNetwork.*;
import static com.github.tommyettinger.neuquant.NeuronContest.BETA;
import static org.junit.jupiter.api.Assertions.*;

class NeuronContestTest {

    private static double ramp(int i) {
        return 255.0 * (i - SPECIALS) / (NET_SIZE - SPECIALS);
    }

    @Test
    void specialFindMatchesReservedColorsOnly() {
        NeuronContest contest = new NeuronContest(new NeuralNetwork());
        // black is both neuron 0 and the untouched background; the first match wins
        assertEquals(0, contest.specialFind(0, 0, 0));
        assertEquals(1, contest.specialFind(255, 255, 255));
        assertEquals(1, contest.specialFind(255, 255, 254.999995));
        assertEquals(-1, contest.specialFind(255, 255, 254.9));
        assertEquals(-1, contest.specialFind(10, 10, 10));

        contest.getNetwork().setBackground(10, 20, 30);
        assertEquals(BACKGROUND, contest.specialFind(10, 20, 30));
    }

    @Test
    void contestPicksClosestNeuronWhenBiasIsEven() {
        NeuralNetwork net = new NeuralNetwork();
        NeuronContest contest = new NeuronContest(net);
        // neuron 130 sits at 255 * 127 / 253, about 128.008
        assertEquals(130, contest.contest(128, 128, 128));
    }

    @Test
    void contestLeaksEveryLearningNeuronAndRewardsClosest() {
        NeuralNetwork net = new NeuralNetwork();
        NeuronContest contest = new NeuronContest(net);
        contest.contest(128, 128, 128);

        double leaked = (1.0 / 256.0) * (1.0 - BETA);
        for (int i = 0; i < SPECIALS; i++) {
            assertEquals(1.0 / 256.0, net.freq[i], 0.0);
            assertEquals(0.0, net.bias[i], 0.0);
        }
        for (int i = SPECIALS; i < NET_SIZE; i++) {
            if (i == 130) {
                assertEquals(leaked + BETA, net.freq[i], 1e-15);
                assertEquals(leaked - 1.0, net.bias[i], 1e-12);
            } else {
                assertEquals(leaked, net.freq[i], 1e-15);
                assertEquals(leaked, net.bias[i], 1e-15);
            }
        }
    }

    @Test
    void biasCanMakeAFartherNeuronWin() {
        NeuralNetwork net = new NeuralNetwork();
        NeuronContest contest = new NeuronContest(net);
        net.bias[200] = 1000.0;

        assertEquals(200, contest.contest(128, 128, 128));
        // the reward still goes to the closest neuron
        assertTrue(net.freq[130] > net.freq[200]);
        assertEquals((1.0 / 256.0) * (1.0 - BETA), net.freq[200], 1e-15);
    }

    @Test
    void rarelyChosenNeuronsGainBias() {
        NeuralNetwork net = new NeuralNetwork();
        NeuronContest contest = new NeuronContest(net);
        for (int n = 0; n < 500; n++) {
            contest.contest(128, 128, 128);
        }
        assertTrue(net.bias[3] > 0.0);
        assertTrue(net.bias[255] > 0.0);
        assertTrue(net.freq[3] < 1.0 / 256.0);
    }

    @Test
    void learningFrequencyMassFollowsLeakAndRewardRecurrence() {
        NeuralNetwork net = new NeuralNetwork();
        NeuronContest contest = new NeuronContest(net);
        Random random = new Random(0x1234ABCDL);
        double expected = net.learningFrequencySum();
        for (int n = 0; n < 5000; n++) {
            contest.contest(random.nextInt(256), random.nextInt(256), random.nextInt(256));
            expected = expected * (1.0 - BETA) + BETA;
            assertEquals(expected, net.learningFrequencySum(), 1e-9);
            assertEquals(3.0 / 256.0 + expected, net.frequencySum(), 1e-9);
        }
        // converges toward 1 for the learning neurons
        assertEquals(1.0, net.learningFrequencySum(), 1e-3);
    }

    @Test
    void alterSingleMovesByFraction() {
        NeuralNetwork net = new NeuralNetwork();
        NeuronContest contest = new NeuronContest(net);
        double before = net.network[100][0];
        contest.alterSingle(0.5, 100, 0, 255, before);
        assertEquals(before * 0.5, net.network[100][0], 1e-12);
        assertEquals(before + (255 - before) * 0.5, net.network[100][1], 1e-12);
        assertEquals(before, net.network[100][2], 1e-12);

        contest.alterSingle(1.0, 50, 9, 8, 7);
        assertArrayEquals(new double[]{9, 8, 7}, net.network[50], 1e-12);
    }

    @Test
    void alterNeighborsUsesRadialFalloff() {
        NeuralNetwork net = new NeuralNetwork();
        NeuronContest contest = new NeuronContest(net);
        contest.alterNeighbors(1.0, 4, 10, 255, 0, 0);

        // adjacent neurons move all the way
        assertArrayEquals(new double[]{255, 0, 0}, net.network[11], 1e-12);
        assertArrayEquals(new double[]{255, 0, 0}, net.network[9], 1e-12);
        // then 15/16 and 12/16 of the way
        double v12 = ramp(12), v8 = ramp(8), v13 = ramp(13), v7 = ramp(7);
        assertEquals(v12 - (15.0 / 16.0) * (v12 - 255), net.network[12][0], 1e-12);
        assertEquals(v12 - (15.0 / 16.0) * v12, net.network[12][1], 1e-12);
        assertEquals(v8 - (15.0 / 16.0) * (v8 - 255), net.network[8][0], 1e-12);
        assertEquals(v13 - (12.0 / 16.0) * (v13 - 255), net.network[13][0], 1e-12);
        assertEquals(v7 - (12.0 / 16.0) * (v7 - 255), net.network[7][0], 1e-12);
        // the winner and anything rad or more away stay put
        assertEquals(ramp(10), net.network[10][0], 0.0);
        assertEquals(ramp(14), net.network[14][0], 0.0);
        assertEquals(ramp(6), net.network[6][0], 0.0);
    }

    @Test
    void alterNeighborsNeverTouchesReservedNeurons() {
        NeuralNetwork net = new NeuralNetwork();
        net.setBackground(40, 40, 40);
        NeuronContest contest = new NeuronContest(net);
        contest.alterNeighbors(1.0, 5, 4, 200, 100, 50);

        assertArrayEquals(new double[]{200, 100, 50}, net.network[3], 1e-12);
        assertArrayEquals(new double[]{40, 40, 40}, net.network[BACKGROUND], 0.0);
        assertArrayEquals(new double[]{255, 255, 255}, net.network[1], 0.0);
        assertArrayEquals(new double[]{0, 0, 0}, net.network[0], 0.0);
        // high side of the neighborhood: 5, 6, 7, 8
        assertNotEquals(ramp(8), net.network[8][0]);
        assertEquals(ramp(9), net.network[9][0], 0.0);
    }

    @Test
    void alterNeighborsStopsAtEndOfNetwork() {
        NeuralNetwork net = new NeuralNetwork();
        NeuronContest contest = new NeuronContest(net);
        contest.alterNeighbors(1.0, 5, 254, 0, 0, 0);

        assertArrayEquals(new double[]{0, 0, 0}, net.network[255], 1e-12);
        assertArrayEquals(new double[]{0, 0, 0}, net.network[253], 1e-12);
        assertEquals(ramp(254), net.network[254][0], 0.0);
        assertNotEquals(ramp(250), net.network[250][0]);
        assertEquals(ramp(249), net.network[249][0], 0.0);
    }
}
