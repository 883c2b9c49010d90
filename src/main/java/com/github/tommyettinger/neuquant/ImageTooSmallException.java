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

import com.badlogic.gdx.utils.GdxRuntimeException;

/**
 * Thrown when an image has fewer pixels than NeuQuant needs for its fixed-step sampling to reach every pixel.
 */
public class ImageTooSmallException extends GdxRuntimeException {
    private final int pixelCount;

    public ImageTooSmallException(int pixelCount) {
        super("Image is too small: has " + pixelCount + " pixels, but needs at least " + NeuQuant.MIN_PIXELS);
        this.pixelCount = pixelCount;
    }

    public int getPixelCount() {
        return pixelCount;
    }

    public int getMinimumPixelCount() {
        return NeuQuant.MIN_PIXELS;
    }
}
