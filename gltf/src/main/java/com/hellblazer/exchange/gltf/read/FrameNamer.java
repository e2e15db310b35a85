/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.exchange.gltf.read;

import java.util.Random;

/**
 * Source of synthetic frame name parts. Sequential naming gives reproducible names; random naming matches the
 * behaviour of tools that salt instance names.
 *
 * @author hal.hildebrand
 */
public final class FrameNamer {
    public static final int SUFFIX_LENGTH = 6;

    private final Random random;
    private       long   suffixes;
    private       long   numerics;

    private FrameNamer(Random random) {
        this.random = random;
    }

    public static FrameNamer sequential() {
        return new FrameNamer(null);
    }

    public static FrameNamer random(Random random) {
        return new FrameNamer(random);
    }

    /**
     * @return six upper case hexadecimal characters
     */
    public String suffix() {
        long value = random == null ? suffixes++ : random.nextInt(1 << 24);
        return String.format("%06X", value & 0xFFFFFF);
    }

    /**
     * @return a decimal name for a base frame whose preferred name is taken
     */
    public String numericName() {
        if (random == null) {
            return Long.toString(1_000_000_000L + numerics++);
        }
        return Long.toString((long) (random.nextDouble() * 1e10));
    }
}
