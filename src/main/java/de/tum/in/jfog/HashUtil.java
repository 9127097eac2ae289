/*
 * This file is part of JFOG.
 * Copyright (c) 2026 The JFOG contributors.
 *
 * JFOG is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, version 3.
 *
 * JFOG is distributed in the hope that it will be useful, but
 * WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU
 * General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with JFOG. If not, see <http://www.gnu.org/licenses/>.
 */
package de.tum.in.jfog;

final class HashUtil {
    static final int PRIME = 0x1000193;

    private HashUtil() {}

    static int hash(int kind, int first, int second) {
        int hash = PRIME * kind;
        hash = 31 * hash + first;
        hash = 31 * hash + second;
        // Spread the higher bits, the table index is taken modulo a non-prime size
        return hash ^ (hash >>> 16);
    }

    static int bucket(int hash, int buckets) {
        return Math.floorMod(hash, buckets);
    }
}
