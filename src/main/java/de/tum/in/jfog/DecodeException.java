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

/**
 * Thrown when a solver assignment cannot be mapped back, either because an external index is out of
 * range or because a bit pattern is not the code of any vertex.
 */
public class DecodeException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public DecodeException(String message) {
        super(message);
    }
}
