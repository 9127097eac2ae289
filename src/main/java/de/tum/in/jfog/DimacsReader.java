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

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import javax.annotation.Nullable;

/** Reads the output of SAT solvers in the format of the SAT competitions. */
public final class DimacsReader {
    private static final Pattern WHITESPACE = Pattern.compile("[ \t]+");

    private DimacsReader() {}

    @Nullable
    private static String nextLine(BufferedReader reader) throws IOException {
        while (true) {
            String line = reader.readLine();
            if (line == null) {
                return null;
            }
            if (line.isBlank()) {
                continue;
            }
            if (line.charAt(0) != 'c' && line.charAt(0) != 's') {
                return line.strip();
            }
        }
    }

    /**
     * Reads the models contained in {@code v} lines. A model may span several lines and ends with
     * the literal 0; several models may follow each other. Comment lines and status lines starting
     * with {@code s} are skipped.
     *
     * @return The models, each as array of non-zero literals.
     */
    public static List<int[]> readAssignments(BufferedReader reader) throws IOException, InvalidFormatException {
        List<int[]> models = new ArrayList<>();
        int[] literals = new int[16];
        int size = 0;
        while (true) {
            String line = nextLine(reader);
            if (line == null) {
                break;
            }
            String[] array = WHITESPACE.split(line);
            if (!"v".equals(array[0])) {
                throw new InvalidFormatException("Invalid line " + line);
            }
            for (int j = 1; j < array.length; j++) {
                int literal;
                try {
                    literal = Integer.parseInt(array[j]);
                } catch (NumberFormatException e) {
                    throw new InvalidFormatException("Invalid literal in line " + line, e);
                }
                if (literal == 0) {
                    models.add(Arrays.copyOf(literals, size));
                    size = 0;
                    continue;
                }
                if (size == literals.length) {
                    literals = Arrays.copyOf(literals, size * 2);
                }
                literals[size] = literal;
                size += 1;
            }
        }
        if (size > 0) {
            throw new InvalidFormatException("Model is not terminated by 0");
        }
        return models;
    }

    public static class InvalidFormatException extends Exception {
        private static final long serialVersionUID = 1L;

        public InvalidFormatException(String message) {
            super(message);
        }

        public InvalidFormatException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
