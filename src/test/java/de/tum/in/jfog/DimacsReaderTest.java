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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import de.tum.in.jfog.DimacsReader.InvalidFormatException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.util.List;
import org.junit.jupiter.api.Test;

public class DimacsReaderTest {
    private static List<int[]> read(String text) throws IOException, InvalidFormatException {
        return DimacsReader.readAssignments(new BufferedReader(new StringReader(text)));
    }

    @Test
    public void testReadAssignments() throws IOException, InvalidFormatException {
        List<int[]> models = read("c comment\ns SATISFIABLE\nv 1 -2\nv 3 0\n\nv -1\t2 -3 0\n");
        assertThat(models.size(), is(2));
        assertThat(models.get(0), is(new int[] {1, -2, 3}));
        assertThat(models.get(1), is(new int[] {-1, 2, -3}));
    }

    @Test
    public void testUnsatisfiable() throws IOException, InvalidFormatException {
        assertThat(read("s UNSATISFIABLE\n").isEmpty(), is(true));
        assertThat(read("").isEmpty(), is(true));
    }

    @Test
    public void testInvalidOutput() {
        assertThrows(InvalidFormatException.class, () -> read("v 1 x 0\n"));
        assertThrows(InvalidFormatException.class, () -> read("1 2 0\n"));
        assertThrows(InvalidFormatException.class, () -> read("v 1 2\n"));
    }
}
