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

import java.util.Random;
import org.junit.jupiter.api.Test;

public class TermTableTest {
    @Test
    public void testKind() {
        for (Tag tag : Tag.values()) {
            int kind = TermTable.kind(1, tag);
            assertThat(TermTable.tagOfKind(kind), is(tag));
            assertThat(TermTable.languageOfKind(kind), is(1));
        }
    }

    @Test
    public void testUniqueNodes() {
        TermTable table = new TermTable(64, 1.5);
        Random random = new Random(0);
        int[][] triples = new int[5000][];
        int[] nodes = new int[triples.length];
        for (int i = 0; i < triples.length; i++) {
            triples[i] = new int[] {TermTable.kind(random.nextInt(2), Tag.AND), random.nextInt(100), random.nextInt(100)};
            nodes[i] = table.findOrCreate(triples[i][0], triples[i][1], triples[i][2]);
        }
        // Lookups after growing find the same nodes
        for (int i = 0; i < triples.length; i++) {
            assertThat(table.findOrCreate(triples[i][0], triples[i][1], triples[i][2]), is(nodes[i]));
            assertThat(table.first(nodes[i]), is(triples[i][1]));
            assertThat(table.second(nodes[i]), is(triples[i][2]));
        }
        assertThat(table.tableSize() >= table.nodeCount(), is(true));

        table.clear();
        assertThat(table.nodeCount(), is(0));
        assertThat(table.tableSize(), is(64));
        assertThat(table.findOrCreate(TermTable.kind(0, Tag.TRUE), 0, 0), is(TermTable.FIRST_NODE));
    }
}
