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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Set;
import java.util.TreeSet;

/** A validated simple undirected graph with positive vertex ids. */
final class Graph {
    private final List<Integer> vertices;
    /* Edges in input order, each normalised to (smaller, larger) */
    private final List<List<Integer>> edges;
    private final Map<Integer, NavigableSet<Integer>> neighbours;

    private Graph(List<Integer> vertices, List<List<Integer>> edges, Map<Integer, NavigableSet<Integer>> neighbours) {
        this.vertices = vertices;
        this.edges = edges;
        this.neighbours = neighbours;
    }

    /**
     * Validates the given graph.
     *
     * @throws GraphException
     *     If a vertex id is not positive or duplicated, or an edge is a loop, a multi-edge, has not
     *     exactly two end points or refers to an unknown vertex.
     */
    static Graph of(List<Integer> vertices, List<? extends List<Integer>> edges) {
        Map<Integer, NavigableSet<Integer>> neighbours = new LinkedHashMap<>();
        for (Integer vertex : vertices) {
            if (vertex == null || vertex <= 0) {
                throw new GraphException(String.format("Vertex ids must be positive, got %s", vertex));
            }
            if (neighbours.put(vertex, new TreeSet<>()) != null) {
                throw new GraphException(String.format("Duplicate vertex %d", vertex));
            }
        }
        ImmutableList.Builder<List<Integer>> normalised = ImmutableList.builder();
        Set<List<Integer>> seen = new HashSet<>();
        for (List<Integer> edge : edges) {
            if (edge.size() != 2) {
                throw new GraphException(String.format("Edge %s does not have two end points", edge));
            }
            int first = edge.get(0);
            int second = edge.get(1);
            if (first == second) {
                throw new GraphException(String.format("Loop %s is not allowed", edge));
            }
            if (!neighbours.containsKey(first) || !neighbours.containsKey(second)) {
                throw new GraphException(String.format("Edge %s refers to an unknown vertex", edge));
            }
            List<Integer> key = ImmutableList.of(Math.min(first, second), Math.max(first, second));
            if (!seen.add(key)) {
                throw new GraphException(String.format("Multiple edges between %d and %d", first, second));
            }
            normalised.add(key);
            neighbours.get(first).add(second);
            neighbours.get(second).add(first);
        }
        ImmutableMap.Builder<Integer, NavigableSet<Integer>> frozen = ImmutableMap.builder();
        neighbours.forEach((vertex, set) -> frozen.put(vertex, Collections.unmodifiableNavigableSet(set)));
        return new Graph(ImmutableList.copyOf(vertices), normalised.build(), frozen.build());
    }

    List<Integer> vertices() {
        return vertices;
    }

    List<List<Integer>> edges() {
        return edges;
    }

    boolean contains(int vertex) {
        return neighbours.containsKey(vertex);
    }

    NavigableSet<Integer> neighbours(int vertex) {
        return neighbours.get(vertex);
    }

    boolean isAdjacent(int first, int second) {
        NavigableSet<Integer> set = neighbours.get(first);
        return set != null && set.contains(second);
    }

    int isolatedVertexCount() {
        return (int) vertices.stream().filter(v -> neighbours.get(v).isEmpty()).count();
    }

    /** Number of edges whose both end points have no other neighbour. */
    int isolatedEdgeCount() {
        return (int) edges.stream()
                .filter(e -> neighbours.get(e.get(0)).size() == 1 && neighbours.get(e.get(1)).size() == 1)
                .count();
    }
}
