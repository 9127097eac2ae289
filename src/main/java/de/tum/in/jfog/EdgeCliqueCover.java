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
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Greedy heuristic for edge clique covers, i.e. collections of cliques such that every edge lies in
 * at least one of them.
 *
 * <p>The construction repeatedly takes the smallest uncovered edge and grows a clique around it,
 * each time adding the common neighbour which covers the most yet uncovered edges (the smallest
 * vertex among equally good ones). The result is deterministic but not necessarily minimal.
 */
public final class EdgeCliqueCover {
    private static final Logger logger = Logger.getLogger(EdgeCliqueCover.class.getName());

    private final Graph graph;

    /**
     * Creates the heuristic for the given graph.
     *
     * @param vertices
     *     Distinct positive vertex ids.
     * @param edges
     *     Pairs of distinct vertices, without duplicates in either direction.
     * @throws GraphException
     *     If the graph is malformed.
     */
    public EdgeCliqueCover(List<Integer> vertices, List<? extends List<Integer>> edges) {
        this(Graph.of(vertices, edges));
    }

    EdgeCliqueCover(Graph graph) {
        this.graph = graph;
    }

    private static long edgeKey(int first, int second) {
        return ((long) Math.min(first, second) << Integer.SIZE) | Math.max(first, second);
    }

    /** Computes an edge clique cover. Each clique is sorted, cliques appear in order of creation. */
    public List<List<Integer>> compute() {
        // Vertex ids are positive, hence the key order is the lexicographic order of edges
        NavigableSet<Long> uncovered = new TreeSet<>();
        for (List<Integer> edge : graph.edges()) {
            uncovered.add(edgeKey(edge.get(0), edge.get(1)));
        }

        ImmutableList.Builder<List<Integer>> cover = ImmutableList.builder();
        while (!uncovered.isEmpty()) {
            long edge = uncovered.first();
            int first = (int) (edge >>> Integer.SIZE);
            int second = (int) edge;

            List<Integer> clique = new ArrayList<>();
            clique.add(first);
            clique.add(second);
            NavigableSet<Integer> candidates = new TreeSet<>(graph.neighbours(first));
            candidates.retainAll(graph.neighbours(second));
            while (!candidates.isEmpty()) {
                int best = -1;
                int bestGain = -1;
                for (int candidate : candidates) {
                    int gain = 0;
                    for (int member : clique) {
                        if (uncovered.contains(edgeKey(member, candidate))) {
                            gain += 1;
                        }
                    }
                    if (gain > bestGain) {
                        best = candidate;
                        bestGain = gain;
                    }
                }
                clique.add(best);
                candidates.remove(best);
                candidates.retainAll(graph.neighbours(best));
            }

            Collections.sort(clique);
            for (int i = 0; i < clique.size(); i++) {
                for (int j = i + 1; j < clique.size(); j++) {
                    uncovered.remove(edgeKey(clique.get(i), clique.get(j)));
                }
            }
            logger.log(Level.FINEST, "Added clique {0}", clique);
            cover.add(ImmutableList.copyOf(clique));
        }
        return cover.build();
    }

    /**
     * Computes a separating edge clique cover: a cover such that no two distinct vertices belong to
     * exactly the same cliques. Starting from {@link #compute()}, every vertex sharing its cliques with
     * a smaller vertex receives an additional singleton clique.
     */
    public List<List<Integer>> computeSeparating() {
        List<List<Integer>> cover = compute();
        Map<BitSet, List<Integer>> classes = new LinkedHashMap<>();
        for (int vertex : graph.vertices()) {
            classes.computeIfAbsent(incidence(cover, vertex), k -> new ArrayList<>()).add(vertex);
        }

        ImmutableList.Builder<List<Integer>> separating = ImmutableList.builder();
        separating.addAll(cover);
        int singletons = 0;
        for (List<Integer> members : classes.values()) {
            if (members.size() == 1) {
                continue;
            }
            Collections.sort(members);
            for (int vertex : members.subList(1, members.size())) {
                separating.add(ImmutableList.of(vertex));
                singletons += 1;
            }
        }
        logger.log(Level.FINE, "Computed cover with {0} cliques and {1} separating singletons", new Object[] {
            cover.size(), singletons
        });
        return separating.build();
    }

    /** The set of clique indices containing the given vertex. */
    static BitSet incidence(List<List<Integer>> cover, int vertex) {
        BitSet cliques = new BitSet(cover.size());
        for (int i = 0; i < cover.size(); i++) {
            if (cover.get(i).contains(vertex)) {
                cliques.set(i);
            }
        }
        return cliques;
    }
}
