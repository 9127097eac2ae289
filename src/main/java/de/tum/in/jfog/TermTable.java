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

import static de.tum.in.jfog.Util.checkState;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Arena of hash-consed formula nodes addressed by dense integer handles.
 *
 * <p>Each node is a triple {@code (kind, first, second)}, where the kind combines the language
 * discriminant and the {@link Tag}. The meaning of the two operands depends on the tag: children
 * handles for connectives, the bound variable and the body for quantifiers, symbol indices for
 * atoms. Nodes are never removed individually, only the whole table can be cleared.
 */
final class TermTable {
    private static final Logger logger = Logger.getLogger(TermTable.class.getName());

    // Use 0 as "not a node" so that freshly allocated chain arrays need no initialization
    static final int NOT_A_NODE = 0;
    static final int FIRST_NODE = 1;

    private static final int TAG_BITS = 5;
    private static final int TAG_MASK = (1 << TAG_BITS) - 1;
    private static final int MINIMUM_TABLE_SIZE = 64;
    private static final int MAXIMAL_NODE_COUNT = Integer.MAX_VALUE / 2 - 8;
    private static final Tag[] TAGS = Tag.values();

    static {
        //noinspection ConstantValue
        assert TAGS.length <= TAG_MASK + 1;
    }

    private final int initialSize;
    private final double growthFactor;

    private int[] kinds;
    private int[] firstOperands;
    private int[] secondOperands;
    /* Hash buckets and the per-node "next in bucket" chain. */
    private int[] hashToChainStart;
    private int[] hashChain;
    /* Canonical wrapper object of each node, created lazily by the owning language. */
    private Formula<?>[] terms;
    private int nextFreeNode;

    // Statistics
    private long createdNodes = 0;
    private long hashChainLookups = 0;
    private long hashChainLookupLength = 0;
    private long hashChainLookupHit = 0;
    private long growCount = 0;

    TermTable(int initialSize, double growthFactor) {
        checkState(growthFactor > 1.0, "Growth factor %s too small", growthFactor);
        this.initialSize = Math.max(initialSize, MINIMUM_TABLE_SIZE);
        this.growthFactor = growthFactor;
        allocate(this.initialSize);
    }

    static int kind(int language, Tag tag) {
        return (language << TAG_BITS) | tag.ordinal();
    }

    static Tag tagOfKind(int kind) {
        return TAGS[kind & TAG_MASK];
    }

    static int languageOfKind(int kind) {
        return kind >>> TAG_BITS;
    }

    private void allocate(int size) {
        kinds = new int[size];
        firstOperands = new int[size];
        secondOperands = new int[size];
        hashToChainStart = new int[size];
        hashChain = new int[size];
        terms = new Formula<?>[size];
        nextFreeNode = FIRST_NODE;
    }

    int tableSize() {
        return kinds.length;
    }

    /** Number of nodes stored in this table. */
    int nodeCount() {
        return nextFreeNode - FIRST_NODE;
    }

    boolean isNodeValid(int node) {
        return FIRST_NODE <= node && node < nextFreeNode;
    }

    int kind(int node) {
        assert isNodeValid(node);
        return kinds[node];
    }

    Tag tag(int node) {
        return tagOfKind(kind(node));
    }

    int first(int node) {
        assert isNodeValid(node);
        return firstOperands[node];
    }

    int second(int node) {
        assert isNodeValid(node);
        return secondOperands[node];
    }

    @Nullable
    Formula<?> term(int node) {
        assert isNodeValid(node);
        return terms[node];
    }

    void setTerm(int node, Formula<?> term) {
        assert isNodeValid(node) && terms[node] == null;
        terms[node] = term;
    }

    /**
     * Returns the handle of the node {@code (kind, first, second)}, creating it if it does not
     * exist yet.
     */
    int findOrCreate(int kind, int first, int second) {
        int hashCode = HashUtil.hash(kind, first, second);
        int currentLookupNode = hashToChainStart[HashUtil.bucket(hashCode, tableSize())];

        int chainLookups = 1;
        hashChainLookups += 1;
        while (currentLookupNode != NOT_A_NODE) {
            if (kinds[currentLookupNode] == kind
                    && firstOperands[currentLookupNode] == first
                    && secondOperands[currentLookupNode] == second) {
                hashChainLookupLength += chainLookups;
                hashChainLookupHit += 1;
                return currentLookupNode;
            }
            int next = hashChain[currentLookupNode];
            assert next != currentLookupNode;
            currentLookupNode = next;
            chainLookups += 1;
        }
        hashChainLookupLength += chainLookups;

        if (nextFreeNode == tableSize()) {
            grow();
        }
        createdNodes += 1;
        int node = nextFreeNode;
        nextFreeNode += 1;
        kinds[node] = kind;
        firstOperands[node] = first;
        secondOperands[node] = second;
        connectHashList(node, hashCode);
        return node;
    }

    private void connectHashList(int node, int hashCode) {
        int position = HashUtil.bucket(hashCode, tableSize());
        hashChain[node] = hashToChainStart[position];
        hashToChainStart[position] = node;
    }

    private void grow() {
        growCount += 1;
        int oldSize = tableSize();
        checkState(oldSize < MAXIMAL_NODE_COUNT, "Term table exhausted");
        @SuppressWarnings("NumericCastThatLosesPrecision")
        int newSize = (int) Math.min(MAXIMAL_NODE_COUNT, Math.ceil(oldSize * growthFactor));
        assert oldSize < newSize : "Got new size " + newSize + " with old size " + oldSize;
        logger.log(Level.FINE, "Growing the term table from {0} to {1}", new Object[] {oldSize, newSize});

        kinds = Arrays.copyOf(kinds, newSize);
        firstOperands = Arrays.copyOf(firstOperands, newSize);
        secondOperands = Arrays.copyOf(secondOperands, newSize);
        terms = Arrays.copyOf(terms, newSize);
        // Bucket positions depend on the table size, rebuild all chains
        hashToChainStart = new int[newSize];
        hashChain = new int[newSize];
        for (int node = FIRST_NODE; node < nextFreeNode; node++) {
            connectHashList(node, HashUtil.hash(kinds[node], firstOperands[node], secondOperands[node]));
        }
    }

    /** Removes all nodes and shrinks the table back to its initial size. */
    void clear() {
        allocate(initialSize);
    }

    String getStatistics() {
        int usedBuckets = 0;
        int longestChain = 0;
        for (int start : hashToChainStart) {
            if (start == NOT_A_NODE) {
                continue;
            }
            usedBuckets += 1;
            int length = 0;
            for (int node = start; node != NOT_A_NODE; node = hashChain[node]) {
                length += 1;
            }
            longestChain = Math.max(longestChain, length);
        }
        return String.format(
                "Nodes: %d/%d, created %d, grown %d times%n"
                        + "Hash lookups: %d, hits %d, average chain length %.2f%n"
                        + "Buckets in use: %d, longest chain %d",
                nodeCount(),
                tableSize(),
                createdNodes,
                growCount,
                hashChainLookups,
                hashChainLookupHit,
                hashChainLookups == 0 ? 0.0d : (double) hashChainLookupLength / hashChainLookups,
                usedBuckets,
                longestChain);
    }
}
