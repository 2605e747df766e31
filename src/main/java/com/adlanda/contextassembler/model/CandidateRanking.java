package com.adlanda.contextassembler.model;

import java.util.List;

/**
 * Ordered candidate list produced by a selection strategy.
 *
 * Entries are sorted by descending score; the producing strategy decides how ties are broken.
 *
 * @param strategy Name of the strategy that produced the ranking
 * @param files    Ranked candidates, best first
 */
public record CandidateRanking(String strategy, List<RankedFile> files) {

    public CandidateRanking {
        files = List.copyOf(files);
        for (int i = 1; i < files.size(); i++) {
            if (files.get(i).score() > files.get(i - 1).score()) {
                throw new IllegalArgumentException("Ranking from " + strategy
                        + " is not in descending score order at position " + i);
            }
        }
    }

    public List<String> paths() {
        return files.stream().map(RankedFile::path).toList();
    }

    public int size() {
        return files.size();
    }

    public boolean isEmpty() {
        return files.isEmpty();
    }
}
