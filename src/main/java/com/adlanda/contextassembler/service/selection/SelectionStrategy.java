package com.adlanda.contextassembler.service.selection;

import com.adlanda.contextassembler.exception.SelectionFailureException;
import com.adlanda.contextassembler.model.CandidateRanking;
import com.adlanda.contextassembler.model.FileTree;

/**
 * Ranks the files of a project by how much they matter for understanding it.
 */
public interface SelectionStrategy {

    /**
     * Short name used in logs and in {@link CandidateRanking#strategy()}.
     */
    String name();

    /**
     * Whether the strategy's dependencies are present. Checked once when the pipeline is built.
     */
    boolean isAvailable();

    /**
     * @throws SelectionFailureException if no usable ranking can be produced
     */
    CandidateRanking rank(FileTree fileTree, SelectionContext context);
}
