package com.adlanda.contextassembler.model;

/**
 * A candidate file with the score assigned by a selection strategy.
 *
 * @param path   Project-relative path
 * @param score  Strategy-dependent score (similarity, ordinal rank or rule weight), higher is better
 */
public record RankedFile(String path, double score) {
}
