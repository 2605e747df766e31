package com.adlanda.contextassembler.repository;

import com.adlanda.contextassembler.model.FileTree;
import com.adlanda.contextassembler.model.RankedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ephemeral in-memory index from file path to embedding vector.
 *
 * Vectors are L2-normalized when stored, so similarity is a dot product.
 * One index lives for one run; nothing is persisted.
 */
public class InMemoryVectorIndex {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorIndex.class);

    /**
     * Best similarity first; equal similarity prefers shallower, then shorter, then lexically smaller paths.
     */
    public static final Comparator<RankedFile> BY_SIMILARITY = Comparator
            .comparingDouble(RankedFile::score).reversed()
            .thenComparingInt(f -> FileTree.depth(f.path()))
            .thenComparingInt(f -> f.path().length())
            .thenComparing(RankedFile::path);

    private final Map<String, float[]> vectors = new LinkedHashMap<>();
    private int dimensions = -1;

    /**
     * Stores one vector per path, replacing any previous content of the index.
     *
     * @param paths   Paths in index order
     * @param vectors Embeddings, one per path, all of the same dimension
     */
    public void index(List<String> paths, List<float[]> vectors) {
        if (paths.size() != vectors.size()) {
            throw new IllegalArgumentException("Got " + vectors.size() + " vectors for " + paths.size() + " paths");
        }
        clear();
        for (int i = 0; i < paths.size(); i++) {
            store(paths.get(i), vectors.get(i));
        }
        log.info("Indexed {} files ({} dimensions)", size(), dimensions);
    }

    /**
     * Stores a vector for a path.
     */
    public void store(String path, float[] vector) {
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("Cannot index " + path + " without embedding");
        }
        if (dimensions >= 0 && vector.length != dimensions) {
            throw new IllegalArgumentException("Vectors must have same dimension: expected "
                    + dimensions + " but " + path + " has " + vector.length);
        }
        dimensions = vector.length;
        vectors.put(path, normalize(vector));
    }

    /**
     * Finds the paths most similar to the query vector.
     *
     * @param queryVector The embedding to search for
     * @param k           Maximum number of results to return
     * @return (path, similarity) pairs ordered by {@link #BY_SIMILARITY}, at most k
     */
    public List<RankedFile> query(float[] queryVector, int k) {
        if (vectors.isEmpty() || k <= 0) {
            return List.of();
        }
        if (queryVector == null || queryVector.length != dimensions) {
            log.warn("Query vector dimension {} does not match index dimension {}",
                    queryVector == null ? 0 : queryVector.length, dimensions);
            return List.of();
        }
        float[] query = normalize(queryVector);
        return vectors.entrySet().stream()
                .map(e -> new RankedFile(e.getKey(), cosineSimilarity(query, e.getValue())))
                .sorted(BY_SIMILARITY)
                .limit(k)
                .toList();
    }

    public boolean contains(String path) {
        return vectors.containsKey(path);
    }

    public int size() {
        return vectors.size();
    }

    public void clear() {
        vectors.clear();
        dimensions = -1;
    }

    /**
     * Cosine similarity of two normalized vectors, clamped to [0, 1].
     */
    static double cosineSimilarity(float[] a, float[] b) {
        double dot = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
        }
        return Math.max(0.0, Math.min(1.0, dot));
    }

    static float[] normalize(float[] vector) {
        double norm = 0.0;
        for (float v : vector) {
            norm += (double) v * v;
        }
        norm = Math.sqrt(norm);
        float[] out = new float[vector.length];
        if (norm == 0) {
            return out;
        }
        for (int i = 0; i < vector.length; i++) {
            out[i] = (float) (vector[i] / norm);
        }
        return out;
    }
}
