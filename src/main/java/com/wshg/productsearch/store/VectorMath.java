package com.wshg.productsearch.store;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 余弦距离与排序，内存库和 MySQL 库共用。
 */
public final class VectorMath {

    private VectorMath() {
    }

    /**
     * 余弦距离 1 - cos，范围 [0, 2]；任一向量模为 0 时按正交处理（距离 1）。
     */
    public static double cosineDistance(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length) {
            throw new IllegalArgumentException("向量维度不一致");
        }
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        double denom = Math.sqrt(normA) * Math.sqrt(normB);
        double cos = denom == 0 ? 0 : dot / denom;
        return Math.min(2.0, Math.max(0.0, 1.0 - cos));
    }

    public static double toSimilarity(double distance) {
        return 1.0 - distance / 2.0;
    }

    /**
     * 对已过滤的候选集按距离升序取前 topK。candidates 须按存储顺序给出，
     * 排序是稳定的，距离相同按存储顺序。维度与查询向量不同的候选跳过。
     */
    public static List<EmbeddingMatch> rank(Iterable<ProductEmbedding> candidates, float[] query, int topK) {
        List<EmbeddingMatch> matches = new ArrayList<>();
        if (query == null || query.length == 0 || topK <= 0) return matches;
        for (ProductEmbedding e : candidates) {
            float[] v = e.getEmbedding();
            if (v == null || v.length != query.length) continue;
            double d = cosineDistance(query, v);
            matches.add(EmbeddingMatch.builder()
                    .embedding(e)
                    .distance(d)
                    .similarityScore(toSimilarity(d))
                    .build());
        }
        matches.sort(Comparator.comparingDouble(EmbeddingMatch::getDistance));
        return matches.size() > topK ? new ArrayList<>(matches.subList(0, topK)) : matches;
    }
}
