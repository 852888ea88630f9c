package com.seekr.utils;

/**
 * 向量工具
 *
 * @author seekr
 */
public final class VectorUtils {

    private VectorUtils() {
    }

    /**
     * 转为 pgvector 文本格式 [x1,x2,...]
     */
    public static String toPgVector(float[] vector) {
        StringBuilder sb = new StringBuilder(vector.length * 10 + 2);
        sb.append('[');
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(vector[i]);
        }
        return sb.append(']').toString();
    }

    /**
     * 余弦相似度,任一向量为零向量时返回 0
     */
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("向量维度不一致: " + a.length + " vs " + b.length);
        }
        double dot = 0;
        double normA = 0;
        double normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * 将 pgvector 余弦距离换算为 [0,1] 的相似度
     */
    public static double clampSimilarity(double similarity) {
        if (Double.isNaN(similarity)) {
            return similarity;
        }
        return Math.max(0.0, Math.min(1.0, similarity));
    }
}
