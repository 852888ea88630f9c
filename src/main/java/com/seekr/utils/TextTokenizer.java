package com.seekr.utils;

import cn.hutool.core.util.StrUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 分词工具: 小写化后按非字母数字字符切分
 *
 * <p>BM25、关键词重叠和 Jaccard 去重共用同一套分词规则。</p>
 *
 * @author seekr
 */
public final class TextTokenizer {

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    private TextTokenizer() {
    }

    public static List<String> tokenize(String text) {
        if (StrUtil.isBlank(text)) {
            return Collections.emptyList();
        }
        String[] parts = NON_WORD.split(text.toLowerCase(Locale.ROOT));
        List<String> tokens = new ArrayList<>(parts.length);
        for (String part : parts) {
            if (!part.isEmpty()) {
                tokens.add(part);
            }
        }
        return tokens;
    }

    public static Set<String> tokenSet(String text) {
        return new HashSet<>(tokenize(text));
    }

    /**
     * 两个词集合的 Jaccard 相似度,两者都为空时返回 0
     */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        int intersection = 0;
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        for (String token : smaller) {
            if (larger.contains(token)) {
                intersection++;
            }
        }
        int union = a.size() + b.size() - intersection;
        return (double) intersection / union;
    }
}
