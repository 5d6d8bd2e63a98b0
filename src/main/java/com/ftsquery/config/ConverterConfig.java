package com.ftsquery.config;

import com.ftsquery.query.Conjunction;

import java.util.ArrayList;
import java.util.List;

/**
 * 转换器运行时配置
 *
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class ConverterConfig {
    private boolean standardStopWords = false;
    private List<String> additionalStopWords = new ArrayList<>();
    private Conjunction defaultConjunction = Conjunction.AND;
    private int maxQueryLength = Constants.MAX_QUERY_LENGTH;

    public boolean isStandardStopWords() {
        return standardStopWords;
    }

    public void setStandardStopWords(boolean standardStopWords) {
        this.standardStopWords = standardStopWords;
    }

    public List<String> getAdditionalStopWords() {
        return additionalStopWords;
    }

    public void setAdditionalStopWords(List<String> additionalStopWords) {
        this.additionalStopWords = additionalStopWords == null ? new ArrayList<>() : new ArrayList<>(additionalStopWords);
    }

    public Conjunction getDefaultConjunction() {
        return defaultConjunction;
    }

    public void setDefaultConjunction(Conjunction defaultConjunction) {
        this.defaultConjunction = defaultConjunction;
    }

    public int getMaxQueryLength() {
        return maxQueryLength;
    }

    public void setMaxQueryLength(int maxQueryLength) {
        this.maxQueryLength = maxQueryLength;
    }

    /**
     * 使用默认配置创建实例
     */
    public static ConverterConfig defaults() {
        return new ConverterConfig();
    }
}
