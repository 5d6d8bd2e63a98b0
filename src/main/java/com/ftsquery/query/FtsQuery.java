package com.ftsquery.query;

import com.ftsquery.config.ConverterConfig;
import com.ftsquery.text.StopWords;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * 将 Google 风格的检索表达式转换为全文检索布尔条件。输入格式错误时不抛异常，尽力构造有效条件。
 *
 * <pre>
 * abc                     abc 的屈折词形
 * ~abc                    abc 的同义词
 * "abc"                   精确词项 abc
 * +abc                    精确词项 abc
 * "abc" near "def"        精确词项 abc 邻近精确词项 def
 * abc*                    以 abc 开头的词
 * -abc def                包含 def 的词形但不包含 abc 的词形
 * abc def                 同时包含 abc 与 def 的词形
 * abc or def              包含 abc 或 def 的词形
 * &lt;+abc +def&gt;             精确词项 abc 邻近精确词项 def
 * abc and (def or ghi)    包含 abc，且包含 def 或 ghi
 * </pre>
 *
 * 实例构造后不可变，可在多线程间共享。
 */
public class FtsQuery {
    private static final Logger logger = LoggerFactory.getLogger(FtsQuery.class);

    private final Set<String> stopWords;
    private final Conjunction defaultConjunction;
    private final ExpressionParser parser;
    private final ExpressionTreeNormalizer normalizer;

    /**
     * 不使用停用词构造转换器。
     */
    public FtsQuery() {
        this(false);
    }

    /**
     * 按需加载标准停用词表构造转换器。
     */
    public FtsQuery(boolean useStandardStopWords) {
        this(configWithStandardStopWords(useStandardStopWords));
    }

    /**
     * 使用 ConverterConfig 注入停用词与默认连接词。
     */
    public FtsQuery(ConverterConfig config) {
        Objects.requireNonNull(config, "config");
        this.defaultConjunction = Objects.requireNonNull(config.getDefaultConjunction(), "defaultConjunction");
        this.stopWords = StopWords.of(config.isStandardStopWords(), config.getAdditionalStopWords());
        this.parser = new ExpressionParser(stopWords);
        this.normalizer = new ExpressionTreeNormalizer();
    }

    /**
     * 判断词项是否为停用词，区分大小写。
     */
    public boolean isStopWord(String word) {
        return word != null && stopWords.contains(word);
    }

    /**
     * 按加入顺序返回停用词的只读视图。
     */
    public Set<String> getStopWords() {
        return stopWords;
    }

    public Conjunction getDefaultConjunction() {
        return defaultConjunction;
    }

    /**
     * 转换检索表达式；没有有效词项时返回空串。
     */
    public String transform(String query) {
        ExpressionNode root = normalizer.normalize(parse(query));
        String condition = root == null ? "" : root.toString();
        logger.debug("transform [{}] -> [{}]", query, condition);
        return condition;
    }

    /**
     * 返回未经规范化的表达式树，没有有效词项时返回 null。
     */
    public ExpressionNode parse(String query) {
        return parser.parse(query == null ? "" : query, defaultConjunction);
    }

    /**
     * 转换检索表达式并附带原始输入，供命令行输出使用。
     */
    public TransformResult explain(String query) {
        String condition = transform(query);
        return new TransformResult(query == null ? "" : query, condition, condition.isEmpty());
    }

    private static ConverterConfig configWithStandardStopWords(boolean useStandardStopWords) {
        ConverterConfig config = ConverterConfig.defaults();
        config.setStandardStopWords(useStandardStopWords);
        return config;
    }
}
