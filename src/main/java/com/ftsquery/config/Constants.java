package com.ftsquery.config;

/**
 * 全局常量定义
 *
 * 包含词法字符集、渲染关键字和命令行限制
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 词法参数 ====================
    /** 不允许出现在未加引号词项中的标点字符 */
    public static final String PUNCTUATION = "~\"`!@#$%^&*()-+=[]{}\\|;:,.<>?/";
    /** 词项之间的空白字符 */
    public static final String WHITESPACE = " \t\n\r";
    /** 越过文本末尾时 peek 返回的哨兵字符 */
    public static final char NUL = '\0';
    /** 尾部通配符 */
    public static final char WILDCARD = '*';

    // ==================== 渲染关键字 ====================
    /** 否定前缀 */
    public static final String NOT_KEYWORD = "NOT";
    /** 词形展开函数名 */
    public static final String FORMSOF_KEYWORD = "FORMSOF";
    /** 屈折变化展开类型 */
    public static final String INFLECTIONAL_KEYWORD = "INFLECTIONAL";
    /** 同义词展开类型 */
    public static final String THESAURUS_KEYWORD = "THESAURUS";

    // ==================== 命令行参数 ====================
    /** 命令行可接受的最大查询长度 */
    public static final int MAX_QUERY_LENGTH = 4096;

    /**
     * 判断字符是否属于标点集合。
     */
    public static boolean isPunctuation(int ch) {
        return PUNCTUATION.indexOf(ch) >= 0;
    }

    /**
     * 判断字符是否为词项分隔空白。
     */
    public static boolean isWhitespace(int ch) {
        return WHITESPACE.indexOf(ch) >= 0;
    }

    /**
     * 判断字符是否在引号短语两端被裁剪，包括不换行空格与字节序标记。
     */
    public static boolean isTrimmable(int ch) {
        return (ch >= '\t' && ch <= '\r') || Character.isSpaceChar(ch) || ch == '\uFEFF';
    }
}
