package com.ftsquery.query;

/** 连接两个子表达式的布尔或邻近操作 */
public enum Conjunction {
    AND,
    OR,
    NEAR;

    /**
     * 渲染时使用的关键字。
     */
    public String keyword() {
        return name();
    }
}
