package com.ftsquery.query;

/**
 * 表达式树节点。叶子为 {@link TerminalNode}，内部节点为 {@link InternalNode}。
 *
 * 每个节点通过 {@link #toString()} 渲染自身为全文检索条件片段。
 */
public sealed interface ExpressionNode permits TerminalNode, InternalNode {

    /** 是否表示逻辑否定 */
    boolean isExclude();

    void setExclude(boolean exclude);

    /** 渲染时是否需要显式括号 */
    boolean isGrouped();

    void setGrouped(boolean grouped);
}
