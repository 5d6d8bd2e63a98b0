package com.ftsquery.query;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * 以连接词组合左右两个子表达式的内部节点。子节点可为 null，仅在规范化过程中出现。
 */
public final class InternalNode implements ExpressionNode {
    private boolean exclude;
    private boolean grouped;
    private ExpressionNode left;
    private ExpressionNode right;
    private Conjunction conjunction;

    public InternalNode(ExpressionNode left, ExpressionNode right, Conjunction conjunction) {
        this.left = left;
        this.right = right;
        this.conjunction = conjunction;
    }

    @Override
    public boolean isExclude() {
        return exclude;
    }

    @Override
    public void setExclude(boolean exclude) {
        this.exclude = exclude;
    }

    @Override
    public boolean isGrouped() {
        return grouped;
    }

    @Override
    public void setGrouped(boolean grouped) {
        this.grouped = grouped;
    }

    public ExpressionNode getLeft() {
        return left;
    }

    public void setLeft(ExpressionNode left) {
        this.left = left;
    }

    public ExpressionNode getRight() {
        return right;
    }

    public void setRight(ExpressionNode right) {
        this.right = right;
    }

    public Conjunction getConjunction() {
        return conjunction;
    }

    public void setConjunction(Conjunction conjunction) {
        this.conjunction = conjunction;
    }

    /**
     * 交换左右子节点。
     */
    public void swapChildren() {
        ExpressionNode temp = left;
        left = right;
        right = temp;
    }

    /**
     * 沿左侧主干迭代渲染，只有右子树递归。
     */
    @Override
    public String toString() {
        Deque<InternalNode> spine = new ArrayDeque<>();
        ExpressionNode current = this;
        while (current instanceof InternalNode internalNode) {
            spine.push(internalNode);
            current = internalNode.left;
        }

        StringBuilder builder = new StringBuilder();
        Iterator<InternalNode> topDown = spine.descendingIterator();
        while (topDown.hasNext()) {
            if (topDown.next().rendersGroup()) {
                builder.append('(');
            }
        }
        if (current != null) {
            builder.append(current);
        }
        for (InternalNode node : spine) {
            if (node.left == null && node.right != null) {
                builder.append(node.right);
            } else if (node.left != null && node.right != null) {
                builder.append(' ');
                if (node.conjunction != null) {
                    builder.append(node.conjunction.keyword()).append(' ');
                }
                builder.append(node.right);
                if (node.grouped) {
                    builder.append(')');
                }
            }
        }
        return builder.toString();
    }

    private boolean rendersGroup() {
        return grouped && left != null && right != null;
    }
}
