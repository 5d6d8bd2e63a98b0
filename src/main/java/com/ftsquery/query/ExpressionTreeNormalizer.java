package com.ftsquery.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 修正目标语法无法表达的子表达式。
 *
 * <pre>
 * NOT a AND b          左右子表达式交换
 * NOT a                丢弃
 * NOT a AND NOT b      位于括号内或根节点时丢弃，否则留给父节点处理
 * a OR NOT b           丢弃被否定的操作数
 * a NEAR NOT b         NEAR 降级为 AND
 * </pre>
 */
public class ExpressionTreeNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(ExpressionTreeNormalizer.class);

    /**
     * 规范化整棵树，返回新的根节点；树被完全消除时返回 null。
     */
    public ExpressionNode normalize(ExpressionNode root) {
        return fixUp(root, true);
    }

    /**
     * 后序重写节点，子节点在父节点之前处理。
     *
     * <p>左侧主干迭代处理，只有右子树递归，递归深度受括号嵌套层数约束。</p>
     */
    ExpressionNode fixUp(ExpressionNode node, boolean isRoot) {
        if (node == null) {
            return null;
        }

        Deque<InternalNode> spine = new ArrayDeque<>();
        ExpressionNode current = node;
        while (current instanceof InternalNode internalNode) {
            spine.push(internalNode);
            current = internalNode.getLeft();
        }

        ExpressionNode fixed = current == null ? null : eliminateNegation(current, spine.isEmpty() && isRoot);
        while (!spine.isEmpty()) {
            InternalNode internalNode = spine.pop();
            internalNode.setLeft(fixed);
            internalNode.setRight(fixUp(internalNode.getRight(), false));
            fixed = rewrite(internalNode, spine.isEmpty() && isRoot);
        }
        return fixed;
    }

    /**
     * 在子节点规范化之后修正单个内部节点，返回替代它的节点或 null。
     */
    private ExpressionNode rewrite(InternalNode internalNode, boolean isRoot) {
        if (internalNode.getConjunction() == Conjunction.NEAR) {
            if (isInvalidWithNear(internalNode.getLeft()) || isInvalidWithNear(internalNode.getRight())) {
                logger.debug("NEAR 两侧不是精确词项，降级为 AND");
                internalNode.setConjunction(Conjunction.AND);
            }
        } else if (internalNode.getConjunction() == Conjunction.OR) {
            if (isInvalidWithOr(internalNode.getLeft())) {
                logger.debug("丢弃 OR 左侧操作数");
                internalNode.setLeft(null);
            }
            if (isInvalidWithOr(internalNode.getRight())) {
                logger.debug("丢弃 OR 右侧操作数");
                internalNode.setRight(null);
            }
        }

        ExpressionNode left = internalNode.getLeft();
        ExpressionNode right = internalNode.getRight();
        ExpressionNode result = internalNode;
        if (left == null && right == null) {
            return null;
        } else if (left == null) {
            result = right;
        } else if (right == null) {
            result = left;
        } else {
            internalNode.setExclude(left.isExclude() && right.isExclude());
            // 否定操作数放到右侧
            if (!internalNode.isExclude() && left.isExclude()) {
                internalNode.swapChildren();
            }
        }
        return eliminateNegation(result, isRoot);
    }

    /**
     * 括号内或根节点上仅含否定条件的表达式被丢弃。
     */
    private ExpressionNode eliminateNegation(ExpressionNode node, boolean isRoot) {
        if ((node.isGrouped() || isRoot) && node.isExclude()) {
            logger.debug("丢弃仅含否定条件的表达式");
            return null;
        }
        return node;
    }

    /**
     * NEAR 只接受精确匹配的词项。
     */
    private boolean isInvalidWithNear(ExpressionNode node) {
        return !(node instanceof TerminalNode terminal) || terminal.getForm() != TermForm.LITERAL;
    }

    /**
     * OR 的操作数不能缺失或被否定。
     */
    private boolean isInvalidWithOr(ExpressionNode node) {
        return node == null || node.isExclude();
    }
}
