package com.ftsquery.query;

import com.ftsquery.config.Constants;
import com.ftsquery.text.TextScanner;

import java.util.Set;

/**
 * 将用户输入的检索表达式解析为左深的二叉表达式树。
 *
 * <p>解析从不失败：未闭合的引号与括号吞掉剩余文本，无法识别的标点被忽略。
 * 没有任何有效词项时返回 null。</p>
 */
public class ExpressionParser {
    private final Set<String> stopWords;

    public ExpressionParser(Set<String> stopWords) {
        this.stopWords = stopWords == null ? Set.of() : stopWords;
    }

    /**
     * 在给定默认连接词下解析查询片段，返回表达式树根节点或 null。
     */
    public ExpressionNode parse(String query, Conjunction defaultConjunction) {
        TextScanner scanner = new TextScanner(query);
        ExpressionNode root = null;

        Conjunction conjunction = defaultConjunction;
        TermForm form = TermForm.INFLECTIONAL;
        boolean exclude = false;
        boolean resetState = true;

        while (!scanner.atEnd()) {
            if (resetState) {
                conjunction = defaultConjunction;
                form = TermForm.INFLECTIONAL;
                exclude = false;
                resetState = false;
            }

            scanner.skipWhitespace();
            if (scanner.atEnd()) {
                break;
            }

            char ch = scanner.peek();
            if (!Constants.isPunctuation(ch)) {
                String term = scanner.takeWhile(c -> !Constants.isPunctuation(c) && !Constants.isWhitespace(c));

                // 尾部通配符只能精确匹配
                if (scanner.peek() == Constants.WILDCARD) {
                    term += Constants.WILDCARD;
                    scanner.advance();
                    form = TermForm.LITERAL;
                }

                if ("and".equalsIgnoreCase(term)) {
                    conjunction = Conjunction.AND;
                } else if ("or".equalsIgnoreCase(term)) {
                    conjunction = Conjunction.OR;
                } else if ("near".equalsIgnoreCase(term)) {
                    conjunction = Conjunction.NEAR;
                } else if ("not".equalsIgnoreCase(term)) {
                    exclude = true;
                } else {
                    root = addTerm(root, term, form, exclude, conjunction);
                    resetState = true;
                }
                continue;
            }

            switch (ch) {
                case '"' -> {
                    scanner.advance();
                    String term = scanner.takeWhile(c -> c != ch);
                    root = addTerm(root, trim(term), TermForm.LITERAL, exclude, conjunction);
                    resetState = true;
                }
                case '(' -> {
                    String block = extractBlock(scanner, '(', ')');
                    root = addNode(root, parse(block, defaultConjunction), conjunction, true);
                    resetState = true;
                }
                case '<' -> {
                    String block = extractBlock(scanner, '<', '>');
                    root = addNode(root, parse(block, Conjunction.NEAR), conjunction, false);
                    resetState = true;
                }
                case '-' -> exclude = true;
                case '+' -> form = TermForm.LITERAL;
                case '~' -> form = TermForm.THESAURUS;
                default -> {
                    // 其余标点忽略
                }
            }
            scanner.advance();
        }
        return root;
    }

    /**
     * 创建词项节点并追加到树中；空串与停用词被丢弃。
     */
    ExpressionNode addTerm(ExpressionNode root, String term, TermForm form, boolean exclude, Conjunction conjunction) {
        if (term.isEmpty() || stopWords.contains(term)) {
            return root;
        }
        return addNode(root, new TerminalNode(term, form, exclude), conjunction, false);
    }

    /**
     * 以新的内部节点连接已有树与新节点，返回新的根节点。
     */
    static ExpressionNode addNode(ExpressionNode root, ExpressionNode node, Conjunction conjunction, boolean group) {
        if (node == null) {
            return root;
        }
        node.setGrouped(group);
        if (root == null) {
            return node;
        }
        return new InternalNode(root, node, conjunction);
    }

    /**
     * 裁剪引号短语两端的空白。
     */
    static String trim(String term) {
        int start = 0;
        int end = term.length();
        while (start < end && Constants.isTrimmable(term.charAt(start))) {
            start++;
        }
        while (end > start && Constants.isTrimmable(term.charAt(end - 1))) {
            end--;
        }
        return term.substring(start, end);
    }

    /**
     * 提取定界符之间的文本。调用时游标位于开定界符，返回时位于匹配的闭定界符或文本末尾。
     * 引号内的定界符不计入嵌套深度。
     */
    static String extractBlock(TextScanner scanner, char open, char close) {
        int depth = 1;

        scanner.advance();
        int start = scanner.getPosition();
        while (!scanner.atEnd()) {
            char ch = scanner.peek();
            if (ch == open) {
                depth++;
            } else if (ch == close) {
                depth--;
                if (depth == 0) {
                    break;
                }
            } else if (ch == '"' || ch == '\'') {
                scanner.advance();
                scanner.skipWhile(c -> c != ch);
            }
            scanner.advance();
        }
        return scanner.extract(start, scanner.getPosition());
    }
}
