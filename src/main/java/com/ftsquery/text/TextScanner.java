package com.ftsquery.text;

import com.ftsquery.config.Constants;

import java.util.function.IntPredicate;

/**
 * 输入文本上的游标，越界访问一律退化为哨兵字符或截断位置。
 */
public class TextScanner {
    private String text;
    private int position;

    public TextScanner(String text) {
        reset(text);
    }

    /**
     * 设置待扫描文本并将游标移回开头。
     */
    public void reset(String text) {
        this.text = text == null ? "" : text;
        this.position = 0;
    }

    public String getText() {
        return text;
    }

    public int getPosition() {
        return position;
    }

    public boolean atEnd() {
        return position >= text.length();
    }

    public char peek() {
        return peek(0);
    }

    /**
     * 返回当前位置之后第 offset 个字符，越界时返回 NUL。
     */
    public char peek(int offset) {
        int index = position + offset;
        if (index < 0 || index >= text.length()) {
            return Constants.NUL;
        }
        return text.charAt(index);
    }

    /**
     * 截取 [start, end) 区间，区间会被夹到文本范围内。
     */
    public String extract(int start, int end) {
        int from = Math.max(0, Math.min(start, text.length()));
        int to = Math.max(from, Math.min(end, text.length()));
        return text.substring(from, to);
    }

    public void advance() {
        advance(1);
    }

    /**
     * 前移 n 个字符，不越过文本末尾。
     */
    public void advance(int n) {
        position = Math.max(0, Math.min(position + n, text.length()));
    }

    public void skipWhitespace() {
        skipWhile(Constants::isWhitespace);
    }

    /**
     * 跳过所有满足条件的字符。
     */
    public void skipWhile(IntPredicate predicate) {
        while (!atEnd() && predicate.test(peek())) {
            advance();
        }
    }

    /**
     * 跳过满足条件的字符并返回被跳过的片段。
     */
    public String takeWhile(IntPredicate predicate) {
        int start = position;
        skipWhile(predicate);
        return extract(start, position);
    }
}
