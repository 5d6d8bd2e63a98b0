package com.ftsquery.text;

import com.ftsquery.config.Constants;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextScannerTest {

    @Test
    @DisplayName("peek: 越界返回 NUL")
    void testPeekPastEndReturnsSentinel() {
        TextScanner scanner = new TextScanner("ab");

        assertEquals('a', scanner.peek());
        assertEquals('b', scanner.peek(1));
        assertEquals(Constants.NUL, scanner.peek(2));
        assertEquals(Constants.NUL, scanner.peek(-1));
    }

    @Test
    @DisplayName("advance: 不越过文本末尾")
    void testAdvanceIsClamped() {
        TextScanner scanner = new TextScanner("abc");

        scanner.advance(10);

        assertEquals(3, scanner.getPosition());
        assertTrue(scanner.atEnd());
        assertEquals(Constants.NUL, scanner.peek());

        scanner.advance();
        assertEquals(3, scanner.getPosition());
    }

    @Test
    @DisplayName("reset: null 视为空串")
    void testResetWithNull() {
        TextScanner scanner = new TextScanner("abc");
        scanner.advance(2);

        scanner.reset(null);

        assertEquals("", scanner.getText());
        assertEquals(0, scanner.getPosition());
        assertTrue(scanner.atEnd());
    }

    @Test
    @DisplayName("takeWhile: 返回被跳过的片段")
    void testTakeWhile() {
        TextScanner scanner = new TextScanner("hello world");

        String word = scanner.takeWhile(c -> c != ' ');

        assertEquals("hello", word);
        assertEquals(' ', scanner.peek());

        scanner.skipWhitespace();
        assertEquals("world", scanner.takeWhile(Character::isLetter));
        assertTrue(scanner.atEnd());
        assertEquals("", scanner.takeWhile(Character::isLetter));
    }

    @Test
    @DisplayName("skipWhitespace: 只跳过空格、制表符与换行")
    void testSkipWhitespace() {
        TextScanner scanner = new TextScanner(" \t\r\n x");

        scanner.skipWhitespace();

        assertEquals('x', scanner.peek());
        assertFalse(scanner.atEnd());
    }

    @Test
    @DisplayName("extract: 区间被夹到文本范围内")
    void testExtractIsClamped() {
        TextScanner scanner = new TextScanner("abcdef");

        assertEquals("bcd", scanner.extract(1, 4));
        assertEquals("def", scanner.extract(3, 100));
        assertEquals("", scanner.extract(4, 2));
        assertEquals("ab", scanner.extract(-3, 2));
    }
}
