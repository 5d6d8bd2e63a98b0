package com.ftsquery.query;

/** 词项匹配方式 */
public enum TermForm {
    /** 屈折词形展开 */
    INFLECTIONAL,
    /** 同义词展开 */
    THESAURUS,
    /** 精确匹配 */
    LITERAL
}
