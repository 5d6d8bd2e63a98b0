package com.ftsquery.query;

import com.ftsquery.config.Constants;

/**
 * 单个检索词项。
 */
public final class TerminalNode implements ExpressionNode {
    private boolean exclude;
    private boolean grouped;
    private final String term;
    private final TermForm form;

    public TerminalNode(String term, TermForm form) {
        this(term, form, false);
    }

    public TerminalNode(String term, TermForm form, boolean exclude) {
        this.term = term;
        this.form = form;
        this.exclude = exclude;
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

    public String getTerm() {
        return term;
    }

    public TermForm getForm() {
        return form;
    }

    /**
     * 按匹配方式渲染词项；未知匹配方式渲染为空串。
     */
    @Override
    public String toString() {
        if (form == null) {
            return "";
        }
        String prefix = exclude ? Constants.NOT_KEYWORD + " " : "";
        return switch (form) {
            case INFLECTIONAL -> prefix + formsOf(Constants.INFLECTIONAL_KEYWORD);
            case THESAURUS -> prefix + formsOf(Constants.THESAURUS_KEYWORD);
            case LITERAL -> prefix + "\"" + term + "\"";
        };
    }

    private String formsOf(String kind) {
        return Constants.FORMSOF_KEYWORD + "(" + kind + ", " + term + ")";
    }
}
