package ru.draen.ssa.ir;

public enum BranchKind {
    IF("if"),
    WHILE("while"),
    FOR("for");

    private final String keyword;

    BranchKind(String keyword) {
        this.keyword = keyword;
    }

    public String getKeyword() {
        return keyword;
    }
}
