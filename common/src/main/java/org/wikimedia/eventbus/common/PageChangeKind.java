package org.wikimedia.eventbus.common;

/**
 * Kinds of page changes reported in {@code page_change} events, with the
 * changelog operation each one applies to a copy of the page.
 */
public enum PageChangeKind {
    CREATE("create", "insert"),
    EDIT("edit", "update"),
    MOVE("move", "update"),
    VISIBILITY_CHANGE("visibility_change", "update"),
    DELETE("delete", "delete"),
    UNDELETE("undelete", "insert");

    private final String kindName;
    private final String changelogKind;

    PageChangeKind(String kindName, String changelogKind) {
        this.kindName = kindName;
        this.changelogKind = changelogKind;
    }

    /** Value of the {@code page_change_kind} field. */
    public String kindName() {
        return kindName;
    }

    /** Value of the {@code changelog_kind} field: {@code insert}, {@code update} or {@code delete}. */
    public String changelogKind() {
        return changelogKind;
    }
}
