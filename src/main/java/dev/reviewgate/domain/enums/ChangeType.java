package dev.reviewgate.domain.enums;

import java.util.Locale;

/**
 * Kind of modification a PR applies to a file. Azure DevOps reports compound values
 * such as {@code "rename, edit"}; anything that is not an add or delete is an edit.
 */
public enum ChangeType {
    ADD, EDIT, DELETE;

    public static ChangeType from(String raw) {
        if (raw == null) return EDIT;
        String lower = raw.toLowerCase(Locale.ROOT);
        if (lower.contains("delete")) return DELETE;
        if (lower.contains("add")) return ADD;
        return EDIT;
    }
}
