package com.feedery.core.merge;

import com.feedery.core.model.Entry;

import java.util.regex.Pattern;

/**
 * Include/exclude regex pair matched case-insensitively against an entry's title and content.
 */
final class EntryFilter {

    static final EntryFilter NONE = new EntryFilter(null, null);

    private final Pattern include;
    private final Pattern exclude;

    private EntryFilter(Pattern include, Pattern exclude) {
        this.include = include;
        this.exclude = exclude;
    }

    static EntryFilter of(String include, String exclude) {
        if (isBlank(include) && isBlank(exclude)) {
            return NONE;
        }
        return new EntryFilter(compile(include), compile(exclude));
    }

    boolean accepts(Entry entry) {
        if (include == null && exclude == null) return true;
        String text = entry.filterText();
        if (include != null && !include.matcher(text).find()) return false;
        return exclude == null || !exclude.matcher(text).find();
    }

    private static Pattern compile(String regex) {
        return isBlank(regex) ? null : Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
