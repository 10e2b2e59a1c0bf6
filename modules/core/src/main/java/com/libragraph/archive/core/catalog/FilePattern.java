package com.libragraph.archive.core.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A compiled filename pattern from the type catalog.
 *
 * <p>Stored patterns use the {@code (?P<name>...)} named-group syntax and may
 * have underscores in group names, neither of which {@link Pattern} accepts.
 * Groups are renamed to {@code g0, g1, ...} on compile and mapped back on match.
 * Matching is anchored at the start of the filename only; a pattern that should
 * consume the whole name ends with {@code $}.
 */
public final class FilePattern {

    private static final Pattern NAMED_GROUP = Pattern.compile("\\(\\?P?<([A-Za-z_][A-Za-z0-9_]*)>");
    private static final Pattern BACKREF = Pattern.compile("\\(\\?P=([A-Za-z_][A-Za-z0-9_]*)\\)");

    private final String source;
    private final Pattern pattern;
    private final List<String> groupNames;

    private FilePattern(String source, Pattern pattern, List<String> groupNames) {
        this.source = source;
        this.pattern = pattern;
        this.groupNames = groupNames;
    }

    /**
     * @throws IllegalArgumentException if the pattern does not compile
     */
    public static FilePattern compile(String source) {
        List<String> names = new ArrayList<>();
        StringBuilder out = new StringBuilder(source.length() + 8);
        Matcher group = NAMED_GROUP.matcher(source);
        Matcher backref = BACKREF.matcher(source);

        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\' && i + 1 < source.length()) {
                out.append(c).append(source.charAt(i + 1));
                i += 2;
                continue;
            }
            if (c == '(') {
                group.region(i, source.length());
                if (group.lookingAt()) {
                    String name = group.group(1);
                    if (names.contains(name)) {
                        throw new IllegalArgumentException("Duplicate group '" + name + "' in pattern: " + source);
                    }
                    out.append("(?<g").append(names.size()).append('>');
                    names.add(name);
                    i = group.end();
                    continue;
                }
                backref.region(i, source.length());
                if (backref.lookingAt()) {
                    int index = names.indexOf(backref.group(1));
                    if (index < 0) {
                        throw new IllegalArgumentException("Unknown group '" + backref.group(1)
                                + "' in pattern: " + source);
                    }
                    out.append("\\k<g").append(index).append('>');
                    i = backref.end();
                    continue;
                }
            }
            out.append(c);
            i++;
        }

        try {
            return new FilePattern(source, Pattern.compile(out.toString()), Collections.unmodifiableList(names));
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid file pattern: " + source, e);
        }
    }

    /**
     * Matches {@code filename} from its first character. On a match, returns
     * the named groups that participated; groups that did not take part are left out.
     */
    public Optional<Map<String, String>> match(String filename) {
        Matcher m = pattern.matcher(filename);
        if (!m.lookingAt()) {
            return Optional.empty();
        }
        Map<String, String> groups = new LinkedHashMap<>();
        for (int g = 0; g < groupNames.size(); g++) {
            String value = m.group("g" + g);
            if (value != null) {
                groups.put(groupNames.get(g), value);
            }
        }
        return Optional.of(groups);
    }

    public List<String> groupNames() {
        return groupNames;
    }

    /** The pattern as stored in the catalog. */
    public String source() {
        return source;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FilePattern other && source.equals(other.source);
    }

    @Override
    public int hashCode() {
        return source.hashCode();
    }

    @Override
    public String toString() {
        return source;
    }
}
