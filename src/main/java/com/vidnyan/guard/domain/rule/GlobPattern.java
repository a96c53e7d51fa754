package com.vidnyan.guard.domain.rule;

import com.google.re2j.Pattern;

/**
 * Translates shell-style globs into anchored RE2 patterns.
 * {@code *} matches any run of characters (separators included), {@code ?} one character.
 */
public final class GlobPattern {

    public static Pattern globToRegexPattern(String globPattern, boolean ignoreCase) {
        String regex = globToRegex(globPattern);
        return ignoreCase ? Pattern.compile(regex, Pattern.CASE_INSENSITIVE) : Pattern.compile(regex);
    }

    static String globToRegex(String globPattern) {
        StringBuilder sb = new StringBuilder(64);
        sb.append('^');
        for (int i = 0; i < globPattern.length(); i++) {
            char ch = globPattern.charAt(i);
            switch (ch) {
                case '?':
                    sb.append('.');
                    break;
                case '*':
                    sb.append(".*");
                    break;
                case '^':
                case '$':
                case '|':
                case '.':
                case '+':
                case '\\':
                case '(':
                case ')':
                case '[':
                case ']':
                case '{':
                case '}':
                    sb.append('\\').append(ch);
                    break;
                default:
                    sb.append(ch);
                    break;
            }
        }
        sb.append('$');
        return sb.toString();
    }

    private GlobPattern() {}
}
