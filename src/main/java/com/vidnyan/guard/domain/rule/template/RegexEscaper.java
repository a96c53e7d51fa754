package com.vidnyan.guard.domain.rule.template;

/**
 * Turns user-supplied literals into regex fragments.
 */
final class RegexEscaper {

    private static final String META = "\\.+*?()|[]{}^$";

    static String escape(String literal) {
        StringBuilder sb = new StringBuilder(literal.length() + 8);
        for (int i = 0; i < literal.length(); i++) {
            char ch = literal.charAt(i);
            if (META.indexOf(ch) >= 0) {
                sb.append('\\');
            }
            sb.append(ch);
        }
        return sb.toString();
    }

    /**
     * Escape a path, then let {@code *} mean "anything". Backslashes are
     * normalized to forward slashes first, like every candidate path.
     */
    static String path(String path) {
        return escape(path.replace('\\', '/')).replace("\\*", ".*");
    }

    private RegexEscaper() {}
}
