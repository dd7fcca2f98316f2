package me.bechberger.logveil.util;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Matches file names against simple glob patterns ({@code *} and {@code ?}).
 * <p>
 * Used for the filename patterns of profiles and for the include filters of directory runs.
 * Compiled globs are cached; the class is safe to use from worker threads.
 */
public final class GlobMatcher {

    private static final Map<String, Pattern> CACHE = new ConcurrentHashMap<>();

    private GlobMatcher() {
    }

    /**
     * Check if a file name matches any of the globs.
     * Entries may hold several comma-separated globs.
     *
     * @param fileName File name without directories
     * @param globs    Glob patterns, may be null
     * @return true if any glob matches the whole file name
     */
    public static boolean matches(String fileName, List<String> globs) {
        if (fileName == null || globs == null || globs.isEmpty()) {
            return false;
        }
        for (String entry : globs) {
            for (String glob : entry.split(",")) {
                glob = glob.trim();
                if (!glob.isEmpty() && matches(fileName, glob)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Check a single glob. Globs without wildcards must equal the file name.
     */
    public static boolean matches(String fileName, String glob) {
        if (glob.indexOf('*') < 0 && glob.indexOf('?') < 0) {
            return fileName.equals(glob);
        }
        return CACHE.computeIfAbsent(glob, g -> Pattern.compile(globToRegex(g))).matcher(fileName).matches();
    }

    /**
     * Convert a glob to an anchored regular expression; everything but the wildcards is literal.
     */
    public static String globToRegex(String glob) {
        StringBuilder regex = new StringBuilder("^");
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return regex.append("$").toString();
    }
}
