package com.procrawl.listingsync.ingest.url;

import java.net.IDN;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The five RFC 3986 components of a URI reference, kept as raw text. {@code null} means the
 * component is undefined, which is not the same as empty ({@code "http://h/p?"} has an empty query).
 */
public record UriParts(String scheme, String authority, String path, String query, String fragment) {
    // RFC 3986, appendix B
    private static final Pattern REFERENCE =
        Pattern.compile("^(([^:/?#]+):)?(//([^/?#]*))?([^?#]*)(\\?([^#]*))?(#(.*))?$", Pattern.DOTALL);
    private static final Pattern SCHEME = Pattern.compile("^[A-Za-z][A-Za-z0-9+.-]*$");
    private static final Pattern REG_NAME = Pattern.compile("^[A-Za-z0-9](?:[A-Za-z0-9._~%!$&'()*+,;=-]*)$");
    private static final Pattern IP_LITERAL = Pattern.compile("^\\[[0-9A-Fa-f:.vV]+]$");
    private static final Pattern PORT = Pattern.compile("^[0-9]*$");

    public UriParts {
        path = path == null ? "" : path;
    }

    public static UriParts parse(String reference) {
        Matcher matcher = REFERENCE.matcher(reference == null ? "" : reference);
        if (!matcher.matches()) {
            return new UriParts(null, null, reference, null, null);
        }
        String scheme = matcher.group(2);
        String authority = matcher.group(4);
        String path = matcher.group(5);
        if (scheme != null && !SCHEME.matcher(scheme).matches()) {
            // "foo bar:baz" is a relative path whose first segment holds a colon
            String prefix = scheme + ":";
            path = authority == null ? prefix + path : prefix + "//" + authority + path;
            scheme = null;
            authority = null;
        }
        return new UriParts(scheme, authority, path, matcher.group(7), matcher.group(9));
    }

    /**
     * Resolves {@code reference} against this base, RFC 3986 section 5.2.2 (strict parser).
     */
    public UriParts resolve(UriParts reference) {
        if (reference.scheme() != null) {
            return new UriParts(
                reference.scheme(),
                reference.authority(),
                removeDotSegments(reference.path()),
                reference.query(),
                reference.fragment()
            );
        }
        if (reference.authority() != null) {
            return new UriParts(
                scheme,
                reference.authority(),
                removeDotSegments(reference.path()),
                reference.query(),
                reference.fragment()
            );
        }
        if (reference.path().isEmpty()) {
            return new UriParts(
                scheme,
                authority,
                path,
                reference.query() != null ? reference.query() : query,
                reference.fragment()
            );
        }
        String targetPath = reference.path().startsWith("/")
            ? removeDotSegments(reference.path())
            : removeDotSegments(merge(reference.path()));
        return new UriParts(scheme, authority, targetPath, reference.query(), reference.fragment());
    }

    public String host() {
        if (authority == null) {
            return null;
        }
        String hostPort = authority.substring(authority.lastIndexOf('@') + 1);
        if (hostPort.startsWith("[")) {
            int end = hostPort.indexOf(']');
            return end == -1 ? hostPort : hostPort.substring(0, end + 1);
        }
        int colon = hostPort.lastIndexOf(':');
        return colon == -1 ? hostPort : hostPort.substring(0, colon);
    }

    public boolean hasValidHost() {
        String host = host();
        if (host == null || host.isEmpty()) {
            return false;
        }
        if (!REG_NAME.matcher(asciiHost(host)).matches() && !IP_LITERAL.matcher(host).matches()) {
            return false;
        }
        String hostPort = authority.substring(authority.lastIndexOf('@') + 1);
        String rest = hostPort.substring(host.length());
        return rest.isEmpty() || (rest.startsWith(":") && PORT.matcher(rest.substring(1)).matches());
    }

    // Internationalized names are checked in their punycode form; the URL text itself is not rewritten.
    private static String asciiHost(String host) {
        if (host.chars().allMatch(c -> c < 0x80)) {
            return host;
        }
        try {
            return IDN.toASCII(host, IDN.ALLOW_UNASSIGNED);
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    /**
     * Same reference with the host lower-cased; user info and port are left alone.
     */
    public UriParts withLowerCaseHost() {
        String host = host();
        if (host == null) {
            return this;
        }
        int at = authority.lastIndexOf('@');
        String userInfo = at == -1 ? "" : authority.substring(0, at + 1);
        String hostPort = authority.substring(at + 1);
        String lowered = userInfo + host.toLowerCase(Locale.ROOT) + hostPort.substring(host.length());
        return new UriParts(scheme, lowered, path, query, fragment);
    }

    public UriParts withScheme(String newScheme) {
        return new UriParts(newScheme, authority, path, query, fragment);
    }

    public UriParts withQuery(String newQuery) {
        return new UriParts(scheme, authority, path, newQuery, fragment);
    }

    public UriParts withFragment(String newFragment) {
        return new UriParts(scheme, authority, path, query, newFragment);
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder();
        if (scheme != null) {
            out.append(scheme).append(':');
        }
        if (authority != null) {
            out.append("//").append(authority);
        }
        out.append(path);
        if (query != null) {
            out.append('?').append(query);
        }
        if (fragment != null) {
            out.append('#').append(fragment);
        }
        return out.toString();
    }

    private String merge(String referencePath) {
        if (authority != null && path.isEmpty()) {
            return "/" + referencePath;
        }
        int lastSlash = path.lastIndexOf('/');
        return lastSlash == -1 ? referencePath : path.substring(0, lastSlash + 1) + referencePath;
    }

    static String removeDotSegments(String input) {
        String in = input == null ? "" : input;
        StringBuilder out = new StringBuilder();
        while (!in.isEmpty()) {
            if (in.startsWith("../")) {
                in = in.substring(3);
            } else if (in.startsWith("./")) {
                in = in.substring(2);
            } else if (in.startsWith("/./")) {
                in = in.substring(2);
            } else if (in.equals("/.")) {
                in = "/";
            } else if (in.startsWith("/../")) {
                in = in.substring(3);
                dropLastSegment(out);
            } else if (in.equals("/..")) {
                in = "/";
                dropLastSegment(out);
            } else if (in.equals(".") || in.equals("..")) {
                in = "";
            } else {
                int next = in.indexOf('/', in.startsWith("/") ? 1 : 0);
                String segment = next == -1 ? in : in.substring(0, next);
                out.append(segment);
                in = in.substring(segment.length());
            }
        }
        return out.toString();
    }

    private static void dropLastSegment(StringBuilder out) {
        int lastSlash = out.lastIndexOf("/");
        out.setLength(Math.max(lastSlash, 0));
    }
}
