package io.infrautomater.core.hcl;

import java.util.regex.Pattern;

/// Escaping and validation helpers for generated HCL.
///
/// Template sequences are neutralised as well as quotes, so a value such as
/// `${file("/etc/passwd")}` renders as the literal text rather than an
/// interpolation.
public final class HclStrings {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_-]*");

    private HclStrings() {}

    /// Renders a quoted HCL string literal.
    ///
    /// @param value the raw text, not null
    /// @return quoted and escaped literal, never null
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            char next = i + 1 < value.length() ? value.charAt(i + 1) : 0;
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '$', '%' -> {
                    sb.append(c);
                    if (next == '{') {
                        sb.append(c);
                    }
                }
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    /// Returns whether `name` can be used as a bare attribute name or block type.
    ///
    /// @param name candidate identifier, may be null
    /// @return true if valid
    public static boolean isIdentifier(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    /// Validates an identifier.
    ///
    /// @param name candidate identifier
    /// @return `name`
    /// @throws IllegalArgumentException if `name` is not a valid identifier
    public static String requireIdentifier(String name) {
        if (!isIdentifier(name)) {
            throw new IllegalArgumentException("Invalid HCL identifier: " + name);
        }
        return name;
    }
}
