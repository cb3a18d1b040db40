package io.infrautomater.core.hcl;

import java.util.Objects;

/// A raw HCL expression emitted verbatim, such as `var.region` or
/// `aws_s3_bucket.this.id`.
///
/// Only generator code constructs expressions. Request-supplied text must be
/// passed as a plain {@link String} value so it is quoted and escaped.
///
/// @param source expression text, not null
public record HclExpression(String source) {

    public HclExpression {
        Objects.requireNonNull(source, "source must not be null");
    }

    public static HclExpression of(String source) {
        return new HclExpression(source);
    }

    /// Shorthand for a variable reference.
    ///
    /// @param name variable name, must be a valid identifier
    /// @return `var.<name>` expression, never null
    public static HclExpression var(String name) {
        return new HclExpression("var." + HclStrings.requireIdentifier(name));
    }
}
