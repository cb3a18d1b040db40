package io.infrautomater.core.hcl;

/// Root of a generated HCL file.
///
/// Used both for definition files (blocks) and variable-value files
/// (top-level attributes only).
///
/// {@snippet :
/// HclDocument doc = new HclDocument();
/// doc.block("provider", "aws").attribute("region", HclExpression.var("region"));
/// doc.attribute("name", request.name()); // quoted and escaped
/// String text = doc.render();
/// }
public final class HclDocument extends HclBody {

    @Override
    public HclDocument attribute(String name, Object value) {
        super.attribute(name, value);
        return this;
    }

    /// Renders the document as HCL text.
    ///
    /// @return rendered text ending in a newline, never null
    public String render() {
        StringBuilder out = new StringBuilder();
        renderItems(out, 0);
        return out.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
