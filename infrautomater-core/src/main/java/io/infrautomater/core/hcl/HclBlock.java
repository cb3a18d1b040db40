package io.infrautomater.core.hcl;

import java.util.List;

/// A labelled HCL block such as `resource "aws_s3_bucket" "this" { ... }`.
public final class HclBlock extends HclBody {

    private final String type;
    private final List<String> labels;

    HclBlock(String type, String... labels) {
        this.type = HclStrings.requireIdentifier(type);
        this.labels = List.of(labels);
    }

    @Override
    public HclBlock attribute(String name, Object value) {
        super.attribute(name, value);
        return this;
    }

    public String getType() {
        return type;
    }

    public List<String> getLabels() {
        return labels;
    }

    void render(StringBuilder out, int depth) {
        indent(out, depth);
        out.append(type);
        for (String label : labels) {
            out.append(' ').append(HclStrings.quote(label));
        }
        out.append(" {\n");
        renderItems(out, depth + 1);
        indent(out, depth);
        out.append("}\n");
    }
}
