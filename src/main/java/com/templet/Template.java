package com.templet;

import com.templet.data.Entity;
import com.templet.node.Node;
import com.templet.node.NodeRenderer;
import com.templet.node.RenderOptions;
import com.templet.node.TemplateParser;
import org.eclipse.collections.api.list.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Template {
    private static final Logger log = LoggerFactory.getLogger(Template.class);

    private final ImmutableList<Node> nodes;

    private Template(ImmutableList<Node> nodes) {
        this.nodes = nodes;
    }

    public static Template compile(String source) {
        ImmutableList<Node> nodes = new TemplateParser().parse(source);
        log.debug("Compiled template into {} top-level nodes", nodes.size());
        return new Template(nodes);
    }

    public ImmutableList<Node> nodes() {
        return nodes;
    }

    public String render(Entity.MapValue scope) {
        return render(scope, RenderOptions.DEFAULT);
    }

    public String render(Entity.MapValue scope, RenderOptions options) {
        StringBuilder out = new StringBuilder();
        new NodeRenderer(options).render(nodes, out, scope);
        return out.toString();
    }

    // sink is only appended to once rendering has succeeded
    public void renderTo(Entity.MapValue scope, RenderOptions options, StringBuilder sink) {
        sink.append(render(scope, options));
    }
}
