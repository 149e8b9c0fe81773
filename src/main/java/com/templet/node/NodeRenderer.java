package com.templet.node;

import com.templet.data.Entity;
import com.templet.error.InvalidTagException;
import com.templet.name.PathResolver;
import com.templet.name.Resolution;
import org.eclipse.collections.api.list.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class NodeRenderer {
    private static final Logger log = LoggerFactory.getLogger(NodeRenderer.class);

    private final PathResolver resolver;
    private final RenderOptions options;

    public NodeRenderer() {
        this(new PathResolver(), RenderOptions.DEFAULT);
    }

    public NodeRenderer(RenderOptions options) {
        this(new PathResolver(), options);
    }

    public NodeRenderer(PathResolver resolver, RenderOptions options) {
        this.resolver = resolver;
        this.options = options;
    }

    public void render(ImmutableList<Node> nodes, StringBuilder out, Entity.MapValue scope) {
        for (Node node : nodes) {
            render(node, out, scope);
        }
    }

    public void render(Node node, StringBuilder out, Entity.MapValue scope) {
        switch (node.type()) {
            case TEXT -> out.append(((Node.Text) node).content());
            case VALUE -> renderValue((Node.Value) node, out, scope);
            case IF_VALUE -> renderBranch(((Node.IfValue) node).condition(), node.children(), out, scope);
            case ELIF_VALUE -> renderBranch(((Node.ElifValue) node).condition(), node.children(), out, scope);
            case ELSE_VALUE -> render(node.children(), out, scope);
            case FOR_VALUE -> renderFor((Node.ForValue) node, out, scope);
        }
    }

    /**
     * An if condition holds when the name is bound in the scope, whatever it is bound to.
     * The name is looked up as written; paths are not followed.
     */
    static boolean isBound(String name, Entity.MapValue scope) {
        return scope.contains(name);
    }

    private void renderValue(Node.Value value, StringBuilder out, Entity.MapValue scope) {
        Resolution resolution = resolver.lookup(value.name(), scope);
        if (resolution.isMissing() && !options.strictMissingValues()) {
            log.debug("Missing value tag '{}' rendered as empty", value.name());
            return;
        }
        out.append(resolver.requireString(value.name(), resolution.orElseThrow()));
    }

    // Children up to the first elif/else belong to this branch; the rest are alternatives.
    private void renderBranch(String condition, ImmutableList<Node> children, StringBuilder out,
                              Entity.MapValue scope) {
        if (isBound(condition, scope)) {
            for (Node child : children) {
                if (child.type().isBranch()) {
                    break;
                }
                render(child, out, scope);
            }
        } else {
            for (Node child : children) {
                if (child.type().isBranch()) {
                    render(child, out, scope);
                }
            }
        }
    }

    private void renderFor(Node.ForValue loop, StringBuilder out, Entity.MapValue scope) {
        ImmutableList<Entity> elements = resolver.resolveList(loop.listName(), scope);
        if (scope.contains(loop.alias())) {
            throw new InvalidTagException("For expression alias name collides with an existing name: " + loop.alias());
        }

        log.debug("Looping over '{}' as '{}' ({} elements)", loop.listName(), loop.alias(), elements.size());
        for (Entity element : elements) {
            render(loop.children(), out, scope.with(loop.alias(), element));
        }
    }
}
