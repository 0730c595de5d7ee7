package com.txt2tex.jackson;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.txt2tex.ast.DocumentItem;
import com.txt2tex.ast.Expr;
import com.txt2tex.ast.Node;
import com.txt2tex.ast.ParseResult;
import com.txt2tex.ast.ProofStep;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Jackson module for the txt2tex tree.
 *
 * Every node is written with a {@code "type"} property holding its simple class
 * name. Subtypes are found by walking the permitted subclasses of {@link Node},
 * so adding a record to a sealed interface is enough to make it serializable.
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.txt2tex", "txt2tex-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Register the mixin on each sealed level; fields are declared against all of them
        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(ParseResult.class, NodeMixin.class);
        context.setMixInAnnotations(DocumentItem.class, NodeMixin.class);
        context.setMixInAnnotations(Expr.class, NodeMixin.class);
        context.setMixInAnnotations(ProofStep.class, NodeMixin.class);

        for (Class<?> record : nodeTypes()) {
            context.registerSubtypes(new NamedType(record, record.getSimpleName()));
        }
    }

    /**
     * All concrete node records reachable from {@link Node}.
     */
    static Set<Class<?>> nodeTypes() {
        Set<Class<?>> records = new LinkedHashSet<>();
        collectRecords(Node.class, records);
        return records;
    }

    private static void collectRecords(Class<?> type, Set<Class<?>> out) {
        if (type.isRecord()) {
            out.add(type);
            return;
        }
        Class<?>[] permitted = type.getPermittedSubclasses();
        if (permitted == null) {
            return;
        }
        for (Class<?> sub : permitted) {
            collectRecords(sub, out);
        }
    }

    // ==================== Node Mixin ====================

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
    private interface NodeMixin {
    }
}
