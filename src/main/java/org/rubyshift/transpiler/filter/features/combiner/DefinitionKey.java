package org.rubyshift.transpiler.filter.features.combiner;

import java.util.ArrayList;
import java.util.List;

import org.rubyshift.transpiler.ast.Atom;
import org.rubyshift.transpiler.ast.Node;

/**
 * Identifies a module or class definition by its kind and fully qualified constant name,
 * e.g. {@code module:Foo::Bar}.
 */
record DefinitionKey(String kind, String qualifiedName) {

    static DefinitionKey of(Node definition) {
        List<String> parts = new ArrayList<>();
        Node name = definition.childNode(0);
        while (name != null && name.is("const") && name.childCount() >= 2) {
            parts.add(0, name.child(1) instanceof Atom atom ? atom.name() : String.valueOf(name.child(1)));
            name = name.childNode(0);
        }
        return new DefinitionKey(definition.tag(), String.join("::", parts));
    }

    @Override
    public String toString() {
        return kind + ":" + qualifiedName;
    }
}
