package org.rubyshift.transpiler.filter.features.require;

import java.util.ArrayList;
import java.util.List;

import org.rubyshift.transpiler.TranspilerOptions.Autoexports;
import org.rubyshift.transpiler.ast.Atom;
import org.rubyshift.transpiler.ast.Node;
import org.rubyshift.transpiler.ast.Nodes;

/**
 * Finds the names a required file exports at top level.
 * <p>
 * Explicit {@code (send nil :export X)} wrappers export {@code X}, {@code (send nil :default X)}
 * inside one makes it the default export. With autoexports every other top-level class,
 * module, constant or method counts too.
 */
final class ExportCollector {

    private static final Atom EXPORT = Atom.of("export");
    private static final Atom DEFAULT = Atom.of("default");

    /**
     * @param defaultExport The default export, or {@code null}.
     * @param named         The named exports in source order.
     */
    record Exports(Atom defaultExport, List<Atom> named) {

        boolean isEmpty() {
            return defaultExport == null && named.isEmpty();
        }

        /**
         * @return The import bindings: {@code (const nil :Default)} followed by a list of named consts.
         */
        List<Object> bindings() {
            List<Object> bindings = new ArrayList<>();
            if (defaultExport != null) {
                bindings.add(Node.of("const", null, defaultExport));
            }
            if (!named.isEmpty()) {
                List<Node> consts = new ArrayList<>();
                for (Atom name : named) {
                    consts.add(Node.of("const", null, name));
                }
                bindings.add(consts);
            }
            return bindings;
        }
    }

    private ExportCollector() {}

    static Exports collect(Node root, Autoexports autoexports) {
        List<Atom> named = new ArrayList<>();
        List<Atom> auto = new ArrayList<>();
        List<Atom> defaults = new ArrayList<>();

        for (Node statement : Nodes.statements(root)) {
            Node declaration = statement;
            List<Atom> target;
            if (isCall(statement, EXPORT)) {
                declaration = statement.childNode(2);
                if (isCall(declaration, DEFAULT)) {
                    declaration = declaration.childNode(2);
                    target = defaults;
                } else {
                    target = named;
                }
            } else if (autoexports != Autoexports.OFF) {
                target = auto;
            } else {
                continue;
            }
            Atom name = declaredName(declaration);
            if (name != null) {
                target.add(name);
            }
        }

        if (autoexports == Autoexports.DEFAULT && auto.size() == 1) {
            defaults.addAll(auto);
        } else {
            named.addAll(auto);
        }
        return new Exports(defaults.isEmpty() ? null : defaults.get(0), named);
    }

    private static boolean isCall(Node node, Atom method) {
        return node != null && node.is("send") && node.childCount() >= 3
                && node.child(0) == null && method.equals(node.child(1));
    }

    private static Atom declaredName(Node declaration) {
        if (declaration == null) {
            return null;
        }
        if (declaration.is("class") || declaration.is("module")) {
            Node name = declaration.childNode(0);
            if (name != null && name.childCount() >= 2 && name.child(0) == null && name.child(1) instanceof Atom atom) {
                return atom;
            }
        } else if (declaration.is("casgn") && declaration.childCount() >= 2) {
            if (declaration.child(0) == null && declaration.child(1) instanceof Atom atom) {
                return atom;
            }
        } else if (declaration.is("def") && declaration.childCount() > 0) {
            if (declaration.child(0) instanceof Atom atom) {
                return atom;
            }
        }
        return null;
    }
}
