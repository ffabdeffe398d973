package com.modeling.dae.flatten;

import com.modeling.dae.ast.ClassDefinition;
import com.modeling.dae.ast.Component;
import com.modeling.dae.ast.Equation;
import com.modeling.dae.ast.Statement;
import com.modeling.dae.dae.NameCollisionException;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Turns a root class and everything it inherits or instantiates into one flat
 * class.
 *
 * <p>
 * Two passes per class:
 * <ol>
 * <li><b>Extends resolution</b>: bases are resolved transitively, in clause
 * order, and their components and sections merged into the derived class.
 * Name clashes are settled by the configured {@link ExtendsPolicy}.</li>
 * <li><b>Instance expansion</b>: every component whose type is a class in the
 * table is itself flattened, its equations scope-pushed under the instance
 * name, its components inserted as {@code instance_sub} at the instance's
 * position. Dotted references into expanded instances are then collapsed to
 * the same underscore form.</li>
 * </ol>
 *
 * <p>
 * Both passes keep their own resolution path, so {@code A extends B extends A}
 * and a class that contains an instance of itself fail with
 * {@link CyclicExtendsException} instead of recursing forever.
 *
 * <p>
 * The class table is never modified. A {@code Flattener} holds only
 * configuration and may be shared across threads; each {@link #flatten} call
 * works on its own memo tables.
 */
@Log4j2
public final class Flattener {
    private final ReservedIdentifiers reserved;
    private final ExtendsPolicy extendsPolicy;

    public Flattener() {
        this(ReservedIdentifiers.DEFAULT, ExtendsPolicy.FIRST_WINS);
    }

    public Flattener(ReservedIdentifiers reserved, ExtendsPolicy extendsPolicy) {
        this.reserved = Objects.requireNonNull(reserved, "reserved");
        this.extendsPolicy = Objects.requireNonNull(extendsPolicy, "extendsPolicy");
    }

    public ReservedIdentifiers reserved() {
        return reserved;
    }

    public ExtendsPolicy extendsPolicy() {
        return extendsPolicy;
    }

    /**
     * Flattens {@code rootName}. A null root selects the first class of the
     * table.
     *
     * @throws MainClassNotFoundException if the root name is blank or the table
     *                                    is empty
     * @throws UnknownClassException      if the root is not in the table
     * @throws BaseClassNotFoundException if an extends target is missing
     * @throws CyclicExtendsException     on inheritance or instantiation loops
     * @throws NameCollisionException     if an expanded name is already taken
     */
    public ClassDefinition flatten(Map<String, ClassDefinition> classTable, String rootName) {
        String root = rootName;
        if (root == null) {
            if (classTable.isEmpty())
                throw new MainClassNotFoundException(null);
            root = classTable.keySet().iterator().next();
        }
        if (root.isBlank())
            throw new MainClassNotFoundException(root);
        if (!classTable.containsKey(root))
            throw new UnknownClassException(root);

        ClassDefinition flat = new Session(classTable).flattenClass(root, new ArrayDeque<>());
        log.debug("Flattened {}: {} components, {} equations", root, flat.getComponents().size(),
                flat.getEquations().size());
        return flat;
    }

    private final class Session {
        private final Map<String, ClassDefinition> table;
        private final Map<String, ClassDefinition> resolved = new HashMap<>();
        private final Map<String, ClassDefinition> flattened = new HashMap<>();

        Session(Map<String, ClassDefinition> table) {
            this.table = table;
        }

        boolean isInstance(Component c) {
            return !c.isPrimitive() && table.containsKey(c.typeName());
        }

        ClassDefinition flattenClass(String name, Deque<String> path) {
            ClassDefinition done = flattened.get(name);
            if (done != null)
                return done;
            checkCycle(name, path, true);

            path.addLast(name);
            try {
                ClassDefinition merged = resolveExtends(name, null, new ArrayDeque<>());
                ClassDefinition flat = expandInstances(merged, path);
                flattened.put(name, flat);
                return flat;
            } finally {
                path.removeLast();
            }
        }

        /**
         * Merges all ancestors of {@code name} into it; instances stay unexpanded.
         * Ancestors are visited depth-first in clause order and each one is merged
         * once, so a base reached along two paths contributes its sections once.
         */
        ClassDefinition resolveExtends(String name, String extender, Deque<String> path) {
            ClassDefinition done = resolved.get(name);
            if (done != null)
                return done;
            checkCycle(name, path, false);

            ClassDefinition def = lookup(name, extender);
            if (def.getExtendsClauses().isEmpty()) {
                resolved.put(name, def);
                return def;
            }

            List<ClassDefinition> ancestors = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            seen.add(name);
            path.addLast(name);
            try {
                for (var ext : def.getExtendsClauses())
                    collectAncestors(ext.baseName(), name, path, seen, ancestors);
            } finally {
                path.removeLast();
            }

            ClassDefinition.Builder b = def.toBuilder().clearExtends();
            for (ClassDefinition base : ancestors) {
                for (Component c : base.getComponents().values()) {
                    if (!b.hasComponent(c.name()) || extendsPolicy == ExtendsPolicy.LAST_WINS)
                        b.putComponent(c);
                    else
                        log.debug("{}: inherited {} from {} shadowed by earlier declaration", name,
                                c.name(), base.getName());
                }
                for (Equation eq : base.getEquations())
                    b.addEquation(eq);
                for (Equation eq : base.getInitialEquations())
                    b.addInitialEquation(eq);
                for (List<Statement> block : base.getAlgorithms())
                    b.addAlgorithm(block);
                for (List<Statement> block : base.getInitialAlgorithms())
                    b.addInitialAlgorithm(block);
            }
            ClassDefinition merged = b.build();
            resolved.put(name, merged);
            return merged;
        }

        private void collectAncestors(String name, String extender, Deque<String> path, Set<String> seen,
                List<ClassDefinition> out) {
            checkCycle(name, path, false);
            if (!seen.add(name)) {
                log.debug("{}: base {} already inherited through another clause", extender, name);
                return;
            }
            ClassDefinition def = lookup(name, extender);
            out.add(def);
            path.addLast(name);
            try {
                for (var ext : def.getExtendsClauses())
                    collectAncestors(ext.baseName(), name, path, seen, out);
            } finally {
                path.removeLast();
            }
        }

        private ClassDefinition lookup(String name, String extender) {
            ClassDefinition def = table.get(name);
            if (def == null) {
                if (extender == null)
                    throw new UnknownClassException(name);
                throw new BaseClassNotFoundException(name, extender);
            }
            return def;
        }

        ClassDefinition expandInstances(ClassDefinition merged, Deque<String> path) {
            boolean any = false;
            for (Component c : merged.getComponents().values())
                any |= isInstance(c);
            if (!any)
                return merged;

            ClassDefinition.Builder b = merged.toBuilder().clearComponents();
            List<Equation> equations = new ArrayList<>(merged.getEquations());
            List<Equation> initialEquations = new ArrayList<>(merged.getInitialEquations());
            List<List<Statement>> algorithms = new ArrayList<>(merged.getAlgorithms());
            List<List<Statement>> initialAlgorithms = new ArrayList<>(merged.getInitialAlgorithms());
            Set<String> expanded = new LinkedHashSet<>();

            for (Component c : merged.getComponents().values()) {
                if (!isInstance(c)) {
                    putUnique(b, c, merged.getName());
                    continue;
                }
                ClassDefinition sub = flattenClass(c.typeName(), path);
                ScopePusher pusher = new ScopePusher(c.name(), reserved);
                for (Component sc : sub.getComponents().values())
                    putUnique(b, pusher.apply(sc).withName(c.name() + "_" + sc.name()), merged.getName());
                equations.addAll(pusher.applyAll(sub.getEquations()));
                initialEquations.addAll(pusher.applyAll(sub.getInitialEquations()));
                for (List<Statement> block : sub.getAlgorithms())
                    algorithms.add(block.stream().map(pusher::apply).toList());
                for (List<Statement> block : sub.getInitialAlgorithms())
                    initialAlgorithms.add(block.stream().map(pusher::apply).toList());
                expanded.add(c.name());
                log.debug("{}: expanded instance {} of {} ({} components)", merged.getName(), c.name(),
                        c.typeName(), sub.getComponents().size());
            }

            ClassDefinition withInstances = b.equations(equations)
                    .initialEquations(initialEquations)
                    .algorithms(algorithms)
                    .initialAlgorithms(initialAlgorithms)
                    .build();
            return new SubComponentNamer(expanded).apply(withInstances);
        }

        private void putUnique(ClassDefinition.Builder b, Component c, String className) {
            if (b.hasComponent(c.name()))
                throw new NameCollisionException(c.name(), className);
            b.putComponent(c);
        }

        private void checkCycle(String name, Deque<String> path, boolean instance) {
            if (!path.contains(name))
                return;
            List<String> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (String p : path) {
                if (p.equals(name))
                    inCycle = true;
                if (inCycle)
                    cycle.add(p);
            }
            cycle.add(name);
            throw new CyclicExtendsException(cycle, instance);
        }
    }
}
