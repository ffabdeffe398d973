package com.modeling.dae.dae;

import com.modeling.dae.ast.Component;
import com.modeling.dae.ast.Equation;
import com.modeling.dae.ast.Expression;
import com.modeling.dae.ast.Statement;

import java.util.*;

import lombok.Getter;
import lombok.Setter;

/**
 * Assembled differential-algebraic system.
 *
 * <p>
 * Variable buckets, all keyed by flat name in declaration order:
 * <ul>
 * <li>{@code p} parameters, {@code cp} constants</li>
 * <li>{@code x} states, with {@code xDot} holding their {@code der_} companions</li>
 * <li>{@code y} algebraic variables</li>
 * <li>{@code z} discrete reals, {@code m} other discrete variables</li>
 * <li>{@code u} inputs</li>
 * <li>{@code preX}, {@code preZ}, {@code preM} the {@code pre_} companions of
 * {@code x}, {@code z} and {@code m}</li>
 * </ul>
 * Equations: {@code fx} continuous, {@code fz}/{@code fm} discrete updates,
 * {@code fc} when-conditions by generated name, {@code fr} reinit statements by
 * condition name.
 *
 * <p>
 * Contents are fixed at construction; only the metadata stamped by the driver
 * ({@link #getModelHash()}, {@link #getVersion()}) can change afterwards.
 */
@Getter
public final class Dae {
    private final String name;
    private final Component t;
    private final Map<String, Component> p, cp, x, xDot, y, z, m, u, preX, preZ, preM;
    private final List<Equation> fx, fz, fm;
    private final Map<String, Expression> fc;
    private final Map<String, List<Statement>> fr;

    @Setter
    private String modelHash = "";
    @Setter
    private String version = "";

    private Dae(Builder b) {
        this.name = b.name;
        this.t = b.t;
        this.p = freeze(b.p);
        this.cp = freeze(b.cp);
        this.x = freeze(b.x);
        this.xDot = freeze(b.xDot);
        this.y = freeze(b.y);
        this.z = freeze(b.z);
        this.m = freeze(b.m);
        this.u = freeze(b.u);
        this.preX = freeze(b.preX);
        this.preZ = freeze(b.preZ);
        this.preM = freeze(b.preM);
        this.fx = List.copyOf(b.fx);
        this.fz = List.copyOf(b.fz);
        this.fm = List.copyOf(b.fm);
        this.fc = Collections.unmodifiableMap(new LinkedHashMap<>(b.fc));
        Map<String, List<Statement>> frCopy = new LinkedHashMap<>();
        b.fr.forEach((k, v) -> frCopy.put(k, List.copyOf(v)));
        this.fr = Collections.unmodifiableMap(frCopy);
        this.modelHash = b.modelHash;
        this.version = b.version;
    }

    private static <V> Map<String, V> freeze(Map<String, V> src) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(src));
    }

    /** Number of unknowns the continuous equations must determine: x + y + z + m. */
    public int unknownCount() {
        return x.size() + y.size() + z.size() + m.size();
    }

    /** Copy with a different continuous equation list, e.g. after ordering. */
    public Dae withFx(List<Equation> newFx) {
        Builder b = toBuilder();
        b.fx.clear();
        b.fx.addAll(newFx);
        return b.build();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Builder toBuilder() {
        Builder b = new Builder(name);
        b.t = t;
        b.p.putAll(p);
        b.cp.putAll(cp);
        b.x.putAll(x);
        b.xDot.putAll(xDot);
        b.y.putAll(y);
        b.z.putAll(z);
        b.m.putAll(m);
        b.u.putAll(u);
        b.preX.putAll(preX);
        b.preZ.putAll(preZ);
        b.preM.putAll(preM);
        b.fx.addAll(fx);
        b.fz.addAll(fz);
        b.fm.addAll(fm);
        b.fc.putAll(fc);
        fr.forEach((k, v) -> b.fr.put(k, new ArrayList<>(v)));
        b.modelHash = modelHash;
        b.version = version;
        return b;
    }

    /** Mutable staging area; every bucket is exposed directly for the assembler. */
    public static final class Builder {
        private final String name;
        private Component t = Component.builder("t", "Real").description("time").build();
        final Map<String, Component> p = new LinkedHashMap<>(), cp = new LinkedHashMap<>(),
                x = new LinkedHashMap<>(), xDot = new LinkedHashMap<>(), y = new LinkedHashMap<>(),
                z = new LinkedHashMap<>(), m = new LinkedHashMap<>(), u = new LinkedHashMap<>(),
                preX = new LinkedHashMap<>(), preZ = new LinkedHashMap<>(), preM = new LinkedHashMap<>();
        final List<Equation> fx = new ArrayList<>(), fz = new ArrayList<>(), fm = new ArrayList<>();
        final Map<String, Expression> fc = new LinkedHashMap<>();
        final Map<String, List<Statement>> fr = new LinkedHashMap<>();
        private String modelHash = "";
        private String version = "";

        private Builder(String name) {
            this.name = name;
        }

        public Builder time(Component time) {
            this.t = time;
            return this;
        }

        public Builder parameter(Component c) {
            p.put(c.name(), c);
            return this;
        }

        public Builder constant(Component c) {
            cp.put(c.name(), c);
            return this;
        }

        /** Adds a state together with its {@code der_} and {@code pre_} companions. */
        public Builder state(Component c) {
            x.put(c.name(), c);
            Component d = c.withName("der_" + c.name());
            xDot.put(d.name(), d);
            Component pre = c.withName("pre_" + c.name());
            preX.put(pre.name(), pre);
            return this;
        }

        public Builder algebraic(Component c) {
            y.put(c.name(), c);
            return this;
        }

        public Builder discreteReal(Component c) {
            z.put(c.name(), c);
            Component pre = c.withName("pre_" + c.name());
            preZ.put(pre.name(), pre);
            return this;
        }

        public Builder discrete(Component c) {
            m.put(c.name(), c);
            Component pre = c.withName("pre_" + c.name());
            preM.put(pre.name(), pre);
            return this;
        }

        public Builder input(Component c) {
            u.put(c.name(), c);
            return this;
        }

        public Builder continuousEquation(Equation eq) {
            fx.add(eq);
            return this;
        }

        public Builder discreteRealEquation(Equation eq) {
            fz.add(eq);
            return this;
        }

        public Builder discreteEquation(Equation eq) {
            fm.add(eq);
            return this;
        }

        public Builder condition(String conditionName, Expression condition) {
            fc.put(conditionName, condition);
            return this;
        }

        public Builder reset(String conditionName, Statement statement) {
            fr.computeIfAbsent(conditionName, k -> new ArrayList<>()).add(statement);
            return this;
        }

        public boolean isDiscreteReal(String variable) {
            return z.containsKey(variable);
        }

        public Dae build() {
            return new Dae(this);
        }
    }
}
