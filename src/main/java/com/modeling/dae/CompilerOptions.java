package com.modeling.dae;

import com.modeling.dae.balance.ForCountingPolicy;
import com.modeling.dae.flatten.ExtendsPolicy;
import com.modeling.dae.flatten.ReservedIdentifiers;

import lombok.Getter;

/**
 * Immutable pipeline configuration.
 *
 * <p>
 * Defaults: builtin reserved identifiers, first declaration wins on extends
 * clashes, for-bodies counted once, all discrete variables in {@code m}, implicit equations matched, derivative
 * coefficients normalized, equations ordered, one worker per available core.
 */
@Getter
public final class CompilerOptions {
    public static final CompilerOptions DEFAULT = builder().build();

    private final ReservedIdentifiers reservedIdentifiers;
    private final ExtendsPolicy extendsPolicy;
    private final ForCountingPolicy forCountingPolicy;
    private final boolean discreteRealsInZ;
    private final boolean matchImplicitEquations;
    private final boolean normalizeDerivativeCoefficients;
    private final boolean orderEquations;
    private final int workers;
    private final int ringBufferSize;

    private CompilerOptions(Builder b) {
        this.reservedIdentifiers = b.reservedIdentifiers;
        this.extendsPolicy = b.extendsPolicy;
        this.forCountingPolicy = b.forCountingPolicy;
        this.discreteRealsInZ = b.discreteRealsInZ;
        this.matchImplicitEquations = b.matchImplicitEquations;
        this.normalizeDerivativeCoefficients = b.normalizeDerivativeCoefficients;
        this.orderEquations = b.orderEquations;
        this.workers = b.workers;
        this.ringBufferSize = b.ringBufferSize;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ReservedIdentifiers reservedIdentifiers = ReservedIdentifiers.DEFAULT;
        private ExtendsPolicy extendsPolicy = ExtendsPolicy.FIRST_WINS;
        private ForCountingPolicy forCountingPolicy = ForCountingPolicy.BODY_ONCE;
        private boolean discreteRealsInZ = false;
        private boolean matchImplicitEquations = true;
        private boolean normalizeDerivativeCoefficients = true;
        private boolean orderEquations = true;
        private int workers = Math.max(1, Runtime.getRuntime().availableProcessors());
        private int ringBufferSize = 1024;

        public Builder reservedIdentifiers(ReservedIdentifiers r) {
            this.reservedIdentifiers = r;
            return this;
        }

        public Builder extendsPolicy(ExtendsPolicy p) {
            this.extendsPolicy = p;
            return this;
        }

        public Builder forCountingPolicy(ForCountingPolicy p) {
            this.forCountingPolicy = p;
            return this;
        }

        /** Puts discrete {@code Real} variables in {@code z} instead of {@code m}. */
        public Builder discreteRealsInZ(boolean b) {
            this.discreteRealsInZ = b;
            return this;
        }

        public Builder matchImplicitEquations(boolean b) {
            this.matchImplicitEquations = b;
            return this;
        }

        public Builder normalizeDerivativeCoefficients(boolean b) {
            this.normalizeDerivativeCoefficients = b;
            return this;
        }

        public Builder orderEquations(boolean b) {
            this.orderEquations = b;
            return this;
        }

        public Builder workers(int n) {
            this.workers = n;
            return this;
        }

        /** Must be a power of two. */
        public Builder ringBufferSize(int n) {
            this.ringBufferSize = n;
            return this;
        }

        public CompilerOptions build() {
            if (reservedIdentifiers == null || extendsPolicy == null || forCountingPolicy == null)
                throw new IllegalArgumentException("Reserved identifiers and policies are required");
            if (workers < 1)
                throw new IllegalArgumentException("workers must be positive: " + workers);
            if (Integer.bitCount(ringBufferSize) != 1)
                throw new IllegalArgumentException("ringBufferSize must be a power of 2: " + ringBufferSize);
            return new CompilerOptions(this);
        }
    }
}
