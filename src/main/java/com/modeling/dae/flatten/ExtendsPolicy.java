package com.modeling.dae.flatten;

/** What happens when an inherited component name is already present. */
public enum ExtendsPolicy {
    /** Keep the declaration seen first: own declarations, then earlier extends clauses. */
    FIRST_WINS,
    /** Later extends clauses replace the earlier declaration in place. */
    LAST_WINS
}
