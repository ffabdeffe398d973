package com.modeling.dae.flatten;

/** No usable root class: blank name or empty class table. */
public class MainClassNotFoundException extends UnknownClassException {
    public MainClassNotFoundException(String requested) {
        super(requested, "Main class not found" + (requested == null || requested.isBlank() ? "" : ": " + requested));
    }
}
