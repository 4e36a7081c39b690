package com.vidnyan.swivel.domain.framework;

/**
 * What a catalogue entry does in a component tree.
 */
public enum ComponentRole {
    /** Takes user input; needs an identifier so tests and tools can find it. */
    INTERACTIVE,
    /** Holds other components; needs an identifier. */
    CONTAINER,
    /** Read-only display. */
    DISPLAY,
    /** Top-level window. */
    WINDOW,
    MENU,
    /** Layout manager handed to {@code setLayout}. */
    LAYOUT;

    public boolean requiresIdentifier() {
        return this == INTERACTIVE || this == CONTAINER;
    }
}
