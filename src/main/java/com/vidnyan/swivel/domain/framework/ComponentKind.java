package com.vidnyan.swivel.domain.framework;

/**
 * One permitted entry of the framework catalogue.
 */
public record ComponentKind(String simpleName, String packageName, ComponentRole role) {

    public String qualifiedName() {
        return packageName + "." + simpleName;
    }

    public boolean requiresIdentifier() {
        return role.requiresIdentifier();
    }

    public boolean isLayout() {
        return role == ComponentRole.LAYOUT;
    }
}
