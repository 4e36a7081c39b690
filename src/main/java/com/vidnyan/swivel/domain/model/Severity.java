package com.vidnyan.swivel.domain.model;

/**
 * Finding severity. Only {@link #ERROR} findings make a result fail.
 */
public enum Severity {
    ERROR,
    WARNING;

    public String jsonValue() {
        return name().toLowerCase();
    }
}
