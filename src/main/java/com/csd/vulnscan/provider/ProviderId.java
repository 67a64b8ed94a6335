package com.csd.vulnscan.provider;

/**
 * The fixed set of supported ecosystems, in detection priority order.
 */
public enum ProviderId {
    NODE("node", "Node.js (npm/pnpm/yarn)"),
    GO("go", "Go (modules)"),
    PYTHON_POETRY("python-poetry", "Python (Poetry)"),
    PYTHON_PIP("python-pip", "Python (pip)");

    private final String id;
    private final String displayName;

    ProviderId(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }
}
