package com.reclint.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw content of the root marker file.
 *
 * <pre>
 * include_extensions: [".java", ".kt"]
 * exclude_dirs: [build, node_modules]
 * </pre>
 *
 * @since 1.0.0
 */
public class RootConfigDefinition {

    private List<String> includeExtensions = new ArrayList<>();
    private List<String> excludeDirs = new ArrayList<>();

    public List<String> getIncludeExtensions() {
        return includeExtensions;
    }

    public void setIncludeExtensions(List<String> includeExtensions) {
        this.includeExtensions = includeExtensions != null ? new ArrayList<>(includeExtensions) : new ArrayList<>();
    }

    public List<String> getExcludeDirs() {
        return excludeDirs;
    }

    public void setExcludeDirs(List<String> excludeDirs) {
        this.excludeDirs = excludeDirs != null ? new ArrayList<>(excludeDirs) : new ArrayList<>();
    }
}
