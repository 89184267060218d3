package com.reclint.core.model;

/**
 * One {@code exclude_files} entry: {@code {filter, keyword}}.
 *
 * @since 1.0.0
 */
public class ExcludeDefinition {

    private String filter;
    private String keyword;

    public String getFilter() {
        return filter;
    }

    public void setFilter(String filter) {
        this.filter = filter;
    }

    public String getKeyword() {
        return keyword;
    }

    public void setKeyword(String keyword) {
        this.keyword = keyword;
    }

    @Override
    public String toString() {
        return "ExcludeDefinition{filter='" + filter + "', keyword='" + keyword + "'}";
    }
}
