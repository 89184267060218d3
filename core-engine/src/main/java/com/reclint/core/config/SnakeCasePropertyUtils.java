package com.reclint.core.config;

import org.yaml.snakeyaml.introspector.Property;
import org.yaml.snakeyaml.introspector.PropertyUtils;

/**
 * Maps snake_case YAML keys ({@code include_exts}) onto camelCase bean
 * properties ({@code includeExts}). Unknown keys still fail.
 *
 * @since 1.0.0
 */
class SnakeCasePropertyUtils extends PropertyUtils {

    @Override
    public Property getProperty(Class<? extends Object> type, String name) {
        return super.getProperty(type, toCamelCase(name));
    }

    static String toCamelCase(String name) {
        if (name.indexOf('_') < 0) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name.length());
        boolean upper = false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '_') {
                upper = sb.length() > 0;
            } else if (upper) {
                sb.append(Character.toUpperCase(c));
                upper = false;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
