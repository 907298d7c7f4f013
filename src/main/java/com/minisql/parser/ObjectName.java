package com.minisql.parser;

import java.util.Collections;
import java.util.List;

/**
 * ObjectName - 可能带限定前缀的对象名
 *
 * 例如 users, mydb.users。多段名字用List存储,消除特殊情况。
 */
public class ObjectName {

    private final List<String> parts;

    public ObjectName(List<String> parts) {
        this.parts = parts != null ? List.copyOf(parts) : List.of();
    }

    public static ObjectName of(String... parts) {
        return new ObjectName(List.of(parts));
    }

    public List<String> getParts() {
        return Collections.unmodifiableList(parts);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        return parts.equals(((ObjectName) obj).parts);
    }

    @Override
    public int hashCode() {
        return parts.hashCode();
    }

    @Override
    public String toString() {
        return String.join(".", parts);
    }
}
