package com.minisql.storage.memory;

import java.util.Objects;

/**
 * MemoryKey - 内存引擎的行Key: 表名 + 表内自增序号
 *
 * 序号只增不减,删除的行不会让序号被复用。
 * Key同时记录所属表的代号(generation),表被删除后即使重建同名表,旧Key也不再有效。
 */
public final class MemoryKey implements Comparable<MemoryKey> {

    private final String tableName;

    private final long generation;

    private final long id;

    MemoryKey(String tableName, long generation, long id) {
        this.tableName = tableName;
        this.generation = generation;
        this.id = id;
    }

    public String getTableName() {
        return tableName;
    }

    long getGeneration() {
        return generation;
    }

    public long getId() {
        return id;
    }

    @Override
    public int compareTo(MemoryKey other) {
        int cmp = tableName.compareTo(other.tableName);
        if (cmp == 0) {
            cmp = Long.compare(generation, other.generation);
        }
        return cmp != 0 ? cmp : Long.compare(id, other.id);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        MemoryKey key = (MemoryKey) obj;

        return id == key.id && generation == key.generation && tableName.equals(key.tableName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tableName, generation, id);
    }

    @Override
    public String toString() {
        return tableName + "#" + id;
    }
}
