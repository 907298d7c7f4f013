package com.minisql.storage;

import com.minisql.storage.memory.MemoryStorageEngine;

/**
 * StorageEngineFactory - 存储引擎工厂
 *
 * 采用工厂模式+策略模式,根据引擎类型创建存储引擎实例。
 *
 * 设计原则:
 * - "Good taste": 简单的工厂方法,没有复杂的依赖注入
 * - 策略模式: 通过EngineType枚举选择引擎实现
 * - 单一职责: 只负责创建引擎实例,不管理生命周期
 *
 * 使用示例:
 * <pre>
 * StorageEngine&lt;?&gt; engine = StorageEngineFactory.createEngine(EngineType.MEMORY);
 * </pre>
 */
public class StorageEngineFactory {

    /**
     * 存储引擎类型枚举
     */
    public enum EngineType {
        /**
         * Memory存储引擎(默认)
         *
         * 特点:
         * - 数据存储在内存中
         * - 重启后数据丢失
         * - 扫描时快照Key,支持迭代期间修改
         */
        MEMORY("Memory", "内存存储引擎,数据存在内存中");

        private final String name;
        private final String description;

        EngineType(String name, String description) {
            this.name = name;
            this.description = description;
        }

        public String getName() {
            return name;
        }

        public String getDescription() {
            return description;
        }
    }

    private StorageEngineFactory() {
    }

    /**
     * 创建存储引擎
     *
     * @param engineType 引擎类型
     * @return 存储引擎实例
     * @throws IllegalArgumentException 引擎类型为null
     */
    public static StorageEngine<?> createEngine(EngineType engineType) {
        if (engineType == null) {
            throw new IllegalArgumentException("Engine type cannot be null");
        }

        switch (engineType) {
            case MEMORY:
                return new MemoryStorageEngine();

            default:
                throw new IllegalArgumentException(
                        "Unsupported engine type: " + engineType
                );
        }
    }

    /**
     * 创建默认存储引擎(Memory)
     */
    public static StorageEngine<?> createDefaultEngine() {
        return createEngine(EngineType.MEMORY);
    }
}
