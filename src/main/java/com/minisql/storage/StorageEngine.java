package com.minisql.storage;

import com.minisql.data.Row;
import com.minisql.data.Schema;

import java.util.Iterator;
import java.util.Optional;

/**
 * StorageEngine - 存储引擎接口
 *
 * 定义执行器依赖的存储层操作,所有存储引擎必须实现此接口。
 * 采用策略模式,执行器只面向接口,不关心数据存在内存、文件还是网络另一端。
 *
 * Key类型由引擎决定:
 * - 执行器从不构造或解析Key,只通过generateId()申请,再原样传回setData()/deleteData()
 * - 同一张表生成的Key两两不同
 * - Key在对应行被删除或表被删除之前一直有效
 *
 * 迭代期间修改(scanData契约):
 * UPDATE/DELETE在scanData()返回的迭代器仍在使用时,对当前行执行setData()/deleteData()。
 * 实现必须保证:
 * - 修改或删除当前行不会破坏、跳过其他行
 * - 已经返回过的行不会再次返回(包括被改写的行)
 * - 迭代到达之前已被删除的行不会返回
 * 做法可以是先快照Key列表再逐个读取,也可以是引擎自身的稳定迭代器。
 *
 * 并发与事务:
 * 执行器不加锁,也不包裹事务。每次写入/删除独立生效,并发控制完全由引擎负责。
 *
 * 错误:
 * 所有失败抛出StorageException(或其子类),执行器原样向上传播。
 *
 * @param <K> 引擎自定义的行Key类型
 */
public interface StorageEngine<K> {

    /**
     * 保存表结构
     *
     * @param schema 表结构
     * @throws StorageException 引擎拒绝(例如表已存在,由引擎决定)
     */
    void setSchema(Schema schema);

    /**
     * 获取表结构
     *
     * @param tableName 表名
     * @return 表结构
     * @throws StorageException 表不存在
     */
    Schema getSchema(String tableName);

    /**
     * 删除表结构及其所有行
     *
     * @param tableName 表名
     * @throws StorageException 表不存在(由引擎决定)
     */
    void deleteSchema(String tableName);

    /**
     * 为表生成新的行Key
     *
     * @param tableName 表名
     * @return 在该表内唯一的Key
     * @throws StorageException 表不存在
     */
    K generateId(String tableName);

    /**
     * 在Key处写入一行(插入或覆盖)
     *
     * @param key 行Key
     * @param row 行数据
     * @return 实际保存的行(引擎可以规范化值)
     * @throws StorageException 写入失败
     */
    Row setData(K key, Row row);

    /**
     * 删除Key处的行
     *
     * @param key 行Key
     * @throws StorageException 删除失败
     */
    void deleteData(K key);

    /**
     * 按Key读取一行
     *
     * @param key 行Key
     * @return 行数据,不存在返回empty
     */
    Optional<Row> getData(K key);

    /**
     * 扫描表中所有行
     *
     * 返回的迭代器是惰性的、有限的、不可重启的,必须满足接口文档中的迭代期间修改契约。
     *
     * @param tableName 表名
     * @return (Key, Row)迭代器
     * @throws StorageException 表不存在
     */
    Iterator<KeyedRow<K>> scanData(String tableName);
}
