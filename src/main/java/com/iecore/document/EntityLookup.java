package com.iecore.document;

import java.util.Optional;

/**
 * 按 key 解析实体的外部查询接口。
 */
@FunctionalInterface
public interface EntityLookup {

    Optional<Entity> findByKey(String key);
}
