package com.iecore.store;

import com.iecore.document.Entity;
import com.iecore.document.EntityKind;
import com.iecore.document.EntityLookup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Optional;

/**
 * 实体表，entity_key 唯一。
 */
public final class EntityTable implements EntityLookup, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EntityTable.class);

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS entities (
                entity_key     TEXT PRIMARY KEY,
                canonical_form TEXT NOT NULL,
                kind           TEXT NOT NULL
            )
            """;

    private static final String ENABLE_WAL_SQL = "PRAGMA journal_mode=WAL";

    private static final String UPSERT_SQL = """
            INSERT INTO entities (entity_key, canonical_form, kind) VALUES (?, ?, ?)
            ON CONFLICT(entity_key) DO UPDATE SET
                canonical_form = excluded.canonical_form,
                kind = excluded.kind
            """;

    private final Connection connection;

    public EntityTable(Path dbPath) {
        try {
            this.connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath.toAbsolutePath());
            try (Statement statement = connection.createStatement()) {
                statement.execute(ENABLE_WAL_SQL);
                statement.execute(CREATE_TABLE_SQL);
            }
            logger.info("实体表已打开: {}", dbPath);
        } catch (SQLException sqlException) {
            throw new IllegalStateException("初始化实体表失败: " + dbPath, sqlException);
        }
    }

    /**
     * 插入新实体。
     *
     * @throws IllegalStateException key 已存在或写入失败
     */
    public void insert(Entity entity) {
        if (findByKey(entity.key()).isPresent()) {
            throw new IllegalStateException("实体key已存在: " + entity.key());
        }
        String sql = "INSERT INTO entities (entity_key, canonical_form, kind) VALUES (?, ?, ?)";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            bindEntity(preparedStatement, entity);
            preparedStatement.executeUpdate();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("插入实体失败, key=" + entity.key(), sqlException);
        }
    }

    /**
     * 插入或更新实体。
     */
    public void upsert(Entity entity) {
        try (PreparedStatement preparedStatement = connection.prepareStatement(UPSERT_SQL)) {
            bindEntity(preparedStatement, entity);
            preparedStatement.executeUpdate();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("写入实体失败, key=" + entity.key(), sqlException);
        }
    }

    /**
     * 在同一事务内批量插入或更新实体，任一条失败则全部回滚。
     */
    public void upsertAll(List<Entity> entities) {
        try (PreparedStatement preparedStatement = connection.prepareStatement(UPSERT_SQL)) {
            connection.setAutoCommit(false);
            for (Entity entity : entities) {
                bindEntity(preparedStatement, entity);
                preparedStatement.executeUpdate();
            }
            connection.commit();
            connection.setAutoCommit(true);
        } catch (SQLException sqlException) {
            rollbackQuietly();
            restoreAutoCommitQuietly();
            throw new IllegalStateException("批量写入实体失败, size=" + entities.size(), sqlException);
        }
    }

    @Override
    public Optional<Entity> findByKey(String key) {
        String sql = "SELECT entity_key, canonical_form, kind FROM entities WHERE entity_key = ?";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setString(1, key);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(new Entity(
                    resultSet.getString("entity_key"),
                    resultSet.getString("canonical_form"),
                    EntityKind.fromCode(resultSet.getString("kind"))
                ));
            }
        } catch (SQLException sqlException) {
            throw new IllegalStateException("查询实体失败, key=" + key, sqlException);
        }
    }

    public int count() {
        try (PreparedStatement preparedStatement = connection.prepareStatement("SELECT COUNT(*) FROM entities");
             ResultSet resultSet = preparedStatement.executeQuery()) {
            return resultSet.getInt(1);
        } catch (SQLException sqlException) {
            throw new IllegalStateException("查询实体总数失败", sqlException);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("关闭数据库连接失败", sqlException);
        }
    }

    private void rollbackQuietly() {
        try {
            connection.rollback();
        } catch (SQLException sqlException) {
            logger.warn("实体表回滚失败", sqlException);
        }
    }

    private void restoreAutoCommitQuietly() {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException sqlException) {
            logger.warn("恢复自动提交失败", sqlException);
        }
    }

    private void bindEntity(PreparedStatement preparedStatement, Entity entity) throws SQLException {
        preparedStatement.setString(1, entity.key());
        preparedStatement.setString(2, entity.canonicalForm());
        preparedStatement.setString(3, entity.kind().code());
    }
}
