package com.iecore.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.iecore.document.EntityOccurrence;
import com.iecore.document.IeDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 文档持久化表，列表与映射字段以 JSON 文本存储。
 */
public final class DocumentTable implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(DocumentTable.class);

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS documents (
                doc_id              INTEGER PRIMARY KEY AUTOINCREMENT,
                human_identifier    TEXT UNIQUE NOT NULL,
                title               TEXT,
                url                 TEXT,
                text                TEXT,
                creation_date       TEXT NOT NULL,
                metadata            TEXT NOT NULL,
                preprocess_metadata TEXT NOT NULL,
                tokens              TEXT NOT NULL,
                offsets             TEXT NOT NULL,
                postags             TEXT NOT NULL,
                sentences           TEXT NOT NULL,
                entities            TEXT NOT NULL
            )
            """;

    private static final String ENABLE_WAL_SQL = "PRAGMA journal_mode=WAL";

    private static final String SELECT_COLUMNS = """
            SELECT human_identifier, title, url, text, creation_date, metadata, preprocess_metadata,
                   tokens, offsets, postags, sentences, entities
            FROM documents
            """;

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<Integer>> INT_LIST = new TypeReference<>() {
    };
    private static final TypeReference<List<EntityOccurrence>> OCCURRENCE_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> METADATA_MAP = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Instant>> PREPROCESS_MAP = new TypeReference<>() {
    };

    private final Connection connection;

    /**
     * 初始化文档表并启用 WAL。
     */
    public DocumentTable(Path dbPath) {
        try {
            this.connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath.toAbsolutePath());
            initializeSchema();
            logger.info("文档表已打开: {}", dbPath);
        } catch (SQLException sqlException) {
            throw new IllegalStateException("初始化文档表失败: " + dbPath, sqlException);
        }
    }

    /**
     * 保存文档，humanIdentifier 已存在时整体覆盖。
     */
    public void save(IeDocument document) {
        String sql = """
                INSERT INTO documents (
                    human_identifier, title, url, text, creation_date, metadata, preprocess_metadata,
                    tokens, offsets, postags, sentences, entities
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT(human_identifier) DO UPDATE SET
                    title = excluded.title,
                    url = excluded.url,
                    text = excluded.text,
                    creation_date = excluded.creation_date,
                    metadata = excluded.metadata,
                    preprocess_metadata = excluded.preprocess_metadata,
                    tokens = excluded.tokens,
                    offsets = excluded.offsets,
                    postags = excluded.postags,
                    sentences = excluded.sentences,
                    entities = excluded.entities
                """;
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setString(1, document.getHumanIdentifier());
            preparedStatement.setString(2, document.getTitle());
            preparedStatement.setString(3, document.getUrl());
            preparedStatement.setString(4, document.getText());
            preparedStatement.setString(5, document.getCreationDate().toString());
            preparedStatement.setString(6, JsonCodec.toJson(document.getMetadata()));
            preparedStatement.setString(7, JsonCodec.toJson(document.getPreprocessMetadata()));
            preparedStatement.setString(8, JsonCodec.toJson(document.getTokens()));
            preparedStatement.setString(9, JsonCodec.toJson(document.getOffsets()));
            preparedStatement.setString(10, JsonCodec.toJson(document.getPostags()));
            preparedStatement.setString(11, JsonCodec.toJson(document.getSentences()));
            preparedStatement.setString(12, JsonCodec.toJson(document.getEntities()));
            preparedStatement.executeUpdate();
            logger.debug("文档已保存: {}", document.getHumanIdentifier());
        } catch (SQLException sqlException) {
            throw new IllegalStateException("保存文档失败, id=" + document.getHumanIdentifier(), sqlException);
        }
    }

    /**
     * 按 humanIdentifier 查找文档。
     */
    public Optional<IeDocument> findByIdentifier(String humanIdentifier) {
        String sql = SELECT_COLUMNS + " WHERE human_identifier = ?";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setString(1, humanIdentifier);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(readDocument(resultSet));
            }
        } catch (SQLException sqlException) {
            throw new IllegalStateException("查询文档失败, id=" + humanIdentifier, sqlException);
        }
    }

    /**
     * 按写入顺序列出全部文档标识。
     */
    public List<String> listIdentifiers() {
        String sql = "SELECT human_identifier FROM documents ORDER BY doc_id";
        List<String> identifiers = new ArrayList<>();
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            while (resultSet.next()) {
                identifiers.add(resultSet.getString(1));
            }
            return identifiers;
        } catch (SQLException sqlException) {
            throw new IllegalStateException("列出文档标识失败", sqlException);
        }
    }

    /**
     * 删除文档，返回是否确有删除。
     */
    public boolean deleteByIdentifier(String humanIdentifier) {
        String sql = "DELETE FROM documents WHERE human_identifier = ?";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setString(1, humanIdentifier);
            return preparedStatement.executeUpdate() > 0;
        } catch (SQLException sqlException) {
            throw new IllegalStateException("删除文档失败, id=" + humanIdentifier, sqlException);
        }
    }

    public int count() {
        String sql = "SELECT COUNT(*) FROM documents";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            return resultSet.getInt(1);
        } catch (SQLException sqlException) {
            throw new IllegalStateException("查询文档总数失败", sqlException);
        }
    }

    /**
     * 关闭数据库连接。
     */
    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("关闭数据库连接失败", sqlException);
        }
    }

    private void initializeSchema() throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute(ENABLE_WAL_SQL);
            statement.execute(CREATE_TABLE_SQL);
        }
    }

    private IeDocument readDocument(ResultSet resultSet) throws SQLException {
        IeDocument document = new IeDocument(
            resultSet.getString("human_identifier"),
            resultSet.getString("text"),
            Instant.parse(resultSet.getString("creation_date"))
        );
        document.setTitle(resultSet.getString("title"));
        document.setUrl(resultSet.getString("url"));
        JsonCodec.fromJson(resultSet.getString("metadata"), METADATA_MAP).forEach(document::putMetadata);
        document.setTokens(JsonCodec.fromJson(resultSet.getString("tokens"), STRING_LIST));
        document.setOffsets(JsonCodec.fromJson(resultSet.getString("offsets"), INT_LIST));
        document.setPostags(JsonCodec.fromJson(resultSet.getString("postags"), STRING_LIST));
        document.setSentences(JsonCodec.fromJson(resultSet.getString("sentences"), INT_LIST));
        document.setEntities(JsonCodec.fromJson(resultSet.getString("entities"), OCCURRENCE_LIST));
        JsonCodec.fromJson(resultSet.getString("preprocess_metadata"), PREPROCESS_MAP)
            .forEach(document::markPreprocessDone);
        return document;
    }
}
