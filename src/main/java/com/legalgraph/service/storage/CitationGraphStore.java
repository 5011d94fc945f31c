package com.legalgraph.service.storage;

import com.legalgraph.dto.graph.BuildCheckpoint;
import com.legalgraph.exception.GraphStoreException;
import com.legalgraph.util.RecordCodec;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * The five stores of one build directory, held in a single embedded H2
 * database ({@code graph.mv.db}). Each store is a two-column table keyed
 * by document id; values are JSON produced by {@link RecordCodec}.
 * <p>
 * One writer at a time. Several stores can be updated atomically through
 * {@link #inTransaction(Runnable)}.
 */
@Slf4j
public class CitationGraphStore implements AutoCloseable {

    public static final String DATABASE_NAME = "graph";
    public static final String DATABASE_FILE = DATABASE_NAME + ".mv.db";

    private static final String STATE_TABLE = "build_state";
    private static final String CHECKPOINT_KEY = "checkpoint";

    @Getter
    private final Path directory;

    private final SingleConnectionDataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final RecordCodec codec;

    private CitationGraphStore(Path directory, SingleConnectionDataSource dataSource, RecordCodec codec) {
        this.directory = directory;
        this.dataSource = dataSource;
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.codec = codec;
    }

    /**
     * Opens (creating when needed) the store in {@code directory}.
     */
    public static CitationGraphStore open(Path directory, RecordCodec codec) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new GraphStoreException("Cannot create store directory " + directory, e);
        }

        String url = "jdbc:h2:file:" + directory.resolve(DATABASE_NAME).toAbsolutePath()
                + ";DB_CLOSE_ON_EXIT=FALSE";
        SingleConnectionDataSource dataSource = new SingleConnectionDataSource(url, "sa", "", true);

        CitationGraphStore store = new CitationGraphStore(directory, dataSource, codec);
        try {
            store.createSchema();
        } catch (DataAccessException e) {
            dataSource.destroy();
            throw new GraphStoreException("Cannot open store at " + directory, e);
        }
        log.debug("Opened store | path={}", directory);
        return store;
    }

    public static boolean exists(Path directory) {
        return Files.isRegularFile(directory.resolve(DATABASE_FILE));
    }

    private void createSchema() {
        for (StoreName store : StoreName.values()) {
            jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + store.getTable()
                    + " (k VARCHAR(1024) PRIMARY KEY, v CLOB NOT NULL)");
        }
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + STATE_TABLE
                + " (k VARCHAR(64) PRIMARY KEY, v CLOB NOT NULL)");
    }

    // ============================================================
    // Writes
    // ============================================================

    public void put(StoreName store, String key, Object value) {
        execute(() -> jdbcTemplate.update(
                "MERGE INTO " + store.getTable() + " (k, v) KEY (k) VALUES (?, ?)",
                key, codec.encode(value)), "put " + store.getStoreName());
    }

    /**
     * Upserts every entry in key order.
     */
    public void putAll(StoreName store, Map<String, ?> values) {
        if (values.isEmpty()) {
            return;
        }
        List<Object[]> rows = new ArrayList<>(values.size());
        new TreeMap<>(values).forEach((key, value) -> rows.add(new Object[]{key, codec.encode(value)}));
        execute(() -> jdbcTemplate.batchUpdate(
                "MERGE INTO " + store.getTable() + " (k, v) KEY (k) VALUES (?, ?)", rows),
                "putAll " + store.getStoreName());
    }

    public void deleteAll(StoreName store, List<String> keys) {
        if (keys.isEmpty()) {
            return;
        }
        List<Object[]> rows = new ArrayList<>(keys.size());
        keys.forEach(key -> rows.add(new Object[]{key}));
        execute(() -> jdbcTemplate.batchUpdate("DELETE FROM " + store.getTable() + " WHERE k = ?", rows),
                "deleteAll " + store.getStoreName());
    }

    public void clear(StoreName store) {
        execute(() -> jdbcTemplate.update("DELETE FROM " + store.getTable()), "clear " + store.getStoreName());
    }

    /**
     * Runs {@code work} in one transaction: either all of its writes become
     * durable or none do.
     */
    public void inTransaction(Runnable work) {
        try {
            transactionTemplate.executeWithoutResult(status -> work.run());
        } catch (DataAccessException | TransactionException e) {
            throw new GraphStoreException("Transaction failed at " + directory, e);
        }
    }

    // ============================================================
    // Reads
    // ============================================================

    public Optional<String> getRaw(StoreName store, String key) {
        return execute(() -> {
            try {
                return Optional.ofNullable(jdbcTemplate.queryForObject(
                        "SELECT v FROM " + store.getTable() + " WHERE k = ?", String.class, key));
            } catch (EmptyResultDataAccessException e) {
                return Optional.<String>empty();
            }
        }, "get " + store.getStoreName());
    }

    public <T> Optional<T> get(StoreName store, String key, Class<T> type) {
        return getRaw(store, key).map(json -> codec.decode(json, type));
    }

    public boolean contains(StoreName store, String key) {
        Integer count = execute(() -> jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + store.getTable() + " WHERE k = ?", Integer.class, key),
                "contains " + store.getStoreName());
        return count != null && count > 0;
    }

    public long count(StoreName store) {
        Long count = execute(() -> jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + store.getTable(), Long.class), "count " + store.getStoreName());
        return count == null ? 0L : count;
    }

    /**
     * Number of keys present in both stores.
     */
    public long countSharedKeys(StoreName left, StoreName right) {
        Long count = execute(() -> jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + left.getTable() + " l JOIN " + right.getTable() + " r ON l.k = r.k",
                Long.class), "countSharedKeys");
        return count == null ? 0L : count;
    }

    public void forEachKey(StoreName store, Consumer<String> consumer) {
        execute(() -> {
            jdbcTemplate.query("SELECT k FROM " + store.getTable() + " ORDER BY k",
                    rs -> {
                        consumer.accept(rs.getString("k"));
                    });
            return null;
        }, "scan " + store.getStoreName());
    }

    public <T> void forEach(StoreName store, Class<T> type, BiConsumer<String, T> consumer) {
        execute(() -> {
            jdbcTemplate.query("SELECT k, v FROM " + store.getTable() + " ORDER BY k",
                    rs -> {
                        consumer.accept(rs.getString("k"), codec.decode(rs.getString("v"), type));
                    });
            return null;
        }, "scan " + store.getStoreName());
    }

    /**
     * Every raw value of a store, keyed and sorted by id.
     */
    public SortedMap<String, String> snapshot(StoreName store) {
        SortedMap<String, String> values = new TreeMap<>();
        execute(() -> {
            jdbcTemplate.query("SELECT k, v FROM " + store.getTable(),
                    rs -> {
                        values.put(rs.getString("k"), rs.getString("v"));
                    });
            return null;
        }, "snapshot " + store.getStoreName());
        return values;
    }

    // ============================================================
    // Checkpoint
    // ============================================================

    public Optional<BuildCheckpoint> loadCheckpoint() {
        return execute(() -> {
            try {
                String json = jdbcTemplate.queryForObject(
                        "SELECT v FROM " + STATE_TABLE + " WHERE k = ?", String.class, CHECKPOINT_KEY);
                return Optional.of(codec.decode(json, BuildCheckpoint.class));
            } catch (EmptyResultDataAccessException e) {
                return Optional.<BuildCheckpoint>empty();
            }
        }, "loadCheckpoint");
    }

    public void saveCheckpoint(BuildCheckpoint checkpoint) {
        execute(() -> jdbcTemplate.update(
                "MERGE INTO " + STATE_TABLE + " (k, v) KEY (k) VALUES (?, ?)",
                CHECKPOINT_KEY, codec.encode(checkpoint)), "saveCheckpoint");
    }

    public void deleteCheckpoint() {
        execute(() -> jdbcTemplate.update("DELETE FROM " + STATE_TABLE + " WHERE k = ?", CHECKPOINT_KEY),
                "deleteCheckpoint");
    }

    @Override
    public void close() {
        dataSource.destroy();
        log.debug("Closed store | path={}", directory);
    }

    private <T> T execute(Supplier<T> action, String operation) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new GraphStoreException("Store operation failed (" + operation + ") at " + directory, e);
        }
    }
}
