package org.crynn.storage.index;

import org.crynn.storage.StorageIoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

/**
 * The relational metadata index shared by every store.
 * <p>
 * Holds typed rows only; eviction and security policy live in the stores. One instance is
 * owned by the storage manager and handed to each store by reference.
 */
public final class StorageIndex implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StorageIndex.class);

    /** Unit of work against one connection. May touch the filesystem before the commit. */
    @FunctionalInterface
    public interface JdbcWork<T> {
        T apply(Connection conn) throws SQLException, IOException;
    }

    private final DataSource dataSource;
    private final Path indexFile;

    /**
     * @param dataSource connection source for the index database
     * @param indexFile  on-disk file backing the database, or {@code null} for in-memory indexes
     */
    public StorageIndex(DataSource dataSource, Path indexFile) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.indexFile = indexFile;
    }

    /** Creates missing tables. Safe to call on every start. */
    public void bootstrap() {
        try (Connection conn = dataSource.getConnection()) {
            StorageSchema.apply(conn);
        } catch (SQLException e) {
            throw new SchemaException("Failed to bootstrap storage index", e);
        }
        log.info("Storage index ready (schema v{}, file={})", StorageSchema.VERSION,
                indexFile == null ? "<memory>" : indexFile);
    }

    /** Runs {@code work} on an auto-commit connection. */
    public <T> T query(JdbcWork<T> work) {
        try (Connection conn = dataSource.getConnection()) {
            return work.apply(conn);
        } catch (SQLException | IOException e) {
            throw new StorageIoException("Index query failed", e);
        }
    }

    /**
     * Runs {@code work} in a single transaction. Any failure, including a failed commit, rolls
     * back and surfaces as {@link StorageIoException}; runtime exceptions are rethrown as-is.
     */
    public <T> T inTransaction(JdbcWork<T> work) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                T result = work.apply(conn);
                conn.commit();
                return result;
            } catch (SQLException | IOException | RuntimeException e) {
                rollbackQuietly(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException | IOException e) {
            throw new StorageIoException("Index transaction failed", e);
        }
    }

    public long count(String table) {
        return query(conn -> {
            try (PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM " + table);
                 ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        });
    }

    public Optional<Path> indexFile() {
        return Optional.ofNullable(indexFile);
    }

    /** Size of the database file in bytes, 0 for in-memory indexes or when the file is not there yet. */
    public long indexFileSize() {
        if (indexFile == null || !Files.exists(indexFile)) return 0L;
        try {
            return Files.size(indexFile);
        } catch (IOException e) {
            throw new StorageIoException("Failed to stat index file " + indexFile, e);
        }
    }

    public DataSource dataSource() {
        return dataSource;
    }

    /** Reads a nullable BIGINT column. */
    public static Long nullableLong(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : v;
    }

    public static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, java.sql.Types.BIGINT);
        } else {
            ps.setLong(index, value);
        }
    }

    private static void rollbackQuietly(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    @Override
    public void close() {
        if (dataSource instanceof AutoCloseable closeable) {
            try {
                closeable.close();
                log.info("Storage index closed");
            } catch (Exception e) {
                log.warn("Failed to close storage index data source", e);
            }
        }
    }
}
