package org.crynn.storage.index;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * DDL for the storage index, one table per record kind.
 * <p>
 * Timestamps are stored as epoch millis. {@code key} and {@code value} are reserved words in H2,
 * hence {@code cache_key} and {@code cookie_value}.
 */
final class StorageSchema {
    private StorageSchema() {}

    static final int VERSION = 1;

    static final List<String> TABLES = List.of(
            "CREATE TABLE IF NOT EXISTS cache_entries ( "
                    + "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                    + "cache_key VARCHAR(8192) NOT NULL, "
                    + "content_type VARCHAR(255) NOT NULL, "
                    + "file_ref VARCHAR(128) NOT NULL, "
                    + "size BIGINT NOT NULL, "
                    + "created_at BIGINT NOT NULL, "
                    + "accessed_at BIGINT NOT NULL, "
                    + "expires_at BIGINT, "
                    + "CONSTRAINT uq_cache_key UNIQUE (cache_key) "
                    + ")",
            "CREATE INDEX IF NOT EXISTS idx_cache_lru ON cache_entries (accessed_at, created_at, id)",
            "CREATE INDEX IF NOT EXISTS idx_cache_expiry ON cache_entries (expires_at)",
            "CREATE TABLE IF NOT EXISTS cookies ( "
                    + "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                    + "name VARCHAR(1024) NOT NULL, "
                    + "cookie_value VARCHAR(8192) NOT NULL, "
                    + "domain VARCHAR(512) NOT NULL, "
                    + "path VARCHAR(2048) NOT NULL, "
                    + "expires_at BIGINT, "
                    + "secure BOOLEAN NOT NULL, "
                    + "http_only BOOLEAN NOT NULL, "
                    + "same_site VARCHAR(8) NOT NULL, "
                    + "created_at BIGINT NOT NULL, "
                    + "last_accessed BIGINT NOT NULL, "
                    + "CONSTRAINT uq_cookie UNIQUE (name, domain, path) "
                    + ")",
            "CREATE INDEX IF NOT EXISTS idx_cookie_expiry ON cookies (expires_at)",
            "CREATE TABLE IF NOT EXISTS history ( "
                    + "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                    + "url VARCHAR(8192) NOT NULL, "
                    + "title VARCHAR(2048), "
                    + "visit_count INT NOT NULL DEFAULT 1, "
                    + "last_visit BIGINT NOT NULL, "
                    + "created_at BIGINT NOT NULL, "
                    + "CONSTRAINT uq_history_url UNIQUE (url) "
                    + ")",
            "CREATE INDEX IF NOT EXISTS idx_history_last_visit ON history (last_visit, id)",
            "CREATE TABLE IF NOT EXISTS bookmarks ( "
                    + "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                    + "url VARCHAR(8192) NOT NULL, "
                    + "title VARCHAR(2048) NOT NULL, "
                    + "folder VARCHAR(512) DEFAULT 'default' NOT NULL, "
                    + "created_at BIGINT NOT NULL, "
                    + "CONSTRAINT uq_bookmark_url UNIQUE (url) "
                    + ")",
            "CREATE TABLE IF NOT EXISTS mail_headers ( "
                    + "uid BIGINT PRIMARY KEY, "
                    + "subject VARCHAR(4096) NOT NULL, "
                    + "from_addr VARCHAR(1024) NOT NULL, "
                    + "to_addr VARCHAR(4096) NOT NULL, "
                    + "sent_at BIGINT NOT NULL, "
                    + "size BIGINT NOT NULL, "
                    + "flags VARCHAR(2048) NOT NULL, "
                    + "folder VARCHAR(512) NOT NULL, "
                    + "cached_at BIGINT NOT NULL "
                    + ")",
            "CREATE INDEX IF NOT EXISTS idx_mail_cached_at ON mail_headers (cached_at, uid)",
            "CREATE TABLE IF NOT EXISTS mail_bodies ( "
                    + "uid BIGINT PRIMARY KEY, "
                    + "content CLOB NOT NULL, "
                    + "content_type VARCHAR(255) NOT NULL, "
                    + "cached_at BIGINT NOT NULL "
                    + ")",
            "CREATE TABLE IF NOT EXISTS mail_attachments ( "
                    + "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                    + "uid BIGINT NOT NULL, "
                    + "filename VARCHAR(1024) NOT NULL, "
                    + "content_type VARCHAR(255) NOT NULL, "
                    + "size BIGINT NOT NULL, "
                    + "data BLOB NOT NULL, "
                    + "cached_at BIGINT NOT NULL "
                    + ")",
            "CREATE INDEX IF NOT EXISTS idx_mail_attachment_uid ON mail_attachments (uid)"
    );

    /** Creates missing tables in one transaction and records the schema version. */
    static void apply(Connection conn) throws SQLException {
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try (Statement st = conn.createStatement()) {
            st.execute("CREATE TABLE IF NOT EXISTS schema_version (version INT NOT NULL)");

            Integer existing = null;
            try (ResultSet rs = st.executeQuery("SELECT MAX(version) FROM schema_version")) {
                if (rs.next()) {
                    int v = rs.getInt(1);
                    existing = rs.wasNull() ? null : v;
                }
            }
            if (existing != null && existing > VERSION) {
                throw new SchemaException("Index was written by schema version " + existing
                        + "; this build supports up to " + VERSION);
            }

            for (String ddl : TABLES) {
                st.execute(ddl);
            }
            if (existing == null) {
                st.executeUpdate("INSERT INTO schema_version (version) VALUES (" + VERSION + ")");
            } else if (existing < VERSION) {
                st.executeUpdate("UPDATE schema_version SET version = " + VERSION);
            }
            conn.commit();
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }
}
