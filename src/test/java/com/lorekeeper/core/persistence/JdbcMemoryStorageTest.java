package com.lorekeeper.core.persistence;

import com.lorekeeper.core.error.StorageFailureException;
import com.lorekeeper.core.model.CanonEntry;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Runs the storage contract against an in-memory H2 database.
 */
class JdbcMemoryStorageTest extends MemoryStorageContract {

    private JdbcDataSource dataSource;

    @Override
    protected MemoryStorage createStorage() {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:lk-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        var jdbc = new JdbcMemoryStorage(dataSource);
        jdbc.createTables();
        return jdbc;
    }

    @Test
    void createTablesIsIdempotent() {
        var again = new JdbcMemoryStorage(dataSource);
        assertDoesNotThrow(again::createTables);
        assertTrue(storage.describe().startsWith("jdbc (H2"));
    }

    @Test
    void secondStoreOverTheSameDatabaseSeesCommittedState() {
        storage.installCanon(new CanonEntry("facts/water", "100C", 0.9, "o", 1, Instant.now(), List.of()));

        var other = new JdbcMemoryStorage(dataSource);

        assertEquals("100C", other.currentCanon("facts/water").orElseThrow().value());
        assertFalse(other.installCanon(new CanonEntry("facts/water", "90C", 0.9, "o", 1, Instant.now(), List.of())));
    }

    @Test
    void connectionFailuresBecomeStorageFailures() throws SQLException {
        DataSource broken = mock(DataSource.class);
        when(broken.getConnection()).thenThrow(new SQLException("connection refused", "08001"));
        var unreachable = new JdbcMemoryStorage(broken);

        assertThrows(StorageFailureException.class, () -> unreachable.currentCanon("facts/water"));
        assertThrows(StorageFailureException.class, unreachable::createTables);
        assertThrows(StorageFailureException.class, unreachable::describe);
    }
}
