package io.github.chirino.tracker.mongo;

import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mongodb.MongoTimeoutException;
import org.junit.jupiter.api.Test;

class TrackerIndexMigrationTest {

    @Test
    void skips_when_migration_disabled() {
        TrackerIndexManager manager = mock(TrackerIndexManager.class);
        TrackerIndexMigration migration = createMigration(manager);
        migration.migrateAtStart = false;

        migration.onStart(null);

        verify(manager, never()).ensureIndexes();
    }

    @Test
    void ensures_indexes_at_start() {
        TrackerIndexManager manager = mock(TrackerIndexManager.class);

        createMigration(manager).onStart(null);

        verify(manager).ensureIndexes();
    }

    @Test
    void startup_fails_when_indexes_cannot_be_created() {
        TrackerIndexManager manager = mock(TrackerIndexManager.class);
        when(manager.ensureIndexes()).thenThrow(new MongoTimeoutException("no server"));

        TrackerIndexMigration migration = createMigration(manager);

        assertThrows(MongoTimeoutException.class, () -> migration.onStart(null));
    }

    private static TrackerIndexMigration createMigration(TrackerIndexManager manager) {
        TrackerIndexMigration migration = new TrackerIndexMigration();
        migration.migrateAtStart = true;
        migration.indexManager = manager;
        return migration;
    }
}
