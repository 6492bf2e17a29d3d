package org.jsondb;

import org.jsondb.container.TrackedMap;
import org.jsondb.document.Document;
import org.jsondb.lifecycle.DocumentRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DocumentRegistryTest {

    private DocumentRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DocumentRegistry();
    }

    @Test
    void openRegistersDocument() throws IOException {
        Document doc = Document.open(Path.of("a.json"), new InMemorySnapshotStore(), registry);
        assertTrue(registry.isRegistered(doc));
        assertEquals(1, registry.size());
    }

    @Test
    void flushAllSavesEveryDirtyDocument() throws IOException {
        InMemorySnapshotStore s1 = new InMemorySnapshotStore();
        InMemorySnapshotStore s2 = new InMemorySnapshotStore("[]");
        InMemorySnapshotStore s3 = new InMemorySnapshotStore("{}");
        Document d1 = Document.open(Path.of("1.json"), s1, registry);
        Document d2 = Document.open(Path.of("2.json"), s2, registry);
        Document.open(Path.of("3.json"), s3, registry);

        d1.set("k", "v");
        d2.append(true);

        assertEquals(0, registry.flushAll());
        assertFalse(d1.isDirty());
        assertFalse(d2.isDirty());
        assertEquals("{\n  \"k\": \"v\"\n}", s1.text);
        assertEquals("[\n  true\n]", s2.text);
        // clean document is not rewritten
        assertEquals(0, s3.writes);
    }

    @Test
    void oneFailingDocumentDoesNotStopTheSweep() throws IOException {
        InMemorySnapshotStore broken = new InMemorySnapshotStore();
        broken.failWrites = true;
        InMemorySnapshotStore healthy = new InMemorySnapshotStore();
        Document bad = Document.open(Path.of("bad.json"), broken, registry);
        Document good = Document.open(Path.of("good.json"), healthy, registry);
        bad.append(1);
        good.append(2);

        assertEquals(1, registry.flushAll());
        assertTrue(bad.isDirty());
        assertFalse(good.isDirty());
        assertEquals(1, healthy.writes);
    }

    @Test
    void documentWithSaveInProgressIsSkipped() throws IOException {
        InMemorySnapshotStore store = new InMemorySnapshotStore();
        Document doc = Document.open(Path.of("busy.json"), store, registry);
        int[] sweepResult = {-1};
        store.duringWrite = () -> {
            assertTrue(doc.isSaving());
            sweepResult[0] = registry.flushAll();
        };
        doc.set("a", 1);

        doc.save();

        assertEquals(1, sweepResult[0]);
        assertEquals(1, store.writes);
        assertFalse(doc.isSaving());
    }

    @Test
    void closedDocumentIsNotFlushed() throws IOException {
        InMemorySnapshotStore store = new InMemorySnapshotStore();
        Document doc = Document.open(Path.of("c.json"), store, registry);
        doc.close();
        doc.set("late", 1);

        registry.flushAll();
        assertTrue(doc.isDirty());
        assertEquals(0, store.writes);
    }

    @Test
    void shutdownHookIsInstalledOnce() {
        assertFalse(registry.isShutdownHookInstalled());
        registry.installShutdownHook();
        registry.installShutdownHook();
        assertTrue(registry.isShutdownHookInstalled());
    }

    @Test
    void selfContainingDocumentDoesNotStopTheSweep() throws IOException {
        InMemorySnapshotStore healthy = new InMemorySnapshotStore();
        Document bad = Document.open(Path.of("bad.json"), new InMemorySnapshotStore(), registry);
        Document good = Document.open(Path.of("good.json"), healthy, registry);
        TrackedMap loop = bad.getOrInsertMap("loop");
        loop.set("again", loop);
        good.set("k", 1);

        assertEquals(1, registry.flushAll());
        assertTrue(bad.isDirty());
        assertFalse(good.isDirty());
        assertEquals(1, healthy.writes);
    }
}
