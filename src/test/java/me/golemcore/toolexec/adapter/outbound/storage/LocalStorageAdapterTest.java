package me.golemcore.toolexec.adapter.outbound.storage;

import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String INVOCATIONS = "invocations";
    private static final String BLOBS = "checkpoint-blobs";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        ToolExecProperties properties = new ToolExecProperties();
        properties.getStorage().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void initCreatesWorkspaceDirectories() {
        assertTrue(Files.isDirectory(tempDir.resolve("invocations")));
        assertTrue(Files.isDirectory(tempDir.resolve("checkpoints")));
        assertTrue(Files.isDirectory(tempDir.resolve("audit")));
        assertTrue(Files.isDirectory(tempDir.resolve("sandboxes")));
    }

    @Test
    void putAndGetObject() throws ExecutionException, InterruptedException {
        byte[] content = new byte[] { 1, 2, 3, 4, 5 };

        storageAdapter.putObject(BLOBS, "inv-1/cp-1.bin", content).get();

        assertArrayEquals(content, storageAdapter.getObject(BLOBS, "inv-1/cp-1.bin").get());
    }

    @Test
    void getReturnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getObject(BLOBS, "missing.bin").get());
        assertNull(storageAdapter.getText(INVOCATIONS, "missing.json").get());
    }

    @Test
    void putTextAtomicOverwritesAndLeavesNoTempFile() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(INVOCATIONS, "inv-1.json", "{\"status\":\"pending\"}").get();
        storageAdapter.putTextAtomic(INVOCATIONS, "inv-1.json", "{\"status\":\"running\"}").get();

        assertEquals("{\"status\":\"running\"}", storageAdapter.getText(INVOCATIONS, "inv-1.json").get());
        List<String> files = storageAdapter.listObjects(INVOCATIONS, "").get();
        assertEquals(List.of("inv-1.json"), files);
    }

    @Test
    void putTextAtomicCreatesParentDirectories() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic("checkpoints", "inv-1/0000000001-cp.json", "{}").get();

        assertTrue(storageAdapter.exists("checkpoints", "inv-1/0000000001-cp.json").get());
    }

    @Test
    void appendTextAppendsLines() throws ExecutionException, InterruptedException {
        storageAdapter.appendText("audit", "acme/2026-03-01.jsonl", "{\"a\":1}\n").get();
        storageAdapter.appendText("audit", "acme/2026-03-01.jsonl", "{\"a\":2}\n").get();

        assertEquals("{\"a\":1}\n{\"a\":2}\n", storageAdapter.getText("audit", "acme/2026-03-01.jsonl").get());
    }

    @Test
    void listObjectsFiltersByPrefixDirectory() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic("checkpoints", "inv-1/a.json", "{}").get();
        storageAdapter.putTextAtomic("checkpoints", "inv-1/b.json", "{}").get();
        storageAdapter.putTextAtomic("checkpoints", "inv-2/c.json", "{}").get();

        List<String> files = storageAdapter.listObjects("checkpoints", "inv-1").get();

        assertEquals(2, files.size());
        assertTrue(files.contains("inv-1/a.json"));
        assertTrue(storageAdapter.listObjects("checkpoints", "inv-9").get().isEmpty());
        assertTrue(storageAdapter.listObjects("no-such-dir", "").get().isEmpty());
    }

    @Test
    void deleteObjectRemovesFileAndToleratesMissing() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(INVOCATIONS, "gone.json", "{}").get();

        storageAdapter.deleteObject(INVOCATIONS, "gone.json").get();

        assertFalse(storageAdapter.exists(INVOCATIONS, "gone.json").get());
        assertDoesNotThrow(() -> storageAdapter.deleteObject(INVOCATIONS, "gone.json").get());
    }

    // ==================== Path traversal ====================

    @Test
    void shouldBlockPathTraversalOnWrite() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.putTextAtomic(INVOCATIONS, "../../etc/passwd", "hack").get());
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }

    @Test
    void shouldBlockPathTraversalOnRead() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.getObject(BLOBS, "../../../secret").get());
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }
}
