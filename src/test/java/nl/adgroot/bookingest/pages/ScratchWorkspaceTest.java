package nl.adgroot.bookingest.pages;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ScratchWorkspaceTest {

  @TempDir
  Path root;

  @Test
  void close_deletesWrittenFilesAndDirectory() throws Exception {
    ScratchWorkspace ws = ScratchWorkspace.create(root);
    Files.writeString(ws.fileFor(1, "jpg"), "one");
    Files.writeString(ws.fileFor(2, "jpg"), "two");

    ws.close();

    assertFalse(Files.exists(ws.directory()));
  }

  @Test
  void close_filesNeverWritten_isFine() throws Exception {
    ScratchWorkspace ws = ScratchWorkspace.create(root);
    ws.fileFor(1, "jpg");

    ws.close();

    assertFalse(Files.exists(ws.directory()));
  }

  @Test
  void close_foreignFilePresent_keepsDirectory() throws Exception {
    ScratchWorkspace ws = ScratchWorkspace.create(root);
    Files.writeString(ws.fileFor(1, "jpg"), "one");
    Path foreign = Files.writeString(ws.directory().resolve("not-ours.txt"), "x");

    ws.close();

    assertTrue(Files.exists(foreign), "only files handed out by the workspace are deleted");
    assertFalse(Files.exists(ws.directory().resolve("page-1.jpg")));
  }

  @Test
  void create_twice_givesDistinctDirectories() throws Exception {
    try (ScratchWorkspace a = ScratchWorkspace.create(root); ScratchWorkspace b = ScratchWorkspace.create(root)) {
      assertNotEquals(a.directory(), b.directory());
      assertEquals(root, a.directory().getParent());
    }
  }

  @Test
  void fileFor_afterClose_isRejected() throws Exception {
    ScratchWorkspace ws = ScratchWorkspace.create(root);
    ws.close();
    ws.close(); // idempotent

    assertTrue(ws.isClosed());
    assertThrows(IllegalStateException.class, () -> ws.fileFor(1, "jpg"));
  }
}
