package hdlopt.emit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class NetlistWriterTest {
  @TempDir
  Path tempDir;

  @Test
  void testCreatesParentDirectories() throws IOException {
    Path out = tempDir.resolve("gen").resolve("netlist.v");
    NetlistWriter writer = new NetlistWriter(out.toString());
    writer.write("module top();\nendmodule\n");
    Assertions.assertEquals("module top();\nendmodule\n", Files.readString(out, StandardCharsets.UTF_8));
  }

  @Test
  void testReplacesExistingFile() throws IOException {
    Path out = tempDir.resolve("netlist.v");
    Files.writeString(out, "old content that is longer than the new one");
    new NetlistWriter(out.toString()).write("new");
    Assertions.assertEquals("new", Files.readString(out));
  }
}
