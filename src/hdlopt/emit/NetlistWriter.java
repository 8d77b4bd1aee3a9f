package hdlopt.emit;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/*
 * Class for writing emitted netlists to files.
 */
public class NetlistWriter {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final File outFile;

  public NetlistWriter(String outPath) { this.outFile = new File(outPath); }

  /**
   * Writes the netlist text, replacing any existing file.
   * Missing parent directories are created.
   */
  public void write(String netlist) throws IOException {
    // create output path if necessary
    File parent = outFile.getAbsoluteFile().getParentFile();
    if (parent != null && !parent.isDirectory() && !parent.mkdirs())
      throw new IOException("Cannot create directory " + parent);

    logger.info("Writing " + outFile.getPath());
    try (PrintWriter out = new PrintWriter(new OutputStreamWriter(new FileOutputStream(outFile), StandardCharsets.UTF_8))) {
      out.print(netlist);
      if (out.checkError())
        throw new IOException("Error writing file " + outFile.getPath());
    }
  }
}
