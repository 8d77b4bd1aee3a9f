package hdlopt.drc;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import hdlopt.diag.DiagnosticCategory;
import hdlopt.diag.DiagnosticCollector;
import hdlopt.emit.ExpressionPrinter;
import hdlopt.ir.HdlModule;
import hdlopt.ir.ProcessBlock;
import hdlopt.ir.Statement.Assign;
import hdlopt.ir.Statement.AssignKind;
import hdlopt.ir.Statements;

/**
 * Flags blocking assignments that read a variable before a later blocking assignment of the same process writes it.
 * <p>
 * The read observes the value from before the evaluation (or from an earlier trigger), which is rarely intended.
 * Assignments are considered in textual order of the unrolled body regardless of the branches they sit in.
 * The diagnostic suggests moving the later assignment first; the IR is never reordered.
 */
public class OrderHazardAnalyzer {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public void analyze(HdlModule module, DiagnosticCollector diagnostics) {
    for (ProcessBlock process : module.getProcesses())
      analyze(module, process, diagnostics);
  }

  public void analyze(HdlModule module, ProcessBlock process, DiagnosticCollector diagnostics) {
    List<Assign> assigns = new ArrayList<>();
    Statements.forEachAssign(Statements.unroll(process.body()), assigns::add);
    logger.trace("Module {}: checking {} assignments of process {}", module.getName(), assigns.size(), process.name());
    Set<String> reported = new LinkedHashSet<>();
    for (int i = 0; i < assigns.size(); ++i) {
      Assign reader = assigns.get(i);
      if (reader.kind() != AssignKind.blocking)
        continue;
      for (String read : reader.source().readSignals()) {
        if (read.equals(reader.target()) || writtenBlocking(assigns, read, 0, i))
          continue;
        int writer = firstBlockingWrite(assigns, read, i + 1);
        if (writer < 0)
          continue;
        String reorder = "`" + print(assigns.get(writer)) + "` before `" + print(reader) + "`";
        if (!reported.add(reader.target() + "<-" + read + ":" + reorder))
          continue;
        diagnostics.warn(DiagnosticCategory.OrderDependentAssignment, module.getName(), reader.target(),
                         reader.target() + " reads " + read + " in process " + process.name() +
                             " before its blocking assignment; consider moving " + reorder);
      }
    }
  }

  private static boolean writtenBlocking(List<Assign> assigns, String target, int from, int to) {
    for (int i = from; i < to; ++i) {
      if (assigns.get(i).kind() == AssignKind.blocking && assigns.get(i).target().equals(target))
        return true;
    }
    return false;
  }

  private static int firstBlockingWrite(List<Assign> assigns, String target, int from) {
    for (int i = from; i < assigns.size(); ++i) {
      if (assigns.get(i).kind() == AssignKind.blocking && assigns.get(i).target().equals(target))
        return i;
    }
    return -1;
  }

  private static String print(Assign assign) {
    return assign.target() + " " + assign.kind().symbol + " " + ExpressionPrinter.print(assign.source()) + ";";
  }
}
