package hdlopt.emit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import hdlopt.ir.ContinuousAssignment;
import hdlopt.ir.Design;
import hdlopt.ir.Expression;
import hdlopt.ir.HdlModule;
import hdlopt.ir.Instance;
import hdlopt.ir.Port;
import hdlopt.ir.ProcessBlock;
import hdlopt.ir.Signal;
import hdlopt.ir.Statement;
import hdlopt.ir.Statement.Assign;
import hdlopt.ir.Statement.Case;
import hdlopt.ir.Statement.CaseArm;
import hdlopt.ir.Statement.If;
import hdlopt.ir.Statement.Loop;

/**
 * Serializes a design into Verilog-like structural text.
 * <p>
 * Modules are written in name order. Within a module, declarations, assignments, process blocks and instances are each
 * written in stable index order, so the text only depends on the IR and never on the order passes produced elements in.
 */
public class NetlistEmitter {
  public String tab = "    ";

  public String emit(Design design) {
    List<String> modules = new ArrayList<>();
    for (HdlModule module : design.getModules().values())
      modules.add(emit(module));
    return String.join("\n", modules);
  }

  public String emit(HdlModule module) {
    StringBuilder text = new StringBuilder();
    text.append("module ").append(module.getName()).append("(");
    text.append(module.getPorts().stream().map(port -> CreatePortDecl(module, port)).collect(Collectors.joining(", ")));
    text.append(");\n");

    module.getSignals()
        .values()
        .stream()
        .filter(signal -> !module.isPort(signal.name()))
        .sorted(Comparator.comparing(Signal::index))
        .forEach(signal -> text.append(tab).append(signal.kind().keyword).append(" ").append(range(signal.width())).append(signal.name()).append(";\n"));

    module.getAssignments()
        .stream()
        .sorted(Comparator.comparing(ContinuousAssignment::index))
        .forEach(assignment -> text.append(tab).append(CreateAssign(assignment.target(), ExpressionPrinter.print(assignment.source()))));

    module.getProcesses()
        .stream()
        .sorted(Comparator.comparing(ProcessBlock::index))
        .forEach(process -> text.append(AlignText(tab, CreateInAlways(process))));

    module.getInstances()
        .stream()
        .sorted(Comparator.comparing(Instance::index))
        .forEach(instance -> text.append(tab).append(CreateInstance(instance)));

    text.append("endmodule\n");
    return text.toString();
  }

  private String CreatePortDecl(HdlModule module, Port port) {
    boolean reg = module.getSignal(port.name()).map(signal -> signal.kind() == Signal.Kind.variable).orElse(false);
    return port.direction().keyword + (reg ? " reg " : " ") + range(port.width()) + port.name();
  }

  public String CreateAssign(String assigSig, String toAssign) { return "assign " + assigSig + " = " + toAssign + ";\n"; }

  public String CreateInAlways(ProcessBlock process) {
    String head = "always@(" + process.sensitivity() + ")";
    StringBuilder body = new StringBuilder();
    appendStatements(process.body(), body);
    return head + " begin\n" + AlignText(tab, body.toString()) + "end\n";
  }

  public String CreateInstance(Instance instance) {
    List<String> connections = new ArrayList<>();
    // binding maps carry no meaningful order, connections are listed by port name
    for (Map.Entry<String, Expression> input : new TreeMap<>(instance.inputs()).entrySet())
      connections.add("." + input.getKey() + "(" + ExpressionPrinter.print(input.getValue()) + ")");
    for (Map.Entry<String, String> output : new TreeMap<>(instance.outputs()).entrySet())
      connections.add("." + output.getKey() + "(" + output.getValue() + ")");
    return instance.moduleName() + " " + instance.name() + "(" + String.join(", ", connections) + ");\n";
  }

  private void appendStatements(List<Statement> statements, StringBuilder out) {
    for (Statement statement : statements) {
      if (statement instanceof Assign) {
        Assign assign = (Assign)statement;
        out.append(assign.target()).append(" ").append(assign.kind().symbol).append(" ").append(ExpressionPrinter.print(assign.source()))
            .append(";\n");
      } else if (statement instanceof If) {
        If ifStmt = (If)statement;
        out.append("if (").append(ExpressionPrinter.print(ifStmt.cond())).append(")").append(CreateBlock(ifStmt.thenBranch()));
        if (!ifStmt.elseBranch().isEmpty())
          out.append("else").append(CreateBlock(ifStmt.elseBranch()));
      } else if (statement instanceof Case) {
        Case caseStmt = (Case)statement;
        StringBuilder arms = new StringBuilder();
        for (CaseArm arm : caseStmt.arms())
          arms.append(arm.pattern()).append(":").append(CreateBlock(arm.body()));
        caseStmt.defaultBranch().ifPresent(body -> arms.append("default:").append(CreateBlock(body)));
        out.append("case (").append(ExpressionPrinter.print(caseStmt.selector())).append(")\n");
        out.append(AlignText(tab, arms.toString()));
        out.append("endcase\n");
      } else if (statement instanceof Loop) {
        Loop loop = (Loop)statement;
        String index = loop.indexName();
        out.append("for (").append(index).append(" = 0; ").append(index).append(" < ").append(loop.tripCount()).append("; ").append(index)
            .append(" = ").append(index).append(" + 1)").append(CreateBlock(loop.body()));
      }
    }
  }

  private String CreateBlock(List<Statement> statements) {
    StringBuilder body = new StringBuilder();
    appendStatements(statements, body);
    return " begin\n" + AlignText(tab, body.toString()) + "end\n";
  }

  private static String range(int width) { return width == 1 ? "" : "[" + (width - 1) + ":0] "; }

  /** Prefixes every line of text with the alignment. */
  public static String AlignText(String alignment, String text) {
    if (text.isEmpty())
      return text;
    StringBuilder aligned = new StringBuilder();
    for (String line : text.split("\n", -1)) {
      if (!line.isEmpty())
        aligned.append(alignment).append(line);
      aligned.append("\n");
    }
    aligned.setLength(aligned.length() - 1);
    return aligned.toString();
  }
}
