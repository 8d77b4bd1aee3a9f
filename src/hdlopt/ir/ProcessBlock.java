package hdlopt.ir;

import java.util.List;
import java.util.Set;

/**
 * An always-style process: a statement list evaluated whenever the sensitivity triggers.
 */
public record ProcessBlock(String name, List<Statement> body, Sensitivity sensitivity, StableIndex index) {
  public enum Domain { combinational, sequential }

  public ProcessBlock { body = List.copyOf(body); }

  public Domain domain() { return sensitivity.domain(); }
  public boolean isCombinational() { return domain() == Domain.combinational; }

  public Set<String> assignedTargets() { return Statements.assignedTargets(body); }

  public ProcessBlock withBody(List<Statement> newBody) { return new ProcessBlock(name, newBody, sensitivity, index); }
}
