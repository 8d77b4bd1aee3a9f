package hdlopt.ir;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Module definition: ports, signals, process blocks, continuous assignments and instances.
 * Immutable; passes derive new modules through the with* methods.
 */
public final class HdlModule {
  private final String name;
  private final List<Port> ports;
  private final Map<String, Signal> signals;
  private final List<ProcessBlock> processes;
  private final List<ContinuousAssignment> assignments;
  private final List<Instance> instances;

  public HdlModule(String name, List<Port> ports, Collection<Signal> signals, List<ProcessBlock> processes,
                   List<ContinuousAssignment> assignments, List<Instance> instances) {
    this.name = name;
    this.ports = List.copyOf(ports);
    LinkedHashMap<String, Signal> signalMap = new LinkedHashMap<>();
    for (Signal signal : signals) {
      if (signalMap.put(signal.name(), signal) != null)
        throw new IllegalArgumentException("module " + name + ": duplicate signal " + signal.name());
    }
    for (Port port : this.ports) {
      Signal portSignal = signalMap.get(port.name());
      if (portSignal == null)
        throw new IllegalArgumentException("module " + name + ": port " + port.name() + " has no signal");
      if (portSignal.width() != port.width())
        throw new IllegalArgumentException("module " + name + ": port " + port.name() + " width differs from its signal");
    }
    this.signals = Collections.unmodifiableMap(signalMap);
    this.processes = List.copyOf(processes);
    this.assignments = List.copyOf(assignments);
    this.instances = List.copyOf(instances);
  }

  public String getName() { return name; }
  public List<Port> getPorts() { return ports; }
  public Map<String, Signal> getSignals() { return signals; }
  public List<ProcessBlock> getProcesses() { return processes; }
  public List<ContinuousAssignment> getAssignments() { return assignments; }
  public List<Instance> getInstances() { return instances; }

  public Optional<Signal> getSignal(String signalName) { return Optional.ofNullable(signals.get(signalName)); }
  public Optional<Port> getPort(String portName) { return ports.stream().filter(port -> port.name().equals(portName)).findFirst(); }
  public Optional<Instance> getInstance(String instanceName) {
    return instances.stream().filter(instance -> instance.name().equals(instanceName)).findFirst();
  }
  public boolean isPort(String signalName) { return getPort(signalName).isPresent(); }

  public Stream<Port> inputPorts() { return ports.stream().filter(port -> port.direction() == Port.Direction.in); }
  public Stream<Port> outputPorts() { return ports.stream().filter(Port::isObservable); }

  public HdlModule withSignals(Collection<Signal> newSignals) {
    return new HdlModule(name, ports, newSignals, processes, assignments, instances);
  }
  public HdlModule withProcesses(List<ProcessBlock> newProcesses) {
    return new HdlModule(name, ports, signals.values(), newProcesses, assignments, instances);
  }
  public HdlModule withAssignments(List<ContinuousAssignment> newAssignments) {
    return new HdlModule(name, ports, signals.values(), processes, newAssignments, instances);
  }
  public HdlModule withInstances(List<Instance> newInstances) {
    return new HdlModule(name, ports, signals.values(), processes, assignments, newInstances);
  }
  public HdlModule with(List<ProcessBlock> newProcesses, List<ContinuousAssignment> newAssignments, List<Instance> newInstances) {
    return new HdlModule(name, ports, signals.values(), newProcesses, newAssignments, newInstances);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, ports, signals, processes, assignments, instances);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    HdlModule other = (HdlModule)obj;
    return name.equals(other.name) && ports.equals(other.ports) && signals.equals(other.signals) && processes.equals(other.processes) &&
        assignments.equals(other.assignments) && instances.equals(other.instances);
  }

  @Override
  public String toString() {
    return "HdlModule " + name + " (" + ports.stream().map(Port::name).collect(Collectors.joining(", ")) + ")";
  }

  public static Builder builder(String name) { return new Builder(name); }

  /**
   * Fluent construction in definition order. Each declared element receives the next ordinal.
   */
  public static class Builder {
    private final String name;
    private final List<Port> ports = new ArrayList<>();
    private final List<Signal> signals = new ArrayList<>();
    private final List<ProcessBlock> processes = new ArrayList<>();
    private final List<ContinuousAssignment> assignments = new ArrayList<>();
    private final List<Instance> instances = new ArrayList<>();
    private int nextOrdinal = 0;

    Builder(String name) { this.name = name; }

    private StableIndex next() { return StableIndex.of(nextOrdinal++); }

    public Builder port(String portName, Port.Direction direction, int width, Signal.Kind kind) {
      ports.add(new Port(portName, direction, width));
      signals.add(new Signal(portName, width, kind, next()));
      return this;
    }
    public Builder input(String portName, int width) { return port(portName, Port.Direction.in, width, Signal.Kind.wire); }
    public Builder output(String portName, int width) { return port(portName, Port.Direction.out, width, Signal.Kind.wire); }
    /** Output port written from a process block. */
    public Builder outputReg(String portName, int width) { return port(portName, Port.Direction.out, width, Signal.Kind.variable); }
    public Builder inout(String portName, int width) { return port(portName, Port.Direction.inout, width, Signal.Kind.wire); }

    public Builder wire(String signalName, int width) {
      signals.add(new Signal(signalName, width, Signal.Kind.wire, next()));
      return this;
    }
    public Builder variable(String signalName, int width) {
      signals.add(new Signal(signalName, width, Signal.Kind.variable, next()));
      return this;
    }

    public Builder assign(String target, Expression source) {
      assignments.add(new ContinuousAssignment(target, source, next()));
      return this;
    }

    public Builder process(String processName, Sensitivity sensitivity, Statement... body) {
      return process(processName, sensitivity, List.of(body));
    }
    public Builder process(String processName, Sensitivity sensitivity, List<Statement> body) {
      processes.add(new ProcessBlock(processName, body, sensitivity, next()));
      return this;
    }

    public Builder instance(String instanceName, String moduleName, Map<String, Expression> inputs, Map<String, String> outputs) {
      instances.add(new Instance(instanceName, moduleName, inputs, outputs, next()));
      return this;
    }

    public HdlModule build() { return new HdlModule(name, ports, signals, processes, assignments, instances); }
  }
}
