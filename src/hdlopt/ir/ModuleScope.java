package hdlopt.ir;

/**
 * Resolves widths of signals and instance outputs within one module of a design.
 */
public class ModuleScope implements WidthResolver {
  private final Design design;
  private final HdlModule module;

  public ModuleScope(Design design, HdlModule module) {
    this.design = design;
    this.module = module;
  }

  public Design getDesign() { return design; }
  public HdlModule getModule() { return module; }

  @Override
  public int signalWidth(String signal) {
    return module.getSignal(signal)
        .orElseThrow(() -> new IllegalStateException("module " + module.getName() + ": undeclared signal " + signal))
        .width();
  }

  @Override
  public int instanceOutputWidth(String instance, String port) {
    Instance inst = module.getInstance(instance).orElseThrow(
        () -> new IllegalStateException("module " + module.getName() + ": unknown instance " + instance));
    HdlModule target = design.getModule(inst.moduleName()).orElseThrow(
        () -> new IllegalStateException("module " + module.getName() + ": unknown module " + inst.moduleName()));
    return target.getPort(port)
        .orElseThrow(() -> new IllegalStateException("module " + target.getName() + " has no port " + port))
        .width();
  }
}
