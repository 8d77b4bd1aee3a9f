package hdlopt.ir;

/** Looks up the widths of the names an expression refers to. */
public interface WidthResolver {
  int signalWidth(String signal);
  int instanceOutputWidth(String instance, String port);

  /** Scope with an additional local name, such as a loop index, that shadows nothing. */
  default WidthResolver withLocal(String name, int width) {
    WidthResolver outer = this;
    return new WidthResolver() {
      @Override
      public int signalWidth(String signal) {
        return signal.equals(name) ? width : outer.signalWidth(signal);
      }
      @Override
      public int instanceOutputWidth(String instance, String port) {
        return outer.instanceOutputWidth(instance, port);
      }
    };
  }
}
