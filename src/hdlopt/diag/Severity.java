package hdlopt.diag;

public enum Severity { warning, error }
