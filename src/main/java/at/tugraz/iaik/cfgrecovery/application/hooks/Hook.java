package at.tugraz.iaik.cfgrecovery.application.hooks;

/**
 * An externally modelled piece of code. The CFG contains a stub node of the given length instead of a lifted block.
 */
public class Hook {
  private final String name;
  private final int length;
  private final boolean returning;
  private final boolean syscall;

  public Hook(String name, int length, boolean returning, boolean syscall) {
    if (length < 0)
      throw new IllegalArgumentException("Negative hook length: " + length);

    this.name = name;
    this.length = length;
    this.returning = returning;
    this.syscall = syscall;
  }

  public String getName() {
    return name;
  }

  public int getLength() {
    return length;
  }

  public boolean isReturning() {
    return returning;
  }

  public boolean isSyscall() {
    return syscall;
  }

  @Override
  public String toString() {
    return "Hook [name=" + name + ", length=" + length + ", returning=" + returning + ", syscall=" + syscall + "]";
  }
}
