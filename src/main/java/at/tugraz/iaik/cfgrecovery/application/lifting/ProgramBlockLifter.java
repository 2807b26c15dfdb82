package at.tugraz.iaik.cfgrecovery.application.lifting;

import at.tugraz.iaik.cfgrecovery.application.Program;
import at.tugraz.iaik.cfgrecovery.application.methods.Address;
import at.tugraz.iaik.cfgrecovery.application.methods.BasicBlock;
import at.tugraz.iaik.cfgrecovery.application.methods.Method;

/**
 * Looks up blocks in an in-memory program image.
 */
public class ProgramBlockLifter implements BlockLifter {
  private final Program program;

  public ProgramBlockLifter(Program program) {
    this.program = program;
  }

  @Override
  public BasicBlock lift(Address address) throws BlockUnavailableException {
    Method method = program.getMethod(address.getMethod());
    if (method == null)
      throw new BlockUnavailableException(address, "method is not part of the program");

    if (!method.hasBody())
      throw new BlockUnavailableException(address, "method has no body");

    BasicBlock bb = method.getBlock(address.getBlockIdx());
    if (bb == null)
      throw new BlockUnavailableException(address, "block index out of range");

    if (!bb.containsStatement(address.getStmtIdx()))
      throw new BlockUnavailableException(address, "statement is not part of block " + bb.getIndex());

    return bb;
  }
}
