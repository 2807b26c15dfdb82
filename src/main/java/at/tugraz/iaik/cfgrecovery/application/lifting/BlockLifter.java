package at.tugraz.iaik.cfgrecovery.application.lifting;

import at.tugraz.iaik.cfgrecovery.application.methods.Address;
import at.tugraz.iaik.cfgrecovery.application.methods.BasicBlock;

/**
 * Turns an address into the basic block starting at it. Implementations must return the same
 * block for the same address as long as the program image does not change.
 */
public interface BlockLifter {
  BasicBlock lift(Address address) throws BlockUnavailableException;
}
