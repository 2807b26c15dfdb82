package at.tugraz.iaik.cfgrecovery.application.lifting;

import at.tugraz.iaik.cfgrecovery.application.methods.Address;

public class BlockUnavailableException extends Exception {
  private static final long serialVersionUID = 4212718803442187260L;

  private final Address address;

  public BlockUnavailableException(Address address, String reason) {
    super("No block at " + address + ": " + reason);
    this.address = address;
  }

  public Address getAddress() {
    return address;
  }
}
