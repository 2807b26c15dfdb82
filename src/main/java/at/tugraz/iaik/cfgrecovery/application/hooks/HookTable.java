package at.tugraz.iaik.cfgrecovery.application.hooks;

import at.tugraz.iaik.cfgrecovery.application.methods.Address;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

public class HookTable {
  private final Map<Address, Hook> hooks = new HashMap<>();

  public void hook(Address address, Hook hook) {
    hooks.put(address, hook);
  }

  public boolean isHooked(Address address) {
    return hooks.containsKey(address);
  }

  public Optional<Hook> getHook(Address address) {
    return Optional.ofNullable(hooks.get(address));
  }

  /**
   * @return the stub length for a hooked address
   */
  public Optional<Integer> getHookLength(Address address) {
    return getHook(address).map(Hook::getLength);
  }

  public Map<Address, Hook> getAllHooks() {
    return Collections.unmodifiableMap(hooks);
  }

  public int size() {
    return hooks.size();
  }
}
