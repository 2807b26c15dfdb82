package at.tugraz.iaik.cfgrecovery.application.instructions;

import java.util.Locale;

public enum InvokeType {
  STATIC,
  SPECIAL,
  VIRTUAL,
  INTERFACE,
  DYNAMIC;

  /**
   * @return the invoke type for the listing keyword, or null if unknown
   */
  public static InvokeType fromKeyword(String keyword) {
    for (InvokeType type : values()) {
      if (type.name().toLowerCase(Locale.ROOT).equals(keyword))
        return type;
    }

    return null;
  }
}
