package dev.zxul767.netflu.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

// What the analyzer learns about a single `method` declaration.
public class MethodInfo {
  // integer `let` bindings found directly in the method's body
  private final Map<String, Integer> locals = new LinkedHashMap<>();
  // payload of the first `back` found directly in the method's body
  private String returnValue = null;

  MethodInfo() {}

  public Map<String, Integer> locals() {
    return Collections.unmodifiableMap(locals);
  }

  // null if the method's body has no `back` statement
  public String returnValue() { return returnValue; }

  public boolean hasReturnValue() { return returnValue != null; }

  void defineLocal(String name, int value) { locals.put(name, value); }

  // only the first `back` counts; later ones are ignored
  void offerReturnValue(String value) {
    if (returnValue == null)
      returnValue = value;
  }
}
