package dev.zxul767.netflu.analysis;

import dev.zxul767.netflu.parsing.Stmt;
import java.util.IdentityHashMap;
import java.util.Map;

// Side table with everything the analyzer computes about the AST. The AST
// itself stays immutable, so results are keyed by node identity (two
// structurally equal methods are still two different entries).
public class Annotations {
  private final Map<Stmt.Method, MethodInfo> methods = new IdentityHashMap<>();

  Annotations() {}

  void record(Stmt.Method method, MethodInfo info) { methods.put(method, info); }

  public boolean contains(Stmt.Method method) {
    return methods.containsKey(method);
  }

  public MethodInfo of(Stmt.Method method) {
    MethodInfo info = methods.get(method);
    if (info == null) {
      throw new IllegalArgumentException(String.format(
          "method '%s' has not been analyzed", method.name.lexeme
      ));
    }
    return info;
  }
}
