package dev.zxul767.netflu;

import dev.zxul767.netflu.analysis.Annotations;
import dev.zxul767.netflu.analysis.SemanticAnalyzer;
import dev.zxul767.netflu.codegen.CodeGenerator;
import dev.zxul767.netflu.parsing.Parser;
import dev.zxul767.netflu.parsing.Scanner;
import dev.zxul767.netflu.parsing.Stmt;
import dev.zxul767.netflu.parsing.Token;
import java.util.List;

// Runs the pipeline: source -> tokens -> AST -> analyzed AST -> Rust.
//
// Every stage gets a fresh instance per call, so a `Compiler` holds no state
// and concurrent calls never share a symbol table. The first stage that
// fails throws a `CompileError` and nothing produced so far is returned.
public class Compiler {
  public List<Token> tokenize(String source) {
    return new Scanner(source).scanTokens();
  }

  public List<Stmt> parse(String source) {
    return new Parser(tokenize(source)).parse();
  }

  public Annotations analyze(List<Stmt> statements) {
    return new SemanticAnalyzer().analyze(statements);
  }

  public String generate(List<Stmt> statements) {
    return new CodeGenerator().generate(statements);
  }

  public String compile(String source) {
    List<Stmt> statements = parse(source);
    analyze(statements);
    return generate(statements);
  }
}
