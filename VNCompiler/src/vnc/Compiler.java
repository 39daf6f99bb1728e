package vnc;

import com.google.common.collect.ImmutableList;

/**
 * Runs every stage over one document. Each call owns its intermediate state, so one instance may
 * compile several documents, also concurrently.
 */
public final class Compiler {
  private final CompilerOptions options;

  public Compiler(CompilerOptions options) {
    this.options = options;
  }

  public Compiler() {
    this(CompilerOptions.defaults());
  }

  public CompilationResult compile(Document document) {
    Stages stages = new Stages();

    IRBuilder irBuilder = new IRBuilder(options);
    Program program = irBuilder.build(document);
    stages.takeDiagnostics(irBuilder);

    CfgBuilder cfgBuilder = new CfgBuilder();
    ImmutableList<Function> functions = cfgBuilder.build(program);
    stages.takeDiagnostics(cfgBuilder);

    CfgValidator validator = new CfgValidator();
    functions.forEach(validator::validate);
    stages.takeDiagnostics(validator);

    CodeGenerator generator = new CodeGenerator(options);
    CodeGenerator.Result generated = generator.generate(program, functions);
    stages.takeDiagnostics(generator);

    String script = new RenPyWriter(options).write(program, generated);
    return CompilationResult.create(
        program, functions, script, PlainDump.of(functions, options), stages.diagnostics());
  }

  // Collects the diagnostics of all stages in order.
  private static final class Stages extends DiagnosticCollector {}
}
