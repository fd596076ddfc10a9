package com.tinyc.cli;

import com.tinyc.cli.json.AstFormatException;
import com.tinyc.cli.json.AstJsonReader;
import com.tinyc.cli.json.AstJsonWriter;
import com.tinyc.compiler.ast.decl.Program;
import com.tinyc.ir.CompilationResult;
import com.tinyc.ir.CompilerOptions;
import com.tinyc.ir.TinycCompiler;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.concurrent.Callable;
import java.util.logging.Level;

/**
 * TinyC CLI 入口点（picocli）。
 * 读取解析器输出的 JSON AST，输出标注后的 AST、CFG 或栈机汇编。
 */
@Command(name = "tinyc", version = "TinyC v0.1.0",
         mixinStandardHelpOptions = true,
         description = "把 JSON AST 编译为栈机汇编")
public class Main implements Callable<Integer> {

    static final int EXIT_FORMAT_ERROR = 1;
    static final int EXIT_IO_ERROR = 2;

    enum Emit { ASM, CFG, ANNOTATED }

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "JSON AST 文件（- 表示标准输入）")
    String input;

    @Option(names = "--emit", defaultValue = "asm", description = "输出内容：asm, cfg, annotated（默认 asm）")
    Emit emit;

    @Option(names = {"-o", "--output"}, description = "输出文件（默认标准输出）")
    String output;

    @Option(names = "--no-optimize", description = "不做空块消除与块合并")
    boolean noOptimize;

    @Option(names = "--comments", description = "在汇编中输出注释")
    boolean comments;

    @Option(names = "--entry", defaultValue = "main", description = "入口函数名，不生成帧序言（默认 main）")
    String entry;

    @Option(names = "--verbose", description = "输出调试日志")
    boolean verbose;

    @Override
    public Integer call() {
        LoggingSetup.configure(verbose ? Level.FINE : Level.WARNING);

        Program program;
        try {
            program = readProgram();
        } catch (AstFormatException e) {
            err().println("错误: " + e.getMessage());
            return EXIT_FORMAT_ERROR;
        } catch (IOException e) {
            err().println("错误: 无法读取 " + input + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }

        CompilationResult result = new TinycCompiler(toOptions()).compile(program);
        String text;
        switch (emit) {
            case CFG:
                text = result.dumpCfgs();
                break;
            case ANNOTATED:
                text = new AstJsonWriter().write(result.getAnnotatedProgram());
                break;
            default:
                text = result.getProgramText();
                break;
        }

        try {
            writeOutput(text);
        } catch (IOException e) {
            err().println("错误: 无法写入 " + output + ": " + e.getMessage());
            return EXIT_IO_ERROR;
        }
        return 0;
    }

    CompilerOptions toOptions() {
        CompilerOptions options = new CompilerOptions();
        options.setOptimize(!noOptimize);
        options.setEmitComments(comments);
        options.setEntryFunctionName(entry);
        return options;
    }

    private Program readProgram() throws IOException {
        if ("-".equals(input)) {
            Reader reader = new InputStreamReader(System.in, StandardCharsets.UTF_8);
            return new AstJsonReader("<stdin>").read(reader);
        }
        String json = new String(Files.readAllBytes(Paths.get(input)), StandardCharsets.UTF_8);
        return new AstJsonReader(input).read(json);
    }

    private void writeOutput(String text) throws IOException {
        if (output == null) {
            PrintWriter out = spec.commandLine().getOut();
            out.println(text);
            out.flush();
            return;
        }
        Files.write(Paths.get(output), (text + "\n").getBytes(StandardCharsets.UTF_8));
    }

    private PrintWriter err() {
        return spec.commandLine().getErr();
    }

    static CommandLine createCommandLine() {
        return createCommandLine(System.out, System.err);
    }

    /** 标准输出与标准错误统一按 UTF-8 编码，与文件输出一致 */
    static CommandLine createCommandLine(OutputStream out, OutputStream err) {
        CommandLine cmd = new CommandLine(new Main());
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        cmd.setOut(new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8), true));
        cmd.setErr(new PrintWriter(new OutputStreamWriter(err, StandardCharsets.UTF_8), true));
        return cmd;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
