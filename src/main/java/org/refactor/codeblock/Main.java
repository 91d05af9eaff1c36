package org.refactor.codeblock;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.refactor.codeblock.analysis.PortSpec;
import org.refactor.codeblock.analysis.Statement;
import org.refactor.codeblock.parser.JavaParserCodeParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 读取一段代码块文本（文件或 -e 参数），分析后以 JSON 输出：
 * - 语句及其定义/引用的变量
 * - 输入/输出端口
 * - 错误信息
 */
public class Main {

    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    record Report(String code, String codeToParse, BlockState state, String error, String previewVariable,
                  List<Statement> statements, List<PortSpec> inputs, List<PortSpec> outputs) {
    }

    public static void main(String[] args) throws IOException {
        if (args.length == 0) {
            System.err.println("Usage: Main <file> | Main -e <code>");
            System.exit(2);
        }
        String code = args[0].equals("-e") && args.length > 1
                ? args[1]
                : Files.readString(Path.of(args[0]), StandardCharsets.UTF_8);

        CodeBlockConfig config = CodeBlockConfig.load();
        InMemoryWorkspace workspace = new InMemoryWorkspace(new JavaParserCodeParser(), config);
        CodeBlockController block = workspace.addCodeBlock("cli");
        block.setCode(code);
        LOGGER.debug("Processed {} character(s) of code", code.length());

        InMemoryWorkspace.BlockPorts ports = workspace.portsOf(block.getBlockId());
        Report report = new Report(block.getCode(), block.getCodeToParse(), block.getState(), block.getErrorMessage(),
                block.getPreviewVariable(), block.getStatements(), ports.getInputPorts(), ports.getOutputPorts());

        Gson gson = new GsonBuilder()
                .setPrettyPrinting()
                .create();
        System.out.println(gson.toJson(report));
    }
}
