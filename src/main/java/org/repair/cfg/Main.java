package org.repair.cfg;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 命令行入口：读取一个源文件，为目标过程构建 CFG，把规范文本（或 JSON）输出到标准输出。
 * <pre>
 * Main &lt;source-file&gt; [--lang python|java] [--function NAME] [--class NAME] [--json]
 * </pre>
 */
public class Main {

    private static final Logger LOG = LogManager.getLogger(Main.class);

    static final String USAGE =
            "usage: Main <source-file> [--lang python|java] [--function NAME] [--class NAME] [--json]";

    public static void main(String[] args) {
        int code = run(args, System.out, System.err);
        if (code != 0) {
            System.exit(code);
        }
    }

    /**
     * @return 进程退出码：0 成功，1 参数错误、目标不存在或源码无法解析
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        String file = null;
        String lang = null;
        String function = null;
        String container = null;
        boolean json = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--json":
                    json = true;
                    break;
                case "--lang":
                case "--function":
                case "--class":
                    if (i + 1 >= args.length) {
                        err.println("missing value for " + arg);
                        err.println(USAGE);
                        return 1;
                    }
                    String value = args[++i];
                    if (arg.equals("--lang")) {
                        lang = value;
                    } else if (arg.equals("--function")) {
                        function = value;
                    } else {
                        container = value;
                    }
                    break;
                default:
                    if (arg.startsWith("--") || file != null) {
                        err.println("unexpected argument: " + arg);
                        err.println(USAGE);
                        return 1;
                    }
                    file = arg;
            }
        }
        if (file == null) {
            err.println(USAGE);
            return 1;
        }

        SourceLanguage language;
        try {
            language = lang != null ? SourceLanguage.parse(lang) : SourceLanguage.fromFileName(file);
        } catch (IllegalArgumentException e) {
            err.println("unsupported language: " + lang);
            return 1;
        }
        if (language == null) {
            err.println("cannot infer language of " + file + ", use --lang");
            return 1;
        }

        String source;
        try {
            source = Files.readString(Path.of(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("cannot read " + file + ": " + e.getMessage());
            return 1;
        }

        try {
            BuildOptions options = BuildOptions.fromEnvironment();
            ControlFlowGraph graph = CfgDriver.analyze(source, language, function, container, options);
            out.println(json ? GraphJson.toJson(graph) : GraphSerializer.serialize(graph));
            return 0;
        } catch (CfgException e) {
            LOG.error("failed to build control flow graph of {}", file, e);
            err.println(e.getMessage());
            return 1;
        } catch (IllegalArgumentException e) {
            // 环境变量中的配置无效
            err.println("invalid configuration: " + e.getMessage());
            return 1;
        }
    }
}
