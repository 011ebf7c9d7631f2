package org.fsmsim.cli;

import org.apache.commons.lang3.StringUtils;
import org.fsmsim.FSMSimulator;
import org.fsmsim.automata.base.State;
import org.fsmsim.automata.models.DFA;
import org.fsmsim.exceptions.FSMException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 命令行入口：读取自动机描述文件，对输入串运行，打印 true/false 或错误信息。
 * <pre>
 * fsmsim [-v] -f &lt;fsm-file&gt; -i &lt;input-string&gt;
 * fsmsim &lt;fsm-file&gt; &lt;input-string&gt;
 * </pre>
 */
public final class FSMCommandLine {

    private static final Logger logger = LoggerFactory.getLogger(FSMCommandLine.class);

    static final String NAME = "fsmsim";
    static final String DEFAULT_VERSION = "1.0.0";

    static final int EXIT_OK = 0;
    static final int EXIT_IO_ERROR = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = "A simple program to emulate finite state machines\n\n"
            + "Usage: " + NAME + " --fsm-file <FSM_FILE> --input-string <INPUT_STRING>\n"
            + "       " + NAME + " <FSM_FILE> <INPUT_STRING>\n\n"
            + "Options:\n"
            + "  -f, --fsm-file <FSM_FILE>\n"
            + "  -i, --input-string <INPUT_STRING>\n"
            + "  -v, --verbose                       Print the visited states to stderr\n"
            + "  -h, --help                          Print help\n"
            + "  -V, --version                       Print version";

    private final PrintStream out;
    private final PrintStream err;

    FSMCommandLine(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int code = new FSMCommandLine(System.out, System.err).execute(args);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /**
     * @return 进程退出码。
     */
    int execute(String[] args) {
        String fsmFile = null;
        String inputString = null;
        boolean verbose = false;
        List<String> positional = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-h", "--help" -> {
                    out.println(USAGE);
                    return EXIT_OK;
                }
                case "-V", "--version" -> {
                    out.println(NAME + " " + version());
                    return EXIT_OK;
                }
                case "-v", "--verbose" -> verbose = true;
                case "-f", "--fsm-file", "-i", "--input-string" -> {
                    if (i + 1 >= args.length) {
                        return usageError("a value is required for '" + arg + "'");
                    }
                    String value = args[++i];
                    if (arg.equals("-f") || arg.equals("--fsm-file")) {
                        fsmFile = value;
                    } else {
                        inputString = value;
                    }
                }
                default -> {
                    if (arg.startsWith("--fsm-file=")) {
                        fsmFile = StringUtils.substringAfter(arg, "=");
                    } else if (arg.startsWith("--input-string=")) {
                        inputString = StringUtils.substringAfter(arg, "=");
                    } else if (arg.startsWith("-") && arg.length() > 1) {
                        return usageError("unexpected argument '" + arg + "'");
                    } else {
                        positional.add(arg);
                    }
                }
            }
        }

        if (fsmFile == null && !positional.isEmpty()) {
            fsmFile = positional.remove(0);
        }
        if (inputString == null && !positional.isEmpty()) {
            inputString = positional.remove(0);
        }
        if (!positional.isEmpty()) {
            return usageError("unexpected argument '" + positional.get(0) + "'");
        }
        if (fsmFile == null || inputString == null) {
            String missing = (fsmFile == null ? "--fsm-file <FSM_FILE> " : "")
                    + (inputString == null ? "--input-string <INPUT_STRING>" : "");
            return usageError("the following required arguments were not provided: " + missing.trim());
        }

        String source;
        try {
            source = Files.readString(Path.of(fsmFile), StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.error("读取文件 {} 失败", fsmFile, e);
            err.println("error: cannot read '" + fsmFile + "': " + e.getMessage());
            return EXIT_IO_ERROR;
        }

        try {
            String input = StringUtils.stripEnd(inputString, null);
            if (verbose) {
                DFA dfa = FSMSimulator.load(source);
                List<State> trace = dfa.trace(input);
                err.println(trace.stream().map(State::toString).collect(Collectors.joining(" -> ")));
                out.println(trace.get(trace.size() - 1).isAccepting());
            } else {
                out.println(FSMSimulator.simulate(source, input));
            }
        } catch (FSMException e) {
            logger.debug("运行失败", e);
            out.println(e.getMessage());
        }
        return EXIT_OK;
    }

    private int usageError(String message) {
        err.println("error: " + message);
        err.println();
        err.println(USAGE);
        return EXIT_USAGE;
    }

    private static String version() {
        String version = FSMCommandLine.class.getPackage().getImplementationVersion();
        return version != null ? version : DEFAULT_VERSION;
    }
}
