package it.autograph.cli;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line options. Both the short single-dash spellings and GNU-style long names are accepted; Spring
 * property overrides ({@code --key=value}) are left to Spring.
 */
public record AnalyzerOptions(String filePath, boolean save, String outputFile, boolean list, boolean help) {

    public static AnalyzerOptions fromArgs(String[] args) {
        boolean save = false;
        boolean list = false;
        boolean help = false;
        String outputFile = null;
        List<String> positional = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith("--") && arg.contains("=")) {
                continue;
            }
            switch (arg) {
                case "-s":
                case "--save":
                    save = true;
                    break;
                case "-o":
                case "--output":
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("missing value for argument " + arg);
                    }
                    outputFile = args[++i];
                    break;
                case "-list":
                case "--list":
                    list = true;
                    break;
                case "-h":
                case "-help":
                case "--help":
                    help = true;
                    break;
                default:
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("unknown option " + arg);
                    }
                    positional.add(arg);
            }
        }

        if (help || list) {
            return new AnalyzerOptions(positional.isEmpty() ? null : positional.get(0), save, outputFile, list, help);
        }
        if (positional.size() != 1) {
            throw new IllegalArgumentException("please provide exactly one file path");
        }
        return new AnalyzerOptions(positional.get(0), save, outputFile, false, false);
    }

    public boolean shouldSave() {
        return save || outputFile != null;
    }

    public String targetFile(String defaultFile) {
        return outputFile != null ? outputFile : defaultFile;
    }

    public static void printUsage(PrintStream out, String defaultFile) {
        out.println("Usage: autograph [options] <file_path>\n" +
            "Search for ASN.1 structures (0x30 0x82) from end of file backwards\n" +
            "Options:\n" +
            "  -s, --save             save ASN.1 structure to file (default: " + defaultFile + ")\n" +
            "  -o, --output <file>    output file to save the ASN.1 structure\n" +
            "  -list, --list          list the object identifiers known to the decoder\n" +
            "  -h, -help, --help      show this help");
    }
}
