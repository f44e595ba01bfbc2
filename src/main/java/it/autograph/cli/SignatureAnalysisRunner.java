package it.autograph.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.ByteBuffer;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import it.autograph.config.AutographProperties;
import it.autograph.io.FileTooSmallException;
import it.autograph.io.SignatureFileLoader;
import it.autograph.io.SignatureFileWriter;
import it.autograph.service.SignatureAnalysisService;
import it.autograph.service.SignatureAnalysisService.AnalysisReport;
import it.autograph.service.SignatureNotFoundException;

@Component
public class SignatureAnalysisRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private static final Logger logger = LoggerFactory.getLogger(SignatureAnalysisRunner.class);

    private final SignatureAnalysisService analysisService;
    private final SignatureFileLoader fileLoader;
    private final SignatureFileWriter fileWriter;
    private final AutographProperties properties;
    private final PrintStream out;
    private int exitCode = EXIT_OK;

    @Autowired
    public SignatureAnalysisRunner(
        SignatureAnalysisService analysisService,
        SignatureFileLoader fileLoader,
        SignatureFileWriter fileWriter,
        AutographProperties properties
    ) {
        this(analysisService, fileLoader, fileWriter, properties, System.out);
    }

    SignatureAnalysisRunner(
        SignatureAnalysisService analysisService,
        SignatureFileLoader fileLoader,
        SignatureFileWriter fileWriter,
        AutographProperties properties,
        PrintStream out
    ) {
        this.analysisService = analysisService;
        this.fileLoader = fileLoader;
        this.fileWriter = fileWriter;
        this.properties = properties;
        this.out = out;
    }

    @Override
    public void run(String... args) {
        exitCode = execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(String[] args) {
        String defaultFile = properties.getOutput().getDefaultFile();
        AnalyzerOptions options;
        try {
            options = AnalyzerOptions.fromArgs(args);
        } catch (IllegalArgumentException ex) {
            out.println("Error: " + ex.getMessage());
            AnalyzerOptions.printUsage(out, defaultFile);
            return EXIT_FAILURE;
        }

        AnalysisReportPrinter printer = new AnalysisReportPrinter(out);
        if (options.help()) {
            AnalyzerOptions.printUsage(out, defaultFile);
            return EXIT_OK;
        }
        if (options.list()) {
            printer.printOidTable();
            return EXIT_OK;
        }

        ByteBuffer data;
        try {
            data = fileLoader.load(Path.of(options.filePath()));
        } catch (FileTooSmallException ex) {
            out.println("Error: " + ex.getMessage());
            return EXIT_FAILURE;
        } catch (IOException ex) {
            logger.warn("Cannot read {}", options.filePath(), ex);
            out.println("Error: error opening file: " + ex.getMessage());
            return EXIT_FAILURE;
        }

        printer.printHeader(options.filePath());
        AnalysisReport report;
        try {
            report = analysisService.analyze(data);
        } catch (SignatureNotFoundException ex) {
            out.println("Error: " + ex.getMessage());
            return EXIT_FAILURE;
        }
        printer.print(report);

        if (options.shouldSave()) {
            Path target = Path.of(options.targetFile(defaultFile));
            try {
                fileWriter.write(report.match().fullBytes(), target);
            } catch (IOException ex) {
                logger.error("Failed to save signature to {}", target, ex);
                out.println("Error saving to file: " + ex.getMessage());
                return EXIT_FAILURE;
            }
            out.println("ASN.1 structure saved to: " + target);
        }
        return EXIT_OK;
    }
}
