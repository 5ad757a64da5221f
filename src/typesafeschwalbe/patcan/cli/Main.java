package typesafeschwalbe.patcan.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import typesafeschwalbe.patcan.can.Pattern;
import typesafeschwalbe.patcan.can.PatternSymbols;
import typesafeschwalbe.patcan.compiler.Compiler;
import typesafeschwalbe.patcan.compiler.Error;
import typesafeschwalbe.patcan.compiler.Result;

public class Main {

    public static void main(String[] args) {
        // color is always disabled if we think we are on Windows
        boolean onWindows = System.getProperty("os.name")
            .toLowerCase().contains("win");
        Result<Cli.Options> cliParseResult = Cli.parse(args, !onWindows);
        if(cliParseResult.isError()) {
            Main.exitWithErrors(
                cliParseResult.getError(), new HashMap<>(), !onWindows
            );
            return;
        }
        Cli.Options options = cliParseResult.getValue();
        if(options.helpRequested()) {
            Cli.printHelp(System.out);
            System.exit(0);
        }
        // read all files
        Map<String, String> files = new HashMap<>();
        for(String fileName: options.files()) {
            byte[] fileBytes;
            try {
                fileBytes = Files.readAllBytes(Paths.get(fileName));
            } catch(IOException e) {
                Main.exitWithErrors(
                    List.of(new Error(
                        "Unable to read file '" + fileName + "': "
                            + "'" + e.getMessage() + "'"
                    )),
                    files,
                    options.colored()
                );
                return;
            }
            files.put(fileName, new String(fileBytes, StandardCharsets.UTF_8));
        }
        Result<Compiler.Output> result = Compiler.canonicalize(
            files, options.patternType(), options.module()
        );
        if(result.isError()) {
            Main.exitWithErrors(result.getError(), files, options.colored());
            return;
        }
        Compiler.Output output = result.getValue();
        Main.printOutput(output, files, System.out);
        for(Error error: output.problemErrors()) {
            System.err.print(error.render(files, options.colored()));
        }
    }

    static void printOutput(
        Compiler.Output output, Map<String, String> files, PrintStream out
    ) {
        for(Pattern pattern: output.patterns()) {
            out.println(pattern.source.toString(files) + " " + pattern);
        }
        for(PatternSymbols.Binding binding: output.bindings()) {
            out.println(
                "'" + output.interns().nameOf(binding.symbol()) + "' = "
                    + binding.symbol() + " bound at "
                    + binding.region().toString(files)
            );
        }
        out.println(output.variableCount() + " type variable(s)");
    }

    private static void exitWithErrors(
        List<Error> errors, Map<String, String> files, boolean colored
    ) {
        for(Error error: errors) {
            System.err.print(error.render(files, colored));
        }
        System.exit(1);
    }

}
