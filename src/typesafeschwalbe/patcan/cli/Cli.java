package typesafeschwalbe.patcan.cli;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import typesafeschwalbe.patcan.compiler.Error;
import typesafeschwalbe.patcan.compiler.Namespace;
import typesafeschwalbe.patcan.compiler.Result;
import typesafeschwalbe.patcan.frontend.Lexer;
import typesafeschwalbe.patcan.frontend.PatternType;

public class Cli {

    enum Option {
        PATTERN_TYPE(
            'p', "pattern-type", "specifies where the patterns are written",
            "toplevel | def | arg | when"
        ),
        MODULE(
            'm', "module",
            "specifies the module the patterns belong to (default 'Main')",
            "module path"
        ),
        NO_COLOR('c', "nocolor", "disables colored output", null),
        HELP('h', "help", "displays a list of all available arguments", null);

        final char shortName;
        final String longName;
        final String description;
        final String valueDescription;

        private Option(
            char shortName, String longName, String description,
            String valueDescription
        ) {
            this.shortName = shortName;
            this.longName = longName;
            this.description = description;
            this.valueDescription = valueDescription;
        }

        boolean hasValue() {
            return this.valueDescription != null;
        }

        static Optional<Option> find(String arg) {
            for(Option option: Option.values()) {
                if(arg.equals("--" + option.longName)
                    || arg.equals("-" + option.shortName)) {
                    return Optional.of(option);
                }
            }
            return Optional.empty();
        }
    }

    public static final String DEFAULT_MODULE = "Main";

    public static record Options(
        boolean helpRequested,
        PatternType patternType,
        Namespace module,
        boolean colored,
        List<String> files
    ) {
        static Options help() {
            return new Options(
                true, PatternType.WHEN_BRANCH, Namespace.parse(DEFAULT_MODULE),
                false, List.of()
            );
        }
    }

    static Optional<PatternType> parsePatternType(String raw) {
        switch(raw) {
            case "toplevel": return Optional.of(PatternType.TOP_LEVEL_DEF);
            case "def": return Optional.of(PatternType.DEF_EXPR);
            case "arg": return Optional.of(PatternType.FUNCTION_ARG);
            case "when": return Optional.of(PatternType.WHEN_BRANCH);
            default: return Optional.empty();
        }
    }

    static boolean isValidModule(String raw) {
        for(String segment: raw.split("::", -1)) {
            if(segment.isEmpty()) { return false; }
            for(int charIdx = 0; charIdx < segment.length(); charIdx += 1) {
                if(!Lexer.isAlphanumeral(segment.charAt(charIdx))) {
                    return false;
                }
            }
        }
        return true;
    }

    private static String describe(Option option) {
        return "'--" + option.longName + "' / '-" + option.shortName + "'";
    }

    // Every problem with the arguments is reported at once. Asking for help
    // stops all further checks.
    public static Result<Options> parse(String[] args, boolean colorSupported) {
        Map<Option, String> values = new EnumMap<>(Option.class);
        List<String> files = new ArrayList<>();
        List<Error> errors = new ArrayList<>();
        for(int argIdx = 0; argIdx < args.length; argIdx += 1) {
            String arg = args[argIdx];
            if(!arg.startsWith("-")) {
                files.add(arg);
                continue;
            }
            Optional<Option> option = Option.find(arg);
            if(option.isEmpty()) {
                errors.add(new Error("'" + arg + "' is not a valid argument"));
                continue;
            }
            if(option.get() == Option.HELP) {
                return Result.ofValue(Options.help());
            }
            String value = "";
            if(option.get().hasValue()) {
                if(argIdx + 1 >= args.length || args[argIdx + 1].startsWith("-")) {
                    errors.add(new Error(
                        "'" + arg + "' does not have a value specified"
                    ));
                    continue;
                }
                argIdx += 1;
                value = args[argIdx];
            }
            if(values.put(option.get(), value) != null) {
                errors.add(new Error(
                    "The argument (" + Cli.describe(option.get())
                        + ") was given more than once"
                ));
            }
        }
        Optional<PatternType> patternType = Optional.empty();
        if(!values.containsKey(Option.PATTERN_TYPE)) {
            errors.add(new Error(
                "The argument (" + Cli.describe(Option.PATTERN_TYPE)
                    + ") is required but missing",
                "use '--help' to see all arguments"
            ));
        } else {
            String rawType = values.get(Option.PATTERN_TYPE);
            patternType = Cli.parsePatternType(rawType);
            if(patternType.isEmpty()) {
                errors.add(new Error(
                    "'" + rawType + "' is not a valid pattern type",
                    "use one of " + Option.PATTERN_TYPE.valueDescription
                ));
            }
        }
        String module = values.getOrDefault(Option.MODULE, DEFAULT_MODULE);
        if(!Cli.isValidModule(module)) {
            errors.add(new Error(
                "'" + module + "' is not a valid module path",
                "separate the module names with '::'"
            ));
        }
        if(files.isEmpty()) {
            errors.add(new Error(
                "No pattern files were given",
                "list the files after the arguments"
            ));
        }
        if(!errors.isEmpty()) {
            return Result.ofError(errors);
        }
        return Result.ofValue(new Options(
            false,
            patternType.get(),
            Namespace.parse(module),
            colorSupported && !values.containsKey(Option.NO_COLOR),
            List.copyOf(files)
        ));
    }

    public static void printHelp(PrintStream out) {
        out.println("Usage: patcan [arguments] <files...>");
        out.println("Pattern files end in '.pat', ability files in '.abilities'.");
        out.println("List of available arguments:");
        for(Option option: Option.values()) {
            String value = option.hasValue()
                ? " <" + option.valueDescription + ">"
                : "";
            out.println("    -" + option.shortName + value);
            out.println("    --" + option.longName + value);
            out.println("                " + option.description);
        }
    }

}
