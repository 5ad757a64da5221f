package typesafeschwalbe.patcan.compiler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.logging.Logger;

import typesafeschwalbe.patcan.can.AbilitiesStore;
import typesafeschwalbe.patcan.can.Env;
import typesafeschwalbe.patcan.can.Pattern;
import typesafeschwalbe.patcan.can.PatternCanonicalizer;
import typesafeschwalbe.patcan.can.PatternSymbols;
import typesafeschwalbe.patcan.can.Problem;
import typesafeschwalbe.patcan.can.Scope;
import typesafeschwalbe.patcan.frontend.AbilityParser;
import typesafeschwalbe.patcan.frontend.AstPattern;
import typesafeschwalbe.patcan.frontend.Lexer;
import typesafeschwalbe.patcan.frontend.PatternParser;
import typesafeschwalbe.patcan.frontend.PatternType;
import typesafeschwalbe.patcan.types.VarStore;

public class Compiler {

    private static final Logger LOGGER = Logger.getLogger(
        Compiler.class.getName()
    );

    public static final String FILE_EXTENSION = ".pat";
    public static final String ABILITY_FILE_EXTENSION = ".abilities";

    public static record Output(
        List<Pattern> patterns,
        List<PatternSymbols.Binding> bindings,
        List<Problem> problems,
        Interns interns,
        int variableCount
    ) {
        public List<Error> problemErrors() {
            return this.problems.stream().map(Problem::toError).toList();
        }
    }

    // Ability files are declared into the scope before any pattern is
    // canonicalized, so definition headers can specialize their members.
    public static Result<Output> canonicalize(
        Map<String, String> files, PatternType patternType, Namespace home
    ) {
        List<AstPattern> parsed = new ArrayList<>();
        List<AbilityParser.Declaration> declarations = new ArrayList<>();
        for(String fileName: new TreeSet<>(files.keySet())) {
            String fileContent = files.get(fileName);
            Lexer fileLexer = new Lexer(fileName, fileContent);
            if(fileName.endsWith(ABILITY_FILE_EXTENSION)) {
                try {
                    declarations.addAll(
                        new AbilityParser(fileLexer).parseDeclarations()
                    );
                } catch(ErrorException e) {
                    LOGGER.warning(
                        "unable to parse '" + fileName + "': " + e.getMessage()
                    );
                    return Result.ofError(e.error);
                }
                continue;
            }
            if(!fileName.endsWith(FILE_EXTENSION)) {
                return Result.ofError(new Error(
                    "Unsupported file extension for file '" + fileName + "'"
                ));
            }
            List<AstPattern> filePatterns;
            try {
                PatternParser fileParser = new PatternParser(fileLexer);
                filePatterns = fileParser.parsePatterns();
            } catch(ErrorException e) {
                LOGGER.warning(
                    "unable to parse '" + fileName + "': " + e.getMessage()
                );
                return Result.ofError(e.error);
            }
            LOGGER.fine(
                "parsed " + filePatterns.size() + " pattern(s) from '"
                    + fileName + "'"
            );
            parsed.addAll(filePatterns);
        }
        Env env = new Env(home);
        VarStore varStore = new VarStore();
        Scope scope = new Scope(env);
        AbilitiesStore abilities = new AbilitiesStore();
        List<Error> declarationErrors = Compiler.declareAbilities(
            declarations, env, scope, abilities
        );
        if(!declarationErrors.isEmpty()) {
            return Result.ofError(declarationErrors);
        }
        PatternCanonicalizer canonicalizer = new PatternCanonicalizer(
            env, varStore, scope
        );
        List<Pattern> patterns = new ArrayList<>();
        for(AstPattern pattern: parsed) {
            PatternCanonicalizer.Canonicalized canonicalized;
            switch(patternType) {
                case TOP_LEVEL_DEF:
                case DEF_EXPR:
                    canonicalized = canonicalizer.canonicalizeDefHeaderPattern(
                        abilities, patternType, pattern, pattern.source
                    );
                    break;
                case FUNCTION_ARG:
                case WHEN_BRANCH:
                    canonicalized = canonicalizer.canonicalizePattern(
                        patternType, pattern, pattern.source
                    );
                    break;
                default:
                    throw new RuntimeException("unhandled pattern type!");
            }
            patterns.add(canonicalized.pattern());
        }
        LOGGER.fine(
            "canonicalized " + patterns.size() + " pattern(s) with "
                + env.problems().size() + " problem(s)"
        );
        return Result.ofValue(new Output(
            List.copyOf(patterns),
            PatternSymbols.bindingsFromPatterns(patterns),
            List.copyOf(env.problems()),
            env.interns,
            varStore.count()
        ));
    }

    private static List<Error> declareAbilities(
        List<AbilityParser.Declaration> declarations, Env env, Scope scope,
        AbilitiesStore abilities
    ) {
        List<Error> errors = new ArrayList<>();
        Map<String, Source> declared = new HashMap<>();
        for(AbilityParser.Declaration declaration: declarations) {
            Source previous = declared.putIfAbsent(
                declaration.name(), declaration.source()
            );
            if(previous != null) {
                errors.add(Compiler.duplicate(
                    "ability", declaration.name(), previous,
                    declaration.source()
                ));
                continue;
            }
            Symbol ability = env.intern(declaration.name());
            List<AbilitiesStore.Member> members = new ArrayList<>();
            for(AbilityParser.Member member: declaration.members()) {
                Scope.Introduction introduction = scope.introduce(
                    member.name(), member.source()
                );
                if(introduction.isShadowing()) {
                    errors.add(Compiler.duplicate(
                        "ability member", member.name(),
                        introduction.originalRegion().get(), member.source()
                    ));
                    continue;
                }
                members.add(new AbilitiesStore.Member(
                    ability, introduction.symbol(), member.source()
                ));
            }
            abilities.registerAbility(ability, members);
            LOGGER.fine(
                "declared ability '" + declaration.name() + "' with "
                    + members.size() + " member(s)"
            );
        }
        return errors;
    }

    private static Error duplicate(
        String kind, String name, Source original, Source duplicate
    ) {
        return new Error(
            "Duplicate " + kind,
            Error.Marking.info(original, "'" + name + "' is first declared here"),
            Error.Marking.error(duplicate, "and declared again here")
        );
    }

}
