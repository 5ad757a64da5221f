package typesafeschwalbe.patcan.can;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import typesafeschwalbe.patcan.compiler.IdentIds;
import typesafeschwalbe.patcan.compiler.Namespace;
import typesafeschwalbe.patcan.compiler.Symbol;
import typesafeschwalbe.patcan.compiler.Source;
import typesafeschwalbe.patcan.types.OpaqueDef;

public class Scope {

    private static record Binding(Symbol symbol, Source region) {}

    private static record AliasEntry(
        Symbol symbol, Source region, Optional<OpaqueDef> opaque
    ) {}

    // The outcome of binding a name. 'originalRegion' is present when
    // the name was already bound, 'specializes' when the new binding
    // specializes an ability member instead of shadowing it.
    public static record Introduction(
        Symbol symbol,
        Optional<Source> originalRegion,
        Optional<Symbol> specializes
    ) {
        public boolean isShadowing() {
            return this.originalRegion.isPresent();
        }
    }

    public static class OpaqueLookup {

        private final Symbol symbol;
        private final OpaqueDef opaqueDef;
        private final Problem problem;

        private OpaqueLookup(Symbol symbol, OpaqueDef opaqueDef, Problem problem) {
            this.symbol = symbol;
            this.opaqueDef = opaqueDef;
            this.problem = problem;
        }

        public boolean isFound() {
            return this.opaqueDef != null;
        }

        public Symbol getSymbol() {
            if(this.symbol == null) {
                throw new IllegalStateException(
                    "Attempted to get the symbol of a failed opaque lookup!"
                );
            }
            return this.symbol;
        }

        public OpaqueDef getOpaqueDef() {
            if(this.opaqueDef == null) {
                throw new IllegalStateException(
                    "Attempted to get the definition of a failed opaque lookup!"
                );
            }
            return this.opaqueDef;
        }

        public Problem getProblem() {
            if(this.problem == null) {
                throw new IllegalStateException(
                    "Attempted to get the problem of a successful opaque lookup!"
                );
            }
            return this.problem;
        }

    }

    public final Namespace home;
    private final IdentIds identIds;
    private final Optional<Scope> parent;
    private final Map<String, Binding> idents;
    private final Map<String, AliasEntry> aliases;

    private Scope(Namespace home, IdentIds identIds, Optional<Scope> parent) {
        this.home = home;
        this.identIds = identIds;
        this.parent = parent;
        this.idents = new LinkedHashMap<>();
        this.aliases = new LinkedHashMap<>();
    }

    public Scope(Env env) {
        this(env.home, env.identIds(), Optional.empty());
    }

    public Scope child() {
        return new Scope(this.home, this.identIds, Optional.of(this));
    }

    private Optional<Binding> findBinding(String name) {
        Binding binding = this.idents.get(name);
        if(binding != null) {
            return Optional.of(binding);
        }
        if(this.parent.isPresent()) {
            return this.parent.get().findBinding(name);
        }
        return Optional.empty();
    }

    private Optional<AliasEntry> findAlias(String name) {
        AliasEntry alias = this.aliases.get(name);
        if(alias != null) {
            return Optional.of(alias);
        }
        if(this.parent.isPresent()) {
            return this.parent.get().findAlias(name);
        }
        return Optional.empty();
    }

    private Symbol bind(String name, Source region) {
        Symbol symbol = new Symbol(this.home, this.identIds.add(name));
        this.idents.put(name, new Binding(symbol, region));
        return symbol;
    }

    // Binds 'name' to a new symbol. A name that is already bound is
    // still rebound to the new symbol, and the region of the previous
    // binding is reported.
    public Introduction introduce(String name, Source region) {
        Optional<Binding> original = this.findBinding(name);
        Symbol symbol = this.bind(name, region);
        return new Introduction(
            symbol, original.map(Binding::region), Optional.empty()
        );
    }

    // Like 'introduce', except that the name of an ability member is
    // specialized instead of shadowed and stays bound to the member.
    public Introduction introduceOrShadowAbilityMember(
        String name, Source region, AbilitiesStore abilities
    ) {
        Optional<Binding> original = this.findBinding(name);
        if(original.isEmpty()) {
            Symbol symbol = this.bind(name, region);
            return new Introduction(symbol, Optional.empty(), Optional.empty());
        }
        Symbol originalSymbol = original.get().symbol();
        if(abilities.isAbilityMember(originalSymbol)) {
            // the name keeps pointing at the member
            Symbol symbol = this.ignore(name);
            return new Introduction(
                symbol, Optional.empty(), Optional.of(originalSymbol)
            );
        }
        Symbol symbol = this.bind(name, region);
        return new Introduction(
            symbol, Optional.of(original.get().region()), Optional.empty()
        );
    }

    public Symbol ignore(String name) {
        return new Symbol(this.home, this.identIds.add(name));
    }

    public Optional<Symbol> lookup(String name) {
        return this.findBinding(name).map(Binding::symbol);
    }

    public void importSymbol(String name, Symbol symbol, Source region) {
        this.idents.put(name, new Binding(symbol, region));
    }

    public Symbol addAlias(String name, Source region) {
        Symbol symbol = new Symbol(this.home, this.identIds.add(name));
        this.aliases.put(
            name, new AliasEntry(symbol, region, Optional.empty())
        );
        return symbol;
    }

    public void addOpaque(String name, OpaqueDef opaqueDef) {
        this.aliases.put(
            name,
            new AliasEntry(
                opaqueDef.symbol(), opaqueDef.region(), Optional.of(opaqueDef)
            )
        );
    }

    public OpaqueLookup lookupOpaqueRef(String name, Source region) {
        Optional<AliasEntry> alias = this.findAlias(name);
        if(alias.isPresent() && alias.get().opaque().isPresent()) {
            return new OpaqueLookup(
                alias.get().symbol(), alias.get().opaque().get(), null
            );
        }
        return new OpaqueLookup(null, null, Problem.opaqueNotDefined(
            Loc.at(region, name),
            this.opaquesInScope(),
            alias.map(AliasEntry::region)
        ));
    }

    public Set<String> namesInScope() {
        Set<String> names = new HashSet<>(this.idents.keySet());
        if(this.parent.isPresent()) {
            names.addAll(this.parent.get().namesInScope());
        }
        return names;
    }

    public Set<String> opaquesInScope() {
        Set<String> names = new HashSet<>();
        for(Map.Entry<String, AliasEntry> alias: this.aliases.entrySet()) {
            if(alias.getValue().opaque().isPresent()) {
                names.add(alias.getKey());
            }
        }
        if(this.parent.isPresent()) {
            names.addAll(this.parent.get().opaquesInScope());
        }
        return names;
    }

}
