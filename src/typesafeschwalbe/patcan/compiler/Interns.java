package typesafeschwalbe.patcan.compiler;

import java.util.HashMap;
import java.util.Map;

public class Interns {

    private final Map<Namespace, IdentIds> modules;

    public Interns() {
        this.modules = new HashMap<>();
    }

    public IdentIds identIds(Namespace module) {
        return this.modules.computeIfAbsent(module, m -> new IdentIds());
    }

    public Symbol intern(Namespace module, String name) {
        return new Symbol(module, this.identIds(module).getOrInsert(name));
    }

    public String nameOf(Symbol symbol) {
        IdentIds ids = this.modules.get(symbol.module());
        if(ids == null) {
            throw new IllegalArgumentException(
                "The module '" + symbol.module() + "' has no identifiers!"
            );
        }
        return ids.nameOf(symbol.identId());
    }

}
