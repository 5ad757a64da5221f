package typesafeschwalbe.patcan.compiler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class IdentIds {

    private final List<String> names;
    private final Map<String, Integer> interned;

    public IdentIds() {
        this.names = new ArrayList<>();
        this.interned = new HashMap<>();
    }

    public int add(String name) {
        int id = this.names.size();
        this.names.add(name);
        this.interned.putIfAbsent(name, id);
        return id;
    }

    public int getOrInsert(String name) {
        Integer existing = this.interned.get(name);
        if(existing != null) {
            return existing;
        }
        return this.add(name);
    }

    public String nameOf(int id) {
        if(id < 0 || id >= this.names.size()) {
            throw new IllegalArgumentException(
                "The identifier id " + id + " was never handed out!"
            );
        }
        return this.names.get(id);
    }

}
