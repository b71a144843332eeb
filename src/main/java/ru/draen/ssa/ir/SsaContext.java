package ru.draen.ssa.ir;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class SsaContext {
    private final Map<String, Integer> versions = new HashMap<>();
    private final Map<String, String> bindings = new HashMap<>();
    private final List<SsaStmt> statements = new ArrayList<>();

    public String newVersion(String name) {
        int version = versions.merge(name, 1, Integer::sum);
        var ssaName = name + "_" + version;
        bindings.put(name, ssaName);
        return ssaName;
    }

    public String current(String name) {
        return bindings.getOrDefault(name, name);
    }

    public int version(String name) {
        return versions.getOrDefault(name, 0);
    }

    public void emit(SsaStmt stmt) {
        statements.add(stmt);
    }

    public List<SsaStmt> statements() {
        return List.copyOf(statements);
    }
}
