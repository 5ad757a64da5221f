package typesafeschwalbe.patcan.types;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;

import typesafeschwalbe.patcan.compiler.Symbol;

public class DataType {

    public interface DataTypeValue {}

    public static record Apply(
        Symbol symbol, List<DataType> arguments
    ) implements DataTypeValue {}

    public static record TagUnion(
        Map<String, List<DataType>> tags, DataType extension
    ) implements DataTypeValue {}

    public static record RecordType(
        Map<String, DataType> fields, DataType extension
    ) implements DataTypeValue {}

    public static record Closure(
        List<DataType> argumentTypes, LambdaSet lambdaSet, DataType returnType
    ) implements DataTypeValue {}

    public static record Var(Variable variable) implements DataTypeValue {}

    public enum Type {
        VARIABLE,        // Var
        APPLY,           // Apply
        TAG_UNION,       // TagUnion
        RECORD,          // RecordType
        CLOSURE,         // Closure
        EMPTY_TAG_UNION, // = null
        EMPTY_RECORD     // = null
    }

    public final Type type;
    private final DataTypeValue value;

    private DataType(Type type, DataTypeValue value) {
        this.type = type;
        this.value = value;
    }

    public static DataType variable(Variable variable) {
        return new DataType(Type.VARIABLE, new Var(variable));
    }

    public static DataType apply(Symbol symbol, List<DataType> arguments) {
        return new DataType(
            Type.APPLY, new Apply(symbol, List.copyOf(arguments))
        );
    }

    public static DataType tagUnion(
        Map<String, List<DataType>> tags, DataType extension
    ) {
        return new DataType(
            Type.TAG_UNION, new TagUnion(new TreeMap<>(tags), extension)
        );
    }

    public static DataType record(
        Map<String, DataType> fields, DataType extension
    ) {
        return new DataType(
            Type.RECORD, new RecordType(new TreeMap<>(fields), extension)
        );
    }

    public static DataType closure(
        List<DataType> argumentTypes, LambdaSet lambdaSet, DataType returnType
    ) {
        return new DataType(
            Type.CLOSURE,
            new Closure(List.copyOf(argumentTypes), lambdaSet, returnType)
        );
    }

    public static DataType emptyTagUnion() {
        return new DataType(Type.EMPTY_TAG_UNION, null);
    }

    public static DataType emptyRecord() {
        return new DataType(Type.EMPTY_RECORD, null);
    }

    @SuppressWarnings("unchecked")
    public <V extends DataTypeValue> V getValue() {
        return (V) this.value;
    }

    public DataType map(Function<Variable, DataType> f) {
        switch(this.type) {
            case VARIABLE: {
                Var data = this.getValue();
                return f.apply(data.variable());
            }
            case APPLY: {
                Apply data = this.getValue();
                return DataType.apply(
                    data.symbol(),
                    data.arguments().stream().map(a -> a.map(f)).toList()
                );
            }
            case TAG_UNION: {
                TagUnion data = this.getValue();
                Map<String, List<DataType>> tags = new TreeMap<>();
                for(String tag: data.tags().keySet()) {
                    tags.put(
                        tag,
                        data.tags().get(tag).stream()
                            .map(t -> t.map(f)).toList()
                    );
                }
                return DataType.tagUnion(tags, data.extension().map(f));
            }
            case RECORD: {
                RecordType data = this.getValue();
                Map<String, DataType> fields = new TreeMap<>();
                for(String field: data.fields().keySet()) {
                    fields.put(field, data.fields().get(field).map(f));
                }
                return DataType.record(fields, data.extension().map(f));
            }
            case CLOSURE: {
                Closure data = this.getValue();
                return DataType.closure(
                    data.argumentTypes().stream().map(a -> a.map(f)).toList(),
                    new LambdaSet(data.lambdaSet().type().map(f)),
                    data.returnType().map(f)
                );
            }
            case EMPTY_TAG_UNION:
            case EMPTY_RECORD: {
                return this;
            }
            default: {
                throw new RuntimeException("unhandled type!");
            }
        }
    }

    public DataType substitute(Map<Variable, DataType> substitutions) {
        return this.map(v -> {
            DataType replacement = substitutions.get(v);
            return replacement == null? DataType.variable(v) : replacement;
        });
    }

    public void collectVariables(Set<Variable> into) {
        this.map(v -> {
            into.add(v);
            return DataType.variable(v);
        });
    }

    @Override
    public boolean equals(Object otherRaw) {
        if(!(otherRaw instanceof DataType)) { return false; }
        DataType other = (DataType) otherRaw;
        return this.type == other.type
            && Objects.equals(this.value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.type, this.value);
    }

    @Override
    public String toString() {
        switch(this.type) {
            case VARIABLE: {
                Var data = this.getValue();
                return data.variable().toString();
            }
            case APPLY: {
                Apply data = this.getValue();
                StringBuilder output = new StringBuilder();
                output.append(data.symbol());
                for(DataType argument: data.arguments()) {
                    output.append(" (");
                    output.append(argument);
                    output.append(")");
                }
                return output.toString();
            }
            case TAG_UNION: {
                TagUnion data = this.getValue();
                StringBuilder output = new StringBuilder("[");
                boolean first = true;
                for(String tag: data.tags().keySet()) {
                    if(!first) { output.append(", "); }
                    first = false;
                    output.append(tag);
                    for(DataType argument: data.tags().get(tag)) {
                        output.append(" ");
                        output.append(argument);
                    }
                }
                output.append("]");
                output.append(data.extension());
                return output.toString();
            }
            case RECORD: {
                RecordType data = this.getValue();
                StringBuilder output = new StringBuilder("{");
                boolean first = true;
                for(String field: data.fields().keySet()) {
                    if(!first) { output.append(", "); }
                    first = false;
                    output.append(field);
                    output.append(" : ");
                    output.append(data.fields().get(field));
                }
                output.append("}");
                output.append(data.extension());
                return output.toString();
            }
            case CLOSURE: {
                Closure data = this.getValue();
                StringBuilder output = new StringBuilder("(");
                for(int argI = 0; argI < data.argumentTypes().size(); argI += 1) {
                    if(argI > 0) { output.append(", "); }
                    output.append(data.argumentTypes().get(argI));
                }
                output.append(" -");
                output.append(data.lambdaSet());
                output.append("-> ");
                output.append(data.returnType());
                output.append(")");
                return output.toString();
            }
            case EMPTY_TAG_UNION: {
                return "[]";
            }
            case EMPTY_RECORD: {
                return "{}";
            }
            default: {
                throw new RuntimeException("unhandled type!");
            }
        }
    }

}
