package typesafeschwalbe.patcan.types;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import typesafeschwalbe.patcan.compiler.Source;
import typesafeschwalbe.patcan.compiler.Symbol;

// An opaque type definition such as 'Id n := [Id U64 n]'. The declared
// type variables and lambda set variables are universally quantified and
// must be instantiated anew at every use site.
public record OpaqueDef(
    Symbol symbol,
    Source region,
    List<TypeParameter> typeParameters,
    List<LambdaSet> lambdaSetVariables,
    DataType actualType
) {

    public static record TypeParameter(String name, Variable variable) {}

    public static record TypeArgument(String name, DataType type) {}

    public static record Freshened(
        List<TypeArgument> typeArguments,
        List<LambdaSet> lambdaSetVariables,
        DataType specializedDefType
    ) {}

    public OpaqueDef {
        typeParameters = List.copyOf(typeParameters);
        lambdaSetVariables = List.copyOf(lambdaSetVariables);
        for(LambdaSet lambdaSet: lambdaSetVariables) {
            if(lambdaSet.type().type != DataType.Type.VARIABLE) {
                throw new IllegalArgumentException(
                    "Lambda set variables of an opaque must be variables!"
                );
            }
        }
    }

    public Freshened freshen(VarStore varStore) {
        Map<Variable, DataType> substitutions = new HashMap<>();
        List<TypeArgument> typeArguments = new ArrayList<>();
        for(TypeParameter parameter: this.typeParameters) {
            DataType fresh = DataType.variable(varStore.fresh());
            substitutions.put(parameter.variable(), fresh);
            typeArguments.add(new TypeArgument(parameter.name(), fresh));
        }
        List<LambdaSet> lambdaSets = new ArrayList<>();
        for(LambdaSet lambdaSet: this.lambdaSetVariables) {
            DataType.Var declared = lambdaSet.type().getValue();
            DataType fresh = DataType.variable(varStore.fresh());
            substitutions.put(declared.variable(), fresh);
            lambdaSets.add(new LambdaSet(fresh));
        }
        return new Freshened(
            typeArguments, lambdaSets,
            this.actualType.substitute(substitutions)
        );
    }

}
