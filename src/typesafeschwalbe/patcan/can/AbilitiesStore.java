package typesafeschwalbe.patcan.can;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import typesafeschwalbe.patcan.compiler.Source;
import typesafeschwalbe.patcan.compiler.Symbol;

public class AbilitiesStore {

    public static record Member(Symbol ability, Symbol member, Source region) {}

    private final Map<Symbol, Member> members;
    private final Map<Symbol, List<Symbol>> abilities;

    public AbilitiesStore() {
        this.members = new HashMap<>();
        this.abilities = new HashMap<>();
    }

    public void registerAbility(Symbol ability, List<Member> members) {
        if(this.abilities.containsKey(ability)) {
            throw new IllegalArgumentException(
                "The ability " + ability + " was already registered!"
            );
        }
        List<Symbol> memberSymbols = new ArrayList<>();
        for(Member member: members) {
            if(!member.ability().equals(ability)) {
                throw new IllegalArgumentException(
                    "The member " + member.member()
                        + " does not belong to the ability " + ability + "!"
                );
            }
            this.members.put(member.member(), member);
            memberSymbols.add(member.member());
        }
        this.abilities.put(ability, List.copyOf(memberSymbols));
    }

    public boolean isAbilityMember(Symbol symbol) {
        return this.members.containsKey(symbol);
    }

    public Optional<Member> memberInfo(Symbol member) {
        return Optional.ofNullable(this.members.get(member));
    }

    public List<Symbol> membersOf(Symbol ability) {
        return this.abilities.getOrDefault(ability, List.of());
    }

}
